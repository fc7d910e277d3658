/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.sql;

import io.pgspatial.data.geometry.Geometry;
import io.pgspatial.spatial.WktWriter;

/**
 * Generates PostGIS constructors from Well-Known Text:
 * <ul>
 *   <li>{@code <schema>.ST_GeomFromText('<WKT>', <srid>)} for geometry columns</li>
 *   <li>{@code <schema>.ST_GeogFromText('SRID=<srid>;<WKT>')} for geography columns</li>
 * </ul>
 * The geography constructor only accepts a single argument, so the SRID travels as Extended WKT.
 *
 * @author pgspatial Authors
 */
public class WktSqlGenerator extends SqlGenerator {

    private final WktWriter wktWriter = new WktWriter();

    @Override
    public String toGeometrySql(Geometry geometry, String schema, int srid) {
        return qualify(schema, "ST_GeomFromText") + "(" + quote(wktWriter.write(geometry)) + ", " + srid + ")";
    }

    @Override
    public String toGeographySql(Geometry geometry, String schema, int srid) {
        return qualify(schema, "ST_GeogFromText") + "(" + quote(wktWriter.writeExtended(geometry, srid)) + ")";
    }
}
