/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.sql;

import io.pgspatial.data.geometry.Geometry;
import io.pgspatial.spatial.EwkbWriter;
import io.pgspatial.util.HexConverter;

/**
 * Generates PostGIS constructors from hex encoded Extended Well-Known Binary, which keeps every ordinate
 * bit-exact:
 * <ul>
 *   <li>{@code <schema>.ST_GeomFromEWKB(decode('<hex>', 'hex'))} for geometry columns</li>
 *   <li>{@code <schema>.ST_GeogFromWKB(decode('<hex>', 'hex'))} for geography columns</li>
 * </ul>
 * The SRID is embedded in the EWKB.
 *
 * @author pgspatial Authors
 */
public class EwkbSqlGenerator extends SqlGenerator {

    private final EwkbWriter ewkbWriter = new EwkbWriter();

    @Override
    public String toGeometrySql(Geometry geometry, String schema, int srid) {
        return qualify(schema, "ST_GeomFromEWKB") + "(" + decode(geometry, srid) + ")";
    }

    @Override
    public String toGeographySql(Geometry geometry, String schema, int srid) {
        return qualify(schema, "ST_GeogFromWKB") + "(" + decode(geometry, srid) + ")";
    }

    private String decode(Geometry geometry, int srid) {
        return "decode(" + quote(HexConverter.convertToHexString(ewkbWriter.write(geometry, srid))) + ", 'hex')";
    }
}
