/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.sql;

import java.util.Objects;

import io.pgspatial.data.geometry.Geometry;

/**
 * Generates the SQL expression that constructs a PostGIS {@code geometry} or {@code geography} value from a
 * {@link Geometry}, for example {@code public.ST_GeomFromText('POINT(1 2)', 4326)}.
 * <p>
 * A generator writes whatever SRID it is given. Reconciling the geometry's SRID with the SRID of the target
 * column, and keeping geometry collections away from the geography constructor, is up to the caller.
 * <p>
 * Implementations must provide a public no-arg constructor so they can be selected by configuration, and must
 * be stateless.
 *
 * @author pgspatial Authors
 */
public abstract class SqlGenerator {

    /**
     * Generates a {@code geometry} constructor using the geometry's own SRID, or 0 if it has none.
     *
     * @param geometry the geometry, must not be {@code null}
     * @param schema the schema of the PostGIS functions; {@code null} or blank for unqualified names
     * @return the SQL expression, never {@code null}
     */
    public String toGeometrySql(Geometry geometry, String schema) {
        return toGeometrySql(geometry, schema, sridOf(geometry));
    }

    /**
     * Generates a {@code geometry} constructor with the given SRID.
     *
     * @param geometry the geometry, must not be {@code null}
     * @param schema the schema of the PostGIS functions; {@code null} or blank for unqualified names
     * @param srid the SRID passed to the constructor
     * @return the SQL expression, never {@code null}
     */
    public abstract String toGeometrySql(Geometry geometry, String schema, int srid);

    /**
     * Generates a {@code geography} constructor using the geometry's own SRID, or 0 if it has none.
     */
    public String toGeographySql(Geometry geometry, String schema) {
        return toGeographySql(geometry, schema, sridOf(geometry));
    }

    /**
     * Generates a {@code geography} constructor with the given SRID. Must not be called with a
     * {@link io.pgspatial.data.geometry.GeometryCollection}.
     */
    public abstract String toGeographySql(Geometry geometry, String schema, int srid);

    /**
     * Wraps a geometry expression into a reprojection to the given SRID.
     */
    public String transform(String geometryExpression, String schema, int srid) {
        return qualify(schema, "ST_Transform") + "(" + geometryExpression + ", " + srid + ")";
    }

    /**
     * Wraps a geometry expression into a cast to {@code geography}.
     */
    public String toGeography(String geometryExpression, String schema) {
        return qualify(schema, "geography") + "(" + geometryExpression + ")";
    }

    protected static String qualify(String schema, String function) {
        if (schema == null || schema.isBlank()) {
            return function;
        }
        return schema + "." + function;
    }

    /**
     * Quotes a value as an SQL string literal.
     */
    protected static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static int sridOf(Geometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        return geometry.hasSrid() ? geometry.getSrid() : 0;
    }
}
