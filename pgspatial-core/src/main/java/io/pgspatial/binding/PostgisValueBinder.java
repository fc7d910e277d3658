/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.binding;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgspatial.config.ColumnType;
import io.pgspatial.config.PostgisConfig;
import io.pgspatial.data.geometry.Geometry;
import io.pgspatial.data.geometry.GeometryCollection;
import io.pgspatial.data.geometry.SridMismatchException;
import io.pgspatial.spatial.EwkbReader;
import io.pgspatial.sql.SqlGenerator;

/**
 * Binds geometries to the spatial columns of an entity.
 * <p>
 * On the write path the geometry's SRID is reconciled with the SRID of the target column: a geometry without
 * SRID takes the column SRID, a geometry with a different SRID is either reprojected by the database through
 * {@code ST_Transform} or rejected, depending on {@link PostgisConfig#TRANSFORM_TO_DATABASE_PROJECTION}.
 * Geometry collections are always written as {@code geometry}, PostGIS has no geography constructor for them.
 * <p>
 * On the read path raw EWKB column values, as bytes or hex text, are decoded into {@link Geometry} trees.
 *
 * @author pgspatial Authors
 */
public class PostgisValueBinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgisValueBinder.class);

    private static final String NULL = "NULL";

    private final PostgisColumns columns;
    private final SqlGenerator generator;
    private final EwkbReader reader;
    private final String schema;
    private final boolean transformToDatabaseProjection;

    public PostgisValueBinder(PostgisConfig config, PostgisColumns columns) {
        this.columns = Objects.requireNonNull(columns, "columns");
        this.generator = config.createSqlGenerator();
        this.reader = config.createEwkbReader();
        this.schema = config.getSchema();
        this.transformToDatabaseProjection = config.isTransformToDatabaseProjection();
    }

    /**
     * Generates the SQL expression writing the geometry into the given column.
     *
     * @param column the column key, must be declared
     * @param geometry the value; {@code null} is written as {@code NULL}
     * @return the SQL expression, never {@code null}
     * @throws MissingColumnConfigurationException if the column has not been declared
     * @throws SridMismatchException if the SRIDs differ and transformation is disabled
     */
    public String toInsertableSql(String column, Geometry geometry) {
        final ColumnDefinition definition = columns.getColumnDefinition(column);
        if (geometry == null) {
            return NULL;
        }
        if (geometry instanceof GeometryCollection || definition.type() == ColumnType.GEOMETRY) {
            return toGeometrySql(geometry, definition.srid());
        }
        return toGeographySql(geometry, definition.srid());
    }

    /**
     * Generates a {@code geometry} expression in the target SRID.
     *
     * @throws SridMismatchException if the geometry has a different SRID and transformation is disabled
     */
    public String toGeometrySql(Geometry geometry, int targetSrid) {
        Objects.requireNonNull(geometry, "geometry");
        if (!geometry.hasSrid() || geometry.getSrid() == targetSrid) {
            return generator.toGeometrySql(geometry, schema, targetSrid);
        }
        return transform(geometry, targetSrid);
    }

    /**
     * Generates a {@code geography} expression in the target SRID.
     *
     * @throws UnsupportedGeometryForGeographyException if the geometry is a collection
     * @throws SridMismatchException if the geometry has a different SRID and transformation is disabled
     */
    public String toGeographySql(Geometry geometry, int targetSrid) {
        Objects.requireNonNull(geometry, "geometry");
        if (geometry instanceof GeometryCollection) {
            throw new UnsupportedGeometryForGeographyException(geometry.getClass());
        }
        if (!geometry.hasSrid() || geometry.getSrid() == targetSrid) {
            return generator.toGeographySql(geometry, schema, targetSrid);
        }
        return generator.toGeography(transform(geometry, targetSrid), schema);
    }

    private String transform(Geometry geometry, int targetSrid) {
        final int srid = geometry.getSrid();
        if (!transformToDatabaseProjection) {
            throw new SridMismatchException(targetSrid, srid, "Geometry has SRID " + srid
                    + " but the column uses SRID " + targetSrid + ", enable '"
                    + PostgisConfig.TRANSFORM_TO_DATABASE_PROJECTION + "' to reproject it");
        }
        LOGGER.debug("Transforming {} from SRID {} to SRID {}", geometry.getGeometryType(), srid, targetSrid);
        return generator.transform(generator.toGeometrySql(geometry, schema, srid), schema, targetSrid);
    }

    /**
     * Converts a raw column value into a geometry.
     *
     * @param value {@code null}, EWKB bytes, hex encoded EWKB or an already decoded geometry
     * @return the geometry, or {@code null} for a {@code null} value
     * @throws IllegalArgumentException if the value has any other type
     * @throws io.pgspatial.spatial.MalformedWkbException if the value is not valid EWKB
     */
    public Geometry fromDatabaseValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Geometry geometry) {
            return geometry;
        }
        if (value instanceof byte[] bytes) {
            return reader.read(bytes);
        }
        if (value instanceof String hex) {
            return reader.read(hex);
        }
        throw new IllegalArgumentException("Unsupported spatial column value of type " + value.getClass().getName());
    }

    /**
     * Returns a copy of the row in which every declared spatial column is decoded. Other columns are copied
     * unchanged.
     */
    public Map<String, Object> decodeColumns(Map<String, Object> row) {
        final Map<String, Object> decoded = new LinkedHashMap<>(row);
        for (String column : columns.getColumnNames()) {
            if (decoded.containsKey(column)) {
                LOGGER.trace("Decoding spatial column '{}' of {}", column, columns.getOwner());
                decoded.put(column, fromDatabaseValue(decoded.get(column)));
            }
        }
        return decoded;
    }

    public PostgisColumns getColumns() {
        return columns;
    }
}
