/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.binding;

import java.util.Objects;

import io.pgspatial.config.ColumnType;
import io.pgspatial.config.PostgisConfig;

/**
 * The storage kind and SRID of a spatial column.
 *
 * @param type the storage kind, never {@code null}
 * @param srid the SRID of the column
 * @author pgspatial Authors
 */
public record ColumnDefinition(ColumnType type, int srid) {

    public ColumnDefinition {
        Objects.requireNonNull(type, "type");
    }

    public static ColumnDefinition geometry(int srid) {
        return new ColumnDefinition(ColumnType.GEOMETRY, srid);
    }

    public static ColumnDefinition geography(int srid) {
        return new ColumnDefinition(ColumnType.GEOGRAPHY, srid);
    }

    /**
     * Returns the definition used for columns that are declared without one.
     */
    public static ColumnDefinition defaultsOf(PostgisConfig config) {
        return new ColumnDefinition(config.getDefaultColumnType(), config.getDefaultSrid());
    }
}
