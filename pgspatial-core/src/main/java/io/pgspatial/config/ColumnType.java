/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.config;

/**
 * The PostGIS storage kinds of a spatial column.
 *
 * @author pgspatial Authors
 */
public enum ColumnType implements EnumeratedValue {

    /**
     * Planar geometry; accepts every shape, including geometry collections.
     */
    GEOMETRY("geometry"),

    /**
     * Geodetic geography on the spheroid; geometry collections are not accepted.
     */
    GEOGRAPHY("geography");

    private final String value;

    ColumnType(String value) {
        this.value = value;
    }

    /**
     * Determine the column type for the given value, ignoring case.
     *
     * @param value the configuration property value; may be {@code null}
     * @return the matching option, or {@code null} if no match is found
     */
    public static ColumnType parse(String value) {
        if (value == null) {
            return null;
        }
        for (ColumnType option : ColumnType.values()) {
            if (option.getValue().equalsIgnoreCase(value.trim())) {
                return option;
            }
        }
        return null;
    }

    @Override
    public String getValue() {
        return value;
    }
}
