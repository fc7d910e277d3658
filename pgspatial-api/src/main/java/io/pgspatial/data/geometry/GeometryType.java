/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

/**
 * The OGC simple feature shapes, with their WKT keyword and WKB base type code.
 *
 * @author pgspatial Authors
 */
public enum GeometryType {

    POINT("POINT", 1),
    LINE_STRING("LINESTRING", 2),
    POLYGON("POLYGON", 3),
    MULTI_POINT("MULTIPOINT", 4),
    MULTI_LINE_STRING("MULTILINESTRING", 5),
    MULTI_POLYGON("MULTIPOLYGON", 6),
    GEOMETRY_COLLECTION("GEOMETRYCOLLECTION", 7);

    private final String keyword;
    private final int wkbCode;

    GeometryType(String keyword, int wkbCode) {
        this.keyword = keyword;
        this.wkbCode = wkbCode;
    }

    public String getKeyword() {
        return keyword;
    }

    public int getWkbCode() {
        return wkbCode;
    }

    /**
     * Returns the shape for a WKB base type code.
     *
     * @param wkbCode the base type code, without any extended flags
     * @return the matching shape, or {@code null} if the code is not a known shape
     */
    public static GeometryType fromWkbCode(int wkbCode) {
        for (GeometryType type : values()) {
            if (type.wkbCode == wkbCode) {
                return type;
            }
        }
        return null;
    }
}
