/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.binding;

import io.pgspatial.PgSpatialException;
import io.pgspatial.data.geometry.Geometry;

/**
 * Raised when a geometry that PostGIS cannot store as {@code geography}, such as a geometry collection, is
 * written to a geography column.
 *
 * @author pgspatial Authors
 */
public class UnsupportedGeometryForGeographyException extends PgSpatialException {

    private static final long serialVersionUID = 8841287750239216740L;

    public UnsupportedGeometryForGeographyException(Class<? extends Geometry> geometryClass) {
        super(geometryClass.getSimpleName() + " cannot be written as geography, only as geometry");
    }
}
