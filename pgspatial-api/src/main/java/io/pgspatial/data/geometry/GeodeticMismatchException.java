/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import io.pgspatial.PgSpatialException;

/**
 * Raised when a latitude, longitude or altitude accessor is used on a {@link Point} whose SRID is not WGS 84.
 *
 * @author pgspatial Authors
 */
public class GeodeticMismatchException extends PgSpatialException {

    private static final long serialVersionUID = 6871734021954477312L;

    private final Integer srid;

    public GeodeticMismatchException(Integer srid) {
        super("Geodetic accessors require a point with SRID " + Point.WGS84_SRID + " or 0, but the point has SRID " + srid);
        this.srid = srid;
    }

    /**
     * Get the SRID of the point the accessor was invoked on.
     */
    public Integer getSrid() {
        return srid;
    }
}
