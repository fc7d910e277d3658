/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import io.pgspatial.PgSpatialException;

/**
 * Raised when a geometry's spatial reference identifier conflicts with the one it is combined with,
 * either a parent geometry or the column it is written to.
 *
 * @author pgspatial Authors
 */
public class SridMismatchException extends PgSpatialException {

    private static final long serialVersionUID = -3160728432166718842L;

    private final int expectedSrid;
    private final int actualSrid;

    public SridMismatchException(int expectedSrid, int actualSrid) {
        this(expectedSrid, actualSrid, "The geometry SRID " + actualSrid + " does not match the expected SRID " + expectedSrid);
    }

    public SridMismatchException(int expectedSrid, int actualSrid, String message) {
        super(message);
        this.expectedSrid = expectedSrid;
        this.actualSrid = actualSrid;
    }

    public int getExpectedSrid() {
        return expectedSrid;
    }

    public int getActualSrid() {
        return actualSrid;
    }
}
