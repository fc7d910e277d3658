/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.spatial;

import io.pgspatial.PgSpatialException;

/**
 * Raised when a byte sequence is not a valid (Extended) Well-Known Binary geometry.
 *
 * @author pgspatial Authors
 */
public class MalformedWkbException extends PgSpatialException {

    private static final long serialVersionUID = 2306517763962930551L;

    public MalformedWkbException(String message) {
        super(message);
    }

    public MalformedWkbException(String message, Throwable cause) {
        super(message, cause);
    }
}
