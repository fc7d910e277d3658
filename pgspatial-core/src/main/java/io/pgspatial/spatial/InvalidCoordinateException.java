/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.spatial;

import io.pgspatial.PgSpatialException;

/**
 * Raised when a geometry holds a coordinate that cannot be written as Well-Known Text, such as a
 * {@code NaN} ordinate outside of an empty point.
 *
 * @author pgspatial Authors
 */
public class InvalidCoordinateException extends PgSpatialException {

    private static final long serialVersionUID = -1180347625209718463L;

    public InvalidCoordinateException(String message) {
        super(message);
    }
}
