/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial;

/**
 * Base exception raised by the pgspatial geometry model, codecs and SQL generators.
 *
 */
public class PgSpatialException extends RuntimeException {

    private static final long serialVersionUID = 4517036925461582204L;

    public PgSpatialException() {
    }

    public PgSpatialException(String message) {
        super(message);
    }

    public PgSpatialException(Throwable cause) {
        super(cause);
    }

    public PgSpatialException(String message, Throwable cause) {
        super(message, cause);
    }

}
