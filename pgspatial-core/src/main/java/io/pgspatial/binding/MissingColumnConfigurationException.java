/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.binding;

import io.pgspatial.PgSpatialException;

/**
 * Raised when a spatial column is requested that has not been declared.
 *
 * @author pgspatial Authors
 */
public class MissingColumnConfigurationException extends PgSpatialException {

    private static final long serialVersionUID = -5539462917311708032L;

    private final String column;

    public MissingColumnConfigurationException(String owner, String column) {
        super(owner + " has not declared the spatial column '" + column + "'");
        this.column = column;
    }

    /**
     * Raised when an owner has not declared any spatial column at all.
     */
    public MissingColumnConfigurationException(String owner) {
        super(owner + " has not declared any spatial columns");
        this.column = null;
    }

    /**
     * Get the requested column.
     *
     * @return the column key, or {@code null} if no spatial columns are declared at all
     */
    public String getColumn() {
        return column;
    }
}
