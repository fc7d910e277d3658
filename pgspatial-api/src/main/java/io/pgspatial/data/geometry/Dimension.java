/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

/**
 * Classifies the ordinates carried by a coordinate tuple.
 * <p>
 * A dimension is always derived from which optional ordinates are present and is never assigned on
 * its own. A present ordinate holding {@link Double#NaN} still counts as present.
 *
 * @author pgspatial Authors
 */
public enum Dimension {

    /**
     * Planar x/y coordinates.
     */
    DIMENSION_2D("", false, false),

    /**
     * x/y coordinates with an elevation (z) ordinate.
     */
    DIMENSION_Z("Z", true, false),

    /**
     * x/y coordinates with a measure (m) ordinate.
     */
    DIMENSION_M("M", false, true),

    /**
     * x/y coordinates with both elevation and measure ordinates.
     */
    DIMENSION_ZM("ZM", true, true);

    private final String wktSuffix;
    private final boolean hasZ;
    private final boolean hasM;

    Dimension(String wktSuffix, boolean hasZ, boolean hasM) {
        this.wktSuffix = wktSuffix;
        this.hasZ = hasZ;
        this.hasM = hasM;
    }

    /**
     * Determines the dimension of a coordinate. Only the presence of {@code z} and {@code m} matters,
     * their values (including {@code NaN}) do not.
     *
     * @param x the x ordinate
     * @param y the y ordinate
     * @param z the z ordinate, may be {@code null}
     * @param m the measure, may be {@code null}
     * @return the dimension, never {@code null}
     */
    public static Dimension fromCoordinates(double x, double y, Double z, Double m) {
        return fromFlags(z != null, m != null);
    }

    /**
     * Resolves the dimension from the presence flags of the optional ordinates.
     *
     * @param hasZ whether a z ordinate is present
     * @param hasM whether a measure is present
     * @return the dimension, never {@code null}
     */
    public static Dimension fromFlags(boolean hasZ, boolean hasM) {
        if (hasZ && hasM) {
            return DIMENSION_ZM;
        }
        if (hasZ) {
            return DIMENSION_Z;
        }
        return hasM ? DIMENSION_M : DIMENSION_2D;
    }

    public boolean hasZDimension() {
        return hasZ;
    }

    public boolean isMeasured() {
        return hasM;
    }

    /**
     * Returns the OGC dimension qualifier used after the WKT type keyword, for example {@code "ZM"}.
     * Planar geometries have an empty qualifier.
     */
    public String getWktSuffix() {
        return wktSuffix;
    }

    /**
     * Returns the number of ordinates of a single coordinate tuple, between 2 and 4.
     */
    public int getCoordinateCount() {
        return 2 + (hasZ ? 1 : 0) + (hasM ? 1 : 0);
    }
}
