/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import java.util.Objects;

/**
 * A single coordinate with optional elevation (z) and measure (m) ordinates.
 * <p>
 * An empty point is represented by {@code NaN} for x and y, and for z and m when its dimension declares them.
 * Setting z or m re-derives the {@link Dimension}; setting x or y leaves it untouched.
 * <p>
 * A point that is part of a composite geometry is read-only; its setters throw {@link IllegalStateException}.
 * Use {@link #copy()} to obtain a modifiable point with the same values.
 * <p>
 * Points using WGS 84 (SRID 4326), SRID 0 or no SRID at all can also be read and written through the
 * latitude, longitude and altitude accessors.
 *
 * @author pgspatial Authors
 */
public final class Point extends Geometry {

    public static final int WGS84_SRID = 4326;

    private double x;
    private double y;
    private Double z;
    private Double m;
    private final boolean readOnly;

    /**
     * Creates a planar point without SRID.
     */
    public static Point of(double x, double y) {
        return of(x, y, null, null, null);
    }

    /**
     * Creates a planar point.
     *
     * @param x the x ordinate
     * @param y the y ordinate
     * @param srid the spatial reference identifier, may be {@code null}
     * @return the point, never {@code null}
     */
    public static Point of(double x, double y, Integer srid) {
        return of(x, y, null, null, srid);
    }

    /**
     * Creates a point; its dimension follows from which of {@code z} and {@code m} are given.
     *
     * @param x the x ordinate
     * @param y the y ordinate
     * @param z the elevation, may be {@code null}
     * @param m the measure, may be {@code null}
     * @param srid the spatial reference identifier, may be {@code null}
     * @return the point, never {@code null}
     */
    public static Point of(double x, double y, Double z, Double m, Integer srid) {
        return new Point(Dimension.fromCoordinates(x, y, z, m), x, y, z, m, srid, false);
    }

    /**
     * Creates a WGS 84 (SRID 4326) point. The longitude is stored as x and the latitude as y.
     */
    public static Point ofGeodetic(double latitude, double longitude) {
        return ofGeodetic(latitude, longitude, null, null);
    }

    public static Point ofGeodetic(double latitude, double longitude, Double altitude) {
        return ofGeodetic(latitude, longitude, altitude, null);
    }

    public static Point ofGeodetic(double latitude, double longitude, Double altitude, Double m) {
        return of(longitude, latitude, altitude, m, WGS84_SRID);
    }

    /**
     * Creates an empty planar point without SRID.
     */
    public static Point empty() {
        return empty(null, Dimension.DIMENSION_2D);
    }

    /**
     * Creates an empty point. Every ordinate declared by {@code dimension} is {@code NaN}.
     *
     * @param srid the spatial reference identifier, may be {@code null}
     * @param dimension the dimension of the point, must not be {@code null}
     * @return the empty point, never {@code null}
     */
    public static Point empty(Integer srid, Dimension dimension) {
        Objects.requireNonNull(dimension, "dimension");
        final Double z = dimension.hasZDimension() ? Double.NaN : null;
        final Double m = dimension.isMeasured() ? Double.NaN : null;
        return new Point(dimension, Double.NaN, Double.NaN, z, m, srid, false);
    }

    private Point(Dimension dimension, double x, double y, Double z, Double m, Integer srid, boolean readOnly) {
        super(srid, dimension);
        this.x = x;
        this.y = y;
        this.z = z;
        this.m = m;
        this.readOnly = readOnly;
    }

    @Override
    public boolean isEmpty() {
        return Double.isNaN(x) && Double.isNaN(y);
    }

    @Override
    public GeometryType getGeometryType() {
        return GeometryType.POINT;
    }

    @Override
    public <T> T accept(GeometryVisitor<T> visitor) {
        return visitor.visit(this);
    }

    /**
     * Returns a read-only copy; composites only ever hold read-only points.
     */
    @Override
    Point withSrid(Integer srid) {
        return new Point(getDimension(), x, y, z, m, srid, true);
    }

    @Override
    boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Returns a modifiable copy of this point, for example to edit a point taken from a composite.
     */
    public Point copy() {
        return new Point(getDimension(), x, y, z, m, getSrid(), false);
    }

    public double getX() {
        return x;
    }

    public void setX(double x) {
        assertModifiable();
        this.x = x;
    }

    public double getY() {
        return y;
    }

    public void setY(double y) {
        assertModifiable();
        this.y = y;
    }

    /**
     * @return the elevation, or {@code null} if the point has no z ordinate
     */
    public Double getZ() {
        return z;
    }

    public void setZ(Double z) {
        assertModifiable();
        this.z = z;
        updateDimension();
    }

    /**
     * @return the measure, or {@code null} if the point is not measured
     */
    public Double getM() {
        return m;
    }

    public void setM(Double m) {
        assertModifiable();
        this.m = m;
        updateDimension();
    }

    private void assertModifiable() {
        if (readOnly) {
            throw new IllegalStateException("Point " + this + " belongs to a composite geometry and cannot be modified");
        }
    }

    private void updateDimension() {
        setDimension(Dimension.fromCoordinates(x, y, z, m));
    }

    /**
     * Returns the ordinates in WKB order: x, y, then z and m when present.
     */
    public double[] getOrdinates() {
        final double[] ordinates = new double[getDimension().getCoordinateCount()];
        ordinates[0] = x;
        ordinates[1] = y;
        int index = 2;
        if (z != null) {
            ordinates[index++] = z;
        }
        if (m != null) {
            ordinates[index] = m;
        }
        return ordinates;
    }

    // Geodetic accessors, valid for WGS 84 points only

    /**
     * Returns whether the point uses WGS 84. A point with SRID 0 or without SRID is treated as geodetic.
     */
    public boolean isGeodetic() {
        final Integer srid = getSrid();
        return srid == null || srid == WGS84_SRID || srid == 0;
    }

    public double getLatitude() {
        assertGeodetic();
        return y;
    }

    public void setLatitude(double latitude) {
        assertGeodetic();
        setY(latitude);
    }

    public double getLongitude() {
        assertGeodetic();
        return x;
    }

    public void setLongitude(double longitude) {
        assertGeodetic();
        setX(longitude);
    }

    public Double getAltitude() {
        assertGeodetic();
        return z;
    }

    public void setAltitude(Double altitude) {
        assertGeodetic();
        setZ(altitude);
    }

    private void assertGeodetic() {
        if (!isGeodetic()) {
            throw new GeodeticMismatchException(getSrid());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        final Point point = (Point) o;
        return Double.compare(x, point.x) == 0
                && Double.compare(y, point.y) == 0
                && Objects.equals(z, point.z)
                && Objects.equals(m, point.m)
                && Objects.equals(getSrid(), point.getSrid())
                && getDimension() == point.getDimension();
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z, m, getSrid(), getDimension());
    }

    @Override
    public String toString() {
        return "Point{" +
                "x=" + x +
                ", y=" + y +
                (z != null ? ", z=" + z : "") +
                (m != null ? ", m=" + m : "") +
                ", srid=" + getSrid() +
                ", dimension=" + getDimension() +
                '}';
    }
}
