/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of points. Also used for the rings of a {@link Polygon}.
 *
 * @author pgspatial Authors
 */
public final class LineString extends Geometry {

    private final List<Point> points;

    public static LineString of(List<Point> points) {
        return of(points, null);
    }

    /**
     * Creates a line string whose dimension is taken from its points.
     *
     * @param points the points, must not be {@code null}
     * @param srid the spatial reference identifier; if {@code null}, the SRID shared by the points is used
     * @return the line string, never {@code null}
     */
    public static LineString of(List<Point> points, Integer srid) {
        return of(GeometryChildren.dimensionOf(points), points, srid);
    }

    public static LineString of(Dimension dimension, List<Point> points, Integer srid) {
        final Integer resolvedSrid = GeometryChildren.resolveSrid(points, srid);
        return new LineString(dimension, GeometryChildren.adopt(LineString.class, dimension, points, resolvedSrid), resolvedSrid);
    }

    public static LineString empty(Integer srid, Dimension dimension) {
        return new LineString(dimension, List.of(), srid);
    }

    private LineString(Dimension dimension, List<Point> points, Integer srid) {
        super(srid, dimension);
        this.points = points;
    }

    /**
     * @return the unmodifiable list of points, never {@code null}
     */
    public List<Point> getPoints() {
        return points;
    }

    public int getNumPoints() {
        return points.size();
    }

    /**
     * Returns whether the line string is non-empty and ends on its starting coordinate, as required for a
     * polygon ring.
     */
    public boolean isClosed() {
        if (points.isEmpty()) {
            return false;
        }
        final Point first = points.get(0);
        final Point last = points.get(points.size() - 1);
        return Double.compare(first.getX(), last.getX()) == 0
                && Double.compare(first.getY(), last.getY()) == 0
                && Objects.equals(first.getZ(), last.getZ());
    }

    @Override
    public boolean isEmpty() {
        return points.isEmpty();
    }

    @Override
    public GeometryType getGeometryType() {
        return GeometryType.LINE_STRING;
    }

    @Override
    public <T> T accept(GeometryVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    LineString withSrid(Integer srid) {
        return new LineString(getDimension(), GeometryChildren.reassign(points, srid), srid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        final LineString that = (LineString) o;
        return points.equals(that.points)
                && Objects.equals(getSrid(), that.getSrid())
                && getDimension() == that.getDimension();
    }

    @Override
    public int hashCode() {
        return Objects.hash(points, getSrid(), getDimension());
    }

    @Override
    public String toString() {
        return "LineString{" +
                "points=" + points +
                ", srid=" + getSrid() +
                ", dimension=" + getDimension() +
                '}';
    }
}
