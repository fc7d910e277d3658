/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import java.util.List;
import java.util.Objects;

/**
 * A collection of points. Members may be empty points.
 *
 * @author pgspatial Authors
 */
public final class MultiPoint extends Geometry {

    private final List<Point> points;

    public static MultiPoint of(List<Point> points) {
        return of(points, null);
    }

    public static MultiPoint of(List<Point> points, Integer srid) {
        return of(GeometryChildren.dimensionOf(points), points, srid);
    }

    public static MultiPoint of(Dimension dimension, List<Point> points, Integer srid) {
        final Integer resolvedSrid = GeometryChildren.resolveSrid(points, srid);
        return new MultiPoint(dimension, GeometryChildren.adopt(MultiPoint.class, dimension, points, resolvedSrid), resolvedSrid);
    }

    public static MultiPoint empty(Integer srid, Dimension dimension) {
        return new MultiPoint(dimension, List.of(), srid);
    }

    private MultiPoint(Dimension dimension, List<Point> points, Integer srid) {
        super(srid, dimension);
        this.points = points;
    }

    /**
     * @return the unmodifiable list of members, never {@code null}
     */
    public List<Point> getPoints() {
        return points;
    }

    public int getNumGeometries() {
        return points.size();
    }

    @Override
    public boolean isEmpty() {
        return points.isEmpty();
    }

    @Override
    public GeometryType getGeometryType() {
        return GeometryType.MULTI_POINT;
    }

    @Override
    public <T> T accept(GeometryVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    MultiPoint withSrid(Integer srid) {
        return new MultiPoint(getDimension(), GeometryChildren.reassign(points, srid), srid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        final MultiPoint that = (MultiPoint) o;
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
        return "MultiPoint{" +
                "points=" + points +
                ", srid=" + getSrid() +
                ", dimension=" + getDimension() +
                '}';
    }
}
