/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import java.util.List;
import java.util.Objects;

/**
 * A collection of polygons.
 *
 * @author pgspatial Authors
 */
public final class MultiPolygon extends Geometry {

    private final List<Polygon> polygons;

    public static MultiPolygon of(List<Polygon> polygons) {
        return of(polygons, null);
    }

    public static MultiPolygon of(List<Polygon> polygons, Integer srid) {
        return of(GeometryChildren.dimensionOf(polygons), polygons, srid);
    }

    public static MultiPolygon of(Dimension dimension, List<Polygon> polygons, Integer srid) {
        final Integer resolvedSrid = GeometryChildren.resolveSrid(polygons, srid);
        return new MultiPolygon(dimension, GeometryChildren.adopt(MultiPolygon.class, dimension, polygons, resolvedSrid), resolvedSrid);
    }

    public static MultiPolygon empty(Integer srid, Dimension dimension) {
        return new MultiPolygon(dimension, List.of(), srid);
    }

    private MultiPolygon(Dimension dimension, List<Polygon> polygons, Integer srid) {
        super(srid, dimension);
        this.polygons = polygons;
    }

    /**
     * @return the unmodifiable list of members, never {@code null}
     */
    public List<Polygon> getPolygons() {
        return polygons;
    }

    public int getNumGeometries() {
        return polygons.size();
    }

    @Override
    public boolean isEmpty() {
        return polygons.isEmpty();
    }

    @Override
    public GeometryType getGeometryType() {
        return GeometryType.MULTI_POLYGON;
    }

    @Override
    public <T> T accept(GeometryVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    MultiPolygon withSrid(Integer srid) {
        return new MultiPolygon(getDimension(), GeometryChildren.reassign(polygons, srid), srid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        final MultiPolygon that = (MultiPolygon) o;
        return polygons.equals(that.polygons)
                && Objects.equals(getSrid(), that.getSrid())
                && getDimension() == that.getDimension();
    }

    @Override
    public int hashCode() {
        return Objects.hash(polygons, getSrid(), getDimension());
    }

    @Override
    public String toString() {
        return "MultiPolygon{" +
                "polygons=" + polygons +
                ", srid=" + getSrid() +
                ", dimension=" + getDimension() +
                '}';
    }
}
