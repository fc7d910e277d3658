/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import java.util.List;
import java.util.Objects;

/**
 * A surface bounded by linear rings. The first ring is the exterior shell, all following rings are holes.
 *
 * @author pgspatial Authors
 */
public final class Polygon extends Geometry {

    private final List<LineString> rings;

    public static Polygon of(List<LineString> rings) {
        return of(rings, null);
    }

    public static Polygon of(List<LineString> rings, Integer srid) {
        return of(GeometryChildren.dimensionOf(rings), rings, srid);
    }

    public static Polygon of(Dimension dimension, List<LineString> rings, Integer srid) {
        final Integer resolvedSrid = GeometryChildren.resolveSrid(rings, srid);
        return new Polygon(dimension, GeometryChildren.adopt(Polygon.class, dimension, rings, resolvedSrid), resolvedSrid);
    }

    public static Polygon empty(Integer srid, Dimension dimension) {
        return new Polygon(dimension, List.of(), srid);
    }

    private Polygon(Dimension dimension, List<LineString> rings, Integer srid) {
        super(srid, dimension);
        this.rings = rings;
    }

    /**
     * @return the unmodifiable list of rings, exterior ring first; never {@code null}
     */
    public List<LineString> getRings() {
        return rings;
    }

    /**
     * @return the exterior ring, or {@code null} if the polygon is empty
     */
    public LineString getExteriorRing() {
        return rings.isEmpty() ? null : rings.get(0);
    }

    /**
     * @return the holes of the polygon, never {@code null}
     */
    public List<LineString> getInteriorRings() {
        return rings.isEmpty() ? List.of() : rings.subList(1, rings.size());
    }

    @Override
    public boolean isEmpty() {
        return rings.isEmpty();
    }

    @Override
    public GeometryType getGeometryType() {
        return GeometryType.POLYGON;
    }

    @Override
    public <T> T accept(GeometryVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    Polygon withSrid(Integer srid) {
        return new Polygon(getDimension(), GeometryChildren.reassign(rings, srid), srid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        final Polygon polygon = (Polygon) o;
        return rings.equals(polygon.rings)
                && Objects.equals(getSrid(), polygon.getSrid())
                && getDimension() == polygon.getDimension();
    }

    @Override
    public int hashCode() {
        return Objects.hash(rings, getSrid(), getDimension());
    }

    @Override
    public String toString() {
        return "Polygon{" +
                "rings=" + rings +
                ", srid=" + getSrid() +
                ", dimension=" + getDimension() +
                '}';
    }
}
