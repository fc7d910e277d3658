/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import java.util.List;
import java.util.Objects;

/**
 * A heterogeneous collection of geometries, which may include other collections.
 * <p>
 * PostGIS only accepts collections in {@code geometry} columns. Callers must never route a collection to the
 * {@code geography} constructor.
 *
 * @author pgspatial Authors
 */
public final class GeometryCollection extends Geometry {

    private final List<Geometry> geometries;

    public static GeometryCollection of(List<Geometry> geometries) {
        return of(geometries, null);
    }

    public static GeometryCollection of(List<Geometry> geometries, Integer srid) {
        return of(GeometryChildren.dimensionOf(geometries), geometries, srid);
    }

    public static GeometryCollection of(Dimension dimension, List<Geometry> geometries, Integer srid) {
        final Integer resolvedSrid = GeometryChildren.resolveSrid(geometries, srid);
        return new GeometryCollection(dimension, GeometryChildren.adopt(GeometryCollection.class, dimension, geometries, resolvedSrid), resolvedSrid);
    }

    public static GeometryCollection empty(Integer srid, Dimension dimension) {
        return new GeometryCollection(dimension, List.of(), srid);
    }

    private GeometryCollection(Dimension dimension, List<Geometry> geometries, Integer srid) {
        super(srid, dimension);
        this.geometries = geometries;
    }

    /**
     * @return the unmodifiable list of members, never {@code null}
     */
    public List<Geometry> getGeometries() {
        return geometries;
    }

    public int getNumGeometries() {
        return geometries.size();
    }

    @Override
    public boolean isEmpty() {
        return geometries.isEmpty();
    }

    @Override
    public GeometryType getGeometryType() {
        return GeometryType.GEOMETRY_COLLECTION;
    }

    @Override
    public <T> T accept(GeometryVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    GeometryCollection withSrid(Integer srid) {
        return new GeometryCollection(getDimension(), GeometryChildren.reassign(geometries, srid), srid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        final GeometryCollection that = (GeometryCollection) o;
        return geometries.equals(that.geometries)
                && Objects.equals(getSrid(), that.getSrid())
                && getDimension() == that.getDimension();
    }

    @Override
    public int hashCode() {
        return Objects.hash(geometries, getSrid(), getDimension());
    }

    @Override
    public String toString() {
        return "GeometryCollection{" +
                "geometries=" + geometries +
                ", srid=" + getSrid() +
                ", dimension=" + getDimension() +
                '}';
    }
}
