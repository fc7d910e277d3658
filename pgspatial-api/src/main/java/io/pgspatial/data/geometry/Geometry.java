/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

/**
 * Root of the OGC simple feature shapes as stored by PostGIS.
 * <p>
 * Every geometry carries an optional spatial reference identifier (SRID) and the {@link Dimension} of
 * its coordinates. Composite shapes share a single SRID and a single dimension with all of their
 * children; this is enforced when a composite is created.
 * <p>
 * The hierarchy is closed: use {@link #accept(GeometryVisitor)} to dispatch over the shapes.
 *
 * @author pgspatial Authors
 */
public abstract sealed class Geometry permits Point, LineString, Polygon, MultiPoint, MultiLineString, MultiPolygon, GeometryCollection {

    private final Integer srid;
    private Dimension dimension;

    protected Geometry(Integer srid, Dimension dimension) {
        this.srid = srid;
        this.dimension = dimension;
    }

    /**
     * Returns whether the geometry has a spatial reference identifier. A geometry without one takes the
     * SRID configured for the column it is written to.
     */
    public boolean hasSrid() {
        return srid != null;
    }

    /**
     * Get the spatial reference identifier.
     *
     * @return spatial reference identifier, may be {@code null}
     */
    public Integer getSrid() {
        return srid;
    }

    public Dimension getDimension() {
        return dimension;
    }

    void setDimension(Dimension dimension) {
        this.dimension = dimension;
    }

    public boolean is3d() {
        return dimension.hasZDimension();
    }

    public boolean isMeasured() {
        return dimension.isMeasured();
    }

    public abstract boolean isEmpty();

    public abstract GeometryType getGeometryType();

    public abstract <T> T accept(GeometryVisitor<T> visitor);

    /**
     * Creates a deep copy of this geometry that carries the given SRID, including all of its children.
     */
    abstract Geometry withSrid(Integer srid);

    /**
     * Returns whether nothing in this geometry can change after construction, so that it can be shared by a
     * composite instead of being copied.
     */
    boolean isReadOnly() {
        return true;
    }
}
