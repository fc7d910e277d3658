/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Enforces the SRID and dimension invariants shared by all composite geometries.
 *
 * @author pgspatial Authors
 */
final class GeometryChildren {

    /**
     * Returns the dimension of the first child, or {@link Dimension#DIMENSION_2D} when there are no children.
     */
    static Dimension dimensionOf(List<? extends Geometry> children) {
        Objects.requireNonNull(children, "children");
        return children.isEmpty() ? Dimension.DIMENSION_2D : children.get(0).getDimension();
    }

    /**
     * Resolves the SRID of a composite. An explicit SRID wins, and every child must either have no SRID or
     * the same one. Without an explicit SRID the children must agree on a single SRID, which the composite
     * then takes over.
     */
    static Integer resolveSrid(List<? extends Geometry> children, Integer srid) {
        Integer resolved = srid;
        for (Geometry child : children) {
            if (child == null || !child.hasSrid()) {
                continue;
            }
            if (resolved == null) {
                resolved = child.getSrid();
            }
            else if (!resolved.equals(child.getSrid())) {
                throw new SridMismatchException(resolved, child.getSrid(),
                        "A " + child.getClass().getSimpleName() + " with SRID " + child.getSrid()
                                + " cannot be part of a geometry with SRID " + resolved);
            }
        }
        return resolved;
    }

    /**
     * Validates the dimension of every child and returns an unmodifiable list of children that carry the
     * parent's SRID. Read-only children that already have that SRID are shared, every other child is copied.
     */
    @SuppressWarnings("unchecked")
    static <T extends Geometry> List<T> adopt(Class<?> owner, Dimension dimension, List<T> children, Integer srid) {
        Objects.requireNonNull(dimension, "dimension");
        final List<T> adopted = new ArrayList<>(children.size());
        for (T child : children) {
            Objects.requireNonNull(child, () -> owner.getSimpleName() + " cannot contain a null geometry");
            if (child.getDimension() != dimension) {
                throw new IllegalArgumentException(owner.getSimpleName() + " with dimension " + dimension
                        + " cannot contain a " + child.getClass().getSimpleName() + " with dimension " + child.getDimension());
            }
            if (child.isReadOnly() && Objects.equals(child.getSrid(), srid)) {
                adopted.add(child);
            }
            else {
                adopted.add((T) child.withSrid(srid));
            }
        }
        return Collections.unmodifiableList(adopted);
    }

    /**
     * Copies already validated children onto a new SRID.
     */
    @SuppressWarnings("unchecked")
    static <T extends Geometry> List<T> reassign(List<T> children, Integer srid) {
        final List<T> copies = new ArrayList<>(children.size());
        for (T child : children) {
            copies.add((T) child.withSrid(srid));
        }
        return Collections.unmodifiableList(copies);
    }

    private GeometryChildren() {
    }
}
