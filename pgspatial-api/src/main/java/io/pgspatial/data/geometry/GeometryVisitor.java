/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

/**
 * Visits the closed set of {@link Geometry} shapes. Each shape dispatches to exactly one method.
 *
 * @param <T> the result type of the visit
 * @author pgspatial Authors
 */
public interface GeometryVisitor<T> {

    T visit(Point point);

    T visit(LineString lineString);

    T visit(Polygon polygon);

    T visit(MultiPoint multiPoint);

    T visit(MultiLineString multiLineString);

    T visit(MultiPolygon multiPolygon);

    T visit(GeometryCollection collection);
}
