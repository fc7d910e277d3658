/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import java.util.List;
import java.util.Objects;

/**
 * A collection of line strings.
 *
 * @author pgspatial Authors
 */
public final class MultiLineString extends Geometry {

    private final List<LineString> lineStrings;

    public static MultiLineString of(List<LineString> lineStrings) {
        return of(lineStrings, null);
    }

    public static MultiLineString of(List<LineString> lineStrings, Integer srid) {
        return of(GeometryChildren.dimensionOf(lineStrings), lineStrings, srid);
    }

    public static MultiLineString of(Dimension dimension, List<LineString> lineStrings, Integer srid) {
        final Integer resolvedSrid = GeometryChildren.resolveSrid(lineStrings, srid);
        return new MultiLineString(dimension, GeometryChildren.adopt(MultiLineString.class, dimension, lineStrings, resolvedSrid), resolvedSrid);
    }

    public static MultiLineString empty(Integer srid, Dimension dimension) {
        return new MultiLineString(dimension, List.of(), srid);
    }

    private MultiLineString(Dimension dimension, List<LineString> lineStrings, Integer srid) {
        super(srid, dimension);
        this.lineStrings = lineStrings;
    }

    /**
     * @return the unmodifiable list of members, never {@code null}
     */
    public List<LineString> getLineStrings() {
        return lineStrings;
    }

    public int getNumGeometries() {
        return lineStrings.size();
    }

    @Override
    public boolean isEmpty() {
        return lineStrings.isEmpty();
    }

    @Override
    public GeometryType getGeometryType() {
        return GeometryType.MULTI_LINE_STRING;
    }

    @Override
    public <T> T accept(GeometryVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    MultiLineString withSrid(Integer srid) {
        return new MultiLineString(getDimension(), GeometryChildren.reassign(lineStrings, srid), srid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        final MultiLineString that = (MultiLineString) o;
        return lineStrings.equals(that.lineStrings)
                && Objects.equals(getSrid(), that.getSrid())
                && getDimension() == that.getDimension();
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineStrings, getSrid(), getDimension());
    }

    @Override
    public String toString() {
        return "MultiLineString{" +
                "lineStrings=" + lineStrings +
                ", srid=" + getSrid() +
                ", dimension=" + getDimension() +
                '}';
    }
}
