/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.spatial;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import io.pgspatial.data.geometry.Geometry;
import io.pgspatial.data.geometry.GeometryCollection;
import io.pgspatial.data.geometry.GeometryVisitor;
import io.pgspatial.data.geometry.LineString;
import io.pgspatial.data.geometry.MultiLineString;
import io.pgspatial.data.geometry.MultiPoint;
import io.pgspatial.data.geometry.MultiPolygon;
import io.pgspatial.data.geometry.Point;
import io.pgspatial.data.geometry.Polygon;

/**
 * Renders a {@link Geometry} tree as OGC Well-Known Text, in the dialect accepted by the PostGIS constructor
 * functions, for example {@code POINT(1 2)}, {@code POINT Z (1 2 3)} or {@code LINESTRING EMPTY}.
 * <p>
 * Ordinates are written in plain decimal notation, keeping the sign of negative zero. {@code NaN} is only
 * accepted as the empty point marker; a {@code NaN} or infinite ordinate anywhere else raises an
 * {@link InvalidCoordinateException}.
 *
 * @author pgspatial Authors
 */
public class WktWriter {

    private static final String EMPTY = "EMPTY";

    // BigDecimal has no negative zero
    private static final String NEGATIVE_ZERO = "-0";

    /**
     * Renders the geometry as WKT, without SRID.
     *
     * @param geometry the geometry, must not be {@code null}
     * @return the WKT text, never {@code null}
     */
    public String write(Geometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        final StringBuilder text = new StringBuilder();
        geometry.accept(new TaggedTextVisitor(text));
        return text.toString();
    }

    /**
     * Renders the geometry as PostGIS Extended WKT, prefixing {@code SRID=<srid>;} when the geometry has an SRID.
     */
    public String writeExtended(Geometry geometry) {
        final String wkt = write(geometry);
        return geometry.hasSrid() ? writeExtended(wkt, geometry.getSrid()) : wkt;
    }

    /**
     * Renders the geometry as PostGIS Extended WKT with the given SRID in place of the geometry's own.
     */
    public String writeExtended(Geometry geometry, int srid) {
        return writeExtended(write(geometry), srid);
    }

    private static String writeExtended(String wkt, int srid) {
        return "SRID=" + srid + ";" + wkt;
    }

    /**
     * Writes a geometry including its type keyword and dimension qualifier.
     */
    private static class TaggedTextVisitor implements GeometryVisitor<Void> {

        private final StringBuilder text;

        TaggedTextVisitor(StringBuilder text) {
            this.text = text;
        }

        @Override
        public Void visit(Point point) {
            if (writeTag(point)) {
                writePointText(text, point);
            }
            return null;
        }

        @Override
        public Void visit(LineString lineString) {
            if (writeTag(lineString)) {
                writeCoordinates(text, lineString);
            }
            return null;
        }

        @Override
        public Void visit(Polygon polygon) {
            if (writeTag(polygon)) {
                writeRings(text, polygon);
            }
            return null;
        }

        @Override
        public Void visit(MultiPoint multiPoint) {
            if (writeTag(multiPoint)) {
                text.append('(');
                writeList(multiPoint.getPoints(), point -> writePointText(text, point));
                text.append(')');
            }
            return null;
        }

        @Override
        public Void visit(MultiLineString multiLineString) {
            if (writeTag(multiLineString)) {
                text.append('(');
                writeList(multiLineString.getLineStrings(), lineString -> writeCoordinates(text, lineString));
                text.append(')');
            }
            return null;
        }

        @Override
        public Void visit(MultiPolygon multiPolygon) {
            if (writeTag(multiPolygon)) {
                text.append('(');
                writeList(multiPolygon.getPolygons(), polygon -> writeRings(text, polygon));
                text.append(')');
            }
            return null;
        }

        @Override
        public Void visit(GeometryCollection collection) {
            if (writeTag(collection)) {
                text.append('(');
                writeList(collection.getGeometries(), geometry -> geometry.accept(this));
                text.append(')');
            }
            return null;
        }

        /**
         * Writes the keyword and dimension qualifier. For an empty geometry {@code EMPTY} is written as well.
         *
         * @return {@code true} if the caller still has to write the geometry's coordinates
         */
        private boolean writeTag(Geometry geometry) {
            text.append(geometry.getGeometryType().getKeyword());
            final String suffix = geometry.getDimension().getWktSuffix();
            if (!suffix.isEmpty()) {
                text.append(' ').append(suffix);
            }
            if (geometry.isEmpty()) {
                if (geometry instanceof Point point) {
                    checkEmptyPoint(point);
                }
                text.append(' ').append(EMPTY);
                return false;
            }
            if (!suffix.isEmpty()) {
                text.append(' ');
            }
            return true;
        }

        private <T extends Geometry> void writeList(List<T> geometries, Consumer<T> writer) {
            for (int i = 0; i < geometries.size(); i++) {
                if (i > 0) {
                    text.append(',');
                }
                writer.accept(geometries.get(i));
            }
        }
    }

    /**
     * Writes {@code (x y ...)} for a point that stands on its own, or {@code EMPTY} for the empty point.
     */
    private static void writePointText(StringBuilder text, Point point) {
        if (point.isEmpty()) {
            checkEmptyPoint(point);
            text.append(EMPTY);
            return;
        }
        text.append('(');
        writeCoordinate(text, point);
        text.append(')');
    }

    private static void writeRings(StringBuilder text, Polygon polygon) {
        if (polygon.isEmpty()) {
            text.append(EMPTY);
            return;
        }
        text.append('(');
        final List<LineString> rings = polygon.getRings();
        for (int i = 0; i < rings.size(); i++) {
            if (i > 0) {
                text.append(',');
            }
            writeCoordinates(text, rings.get(i));
        }
        text.append(')');
    }

    /**
     * Writes the parenthesised coordinate list of a line string or ring, or {@code EMPTY} when it has no points.
     */
    private static void writeCoordinates(StringBuilder text, LineString lineString) {
        if (lineString.isEmpty()) {
            text.append(EMPTY);
            return;
        }
        text.append('(');
        final List<Point> points = lineString.getPoints();
        for (int i = 0; i < points.size(); i++) {
            if (i > 0) {
                text.append(',');
            }
            writeCoordinate(text, points.get(i));
        }
        text.append(')');
    }

    private static void writeCoordinate(StringBuilder text, Point point) {
        final double[] ordinates = point.getOrdinates();
        for (int i = 0; i < ordinates.length; i++) {
            if (i > 0) {
                text.append(' ');
            }
            text.append(formatOrdinate(ordinates[i], point));
        }
    }

    private static void checkEmptyPoint(Point point) {
        final Double z = point.getZ();
        final Double m = point.getM();
        if ((z != null && !z.isNaN()) || (m != null && !m.isNaN())) {
            throw new InvalidCoordinateException("An empty point must not have a z or m value: " + point);
        }
    }

    private static String formatOrdinate(double value, Point point) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidCoordinateException("Ordinate " + value + " of " + point
                    + " cannot be written as WKT; NaN is only permitted for empty points");
        }
        if (Double.compare(value, -0.0d) == 0) {
            return NEGATIVE_ZERO;
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
