/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.spatial;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgspatial.data.geometry.Dimension;
import io.pgspatial.data.geometry.Geometry;
import io.pgspatial.data.geometry.GeometryCollection;
import io.pgspatial.data.geometry.GeometryType;
import io.pgspatial.data.geometry.LineString;
import io.pgspatial.data.geometry.MultiLineString;
import io.pgspatial.data.geometry.MultiPoint;
import io.pgspatial.data.geometry.MultiPolygon;
import io.pgspatial.data.geometry.Point;
import io.pgspatial.data.geometry.Polygon;
import io.pgspatial.util.HexConverter;

/**
 * Decodes PostGIS Extended Well-Known Binary (EWKB) into a {@link Geometry} tree.
 * <p>
 * The SRID is only present on the outermost geometry and is handed down to every nested geometry. Each
 * nested geometry of a multi geometry or collection re-reads its own byte order. Every count read from the
 * input is checked against the remaining bytes before anything is allocated for it, and multi geometries and
 * collections may only be nested up to a maximum depth.
 * <p>
 * Instances are immutable and can be shared between threads.
 *
 * @author pgspatial Authors
 */
public class EwkbReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(EwkbReader.class);

    // Smallest possible nested geometry inside a collection: header plus a zero element count
    private static final int MIN_NESTED_GEOMETRY_SIZE = GeometryConstants.HEADER_SIZE + GeometryConstants.INT_SIZE;

    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    private final boolean validateRingClosure;
    private final int maxNestingDepth;

    public EwkbReader() {
        this(false);
    }

    /**
     * @param validateRingClosure whether every non-empty polygon ring must end on its starting coordinate
     */
    public EwkbReader(boolean validateRingClosure) {
        this(validateRingClosure, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param validateRingClosure whether every non-empty polygon ring must end on its starting coordinate
     * @param maxNestingDepth how deep geometries may be nested inside multi geometries and collections; the
     *            members of a top level collection are at depth 1
     */
    public EwkbReader(boolean validateRingClosure, int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("The maximum nesting depth must be at least 1 but was " + maxNestingDepth);
        }
        this.validateRingClosure = validateRingClosure;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Decodes a hex encoded EWKB geometry, as returned by PostgreSQL for {@code geometry} and
     * {@code geography} columns. A leading {@code \x} bytea marker is accepted.
     *
     * @param hexEwkb the hex string, must not be {@code null}
     * @return the geometry, never {@code null}
     * @throws MalformedWkbException if the string is not valid hex or does not hold a valid geometry
     */
    public Geometry read(String hexEwkb) {
        Objects.requireNonNull(hexEwkb, "hexEwkb");
        final byte[] ewkb;
        try {
            ewkb = HexConverter.convertFromHex(hexEwkb);
        }
        catch (IllegalArgumentException e) {
            throw new MalformedWkbException("Invalid hex encoded EWKB: " + e.getMessage(), e);
        }
        return read(ewkb);
    }

    /**
     * Decodes an EWKB geometry that spans the whole array.
     *
     * @param ewkb the bytes, must not be {@code null}
     * @return the geometry, never {@code null}
     * @throws MalformedWkbException if the bytes do not hold exactly one valid geometry
     */
    public Geometry read(byte[] ewkb) {
        Objects.requireNonNull(ewkb, "ewkb");
        final ByteBuffer buffer = ByteBuffer.wrap(ewkb);
        final Geometry geometry = read(buffer);
        if (buffer.hasRemaining()) {
            throw new MalformedWkbException(buffer.remaining() + " unexpected trailing bytes after the "
                    + geometry.getGeometryType().getKeyword() + " geometry at offset " + buffer.position());
        }
        return geometry;
    }

    /**
     * Decodes one EWKB geometry starting at the buffer's position, leaving the position after the geometry.
     * The buffer's byte order is restored afterwards.
     *
     * @param buffer the buffer, must not be {@code null}
     * @return the geometry, never {@code null}
     * @throws MalformedWkbException if the buffer does not hold a valid geometry at its position
     */
    public Geometry read(ByteBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        requireRemaining(buffer, GeometryConstants.BYTE_ORDER_SIZE, "byte order");
        final ByteOrder order = GeometryUtil.getByteOrder(buffer.get());

        try (ByteOrderScope scope = new ByteOrderScope(buffer, order)) {
            final int wkbType = readInt(buffer, "geometry type");
            final GeometryType type = resolveType(wkbType);
            final Dimension dimension = GeometryUtil.getDimension(wkbType);
            final Integer srid = GeometryUtil.hasSrid(wkbType) ? readInt(buffer, "SRID") : null;

            final Geometry geometry = readGeometry(buffer, type, dimension, srid, 0);
            LOGGER.trace("Decoded {} with SRID {} and dimension {}", type, srid, dimension);
            return geometry;
        }
    }

    /**
     * @param depth the nesting depth of the geometry, 0 for the outermost one
     */
    private Geometry readGeometry(ByteBuffer buffer, GeometryType type, Dimension dimension, Integer srid, int depth) {
        return switch (type) {
            case POINT -> readPoint(buffer, dimension, srid);
            case LINE_STRING -> readLineString(buffer, dimension, srid);
            case POLYGON -> readPolygon(buffer, dimension, srid);
            case MULTI_POINT -> readMultiPoint(buffer, dimension, srid, depth);
            case MULTI_LINE_STRING -> readMultiLineString(buffer, dimension, srid, depth);
            case MULTI_POLYGON -> readMultiPolygon(buffer, dimension, srid, depth);
            case GEOMETRY_COLLECTION -> readGeometryCollection(buffer, dimension, srid, depth);
        };
    }

    private Point readPoint(ByteBuffer buffer, Dimension dimension, Integer srid) {
        requireRemaining(buffer, coordinateSize(dimension), "point coordinates");
        final double x = buffer.getDouble();
        final double y = buffer.getDouble();
        final Double z = dimension.hasZDimension() ? buffer.getDouble() : null;
        final Double m = dimension.isMeasured() ? buffer.getDouble() : null;
        return Point.of(x, y, z, m, srid);
    }

    private LineString readLineString(ByteBuffer buffer, Dimension dimension, Integer srid) {
        final int numPoints = readCount(buffer, coordinateSize(dimension), "point");
        final List<Point> points = new ArrayList<>(numPoints);
        for (int i = 0; i < numPoints; i++) {
            points.add(readPoint(buffer, dimension, srid));
        }
        return LineString.of(dimension, points, srid);
    }

    private Polygon readPolygon(ByteBuffer buffer, Dimension dimension, Integer srid) {
        final int numRings = readCount(buffer, GeometryConstants.INT_SIZE, "ring");
        final List<LineString> rings = new ArrayList<>(numRings);
        for (int i = 0; i < numRings; i++) {
            final LineString ring = readLineString(buffer, dimension, srid);
            if (validateRingClosure && !ring.isEmpty() && !ring.isClosed()) {
                throw new MalformedWkbException("Polygon ring " + i + " is not closed");
            }
            rings.add(ring);
        }
        return Polygon.of(dimension, rings, srid);
    }

    private MultiPoint readMultiPoint(ByteBuffer buffer, Dimension dimension, Integer srid, int depth) {
        final List<Point> points = readNestedGeometries(buffer, GeometryType.POINT, Point.class, dimension, srid, depth);
        return MultiPoint.of(dimension, points, srid);
    }

    private MultiLineString readMultiLineString(ByteBuffer buffer, Dimension dimension, Integer srid, int depth) {
        final List<LineString> lineStrings = readNestedGeometries(buffer, GeometryType.LINE_STRING, LineString.class, dimension, srid, depth);
        return MultiLineString.of(dimension, lineStrings, srid);
    }

    private MultiPolygon readMultiPolygon(ByteBuffer buffer, Dimension dimension, Integer srid, int depth) {
        final List<Polygon> polygons = readNestedGeometries(buffer, GeometryType.POLYGON, Polygon.class, dimension, srid, depth);
        return MultiPolygon.of(dimension, polygons, srid);
    }

    private GeometryCollection readGeometryCollection(ByteBuffer buffer, Dimension dimension, Integer srid, int depth) {
        final List<Geometry> geometries = readNestedGeometries(buffer, null, Geometry.class, dimension, srid, depth);
        return GeometryCollection.of(dimension, geometries, srid);
    }

    /**
     * Reads the element count of a multi geometry or collection followed by that many complete geometries.
     *
     * @param expectedType the shape every nested geometry must have, or {@code null} to accept any shape
     */
    private <T extends Geometry> List<T> readNestedGeometries(ByteBuffer buffer, GeometryType expectedType, Class<T> geometryClass,
                                                              Dimension dimension, Integer srid, int depth) {
        final int minSize = expectedType == GeometryType.POINT
                ? GeometryConstants.HEADER_SIZE + coordinateSize(dimension)
                : MIN_NESTED_GEOMETRY_SIZE;
        final int numGeometries = readCount(buffer, minSize, "geometry");

        final List<T> geometries = new ArrayList<>(numGeometries);
        for (int i = 0; i < numGeometries; i++) {
            geometries.add(geometryClass.cast(readNestedGeometry(buffer, expectedType, dimension, srid, depth + 1)));
        }
        return geometries;
    }

    private Geometry readNestedGeometry(ByteBuffer buffer, GeometryType expectedType, Dimension dimension, Integer srid, int depth) {
        if (depth > maxNestingDepth) {
            throw new MalformedWkbException("Geometries are nested deeper than the maximum of " + maxNestingDepth
                    + " levels at offset " + buffer.position());
        }
        requireRemaining(buffer, GeometryConstants.BYTE_ORDER_SIZE, "byte order");
        final ByteOrder order = GeometryUtil.getByteOrder(buffer.get());

        try (ByteOrderScope scope = new ByteOrderScope(buffer, order)) {
            final int wkbType = readInt(buffer, "geometry type");
            final GeometryType type = resolveType(wkbType);

            if (GeometryUtil.hasSrid(wkbType)) {
                throw new MalformedWkbException("Nested " + type.getKeyword() + " must not declare its own SRID");
            }
            if (expectedType != null && type != expectedType) {
                throw new MalformedWkbException("Expected a nested " + expectedType.getKeyword() + " but found " + type.getKeyword());
            }
            final Dimension nestedDimension = GeometryUtil.getDimension(wkbType);
            if (nestedDimension != dimension) {
                throw new MalformedWkbException("Nested " + type.getKeyword() + " has dimension " + nestedDimension
                        + " but its parent has dimension " + dimension);
            }

            return readGeometry(buffer, type, dimension, srid, depth);
        }
    }

    private static GeometryType resolveType(int wkbType) {
        final int baseType = GeometryUtil.getBaseType(wkbType);
        final GeometryType type = GeometryType.fromWkbCode(baseType);
        if (type == null) {
            throw new MalformedWkbException("Invalid geometry type: " + baseType);
        }
        return type;
    }

    /**
     * Reads an element count and verifies that the remaining bytes can hold at least that many elements of the
     * given minimal size, so that a corrupted count never leads to a large allocation.
     */
    private static int readCount(ByteBuffer buffer, int minElementSize, String element) {
        final int count = readInt(buffer, element + " count");
        if (count < 0) {
            throw new MalformedWkbException("Invalid " + element + " count " + Integer.toUnsignedString(count)
                    + " at offset " + (buffer.position() - GeometryConstants.INT_SIZE));
        }
        if ((long) count * minElementSize > buffer.remaining()) {
            throw new MalformedWkbException("Declared " + element + " count " + count + " needs at least "
                    + ((long) count * minElementSize) + " bytes but only " + buffer.remaining() + " remain");
        }
        return count;
    }

    private static int readInt(ByteBuffer buffer, String field) {
        requireRemaining(buffer, GeometryConstants.INT_SIZE, field);
        return buffer.getInt();
    }

    private static void requireRemaining(ByteBuffer buffer, int size, String field) {
        if (buffer.remaining() < size) {
            throw new MalformedWkbException("Truncated EWKB: expected " + size + " bytes for the " + field
                    + " at offset " + buffer.position() + " but only " + buffer.remaining() + " remain");
        }
    }

    private static int coordinateSize(Dimension dimension) {
        return dimension.getCoordinateCount() * GeometryConstants.DOUBLE_SIZE;
    }

    /**
     * Helper class that changes the {@link ByteOrder} of a {@link ByteBuffer} if the new order
     * differs, restoring the order after the scope closes automatically.
     */
    private static class ByteOrderScope implements AutoCloseable {

        private final ByteBuffer buffer;
        private final ByteOrder byteOrder;

        ByteOrderScope(ByteBuffer buffer, ByteOrder newByteOrder) {
            this.buffer = buffer;
            this.byteOrder = buffer.order();

            if (buffer.order() != newByteOrder) {
                buffer.order(newByteOrder);
            }
        }

        @Override
        public void close() {
            if (buffer.order() != byteOrder) {
                buffer.order(byteOrder);
            }
        }
    }
}
