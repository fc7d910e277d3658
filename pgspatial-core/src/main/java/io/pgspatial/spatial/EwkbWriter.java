/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.spatial;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Objects;

import io.pgspatial.data.geometry.Geometry;
import io.pgspatial.data.geometry.GeometryCollection;
import io.pgspatial.data.geometry.GeometryVisitor;
import io.pgspatial.data.geometry.LineString;
import io.pgspatial.data.geometry.MultiLineString;
import io.pgspatial.data.geometry.MultiPoint;
import io.pgspatial.data.geometry.MultiPolygon;
import io.pgspatial.data.geometry.Point;
import io.pgspatial.data.geometry.Polygon;
import io.pgspatial.util.HexConverter;

/**
 * Encodes a {@link Geometry} tree as PostGIS Extended Well-Known Binary (EWKB).
 * <p>
 * The SRID, when present, is written once on the outermost geometry. Nested geometries carry their own byte
 * order marker and dimension flags but never an SRID.
 *
 * @author pgspatial Authors
 */
public class EwkbWriter {

    private final ByteOrder byteOrder;

    /**
     * Creates a writer producing little endian (NDR) output, the byte order PostGIS uses.
     */
    public EwkbWriter() {
        this(ByteOrder.LITTLE_ENDIAN);
    }

    public EwkbWriter(ByteOrder byteOrder) {
        this.byteOrder = Objects.requireNonNull(byteOrder, "byteOrder");
    }

    /**
     * Encodes the geometry, including its SRID if it has one.
     *
     * @param geometry the geometry, must not be {@code null}
     * @return the EWKB bytes, never {@code null}
     */
    public byte[] write(Geometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        return encode(geometry, geometry.getSrid());
    }

    /**
     * Encodes the geometry with the given SRID in place of the geometry's own.
     *
     * @param geometry the geometry, must not be {@code null}
     * @param srid the SRID written into the root geometry
     * @return the EWKB bytes, never {@code null}
     */
    public byte[] write(Geometry geometry, int srid) {
        Objects.requireNonNull(geometry, "geometry");
        return encode(geometry, srid);
    }

    /**
     * Encodes the geometry as a lower case hex string, the textual form PostgreSQL uses for geometry values.
     */
    public String writeHex(Geometry geometry) {
        return HexConverter.convertToHexString(write(geometry));
    }

    private byte[] encode(Geometry geometry, Integer srid) {
        int size = GeometryConstants.HEADER_SIZE + geometry.accept(SizeVisitor.INSTANCE);
        if (srid != null) {
            size += GeometryConstants.INT_SIZE;
        }

        final ByteBuffer output = ByteBuffer.allocate(size);
        output.put(GeometryUtil.getByteOrderByte(byteOrder));
        output.order(byteOrder);
        output.putInt(GeometryUtil.getTypeWord(geometry.getGeometryType(), geometry.getDimension(), srid != null));
        if (srid != null) {
            output.putInt(srid);
        }
        geometry.accept(new BodyWriterVisitor(output, byteOrder));

        return output.array();
    }

    /**
     * Computes the encoded size of a geometry body, excluding the byte order marker, type word and SRID of the
     * geometry itself.
     */
    private static class SizeVisitor implements GeometryVisitor<Integer> {

        static final SizeVisitor INSTANCE = new SizeVisitor();

        @Override
        public Integer visit(Point point) {
            return point.getDimension().getCoordinateCount() * GeometryConstants.DOUBLE_SIZE;
        }

        @Override
        public Integer visit(LineString lineString) {
            return GeometryConstants.INT_SIZE
                    + lineString.getNumPoints() * lineString.getDimension().getCoordinateCount() * GeometryConstants.DOUBLE_SIZE;
        }

        @Override
        public Integer visit(Polygon polygon) {
            int size = GeometryConstants.INT_SIZE;
            for (LineString ring : polygon.getRings()) {
                size += visit(ring);
            }
            return size;
        }

        @Override
        public Integer visit(MultiPoint multiPoint) {
            return nestedSize(multiPoint.getPoints());
        }

        @Override
        public Integer visit(MultiLineString multiLineString) {
            return nestedSize(multiLineString.getLineStrings());
        }

        @Override
        public Integer visit(MultiPolygon multiPolygon) {
            return nestedSize(multiPolygon.getPolygons());
        }

        @Override
        public Integer visit(GeometryCollection collection) {
            return nestedSize(collection.getGeometries());
        }

        private int nestedSize(List<? extends Geometry> geometries) {
            int size = GeometryConstants.INT_SIZE;
            for (Geometry geometry : geometries) {
                size += GeometryConstants.HEADER_SIZE + geometry.accept(this);
            }
            return size;
        }
    }

    /**
     * Visitor implementation that writes the body of a geometry into the output buffer, recursing into nested
     * geometries with their own header.
     *
     * @param output the output byte buffer to write into, must not be {@code null}
     * @param byteOrder the byte order that the output uses
     */
    private record BodyWriterVisitor(ByteBuffer output, ByteOrder byteOrder) implements GeometryVisitor<Void> {

        @Override
        public Void visit(Point point) {
            for (double ordinate : point.getOrdinates()) {
                output.putDouble(ordinate);
            }
            return null;
        }

        @Override
        public Void visit(LineString lineString) {
            output.putInt(lineString.getNumPoints());
            lineString.getPoints().forEach(this::visit);
            return null;
        }

        @Override
        public Void visit(Polygon polygon) {
            output.putInt(polygon.getRings().size());
            polygon.getRings().forEach(this::visit);
            return null;
        }

        @Override
        public Void visit(MultiPoint multiPoint) {
            writeNested(multiPoint.getPoints());
            return null;
        }

        @Override
        public Void visit(MultiLineString multiLineString) {
            writeNested(multiLineString.getLineStrings());
            return null;
        }

        @Override
        public Void visit(MultiPolygon multiPolygon) {
            writeNested(multiPolygon.getPolygons());
            return null;
        }

        @Override
        public Void visit(GeometryCollection collection) {
            writeNested(collection.getGeometries());
            return null;
        }

        private void writeNested(List<? extends Geometry> geometries) {
            output.putInt(geometries.size());
            for (Geometry geometry : geometries) {
                output.put(GeometryUtil.getByteOrderByte(byteOrder));
                output.putInt(GeometryUtil.getTypeWord(geometry.getGeometryType(), geometry.getDimension(), false));
                geometry.accept(this);
            }
        }
    }
}
