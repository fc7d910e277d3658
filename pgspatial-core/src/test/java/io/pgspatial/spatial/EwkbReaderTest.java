/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.spatial;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgspatial.data.geometry.Dimension;
import io.pgspatial.data.geometry.Geometry;
import io.pgspatial.data.geometry.GeometryCollection;
import io.pgspatial.data.geometry.LineString;
import io.pgspatial.data.geometry.MultiPoint;
import io.pgspatial.data.geometry.Point;
import io.pgspatial.data.geometry.Polygon;
import io.pgspatial.junit.TestLogger;
import io.pgspatial.util.HexConverter;

/**
 * Unit test for {@link EwkbReader}.
 *
 * @author pgspatial Authors
 */
public class EwkbReaderTest {

    private static final Logger LOGGER = LoggerFactory.getLogger(EwkbReaderTest.class);

    // POINT(9.1 48.7) with SRID 4326, little endian
    private static final String POINT_4326 = "0101000020e610000033333333333322409a99999999594840";

    @Rule
    public TestRule logTestName = new TestLogger(LOGGER);

    private final EwkbReader reader = new EwkbReader();

    @Test
    public void shouldDecodePointWithSrid() {
        final Geometry geometry = reader.read(POINT_4326);

        assertThat(geometry).isInstanceOf(Point.class);
        final Point point = (Point) geometry;
        assertThat(point.getX()).isEqualTo(9.1);
        assertThat(point.getY()).isEqualTo(48.7);
        assertThat(point.getSrid()).isEqualTo(4326);
        assertThat(point.getDimension()).isEqualTo(Dimension.DIMENSION_2D);
        assertThat(point.getLatitude()).isEqualTo(48.7);
    }

    @Test
    public void shouldDecodeBigEndianAndUpperCaseHex() {
        assertThat(reader.read("0020000001000010e64022333333333333404859999999999a")).isEqualTo(Point.of(9.1, 48.7, 4326));
        assertThat(reader.read(POINT_4326.toUpperCase())).isEqualTo(Point.of(9.1, 48.7, 4326));
        assertThat(reader.read("\\x" + POINT_4326)).isEqualTo(Point.of(9.1, 48.7, 4326));
    }

    @Test
    public void shouldDecodeDimensionFlags() {
        assertThat(reader.read("0101000080000000000000f03f00000000000000400000000000000840"))
                .isEqualTo(Point.of(1, 2, 3.0, null, null));
        assertThat(reader.read("0101000040000000000000f03f00000000000000400000000000001040"))
                .isEqualTo(Point.of(1, 2, null, 4.0, null));
        assertThat(reader.read("01010000c0000000000000f03f000000000000004000000000000008400000000000001040"))
                .isEqualTo(Point.of(1, 2, 3.0, 4.0, null));
    }

    @Test
    public void shouldDecodeEmptyGeometries() {
        final Geometry point = reader.read("0101000000000000000000f87f000000000000f87f");
        assertThat(point.isEmpty()).isTrue();
        assertThat(point.hasSrid()).isFalse();

        final Geometry lineString = reader.read("010200000000000000");
        assertThat(lineString).isEqualTo(LineString.empty(null, Dimension.DIMENSION_2D));

        final Geometry multiPoint = reader.read("010400000000000000");
        assertThat(multiPoint.isEmpty()).isTrue();
    }

    @Test
    public void shouldDecodePolygonAndPropagateSrid() {
        final Polygon polygon = (Polygon) reader.read("0103000020110f0000010000000400000000000000000000000000000000000000000000"
                + "000000f03f0000000000000000000000000000f03f000000000000f03f00000000000000000000000000000000");

        assertThat(polygon.getSrid()).isEqualTo(3857);
        assertThat(polygon.getRings()).hasSize(1);
        assertThat(polygon.getExteriorRing().getNumPoints()).isEqualTo(4);
        assertThat(polygon.getExteriorRing().isClosed()).isTrue();
        assertThat(polygon.getExteriorRing().getPoints()).allSatisfy(point -> assertThat(point.getSrid()).isEqualTo(3857));
    }

    @Test
    public void shouldHonourByteOrderOfEachNestedGeometry() {
        final MultiPoint multiPoint = (MultiPoint) reader.read("0104000020e6100000020000000101000000000000000000f03f"
                + "0000000000000040000000000140080000000000004010000000000000");

        assertThat(multiPoint.getSrid()).isEqualTo(4326);
        assertThat(multiPoint.getPoints()).containsExactly(Point.of(1, 2, 4326), Point.of(3, 4, 4326));
    }

    @Test
    public void shouldDecodeGeometryCollection() {
        final GeometryCollection collection = (GeometryCollection) reader.read("0107000000020000000101000000000000000000f03f"
                + "00000000000000400102000000020000000000000000000840000000000000104000000000000014400000000000001840");

        assertThat(collection.getGeometries()).hasSize(2);
        assertThat(collection.getGeometries().get(0)).isEqualTo(Point.of(1, 2));
        assertThat(collection.getGeometries().get(1)).isInstanceOf(LineString.class);
        assertThat(((LineString) collection.getGeometries().get(1)).getPoints()).containsExactly(Point.of(3, 4), Point.of(5, 6));
    }

    @Test
    public void shouldRestoreByteOrderOfBuffer() {
        final ByteBuffer buffer = ByteBuffer.wrap(HexConverter.convertFromHex(POINT_4326));

        reader.read(buffer);

        assertThat(buffer.order()).isEqualTo(ByteOrder.BIG_ENDIAN);
        assertThat(buffer.remaining()).isZero();
    }

    @Test
    public void shouldRejectTruncatedInput() {
        assertThatThrownBy(() -> reader.read("0101000000000000000000f03f000000000000"))
                .isInstanceOf(MalformedWkbException.class)
                .hasMessageContaining("Truncated");
        assertThatThrownBy(() -> reader.read(new byte[0])).isInstanceOf(MalformedWkbException.class);
        assertThatThrownBy(() -> reader.read("0101")).isInstanceOf(MalformedWkbException.class);
    }

    @Test
    public void shouldRejectTrailingBytes() {
        assertThatThrownBy(() -> reader.read(POINT_4326 + "00")).isInstanceOf(MalformedWkbException.class);
    }

    @Test
    public void shouldRejectUnknownTypeCode() {
        assertThatThrownBy(() -> reader.read("0108000000000000000000f03f0000000000000040"))
                .isInstanceOf(MalformedWkbException.class)
                .hasMessageContaining("8");
    }

    @Test
    public void shouldRejectInvalidByteOrder() {
        assertThatThrownBy(() -> reader.read("0201000000000000000000f03f0000000000000040"))
                .isInstanceOf(MalformedWkbException.class);
    }

    @Test
    public void shouldRejectImplausibleCounts() {
        assertThatThrownBy(() -> reader.read("0102000000ffffff7f"))
                .isInstanceOf(MalformedWkbException.class)
                .hasMessageContaining("count");
        assertThatThrownBy(() -> reader.read("0102000000ffffffff"))
                .isInstanceOf(MalformedWkbException.class)
                .hasMessageContaining("count");
    }

    @Test
    public void shouldRejectInvalidHex() {
        assertThatThrownBy(() -> reader.read("01x")).isInstanceOf(MalformedWkbException.class);
    }

    @Test
    public void shouldRejectInvalidNestedGeometries() {
        // nested point declaring SRID 4326
        assertThatThrownBy(() -> reader.read("0104000000010000000101000020e6100000000000000000f03f0000000000000040"))
                .isInstanceOf(MalformedWkbException.class)
                .hasMessageContaining("SRID");
        // line string inside a multipoint
        assertThatThrownBy(() -> reader.read("010400000001000000010200000000000000"))
                .isInstanceOf(MalformedWkbException.class);
        // Z point inside a planar multipoint
        assertThatThrownBy(() -> reader.read("0104000000010000000101000080000000000000f03f00000000000000400000000000000840"))
                .isInstanceOf(MalformedWkbException.class)
                .hasMessageContaining("dimension");
    }

    @Test
    public void shouldDecodeCollectionsUpToMaximumNestingDepth() {
        Geometry geometry = reader.read(nestedCollections(EwkbReader.DEFAULT_MAX_NESTING_DEPTH));

        for (int i = 0; i < EwkbReader.DEFAULT_MAX_NESTING_DEPTH; i++) {
            assertThat(geometry).isInstanceOf(GeometryCollection.class);
            geometry = ((GeometryCollection) geometry).getGeometries().get(0);
        }
        assertThat(geometry.isEmpty()).isTrue();
    }

    @Test
    public void shouldRejectCollectionsNestedTooDeeply() {
        assertThatThrownBy(() -> reader.read(nestedCollections(EwkbReader.DEFAULT_MAX_NESTING_DEPTH + 1)))
                .isInstanceOf(MalformedWkbException.class)
                .hasMessageContaining("nested deeper");
        assertThatThrownBy(() -> reader.read(nestedCollections(200_000)))
                .isInstanceOf(MalformedWkbException.class)
                .hasMessageContaining("nested deeper");
    }

    @Test
    public void shouldApplyConfiguredNestingDepth() {
        final EwkbReader shallowReader = new EwkbReader(false, 2);

        assertThat(shallowReader.read(nestedCollections(2))).isInstanceOf(GeometryCollection.class);
        assertThatThrownBy(() -> shallowReader.read(nestedCollections(3))).isInstanceOf(MalformedWkbException.class);
        assertThatThrownBy(() -> new EwkbReader(false, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldValidateRingClosureWhenEnabled() {
        final String openRing = "0103000000010000000400000000000000000000000000000000000000000000000000f03f000000000000"
                + "0000000000000000f03f000000000000f03f0000000000000000000000000000f03f";

        assertThat(reader.read(openRing)).isInstanceOf(Polygon.class);
        assertThatThrownBy(() -> new EwkbReader(true).read(openRing))
                .isInstanceOf(MalformedWkbException.class)
                .hasMessageContaining("not closed");
    }

    /**
     * Builds {@code levels} collections, each holding the next one, around an empty collection.
     */
    private static byte[] nestedCollections(int levels) {
        final ByteBuffer buffer = ByteBuffer.allocate((levels + 1) * 9).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < levels; i++) {
            buffer.put((byte) 1).putInt(7).putInt(1);
        }
        buffer.put((byte) 1).putInt(7).putInt(0);
        return buffer.array();
    }
}
