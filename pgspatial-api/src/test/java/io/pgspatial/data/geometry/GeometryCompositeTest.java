/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.data.geometry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

/**
 * Unit test for the SRID and dimension rules of composite geometries.
 */
public class GeometryCompositeTest {

    @Test
    public void shouldPropagateParentSridToChildren() {
        final LineString lineString = LineString.of(List.of(Point.of(0, 0), Point.of(1, 1)), 4326);

        assertThat(lineString.getSrid()).isEqualTo(4326);
        assertThat(lineString.getPoints()).allSatisfy(point -> assertThat(point.getSrid()).isEqualTo(4326));
    }

    @Test
    public void shouldAdoptSridOfChildren() {
        final MultiPoint multiPoint = MultiPoint.of(List.of(Point.of(0, 0, 3857), Point.of(1, 1)));

        assertThat(multiPoint.getSrid()).isEqualTo(3857);
        assertThat(multiPoint.getPoints().get(1).getSrid()).isEqualTo(3857);
    }

    @Test
    public void shouldRejectConflictingChildSrid() {
        final List<Point> points = List.of(Point.of(0, 0, 4326), Point.of(1, 1, 3857));

        assertThatThrownBy(() -> LineString.of(points))
                .isInstanceOf(SridMismatchException.class)
                .hasMessageContaining("4326")
                .hasMessageContaining("3857");
        assertThatThrownBy(() -> MultiPoint.of(List.of(Point.of(0, 0, 3857)), 4326))
                .isInstanceOfSatisfying(SridMismatchException.class, e -> {
                    assertThat(e.getExpectedSrid()).isEqualTo(4326);
                    assertThat(e.getActualSrid()).isEqualTo(3857);
                });
    }

    @Test
    public void shouldRejectMixedDimensions() {
        final List<Point> points = List.of(Point.of(0, 0), Point.of(1, 1, 2.0, null, null));

        assertThatThrownBy(() -> LineString.of(points)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldRejectNullChild() {
        final List<Point> points = Arrays.asList(Point.of(0, 0), null);

        assertThatThrownBy(() -> MultiPoint.of(points)).isInstanceOf(NullPointerException.class);
    }

    @Test
    public void shouldNotShareChildrenWithCaller() {
        final List<Point> points = new ArrayList<>(List.of(Point.of(0, 0), Point.of(1, 1)));
        final LineString lineString = LineString.of(points);
        points.clear();

        assertThat(lineString.getNumPoints()).isEqualTo(2);
        assertThatThrownBy(() -> lineString.getPoints().add(Point.of(2, 2)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void shouldKeepParentIntactWhenChildIsModified() {
        final LineString lineString = LineString.of(List.of(Point.of(1, 2), Point.of(3, 4)), 4326);
        final Point child = lineString.getPoints().get(0);

        assertThatThrownBy(() -> child.setZ(5.0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> child.setM(5.0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> child.setX(5.0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> child.setLatitude(5.0)).isInstanceOf(IllegalStateException.class);

        assertThat(child.getDimension()).isEqualTo(Dimension.DIMENSION_2D);
        assertThat(lineString.getDimension()).isEqualTo(Dimension.DIMENSION_2D);
        assertThat(lineString.getPoints()).containsExactly(Point.of(1, 2, 4326), Point.of(3, 4, 4326));
    }

    @Test
    public void shouldProtectPointsOfNestedComposites() {
        final Polygon polygon = Polygon.of(List.of(ring(0, 1)));
        final MultiPolygon multiPolygon = MultiPolygon.of(List.of(polygon), 3857);
        final Point corner = multiPolygon.getPolygons().get(0).getExteriorRing().getPoints().get(0);

        assertThatThrownBy(() -> corner.setZ(1.0)).isInstanceOf(IllegalStateException.class);
        assertThat(multiPolygon.getPolygons().get(0).getExteriorRing().getDimension()).isEqualTo(Dimension.DIMENSION_2D);
    }

    @Test
    public void shouldEditCopyOfChild() {
        final LineString lineString = LineString.of(List.of(Point.of(1, 2), Point.of(3, 4)), 4326);

        final Point copy = lineString.getPoints().get(0).copy();
        copy.setZ(5.0);

        assertThat(copy.getDimension()).isEqualTo(Dimension.DIMENSION_Z);
        assertThat(copy.getSrid()).isEqualTo(4326);
        assertThat(lineString.getPoints().get(0).getZ()).isNull();
    }

    @Test
    public void shouldNotReflectLaterChangesOfCallerPoints() {
        final Point point = Point.of(1, 2);
        final MultiPoint multiPoint = MultiPoint.of(List.of(point));

        point.setZ(3.0);

        assertThat(multiPoint.getPoints().get(0).getZ()).isNull();
        assertThat(multiPoint.getPoints().get(0).getDimension()).isEqualTo(multiPoint.getDimension());
    }

    @Test
    public void shouldShareReadOnlyChildrenWithSameSrid() {
        final LineString lineString = LineString.of(List.of(Point.of(0, 0), Point.of(1, 1)), 4326);

        assertThat(MultiLineString.of(List.of(lineString)).getLineStrings().get(0)).isSameAs(lineString);
        assertThat(MultiLineString.of(List.of(lineString), 4326).getLineStrings().get(0)).isSameAs(lineString);
    }

    @Test
    public void shouldReportEmptiness() {
        assertThat(LineString.empty(null, Dimension.DIMENSION_2D).isEmpty()).isTrue();
        assertThat(Polygon.empty(4326, Dimension.DIMENSION_Z).isEmpty()).isTrue();
        assertThat(Polygon.empty(4326, Dimension.DIMENSION_Z).getExteriorRing()).isNull();
        assertThat(MultiPolygon.empty(null, Dimension.DIMENSION_2D).getNumGeometries()).isZero();
        assertThat(GeometryCollection.empty(null, Dimension.DIMENSION_2D).isEmpty()).isTrue();
        assertThat(MultiPoint.of(List.of(Point.of(1, 2))).isEmpty()).isFalse();
    }

    @Test
    public void shouldSplitExteriorAndInteriorRings() {
        final LineString shell = ring(0, 10);
        final LineString hole = ring(2, 4);
        final Polygon polygon = Polygon.of(List.of(shell, hole), 4326);

        assertThat(polygon.getExteriorRing()).isEqualTo(LineString.of(shell.getPoints(), 4326));
        assertThat(polygon.getInteriorRings()).hasSize(1);
        assertThat(polygon.getExteriorRing().isClosed()).isTrue();
    }

    @Test
    public void shouldNestGeometriesInCollection() {
        final GeometryCollection collection = GeometryCollection.of(List.of(
                Point.of(1, 2),
                MultiLineString.of(List.of(LineString.of(List.of(Point.of(0, 0), Point.of(1, 1))))),
                GeometryCollection.of(List.of(Point.of(3, 4)))), 4326);

        assertThat(collection.getNumGeometries()).isEqualTo(3);
        assertThat(collection.getGeometries()).allSatisfy(geometry -> assertThat(geometry.getSrid()).isEqualTo(4326));
        final GeometryCollection nested = (GeometryCollection) collection.getGeometries().get(2);
        assertThat(nested.getGeometries().get(0).getSrid()).isEqualTo(4326);
    }

    private static LineString ring(double min, double max) {
        return LineString.of(List.of(Point.of(min, min), Point.of(max, min), Point.of(max, max), Point.of(min, min)));
    }
}
