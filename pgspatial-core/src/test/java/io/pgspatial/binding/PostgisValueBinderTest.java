/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.binding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgspatial.config.PostgisConfig;
import io.pgspatial.data.geometry.Geometry;
import io.pgspatial.data.geometry.GeometryCollection;
import io.pgspatial.data.geometry.Point;
import io.pgspatial.data.geometry.SridMismatchException;
import io.pgspatial.junit.TestLogger;
import io.pgspatial.spatial.MalformedWkbException;
import io.pgspatial.util.HexConverter;

/**
 * Unit test for {@link PostgisValueBinder}.
 *
 * @author pgspatial Authors
 */
public class PostgisValueBinderTest {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgisValueBinderTest.class);

    private static final String POINT_4326 = "0101000020e610000033333333333322409a99999999594840";

    @Rule
    public TestRule logTestName = new TestLogger(LOGGER);

    @Test
    public void shouldWriteGeometryColumn() {
        final PostgisValueBinder binder = binder(false);

        assertThat(binder.toInsertableSql("area", Point.of(1, 2, 3857)))
                .isEqualTo("public.ST_GeomFromText('POINT(1 2)', 3857)");
    }

    @Test
    public void shouldWriteGeographyColumn() {
        final PostgisValueBinder binder = binder(false);

        assertThat(binder.toInsertableSql("location", Point.ofGeodetic(48.7, 9.1)))
                .isEqualTo("public.ST_GeogFromText('SRID=4326;POINT(9.1 48.7)')");
    }

    @Test
    public void shouldUseColumnSridForGeometryWithoutSrid() {
        final PostgisValueBinder binder = binder(false);

        assertThat(binder.toInsertableSql("area", Point.of(1, 2))).isEqualTo("public.ST_GeomFromText('POINT(1 2)', 3857)");
        assertThat(binder.toInsertableSql("location", Point.of(1, 2))).isEqualTo("public.ST_GeogFromText('SRID=4326;POINT(1 2)')");
    }

    @Test
    public void shouldWriteNullValue() {
        assertThat(binder(false).toInsertableSql("area", null)).isEqualTo("NULL");
    }

    @Test
    public void shouldRejectSridMismatchWithoutTransformation() {
        final PostgisValueBinder binder = binder(false);

        assertThatThrownBy(() -> binder.toInsertableSql("area", Point.of(1, 2, 4326)))
                .isInstanceOfSatisfying(SridMismatchException.class, e -> {
                    assertThat(e.getExpectedSrid()).isEqualTo(3857);
                    assertThat(e.getActualSrid()).isEqualTo(4326);
                })
                .hasMessageContaining("3857")
                .hasMessageContaining("4326");
        assertThatThrownBy(() -> binder.toInsertableSql("location", Point.of(1, 2, 3857)))
                .isInstanceOf(SridMismatchException.class);
    }

    @Test
    public void shouldTransformToColumnSridWhenEnabled() {
        final PostgisValueBinder binder = binder(true);

        assertThat(binder.toInsertableSql("area", Point.of(1, 2, 4326)))
                .isEqualTo("public.ST_Transform(public.ST_GeomFromText('POINT(1 2)', 4326), 3857)");
        assertThat(binder.toInsertableSql("location", Point.of(1, 2, 3857)))
                .isEqualTo("public.geography(public.ST_Transform(public.ST_GeomFromText('POINT(1 2)', 3857), 4326))");
    }

    @Test
    public void shouldRouteCollectionToGeometry() {
        final PostgisValueBinder binder = binder(false);
        final GeometryCollection collection = GeometryCollection.of(List.of(Point.of(1, 2)), 4326);

        assertThat(binder.toInsertableSql("location", collection))
                .isEqualTo("public.ST_GeomFromText('GEOMETRYCOLLECTION(POINT(1 2))', 4326)");
    }

    @Test
    public void shouldRejectCollectionAsGeography() {
        final PostgisValueBinder binder = binder(true);
        final GeometryCollection collection = GeometryCollection.of(List.of(Point.of(1, 2)), 4326);

        assertThatThrownBy(() -> binder.toGeographySql(collection, 4326))
                .isInstanceOf(UnsupportedGeometryForGeographyException.class)
                .hasMessageContaining("GeometryCollection");
    }

    @Test
    public void shouldRejectUndeclaredColumn() {
        assertThatThrownBy(() -> binder(false).toInsertableSql("route", Point.of(1, 2)))
                .isInstanceOf(MissingColumnConfigurationException.class)
                .hasMessageContaining("route");
    }

    @Test
    public void shouldDecodeDatabaseValues() {
        final PostgisValueBinder binder = binder(false);
        final Point expected = Point.of(9.1, 48.7, 4326);

        assertThat(binder.fromDatabaseValue(null)).isNull();
        assertThat(binder.fromDatabaseValue(POINT_4326)).isEqualTo(expected);
        assertThat(binder.fromDatabaseValue(HexConverter.convertFromHex(POINT_4326))).isEqualTo(expected);
        assertThat(binder.fromDatabaseValue(expected)).isSameAs(expected);
        assertThatThrownBy(() -> binder.fromDatabaseValue(42)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> binder.fromDatabaseValue("0101")).isInstanceOf(MalformedWkbException.class);
    }

    @Test
    public void shouldDecodeOnlyDeclaredColumns() {
        final Map<String, Object> row = new HashMap<>();
        row.put("id", 7);
        row.put("name", POINT_4326);
        row.put("location", POINT_4326);
        row.put("area", null);

        final Map<String, Object> decoded = binder(false).decodeColumns(row);

        assertThat(decoded.get("id")).isEqualTo(7);
        assertThat(decoded.get("name")).isEqualTo(POINT_4326);
        assertThat(decoded.get("location")).isInstanceOf(Geometry.class).isEqualTo(Point.of(9.1, 48.7, 4326));
        assertThat(decoded).containsEntry("area", null);
        assertThat(row.get("location")).isEqualTo(POINT_4326);
    }

    private static PostgisValueBinder binder(boolean transform) {
        final PostgisConfig config = new PostgisConfig(Map.of(
                PostgisConfig.DEFAULT_COLUMN_TYPE, "geography",
                PostgisConfig.TRANSFORM_TO_DATABASE_PROJECTION, String.valueOf(transform)));
        final PostgisColumns columns = PostgisColumns.builder("Store", config)
                .column("location")
                .column("area", ColumnDefinition.geometry(3857))
                .build();
        return new PostgisValueBinder(config, columns);
    }
}
