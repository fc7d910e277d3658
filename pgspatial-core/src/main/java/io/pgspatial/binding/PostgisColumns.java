/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.binding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.pgspatial.config.PostgisConfig;

/**
 * The spatial columns of an entity. A column is declared either with an explicit {@link ColumnDefinition} or
 * by name only, in which case the configured defaults apply.
 *
 * @author pgspatial Authors
 */
public class PostgisColumns {

    private final String owner;
    private final ColumnDefinition defaults;
    private final Map<String, ColumnDefinition> columns;

    private PostgisColumns(String owner, ColumnDefinition defaults, Map<String, ColumnDefinition> columns) {
        this.owner = owner;
        this.defaults = defaults;
        this.columns = Collections.unmodifiableMap(columns);
    }

    /**
     * Starts declaring the spatial columns of an entity.
     *
     * @param owner the name of the entity owning the columns, used in error messages
     * @param config the configuration providing the column defaults
     * @return the builder, never {@code null}
     */
    public static Builder builder(String owner, PostgisConfig config) {
        return new Builder(owner, ColumnDefinition.defaultsOf(config));
    }

    public String getOwner() {
        return owner;
    }

    /**
     * @return the declared column names in declaration order
     * @throws MissingColumnConfigurationException if no column has been declared
     */
    public Set<String> getColumnNames() {
        assertColumnsNotEmpty();
        return columns.keySet();
    }

    public boolean isSpatialColumn(String column) {
        return columns.containsKey(column);
    }

    /**
     * Returns the definition of a declared column.
     *
     * @param column the column key
     * @return the definition, never {@code null}
     * @throws MissingColumnConfigurationException if the column has not been declared
     */
    public ColumnDefinition getColumnDefinition(String column) {
        assertColumnsNotEmpty();
        final ColumnDefinition definition = columns.get(column);
        if (definition == null) {
            throw new MissingColumnConfigurationException(owner, column);
        }
        return definition;
    }

    /**
     * @return the definition applied to columns declared by name only
     */
    public ColumnDefinition getDefaults() {
        return defaults;
    }

    private void assertColumnsNotEmpty() {
        if (columns.isEmpty()) {
            throw new MissingColumnConfigurationException(owner);
        }
    }

    public static class Builder {

        private final String owner;
        private final ColumnDefinition defaults;
        private final Map<String, ColumnDefinition> columns = new LinkedHashMap<>();

        private Builder(String owner, ColumnDefinition defaults) {
            this.owner = Objects.requireNonNull(owner, "owner");
            this.defaults = defaults;
        }

        /**
         * Declares a column that uses the configured default type and SRID.
         */
        public Builder column(String column) {
            return column(column, defaults);
        }

        public Builder column(String column, ColumnDefinition definition) {
            columns.put(Objects.requireNonNull(column, "column"), Objects.requireNonNull(definition, "definition"));
            return this;
        }

        public PostgisColumns build() {
            return new PostgisColumns(owner, defaults, new LinkedHashMap<>(columns));
        }
    }
}
