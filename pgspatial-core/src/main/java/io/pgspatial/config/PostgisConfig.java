/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.config;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgspatial.spatial.EwkbReader;
import io.pgspatial.sql.SqlGenerator;
import io.pgspatial.sql.WktSqlGenerator;

/**
 * Configuration of the PostGIS value handling: column defaults, SRID reconciliation and the SQL generator.
 *
 * @author pgspatial Authors
 */
public class PostgisConfig extends AbstractConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgisConfig.class);

    public static final String SCHEMA = "postgis.schema";
    public static final String DEFAULT_COLUMN_TYPE = "postgis.default.column.type";
    public static final String DEFAULT_SRID = "postgis.default.srid";
    public static final String TRANSFORM_TO_DATABASE_PROJECTION = "postgis.transform.to.database.projection";
    public static final String SQL_GENERATOR = "postgis.sql.generator";
    public static final String VALIDATE_RING_CLOSURE = "postgis.wkb.validate.ring.closure";
    public static final String MAX_NESTING_DEPTH = "postgis.wkb.max.nesting.depth";

    public static final String DEFAULT_SCHEMA = "public";
    public static final int DEFAULT_SRID_VALUE = 4326;

    public static final ConfigDef CONFIG_DEF = new ConfigDef()
            .define(SCHEMA,
                    Type.STRING,
                    DEFAULT_SCHEMA,
                    Importance.MEDIUM,
                    "Name of the schema where the PostGIS extension is installed. Default is public")
            .define(DEFAULT_COLUMN_TYPE,
                    Type.STRING,
                    ColumnType.GEOMETRY.getValue(),
                    PostgisConfig::validateColumnType,
                    Importance.MEDIUM,
                    "Storage kind of spatial columns without an explicit definition, either 'geometry' or 'geography'.")
            .define(DEFAULT_SRID,
                    Type.INT,
                    DEFAULT_SRID_VALUE,
                    Importance.MEDIUM,
                    "SRID of spatial columns without an explicit definition. Default is 4326 (WGS 84)")
            .define(TRANSFORM_TO_DATABASE_PROJECTION,
                    Type.BOOLEAN,
                    false,
                    Importance.LOW,
                    "Whether a geometry whose SRID differs from the column SRID is transformed with ST_Transform. "
                            + "When disabled, such a geometry is rejected.")
            .define(SQL_GENERATOR,
                    Type.STRING,
                    WktSqlGenerator.class.getName(),
                    Importance.LOW,
                    "Fully qualified class name of the SqlGenerator used to build geometry constructors, defaults to "
                            + WktSqlGenerator.class.getName())
            .define(VALIDATE_RING_CLOSURE,
                    Type.BOOLEAN,
                    false,
                    Importance.LOW,
                    "Whether decoding rejects polygon rings that do not end on their starting coordinate.")
            .define(MAX_NESTING_DEPTH,
                    Type.INT,
                    EwkbReader.DEFAULT_MAX_NESTING_DEPTH,
                    ConfigDef.Range.atLeast(1),
                    Importance.LOW,
                    "How deep geometries may be nested inside multi geometries and collections when decoding. "
                            + "Deeper input is rejected as malformed. Default is " + EwkbReader.DEFAULT_MAX_NESTING_DEPTH);

    private final ColumnType defaultColumnType;

    public PostgisConfig(Map<?, ?> props) {
        super(CONFIG_DEF, props);
        this.defaultColumnType = ColumnType.parse(getString(DEFAULT_COLUMN_TYPE));
    }

    /**
     * Returns a configuration that uses the default of every setting.
     */
    public static PostgisConfig defaults() {
        return new PostgisConfig(Map.of());
    }

    public String getSchema() {
        return getString(SCHEMA);
    }

    public ColumnType getDefaultColumnType() {
        return defaultColumnType;
    }

    public int getDefaultSrid() {
        return getInt(DEFAULT_SRID);
    }

    public boolean isTransformToDatabaseProjection() {
        return getBoolean(TRANSFORM_TO_DATABASE_PROJECTION);
    }

    public boolean isValidateRingClosure() {
        return getBoolean(VALIDATE_RING_CLOSURE);
    }

    public int getMaxNestingDepth() {
        return getInt(MAX_NESTING_DEPTH);
    }

    /**
     * Creates the configured SQL generator.
     *
     * @return the generator, never {@code null}
     * @throws ConfigException if the configured class cannot be instantiated as a {@link SqlGenerator}
     */
    public SqlGenerator createSqlGenerator() {
        final String className = getString(SQL_GENERATOR);
        try {
            return Instantiator.getInstance(className, SqlGenerator.class);
        }
        catch (IllegalArgumentException e) {
            LOGGER.error("Unable to create the SQL generator '{}'", className, e);
            throw new ConfigException(SQL_GENERATOR, className, e.getMessage());
        }
    }

    /**
     * Creates an EWKB reader honouring the ring closure and nesting depth settings.
     */
    public EwkbReader createEwkbReader() {
        return new EwkbReader(isValidateRingClosure(), getMaxNestingDepth());
    }

    private static void validateColumnType(String name, Object value) {
        if (ColumnType.parse((String) value) == null) {
            throw new ConfigException(name, value, "Must be one of "
                    + Arrays.stream(ColumnType.values()).map(ColumnType::getValue).collect(Collectors.joining(", ")));
        }
    }
}
