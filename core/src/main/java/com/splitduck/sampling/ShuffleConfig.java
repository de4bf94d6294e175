package com.splitduck.sampling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thresholds of the tiered shuffle.
 *
 * <p>Defaults can be overridden with system properties:
 * <ul>
 *   <li>{@value #PROP_DIRECT_JOIN_MAX_ROWS}: largest row count shuffled with
 *       an inline VALUES join (default {@value #DEFAULT_DIRECT_JOIN_MAX_ROWS})</li>
 *   <li>{@value #PROP_HASH_ORDER_THRESHOLD}: row count from which the
 *       hash-order approximation is used (default {@value #DEFAULT_HASH_ORDER_THRESHOLD})</li>
 *   <li>{@value #PROP_MAPPING_BATCH_SIZE}: pairs per INSERT when filling a
 *       mapping table (default {@value #DEFAULT_MAPPING_BATCH_SIZE})</li>
 * </ul>
 * Invalid values are ignored with a warning.
 */
public final class ShuffleConfig {

    private static final Logger logger = LoggerFactory.getLogger(ShuffleConfig.class);

    public static final String PROP_DIRECT_JOIN_MAX_ROWS = "splitduck.shuffle.directJoinMaxRows";
    public static final String PROP_HASH_ORDER_THRESHOLD = "splitduck.shuffle.hashOrderThreshold";
    public static final String PROP_MAPPING_BATCH_SIZE = "splitduck.shuffle.mappingBatchSize";

    public static final int DEFAULT_DIRECT_JOIN_MAX_ROWS = 10_000;
    public static final long DEFAULT_HASH_ORDER_THRESHOLD = 1_000_000L;
    public static final int DEFAULT_MAPPING_BATCH_SIZE = 10_000;

    private final int directJoinMaxRows;
    private final long hashOrderThreshold;
    private final int mappingBatchSize;

    /**
     * Creates a configuration.
     *
     * @param directJoinMaxRows largest row count for the inline join
     * @param hashOrderThreshold row count from which hash ordering is used;
     *        must not exceed {@link Integer#MAX_VALUE}, the largest permutation
     *        that can be held in memory
     * @param mappingBatchSize pairs per mapping table INSERT
     * @throws IllegalArgumentException if a value is out of range
     */
    public ShuffleConfig(int directJoinMaxRows, long hashOrderThreshold, int mappingBatchSize) {
        if (directJoinMaxRows < 0) {
            throw new IllegalArgumentException("directJoinMaxRows must be non-negative, got: " + directJoinMaxRows);
        }
        if (hashOrderThreshold <= 0 || hashOrderThreshold > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("hashOrderThreshold out of range: " + hashOrderThreshold);
        }
        if (mappingBatchSize <= 0) {
            throw new IllegalArgumentException("mappingBatchSize must be positive, got: " + mappingBatchSize);
        }
        this.directJoinMaxRows = directJoinMaxRows;
        this.hashOrderThreshold = hashOrderThreshold;
        this.mappingBatchSize = mappingBatchSize;
    }

    public static ShuffleConfig defaults() {
        return new ShuffleConfig(DEFAULT_DIRECT_JOIN_MAX_ROWS, DEFAULT_HASH_ORDER_THRESHOLD, DEFAULT_MAPPING_BATCH_SIZE);
    }

    /**
     * Reads the configuration from system properties, falling back to the
     * defaults for missing or invalid values.
     *
     * @return the configuration
     */
    public static ShuffleConfig fromSystemProperties() {
        return new ShuffleConfig(
            (int) getConfiguredLong(PROP_DIRECT_JOIN_MAX_ROWS, DEFAULT_DIRECT_JOIN_MAX_ROWS, 0, Integer.MAX_VALUE),
            getConfiguredLong(PROP_HASH_ORDER_THRESHOLD, DEFAULT_HASH_ORDER_THRESHOLD, 1, Integer.MAX_VALUE),
            (int) getConfiguredLong(PROP_MAPPING_BATCH_SIZE, DEFAULT_MAPPING_BATCH_SIZE, 1, Integer.MAX_VALUE));
    }

    public int directJoinMaxRows() {
        return directJoinMaxRows;
    }

    public long hashOrderThreshold() {
        return hashOrderThreshold;
    }

    public int mappingBatchSize() {
        return mappingBatchSize;
    }

    // ========== Configuration Helpers ==========

    private static long getConfiguredLong(String property, long defaultValue, long min, long max) {
        String value = System.getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim().replace("_", ""));
            if (parsed >= min && parsed <= max) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            logger.debug("Cannot parse {}='{}'", property, value, e);
        }
        logger.warn("Ignoring invalid {} value '{}', using default {}", property, value, defaultValue);
        return defaultValue;
    }

    @Override
    public String toString() {
        return String.format("ShuffleConfig(directJoinMaxRows=%d, hashOrderThreshold=%d, mappingBatchSize=%d)",
            directJoinMaxRows, hashOrderThreshold, mappingBatchSize);
    }
}
