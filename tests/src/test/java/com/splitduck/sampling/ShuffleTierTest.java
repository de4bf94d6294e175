package com.splitduck.sampling;

import com.splitduck.test.TestBase;
import com.splitduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Shuffle tier selection")
public class ShuffleTierTest extends TestBase {

    @Nested
    @DisplayName("Default thresholds")
    class DefaultThresholds {

        private final ShuffleConfig config = ShuffleConfig.defaults();

        @Test
        @DisplayName("Up to 10,000 rows use the direct join")
        void testDirectJoin() {
            assertThat(ShuffleTier.select(2, config)).isEqualTo(ShuffleTier.DIRECT_JOIN);
            assertThat(ShuffleTier.select(10_000, config)).isEqualTo(ShuffleTier.DIRECT_JOIN);
        }

        @Test
        @DisplayName("Between the limits the mapping table is used")
        void testMappingTable() {
            assertThat(ShuffleTier.select(10_001, config)).isEqualTo(ShuffleTier.MAPPING_TABLE);
            assertThat(ShuffleTier.select(999_999, config)).isEqualTo(ShuffleTier.MAPPING_TABLE);
        }

        @Test
        @DisplayName("From 1,000,000 rows the hash order is used")
        void testHashOrder() {
            assertThat(ShuffleTier.select(1_000_000, config)).isEqualTo(ShuffleTier.HASH_ORDER);
            assertThat(ShuffleTier.select(50_000_000, config)).isEqualTo(ShuffleTier.HASH_ORDER);
        }

        @Test
        @DisplayName("Only the hash order is flagged as non-uniform")
        void testUniformity() {
            assertThat(ShuffleTier.DIRECT_JOIN.isUniform()).isTrue();
            assertThat(ShuffleTier.MAPPING_TABLE.isUniform()).isTrue();
            assertThat(ShuffleTier.HASH_ORDER.isUniform()).isFalse();
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Hash threshold wins over a larger direct join limit")
        void testOverlappingThresholds() {
            ShuffleConfig config = new ShuffleConfig(100, 50, 10);
            assertThat(ShuffleTier.select(60, config)).isEqualTo(ShuffleTier.HASH_ORDER);
            assertThat(ShuffleTier.select(40, config)).isEqualTo(ShuffleTier.DIRECT_JOIN);
        }

        @Test
        @DisplayName("System properties override the defaults")
        void testSystemProperties() {
            System.setProperty(ShuffleConfig.PROP_DIRECT_JOIN_MAX_ROWS, "5");
            System.setProperty(ShuffleConfig.PROP_HASH_ORDER_THRESHOLD, "1_000");
            try {
                ShuffleConfig config = ShuffleConfig.fromSystemProperties();
                assertThat(config.directJoinMaxRows()).isEqualTo(5);
                assertThat(config.hashOrderThreshold()).isEqualTo(1_000);
                assertThat(config.mappingBatchSize()).isEqualTo(ShuffleConfig.DEFAULT_MAPPING_BATCH_SIZE);
            } finally {
                System.clearProperty(ShuffleConfig.PROP_DIRECT_JOIN_MAX_ROWS);
                System.clearProperty(ShuffleConfig.PROP_HASH_ORDER_THRESHOLD);
            }
        }

        @Test
        @DisplayName("Invalid property values fall back to the defaults")
        void testInvalidProperties() {
            System.setProperty(ShuffleConfig.PROP_MAPPING_BATCH_SIZE, "zero");
            System.setProperty(ShuffleConfig.PROP_HASH_ORDER_THRESHOLD, "-4");
            try {
                ShuffleConfig config = ShuffleConfig.fromSystemProperties();
                assertThat(config.mappingBatchSize()).isEqualTo(ShuffleConfig.DEFAULT_MAPPING_BATCH_SIZE);
                assertThat(config.hashOrderThreshold()).isEqualTo(ShuffleConfig.DEFAULT_HASH_ORDER_THRESHOLD);
            } finally {
                System.clearProperty(ShuffleConfig.PROP_MAPPING_BATCH_SIZE);
                System.clearProperty(ShuffleConfig.PROP_HASH_ORDER_THRESHOLD);
            }
        }

        @Test
        @DisplayName("Out-of-range values are rejected by the constructor")
        void testConstructorValidation() {
            assertThatThrownBy(() -> new ShuffleConfig(10, 0, 10)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ShuffleConfig(10, 100, 0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ShuffleConfig(-1, 100, 10)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
