package com.splitduck.sampling;

import com.splitduck.exception.InvalidArgumentException;
import com.splitduck.test.TestBase;
import com.splitduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SplitSpec")
public class SplitSpecTest extends TestBase {

    private static List<Path> paths(String... names) {
        Path[] result = new Path[names.length];
        for (int i = 0; i < names.length; i++) {
            result[i] = Paths.get(names[i]);
        }
        return List.of(result);
    }

    @Nested
    @DisplayName("Ratio parsing")
    class RatioParsing {

        @Test
        @DisplayName("Fractions summing to 1.0 are kept")
        void testFractions() {
            assertThat(SplitSpec.parseRatios("0.7,0.2,0.1")).containsExactly(0.7, 0.2, 0.1);
        }

        @Test
        @DisplayName("Percentages summing to 100 are divided by 100")
        void testPercentages() {
            List<Double> ratios = SplitSpec.parseRatios("70, 20, 10");
            assertThat(ratios.get(0)).isCloseTo(0.7, within(1e-9));
            assertThat(ratios.get(1)).isCloseTo(0.2, within(1e-9));
            assertThat(ratios.get(2)).isCloseTo(0.1, within(1e-9));
        }

        @Test
        @DisplayName("Sums within the 0.001 tolerance are accepted")
        void testTolerance() {
            assertThat(SplitSpec.parseRatios("0.333,0.333,0.3335")).hasSize(3);
        }

        @Test
        @DisplayName("Ratios summing to 1.1 are rejected")
        void testBadSum() {
            assertThatThrownBy(() -> SplitSpec.parseRatios("0.5,0.6"))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("must sum to 1.0 or 100.0");
        }

        @Test
        @DisplayName("Non-positive ratios are rejected")
        void testNonPositive() {
            assertThatThrownBy(() -> SplitSpec.parseRatios("1.0,0"))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("positive");
            assertThatThrownBy(() -> SplitSpec.parseRatios("1.2,-0.2"))
                .isInstanceOf(InvalidArgumentException.class);
        }

        @Test
        @DisplayName("Malformed ratios are rejected")
        void testSyntax() {
            assertThatThrownBy(() -> SplitSpec.parseRatios("0.5,abc"))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("Invalid ratio: abc");
            assertThatThrownBy(() -> SplitSpec.parseRatios("0.5,,0.5"))
                .isInstanceOf(InvalidArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Ratio and destination counts must match")
        void testCountMismatch() {
            assertThatThrownBy(() -> SplitSpec.of(List.of(0.5, 0.5), paths("a.csv", "b.csv", "c.csv")))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessage("Number of ratios (2) must match number of names (3)");
        }

        @Test
        @DisplayName("Entries keep their order")
        void testEntries() {
            SplitSpec spec = SplitSpec.of(List.of(60.0, 40.0), paths("train.csv", "test.csv"));
            assertThat(spec.size()).isEqualTo(2);
            assertThat(spec.entries().get(0).destination()).isEqualTo(Paths.get("train.csv"));
            assertThat(spec.entries().get(0).ratio()).isCloseTo(0.6, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Split sizes")
    class Sizes {

        @Test
        @DisplayName("5 rows at 0.6/0.4 give 3 and 2")
        void testFiveRows() {
            SplitSpec spec = SplitSpec.of(List.of(0.6, 0.4), paths("a", "b"));
            assertThat(spec.sizesFor(5)).containsExactly(3, 2);
        }

        @Test
        @DisplayName("The last part receives the remainder")
        void testLastGetsRemainder() {
            SplitSpec spec = SplitSpec.of(List.of(0.333, 0.333, 0.334), paths("a", "b", "c"));
            long[] sizes = spec.sizesFor(10);
            assertThat(sizes).containsExactly(3, 3, 4);
        }

        @Test
        @DisplayName("Sizes always sum to the row count")
        void testCompleteness() {
            SplitSpec spec = SplitSpec.of(List.of(0.45, 0.45, 0.05, 0.05), paths("a", "b", "c", "d"));
            for (long rows = 0; rows < 200; rows++) {
                long sum = 0;
                for (long size : spec.sizesFor(rows)) {
                    assertThat(size).isNotNegative();
                    sum += size;
                }
                assertThat(sum).isEqualTo(rows);
            }
        }

        @Test
        @DisplayName("Rounding never lets earlier parts exceed the rows left")
        void testSaturation() {
            SplitSpec spec = SplitSpec.of(List.of(0.5, 0.5), paths("a", "b"));
            // round(1 * 0.5) = 1 takes the only row
            assertThat(spec.sizesFor(1)).containsExactly(1, 0);
        }
    }
}
