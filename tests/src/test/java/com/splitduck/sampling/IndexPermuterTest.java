package com.splitduck.sampling;

import com.splitduck.test.TestBase;
import com.splitduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("IndexPermuter")
public class IndexPermuterTest extends TestBase {

    @ParameterizedTest(name = "n = {0}")
    @ValueSource(ints = {0, 1, 2, 10, 1000})
    @DisplayName("Result is a bijection drawing n-1 values")
    void testBijectionAndDrawCount(int n) {
        RandomStream stream = SeedSource.seeded(99);
        Permutation permutation = IndexPermuter.permute(n, stream);

        assertThat(permutation.size()).isEqualTo(n);
        assertThat(Permutation.of(permutation.toArray())).isEqualTo(permutation);
        assertThat(stream.draws()).isEqualTo(Math.max(0, n - 1));
    }

    @Test
    @DisplayName("Same seed yields the same permutation")
    void testReproducible() {
        assertThat(IndexPermuter.permute(500, SeedSource.seeded(123)))
            .isEqualTo(IndexPermuter.permute(500, SeedSource.seeded(123)));
        assertThat(IndexPermuter.permute(500, SeedSource.seeded(123)))
            .isNotEqualTo(IndexPermuter.permute(500, SeedSource.seeded(124)));
    }

    @Test
    @DisplayName("Every ordering of three elements is reachable")
    void testAllOrderingsReachable() {
        Set<Permutation> seen = new HashSet<>();
        for (long seed = 0; seed < 200 && seen.size() < 6; seed++) {
            seen.add(IndexPermuter.permute(3, SeedSource.seeded(seed)));
        }
        assertThat(seen).hasSize(6);
    }

    @Test
    @DisplayName("Permutation.of rejects duplicates and out-of-range positions")
    void testPermutationValidation() {
        assertThatThrownBy(() -> Permutation.of(new int[] {0, 0, 1}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Permutation.of(new int[] {0, 3, 1}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(Permutation.identity(4).sourceOf(2)).isEqualTo(2);
    }

    @Test
    @DisplayName("Negative sizes are rejected")
    void testNegativeSize() {
        assertThatThrownBy(() -> IndexPermuter.permute(-1, SeedSource.seeded(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
