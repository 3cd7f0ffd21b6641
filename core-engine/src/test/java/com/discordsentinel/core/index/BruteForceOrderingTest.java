package com.discordsentinel.core.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BruteForceOrdering}.
 */
class BruteForceOrderingTest {

    @Test
    @DisplayName("Should visit candidates in ascending order")
    void shouldUseAscendingOuterOrder() {
        assertThat(new BruteForceOrdering(5, 2).outerOrder()).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    @DisplayName("Should visit non-overlapping neighbours in ascending order")
    void shouldSkipOverlapsInInnerOrder() {
        BruteForceOrdering ordering = new BruteForceOrdering(6, 2);

        List<Integer> inner = new ArrayList<>();
        ordering.innerOrder(2).forEachRemaining((int q) -> inner.add(q));

        assertThat(inner).containsExactly(0, 4, 5);
    }

    @Test
    @DisplayName("Should yield nothing when every neighbour overlaps")
    void shouldYieldNothingInsideExclusionZone() {
        assertThat(new BruteForceOrdering(3, 3).innerOrder(1).hasNext()).isFalse();
    }

    @Test
    @DisplayName("Should reject invalid dimensions")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> new BruteForceOrdering(-1, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BruteForceOrdering(4, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
