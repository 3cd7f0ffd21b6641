package com.discordsentinel.core.sax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link GaussianBreakpoints}.
 */
class GaussianBreakpointsTest {

    @Test
    @DisplayName("Should match the classic SAX table for small alphabets")
    void shouldMatchKnownValues() {
        assertThat(GaussianBreakpoints.forAlphabet(3))
                .containsExactly(new double[] {-0.4307, 0.4307}, within(1e-4));
        assertThat(GaussianBreakpoints.forAlphabet(4))
                .containsExactly(new double[] {-0.6745, 0.0, 0.6745}, within(1e-4));
        assertThat(GaussianBreakpoints.forAlphabet(5))
                .containsExactly(new double[] {-0.8416, -0.2533, 0.2533, 0.8416}, within(1e-4));
    }

    @ParameterizedTest(name = "alphabet {0}")
    @ValueSource(ints = {2, 3, 5, 7, 10, 16, 26})
    @DisplayName("Should return a-1 strictly ascending, symmetric breakpoints")
    void shouldBeAscendingAndSymmetric(int alphabetSize) {
        double[] cuts = GaussianBreakpoints.forAlphabet(alphabetSize);

        assertThat(cuts).hasSize(alphabetSize - 1);
        for (int i = 1; i < cuts.length; i++) {
            assertThat(cuts[i]).isGreaterThan(cuts[i - 1]);
        }
        for (int i = 0; i < cuts.length; i++) {
            assertThat(cuts[i]).isCloseTo(-cuts[cuts.length - 1 - i], within(1e-9));
        }
    }

    @Test
    @DisplayName("Should hand out copies of the cached table")
    void shouldReturnDefensiveCopies() {
        double[] first = GaussianBreakpoints.forAlphabet(4);
        first[0] = 99;

        assertThat(GaussianBreakpoints.forAlphabet(4)[0]).isCloseTo(-0.6745, within(1e-4));
    }

    @Test
    @DisplayName("Should map values to symbols by interval")
    void shouldMapValuesToSymbols() {
        double[] cuts = GaussianBreakpoints.forAlphabet(4);

        assertThat(GaussianBreakpoints.symbolFor(-5, cuts)).isZero();
        assertThat(GaussianBreakpoints.symbolFor(-0.3, cuts)).isEqualTo(1);
        // a value on a breakpoint belongs to the interval above it
        assertThat(GaussianBreakpoints.symbolFor(0.0, cuts)).isEqualTo(2);
        assertThat(GaussianBreakpoints.symbolFor(5, cuts)).isEqualTo(3);
    }

    @ParameterizedTest(name = "alphabet {0}")
    @ValueSource(ints = {-1, 0, 1, 27})
    @DisplayName("Should reject unsupported alphabet sizes")
    void shouldRejectUnsupportedAlphabet(int alphabetSize) {
        assertThatThrownBy(() -> GaussianBreakpoints.forAlphabet(alphabetSize))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alphabetSize");
    }
}
