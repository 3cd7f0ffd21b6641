package com.discordsentinel.core.sax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SaxEncoder}.
 */
class SaxEncoderTest {

    @Test
    @DisplayName("Should encode a rising ramp as ascending letters")
    void shouldEncodeRamp() {
        double[] ramp = {0, 1, 2, 3, 4, 5, 6, 7, 8};

        assertThat(SaxEncoder.saxWord(ramp, 3, 3)).isEqualTo("abc");
        assertThat(SaxEncoder.saxWord(reverse(ramp), 3, 3)).isEqualTo("cba");
    }

    @Test
    @DisplayName("Should encode a flat window with the middle symbol")
    void shouldEncodeFlatWindow() {
        assertThat(SaxEncoder.saxWord(new double[] {2, 2, 2, 2}, 4, 3)).isEqualTo("bbbb");
    }

    @Test
    @DisplayName("Should ignore offset and scale of a window")
    void shouldBeInvariantToOffsetAndScale() {
        double[] window = {0.3, -1.2, 4.0, 2.2, 0.0, -0.5, 1.1, 3.3};
        double[] shifted = new double[window.length];
        for (int i = 0; i < window.length; i++) {
            shifted[i] = 3 * window[i] + 10;
        }

        assertThat(SaxEncoder.saxWord(shifted, 4, 5)).isEqualTo(SaxEncoder.saxWord(window, 4, 5));
    }

    @Test
    @DisplayName("Should encode one word per start position")
    void shouldEncodeAllWindows() {
        double[] series = {0, 1, 2, 3, 2, 1, 0, 1, 2, 3};
        SaxEncoder encoder = new SaxEncoder(2, 4);

        String[] words = encoder.encodeAll(series, 4);

        assertThat(words).hasSize(7);
        for (int start = 0; start < words.length; start++) {
            assertThat(words[start]).hasSize(2).isEqualTo(encoder.encode(series, start, 4));
        }
    }

    @Test
    @DisplayName("Should return no words when the series is shorter than a window")
    void shouldHandleShortSeries() {
        assertThat(new SaxEncoder(2, 3).encodeAll(new double[] {1, 2}, 3)).isEmpty();
    }

    @Test
    @DisplayName("Should reject word sizes larger than the window")
    void shouldRejectWordLongerThanWindow() {
        assertThatThrownBy(() -> SaxEncoder.saxWord(new double[] {1, 2, 3}, 4, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SaxEncoder(0, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private double[] reverse(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[values.length - 1 - i];
        }
        return out;
    }
}
