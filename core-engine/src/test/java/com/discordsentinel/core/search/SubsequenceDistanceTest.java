package com.discordsentinel.core.search;

import com.discordsentinel.core.sax.ZNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SubsequenceDistance}.
 */
class SubsequenceDistanceTest {

    private static final double[] SPIKE = {0, 0, 0, 0, 10, 0, 0, 0, 0, 0, 0, 0};

    @Test
    @DisplayName("Should match the distance of explicitly normalized windows")
    void shouldMatchExplicitNormalization() {
        double[] series = {3, 1, 4, 1, 5, 9, 2, 6, 5, 3, 5, 8};
        SubsequenceDistance distance = new SubsequenceDistance(series, 4);

        double[] a = ZNormalizer.znorm(Arrays.copyOfRange(series, 1, 5));
        double[] b = ZNormalizer.znorm(Arrays.copyOfRange(series, 7, 11));
        double expected = 0;
        for (int i = 0; i < a.length; i++) {
            expected += (a[i] - b[i]) * (a[i] - b[i]);
        }

        assertThat(distance.distance(1, 7)).isCloseTo(Math.sqrt(expected), within(1e-12));
        assertThat(distance.distance(7, 1)).isCloseTo(distance.distance(1, 7), within(1e-12));
        assertThat(distance.distance(3, 3)).isZero();
    }

    @Test
    @DisplayName("Should treat flat windows as all zeros")
    void shouldTreatFlatWindowsAsZero() {
        SubsequenceDistance distance = new SubsequenceDistance(SPIKE, 3);

        assertThat(distance.distance(0, 8)).isZero();
        assertThat(distance.distance(2, 8)).isCloseTo(Math.sqrt(3), within(1e-12));
    }

    @Test
    @DisplayName("Should not depend on the units of the series")
    void shouldBeScaleInvariant() {
        double[] series = {3, 1, 4, 1, 5, 9, 2, 6, 5, 3, 5, 8};
        double[] scaled = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            scaled[i] = series[i] * 1e-10 + 5e-9;
        }
        SubsequenceDistance unit = new SubsequenceDistance(series, 4);
        SubsequenceDistance small = new SubsequenceDistance(scaled, 4);

        assertThat(unit.distance(1, 7)).isPositive();
        for (int p = 0; p < unit.windowCount(); p++) {
            for (int q = 0; q < unit.windowCount(); q++) {
                assertThat(small.distance(p, q)).isCloseTo(unit.distance(p, q), within(1e-6));
            }
        }
    }

    @Test
    @DisplayName("Should stop at the limit once it is reached")
    void shouldAbandonAtLimit() {
        SubsequenceDistance distance = new SubsequenceDistance(SPIKE, 3);

        assertThat(distance.distance(2, 8, 1.0)).isEqualTo(1.0);
        assertThat(distance.distance(2, 8, 5.0)).isCloseTo(Math.sqrt(3), within(1e-12));
        assertThat(distance.distance(2, 8, Double.POSITIVE_INFINITY))
                .isCloseTo(Math.sqrt(3), within(1e-12));
    }

    @Test
    @DisplayName("Should report window geometry")
    void shouldExposeGeometry() {
        SubsequenceDistance distance = new SubsequenceDistance(SPIKE, 3);

        assertThat(distance.windowLength()).isEqualTo(3);
        assertThat(distance.windowCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject a window longer than the series")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> new SubsequenceDistance(SPIKE, 13))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowLength");
        assertThatThrownBy(() -> new SubsequenceDistance(SPIKE, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
