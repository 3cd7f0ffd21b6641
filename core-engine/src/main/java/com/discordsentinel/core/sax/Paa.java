package com.discordsentinel.core.sax;

import java.util.Objects;

/**
 * Piecewise Aggregate Approximation.
 *
 * <p>
 * Splits a window of {@code n} samples into {@code w} contiguous segments and
 * replaces each segment by its mean. Every segment holds {@code n / w}
 * samples; when {@code w} does not divide {@code n} the first
 * {@code n % w} segments take one extra sample each.
 * </p>
 *
 * @since 1.0.0
 */
public final class Paa {

    private Paa() {
        // utility class — not instantiable
    }

    /**
     * @param window   the (normally z-normalized) window; must not be {@code null}
     * @param wordSize number of segments, {@code 1 <= wordSize <= window.length}
     * @return exactly {@code wordSize} segment means
     * @throws IllegalArgumentException if {@code wordSize} is out of range
     */
    public static double[] paa(double[] window, int wordSize) {
        Objects.requireNonNull(window, "Window must not be null");
        int n = window.length;
        if (wordSize < 1 || wordSize > n) {
            throw new IllegalArgumentException(
                    "wordSize must be in [1, " + n + "], got: " + wordSize);
        }

        int base = n / wordSize;
        int extra = n % wordSize;

        double[] out = new double[wordSize];
        int pos = 0;
        for (int segment = 0; segment < wordSize; segment++) {
            int size = segment < extra ? base + 1 : base;
            double sum = 0;
            for (int i = pos; i < pos + size; i++) {
                sum += window[i];
            }
            out[segment] = sum / size;
            pos += size;
        }
        return out;
    }
}
