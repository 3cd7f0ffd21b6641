package com.discordsentinel.core.sax;

import java.util.Objects;

/**
 * Z-normalization of time-series windows.
 *
 * <p>
 * A window is rescaled to zero mean and unit (population) standard deviation.
 * </p>
 *
 * <h3>Flat windows</h3>
 * <p>
 * A window is flat when its standard deviation is at most
 * {@value #FLAT_EPSILON} times the magnitude of its mean, i.e. when what is
 * left after subtracting the mean is rounding noise. The test is relative,
 * so rescaling a series never changes which of its windows are flat. Flat
 * windows normalize to all zeros: two flat windows are at distance zero from
 * each other, and a flat window is at distance {@code sqrt(n)} from any
 * non-flat window of length {@code n}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ZNormalizer {

    /** Largest ratio of standard deviation to mean magnitude that counts as flat. */
    public static final double FLAT_EPSILON = 1e-10;

    private ZNormalizer() {
        // utility class — not instantiable
    }

    /**
     * Z-normalize a whole window.
     *
     * @param window the samples; must not be {@code null} or empty
     * @return a new array of normalized values
     */
    public static double[] znorm(double[] window) {
        Objects.requireNonNull(window, "Window must not be null");
        return znorm(window, 0, window.length);
    }

    /**
     * Z-normalize the window {@code series[start, start + length)}.
     *
     * @param series the series holding the window
     * @param start  first sample of the window
     * @param length number of samples, at least 1
     * @return a new array of {@code length} normalized values
     * @throws IllegalArgumentException if the window is empty or out of bounds
     */
    public static double[] znorm(double[] series, int start, int length) {
        checkWindow(series, start, length);
        double mean = mean(series, start, length);
        double sd = standardDeviation(series, start, length, mean);

        double[] out = new double[length];
        if (isFlat(sd, mean)) {
            return out;
        }
        for (int i = 0; i < length; i++) {
            out[i] = (series[start + i] - mean) / sd;
        }
        return out;
    }

    /**
     * @return the arithmetic mean of {@code series[start, start + length)}
     */
    public static double mean(double[] series, int start, int length) {
        double sum = 0;
        for (int i = start; i < start + length; i++) {
            sum += series[i];
        }
        return sum / length;
    }

    /**
     * Population standard deviation around a precomputed mean.
     *
     * @return the standard deviation of {@code series[start, start + length)}
     */
    public static double standardDeviation(double[] series, int start, int length, double mean) {
        double sumSquaredDiff = 0;
        for (int i = start; i < start + length; i++) {
            double diff = series[i] - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / length);
    }

    /**
     * Whether a window with this mean and standard deviation is flat.
     *
     * @param standardDeviation population standard deviation of the window
     * @param mean              mean of the window
     * @return {@code true} if the deviation is rounding noise relative to the
     *         mean, or exactly zero
     */
    public static boolean isFlat(double standardDeviation, double mean) {
        return standardDeviation <= FLAT_EPSILON * Math.max(Math.abs(mean), Double.MIN_NORMAL);
    }

    static void checkWindow(double[] series, int start, int length) {
        Objects.requireNonNull(series, "Series must not be null");
        if (length < 1) {
            throw new IllegalArgumentException("Window length must be >= 1, got: " + length);
        }
        if (start < 0 || start > series.length - length) {
            throw new IllegalArgumentException(
                    "Window [" + start + ", " + (start + length) + ") is outside a series of length "
                            + series.length);
        }
    }
}
