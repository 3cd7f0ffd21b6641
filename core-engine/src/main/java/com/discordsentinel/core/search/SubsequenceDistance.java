package com.discordsentinel.core.search;

import com.discordsentinel.core.sax.ZNormalizer;

import java.util.Objects;

/**
 * Euclidean distance between z-normalized windows of one series.
 *
 * <p>
 * The mean and standard deviation of every window are computed once up
 * front with {@link ZNormalizer}, so each distance is a single pass over the
 * raw samples. Flat windows (see
 * {@link ZNormalizer#isFlat(double, double)}) count as all zeros.
 * </p>
 *
 * @since 1.0.0
 */
public final class SubsequenceDistance {

    private final double[] series;
    private final int windowLength;
    private final double[] means;
    private final double[] inverseDeviations;

    /**
     * @param series       the series; not copied, must not change while in use
     * @param windowLength window length, {@code 1 <= windowLength <= series.length}
     */
    public SubsequenceDistance(double[] series, int windowLength) {
        this.series = Objects.requireNonNull(series, "Series must not be null");
        if (windowLength < 1 || windowLength > series.length) {
            throw new IllegalArgumentException("windowLength must be in [1, " + series.length
                    + "], got: " + windowLength);
        }
        this.windowLength = windowLength;

        int count = series.length - windowLength + 1;
        this.means = new double[count];
        this.inverseDeviations = new double[count];
        for (int p = 0; p < count; p++) {
            double mean = ZNormalizer.mean(series, p, windowLength);
            double sd = ZNormalizer.standardDeviation(series, p, windowLength, mean);
            means[p] = mean;
            inverseDeviations[p] = ZNormalizer.isFlat(sd, mean) ? 0 : 1 / sd;
        }
    }

    /**
     * @return the exact distance between the windows starting at {@code p} and
     *         {@code q}
     */
    public double distance(int p, int q) {
        return distance(p, q, Double.POSITIVE_INFINITY);
    }

    /**
     * Distance with a cutoff: once the partial sum shows the distance is at
     * least {@code limit}, stop and return {@code limit}.
     *
     * @param p     first window start
     * @param q     second window start
     * @param limit cutoff, {@code +∞} for none
     * @return the distance if below {@code limit}, otherwise {@code limit}
     */
    public double distance(int p, int q, double limit) {
        double limitSquared = limit * limit;
        double meanP = means[p];
        double meanQ = means[q];
        double scaleP = inverseDeviations[p];
        double scaleQ = inverseDeviations[q];

        double sum = 0;
        for (int i = 0; i < windowLength; i++) {
            double diff = (series[p + i] - meanP) * scaleP - (series[q + i] - meanQ) * scaleQ;
            sum += diff * diff;
            if (sum >= limitSquared) {
                return limit;
            }
        }
        return Math.sqrt(sum);
    }

    public int windowLength() {
        return windowLength;
    }

    /**
     * @return number of windows, {@code series.length - windowLength + 1}
     */
    public int windowCount() {
        return means.length;
    }
}
