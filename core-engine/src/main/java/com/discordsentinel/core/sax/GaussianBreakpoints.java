package com.discordsentinel.core.sax;

import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Breakpoints that cut the standard normal distribution into equiprobable
 * regions.
 *
 * <p>
 * For alphabet size {@code a} the table holds {@code a - 1} ascending values
 * {@code Φ⁻¹(k / a)}, {@code k = 1 .. a-1}. Tables are computed once per
 * alphabet size and shared; callers always receive a copy.
 * </p>
 *
 * @since 1.0.0
 */
public final class GaussianBreakpoints {

    /** Smallest supported alphabet. */
    public static final int MIN_ALPHABET_SIZE = 2;

    /** Largest supported alphabet (symbols are rendered as {@code 'a'..'z'}). */
    public static final int MAX_ALPHABET_SIZE = 26;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private static final Map<Integer, double[]> CACHE = new ConcurrentHashMap<>();

    private GaussianBreakpoints() {
        // utility class — not instantiable
    }

    /**
     * @param alphabetSize number of symbols, in
     *                     [{@value #MIN_ALPHABET_SIZE}, {@value #MAX_ALPHABET_SIZE}]
     * @return a fresh copy of the {@code alphabetSize - 1} breakpoints
     * @throws IllegalArgumentException if the alphabet size is unsupported
     */
    public static double[] forAlphabet(int alphabetSize) {
        return table(alphabetSize).clone();
    }

    /**
     * Map a value to its symbol index: the first interval whose upper
     * breakpoint is strictly greater than the value.
     *
     * @param value       the aggregate value
     * @param breakpoints an ascending breakpoint table
     * @return a symbol index in {@code [0, breakpoints.length]}
     */
    public static int symbolFor(double value, double[] breakpoints) {
        for (int i = 0; i < breakpoints.length; i++) {
            if (breakpoints[i] > value) {
                return i;
            }
        }
        return breakpoints.length;
    }

    static double[] table(int alphabetSize) {
        if (alphabetSize < MIN_ALPHABET_SIZE || alphabetSize > MAX_ALPHABET_SIZE) {
            throw new IllegalArgumentException("alphabetSize must be in [" + MIN_ALPHABET_SIZE
                    + ", " + MAX_ALPHABET_SIZE + "], got: " + alphabetSize);
        }
        return CACHE.computeIfAbsent(alphabetSize, GaussianBreakpoints::compute);
    }

    private static double[] compute(int alphabetSize) {
        double[] cuts = new double[alphabetSize - 1];
        for (int k = 1; k < alphabetSize; k++) {
            cuts[k - 1] = STANDARD_NORMAL.inverseCumulativeProbability((double) k / alphabetSize);
        }
        return cuts;
    }
}
