package com.discordsentinel.core.index;

/**
 * Trivial-match exclusion: two windows of length {@code n} overlap when their
 * start positions are less than {@code n} apart.
 *
 * @since 1.0.0
 */
public final class ExclusionZone {

    private ExclusionZone() {
        // utility class — not instantiable
    }

    /**
     * @return {@code true} if windows starting at {@code p} and {@code q} share
     *         at least one sample
     */
    public static boolean overlaps(int p, int q, int windowLength) {
        return Math.abs(p - q) < windowLength;
    }
}
