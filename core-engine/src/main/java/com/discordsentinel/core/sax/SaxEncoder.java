package com.discordsentinel.core.sax;

import java.util.Objects;

/**
 * Symbolic Aggregate approXimation.
 *
 * <p>
 * Maps a window to a word of {@code wordSize} letters over an alphabet of
 * {@code alphabetSize} symbols: z-normalize, reduce with {@link Paa}, then
 * look up each segment mean in the {@link GaussianBreakpoints} table. Symbol
 * {@code k} is rendered as the letter {@code 'a' + k}.
 * </p>
 *
 * <p>
 * Instances are immutable and may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class SaxEncoder {

    private final int wordSize;
    private final int alphabetSize;
    private final double[] breakpoints;

    /**
     * @param wordSize     letters per word, at least 1
     * @param alphabetSize symbols per letter
     * @throws IllegalArgumentException if either parameter is out of range
     */
    public SaxEncoder(int wordSize, int alphabetSize) {
        if (wordSize < 1) {
            throw new IllegalArgumentException("wordSize must be >= 1, got: " + wordSize);
        }
        this.wordSize = wordSize;
        this.alphabetSize = alphabetSize;
        this.breakpoints = GaussianBreakpoints.table(alphabetSize);
    }

    /**
     * One-shot encoding of a whole window.
     *
     * @param window       the raw window samples
     * @param wordSize     letters per word, {@code <= window.length}
     * @param alphabetSize symbols per letter
     * @return the SAX word
     */
    public static String saxWord(double[] window, int wordSize, int alphabetSize) {
        Objects.requireNonNull(window, "Window must not be null");
        return new SaxEncoder(wordSize, alphabetSize).encode(window, 0, window.length);
    }

    /**
     * Encode the window {@code series[start, start + length)}.
     *
     * @return the SAX word of the window
     * @throws IllegalArgumentException if the window is out of bounds or shorter
     *                                  than the word size
     */
    public String encode(double[] series, int start, int length) {
        double[] aggregates = Paa.paa(ZNormalizer.znorm(series, start, length), wordSize);

        char[] letters = new char[wordSize];
        for (int i = 0; i < wordSize; i++) {
            letters[i] = (char) ('a' + GaussianBreakpoints.symbolFor(aggregates[i], breakpoints));
        }
        return new String(letters);
    }

    /**
     * Encode every window of the given length, one word per start position
     * {@code 0 .. series.length - windowLength}.
     *
     * @param series       the series
     * @param windowLength the window length
     * @return words indexed by start position
     */
    public String[] encodeAll(double[] series, int windowLength) {
        Objects.requireNonNull(series, "Series must not be null");
        int count = series.length - windowLength + 1;
        if (count < 1) {
            return new String[0];
        }
        String[] words = new String[count];
        for (int start = 0; start < count; start++) {
            words[start] = encode(series, start, windowLength);
        }
        return words;
    }

    public int getWordSize() {
        return wordSize;
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

    @Override
    public String toString() {
        return "SaxEncoder{wordSize=" + wordSize + ", alphabetSize=" + alphabetSize + '}';
    }
}
