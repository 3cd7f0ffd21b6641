package com.discordsentinel.core.model;

import com.discordsentinel.core.sax.GaussianBreakpoints;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parameters of one discord search.
 *
 * <p>
 * Only {@code discordLength} has no default. The remaining fields default to
 * a word size of 3, an alphabet of 3 symbols, the {@code heuristic} mode, a
 * Squeezer threshold of 0.75, seed 0 and the whole series as range.
 * </p>
 *
 * <p>
 * Populated either through the {@link Builder} or by SnakeYAML through the
 * setters. Call {@link #validate()} (or {@link #validate(int)} once the series
 * length is known) before searching.
 * </p>
 *
 * @since 1.0.0
 */
public class DiscordQuery implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Label used in reports and logs. */
    private String name = "discord";

    /** Length of the discord window. */
    private int discordLength;

    /** Letters per SAX word. */
    private int wordSize = 3;

    /** Symbols per SAX letter. */
    private int alphabetSize = 3;

    /** One of {@code heuristic}, {@code brute_force}, {@code squeezer}. */
    private String mode = SearchMode.HEURISTIC.configName();

    /** Minimum similarity for Squeezer merges; only used in squeezer mode. */
    private double squeezerThreshold = 0.75;

    /** Seed of the inner-order shuffle. */
    private long seed;

    /** First sample of the searched range (inclusive), {@code null} for 0. */
    private Integer rangeStart;

    /** End of the searched range (exclusive), {@code null} for the series end. */
    private Integer rangeEnd;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every parameter that does not depend on the series.
     *
     * @throws IllegalArgumentException listing every violation
     */
    public void validate() {
        List<String> errors = parameterErrors();
        throwIfAny(errors);
    }

    /**
     * Validate all parameters, including the range, against a series.
     *
     * @param seriesLength number of samples in the series
     * @throws IllegalArgumentException listing every violation
     */
    public void validate(int seriesLength) {
        List<String> errors = parameterErrors();

        int start = effectiveRangeStart();
        int end = effectiveRangeEnd(seriesLength);
        if (start < 0 || end > seriesLength || start >= end) {
            errors.add("Query '" + name + "' range [" + start + ", " + end
                    + ") must be a non-empty range within [0, " + seriesLength + ")");
        }

        throwIfAny(errors);
    }

    private List<String> parameterErrors() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Query 'name' is required");
        }
        if (discordLength <= 1) {
            errors.add("Query '" + name + "' requires 'discordLength' > 1, got: " + discordLength);
        }
        if (wordSize < 1 || wordSize > Math.max(discordLength, 1)) {
            errors.add("Query '" + name + "' requires 1 <= 'wordSize' <= discordLength, got: "
                    + wordSize);
        }
        if (alphabetSize < GaussianBreakpoints.MIN_ALPHABET_SIZE
                || alphabetSize > GaussianBreakpoints.MAX_ALPHABET_SIZE) {
            errors.add("Query '" + name + "' requires 'alphabetSize' in ["
                    + GaussianBreakpoints.MIN_ALPHABET_SIZE + ", "
                    + GaussianBreakpoints.MAX_ALPHABET_SIZE + "], got: " + alphabetSize);
        }
        if (mode == null || mode.isBlank()) {
            errors.add("Query '" + name + "' requires 'mode'");
        } else {
            try {
                SearchMode.fromString(mode);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (!(squeezerThreshold >= 0 && squeezerThreshold <= 1)) {
            errors.add("Query '" + name + "' requires 'squeezerThreshold' in [0, 1], got: "
                    + squeezerThreshold);
        }
        if (rangeStart != null && rangeStart < 0) {
            errors.add("Query '" + name + "' requires 'rangeStart' >= 0, got: " + rangeStart);
        }
        if (rangeStart != null && rangeEnd != null && rangeEnd <= rangeStart) {
            errors.add("Query '" + name + "' requires 'rangeEnd' > 'rangeStart'");
        }
        return errors;
    }

    private static void throwIfAny(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(
                    "Invalid DiscordQuery: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * @return the parsed mode
     * @throws IllegalArgumentException if the mode is unknown
     */
    public SearchMode searchMode() {
        return SearchMode.fromString(mode);
    }

    /**
     * @return first searched sample
     */
    public int effectiveRangeStart() {
        return rangeStart != null ? rangeStart : 0;
    }

    /**
     * @param seriesLength number of samples in the series
     * @return end of the searched range (exclusive)
     */
    public int effectiveRangeEnd(int seriesLength) {
        return rangeEnd != null ? rangeEnd : seriesLength;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * @param discordLength length of the discord window
     * @return a builder with every other parameter at its default
     */
    public static Builder builder(int discordLength) {
        return new Builder(discordLength);
    }

    /**
     * Fluent builder for {@link DiscordQuery}. {@link #build()} validates the
     * series-independent parameters.
     */
    public static class Builder {
        private final DiscordQuery query = new DiscordQuery();

        private Builder(int discordLength) {
            query.setDiscordLength(discordLength);
        }

        public Builder name(String v) {
            query.setName(v);
            return this;
        }

        public Builder wordSize(int v) {
            query.setWordSize(v);
            return this;
        }

        public Builder alphabetSize(int v) {
            query.setAlphabetSize(v);
            return this;
        }

        public Builder mode(SearchMode v) {
            query.setMode(Objects.requireNonNull(v, "mode must not be null").configName());
            return this;
        }

        public Builder squeezerThreshold(double v) {
            query.setSqueezerThreshold(v);
            return this;
        }

        public Builder seed(long v) {
            query.setSeed(v);
            return this;
        }

        /**
         * Restrict the search to {@code [start, end)}.
         */
        public Builder range(int start, int end) {
            query.setRangeStart(start);
            query.setRangeEnd(end);
            return this;
        }

        /**
         * @return the validated query
         * @throws IllegalArgumentException if any parameter is invalid
         */
        public DiscordQuery build() {
            query.validate();
            return query;
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getDiscordLength() {
        return discordLength;
    }

    public void setDiscordLength(int discordLength) {
        this.discordLength = discordLength;
    }

    public int getWordSize() {
        return wordSize;
    }

    public void setWordSize(int wordSize) {
        this.wordSize = wordSize;
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

    public void setAlphabetSize(int alphabetSize) {
        this.alphabetSize = alphabetSize;
    }

    public String getMode() {
        return mode;
    }

    /**
     * Set the mode, normalised to lowercase.
     *
     * @param mode mode name
     */
    public void setMode(String mode) {
        this.mode = mode != null ? mode.toLowerCase(Locale.ROOT) : null;
    }

    public double getSqueezerThreshold() {
        return squeezerThreshold;
    }

    public void setSqueezerThreshold(double squeezerThreshold) {
        this.squeezerThreshold = squeezerThreshold;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public Integer getRangeStart() {
        return rangeStart;
    }

    public void setRangeStart(Integer rangeStart) {
        this.rangeStart = rangeStart;
    }

    public Integer getRangeEnd() {
        return rangeEnd;
    }

    public void setRangeEnd(Integer rangeEnd) {
        this.rangeEnd = rangeEnd;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DiscordQuery that))
            return false;
        return discordLength == that.discordLength
                && wordSize == that.wordSize
                && alphabetSize == that.alphabetSize
                && Double.compare(squeezerThreshold, that.squeezerThreshold) == 0
                && seed == that.seed
                && Objects.equals(name, that.name)
                && Objects.equals(mode, that.mode)
                && Objects.equals(rangeStart, that.rangeStart)
                && Objects.equals(rangeEnd, that.rangeEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, discordLength, wordSize, alphabetSize, mode,
                squeezerThreshold, seed, rangeStart, rangeEnd);
    }

    @Override
    public String toString() {
        return "DiscordQuery{" +
                "name='" + name + '\'' +
                ", discordLength=" + discordLength +
                ", wordSize=" + wordSize +
                ", alphabetSize=" + alphabetSize +
                ", mode='" + mode + '\'' +
                ", squeezerThreshold=" + squeezerThreshold +
                ", seed=" + seed +
                ", rangeStart=" + rangeStart +
                ", rangeEnd=" + rangeEnd +
                '}';
    }
}
