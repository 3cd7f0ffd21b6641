package com.discordsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one configured query, ready to hand to a reporting or plotting
 * collaborator.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code queryName}, {@code mode} and
 * {@code detectedAt} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscordReport implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Name of the query that produced the report. */
    private String queryName;

    /** Configuration name of the search mode. */
    private String mode;

    /** Absolute start position of the discord. */
    private int position;

    /** Nearest-neighbour distance of the discord. */
    private double distance;

    private int discordLength;
    private int wordSize;
    private int alphabetSize;

    /** When the search finished. */
    private Instant detectedAt;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public DiscordReport() {
    }

    private DiscordReport(Builder builder) {
        this.queryName = Objects.requireNonNull(builder.queryName, "queryName must not be null");
        this.mode = Objects.requireNonNull(builder.mode, "mode must not be null");
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        this.position = builder.position;
        this.distance = builder.distance;
        this.discordLength = builder.discordLength;
        this.wordSize = builder.wordSize;
        this.alphabetSize = builder.alphabetSize;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled from a query and its result.
     *
     * @param query   the query that was run
     * @param discord the discord it found
     * @return builder still missing {@code detectedAt}
     */
    public static Builder of(DiscordQuery query, Discord discord) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(discord, "discord must not be null");
        return new Builder()
                .queryName(query.getName())
                .mode(query.searchMode().configName())
                .position(discord.getPosition())
                .distance(discord.getDistance())
                .discordLength(query.getDiscordLength())
                .wordSize(query.getWordSize())
                .alphabetSize(query.getAlphabetSize());
    }

    /**
     * Fluent builder for {@link DiscordReport} instances.
     */
    public static class Builder {
        private String queryName;
        private String mode;
        private int position;
        private double distance;
        private int discordLength;
        private int wordSize;
        private int alphabetSize;
        private Instant detectedAt;

        public Builder queryName(String queryName) {
            this.queryName = queryName;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder position(int position) {
            this.position = position;
            return this;
        }

        public Builder distance(double distance) {
            this.distance = distance;
            return this;
        }

        public Builder discordLength(int discordLength) {
            this.discordLength = discordLength;
            return this;
        }

        public Builder wordSize(int wordSize) {
            this.wordSize = wordSize;
            return this;
        }

        public Builder alphabetSize(int alphabetSize) {
            this.alphabetSize = alphabetSize;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        /**
         * @return a new {@link DiscordReport}
         * @throws NullPointerException if a required field is missing
         */
        public DiscordReport build() {
            return new DiscordReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getQueryName() {
        return queryName;
    }

    public void setQueryName(String queryName) {
        this.queryName = queryName;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public double getDistance() {
        return distance;
    }

    public void setDistance(double distance) {
        this.distance = distance;
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

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(Instant detectedAt) {
        this.detectedAt = detectedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DiscordReport that))
            return false;
        return position == that.position
                && Double.compare(distance, that.distance) == 0
                && discordLength == that.discordLength
                && wordSize == that.wordSize
                && alphabetSize == that.alphabetSize
                && Objects.equals(queryName, that.queryName)
                && Objects.equals(mode, that.mode)
                && Objects.equals(detectedAt, that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queryName, mode, position, distance, discordLength, wordSize,
                alphabetSize, detectedAt);
    }

    @Override
    public String toString() {
        return "DiscordReport{" +
                "queryName='" + queryName + '\'' +
                ", mode='" + mode + '\'' +
                ", position=" + position +
                ", distance=" + distance +
                ", discordLength=" + discordLength +
                ", detectedAt=" + detectedAt +
                '}';
    }
}
