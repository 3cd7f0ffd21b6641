package com.discordsentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * How the discord search orders its candidates.
 *
 * @since 1.0.0
 */
public enum SearchMode {

    /** Rare SAX words first, same-word neighbours first. */
    HEURISTIC("heuristic"),

    /** Ascending positions; the reference result. */
    BRUTE_FORCE("brute_force"),

    /** Like {@link #HEURISTIC}, over Squeezer-merged word groups. */
    SQUEEZER("squeezer");

    private final String configName;

    SearchMode(String configName) {
        this.configName = configName;
    }

    /**
     * @return the name used in configuration files
     */
    public String configName() {
        return configName;
    }

    /**
     * Parse a configuration name, ignoring case; {@code -} is accepted in
     * place of {@code _}.
     *
     * @param name the mode name
     * @return the matching mode
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SearchMode fromString(String name) {
        Objects.requireNonNull(name, "Search mode must not be null");
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SearchMode mode : values()) {
            if (mode.configName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown search mode: '" + name
                + "'. Supported modes: heuristic, brute_force, squeezer");
    }
}
