package com.discordsentinel.core.search;

import com.discordsentinel.core.config.DiscordConfig;
import com.discordsentinel.core.index.CandidateOrdering;
import com.discordsentinel.core.model.Discord;
import com.discordsentinel.core.model.DiscordQuery;
import com.discordsentinel.core.model.DiscordReport;
import com.discordsentinel.core.model.SearchMode;
import com.discordsentinel.core.sax.GaussianBreakpoints;
import com.discordsentinel.core.sax.Paa;
import com.discordsentinel.core.sax.SaxEncoder;
import com.discordsentinel.core.sax.ZNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Entry point of the discord engine.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   series[rangeStart, rangeEnd)
 *     → OrderingFactory (SAX words → trie → candidate index, or identity)
 *     → DiscordSearchEngine (best-first search, early abandonment)
 *     → Discord (absolute position, distance)
 * </pre>
 *
 * <p>
 * The series is only read. A search is empty, not an error, when the range
 * cannot hold two non-overlapping windows.
 * </p>
 *
 * @since 1.0.0
 */
public final class DiscordFinder {

    private static final Logger LOG = LoggerFactory.getLogger(DiscordFinder.class);

    private DiscordFinder() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Discord search
    // ---------------------------------------------------------------

    /**
     * Find the discord of {@code series} with default word size, alphabet and
     * seed.
     *
     * @param series        the samples
     * @param discordLength window length
     * @param wordSize      SAX word size
     * @param alphabetSize  SAX alphabet size
     * @param mode          candidate ordering
     * @return the discord, or empty if the series is too short
     * @throws IllegalArgumentException if a parameter is invalid
     */
    public static Optional<Discord> find(double[] series, int discordLength, int wordSize,
            int alphabetSize, SearchMode mode) {
        return find(series, DiscordQuery.builder(discordLength)
                .wordSize(wordSize)
                .alphabetSize(alphabetSize)
                .mode(mode)
                .build());
    }

    /**
     * Find the discord described by {@code query}.
     *
     * @param series the samples; must be finite
     * @param query  the search parameters
     * @return the discord with its absolute position, or empty if the range
     *         cannot hold two non-overlapping windows
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException if a parameter is invalid or the range
     *                                  holds a non-finite sample
     */
    public static Optional<Discord> find(double[] series, DiscordQuery query) {
        return find(series, query, () -> false);
    }

    /**
     * Cancellable variant of {@link #find(double[], DiscordQuery)}.
     *
     * @param cancelled polled between outer candidates
     * @throws CancellationException if {@code cancelled} returns {@code true}
     */
    public static Optional<Discord> find(double[] series, DiscordQuery query,
            BooleanSupplier cancelled) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(query, "DiscordQuery must not be null");
        query.validate(series.length);

        int from = query.effectiveRangeStart();
        int to = query.effectiveRangeEnd(series.length);
        double[] data = (from == 0 && to == series.length)
                ? series
                : Arrays.copyOfRange(series, from, to);
        requireFinite(data, from);

        int n = query.getDiscordLength();
        if (data.length < 2 * n) {
            LOG.debug("Query [{}]: range of {} sample(s) cannot hold two windows of length {}",
                    query.getName(), data.length, n);
            return Optional.empty();
        }

        CandidateOrdering ordering = OrderingFactory.create(data, query);
        DiscordSearchEngine engine = new DiscordSearchEngine(new SubsequenceDistance(data, n));
        Optional<Discord> discord = engine.search(ordering, cancelled).map(d -> d.withOffset(from));

        LOG.debug("Query [{}] ({}): {}", query.getName(), query.getMode(),
                discord.map(Discord::toString).orElse("no discord"));
        return discord;
    }

    /**
     * Run every query of a configuration against one series.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong> and holds one report
     * per query that found a discord, in configuration order.
     * </p>
     *
     * @param series the samples
     * @param config validated configuration
     * @return the reports
     * @throws IllegalArgumentException if a query does not fit the series
     */
    public static List<DiscordReport> runAll(double[] series, DiscordConfig config) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(config, "DiscordConfig must not be null");
        LOG.info("Running {} discord query(ies) over {} sample(s)",
                config.getQueries().size(), series.length);

        List<DiscordReport> reports = new ArrayList<>();
        for (DiscordQuery query : config.getQueries()) {
            find(series, query).ifPresentOrElse(
                    discord -> reports.add(DiscordReport.of(query, discord)
                            .detectedAt(Instant.now())
                            .build()),
                    () -> LOG.info("Query [{}]: no discord found", query.getName()));
        }
        return Collections.unmodifiableList(reports);
    }

    // ---------------------------------------------------------------
    // Discretization
    // ---------------------------------------------------------------

    /**
     * @see SaxEncoder#saxWord(double[], int, int)
     */
    public static String saxWord(double[] window, int wordSize, int alphabetSize) {
        return SaxEncoder.saxWord(window, wordSize, alphabetSize);
    }

    /**
     * @see Paa#paa(double[], int)
     */
    public static double[] paa(double[] window, int wordSize) {
        return Paa.paa(window, wordSize);
    }

    /**
     * @see ZNormalizer#znorm(double[])
     */
    public static double[] znorm(double[] window) {
        return ZNormalizer.znorm(window);
    }

    /**
     * @see GaussianBreakpoints#forAlphabet(int)
     */
    public static double[] gaussianBreakpoints(int alphabetSize) {
        return GaussianBreakpoints.forAlphabet(alphabetSize);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void requireFinite(double[] data, int offset) {
        for (int i = 0; i < data.length; i++) {
            if (!Double.isFinite(data[i])) {
                throw new IllegalArgumentException(
                        "Series sample at index " + (i + offset) + " is not finite: " + data[i]);
            }
        }
    }
}
