package com.discordsentinel.core.search;

import com.discordsentinel.core.index.BruteForceOrdering;
import com.discordsentinel.core.index.CandidateIndex;
import com.discordsentinel.core.index.CandidateOrdering;
import com.discordsentinel.core.index.SaxTrie;
import com.discordsentinel.core.index.SqueezerClusterer;
import com.discordsentinel.core.model.DiscordQuery;
import com.discordsentinel.core.model.SearchMode;
import com.discordsentinel.core.sax.SaxEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates the {@link CandidateOrdering} for a query's {@link SearchMode}.
 *
 * <p>
 * This is the single point of extension when adding new orderings: add the
 * mode to {@link SearchMode} and build its ordering here.
 * </p>
 *
 * @since 1.0.0
 */
public final class OrderingFactory {

    private static final Logger LOG = LoggerFactory.getLogger(OrderingFactory.class);

    private OrderingFactory() {
        // utility class — not instantiable
    }

    /**
     * Build the ordering for {@code query} over {@code series}.
     *
     * @param series the searched samples (already restricted to the query
     *               range)
     * @param query  a validated query
     * @return the ordering
     * @throws NullPointerException if an argument is {@code null}
     */
    public static CandidateOrdering create(double[] series, DiscordQuery query) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(query, "DiscordQuery must not be null");

        int n = query.getDiscordLength();
        SearchMode mode = query.searchMode();
        return switch (mode) {
            case BRUTE_FORCE -> new BruteForceOrdering(series.length - n + 1, n);
            case HEURISTIC -> CandidateIndex.fromWordGroups(trie(series, query), n, query.getSeed());
            case SQUEEZER -> squeezed(series, query);
        };
    }

    private static SaxTrie trie(double[] series, DiscordQuery query) {
        SaxEncoder encoder = new SaxEncoder(query.getWordSize(), query.getAlphabetSize());
        SaxTrie trie = SaxTrie.of(encoder.encodeAll(series, query.getDiscordLength()));
        LOG.debug("Query [{}]: {} window(s) grouped into {} SAX word(s)",
                query.getName(), trie.size(), trie.groups().size());
        return trie;
    }

    private static CandidateOrdering squeezed(double[] series, DiscordQuery query) {
        SaxTrie trie = trie(series, query);
        List<SqueezerClusterer.Cluster> clusters =
                new SqueezerClusterer(query.getSqueezerThreshold()).cluster(trie.groups());
        return CandidateIndex.fromClusters(clusters, query.getDiscordLength(), query.getSeed());
    }
}
