package com.discordsentinel.core.search;

import com.discordsentinel.core.index.BruteForceOrdering;
import com.discordsentinel.core.index.CandidateIndex;
import com.discordsentinel.core.index.SaxTrie;
import com.discordsentinel.core.model.Discord;
import com.discordsentinel.core.sax.SaxEncoder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DiscordSearchEngine}.
 */
class DiscordSearchEngineTest {

    private static final double[] SPIKE = {0, 0, 0, 0, 10, 0, 0, 0, 0, 0, 0, 0};

    @Test
    @DisplayName("Should find a window holding the spike")
    void shouldFindSpike() {
        DiscordSearchEngine engine = new DiscordSearchEngine(new SubsequenceDistance(SPIKE, 3));

        Optional<Discord> discord = engine.search(new BruteForceOrdering(10, 3));

        assertThat(discord).isPresent();
        assertThat(discord.get().getPosition()).isBetween(2, 4);
        assertThat(discord.get().getDistance()).isCloseTo(Math.sqrt(3), within(1e-9));
    }

    @Test
    @DisplayName("Should report the first candidate with distance 0 on a constant series")
    void shouldHandleConstantSeries() {
        double[] series = new double[20];
        Arrays.fill(series, 4.2);
        DiscordSearchEngine engine = new DiscordSearchEngine(new SubsequenceDistance(series, 5));

        Optional<Discord> discord = engine.search(new BruteForceOrdering(16, 5));

        assertThat(discord).contains(new Discord(0, 0.0));
    }

    @Test
    @DisplayName("Should report nothing when no candidate has a non-overlapping neighbour")
    void shouldReturnEmptyWithoutNeighbours() {
        double[] series = {1, 2, 3, 4, 5};
        DiscordSearchEngine engine = new DiscordSearchEngine(new SubsequenceDistance(series, 3));

        assertThat(engine.search(new BruteForceOrdering(3, 3))).isEmpty();
    }

    @Test
    @DisplayName("Should compute fewer distances with the SAX ordering than brute force")
    void shouldPruneWithHeuristicOrdering() {
        double[] series = DiscordFinderTest.sineWithFlatSegment();
        int n = 50;
        SubsequenceDistance distance = new SubsequenceDistance(series, n);

        DiscordSearchEngine brute = new DiscordSearchEngine(distance);
        Optional<Discord> bruteDiscord = brute.search(new BruteForceOrdering(series.length - n + 1, n));

        SaxTrie trie = SaxTrie.of(new SaxEncoder(3, 3).encodeAll(series, n));
        DiscordSearchEngine heuristic = new DiscordSearchEngine(distance);
        Optional<Discord> heuristicDiscord = heuristic.search(CandidateIndex.fromWordGroups(trie, n, 1L));

        assertThat(heuristicDiscord).isPresent();
        assertThat(heuristicDiscord.get().getDistance())
                .isCloseTo(bruteDiscord.get().getDistance(), within(1e-9));
        assertThat(heuristic.getDistanceComputations()).isLessThan(brute.getDistanceComputations());
        assertThat(heuristic.getAbandonedCandidates()).isPositive();
    }

    @Test
    @DisplayName("Should stop when cancelled between candidates")
    void shouldHonourCancellation() {
        DiscordSearchEngine engine = new DiscordSearchEngine(new SubsequenceDistance(SPIKE, 3));
        AtomicInteger polls = new AtomicInteger();

        assertThatThrownBy(() -> engine.search(new BruteForceOrdering(10, 3),
                () -> polls.incrementAndGet() > 3))
                .isInstanceOf(CancellationException.class);
        assertThat(polls.get()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should reject an ordering built for another series")
    void shouldRejectMismatchedOrdering() {
        DiscordSearchEngine engine = new DiscordSearchEngine(new SubsequenceDistance(SPIKE, 3));

        assertThatThrownBy(() -> engine.search(new BruteForceOrdering(9, 4)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windows of length");
    }
}
