package com.discordsentinel.core.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SqueezerClusterer}.
 */
class SqueezerClustererTest {

    private static final String[] WORDS = {"aaa", "aaa", "aab", "ccc"};

    @Test
    @DisplayName("Should merge a word into a cluster that is similar enough")
    void shouldMergeSimilarWords() {
        // sim(aab, {aaa, aaa}) = (1 + 1 + 0) / 3
        List<SqueezerClusterer.Cluster> clusters =
                new SqueezerClusterer(0.6).cluster(SaxTrie.of(WORDS).groups());

        assertThat(clusters).hasSize(2);
        assertThat(clusters.get(0).getWords()).containsExactly("aaa", "aab");
        assertThat(clusters.get(0).getPositions()).containsExactly(0, 1, 2);
        assertThat(clusters.get(1).getWords()).containsExactly("ccc");
    }

    @Test
    @DisplayName("Should keep a word apart when similarity is below the threshold")
    void shouldNotMergeBelowThreshold() {
        List<SqueezerClusterer.Cluster> clusters =
                new SqueezerClusterer(0.7).cluster(SaxTrie.of(WORDS).groups());

        assertThat(clusters).hasSize(3);
    }

    @Test
    @DisplayName("Should reproduce plain word groups at threshold 1")
    void shouldKeepDistinctWordsAtThresholdOne() {
        String[] words = {"ab", "ba", "ab", "bb", "ba", "aa"};

        List<SqueezerClusterer.Cluster> clusters =
                new SqueezerClusterer(1.0).cluster(SaxTrie.of(words).groups());

        assertThat(clusters).extracting(SqueezerClusterer.Cluster::getWords)
                .containsExactly(List.of("ab"), List.of("ba"), List.of("bb"), List.of("aa"));
    }

    @Test
    @DisplayName("Should merge everything into one cluster at threshold 0")
    void shouldMergeAllAtThresholdZero() {
        List<SqueezerClusterer.Cluster> clusters =
                new SqueezerClusterer(0.0).cluster(SaxTrie.of(WORDS).groups());

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).size()).isEqualTo(WORDS.length);
    }

    @Test
    @DisplayName("Should feed clusters into a candidate index")
    void shouldBuildIndexFromClusters() {
        List<SqueezerClusterer.Cluster> clusters =
                new SqueezerClusterer(0.6).cluster(SaxTrie.of(WORDS).groups());

        CandidateIndex index = CandidateIndex.fromClusters(clusters, 1, 0L);

        assertThat(index.outerOrder()).containsExactly(3, 0, 1, 2);
    }

    @ParameterizedTest(name = "threshold {0}")
    @ValueSource(doubles = {-0.1, 1.1, Double.NaN})
    @DisplayName("Should reject thresholds outside [0, 1]")
    void shouldRejectInvalidThreshold(double threshold) {
        assertThatThrownBy(() -> new SqueezerClusterer(threshold))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threshold");
    }
}
