package com.discordsentinel.core.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Squeezer clustering of SAX word groups.
 *
 * <p>
 * Every letter slot of a word is treated as a categorical attribute. The
 * similarity of a word {@code s} to a cluster {@code C} is
 * </p>
 *
 * <pre>
 *   sim(C, s) = (1 / w) * Σ<sub>i</sub> count<sub>C</sub>(i, s<sub>i</sub>) / |C|
 * </pre>
 *
 * <p>
 * i.e. the average, over letter slots, of the share of the cluster's
 * positions carrying the same letter in that slot. Groups are visited once,
 * in the order given. A group joins the most similar existing cluster (the
 * earliest one on ties) when that similarity reaches the threshold, and
 * starts a new cluster otherwise.
 * </p>
 *
 * <p>
 * With a threshold of {@code 1.0} only identical words merge, which
 * reproduces the plain word grouping. Lower thresholds merge shape-similar
 * words into fewer, larger clusters.
 * </p>
 *
 * @since 1.0.0
 */
public final class SqueezerClusterer {

    private static final Logger LOG = LoggerFactory.getLogger(SqueezerClusterer.class);

    private static final int LETTERS = 26;

    private final double threshold;

    /**
     * @param threshold minimum similarity for a group to join a cluster, in
     *                  {@code [0, 1]}
     * @throws IllegalArgumentException if the threshold is out of range
     */
    public SqueezerClusterer(double threshold) {
        if (!(threshold >= 0 && threshold <= 1)) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * A set of merged word groups.
     */
    public static final class Cluster {
        private final List<String> words = new ArrayList<>();
        private final List<Integer> positions = new ArrayList<>();
        private final int[][] counts;

        private Cluster(int wordLength) {
            this.counts = new int[wordLength][LETTERS];
        }

        private void absorb(WordGroup group) {
            String word = group.getWord();
            int k = group.size();
            for (int i = 0; i < counts.length; i++) {
                counts[i][word.charAt(i) - 'a'] += k;
            }
            words.add(word);
            positions.addAll(group.getPositions());
        }

        private double similarity(String word) {
            double total = 0;
            for (int i = 0; i < counts.length; i++) {
                total += (double) counts[i][word.charAt(i) - 'a'] / positions.size();
            }
            return total / counts.length;
        }

        /**
         * @return words merged into this cluster, in merge order
         */
        public List<String> getWords() {
            return Collections.unmodifiableList(words);
        }

        /**
         * @return positions of every merged group, in merge order
         */
        public List<Integer> getPositions() {
            return Collections.unmodifiableList(positions);
        }

        public int size() {
            return positions.size();
        }

        int[] toArray() {
            return positions.stream().mapToInt(Integer::intValue).sorted().toArray();
        }

        @Override
        public String toString() {
            return "Cluster{words=" + words + ", size=" + positions.size() + '}';
        }
    }

    /**
     * Cluster the groups of a trie.
     *
     * @param groups word groups, all words of equal length
     * @return the clusters, in creation order
     */
    public List<Cluster> cluster(List<WordGroup> groups) {
        Objects.requireNonNull(groups, "Groups must not be null");
        List<Cluster> clusters = new ArrayList<>();

        for (WordGroup group : groups) {
            String word = group.getWord();
            Cluster best = null;
            double bestSimilarity = -1;
            for (Cluster candidate : clusters) {
                double similarity = candidate.similarity(word);
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    best = candidate;
                }
            }

            if (best == null || bestSimilarity < threshold) {
                best = new Cluster(word.length());
                clusters.add(best);
            }
            best.absorb(group);
        }

        LOG.debug("Squeezer merged {} word group(s) into {} cluster(s) at threshold {}",
                groups.size(), clusters.size(), threshold);
        return clusters;
    }

    public double getThreshold() {
        return threshold;
    }
}
