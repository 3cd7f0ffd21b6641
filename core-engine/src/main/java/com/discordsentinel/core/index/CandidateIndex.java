package com.discordsentinel.core.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.Random;

/**
 * Frequency-driven candidate ordering over groups of coarsely similar
 * windows.
 *
 * <h3>Outer order</h3>
 * <p>
 * Positions sorted by ascending size of their group, ties by ascending
 * position. Windows with globally rare shapes are tried first, so the best
 * known discord distance rises early and later candidates abandon sooner.
 * </p>
 *
 * <h3>Inner order</h3>
 * <p>
 * For a candidate {@code p}: the other members of {@code p}'s group in
 * ascending order, then every remaining position in a pseudo-random order.
 * The permutation is drawn once from {@code new Random(seed)} when the index
 * is built, so a given seed always yields the same orders. Positions whose
 * window overlaps {@code p}'s are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class CandidateIndex implements CandidateOrdering {

    private final int[][] groups;
    private final int[] groupOf;
    private final int[] outerOrder;
    private final int[] permutation;
    private final int windowLength;

    /**
     * @param groups       disjoint groups covering every position
     *                     {@code 0 .. positionCount - 1} exactly once, each
     *                     sorted ascending
     * @param windowLength window length used for the exclusion zone
     * @param seed         seed of the inner-order permutation
     * @throws IllegalArgumentException if the groups are not a partition of
     *                                  the positions
     */
    public CandidateIndex(List<int[]> groups, int windowLength, long seed) {
        Objects.requireNonNull(groups, "Groups must not be null");
        if (windowLength < 1) {
            throw new IllegalArgumentException("windowLength must be >= 1, got: " + windowLength);
        }
        this.windowLength = windowLength;
        this.groups = groups.toArray(new int[0][]);

        int positionCount = 0;
        for (int[] group : this.groups) {
            positionCount += group.length;
        }

        this.groupOf = new int[positionCount];
        Arrays.fill(groupOf, -1);
        for (int g = 0; g < this.groups.length; g++) {
            for (int position : this.groups[g]) {
                if (position < 0 || position >= positionCount || groupOf[position] >= 0) {
                    throw new IllegalArgumentException(
                            "Groups must partition positions 0.." + (positionCount - 1)
                                    + ", offending position: " + position);
                }
                groupOf[position] = g;
            }
        }

        this.outerOrder = sortByGroupSize(positionCount);
        this.permutation = shuffledPositions(positionCount, new Random(seed));
    }

    /**
     * Index with one group per distinct SAX word.
     *
     * @param trie         words of every start position
     * @param windowLength window length
     * @param seed         seed of the inner-order permutation
     * @return the index
     */
    public static CandidateIndex fromWordGroups(SaxTrie trie, int windowLength, long seed) {
        Objects.requireNonNull(trie, "Trie must not be null");
        List<int[]> groups = new ArrayList<>();
        for (WordGroup group : trie.groups()) {
            groups.add(group.toArray());
        }
        return new CandidateIndex(groups, windowLength, seed);
    }

    /**
     * Index with one group per Squeezer cluster.
     *
     * @param clusters     clusters covering every start position
     * @param windowLength window length
     * @param seed         seed of the inner-order permutation
     * @return the index
     */
    public static CandidateIndex fromClusters(List<SqueezerClusterer.Cluster> clusters,
            int windowLength, long seed) {
        Objects.requireNonNull(clusters, "Clusters must not be null");
        List<int[]> groups = new ArrayList<>();
        for (SqueezerClusterer.Cluster cluster : clusters) {
            groups.add(cluster.toArray());
        }
        return new CandidateIndex(groups, windowLength, seed);
    }

    @Override
    public int[] outerOrder() {
        return outerOrder.clone();
    }

    @Override
    public PrimitiveIterator.OfInt innerOrder(int position) {
        if (position < 0 || position >= groupOf.length) {
            throw new IllegalArgumentException("Unknown position: " + position);
        }
        return new InnerIterator(position);
    }

    @Override
    public int windowLength() {
        return windowLength;
    }

    @Override
    public int positionCount() {
        return groupOf.length;
    }

    /**
     * @return number of groups
     */
    public int groupCount() {
        return groups.length;
    }

    /**
     * @return size of the group holding {@code position}
     */
    public int groupSize(int position) {
        return groups[groupOf[position]].length;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private int[] sortByGroupSize(int positionCount) {
        // (group size, position) packed so a primitive sort gives the outer order
        long[] keys = new long[positionCount];
        for (int p = 0; p < positionCount; p++) {
            keys[p] = ((long) groups[groupOf[p]].length << 32) | p;
        }
        Arrays.sort(keys);

        int[] order = new int[positionCount];
        for (int i = 0; i < positionCount; i++) {
            order[i] = (int) keys[i];
        }
        return order;
    }

    private static int[] shuffledPositions(int positionCount, Random random) {
        int[] positions = new int[positionCount];
        for (int i = 0; i < positionCount; i++) {
            positions[i] = i;
        }
        for (int i = positionCount - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = positions[i];
            positions[i] = positions[j];
            positions[j] = tmp;
        }
        return positions;
    }

    /**
     * Same-group members first, then the shared permutation minus the
     * candidate's group.
     */
    private final class InnerIterator implements PrimitiveIterator.OfInt {
        private final int position;
        private final int group;
        private final int[] members;
        private int memberCursor;
        private int permutationCursor;
        private int next;

        private InnerIterator(int position) {
            this.position = position;
            this.group = groupOf[position];
            this.members = groups[group];
            this.next = advance();
        }

        private int advance() {
            while (memberCursor < members.length) {
                int q = members[memberCursor++];
                if (!ExclusionZone.overlaps(position, q, windowLength)) {
                    return q;
                }
            }
            while (permutationCursor < permutation.length) {
                int q = permutation[permutationCursor++];
                if (groupOf[q] != group && !ExclusionZone.overlaps(position, q, windowLength)) {
                    return q;
                }
            }
            return -1;
        }

        @Override
        public boolean hasNext() {
            return next >= 0;
        }

        @Override
        public int nextInt() {
            if (next < 0) {
                throw new NoSuchElementException();
            }
            int current = next;
            next = advance();
            return current;
        }
    }
}
