package com.discordsentinel.core.index;

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Identity ordering: candidates and neighbours in ascending position order.
 *
 * <p>
 * Used as the reference search. It prunes poorly but its result is the
 * ground truth the heuristic orderings must reproduce.
 * </p>
 *
 * @since 1.0.0
 */
public class BruteForceOrdering implements CandidateOrdering {

    private final int positionCount;
    private final int windowLength;

    /**
     * @param positionCount number of start positions
     * @param windowLength  window length used for the exclusion zone
     */
    public BruteForceOrdering(int positionCount, int windowLength) {
        if (positionCount < 0) {
            throw new IllegalArgumentException("positionCount must be >= 0, got: " + positionCount);
        }
        if (windowLength < 1) {
            throw new IllegalArgumentException("windowLength must be >= 1, got: " + windowLength);
        }
        this.positionCount = positionCount;
        this.windowLength = windowLength;
    }

    @Override
    public int[] outerOrder() {
        int[] order = new int[positionCount];
        for (int i = 0; i < positionCount; i++) {
            order[i] = i;
        }
        return order;
    }

    @Override
    public PrimitiveIterator.OfInt innerOrder(int position) {
        return new PrimitiveIterator.OfInt() {
            private int next = advance(0);

            private int advance(int from) {
                int q = from;
                while (q < positionCount && ExclusionZone.overlaps(position, q, windowLength)) {
                    q++;
                }
                return q;
            }

            @Override
            public boolean hasNext() {
                return next < positionCount;
            }

            @Override
            public int nextInt() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int current = next;
                next = advance(current + 1);
                return current;
            }
        };
    }

    @Override
    public int windowLength() {
        return windowLength;
    }

    @Override
    public int positionCount() {
        return positionCount;
    }
}
