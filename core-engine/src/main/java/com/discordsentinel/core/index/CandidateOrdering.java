package com.discordsentinel.core.index;

import java.util.PrimitiveIterator;

/**
 * Visiting orders consumed by the discord search.
 *
 * <p>
 * The outer order decides which start positions are tried as discord
 * candidates first; the inner order decides, for one candidate, in which
 * order its potential nearest neighbours are compared. Orders only affect how
 * quickly the search prunes, never its result.
 * </p>
 *
 * <p>
 * Positions are relative to the searched range, {@code 0 .. count - 1}.
 * </p>
 *
 * @since 1.0.0
 */
public interface CandidateOrdering {

    /**
     * Every start position exactly once, in the order the search should try
     * them as discord candidates.
     *
     * @return the outer order
     */
    int[] outerOrder();

    /**
     * Neighbour positions for one candidate. Never yields a position whose
     * window overlaps the candidate's window.
     *
     * @param position the candidate start position
     * @return a fresh iterator over the inner order
     */
    PrimitiveIterator.OfInt innerOrder(int position);

    /**
     * @return the window length the ordering was built for
     */
    int windowLength();

    /**
     * @return number of start positions covered
     */
    int positionCount();
}
