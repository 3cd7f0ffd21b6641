/**
 * Candidate orderings for the discord search.
 *
 * <p>
 * A {@link com.discordsentinel.core.index.CandidateOrdering} tells the search
 * which windows to try first and, per window, which neighbours to compare
 * first. Implementations:
 * </p>
 * <ul>
 * <li>{@link com.discordsentinel.core.index.BruteForceOrdering} — ascending
 * positions</li>
 * <li>{@link com.discordsentinel.core.index.CandidateIndex} — rare SAX words
 * first, same-word neighbours first; built either from a
 * {@link com.discordsentinel.core.index.SaxTrie} or from the clusters of a
 * {@link com.discordsentinel.core.index.SqueezerClusterer}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.discordsentinel.core.index;
