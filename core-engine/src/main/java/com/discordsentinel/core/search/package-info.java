/**
 * Discord search.
 *
 * <p>
 * {@link com.discordsentinel.core.search.DiscordFinder} is the public entry
 * point. It builds a candidate ordering through
 * {@link com.discordsentinel.core.search.OrderingFactory} and runs the
 * best-first search of
 * {@link com.discordsentinel.core.search.DiscordSearchEngine} over exact
 * z-normalized Euclidean distances
 * ({@link com.discordsentinel.core.search.SubsequenceDistance}).
 * </p>
 *
 * @since 1.0.0
 */
package com.discordsentinel.core.search;
