/**
 * Domain model classes for Discord Sentinel.
 *
 * <ul>
 * <li>{@link com.discordsentinel.core.model.DiscordQuery} — validated search
 * parameters, also the YAML configuration POJO</li>
 * <li>{@link com.discordsentinel.core.model.SearchMode} — candidate ordering
 * strategy</li>
 * <li>{@link com.discordsentinel.core.model.Discord} — search result</li>
 * <li>{@link com.discordsentinel.core.model.DiscordReport} — serializable
 * report of a configured query</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.discordsentinel.core.model;
