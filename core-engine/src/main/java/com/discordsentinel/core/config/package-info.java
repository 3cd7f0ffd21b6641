/**
 * Named discord queries read from YAML.
 *
 * <p>
 * {@link com.discordsentinel.core.config.ConfigLoader} binds a file, a
 * classpath resource or an inline document to a
 * {@link com.discordsentinel.core.config.DiscordConfig} and validates it
 * before returning.
 * </p>
 *
 * @since 1.0.0
 */
package com.discordsentinel.core.config;
