/**
 * JSON rendering of discord reports.
 *
 * @since 1.0.0
 */
package com.discordsentinel.core.report;
