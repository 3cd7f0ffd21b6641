/**
 * Symbolic discretization of time-series windows.
 *
 * <ul>
 * <li>{@link com.discordsentinel.core.sax.ZNormalizer} — zero mean, unit
 * variance</li>
 * <li>{@link com.discordsentinel.core.sax.Paa} — segment averaging</li>
 * <li>{@link com.discordsentinel.core.sax.GaussianBreakpoints} — equiprobable
 * cut points of the standard normal distribution</li>
 * <li>{@link com.discordsentinel.core.sax.SaxEncoder} — window to SAX
 * word</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.discordsentinel.core.sax;
