/**
 * Utility package for LeagueRow.
 *
 * <p>
 * Provides stateless helpers used across the parsers: line splitting and case normalization,
 * month and day-name lookup, two-digit year expansion, the {@code 04:00 UTC} date anchor, and the
 * fatal-error reporter used by the command-line host.
 * </p>
 */
package io.github.yok.leaguerow.util;
