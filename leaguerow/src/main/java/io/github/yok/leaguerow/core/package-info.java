/**
 * Core package for LeagueRow.
 *
 * <p>
 * Hosts the row orchestrator ({@code RowParser}), the per-row unresolved-field tracker and the
 * sport relevance matrix that seeds it, the spreadsheet column definitions, and the JSON row-file
 * loader used by the command-line host.
 * </p>
 *
 * <p>
 * Field-level parsing is implemented in {@code parser}; this package only composes it.
 * </p>
 */
package io.github.yok.leaguerow.core;
