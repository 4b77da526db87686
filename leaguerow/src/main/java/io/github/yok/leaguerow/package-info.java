/**
 * Root package of LeagueRow.
 *
 * <p>
 * Converts free-text sports-league registration rows into a canonical product payload, listing the
 * fields that could not be derived with confidence so an operator can fill them in.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.leaguerow.config}: command-line host settings</li>
 * <li>{@code io.github.yok.leaguerow.core}: row orchestration and unresolved-field tracking</li>
 * <li>{@code io.github.yok.leaguerow.parser}: field parsers for each spreadsheet column</li>
 * <li>{@code io.github.yok.leaguerow.model}: payload and parser result types</li>
 * <li>{@code io.github.yok.leaguerow.util}: text and calendar helpers, fatal-error reporting</li>
 * </ul>
 */
package io.github.yok.leaguerow;
