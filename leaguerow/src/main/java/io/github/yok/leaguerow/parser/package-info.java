/**
 * Field parser package for LeagueRow.
 *
 * <p>
 * Each parser reads one or more spreadsheet cells, returns a typed value (or {@code null} when the
 * text carries no confident value), and resolves the payload fields it filled on the caller's
 * {@code UnresolvedFields}. Malformed cell content never raises an exception.
 * </p>
 *
 * <p>
 * Date and time primitives live in {@code FlexibleDateParser} and are shared by the season,
 * notes and registration-window parsers. The details column is read by {@code FlagsParser} through
 * a pipeline of {@code DetailsRule}s over immutable {@code CandidateLines}.
 * </p>
 */
package io.github.yok.leaguerow.parser;
