/**
 * Data model for LeagueRow.
 *
 * <p>
 * Holds the canonical payload handed to product creation, the typed results each parser returns,
 * and the enumerations (sports, divisions, seasons, venues, payload fields) the parsers map free
 * text onto.
 * </p>
 */
package io.github.yok.leaguerow.model;
