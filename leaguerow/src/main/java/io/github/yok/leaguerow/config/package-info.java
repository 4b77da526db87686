/**
 * Configuration model package for LeagueRow.
 *
 * <p>
 * Holds the values the command-line host binds from {@code application.yml}. The parsing engine
 * itself takes no configuration beyond the {@code Clock} built here.
 * </p>
 */
package io.github.yok.leaguerow.config;
