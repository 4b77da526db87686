package io.github.yok.leaguerow.parser;

import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.Season;
import io.github.yok.leaguerow.model.SeasonDates;
import io.github.yok.leaguerow.util.CalendarUtil;
import java.time.Instant;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses the season start and end columns and derives the season and year from the start date.
 *
 * <p>
 * The start and end are resolved independently: a valid start resolves {@code seasonStartDate},
 * {@code season} and {@code year} even when the end date is missing, and a valid end resolves
 * {@code seasonEndDate} on its own. Nothing is guessed for an invalid input.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class SeasonDateParser {

    private final FlexibleDateParser dateParser;

    /**
     * Parses a start/end pair.
     *
     * @param rawStart season start text (column D)
     * @param rawEnd season end text (column E)
     * @param unresolved tracker for the current row
     * @return parsed anchors with derived season and year; components are {@code null} when
     *         unparseable
     */
    public SeasonDates parse(String rawStart, String rawEnd, UnresolvedFields unresolved) {
        Instant start = dateParser.parseDate(rawStart);
        Instant end = dateParser.parseDate(rawEnd);

        Season season = null;
        Integer year = null;
        if (start != null) {
            LocalDate startDate = CalendarUtil.dateOf(start);
            season = Season.ofMonth(startDate.getMonthValue());
            year = startDate.getYear();
            unresolved.resolve(LeagueField.SEASON_START_DATE);
            unresolved.resolve(LeagueField.SEASON);
            unresolved.resolve(LeagueField.YEAR);
        } else {
            log.debug("Season start '{}' could not be parsed", rawStart);
        }
        if (end != null) {
            unresolved.resolve(LeagueField.SEASON_END_DATE);
        } else {
            log.debug("Season end '{}' could not be parsed", rawEnd);
        }
        return new SeasonDates(start, end, season, year);
    }
}
