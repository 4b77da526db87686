package io.github.yok.leaguerow.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.Season;
import io.github.yok.leaguerow.model.SeasonDates;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SeasonDateParserTest {

    private SeasonDateParser parser;
    private UnresolvedFields unresolved;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2025-09-01T16:00:00Z"),
                ZoneId.of("America/New_York"));
        parser = new SeasonDateParser(new FlexibleDateParser(clock));
        unresolved = UnresolvedFields.of(LeagueField.SEASON_START_DATE,
                LeagueField.SEASON_END_DATE, LeagueField.SEASON, LeagueField.YEAR);
    }

    @Test
    void parse_正常ケース_開始日から季節と年が導出されること() {
        SeasonDates dates = parser.parse("10/15/25", "12/10/25", unresolved);

        assertEquals(Instant.parse("2025-10-15T04:00:00Z"), dates.getSeasonStartDate());
        assertEquals(Instant.parse("2025-12-10T04:00:00Z"), dates.getSeasonEndDate());
        assertEquals(Season.FALL, dates.getSeason());
        assertEquals(2025, dates.getYear());
        assertTrue(unresolved.isEmpty());
    }

    @Test
    void parse_正常ケース_冬開始は開始日の年が使われること() {
        SeasonDates dates = parser.parse("1/8/26", "3/12/26", unresolved);
        assertEquals(Season.WINTER, dates.getSeason());
        assertEquals(2026, dates.getYear());
    }

    @Test
    void parse_異常ケース_空の日付は未解決のまま残ること() {
        SeasonDates dates = parser.parse("", "", unresolved);

        assertNull(dates.getSeasonStartDate());
        assertNull(dates.getSeasonEndDate());
        assertNull(dates.getSeason());
        assertNull(dates.getYear());
        assertEquals(4, unresolved.size());
    }

    @Test
    void parse_正常ケース_開始と終了は独立して解決されること() {
        SeasonDates dates = parser.parse("TBD", "Dec 7", unresolved);

        assertNull(dates.getSeasonStartDate());
        assertEquals(Instant.parse("2025-12-07T04:00:00Z"), dates.getSeasonEndDate());
        assertFalse(unresolved.contains(LeagueField.SEASON_END_DATE));
        assertTrue(unresolved.contains(LeagueField.SEASON_START_DATE));
        assertTrue(unresolved.contains(LeagueField.SEASON));
        assertTrue(unresolved.contains(LeagueField.YEAR));
    }
}
