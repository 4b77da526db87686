package io.github.yok.leaguerow.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.NotesInfo;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotesParserTest {

    private NotesParser parser;
    private UnresolvedFields unresolved;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2025-09-01T16:00:00Z"),
                ZoneId.of("America/New_York"));
        parser = new NotesParser(new FlexibleDateParser(clock));
        unresolved = UnresolvedFields.of(LeagueField.NEW_PLAYER_ORIENTATION_DATE_TIME,
                LeagueField.SCOUT_NIGHT_DATE_TIME, LeagueField.OPENING_PARTY_DATE,
                LeagueField.CLOSING_PARTY_DATE, LeagueField.RAIN_DATE, LeagueField.OFF_DATES,
                LeagueField.TOTAL_INVENTORY);
    }

    @Test
    void parse_正常ケース_説明会日と休止日が抽出されること() {
        NotesInfo info = parser.parse("Newbie Night/Open Play - 10/6/25\n\n"
                + "No games on Indigenous Peoples Day 10/13", unresolved);

        assertEquals(Instant.parse("2025-10-06T04:00:00Z"),
                info.getNewPlayerOrientationDateTime());
        assertEquals(List.of(Instant.parse("2025-10-13T04:00:00Z")), info.getOffDates());
        assertFalse(unresolved.contains(LeagueField.NEW_PLAYER_ORIENTATION_DATE_TIME));
        assertFalse(unresolved.contains(LeagueField.OFF_DATES));
        assertTrue(unresolved.contains(LeagueField.TOTAL_INVENTORY));
    }

    @Test
    void parse_正常ケース_週数と休止日と定員が抽出されること() {
        NotesInfo info = parser.parse(
                "Total # of Weeks: 8\nSkipping 11/9 and 11/30\n# of Players: 72", unresolved);

        assertEquals(8, info.getWeekCount());
        assertEquals(72, info.getTotalInventory());
        assertEquals(List.of(Instant.parse("2025-11-09T04:00:00Z"),
                Instant.parse("2025-11-30T04:00:00Z")), info.getOffDates());
        assertFalse(unresolved.contains(LeagueField.TOTAL_INVENTORY));
    }

    @Test
    void parse_正常ケース_人数の範囲は上限が定員になること() {
        NotesInfo info = parser.parse(
                "2 sessions; 350-364 players, 50-52 teams, 7 players max\n"
                        + "NOTE: SKIPPING 11/9 for Veterans Day",
                unresolved);

        assertEquals(364, info.getTotalInventory());
        assertEquals(List.of(Instant.parse("2025-11-09T04:00:00Z")), info.getOffDates());
        assertNull(info.getWeekCount());
    }

    @Test
    void parse_正常ケース_各イベント日が抽出されること() {
        NotesInfo info = parser.parse("Opening Party: 10/4 at Gotham\n"
                + "Scout Night Sept 30th 7pm\nRain Date: 12/14\nClosing Party 12/13\n"
                + "20 vet spots", unresolved);

        assertEquals(Instant.parse("2025-10-04T04:00:00Z"), info.getOpeningPartyDate());
        // スカウトナイトは時刻も読まれる
        assertEquals(Instant.parse("2025-09-30T23:00:00Z"), info.getScoutNightDateTime());
        assertEquals(Instant.parse("2025-12-14T04:00:00Z"), info.getRainDate());
        assertEquals(Instant.parse("2025-12-13T04:00:00Z"), info.getClosingPartyDate());
        assertEquals(20, info.getVetSpots());
        // イベント行の日付は休止日に含まれない
        assertTrue(info.getOffDates().isEmpty());
        assertTrue(unresolved.contains(LeagueField.OFF_DATES));
        assertFalse(unresolved.contains(LeagueField.RAIN_DATE));
    }

    @Test
    void parse_異常ケース_TBDなどのプレースホルダは未解決のまま残ること() {
        NotesInfo info = parser.parse("Rain Date: TBD\nOrientation: n/a", unresolved);

        assertNull(info.getRainDate());
        assertNull(info.getNewPlayerOrientationDateTime());
        assertTrue(unresolved.contains(LeagueField.RAIN_DATE));
        assertTrue(unresolved.contains(LeagueField.NEW_PLAYER_ORIENTATION_DATE_TIME));
    }

    @Test
    void parse_正常ケース_休止日は重複なく昇順になること() {
        NotesInfo info =
                parser.parse("Skipping 11/30 and 11/9\nNo league 11/9\nskip 1/5", unresolved);

        assertEquals(List.of(Instant.parse("2025-11-09T04:00:00Z"),
                Instant.parse("2025-11-30T04:00:00Z"), Instant.parse("2026-01-05T04:00:00Z")),
                info.getOffDates());
    }

    @Test
    void parse_正常ケース_同じイベントは最初の行が採用されること() {
        NotesInfo info = parser.parse("Rain date 12/14\nRain date 12/21", unresolved);
        assertEquals(Instant.parse("2025-12-14T04:00:00Z"), info.getRainDate());
    }

    @Test
    void parse_異常ケース_空の備考は空の結果が返ること() {
        NotesInfo info = parser.parse(null, unresolved);

        assertTrue(info.getOffDates().isEmpty());
        assertNull(info.getWeekCount());
        assertNull(info.getTotalInventory());
        assertNull(info.getVetSpots());
        assertEquals(7, unresolved.size());
    }

    @Test
    void weekCount_正常ケース_合計週数が単純な週数より優先されること() {
        assertEquals(10, parser.weekCount("8 weeks of play\nTotal # of Weeks: 10"));
        assertEquals(8, parser.weekCount("8 weeks of play"));
        assertNull(parser.weekCount("weekly"));
    }

    @Test
    void totalInventory_正常ケース_maxが続く人数は定員とみなさないこと() {
        assertEquals(40, parser.totalInventory("40 players"));
        assertNull(parser.totalInventory("7 players max"));
    }

    @Test
    void vetSpots_正常ケース_前置と後置のどちらの書式も読まれること() {
        assertEquals(20, parser.vetSpots("Holding 20 vet spots"));
        assertEquals(15, parser.vetSpots("vet spots: 15"));
        assertNull(parser.vetSpots("Veterans get early access"));
    }

    @Test
    void parse_正常ケース_イベント行に書かれた休止日も抽出されること() {
        NotesInfo info = parser.parse("Opening party 9/20, no games 10/13", unresolved);

        assertEquals(Instant.parse("2025-09-20T04:00:00Z"), info.getOpeningPartyDate());
        // イベント自身の日付は休止日に含まれない
        assertEquals(List.of(Instant.parse("2025-10-13T04:00:00Z")), info.getOffDates());
        assertFalse(unresolved.contains(LeagueField.OFF_DATES));
    }

    @Test
    void parse_正常ケース_休止日の後ろのイベント日は休止日に含まれないこと() {
        NotesInfo info = parser.parse("No games 11/27, closing party 12/13", unresolved);

        assertEquals(Instant.parse("2025-12-13T04:00:00Z"), info.getClosingPartyDate());
        assertEquals(List.of(Instant.parse("2025-11-27T04:00:00Z")), info.getOffDates());
    }

    @Test
    void parse_異常ケース_キックオフの日付は休止日とみなさないこと() {
        NotesInfo info = parser.parse("Kick off party 9/20\nKick-off 9/21", unresolved);

        assertTrue(info.getOffDates().isEmpty());
        assertTrue(unresolved.contains(LeagueField.OFF_DATES));
    }

    @Test
    void parse_正常ケース_offを含む休止表記は休止日になること() {
        NotesInfo info = parser.parse("Week off 10/13\nOff: 11/27", unresolved);

        assertEquals(List.of(Instant.parse("2025-10-13T04:00:00Z"),
                Instant.parse("2025-11-27T04:00:00Z")), info.getOffDates());
    }

    @Test
    void parse_正常ケース_説明会の時間帯は開始時刻が使われること() {
        NotesInfo info = parser.parse("Newbie Night 10/6 7-9pm", unresolved);

        // 19:00(東部夏時間)
        assertEquals(Instant.parse("2025-10-06T23:00:00Z"),
                info.getNewPlayerOrientationDateTime());
    }

    @Test
    void offDatesBesideEvent_異常ケース_休止表記がないイベント行は空が返ること() {
        assertTrue(parser.offDatesBesideEvent("Opening Party: 10/4 at Gotham").isEmpty());
    }
}
