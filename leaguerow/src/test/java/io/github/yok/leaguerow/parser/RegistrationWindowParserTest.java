package io.github.yok.leaguerow.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.RegistrationWindows;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RegistrationWindowParserTest {

    private RegistrationWindowParser parser;
    private UnresolvedFields unresolved;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2025-09-01T16:00:00Z"),
                ZoneId.of("America/New_York"));
        parser = new RegistrationWindowParser(new FlexibleDateParser(clock));
        unresolved = UnresolvedFields.of(LeagueField.EARLY_REGISTRATION_START_DATE_TIME,
                LeagueField.VET_REGISTRATION_START_DATE_TIME,
                LeagueField.OPEN_REGISTRATION_START_DATE_TIME,
                LeagueField.NUMBER_VET_SPOTS_TO_RELEASE_AT_GO_LIVE);
    }

    @Test
    void parse_正常ケース_3つの登録開始日時が解析されること() {
        RegistrationWindows windows = parser.parse("Weds, Sept. 3rd, 6pm",
                "Tues, Sept. 2nd, 7pm", "Thurs, Sept. 4th, 6pm", null, null, unresolved);

        assertEquals(Instant.parse("2025-09-03T22:00:00Z"),
                windows.getEarlyRegistrationStartDateTime());
        assertEquals(Instant.parse("2025-09-02T23:00:00Z"),
                windows.getVetRegistrationStartDateTime());
        assertEquals(Instant.parse("2025-09-04T22:00:00Z"),
                windows.getOpenRegistrationStartDateTime());
        assertNull(windows.getNumberVetSpotsToReleaseAtGoLive());
        assertEquals(1, unresolved.size());
        assertTrue(unresolved.contains(LeagueField.NUMBER_VET_SPOTS_TO_RELEASE_AT_GO_LIVE));
    }

    @Test
    void parse_正常ケース_退役者列の人数が優先されること() {
        RegistrationWindows windows = parser.parse("", "Sept 17th 7PM\n20 spots", "", 10, 72,
                unresolved);

        assertEquals(20, windows.getNumberVetSpotsToReleaseAtGoLive());
        assertEquals(Instant.parse("2025-09-17T23:00:00Z"),
                windows.getVetRegistrationStartDateTime());
        assertNull(windows.getEarlyRegistrationStartDateTime());
        assertNull(windows.getOpenRegistrationStartDateTime());
    }

    @Test
    void parse_正常ケース_人数がない場合は備考の枠数_定員の順に補完されること() {
        assertEquals(10, parser.parse("", "Sept 17th 7PM", "", 10, 72, unresolved)
                .getNumberVetSpotsToReleaseAtGoLive());
        assertEquals(72, parser.parse("", "Sept 17th 7PM", "", null, 72, unresolved)
                .getNumberVetSpotsToReleaseAtGoLive());
    }

    @Test
    void parse_異常ケース_空の列は未解決のまま残ること() {
        RegistrationWindows windows = parser.parse("", null, "  ", null, null, unresolved);

        assertNull(windows.getEarlyRegistrationStartDateTime());
        assertNull(windows.getVetRegistrationStartDateTime());
        assertNull(windows.getOpenRegistrationStartDateTime());
        assertEquals(4, unresolved.size());
    }

    @Test
    void parseStart_正常ケース_見出しと期限句が除去されて解析されること() {
        assertEquals(Instant.parse("2025-09-17T23:00:00Z"),
                parser.parseStart("Veteran registration: Sept 17th 7PM"));
        assertEquals(Instant.parse("2025-09-04T22:00:00Z"),
                parser.parseStart("Open Registration starts 9/4 at 6pm through 9/10"));
    }

    @Test
    void stripBoilerplate_正常ケース_日時部分のみが残ること() {
        assertEquals("9/4 at 6pm",
                parser.stripBoilerplate("Open Registration starts 9/4 at 6pm through 9/10"));
        assertEquals("9/3 6pm", parser.stripBoilerplate("Early Registration: 9/3 6pm until 9/5"));
        assertEquals("Sept 18th 7PM", parser.stripBoilerplate("Sept 18th 7PM"));
    }

    @Test
    void vetSpotCount_正常ケース_キーワード付近の数値が読まれること() {
        assertEquals(20, parser.vetSpotCount("Sept 17th 7PM\n20 spots"));
        assertEquals(15, parser.vetSpotCount("Vet spots: 15"));
        assertEquals(30, parser.vetSpotCount("inventory 30"));
    }

    @Test
    void vetSpotCount_異常ケース_日付や時刻の数値は人数とみなさないこと() {
        assertNull(parser.vetSpotCount("Veteran registration: Sept 17th 7PM"));
        assertNull(parser.vetSpotCount("Vet: 9/2 at 7pm"));
        assertNull(parser.vetSpotCount(""));
    }

    @Test
    void vetSpotCount_異常ケース_ハイフン区切りの日付は人数とみなさないこと() {
        assertNull(parser.vetSpotCount("Vets: 9-2-25 7pm"));
        assertNull(parser.vetSpotCount("Opens 9-2-25 vets only"));
        assertEquals(12, parser.vetSpotCount("Vets: 9-2-25 7pm, 12 spots"));
    }

    @Test
    void parse_異常ケース_ハイフン区切りの日付のみの退役者列は人数が未解決のまま残ること() {
        RegistrationWindows windows =
                parser.parse("", "Vets: 9-2-25 7pm", "", null, null, unresolved);

        assertEquals(Instant.parse("2025-09-02T23:00:00Z"),
                windows.getVetRegistrationStartDateTime());
        assertNull(windows.getNumberVetSpotsToReleaseAtGoLive());
        assertTrue(unresolved.contains(LeagueField.NUMBER_VET_SPOTS_TO_RELEASE_AT_GO_LIVE));
    }
}
