package io.github.yok.leaguerow.model;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class LocationTest {

    @Test
    void matches_正常ケース_別名が大文字小文字を問わず一致すること() {
        assertTrue(Location.HARTLEY_HOUSE.matches("Hartley House\n413 W 46th Street"));
        assertTrue(Location.PS3_CHARRETTE.matches("PS 3 (Charrette)"));
        assertTrue(Location.DEWITT_CLINTON_PARK.matches("DeWitt Clinton"));
        assertTrue(Location.PICKLE1.matches("7 Hanover Sq"));
    }

    @Test
    void matches_異常ケース_別名を含まない文字列は一致しないこと() {
        assertFalse(Location.CHELSEA_PARK.matches("Chelsea Piers"));
        assertFalse(Location.GOTHAM_PICKLEBALL.matches(""));
        assertFalse(Location.FRAMES_BOWLING_LOUNGE.matches(null));
    }
}
