package io.github.yok.leaguerow.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.Sport;
import java.util.List;
import org.junit.jupiter.api.Test;

class UnresolvedFieldsTest {

    @Test
    void forSport_正常ケース_競技に関係するフィールドのみで初期化されること() {
        UnresolvedFields dodgeball = UnresolvedFields.forSport(Sport.DODGEBALL);
        assertTrue(dodgeball.contains(LeagueField.SPORT_SUB_CATEGORY));
        assertFalse(dodgeball.contains(LeagueField.RAIN_DATE));

        UnresolvedFields kickball = UnresolvedFields.forSport(Sport.KICKBALL);
        assertTrue(kickball.contains(LeagueField.RAIN_DATE));
        assertTrue(kickball.contains(LeagueField.SCOUT_NIGHT_DATE_TIME));
        assertFalse(kickball.contains(LeagueField.SPORT_SUB_CATEGORY));
    }

    @Test
    void resolve_正常ケース_未解決フィールドを解決するとtrueが返り件数が減ること() {
        UnresolvedFields fields = UnresolvedFields.of(LeagueField.PRICE, LeagueField.LOCATION);
        assertTrue(fields.resolve(LeagueField.PRICE));
        assertEquals(1, fields.size());
        assertFalse(fields.contains(LeagueField.PRICE));
    }

    @Test
    void resolve_正常ケース_解決済みや対象外フィールドはfalseが返ること() {
        UnresolvedFields fields = UnresolvedFields.of(LeagueField.PRICE);
        fields.resolve(LeagueField.PRICE);
        // 二度目の解決は何もしない
        assertFalse(fields.resolve(LeagueField.PRICE));
        assertFalse(fields.resolve(LeagueField.RAIN_DATE));
        assertTrue(fields.isEmpty());
    }

    @Test
    void toKeys_正常ケース_宣言順のキーが返ること() {
        UnresolvedFields fields = UnresolvedFields.of(LeagueField.PRICE, LeagueField.SPORT_NAME,
                LeagueField.OFF_DATES);
        assertEquals(List.of("sportName", "offDates", "price"), fields.toKeys());
        assertEquals("[sportName, offDates, price]", fields.toString());
    }

    @Test
    void toKeys_異常ケース_返却リストは変更できないこと() {
        List<String> keys = UnresolvedFields.of(LeagueField.YEAR).toKeys();
        assertThrows(UnsupportedOperationException.class, () -> keys.add("season"));
    }

    @Test
    void of_正常ケース_空指定で空の集合が生成されること() {
        assertTrue(UnresolvedFields.of().isEmpty());
    }
}
