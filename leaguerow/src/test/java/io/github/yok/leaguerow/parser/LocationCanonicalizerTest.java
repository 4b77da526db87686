package io.github.yok.leaguerow.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.Location;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LocationCanonicalizerTest {

    private final LocationCanonicalizer canonicalizer = new LocationCanonicalizer();

    @Test
    void canonicalize_正常ケース_複数行の会場名が正規化されること() {
        assertEquals(Optional.of(Location.HARTLEY_HOUSE),
                canonicalizer.canonicalize("Hartley House\n413 W 46th Street"));
        assertEquals(Optional.of(Location.JOHN_JAY_COLLEGE),
                canonicalizer.canonicalize("John Jay College"));
        assertEquals(Optional.of(Location.FRAMES_BOWLING_LOUNGE),
                canonicalizer.canonicalize("FRAMES BOWLING LOUNGE"));
    }

    @Test
    void canonicalize_正常ケース_ChelseaPiersはChelseaParkより優先されること() {
        assertEquals(Optional.of(Location.BOWLERO_CHELSEA_PIERS),
                canonicalizer.canonicalize("Chelsea Piers lanes"));
        assertEquals(Optional.of(Location.CHELSEA_PARK),
                canonicalizer.canonicalize("Chelsea Park"));
    }

    @Test
    void canonicalize_正常ケース_解決時に表示名が返りlocationが解決されること() {
        UnresolvedFields unresolved = UnresolvedFields.of(LeagueField.LOCATION);
        assertEquals("Gotham Pickleball (46th and Vernon in LIC)",
                canonicalizer.canonicalize("Gotham", unresolved));
        assertTrue(unresolved.isEmpty());
    }

    @Test
    void canonicalize_異常ケース_未知の会場はnullで未解決のまま残ること() {
        UnresolvedFields unresolved = UnresolvedFields.of(LeagueField.LOCATION);
        assertNull(canonicalizer.canonicalize("Central Park Great Lawn", unresolved));
        assertTrue(unresolved.contains(LeagueField.LOCATION));
        assertTrue(canonicalizer.canonicalize("   ").isEmpty());
    }
}
