package io.github.yok.leaguerow.model;

import io.github.yok.leaguerow.util.TextUtils;
import java.util.List;
import lombok.Getter;

/**
 * Canonical venues. Each constant carries the exact string the product-creation workflow expects
 * and the lower-case aliases that identify it in free text.
 *
 * <p>
 * Constants are matched in declaration order, so a venue whose aliases overlap another's must be
 * declared first ({@link #BOWLERO_CHELSEA_PIERS} before {@link #CHELSEA_PARK}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum Location {

    ELLIOTT_CENTER("Elliott Center (26th St & 9th Ave)", "elliott"),

    PS3_CHARRETTE("PS3 Charrette School (Grove St & Hudson St)", "ps3", "ps 3", "charrette"),

    VILLAGE_COMMUNITY_SCHOOL("Village Community School (10th St & Greenwich St)",
            "village community"),

    HARTLEY_HOUSE("Hartley House (46th St & 9th Ave)", "hartley"),

    DEWITT_CLINTON_PARK("Dewitt Clinton Park (52nd St & 11th Ave)", "dewitt", "de witt",
            "clinton park"),

    GANSEVOORT_PIER_53("Gansevoort Peninsula Athletic Park, Pier 53 (Gansevoort St & 11th)",
            "gansevoort", "pier 53"),

    BOWLERO_CHELSEA_PIERS("Bowlero Chelsea Piers (60 Chelsea Piers)", "bowlero",
            "chelsea piers"),

    CHELSEA_PARK("Chelsea Park (27th St & 9th Ave)", "chelsea park"),

    GOTHAM_PICKLEBALL("Gotham Pickleball (46th and Vernon in LIC)", "gotham"),

    JOHN_JAY_COLLEGE("John Jay College (59th and 10th)", "john jay"),

    PICKLE1("Pickle1 (7 Hanover Square in LIC)", "pickle1", "pickle 1", "hanover"),

    FRAMES_BOWLING_LOUNGE("Frames Bowling Lounge (40th St and 9th Ave)", "frames");

    private final String displayName;

    private final List<String> aliases;

    Location(String displayName, String... aliases) {
        this.displayName = displayName;
        this.aliases = List.of(aliases);
    }

    /**
     * Determines whether free text mentions this venue.
     *
     * @param text venue text (any case, may span several lines)
     * @return {@code true} if any alias occurs in the text
     */
    public boolean matches(String text) {
        String lower = TextUtils.lower(text);
        return aliases.stream().anyMatch(lower::contains);
    }
}
