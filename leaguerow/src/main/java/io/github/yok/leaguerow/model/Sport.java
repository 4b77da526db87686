package io.github.yok.leaguerow.model;

import io.github.yok.leaguerow.util.TextUtils;
import java.util.Arrays;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Sports offered by the league. The display name is the value written to {@code sportName}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum Sport {

    DODGEBALL("Dodgeball"),

    KICKBALL("Kickball"),

    BOWLING("Bowling"),

    PICKLEBALL("Pickleball");

    private final String displayName;

    /**
     * Resolves a sport from free text by title-casing its first word ({@code "KICKBALL league"}
     * resolves to {@link #KICKBALL}).
     *
     * @param text free text, typically column A or a caller-supplied hint
     * @return the sport, or empty if the first word names no known sport
     */
    public static Optional<Sport> fromText(String text) {
        String word = TextUtils.titleCase(TextUtils.firstWord(text));
        return Arrays.stream(values()).filter(s -> s.displayName.equals(word)).findFirst();
    }
}
