package io.github.yok.leaguerow.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * League divisions as they appear in the payload.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum Division {

    OPEN("Open"),

    // Women, trans and non-binary division
    WTNB("WTNB+");

    private final String displayName;
}
