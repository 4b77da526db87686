package io.github.yok.leaguerow.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Seasons derived from the month a league starts in.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum Season {

    WINTER("Winter"),

    SPRING("Spring"),

    SUMMER("Summer"),

    FALL("Fall");

    private final String displayName;

    /**
     * Buckets a month: December-February is Winter, March-May Spring, June-August Summer and
     * September-November Fall.
     *
     * @param month month number {@code 1-12}
     * @return the season containing that month
     * @throws IllegalArgumentException if {@code month} is outside {@code 1-12}
     */
    public static Season ofMonth(int month) {
        switch (month) {
            case 12:
            case 1:
            case 2:
                return WINTER;
            case 3:
            case 4:
            case 5:
                return SPRING;
            case 6:
            case 7:
            case 8:
                return SUMMER;
            case 9:
            case 10:
            case 11:
                return FALL;
            default:
                throw new IllegalArgumentException("Invalid month: " + month);
        }
    }
}
