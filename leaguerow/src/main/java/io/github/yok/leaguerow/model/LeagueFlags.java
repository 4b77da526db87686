package io.github.yok.leaguerow.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Categorical values read from the details column: day of play, division, skill level, ball type
 * and signup style. Unmatched values are {@code null}; {@code types} is empty when no signup style
 * was recognized.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class LeagueFlags {

    private final String dayOfPlay;

    private final Division division;

    private final String socialOrAdvanced;

    private final String sportSubCategory;

    private final List<String> types;
}
