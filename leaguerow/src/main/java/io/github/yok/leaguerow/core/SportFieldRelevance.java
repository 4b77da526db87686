package io.github.yok.leaguerow.core;

import static io.github.yok.leaguerow.model.LeagueField.ALTERNATIVE_END_TIME;
import static io.github.yok.leaguerow.model.LeagueField.ALTERNATIVE_START_TIME;
import static io.github.yok.leaguerow.model.LeagueField.NEW_PLAYER_ORIENTATION_DATE_TIME;
import static io.github.yok.leaguerow.model.LeagueField.OPENING_PARTY_DATE;
import static io.github.yok.leaguerow.model.LeagueField.RAIN_DATE;
import static io.github.yok.leaguerow.model.LeagueField.SCOUT_NIGHT_DATE_TIME;
import static io.github.yok.leaguerow.model.LeagueField.SOCIAL_OR_ADVANCED;
import static io.github.yok.leaguerow.model.LeagueField.SPORT_SUB_CATEGORY;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Sets;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.Sport;
import java.util.EnumSet;
import java.util.Set;
import lombok.Generated;

/**
 * Declarative sport-to-irrelevant-field matrix.
 *
 * <p>
 * Consulted once, when the unresolved set for a row is seeded. A field that does not apply to a
 * sport is never reported as unresolved for that sport, even if the row says nothing about it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SportFieldRelevance {

    private static final ImmutableSetMultimap<Sport, LeagueField> EXCLUDED =
            ImmutableSetMultimap.<Sport, LeagueField>builder()
                    .putAll(Sport.KICKBALL, SPORT_SUB_CATEGORY, ALTERNATIVE_START_TIME,
                            ALTERNATIVE_END_TIME)
                    .putAll(Sport.DODGEBALL, SCOUT_NIGHT_DATE_TIME, RAIN_DATE,
                            ALTERNATIVE_START_TIME, ALTERNATIVE_END_TIME)
                    .putAll(Sport.BOWLING, SPORT_SUB_CATEGORY, SOCIAL_OR_ADVANCED,
                            NEW_PLAYER_ORIENTATION_DATE_TIME, SCOUT_NIGHT_DATE_TIME,
                            OPENING_PARTY_DATE, RAIN_DATE)
                    .putAll(Sport.PICKLEBALL, SPORT_SUB_CATEGORY,
                            NEW_PLAYER_ORIENTATION_DATE_TIME, SCOUT_NIGHT_DATE_TIME, RAIN_DATE,
                            ALTERNATIVE_START_TIME, ALTERNATIVE_END_TIME)
                    .build();

    // Sport-specific fields, excluded while the sport itself is unknown
    private static final ImmutableSet<LeagueField> EXCLUDED_FOR_UNKNOWN_SPORT =
            ImmutableSet.of(SPORT_SUB_CATEGORY, SCOUT_NIGHT_DATE_TIME, RAIN_DATE);

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private SportFieldRelevance() {}

    /**
     * Returns the fields that do not apply to a sport.
     *
     * @param sport the sport, or {@code null} when the row's sport is unknown
     * @return excluded fields
     */
    public static Set<LeagueField> excludedFields(Sport sport) {
        return sport == null ? EXCLUDED_FOR_UNKNOWN_SPORT : EXCLUDED.get(sport);
    }

    /**
     * Returns the fields a row of the given sport is expected to fill, in reporting order.
     *
     * @param sport the sport, or {@code null} when the row's sport is unknown
     * @return relevant fields
     */
    public static Set<LeagueField> relevantFields(Sport sport) {
        Set<LeagueField> excluded = excludedFields(sport);
        return Sets.difference(EnumSet.allOf(LeagueField.class), excluded).immutableCopy();
    }
}
