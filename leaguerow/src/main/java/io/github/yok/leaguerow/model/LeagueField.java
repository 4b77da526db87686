package io.github.yok.leaguerow.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Every payload field a row parse is expected to fill, in the order they are reported when left
 * unresolved.
 *
 * <p>
 * The key is the JSON property name used by the canonical payload and by the confirmation screen
 * that asks an operator to fill the gaps.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum LeagueField {

    SPORT_NAME("sportName"),
    DIVISION("division"),
    SEASON("season"),
    YEAR("year"),
    DAY_OF_PLAY("dayOfPlay"),
    LOCATION("location"),
    SPORT_SUB_CATEGORY("sportSubCategory"),
    SOCIAL_OR_ADVANCED("socialOrAdvanced"),
    TYPES("types"),
    NEW_PLAYER_ORIENTATION_DATE_TIME("newPlayerOrientationDateTime"),
    SCOUT_NIGHT_DATE_TIME("scoutNightDateTime"),
    OPENING_PARTY_DATE("openingPartyDate"),
    SEASON_START_DATE("seasonStartDate"),
    SEASON_END_DATE("seasonEndDate"),
    OFF_DATES("offDates"),
    RAIN_DATE("rainDate"),
    CLOSING_PARTY_DATE("closingPartyDate"),
    VET_REGISTRATION_START_DATE_TIME("vetRegistrationStartDateTime"),
    EARLY_REGISTRATION_START_DATE_TIME("earlyRegistrationStartDateTime"),
    OPEN_REGISTRATION_START_DATE_TIME("openRegistrationStartDateTime"),
    LEAGUE_START_TIME("leagueStartTime"),
    LEAGUE_END_TIME("leagueEndTime"),
    ALTERNATIVE_START_TIME("alternativeStartTime"),
    ALTERNATIVE_END_TIME("alternativeEndTime"),
    PRICE("price"),
    TOTAL_INVENTORY("totalInventory"),
    NUMBER_VET_SPOTS_TO_RELEASE_AT_GO_LIVE("numberVetSpotsToReleaseAtGoLive");

    private final String key;
}
