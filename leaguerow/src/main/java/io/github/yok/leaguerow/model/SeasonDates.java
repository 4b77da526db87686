package io.github.yok.leaguerow.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Season start/end anchors with the season and year derived from the start date. Any component
 * that could not be parsed is {@code null}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class SeasonDates {

    private final Instant seasonStartDate;

    private final Instant seasonEndDate;

    private final Season season;

    private final Integer year;
}
