package io.github.yok.leaguerow.model;

import java.time.LocalTime;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One or two play sessions. Only the time of day is meaningful; {@code start2}/{@code end2} are
 * {@code null} when the league plays a single session.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class TimeRange {

    private final LocalTime start1;

    private final LocalTime end1;

    private final LocalTime start2;

    private final LocalTime end2;

    /**
     * Returns whether a second session was found.
     *
     * @return {@code true} if both {@code start2} and {@code end2} are present
     */
    public boolean hasSecondSession() {
        return start2 != null && end2 != null;
    }
}
