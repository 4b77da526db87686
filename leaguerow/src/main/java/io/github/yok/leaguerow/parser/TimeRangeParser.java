package io.github.yok.leaguerow.parser;

import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.TimeRange;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses play times such as {@code "8:00 PM - 11:00 PM"}, {@code "12-3PM"}, {@code "6:30-10"} or
 * the two-session {@code "Times: 12:45-2:45PM & 3:00-5:00PM"}.
 *
 * <p>
 * A side of a range without {@code am}/{@code pm} takes the meridiem of the other side, flipped if
 * the range would otherwise run backwards ({@code "11-1PM"} is 11:00 to 13:00). When neither side
 * carries a meridiem, evening play is assumed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TimeRangeParser {

    /**
     * Format of the time strings written to the payload, e.g. {@code "8:00 PM"}.
     */
    public static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private static final Pattern RANGE = Pattern.compile(
            "(?<![\\d:/])(\\d{1,2})(?::(\\d{2}))?\\s*(?:([ap])\\.?m\\.?)?"
                    + "\\s*(?:-|\\u2013|\\u2014|to)\\s*"
                    + "(\\d{1,2})(?::(\\d{2}))?\\s*(?:([ap])\\.?m\\b\\.?)?",
            Pattern.CASE_INSENSITIVE);

    private static final char DEFAULT_MERIDIEM = 'p';

    /**
     * Parses up to two sessions.
     *
     * @param raw play-times text (column G)
     * @return the sessions, or {@code null} if no valid first range is present
     */
    public TimeRange parse(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        Matcher m = RANGE.matcher(raw);
        LocalTime[] first = nextSession(m);
        if (first == null) {
            log.debug("No time range found in '{}'", raw);
            return null;
        }
        LocalTime[] second = nextSession(m);
        return second == null ? new TimeRange(first[0], first[1], null, null)
                : new TimeRange(first[0], first[1], second[0], second[1]);
    }

    /**
     * Parses up to two sessions and resolves the corresponding time fields.
     *
     * @param raw play-times text (column G)
     * @param unresolved tracker for the current row
     * @return the sessions, or {@code null} if no valid first range is present
     */
    public TimeRange parse(String raw, UnresolvedFields unresolved) {
        TimeRange range = parse(raw);
        if (range == null) {
            return null;
        }
        unresolved.resolve(LeagueField.LEAGUE_START_TIME);
        unresolved.resolve(LeagueField.LEAGUE_END_TIME);
        if (range.hasSecondSession()) {
            unresolved.resolve(LeagueField.ALTERNATIVE_START_TIME);
            unresolved.resolve(LeagueField.ALTERNATIVE_END_TIME);
        }
        return range;
    }

    /**
     * Formats a time of day for the payload.
     *
     * @param time time of day (may be {@code null})
     * @return formatted time, or {@code null}
     */
    public static String format(LocalTime time) {
        return time == null ? null : DISPLAY_FORMAT.format(time);
    }

    private LocalTime[] nextSession(Matcher m) {
        while (m.find()) {
            int h1 = Integer.parseInt(m.group(1));
            int min1 = minutes(m.group(2));
            int h2 = Integer.parseInt(m.group(4));
            int min2 = minutes(m.group(5));
            if (!validClock(h1, min1) || !validClock(h2, min2)) {
                continue;
            }
            Character mer1 = meridiem(m.group(3));
            Character mer2 = meridiem(m.group(6));
            if (mer1 == null && mer2 == null) {
                mer2 = DEFAULT_MERIDIEM;
            }
            if (mer1 == null) {
                mer1 = mer2;
                if (minuteOfDay(h1, min1, mer1) > minuteOfDay(h2, min2, mer2)) {
                    mer1 = flip(mer1);
                }
            } else if (mer2 == null) {
                mer2 = mer1;
                if (minuteOfDay(h2, min2, mer2) < minuteOfDay(h1, min1, mer1)) {
                    mer2 = flip(mer2);
                }
            }
            return new LocalTime[] {LocalTime.of(FlexibleDateParser.to24Hour(h1, mer1), min1),
                    LocalTime.of(FlexibleDateParser.to24Hour(h2, mer2), min2)};
        }
        return null;
    }

    private static int minutes(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }

    private static boolean validClock(int hour, int minute) {
        return hour >= 1 && hour <= 12 && minute <= 59;
    }

    private static Character meridiem(String group) {
        return group == null ? null : Character.toLowerCase(group.charAt(0));
    }

    private static char flip(char meridiem) {
        return meridiem == 'p' ? 'a' : 'p';
    }

    private static int minuteOfDay(int hour12, int minute, char meridiem) {
        return FlexibleDateParser.to24Hour(hour12, meridiem) * 60 + minute;
    }
}
