package io.github.yok.leaguerow.util;

import com.google.common.collect.ImmutableMap;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Map;
import lombok.Generated;

/**
 * Calendar primitives shared by the date, time and registration parsers.
 *
 * <p>
 * Every calendar date produced by this project is stored as the instant {@code 04:00 UTC} of the
 * intended day. That instant is midnight in US Eastern daylight time, so a date can be compared
 * with another by plain {@link Instant#equals(Object)} without any time-zone arithmetic.
 * </p>
 *
 * <ul>
 * <li>Month lookup accepts full names, three-letter abbreviations and {@code "sept"}.</li>
 * <li>Day lookup accepts full names and the usual spreadsheet abbreviations ({@code "tues"},
 * {@code "weds"}, {@code "thurs"}).</li>
 * <li>Two-digit years map {@code 00-30} to the 2000s and {@code 31-99} to the 1900s.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CalendarUtil {

    /**
     * Hour of the UTC day that encodes Eastern-time midnight.
     */
    public static final int ANCHOR_HOUR_UTC = 4;

    /**
     * Highest two-digit year that is read as belonging to the 2000s.
     */
    public static final int TWO_DIGIT_YEAR_PIVOT = 30;

    private static final Map<String, Integer> MONTHS = ImmutableMap.<String, Integer>builder()
            .put("jan", 1).put("january", 1).put("feb", 2).put("february", 2).put("mar", 3)
            .put("march", 3).put("apr", 4).put("april", 4).put("may", 5).put("jun", 6)
            .put("june", 6).put("jul", 7).put("july", 7).put("aug", 8).put("august", 8)
            .put("sep", 9).put("sept", 9).put("september", 9).put("oct", 10).put("october", 10)
            .put("nov", 11).put("november", 11).put("dec", 12).put("december", 12).build();

    private static final Map<String, DayOfWeek> DAYS = ImmutableMap.<String, DayOfWeek>builder()
            .put("mon", DayOfWeek.MONDAY).put("monday", DayOfWeek.MONDAY)
            .put("tue", DayOfWeek.TUESDAY).put("tues", DayOfWeek.TUESDAY)
            .put("tuesday", DayOfWeek.TUESDAY).put("wed", DayOfWeek.WEDNESDAY)
            .put("weds", DayOfWeek.WEDNESDAY).put("wednesday", DayOfWeek.WEDNESDAY)
            .put("thu", DayOfWeek.THURSDAY).put("thur", DayOfWeek.THURSDAY)
            .put("thurs", DayOfWeek.THURSDAY).put("thursday", DayOfWeek.THURSDAY)
            .put("fri", DayOfWeek.FRIDAY).put("friday", DayOfWeek.FRIDAY)
            .put("sat", DayOfWeek.SATURDAY).put("saturday", DayOfWeek.SATURDAY)
            .put("sun", DayOfWeek.SUNDAY).put("sunday", DayOfWeek.SUNDAY).build();

    /**
     * Regular-expression alternation of every accepted day token, longest first.
     */
    public static final String DAY_TOKEN_ALTERNATION =
            "monday|mon|tuesday|tues|tue|wednesday|weds|wed|thursday|thurs|thur|thu|friday|fri"
                    + "|saturday|sat|sunday|sun";

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private CalendarUtil() {}

    /**
     * Looks up a month by name or abbreviation.
     *
     * @param token month token, case-insensitive, optionally followed by a period
     * @return month number {@code 1-12}, or {@code null} if the token is not a month
     */
    public static Integer monthOf(String token) {
        if (token == null) {
            return null;
        }
        return MONTHS.get(TextUtils.lower(token).replace(".", "").trim());
    }

    /**
     * Looks up a day of the week by name or abbreviation.
     *
     * @param token day token, case-insensitive
     * @return the day, or {@code null} if the token is not a day name
     */
    public static DayOfWeek dayOf(String token) {
        if (token == null) {
            return null;
        }
        return DAYS.get(TextUtils.lower(token).replace(".", "").trim());
    }

    /**
     * Renders a day of the week the way the payload expects it ({@code "Tuesday"}).
     *
     * @param day day of the week
     * @return capitalized English day name
     */
    public static String displayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.US);
    }

    /**
     * Expands a two-digit year token; longer tokens are read as written, so {@code "0025"} stays
     * year 25.
     *
     * @param token year digits as written in the source text
     * @return full year
     */
    public static int normalizeYear(String token) {
        int year = Integer.parseInt(token);
        if (token.length() > 2) {
            return year;
        }
        return year <= TWO_DIGIT_YEAR_PIVOT ? 2000 + year : 1900 + year;
    }

    /**
     * Converts a calendar date to its canonical anchor instant.
     *
     * @param date calendar date
     * @return {@code date} at {@code 04:00 UTC}
     */
    public static Instant anchor(LocalDate date) {
        return date.atTime(ANCHOR_HOUR_UTC, 0).toInstant(ZoneOffset.UTC);
    }

    /**
     * Converts a calendar date and an Eastern wall-clock time to an instant, using the same fixed
     * offset as {@link #anchor(LocalDate)}.
     *
     * @param date calendar date
     * @param timeOfDay wall-clock time of day
     * @return the anchor instant of {@code date} shifted by {@code timeOfDay}
     */
    public static Instant anchor(LocalDate date, LocalTime timeOfDay) {
        return anchor(date).plusSeconds(timeOfDay.toSecondOfDay());
    }

    /**
     * Recovers the calendar date encoded by an anchor instant.
     *
     * @param anchor instant produced by {@link #anchor(LocalDate)}
     * @return calendar date
     */
    public static LocalDate dateOf(Instant anchor) {
        return LocalDateTime.ofInstant(anchor, ZoneOffset.UTC).toLocalDate();
    }
}
