package io.github.yok.leaguerow.parser;

import com.google.common.base.Preconditions;
import io.github.yok.leaguerow.model.TimeRange;
import io.github.yok.leaguerow.util.CalendarUtil;
import io.github.yok.leaguerow.util.TextUtils;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses human-entered date tokens into {@code 04:00 UTC} anchor instants.
 *
 * <p>
 * Accepted forms:
 * </p>
 * <ul>
 * <li>{@code M/D}, {@code M/D/YY}, {@code M/D/YYYY}</li>
 * <li>{@code M-D}, {@code M-D-YY}, {@code M-D-YYYY}</li>
 * <li>{@code October 15}, {@code Oct 14th}, {@code Sept. 3rd}, {@code October 15, 2025}</li>
 * </ul>
 *
 * <p>
 * Leading weekday names ({@code "Weds, Sept. 3rd"}) are ignored. When the year is absent it is
 * inferred from "today" as supplied by the injected {@link Clock}: the current year is used unless
 * that would put the date strictly before today, in which case the next year is used.
 * </p>
 *
 * <p>
 * Unparseable input is a normal outcome and yields {@code null}; no method of this class throws
 * for malformed text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FlexibleDateParser {

    private static final Pattern SLASH_DATE =
            Pattern.compile("(?<![\\d/:.])(\\d{1,2})/(\\d{1,2})(?:/(\\d{4}|\\d{2}))?(?![\\d/:])");

    // a trailing meridiem marks a time range such as "12-3PM", not a date
    private static final Pattern DASH_DATE = Pattern.compile(
            "(?<![\\d\\-:.])(\\d{1,2})-(\\d{1,2})(?:-(\\d{4}|\\d{2}))?(?![\\d\\-:])"
                    + "(?!\\s*[ap]\\.?m\\b)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern MONTH_NAME_DATE = Pattern.compile(
            "\\b([a-z]{3,9})\\.?\\s*(\\d{1,2})(?:st|nd|rd|th)?\\b(?:,?\\s*(\\d{4})\\b)?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TIME_OF_DAY = Pattern.compile(
            "(?<![\\d/:])(\\d{1,2})(?::(\\d{2}))?\\s*([ap])\\.?\\s?m\\b\\.?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern AT_SEPARATOR =
            Pattern.compile("@|\\bat\\b", Pattern.CASE_INSENSITIVE);

    // Feb 29 may be up to eight years away (2096 to 2104)
    private static final int YEAR_SEARCH_LIMIT = 8;

    // Source of "today" for year inference
    private final Clock clock;

    private final TimeRangeParser timeRangeParser = new TimeRangeParser();

    /**
     * Creates a parser that infers missing years relative to the given clock.
     *
     * @param clock clock whose zone defines "today"
     */
    public FlexibleDateParser(Clock clock) {
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
    }

    /**
     * Parses the first date found in the text.
     *
     * @param raw free-text date (may be {@code null} or empty)
     * @return anchor instant, or {@code null} if no valid date is present
     */
    public Instant parseDate(String raw) {
        DateMatch match = firstMatch(raw);
        if (match == null) {
            log.debug("No date found in '{}'", raw);
            return null;
        }
        return CalendarUtil.anchor(match.date);
    }

    /**
     * Parses a date followed or preceded by an optional time of day, such as
     * {@code "Weds, Sept. 3rd, 6pm"} or {@code "Sept 18th 7PM"}.
     *
     * <p>
     * The result is the date's anchor instant shifted by the Eastern wall-clock time of day. When
     * the time is written as a range ({@code "7-9pm"}) its start is used. When no time of day is
     * present the bare anchor is returned.
     * </p>
     *
     * @param raw free-text date and time (may be {@code null} or empty)
     * @return instant, or {@code null} if no valid date is present
     */
    public Instant parseDateTime(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String text = TextUtils.collapseWhitespace(AT_SEPARATOR.matcher(raw).replaceAll(" "));
        DateMatch match = firstMatch(text);
        if (match == null) {
            log.debug("No date found in date-time '{}'", raw);
            return null;
        }
        String remainder = text.substring(0, match.start) + " " + text.substring(match.end);
        LocalTime time = startTimeOf(remainder);
        return time == null ? CalendarUtil.anchor(match.date)
                : CalendarUtil.anchor(match.date, time);
    }

    /**
     * Finds every date in the text, in order of appearance.
     *
     * @param text free text such as a notes line (may be {@code null})
     * @return anchor instants; empty if there are none
     */
    public List<Instant> findDates(String text) {
        List<Instant> dates = new ArrayList<>();
        for (DateMatch match : allMatches(text)) {
            dates.add(CalendarUtil.anchor(match.date));
        }
        return dates;
    }

    /**
     * Reads a 12-hour time of day such as {@code 7PM}, {@code 6:30 pm} or {@code 10 a.m.}.
     *
     * @param text text containing the time
     * @return the time, or {@code null} if none is present or it is out of range
     */
    static LocalTime parseTimeOfDay(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Matcher m = TIME_OF_DAY.matcher(text);
        if (!m.find()) {
            return null;
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
        if (hour < 1 || hour > 12 || minute > 59) {
            return null;
        }
        return LocalTime.of(to24Hour(hour, Character.toLowerCase(m.group(3).charAt(0))), minute);
    }

    private LocalTime startTimeOf(String text) {
        TimeRange range = timeRangeParser.parse(text);
        return range != null ? range.getStart1() : parseTimeOfDay(text);
    }

    /**
     * Converts a 12-hour clock hour to a 24-hour one.
     *
     * @param hour12 hour {@code 1-12}
     * @param meridiem {@code 'a'} or {@code 'p'}
     * @return hour {@code 0-23}
     */
    static int to24Hour(int hour12, char meridiem) {
        if (meridiem == 'p') {
            return hour12 == 12 ? 12 : hour12 + 12;
        }
        return hour12 == 12 ? 0 : hour12;
    }

    private DateMatch firstMatch(String text) {
        List<DateMatch> matches = allMatches(text);
        return matches.isEmpty() ? null : matches.get(0);
    }

    private List<DateMatch> allMatches(String text) {
        List<DateMatch> matches = new ArrayList<>();
        if (StringUtils.isBlank(text)) {
            return matches;
        }
        collectNumeric(SLASH_DATE, text, matches);
        collectNumeric(DASH_DATE, text, matches);

        Matcher m = MONTH_NAME_DATE.matcher(text);
        while (m.find()) {
            Integer month = CalendarUtil.monthOf(m.group(1));
            if (month == null) {
                continue;
            }
            Integer year = m.group(3) == null ? null : Integer.valueOf(m.group(3));
            LocalDate date = resolve(month, Integer.parseInt(m.group(2)), year);
            if (date != null) {
                matches.add(new DateMatch(date, m.start(), m.end()));
            }
        }
        matches.sort(Comparator.comparingInt(dm -> dm.start));
        return matches;
    }

    private void collectNumeric(Pattern pattern, String text, List<DateMatch> sink) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            Integer year = m.group(3) == null ? null : CalendarUtil.normalizeYear(m.group(3));
            LocalDate date =
                    resolve(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), year);
            if (date != null) {
                sink.add(new DateMatch(date, m.start(), m.end()));
            }
        }
    }

    private LocalDate resolve(int month, int day, Integer year) {
        try {
            if (year != null) {
                return LocalDate.of(year, month, day);
            }
            LocalDate today = LocalDate.now(clock);
            // first year whose month has the day and that is not before today
            for (int y = today.getYear(); y <= today.getYear() + YEAR_SEARCH_LIMIT; y++) {
                if (day <= YearMonth.of(y, month).lengthOfMonth()) {
                    LocalDate candidate = LocalDate.of(y, month, day);
                    if (!candidate.isBefore(today)) {
                        return candidate;
                    }
                }
            }
            log.debug("No year within reach has month={} day={}", month, day);
            return null;
        } catch (DateTimeException e) {
            log.debug("Discarding impossible date month={} day={} year={}: {}", month, day, year,
                    e.getMessage());
            return null;
        }
    }

    /**
     * A resolved date and the span of text it came from.
     */
    private static final class DateMatch {

        private final LocalDate date;
        private final int start;
        private final int end;

        DateMatch(LocalDate date, int start, int end) {
            this.date = date;
            this.start = start;
            this.end = end;
        }
    }
}
