package io.github.yok.leaguerow.parser;

import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.NotesInfo;
import io.github.yok.leaguerow.util.TextUtils;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the free-form notes column (column C).
 *
 * <p>
 * Notes are prose written for players, e.g.:
 * </p>
 *
 * <pre>
 * Newbie Night/Open Play - 10/6/25
 * No games on Indigenous Peoples Day 10/13
 * Total # of Weeks: 8
 * # of Players: 72
 * </pre>
 *
 * <p>
 * Each line is inspected on its own. A line naming an event (orientation, scout night, opening or
 * closing party, rain date) supplies that event's date; the first such line per event wins. Any
 * other line containing an off marker ("skipping", "no games", ...) contributes all of its dates to
 * the off-dates list. On an event line only the dates between the off marker and the next event
 * keyword are off dates. Week count, total inventory and veteran carve-outs are read from the whole
 * text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class NotesParser {

    // "kick off" names the first night, not a night off
    private static final Pattern OFF_MARKER = Pattern.compile(
            "\\b(skip|skipping|skipped|(?<!kick[\\s\\-]?)off|no games?|no league|no play)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TOTAL_WEEKS =
            Pattern.compile("total\\s*#\\s*of\\s*weeks\\s*:?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern N_WEEKS =
            Pattern.compile("\\b(\\d+)\\s*weeks?\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern PLAYER_COUNT =
            Pattern.compile("#\\s*of\\s*players\\s*:?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAYER_RANGE = Pattern.compile(
            "\\b(\\d+)\\s*(?:-|\\u2013|to)\\s*(\\d+)\\s*players\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern N_PLAYERS = Pattern.compile(
            "\\b(\\d+)\\s*players\\b(?!\\s*max)", Pattern.CASE_INSENSITIVE);

    private static final Pattern VET_SPOTS_AFTER = Pattern.compile(
            "\\b(\\d+)\\s*(?:vet(?:eran)?s?)\\s*spots?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern VET_SPOTS_BEFORE = Pattern.compile(
            "\\bvet(?:eran)?s?\\s*spots?\\s*:?\\s*(\\d+)\\b", Pattern.CASE_INSENSITIVE);

    private final FlexibleDateParser dateParser;

    /**
     * Notes events and the keywords that introduce them.
     */
    @Getter
    @AllArgsConstructor
    enum NoteEvent {

        ORIENTATION(LeagueField.NEW_PLAYER_ORIENTATION_DATE_TIME, true, Pattern.compile(
                "orientation|newbie night|new player", Pattern.CASE_INSENSITIVE)),
        SCOUT_NIGHT(LeagueField.SCOUT_NIGHT_DATE_TIME, true,
                Pattern.compile("scout night", Pattern.CASE_INSENSITIVE)),
        OPENING_PARTY(LeagueField.OPENING_PARTY_DATE, false,
                Pattern.compile("opening party", Pattern.CASE_INSENSITIVE)),
        CLOSING_PARTY(LeagueField.CLOSING_PARTY_DATE, false,
                Pattern.compile("closing party", Pattern.CASE_INSENSITIVE)),
        RAIN_DATE(LeagueField.RAIN_DATE, false,
                Pattern.compile("rain\\s*date", Pattern.CASE_INSENSITIVE));

        private final LeagueField field;

        // reads a time of day as well as the date
        private final boolean withTime;

        private final Pattern keyword;
    }

    /**
     * Parses the notes column and resolves every field it fills.
     *
     * @param notes notes text (column C)
     * @param unresolved tracker for the current row
     * @return extracted values; absent items are {@code null} and {@code offDates} may be empty
     */
    public NotesInfo parse(String notes, UnresolvedFields unresolved) {
        Map<NoteEvent, Instant> events = new EnumMap<>(NoteEvent.class);
        TreeSet<Instant> offDates = new TreeSet<>();

        for (String line : TextUtils.splitLines(notes)) {
            NoteEvent event = eventOf(line);
            if (event != null) {
                if (!events.containsKey(event)) {
                    Instant date = eventDate(event, line);
                    if (date != null) {
                        events.put(event, date);
                    }
                }
                offDates.addAll(offDatesBesideEvent(line));
                continue;
            }
            if (OFF_MARKER.matcher(line).find()) {
                offDates.addAll(dateParser.findDates(line));
            }
        }

        Integer weekCount = weekCount(notes);
        Integer totalInventory = totalInventory(notes);
        Integer vetSpots = vetSpots(notes);

        events.keySet().forEach(e -> unresolved.resolve(e.getField()));
        if (!offDates.isEmpty()) {
            unresolved.resolve(LeagueField.OFF_DATES);
        }
        if (totalInventory != null) {
            unresolved.resolve(LeagueField.TOTAL_INVENTORY);
        }

        NotesInfo info = NotesInfo.builder()
                .newPlayerOrientationDateTime(events.get(NoteEvent.ORIENTATION))
                .scoutNightDateTime(events.get(NoteEvent.SCOUT_NIGHT))
                .openingPartyDate(events.get(NoteEvent.OPENING_PARTY))
                .closingPartyDate(events.get(NoteEvent.CLOSING_PARTY))
                .rainDate(events.get(NoteEvent.RAIN_DATE))
                .offDates(List.copyOf(offDates)).weekCount(weekCount)
                .totalInventory(totalInventory).vetSpots(vetSpots).build();
        log.debug("Parsed notes: {}", info);
        return info;
    }

    /**
     * Reads the season length, preferring {@code Total # of Weeks: N} over a bare {@code N weeks}.
     *
     * @param notes notes text
     * @return week count, or {@code null}
     */
    Integer weekCount(String notes) {
        Integer total = firstNumber(TOTAL_WEEKS, notes, 1);
        return total != null ? total : firstNumber(N_WEEKS, notes, 1);
    }

    /**
     * Reads the player capacity from {@code # of Players: 72}, the upper bound of
     * {@code 350-364 players}, or {@code N players} when not followed by "max".
     *
     * @param notes notes text
     * @return total inventory, or {@code null}
     */
    Integer totalInventory(String notes) {
        Integer count = firstNumber(PLAYER_COUNT, notes, 1);
        if (count != null) {
            return count;
        }
        count = firstNumber(PLAYER_RANGE, notes, 2);
        if (count != null) {
            return count;
        }
        return firstNumber(N_PLAYERS, notes, 1);
    }

    Integer vetSpots(String notes) {
        Integer spots = firstNumber(VET_SPOTS_AFTER, notes, 1);
        return spots != null ? spots : firstNumber(VET_SPOTS_BEFORE, notes, 1);
    }

    private static NoteEvent eventOf(String line) {
        for (NoteEvent event : NoteEvent.values()) {
            if (event.getKeyword().matcher(line).find()) {
                return event;
            }
        }
        return null;
    }

    private Instant eventDate(NoteEvent event, String line) {
        Matcher m = event.getKeyword().matcher(line);
        m.find();
        String afterKeyword = line.substring(m.end());
        Instant date = read(event, afterKeyword);
        if (date == null) {
            date = read(event, line);
        }
        if (date == null) {
            log.debug("No date for {} in '{}'", event, line);
        }
        return date;
    }

    /**
     * Reads the off dates written on an event line, e.g. {@code "Opening party 9/20, no games
     * 10/13"}.
     *
     * @param line notes line naming an event
     * @return dates between the off marker and the next event keyword; empty without a marker
     */
    List<Instant> offDatesBesideEvent(String line) {
        Matcher marker = OFF_MARKER.matcher(line);
        if (!marker.find()) {
            return List.of();
        }
        String segment = line.substring(marker.start());
        int end = segment.length();
        for (NoteEvent event : NoteEvent.values()) {
            Matcher keyword = event.getKeyword().matcher(segment);
            if (keyword.find()) {
                end = Math.min(end, keyword.start());
            }
        }
        return dateParser.findDates(segment.substring(0, end));
    }

    private Instant read(NoteEvent event, String text) {
        return event.isWithTime() ? dateParser.parseDateTime(text) : dateParser.parseDate(text);
    }

    private static Integer firstNumber(Pattern pattern, String text, int group) {
        if (text == null) {
            return null;
        }
        Matcher m = pattern.matcher(text);
        return m.find() ? TextUtils.toInteger(m.group(group)) : null;
    }
}
