package io.github.yok.leaguerow.parser;

import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.RegistrationWindows;
import io.github.yok.leaguerow.util.TextUtils;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses the early, veteran and open registration columns (M, N and O) into start instants, and
 * determines how many veteran spots are released when registration goes live.
 *
 * <p>
 * Cells look like {@code "Weds, Sept. 3rd, 6pm"}, {@code "Veteran registration: Sept 17th 7PM"} or
 * {@code "Open Registration starts 9/4 at 6pm through 9/10"}. A leading registration label and a
 * trailing {@code through/until} clause are stripped before the date-time is read.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class RegistrationWindowParser {

    private static final Pattern LABEL_PREFIX = Pattern.compile(
            "^\\s*(?:early|vet(?:eran)?|open)?\\s*registration\\s*"
                    + "(?:opens?|starts?|begins?)?\\s*[:\\-\\u2013]?\\s*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern UNTIL_SUFFIX = Pattern.compile(
            "\\s*\\b(?:through|thru|until|till)\\b.*$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // the number must not be the tail of a date or clock time
    private static final Pattern COUNT_BEFORE_KEYWORD = Pattern.compile(
            "(?<![\\d/:\\-\\u2013])\\b(\\d+)\\s*(?:vet(?:eran)?s?|spots?|inventory)\\b",
            Pattern.CASE_INSENSITIVE);

    // excludes dates, clock times and ordinals following the keyword
    private static final Pattern COUNT_AFTER_KEYWORD = Pattern.compile(
            "\\b(?:vet(?:eran)?s?|spots?|inventory)\\s*:?\\s*(\\d+)"
                    + "(?![\\d/:\\-\\u2013]|st|nd|rd|th|\\s*[ap]\\.?m)",
            Pattern.CASE_INSENSITIVE);

    private final FlexibleDateParser dateParser;

    /**
     * Parses the three registration columns.
     *
     * @param rawEarly early registration text (column M)
     * @param rawVet veteran registration text (column N)
     * @param rawOpen open registration text (column O)
     * @param notesVetSpots veteran carve-out found in the notes, or {@code null}
     * @param totalInventory total inventory found in the notes, or {@code null}
     * @param unresolved tracker for the current row
     * @return the windows; unparseable starts are {@code null}
     */
    public RegistrationWindows parse(String rawEarly, String rawVet, String rawOpen,
            Integer notesVetSpots, Integer totalInventory, UnresolvedFields unresolved) {
        Instant early = parseStart(rawEarly);
        Instant vet = parseStart(rawVet);
        Instant open = parseStart(rawOpen);

        Integer vetSpots = vetSpotCount(rawVet);
        if (vetSpots == null) {
            vetSpots = notesVetSpots != null ? notesVetSpots : totalInventory;
        }

        resolveIfPresent(early, LeagueField.EARLY_REGISTRATION_START_DATE_TIME, unresolved);
        resolveIfPresent(vet, LeagueField.VET_REGISTRATION_START_DATE_TIME, unresolved);
        resolveIfPresent(open, LeagueField.OPEN_REGISTRATION_START_DATE_TIME, unresolved);
        resolveIfPresent(vetSpots, LeagueField.NUMBER_VET_SPOTS_TO_RELEASE_AT_GO_LIVE, unresolved);

        RegistrationWindows windows = new RegistrationWindows(early, vet, open, vetSpots);
        log.debug("Parsed registration windows: {}", windows);
        return windows;
    }

    /**
     * Parses one registration column into its start instant.
     *
     * @param raw registration text
     * @return the start, or {@code null} for empty or unparseable text
     */
    public Instant parseStart(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        return dateParser.parseDateTime(stripBoilerplate(raw));
    }

    /**
     * Removes the registration label and any {@code through/until} clause.
     *
     * @param raw registration text
     * @return the date-time part
     */
    String stripBoilerplate(String raw) {
        String text = TextUtils.collapseWhitespace(raw);
        text = LABEL_PREFIX.matcher(text).replaceFirst("");
        return UNTIL_SUFFIX.matcher(text).replaceFirst("").trim();
    }

    /**
     * Looks for a veteran spot count near {@code vet}, {@code spot} or {@code inventory}.
     *
     * @param rawVet veteran registration text, possibly multi-line
     * @return the count, or {@code null}
     */
    Integer vetSpotCount(String rawVet) {
        if (StringUtils.isBlank(rawVet)) {
            return null;
        }
        Matcher m = COUNT_BEFORE_KEYWORD.matcher(rawVet);
        if (m.find()) {
            return TextUtils.toInteger(m.group(1));
        }
        m = COUNT_AFTER_KEYWORD.matcher(rawVet);
        return m.find() ? TextUtils.toInteger(m.group(1)) : null;
    }

    private static void resolveIfPresent(Object value, LeagueField field,
            UnresolvedFields unresolved) {
        if (value != null) {
            unresolved.resolve(field);
        }
    }
}
