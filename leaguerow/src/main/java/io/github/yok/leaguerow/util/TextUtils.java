package io.github.yok.leaguerow.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Text helpers shared by every cell parser.
 *
 * <p>
 * Spreadsheet cells arrive with Windows or Unix line endings, non-breaking spaces, runs of blank
 * lines and inconsistent casing. These helpers reduce that noise to a predictable shape before any
 * keyword or pattern matching takes place.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TextUtils {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\u00A0]+");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private TextUtils() {}

    /**
     * Splits a multi-line cell into trimmed, whitespace-collapsed, non-blank lines.
     *
     * @param text raw cell text (may be {@code null})
     * @return lines in their original order; never {@code null}
     */
    public static List<String> splitLines(String text) {
        if (StringUtils.isBlank(text)) {
            return List.of();
        }
        return Arrays.stream(LINE_BREAK.split(text)).map(TextUtils::collapseWhitespace)
                .filter(StringUtils::isNotEmpty).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Collapses every whitespace run (including non-breaking spaces) into a single space and trims
     * the result.
     *
     * @param text input text (may be {@code null})
     * @return normalized text, or an empty string for {@code null}
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Lower-cases text using a locale-independent mapping.
     *
     * @param text input text (may be {@code null})
     * @return lower-case text, or an empty string for {@code null}
     */
    public static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * Title-cases a single word ({@code "KICKBALL"} becomes {@code "Kickball"}).
     *
     * @param word input word (may be {@code null})
     * @return title-cased word, or an empty string for blank input
     */
    public static String titleCase(String word) {
        if (StringUtils.isBlank(word)) {
            return "";
        }
        String trimmed = word.trim();
        return trimmed.substring(0, 1).toUpperCase(Locale.ROOT)
                + trimmed.substring(1).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the first whitespace-delimited word of the text.
     *
     * @param text input text (may be {@code null})
     * @return first word, or an empty string when there is none
     */
    public static String firstWord(String text) {
        String normalized = collapseWhitespace(text);
        int space = normalized.indexOf(' ');
        return space < 0 ? normalized : normalized.substring(0, space);
    }

    /**
     * Parses a run of ASCII digits that a regular expression has already isolated.
     *
     * @param digits digit string
     * @return parsed value, or {@code null} when the text is not a plain integer
     */
    public static Integer toInteger(String digits) {
        if (!StringUtils.isNumeric(digits)) {
            return null;
        }
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            // longer than an int; treated the same as no number
            return null;
        }
    }
}
