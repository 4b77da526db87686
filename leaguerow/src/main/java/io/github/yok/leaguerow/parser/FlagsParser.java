package io.github.yok.leaguerow.parser;

import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.Division;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.LeagueFlags;
import io.github.yok.leaguerow.model.Sport;
import io.github.yok.leaguerow.parser.CandidateLines.Line;
import io.github.yok.leaguerow.util.CalendarUtil;
import io.github.yok.leaguerow.util.TextUtils;
import java.time.DayOfWeek;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the details column (column B): day of play, division, skill level, Dodgeball ball type and
 * signup style.
 *
 * <p>
 * The column is split into lines and evaluated by a fixed sequence of rules. A rule that consumes
 * its line hides it from every later rule, so the same text is never read twice:
 * </p>
 * <ol>
 * <li>day: the first line, consumed only when it holds nothing but the day name</li>
 * <li>division: first line mentioning {@code wtnb} or {@code open}, consumed</li>
 * <li>social/advanced: for Dodgeball the ball-type line is used verbatim and kept for the next
 * rule; otherwise the first skill-level line is consumed</li>
 * <li>sport sub-category (Dodgeball only): ball-type line, consumed</li>
 * </ol>
 *
 * <p>
 * Signup style is read last from the whole column, since the keywords that decide it are
 * unambiguous wherever they appear.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FlagsParser {

    static final String MIXED_SOCIAL_ADVANCED = "Mixed Social/Advanced";
    static final String SMALL_BALL = "Small Ball";
    static final String BIG_BALL = "Big Ball";
    static final String FOAM = "Foam";
    static final String TYPE_DRAFT = "Draft";
    static final String TYPE_NEWBIE = "Sign up with a newbie (randomized otherwise)";
    static final String TYPE_RANDOMIZED = "Randomized Teams";
    static final String TYPE_BUDDY = "Buddy Sign-up";

    private static final Pattern DAY = Pattern.compile(
            "\\b(" + CalendarUtil.DAY_TOKEN_ALTERNATION + ")\\b\\.?", Pattern.CASE_INSENSITIVE);

    private static final Pattern OPEN = Pattern.compile("\\bopen\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WTNB = Pattern.compile("wtnb", Pattern.CASE_INSENSITIVE);

    private static final Pattern SOCIAL = Pattern.compile("\\bsocial\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADVANCED = Pattern.compile(
            "\\b(advanced|competitive|intermediate)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern BALL_TYPE = Pattern.compile(
            "\\b(small|big|foam|no[-\\s]?sting)\\b|8\\.5", Pattern.CASE_INSENSITIVE);
    private static final Pattern SMALL_BALL_KEYWORD =
            Pattern.compile("\\b(small|no[-\\s]?sting)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BIG_BALL_KEYWORD =
            Pattern.compile("\\bbig\\b|8\\.5", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOAM_KEYWORD =
            Pattern.compile("\\bfoam\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DRAFT = Pattern.compile("\\bdraft", Pattern.CASE_INSENSITIVE);
    private static final Pattern WITH_NEWBIE =
            Pattern.compile("with.*new", Pattern.CASE_INSENSITIVE);
    private static final Pattern RANDOM = Pattern.compile("random", Pattern.CASE_INSENSITIVE);
    private static final Pattern BUDDY =
            Pattern.compile("buddy|friend|partner", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEFTOVER_PUNCTUATION = Pattern.compile("[\\s,.:;\\-]+");

    /**
     * Parses the details column.
     *
     * @param details multi-line details text (column B)
     * @param sport the row's sport, or {@code null} when unknown
     * @param unresolved tracker for the current row
     * @return the flags; unmatched values are {@code null} and {@code types} may be empty
     */
    public LeagueFlags parse(String details, Sport sport, UnresolvedFields unresolved) {
        List<String> texts = TextUtils.splitLines(details);
        CandidateLines lines = CandidateLines.of(texts);

        RuleMatch<String> day = dayRule().apply(lines);
        lines = consume(lines, day);

        RuleMatch<Division> division = divisionRule().apply(lines);
        lines = consume(lines, division);

        RuleMatch<String> social = socialOrAdvancedRule(sport).apply(lines);
        lines = consume(lines, social);

        RuleMatch<String> subCategory = null;
        if (sport == Sport.DODGEBALL) {
            subCategory = subCategoryRule().apply(lines);
            lines = consume(lines, subCategory);
        }

        List<String> types = signupTypes(texts);

        resolveIfPresent(day, LeagueField.DAY_OF_PLAY, unresolved);
        resolveIfPresent(division, LeagueField.DIVISION, unresolved);
        resolveIfPresent(social, LeagueField.SOCIAL_OR_ADVANCED, unresolved);
        resolveIfPresent(subCategory, LeagueField.SPORT_SUB_CATEGORY, unresolved);
        if (!types.isEmpty()) {
            unresolved.resolve(LeagueField.TYPES);
        }

        LeagueFlags flags = new LeagueFlags(valueOf(day), valueOf(division), valueOf(social),
                valueOf(subCategory), types);
        log.debug("Parsed details flags: {} (unconsumed lines: {})", flags, lines.asList().size());
        return flags;
    }

    /**
     * Maps the first line's day token to its display name.
     */
    DetailsRule<String> dayRule() {
        return lines -> {
            if (lines.isEmpty()) {
                return null;
            }
            Line first = lines.asList().get(0);
            Matcher m = DAY.matcher(first.getText());
            if (!m.find()) {
                return null;
            }
            DayOfWeek day = CalendarUtil.dayOf(m.group(1));
            String text = first.getText();
            String rest = text.substring(0, m.start()) + text.substring(m.end());
            String value = CalendarUtil.displayName(day);
            return LEFTOVER_PUNCTUATION.matcher(rest).replaceAll("").isEmpty()
                    ? RuleMatch.consuming(value, first.getIndex())
                    : RuleMatch.keeping(value);
        };
    }

    DetailsRule<Division> divisionRule() {
        return lines -> {
            for (Line line : lines.asList()) {
                if (WTNB.matcher(line.getText()).find()) {
                    return RuleMatch.consuming(Division.WTNB, line.getIndex());
                }
                if (OPEN.matcher(line.getText()).find()) {
                    return RuleMatch.consuming(Division.OPEN, line.getIndex());
                }
            }
            return null;
        };
    }

    /**
     * Dodgeball rows usually write skill level and ball type on one line ("Social Big Ball"), so
     * for that sport the ball-type line is taken verbatim and left for the sub-category rule.
     */
    DetailsRule<String> socialOrAdvancedRule(Sport sport) {
        DetailsRule<String> keywordRule = lines -> {
            for (Line line : lines.asList()) {
                boolean social = SOCIAL.matcher(line.getText()).find();
                boolean advanced = ADVANCED.matcher(line.getText()).find();
                if (social && advanced) {
                    return RuleMatch.consuming(MIXED_SOCIAL_ADVANCED, line.getIndex());
                }
                if (social || advanced) {
                    return RuleMatch.consuming(line.getText().trim(), line.getIndex());
                }
            }
            return null;
        };
        if (sport != Sport.DODGEBALL) {
            return keywordRule;
        }
        return lines -> {
            Line ballLine = lines.firstMatching(text -> BALL_TYPE.matcher(text).find());
            if (ballLine != null) {
                return RuleMatch.keeping(ballLine.getText().trim());
            }
            return keywordRule.apply(lines);
        };
    }

    DetailsRule<String> subCategoryRule() {
        return lines -> {
            for (Line line : lines.asList()) {
                String text = line.getText();
                if (SMALL_BALL_KEYWORD.matcher(text).find()) {
                    return RuleMatch.consuming(SMALL_BALL, line.getIndex());
                }
                if (BIG_BALL_KEYWORD.matcher(text).find()) {
                    return RuleMatch.consuming(BIG_BALL, line.getIndex());
                }
                if (FOAM_KEYWORD.matcher(text).find()) {
                    return RuleMatch.consuming(FOAM, line.getIndex());
                }
            }
            return null;
        };
    }

    /**
     * Determines the signup style. {@code draft} and {@code with ... new} are exclusive and win in
     * that order; otherwise randomized and buddy signups combine.
     *
     * @param lines every line of the details column
     * @return signup styles; empty when none is mentioned
     */
    List<String> signupTypes(List<String> lines) {
        if (lines.stream().anyMatch(l -> DRAFT.matcher(l).find())) {
            return List.of(TYPE_DRAFT);
        }
        if (lines.stream().anyMatch(l -> WITH_NEWBIE.matcher(l).find())) {
            return List.of(TYPE_NEWBIE);
        }
        boolean random = lines.stream().anyMatch(l -> RANDOM.matcher(l).find());
        boolean buddy = lines.stream().anyMatch(l -> BUDDY.matcher(l).find());
        if (random && buddy) {
            return List.of(TYPE_RANDOMIZED + ", " + TYPE_BUDDY);
        }
        if (random) {
            return List.of(TYPE_RANDOMIZED);
        }
        if (buddy) {
            return List.of(TYPE_BUDDY);
        }
        return List.of();
    }

    private static CandidateLines consume(CandidateLines lines, RuleMatch<?> match) {
        return match == null ? lines : lines.without(match.getConsumed());
    }

    private static void resolveIfPresent(RuleMatch<?> match, LeagueField field,
            UnresolvedFields unresolved) {
        if (match != null) {
            unresolved.resolve(field);
        }
    }

    private static <T> T valueOf(RuleMatch<T> match) {
        return match == null ? null : match.getValue();
    }
}
