package io.github.yok.leaguerow.parser;

/**
 * One step of the details-column pipeline.
 *
 * @param <T> value type the rule produces
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
interface DetailsRule<T> {

    /**
     * Evaluates the rule against the lines earlier rules left behind.
     *
     * @param lines remaining candidate lines
     * @return the match, or {@code null} if the rule does not apply
     */
    RuleMatch<T> apply(CandidateLines lines);
}
