package io.github.yok.leaguerow.parser;

import java.util.Set;
import lombok.Getter;
import lombok.ToString;

/**
 * Value produced by one details rule and the original line indices it consumed.
 *
 * @param <T> value type
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
final class RuleMatch<T> {

    private final T value;

    private final Set<Integer> consumed;

    private RuleMatch(T value, Set<Integer> consumed) {
        this.value = value;
        this.consumed = consumed;
    }

    /**
     * A match that removes its line from later rules.
     *
     * @param value matched value
     * @param lineIndex original index of the consumed line
     * @param <T> value type
     * @return the match
     */
    static <T> RuleMatch<T> consuming(T value, int lineIndex) {
        return new RuleMatch<>(value, Set.of(lineIndex));
    }

    /**
     * A match that leaves every line available to later rules.
     *
     * @param value matched value
     * @param <T> value type
     * @return the match
     */
    static <T> RuleMatch<T> keeping(T value) {
        return new RuleMatch<>(value, Set.of());
    }
}
