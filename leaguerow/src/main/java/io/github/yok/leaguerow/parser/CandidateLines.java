package io.github.yok.leaguerow.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable list of the details-column lines that no rule has consumed yet.
 *
 * <p>
 * Each line keeps the index it had in the original cell, so a rule can report which lines it
 * consumed and the pipeline can hand the next rule a filtered copy instead of mutating a shared
 * list.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
@EqualsAndHashCode
final class CandidateLines {

    private final List<Line> lines;

    private CandidateLines(List<Line> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    /**
     * Wraps the lines of a cell, numbering them from zero.
     *
     * @param texts cell lines
     * @return candidate lines
     */
    static CandidateLines of(List<String> texts) {
        List<Line> lines = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            lines.add(new Line(i, texts.get(i)));
        }
        return new CandidateLines(lines);
    }

    /**
     * Returns a copy without the given original indices.
     *
     * @param consumed original indices to drop
     * @return remaining lines
     */
    CandidateLines without(Set<Integer> consumed) {
        if (consumed.isEmpty()) {
            return this;
        }
        List<Line> remaining = new ArrayList<>(lines.size());
        for (Line line : lines) {
            if (!consumed.contains(line.getIndex())) {
                remaining.add(line);
            }
        }
        return new CandidateLines(remaining);
    }

    /**
     * Returns the first remaining line that satisfies the predicate.
     *
     * @param predicate test applied to the line text
     * @return the line, or {@code null}
     */
    Line firstMatching(Predicate<String> predicate) {
        return lines.stream().filter(l -> predicate.test(l.getText())).findFirst().orElse(null);
    }

    List<Line> asList() {
        return lines;
    }

    boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * One line of the cell and its original position.
     */
    @Getter
    @ToString
    @EqualsAndHashCode
    static final class Line {

        private final int index;
        private final String text;

        Line(int index, String text) {
            this.index = index;
            this.text = text;
        }
    }
}
