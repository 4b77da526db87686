package io.github.yok.leaguerow.core;

import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.Sport;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Caller-owned accumulator of the payload fields that are still unresolved for one row.
 *
 * <p>
 * The set is seeded once and can only shrink: every parser that produces a confident, non-empty
 * value calls {@link #resolve(LeagueField)} for the field it filled. There is no way to add a
 * field back, so a field that has been resolved stays resolved for the rest of the parse.
 * </p>
 *
 * <p>
 * An instance belongs to a single row parse and is not thread-safe; concurrent row parses each
 * create their own.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class UnresolvedFields {

    // EnumSet iterates in LeagueField declaration order
    private final EnumSet<LeagueField> remaining;

    private UnresolvedFields(Set<LeagueField> seed) {
        this.remaining = seed.isEmpty() ? EnumSet.noneOf(LeagueField.class) : EnumSet.copyOf(seed);
    }

    /**
     * Seeds a tracker with every field relevant to a sport.
     *
     * @param sport the row's sport, or {@code null} when unknown
     * @return new tracker
     */
    public static UnresolvedFields forSport(Sport sport) {
        return new UnresolvedFields(SportFieldRelevance.relevantFields(sport));
    }

    /**
     * Seeds a tracker with an explicit set of fields.
     *
     * @param fields fields to track
     * @return new tracker
     */
    public static UnresolvedFields of(LeagueField... fields) {
        return new UnresolvedFields(Set.copyOf(Arrays.asList(fields)));
    }

    /**
     * Marks a field as resolved. Resolving a field that is not tracked (irrelevant to the sport,
     * or already resolved) has no effect.
     *
     * @param field the field a parser just filled
     * @return {@code true} if the field was still unresolved
     */
    public boolean resolve(LeagueField field) {
        boolean removed = remaining.remove(field);
        if (removed) {
            log.debug("Resolved field: {}", field.getKey());
        }
        return removed;
    }

    /**
     * Returns whether a field is still unresolved.
     *
     * @param field field to check
     * @return {@code true} if the field is tracked and unresolved
     */
    public boolean contains(LeagueField field) {
        return remaining.contains(field);
    }

    public int size() {
        return remaining.size();
    }

    public boolean isEmpty() {
        return remaining.isEmpty();
    }

    /**
     * Returns the unresolved field keys, in reporting order.
     *
     * @return immutable snapshot of the remaining keys
     */
    public List<String> toKeys() {
        return remaining.stream().map(LeagueField::getKey)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return toKeys().toString();
    }
}
