package io.github.yok.leaguerow.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of parsing one registration row: the canonical payload plus the keys of every field that
 * no parser could fill with confidence.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor
public class RowParseResult {

    private final CanonicalPayload payload;

    // LeagueField keys in declaration order
    private final List<String> unresolvedFields;
}
