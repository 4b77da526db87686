package io.github.yok.leaguerow.parser;

import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.Location;
import java.util.Arrays;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps free-text venue descriptions ({@code "Hartley House\n413 W 46th Street"}) to a
 * {@link Location}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LocationCanonicalizer {

    /**
     * Finds the venue mentioned in the text.
     *
     * @param raw venue text (may span several lines)
     * @return the venue, or empty if no alias matches
     */
    public Optional<Location> canonicalize(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        return Arrays.stream(Location.values()).filter(l -> l.matches(raw)).findFirst();
    }

    /**
     * Canonicalizes the venue and resolves the {@code location} field.
     *
     * @param raw venue text (column H)
     * @param unresolved tracker for the current row
     * @return the canonical venue string, or {@code null} for an unknown venue
     */
    public String canonicalize(String raw, UnresolvedFields unresolved) {
        Optional<Location> location = canonicalize(raw);
        if (location.isEmpty()) {
            log.debug("Unknown venue '{}'", raw);
            return null;
        }
        unresolved.resolve(LeagueField.LOCATION);
        return location.get().getDisplayName();
    }
}
