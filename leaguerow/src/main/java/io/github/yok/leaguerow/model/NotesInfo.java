package io.github.yok.leaguerow.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Values extracted from the free-form notes column.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@Builder
public class NotesInfo {

    private final Instant newPlayerOrientationDateTime;

    private final Instant scoutNightDateTime;

    private final Instant openingPartyDate;

    private final Instant closingPartyDate;

    private final Instant rainDate;

    // ascending, without duplicates
    @Builder.Default
    private final List<Instant> offDates = List.of();

    private final Integer weekCount;

    private final Integer totalInventory;

    // veteran carve-out mentioned in the notes, e.g. "20 vet spots"
    private final Integer vetSpots;
}
