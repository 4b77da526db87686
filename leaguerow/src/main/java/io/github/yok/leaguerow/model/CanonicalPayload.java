package io.github.yok.leaguerow.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Canonical product payload assembled from one registration row.
 *
 * <p>
 * The property names and nesting are consumed one-to-one by the product-creation workflow and
 * must not be renamed. Every {@link Instant} that represents a calendar date is the
 * {@code 04:00 UTC} anchor of that date; registration start instants add the Eastern wall-clock
 * time of day to that anchor. Values that could not be derived are {@code null} (or an empty list)
 * and are listed in {@link RowParseResult#getUnresolvedFields()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class CanonicalPayload {

    private String sportName;

    private String dayOfPlay;

    // "Open" or "WTNB+"
    private String division;

    private String season;

    private Integer year;

    private String location;

    private OptionalLeagueInfo optionalLeagueInfo = new OptionalLeagueInfo();

    private ImportantDates importantDates = new ImportantDates();

    // formatted "h:mm a"
    private String leagueStartTime;

    private String leagueEndTime;

    private String alternativeStartTime;

    private String alternativeEndTime;

    private InventoryInfo inventoryInfo = new InventoryInfo();

    /**
     * Sport-dependent categorical details.
     */
    @Data
    public static class OptionalLeagueInfo {

        // Dodgeball only: "Small Ball", "Big Ball" or "Foam"
        private String sportSubCategory;

        private String socialOrAdvanced;

        private List<String> types = new ArrayList<>();
    }

    /**
     * Season, event and registration dates.
     */
    @Data
    public static class ImportantDates {

        private Instant seasonStartDate;

        private Instant seasonEndDate;

        private List<Instant> offDates = new ArrayList<>();

        private Instant newPlayerOrientationDateTime;

        private Instant scoutNightDateTime;

        private Instant openingPartyDate;

        private Instant closingPartyDate;

        private Instant rainDate;

        private Instant vetRegistrationStartDateTime;

        private Instant earlyRegistrationStartDateTime;

        private Instant openRegistrationStartDateTime;
    }

    /**
     * Price and inventory figures.
     */
    @Data
    public static class InventoryInfo {

        private BigDecimal price;

        private Integer totalInventory;

        private Integer numberVetSpotsToReleaseAtGoLive;
    }
}
