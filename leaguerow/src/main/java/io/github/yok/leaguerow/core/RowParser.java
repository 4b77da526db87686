package io.github.yok.leaguerow.core;

import io.github.yok.leaguerow.model.CanonicalPayload;
import io.github.yok.leaguerow.model.CanonicalPayload.ImportantDates;
import io.github.yok.leaguerow.model.CanonicalPayload.InventoryInfo;
import io.github.yok.leaguerow.model.CanonicalPayload.OptionalLeagueInfo;
import io.github.yok.leaguerow.model.LeagueField;
import io.github.yok.leaguerow.model.LeagueFlags;
import io.github.yok.leaguerow.model.NotesInfo;
import io.github.yok.leaguerow.model.RegistrationWindows;
import io.github.yok.leaguerow.model.RowParseResult;
import io.github.yok.leaguerow.model.SeasonDates;
import io.github.yok.leaguerow.model.Sport;
import io.github.yok.leaguerow.model.TimeRange;
import io.github.yok.leaguerow.parser.FlagsParser;
import io.github.yok.leaguerow.parser.FlexibleDateParser;
import io.github.yok.leaguerow.parser.LocationCanonicalizer;
import io.github.yok.leaguerow.parser.NotesParser;
import io.github.yok.leaguerow.parser.PriceParser;
import io.github.yok.leaguerow.parser.RegistrationWindowParser;
import io.github.yok.leaguerow.parser.SeasonDateParser;
import io.github.yok.leaguerow.parser.TimeRangeParser;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts one spreadsheet registration row into a {@link CanonicalPayload} and the list of fields
 * that still need a human decision.
 *
 * <p>
 * This class only composes the field parsers: each parser reads its cells and resolves the fields
 * it fills on the row's {@link UnresolvedFields}, and the results are copied into the payload
 * as-is. A malformed cell never raises an exception; it leaves its field {@code null} and
 * unresolved.
 * </p>
 *
 * <p>
 * Instances hold no per-row state and may be shared between threads. The only external input is
 * the {@link Clock} used to infer missing years.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RowParser {

    private final SeasonDateParser seasonDateParser;
    private final TimeRangeParser timeRangeParser;
    private final PriceParser priceParser;
    private final LocationCanonicalizer locationCanonicalizer;
    private final FlagsParser flagsParser;
    private final NotesParser notesParser;
    private final RegistrationWindowParser registrationWindowParser;

    /**
     * Creates a row parser whose year inference is relative to the given clock.
     *
     * @param clock clock whose zone defines "today"
     */
    public RowParser(Clock clock) {
        FlexibleDateParser dateParser = new FlexibleDateParser(clock);
        this.seasonDateParser = new SeasonDateParser(dateParser);
        this.timeRangeParser = new TimeRangeParser();
        this.priceParser = new PriceParser();
        this.locationCanonicalizer = new LocationCanonicalizer();
        this.flagsParser = new FlagsParser();
        this.notesParser = new NotesParser(dateParser);
        this.registrationWindowParser = new RegistrationWindowParser(dateParser);
    }

    /**
     * Parses one row.
     *
     * @param rawCells cells keyed by column letter ({@code "A"} to {@code "O"}); values may be
     *        empty
     * @param sportHint sport chosen by the caller, or {@code null}/blank to read column A
     * @return payload and unresolved field keys
     * @throws InvalidRowException if {@code rawCells} is {@code null} or a required column key is
     *         absent
     */
    public RowParseResult parseRow(Map<String, String> rawCells, String sportHint) {
        validate(rawCells);

        String sportText =
                StringUtils.isNotBlank(sportHint) ? sportHint : RowColumn.A.read(rawCells);
        Sport sport = Sport.fromText(sportText).orElse(null);
        UnresolvedFields unresolved = UnresolvedFields.forSport(sport);
        if (sport != null) {
            unresolved.resolve(LeagueField.SPORT_NAME);
        } else {
            log.debug("Unknown sport '{}'", sportText);
        }

        LeagueFlags flags = flagsParser.parse(RowColumn.B.read(rawCells), sport, unresolved);
        SeasonDates seasonDates = seasonDateParser.parse(RowColumn.D.read(rawCells),
                RowColumn.E.read(rawCells), unresolved);
        TimeRange times = timeRangeParser.parse(RowColumn.G.read(rawCells), unresolved);
        String location =
                locationCanonicalizer.canonicalize(RowColumn.H.read(rawCells), unresolved);
        NotesInfo notes = notesParser.parse(RowColumn.C.read(rawCells), unresolved);

        CanonicalPayload payload = new CanonicalPayload();
        payload.setSportName(sport == null ? null : sport.getDisplayName());
        payload.setDayOfPlay(flags.getDayOfPlay());
        payload.setDivision(
                flags.getDivision() == null ? null : flags.getDivision().getDisplayName());
        payload.setSeason(
                seasonDates.getSeason() == null ? null : seasonDates.getSeason().getDisplayName());
        payload.setYear(seasonDates.getYear());
        payload.setLocation(location);

        OptionalLeagueInfo leagueInfo = payload.getOptionalLeagueInfo();
        leagueInfo.setSportSubCategory(flags.getSportSubCategory());
        leagueInfo.setSocialOrAdvanced(flags.getSocialOrAdvanced());
        leagueInfo.setTypes(new ArrayList<>(flags.getTypes()));

        if (times != null) {
            payload.setLeagueStartTime(TimeRangeParser.format(times.getStart1()));
            payload.setLeagueEndTime(TimeRangeParser.format(times.getEnd1()));
            payload.setAlternativeStartTime(TimeRangeParser.format(times.getStart2()));
            payload.setAlternativeEndTime(TimeRangeParser.format(times.getEnd2()));
        }

        InventoryInfo inventory = payload.getInventoryInfo();
        inventory.setPrice(priceParser.parsePrice(RowColumn.F.read(rawCells), unresolved));
        inventory.setTotalInventory(notes.getTotalInventory());

        RegistrationWindows windows = registrationWindowParser.parse(RowColumn.M.read(rawCells),
                RowColumn.N.read(rawCells), RowColumn.O.read(rawCells), notes.getVetSpots(),
                notes.getTotalInventory(), unresolved);
        inventory.setNumberVetSpotsToReleaseAtGoLive(windows.getNumberVetSpotsToReleaseAtGoLive());

        ImportantDates dates = payload.getImportantDates();
        dates.setSeasonStartDate(seasonDates.getSeasonStartDate());
        dates.setSeasonEndDate(seasonDates.getSeasonEndDate());
        dates.setOffDates(new ArrayList<>(notes.getOffDates()));
        dates.setNewPlayerOrientationDateTime(notes.getNewPlayerOrientationDateTime());
        dates.setScoutNightDateTime(notes.getScoutNightDateTime());
        dates.setOpeningPartyDate(notes.getOpeningPartyDate());
        dates.setClosingPartyDate(notes.getClosingPartyDate());
        dates.setRainDate(notes.getRainDate());
        dates.setEarlyRegistrationStartDateTime(windows.getEarlyRegistrationStartDateTime());
        dates.setVetRegistrationStartDateTime(windows.getVetRegistrationStartDateTime());
        dates.setOpenRegistrationStartDateTime(windows.getOpenRegistrationStartDateTime());

        if (notes.getWeekCount() != null) {
            log.debug("Season length from notes: {} weeks", notes.getWeekCount());
        }
        log.info("Parsed row. Sport [{}], unresolved fields: {}",
                sport == null ? sportText : sport.getDisplayName(), unresolved.size());
        return new RowParseResult(payload, unresolved.toKeys());
    }

    private static void validate(Map<String, String> rawCells) {
        if (rawCells == null) {
            throw new InvalidRowException("Row cells must not be null.");
        }
        List<RowColumn> missing = RowColumn.missingRequired(rawCells);
        if (!missing.isEmpty()) {
            throw new InvalidRowException("Row is missing required columns: " + missing.stream()
                    .map(c -> c.key() + " (" + c.getDescription() + ")")
                    .collect(Collectors.joining(", ")));
        }
    }
}
