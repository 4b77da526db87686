package io.github.yok.leaguerow.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Start instants of the early, veteran and open registration windows, plus the number of veteran
 * spots released when registration goes live.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class RegistrationWindows {

    private final Instant earlyRegistrationStartDateTime;

    private final Instant vetRegistrationStartDateTime;

    private final Instant openRegistrationStartDateTime;

    private final Integer numberVetSpotsToReleaseAtGoLive;
}
