package io.github.yok.leaguerow.config;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the command-line host, bound from {@code league-row.*} in {@code application.yml}.
 *
 * <ul>
 * <li>{@code league-row.zone}: zone that defines "today" for year inference (default
 * {@code America/New_York})</li>
 * <li>{@code league-row.today}: optional ISO date ({@code 2025-09-01}) that pins "today" for
 * reproducible runs</li>
 * <li>{@code league-row.pretty-print}: whether the JSON result is indented (default
 * {@code true})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "league-row")
@Data
public class LeagueRowConfig {

    private String zone = "America/New_York";

    private String today;

    private boolean prettyPrint = true;

    /**
     * Builds the clock the row parser infers years from.
     *
     * @return a clock fixed at the start of {@code today} when it is set, otherwise the system
     *         clock in {@code zone}
     * @throws java.time.DateTimeException if {@code zone} or {@code today} is malformed
     */
    public Clock clock() {
        ZoneId zoneId = ZoneId.of(zone);
        if (StringUtils.isBlank(today)) {
            return Clock.system(zoneId);
        }
        LocalDate fixedDay = LocalDate.parse(today.trim());
        return Clock.fixed(fixedDay.atStartOfDay(zoneId).toInstant(), zoneId);
    }
}
