package io.github.yok.leaguerow.core;

import com.google.common.base.Strings;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Spreadsheet columns of a registration row.
 *
 * <p>
 * Required columns must be present as keys in the cell map (their value may be empty). Optional
 * columns carry information the engine does not read.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum RowColumn {

    A("sport", true),
    B("day and league details", true),
    C("notes", true),
    D("season start date", true),
    E("season end date", true),
    F("price", true),
    G("play times", true),
    H("location", true),
    I("contact emails", false),
    J("veteran eligibility", false),
    K("full schedule dates", false),
    L("registration notes", false),
    M("early registration", true),
    N("veteran registration", true),
    O("open registration", true);

    private final String description;

    private final boolean required;

    /**
     * Returns the cell map key of this column.
     *
     * @return the column letter
     */
    public String key() {
        return name();
    }

    /**
     * Reads this column from a row.
     *
     * @param cells row cells keyed by column letter
     * @return cell text, or an empty string if the cell is absent or {@code null}
     */
    public String read(Map<String, String> cells) {
        return Strings.nullToEmpty(cells.get(key()));
    }

    /**
     * Returns the required columns whose keys are absent from a row.
     *
     * @param cells row cells keyed by column letter
     * @return missing required columns, in column order
     */
    public static List<RowColumn> missingRequired(Map<String, String> cells) {
        return Arrays.stream(values()).filter(RowColumn::isRequired)
                .filter(c -> !cells.containsKey(c.key())).collect(Collectors.toList());
    }
}
