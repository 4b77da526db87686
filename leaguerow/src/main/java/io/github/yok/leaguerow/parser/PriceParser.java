package io.github.yok.leaguerow.parser;

import io.github.yok.leaguerow.core.UnresolvedFields;
import io.github.yok.leaguerow.model.LeagueField;
import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Extracts the price from text such as {@code "$45"}, {@code "$45.50"} or
 * {@code "Registration fee is $45 per person"}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PriceParser {

    private static final Pattern PRICE = Pattern.compile("\\$?\\s*(\\d+(?:\\.\\d{1,2})?)");

    /**
     * Returns the first currency-like number as written, without the currency sign.
     *
     * @param raw price text (may be {@code null})
     * @return the digits (e.g. {@code "45.50"}), or an empty string if there is no number
     */
    public String extractPriceText(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        Matcher m = PRICE.matcher(raw);
        return m.find() ? m.group(1) : "";
    }

    /**
     * Parses the price and resolves the {@code price} field.
     *
     * @param raw price text (column F)
     * @param unresolved tracker for the current row
     * @return the price, or {@code null} if there is no number
     */
    public BigDecimal parsePrice(String raw, UnresolvedFields unresolved) {
        String digits = extractPriceText(raw);
        if (digits.isEmpty()) {
            log.debug("No price found in '{}'", raw);
            return null;
        }
        unresolved.resolve(LeagueField.PRICE);
        return new BigDecimal(digits);
    }
}
