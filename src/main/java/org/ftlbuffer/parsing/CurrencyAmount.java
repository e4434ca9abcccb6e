package org.ftlbuffer.parsing;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.Objects;

/**
 * An amount of money read from a display string.
 *
 * @param amount   The exact amount.
 * @param currency The currency the string named or implied.
 */
public record CurrencyAmount(BigDecimal amount, Currency currency) {

    public CurrencyAmount {
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(currency, "currency");
    }

    /**
     * @return The ISO 4217 code, e.g. {@code EUR}.
     */
    public String currencyCode() {
        return currency.getCurrencyCode();
    }
}
