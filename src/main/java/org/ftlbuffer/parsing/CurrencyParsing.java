package org.ftlbuffer.parsing;

import org.ftlbuffer.diagnostics.ErrorTemplates;
import org.ftlbuffer.diagnostics.Outcome;
import org.ftlbuffer.runtime.functions.LocaleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses money as displayed for a locale, the inverse of the CURRENCY function.
 * <p>
 * The currency is taken from the first currency symbol or three-letter ISO code in the string; the
 * rest is parsed as a number of the locale. Symbols used by several currencies ({@code $}, {@code ¢},
 * {@code ₨}, {@code ₱}) are only accepted together with a default currency or when the currency can
 * be inferred from the locale's country.
 */
public final class CurrencyParsing {

    private static final Logger LOG = LoggerFactory.getLogger(CurrencyParsing.class);

    private static final Pattern CURRENCY = Pattern.compile("([€$£¥₹₽¢₡₦₧₨₩₪₫₱₴₵₸₺₼₾]|[A-Z]{3})");

    private static final Set<String> AMBIGUOUS_SYMBOLS = Set.of("$", "¢", "₨", "₱");

    private static final Map<String, String> SYMBOLS = Map.ofEntries(
            Map.entry("€", "EUR"),
            Map.entry("£", "GBP"),
            Map.entry("¥", "JPY"),
            Map.entry("₹", "INR"),
            Map.entry("₽", "RUB"),
            Map.entry("₡", "CRC"),
            Map.entry("₦", "NGN"),
            Map.entry("₧", "ESP"),
            Map.entry("₩", "KRW"),
            Map.entry("₪", "ILS"),
            Map.entry("₫", "VND"),
            Map.entry("₴", "UAH"),
            Map.entry("₵", "GHS"),
            Map.entry("₸", "KZT"),
            Map.entry("₺", "TRY"),
            Map.entry("₼", "AZN"),
            Map.entry("₾", "GEL"));

    private CurrencyParsing() {
    }

    /**
     * Parses a string whose currency is an unambiguous symbol or an ISO code.
     *
     * @param value      The display string, e.g. {@code "1.234,56 €"} or {@code "USD 1,234.56"}.
     * @param localeCode The locale the amount was formatted for.
     * @return The amount and currency, or a failure.
     */
    public static Outcome<CurrencyAmount> parseCurrency(String value, String localeCode) {
        return parseCurrency(value, localeCode, null, false);
    }

    /**
     * @param value           The display string.
     * @param localeCode      The locale the amount was formatted for.
     * @param defaultCurrency ISO code used for an ambiguous symbol, may be {@code null}.
     * @param inferFromLocale Whether an ambiguous symbol without default takes the currency of the
     *                        locale's country.
     * @return The amount and currency; a {@code CURRENCY_PARSE_FAILED} failure if no currency or
     * amount is found, an {@code AMBIGUOUS_CURRENCY} failure if an ambiguous symbol cannot be
     * resolved.
     */
    public static Outcome<CurrencyAmount> parseCurrency(String value, String localeCode,
                                                        String defaultCurrency, boolean inferFromLocale) {
        if (value == null) {
            return Outcome.failure(ErrorTemplates.currencyNotFound("null"));
        }
        Matcher matcher = CURRENCY.matcher(value);
        if (!matcher.find()) {
            return Outcome.failure(ErrorTemplates.currencyNotFound(value));
        }
        String found = matcher.group(1);
        Locale locale = LocaleContext.toLocale(localeCode);

        String code;
        if (AMBIGUOUS_SYMBOLS.contains(found)) {
            if (defaultCurrency != null) {
                code = defaultCurrency;
            } else if (inferFromLocale) {
                Currency inferred = currencyOf(locale);
                if (inferred == null) {
                    return Outcome.failure(ErrorTemplates.noCurrencyForLocale(found, localeCode));
                }
                code = inferred.getCurrencyCode();
            } else {
                return Outcome.failure(ErrorTemplates.ambiguousCurrency(found, value));
            }
        } else {
            code = SYMBOLS.getOrDefault(found, found);
        }

        Currency currency;
        try {
            currency = Currency.getInstance(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejected currency '{}' in '{}': {}", code, value, e.getMessage());
            return Outcome.failure(ErrorTemplates.unknownCurrency(code, value));
        }

        String amountText = strip(value.replace(found, ""));
        BigDecimal amount = NumberParsing.parse(amountText, locale);
        if (amount == null) {
            LOG.debug("Could not parse amount '{}' of '{}' for locale {}", amountText, value, localeCode);
            return Outcome.failure(ErrorTemplates.currencyAmountParseFailed(amountText, value));
        }
        return Outcome.of(new CurrencyAmount(amount, currency));
    }

    private static Currency currencyOf(Locale locale) {
        if (locale.getCountry().isEmpty()) {
            return null;
        }
        try {
            return Currency.getInstance(locale);
        } catch (IllegalArgumentException e) {
            LOG.debug("No currency for country of {}: {}", locale.toLanguageTag(), e.getMessage());
            return null;
        }
    }

    private static String strip(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
