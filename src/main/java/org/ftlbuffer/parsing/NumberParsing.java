package org.ftlbuffer.parsing;

import org.ftlbuffer.diagnostics.ErrorTemplates;
import org.ftlbuffer.diagnostics.Outcome;
import org.ftlbuffer.runtime.functions.LocaleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.text.ParsePosition;
import java.util.Locale;

/**
 * Parses numbers as displayed for a locale, the inverse of the NUMBER function.
 * <p>
 * The whole input must be a number: {@code "12abc"} fails instead of yielding 12. Any kind of space
 * is accepted where the locale groups with a space, so {@code "1 234,5"} parses for {@code lv-LV}
 * although the locale itself groups with a no-break space.
 */
public final class NumberParsing {

    private static final Logger LOG = LoggerFactory.getLogger(NumberParsing.class);

    private NumberParsing() {
    }

    /**
     * @param value      The display string, e.g. {@code "1.234,5"}.
     * @param localeCode The locale the string was formatted for, e.g. {@code de-DE}.
     * @return The finite number, or a {@code NUMBER_PARSE_FAILED} failure.
     */
    public static Outcome<Double> parseNumber(String value, String localeCode) {
        BigDecimal parsed = parse(value, LocaleContext.toLocale(localeCode));
        if (parsed == null || !Double.isFinite(parsed.doubleValue())) {
            LOG.debug("Could not parse number '{}' for locale {}", value, localeCode);
            return Outcome.failure(ErrorTemplates.numberParseFailed("number", value, localeCode));
        }
        return Outcome.of(parsed.doubleValue());
    }

    /**
     * Parses without loss of precision, for amounts that must not go through {@code double}.
     *
     * @param value      The display string, e.g. {@code "1 234,56"}.
     * @param localeCode The locale the string was formatted for.
     * @return The exact decimal value, or a {@code NUMBER_PARSE_FAILED} failure.
     */
    public static Outcome<BigDecimal> parseDecimal(String value, String localeCode) {
        BigDecimal parsed = parse(value, LocaleContext.toLocale(localeCode));
        if (parsed == null) {
            LOG.debug("Could not parse decimal '{}' for locale {}", value, localeCode);
            return Outcome.failure(ErrorTemplates.numberParseFailed("decimal", value, localeCode));
        }
        return Outcome.of(parsed);
    }

    /**
     * @return The value, or {@code null} if {@code value} is not entirely a finite number.
     */
    static BigDecimal parse(String value, Locale locale) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        if (text.isEmpty()) {
            return null;
        }
        NumberFormat format = NumberFormat.getNumberInstance(locale);
        if (!(format instanceof DecimalFormat decimalFormat)) {
            return null;
        }
        decimalFormat.setParseBigDecimal(true);
        text = normalize(text, decimalFormat.getDecimalFormatSymbols());

        ParsePosition position = new ParsePosition(0);
        Number number = decimalFormat.parse(text, position);
        if (position.getIndex() != text.length() || !(number instanceof BigDecimal decimal)) {
            // partial match, NaN or infinity
            return null;
        }
        return decimal;
    }

    private static String normalize(String text, DecimalFormatSymbols symbols) {
        String result = text;
        char grouping = symbols.getGroupingSeparator();
        if (Character.isSpaceChar(grouping)) {
            result = result.replace(' ', grouping).replace('\u00A0', grouping).replace('\u202F', grouping);
        }
        char minus = symbols.getMinusSign();
        if (minus != '-' && result.startsWith("-")) {
            result = minus + result.substring(1);
        }
        return result;
    }
}
