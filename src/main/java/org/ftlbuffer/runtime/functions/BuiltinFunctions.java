package org.ftlbuffer.runtime.functions;

import org.ftlbuffer.util.NumericValues;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.FormatStyle;
import java.util.Currency;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The built-in NUMBER, DATETIME and CURRENCY functions.
 * <p>
 * All three expect the value as the first positional argument and the locale code as the last
 * one; the resolver appends the locale automatically. Options are read from the named arguments
 * under their FTL names.
 */
public final class BuiltinFunctions {

    /** Result of DATETIME for a string that is not an ISO-8601 date or date-time. */
    public static final String INVALID_DATETIME = "{?DATETIME}";

    public static final BuiltinFunction NUMBER = new BuiltinFunction("NUMBER", BuiltinFunctions::number, true);
    public static final BuiltinFunction DATETIME = new BuiltinFunction("DATETIME", BuiltinFunctions::datetime, true);
    public static final BuiltinFunction CURRENCY = new BuiltinFunction("CURRENCY", BuiltinFunctions::currency, true);

    private BuiltinFunctions() {
    }

    /**
     * @return All built-in functions.
     */
    public static List<BuiltinFunction> all() {
        return List.of(NUMBER, DATETIME, CURRENCY);
    }

    /**
     * {@code NUMBER(value, minimumFractionDigits: 0, maximumFractionDigits: 3, useGrouping: true)}.
     * Rounds half to even.
     */
    static String number(List<Object> positional, Map<String, Object> named) {
        BigDecimal value = numericValue("NUMBER", positional);
        Locale locale = locale(positional);
        int minimum = intOption(named, "minimumFractionDigits", 0);
        int maximum = Math.max(minimum, intOption(named, "maximumFractionDigits", 3));

        NumberFormat format = NumberFormat.getNumberInstance(locale);
        format.setMinimumFractionDigits(minimum);
        format.setMaximumFractionDigits(maximum);
        format.setGroupingUsed(booleanOption(named, "useGrouping", true));
        format.setRoundingMode(RoundingMode.HALF_EVEN);
        return format.format(value);
    }

    /**
     * {@code DATETIME(value, dateStyle: "medium", timeStyle: none)}.
     * Accepts {@code java.time} values, {@link Date} and ISO-8601 strings; values without a zone are
     * taken as UTC.
     */
    static String datetime(List<Object> positional, Map<String, Object> named) {
        Object value = requireValue("DATETIME", positional);
        Locale locale = locale(positional);
        ZonedDateTime dateTime;
        if (value instanceof CharSequence text) {
            dateTime = parseIsoDateTime(text.toString().trim());
            if (dateTime == null) {
                return INVALID_DATETIME;
            }
        } else {
            dateTime = toZonedDateTime(value);
        }

        FormatStyle dateStyle = formatStyle(named.get("dateStyle"), FormatStyle.MEDIUM);
        FormatStyle timeStyle = formatStyle(named.get("timeStyle"), null);
        DateTimeFormatter formatter = timeStyle == null
                ? DateTimeFormatter.ofLocalizedDate(dateStyle)
                : DateTimeFormatter.ofLocalizedDateTime(dateStyle, timeStyle);
        return formatter.withLocale(locale).format(dateTime);
    }

    /**
     * {@code CURRENCY(value, currency: "EUR", currencyDisplay: "symbol" | "code" | "name")}.
     * Uses the fraction digits defined for the currency.
     */
    static String currency(List<Object> positional, Map<String, Object> named) {
        BigDecimal value = numericValue("CURRENCY", positional);
        Locale locale = locale(positional);
        Object code = named.get("currency");
        if (code == null) {
            throw new IllegalArgumentException("CURRENCY requires a 'currency' option with an ISO 4217 code");
        }
        Currency currency = Currency.getInstance(code.toString().trim().toUpperCase(Locale.ROOT));
        String display = named.getOrDefault("currencyDisplay", "symbol").toString();

        switch (display) {
            case "symbol", "code" -> {
                NumberFormat format = NumberFormat.getCurrencyInstance(locale);
                format.setCurrency(currency);
                applyCurrencyDigits(format, currency);
                if ("code".equals(display) && format instanceof DecimalFormat decimalFormat) {
                    DecimalFormatSymbols symbols = decimalFormat.getDecimalFormatSymbols();
                    symbols.setCurrencySymbol(currency.getCurrencyCode() + " ");
                    decimalFormat.setDecimalFormatSymbols(symbols);
                }
                return format.format(value).trim();
            }
            case "name" -> {
                NumberFormat format = NumberFormat.getNumberInstance(locale);
                applyCurrencyDigits(format, currency);
                return format.format(value) + " " + currency.getDisplayName(locale);
            }
            default -> throw new IllegalArgumentException(
                    "Invalid currencyDisplay '" + display + "', expected symbol, code or name");
        }
    }

    private static void applyCurrencyDigits(NumberFormat format, Currency currency) {
        int digits = currency.getDefaultFractionDigits();
        if (digits >= 0) {
            format.setMinimumFractionDigits(digits);
            format.setMaximumFractionDigits(digits);
        }
        format.setRoundingMode(RoundingMode.HALF_EVEN);
    }

    private static Object requireValue(String function, List<Object> positional) {
        if (positional.isEmpty() || positional.get(0) == null) {
            throw new IllegalArgumentException(function + " requires a value as its first argument");
        }
        return positional.get(0);
    }

    private static BigDecimal numericValue(String function, List<Object> positional) {
        Object value = requireValue(function, positional);
        return NumericValues.toBigDecimal(value).orElseThrow(() -> new IllegalArgumentException(
                function + " expects a number, got " + value.getClass().getSimpleName()));
    }

    private static Locale locale(List<Object> positional) {
        if (positional.size() < 2 || positional.get(positional.size() - 1) == null) {
            return LocaleContext.FALLBACK_LOCALE;
        }
        return LocaleContext.toLocale(positional.get(positional.size() - 1).toString());
    }

    private static int intOption(Map<String, Object> named, String name, int defaultValue) {
        Object value = named.get(name);
        if (value == null) {
            return defaultValue;
        }
        BigDecimal number = NumericValues.toBigDecimal(value).orElseThrow(
                () -> new IllegalArgumentException("Option '" + name + "' must be a number, got '" + value + "'"));
        int result = number.intValue();
        if (result < 0 || result > 340) {
            throw new IllegalArgumentException("Option '" + name + "' is out of range: " + result);
        }
        return result;
    }

    private static boolean booleanOption(Map<String, Object> named, String name, boolean defaultValue) {
        Object value = named.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new IllegalArgumentException("Option '" + name + "' must be true or false, got '" + text + "'");
    }

    private static FormatStyle formatStyle(Object value, FormatStyle defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return FormatStyle.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid style '" + value + "', expected short, medium, long or full", e);
        }
    }

    private static ZonedDateTime parseIsoDateTime(String text) {
        try {
            return OffsetDateTime.parse(text).toZonedDateTime();
        } catch (DateTimeParseException ignored) {
            // try the next ISO form
        }
        try {
            return LocalDateTime.parse(text).atZone(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // try the next ISO form
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static ZonedDateTime toZonedDateTime(Object value) {
        if (value instanceof ZonedDateTime zoned) {
            return zoned;
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toZonedDateTime();
        }
        if (value instanceof LocalDateTime local) {
            return local.atZone(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC);
        }
        if (value instanceof Instant instant) {
            return instant.atZone(ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneOffset.UTC);
        }
        throw new IllegalArgumentException("DATETIME expects a date or time, got " + value.getClass().getSimpleName());
    }
}
