package org.ftlbuffer.parsing;

import org.ftlbuffer.diagnostics.ErrorTemplates;
import org.ftlbuffer.diagnostics.Outcome;
import org.ftlbuffer.runtime.functions.LocaleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.FormatStyle;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses dates and date-times as displayed for a locale, the inverse of the DATETIME function.
 * <p>
 * ISO-8601 is tried first, then the short, medium and long formats of the locale, then a fixed list
 * of common numeric and month-name formats. The first format that matches the whole input wins, so
 * an ambiguous input like {@code 01/02/2025} is read the way the locale writes dates. Fields are
 * validated strictly: {@code 31.02.2025} is not a date.
 */
public final class DateParsing {

    private static final Logger LOG = LoggerFactory.getLogger(DateParsing.class);

    private static final List<String> COMMON_DATE_PATTERNS = List.of(
            "M/d/uuuu",
            "M/d/uu",
            "d.M.uuuu",
            "d.M.uu",
            "d/M/uuuu",
            "d/M/uu",
            "uuuu-M-d",
            "d-M-uuuu",
            "MMM d, uuuu",
            "d MMM uuuu",
            "MMMM d, uuuu",
            "d MMMM uuuu");

    private static final List<String> TIME_SUFFIXES = List.of(" H:mm:ss", " H:mm", " h:mm:ss a", " h:mm a");

    private static final List<String> COMMON_DATETIME_PATTERNS = List.of(
            "uuuu-M-d H:mm:ss",
            "uuuu-M-d H:mm",
            "M/d/uuuu H:mm:ss",
            "M/d/uuuu H:mm",
            "d.M.uuuu H:mm:ss",
            "d.M.uuuu H:mm");

    private DateParsing() {
    }

    /**
     * @param value      The display string, e.g. {@code "1/28/25"} or {@code "2025-01-28"}.
     * @param localeCode The locale the date was formatted for.
     * @return The date, or a {@code DATE_PARSE_FAILED} failure.
     */
    public static Outcome<LocalDate> parseDate(String value, String localeCode) {
        if (value != null) {
            String text = value.trim();
            LocalDate iso = tryParse(text, DateTimeFormatter.ISO_LOCAL_DATE, LocalDate::from);
            if (iso != null) {
                return Outcome.of(iso);
            }
            LocalDateTime isoDateTime = parseIsoDateTime(text);
            if (isoDateTime != null) {
                return Outcome.of(isoDateTime.toLocalDate());
            }
            Locale locale = LocaleContext.toLocale(localeCode);
            for (String pattern : datePatterns(locale)) {
                LocalDate parsed = tryParse(text, formatter(pattern, locale), LocalDate::from);
                if (parsed != null) {
                    return Outcome.of(parsed);
                }
            }
        }
        LOG.debug("Could not parse date '{}' for locale {}", value, localeCode);
        return Outcome.failure(ErrorTemplates.dateParseFailed("date", value, localeCode));
    }

    /**
     * Parses a date with a time of day. An ISO-8601 offset in the input is dropped; use
     * {@link #parseDatetime(String, String, ZoneId)} to keep it.
     *
     * @param value      The display string, e.g. {@code "1/28/25 14:30"}.
     * @param localeCode The locale the date-time was formatted for.
     * @return The local date-time, or a {@code DATE_PARSE_FAILED} failure.
     */
    public static Outcome<LocalDateTime> parseDatetime(String value, String localeCode) {
        if (value != null) {
            String text = value.trim();
            LocalDateTime iso = parseIsoDateTime(text);
            if (iso != null) {
                return Outcome.of(iso);
            }
            OffsetDateTime withOffset = tryParse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME, OffsetDateTime::from);
            if (withOffset != null) {
                return Outcome.of(withOffset.toLocalDateTime());
            }
            Locale locale = LocaleContext.toLocale(localeCode);
            for (String pattern : dateTimePatterns(locale)) {
                LocalDateTime parsed = tryParse(text, formatter(pattern, locale), LocalDateTime::from);
                if (parsed != null) {
                    return Outcome.of(parsed);
                }
            }
        }
        LOG.debug("Could not parse datetime '{}' for locale {}", value, localeCode);
        return Outcome.failure(ErrorTemplates.dateParseFailed("datetime", value, localeCode));
    }

    /**
     * Parses a date with a time of day and places it in a time zone. An ISO-8601 offset or zone in
     * the input takes precedence over {@code zone}.
     *
     * @param value      The display string.
     * @param localeCode The locale the date-time was formatted for.
     * @param zone       The zone for inputs that carry none.
     * @return The zoned date-time, or a {@code DATE_PARSE_FAILED} failure.
     */
    public static Outcome<ZonedDateTime> parseDatetime(String value, String localeCode, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        if (value != null) {
            ZonedDateTime zoned = tryParse(value.trim(), DateTimeFormatter.ISO_ZONED_DATE_TIME, ZonedDateTime::from);
            if (zoned != null) {
                return Outcome.of(zoned);
            }
        }
        Outcome<LocalDateTime> local = parseDatetime(value, localeCode);
        if (local instanceof Outcome.Failure<LocalDateTime> failure) {
            return failure.retype();
        }
        return Outcome.of(((Outcome.Value<LocalDateTime>) local).value().atZone(zone));
    }

    private static LocalDateTime parseIsoDateTime(String text) {
        LocalDateTime parsed = tryParse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME, LocalDateTime::from);
        if (parsed != null) {
            return parsed;
        }
        // ISO date and time separated by a space instead of 'T'
        return tryParse(text.replaceFirst("^(\\d{4}-\\d{2}-\\d{2}) ", "$1T"),
                DateTimeFormatter.ISO_LOCAL_DATE_TIME, LocalDateTime::from);
    }

    static List<String> datePatterns(Locale locale) {
        List<String> patterns = new ArrayList<>();
        for (FormatStyle style : List.of(FormatStyle.SHORT, FormatStyle.MEDIUM, FormatStyle.LONG)) {
            patterns.add(localizedPattern(style, null, locale));
        }
        patterns.addAll(COMMON_DATE_PATTERNS);
        return patterns;
    }

    static List<String> dateTimePatterns(Locale locale) {
        List<String> patterns = new ArrayList<>();
        for (FormatStyle style : List.of(FormatStyle.SHORT, FormatStyle.MEDIUM)) {
            patterns.add(localizedPattern(style, style, locale));
        }
        for (String datePattern : datePatterns(locale)) {
            for (String suffix : TIME_SUFFIXES) {
                patterns.add(datePattern + suffix);
            }
        }
        patterns.addAll(COMMON_DATETIME_PATTERNS);
        return patterns;
    }

    /**
     * Returns the locale's pattern made lenient about leading zeros and strict about the year:
     * {@code dd.MM.yy} becomes {@code d.M.uu}.
     */
    private static String localizedPattern(FormatStyle dateStyle, FormatStyle timeStyle, Locale locale) {
        String pattern = DateTimeFormatterBuilder.getLocalizedDateTimePattern(
                dateStyle, timeStyle, IsoChronology.INSTANCE, locale);
        StringBuilder result = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
                result.append(c);
            } else if (quoted) {
                result.append(c);
            } else if (c == 'y') {
                result.append('u');
            } else if ((c == 'd' || c == 'M' || c == 'H' || c == 'h')
                    && i + 1 < pattern.length() && pattern.charAt(i + 1) == c
                    && (i + 2 >= pattern.length() || pattern.charAt(i + 2) != c)
                    && (i == 0 || pattern.charAt(i - 1) != c)) {
                // two-digit field: drop the first letter so one digit is accepted too
                continue;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    private static DateTimeFormatter formatter(String pattern, Locale locale) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(locale)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static <T> T tryParse(String text, DateTimeFormatter formatter, TemporalQuery<T> query) {
        try {
            return formatter.parse(text, query);
        } catch (DateTimeParseException ignored) {
            // not this format
            return null;
        }
    }
}
