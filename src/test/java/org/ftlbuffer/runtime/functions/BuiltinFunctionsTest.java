package org.ftlbuffer.runtime.functions;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the locale-aware NUMBER, DATETIME and CURRENCY implementations.
 */
@Tag("unit")
class BuiltinFunctionsTest {

    /**
     * Verifies grouping and decimal separators per locale.
     */
    @Test
    void number_usesLocaleSeparators() {
        assertThat(BuiltinFunctions.number(List.of(1234.5, "en-US"), Map.of())).isEqualTo("1,234.5");
        assertThat(BuiltinFunctions.number(List.of(1234.5, "de-DE"), Map.of())).isEqualTo("1.234,5");
    }

    /**
     * Verifies fraction digit and grouping options.
     */
    @Test
    void number_options() {
        assertThat(BuiltinFunctions.number(List.of(new BigDecimal("3"), "en-US"),
                Map.of("minimumFractionDigits", new BigDecimal("2")))).isEqualTo("3.00");
        assertThat(BuiltinFunctions.number(List.of(2.5, "en-US"),
                Map.of("maximumFractionDigits", 0))).isEqualTo("2");
        assertThat(BuiltinFunctions.number(List.of(1234567, "en-US"),
                Map.of("useGrouping", "false"))).isEqualTo("1234567");
    }

    /**
     * Verifies that non-numeric input fails.
     */
    @Test
    void number_rejectsNonNumbers() {
        assertThatThrownBy(() -> BuiltinFunctions.number(List.of("abc", "en-US"), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("NUMBER expects a number, got String");
        assertThatThrownBy(() -> BuiltinFunctions.number(List.of(), Map.of()))
                .hasMessage("NUMBER requires a value as its first argument");
    }

    /**
     * Verifies the short date style per locale.
     */
    @Test
    void datetime_shortDateStyle() {
        LocalDate date = LocalDate.of(2025, 10, 27);

        assertThat(BuiltinFunctions.datetime(List.of(date, "en-US"), Map.of("dateStyle", "short")))
                .isEqualTo("10/27/25");
        assertThat(BuiltinFunctions.datetime(List.of("2025-10-27", "de-DE"), Map.of("dateStyle", "short")))
                .isEqualTo("27.10.25");
    }

    /**
     * Verifies the marker returned for unparseable date strings.
     */
    @Test
    void datetime_invalidString() {
        assertThat(BuiltinFunctions.datetime(List.of("not a date", "en-US"), Map.of()))
                .isEqualTo(BuiltinFunctions.INVALID_DATETIME);
    }

    /**
     * Verifies currency symbols and fraction digits.
     */
    @Test
    void currency_symbolAndCode() {
        assertThat(BuiltinFunctions.currency(List.of(1234.5, "en-US"), Map.of("currency", "USD")))
                .isEqualTo("$1,234.50");
        assertThat(BuiltinFunctions.currency(List.of(1234.5, "en-US"), Map.of("currency", "JPY")))
                .doesNotContain(".");
        assertThat(BuiltinFunctions.currency(List.of(10, "en-US"),
                Map.of("currency", "EUR", "currencyDisplay", "code"))).startsWith("EUR");
    }

    /**
     * Verifies the errors for a missing currency and an invalid display option.
     */
    @Test
    void currency_failures() {
        assertThatThrownBy(() -> BuiltinFunctions.currency(List.of(1, "en-US"), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires a 'currency' option");
        assertThatThrownBy(() -> BuiltinFunctions.currency(List.of(1, "en-US"),
                Map.of("currency", "USD", "currencyDisplay", "emoji")))
                .hasMessageContaining("Invalid currencyDisplay 'emoji'");
    }

    /**
     * Verifies the locale fallback for unusable codes.
     */
    @Test
    void localeContext_fallsBackToEnglish() {
        assertThat(LocaleContext.of("de_DE").language()).isEqualTo("de");
        assertThat(LocaleContext.toLocale("")).isEqualTo(LocaleContext.FALLBACK_LOCALE);
        assertThat(LocaleContext.toLocale("!!")).isEqualTo(LocaleContext.FALLBACK_LOCALE);
    }
}
