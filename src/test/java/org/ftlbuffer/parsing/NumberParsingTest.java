package org.ftlbuffer.parsing;

import org.ftlbuffer.diagnostics.DiagnosticCode;
import org.ftlbuffer.diagnostics.Outcome;
import org.ftlbuffer.runtime.BundleOptions;
import org.ftlbuffer.runtime.FluentBundle;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests reading locale-formatted numbers with {@link NumberParsing}.
 */
@Tag("unit")
class NumberParsingTest {

    /**
     * Verifies grouping and decimal separators of several locales.
     */
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "1,234.5  | en-US",
            "1234.5   | en-US",
            "1.234,5  | de-DE",
            "1234,5   | de_DE",
            "1 234,5  | lv-LV",
            "1\u00A0234,5 | lv-LV"
    })
    void parseNumber_usesLocaleSeparators(String text, String locale) {
        assertThat(NumberParsing.parseNumber(text, locale)).isEqualTo(Outcome.of(1234.5));
    }

    /**
     * Verifies that decimals keep their exact value.
     */
    @Test
    void parseDecimal_isExact() {
        // Act
        BigDecimal amount = value(NumberParsing.parseDecimal("100,50", "lv-LV"));

        // Assert
        assertThat(amount.multiply(new BigDecimal("0.21"))).isEqualByComparingTo("21.105");
        assertThat(value(NumberParsing.parseDecimal("1,234.56", "en-US"))).isEqualByComparingTo("1234.56");
        assertThat(value(NumberParsing.parseDecimal("0,01", "de-DE"))).isEqualByComparingTo("0.01");
        assertThat(value(NumberParsing.parseDecimal("-12.5", "en-US"))).isEqualByComparingTo("-12.5");
    }

    /**
     * Verifies that input which is not entirely a number fails with a diagnostic.
     */
    @ParameterizedTest
    @ValueSource(strings = {"invalid", "", "   ", "12abc", "1.234,5"})
    void parseNumber_rejectsNonNumbers(String text) {
        // Act
        Outcome<Double> outcome = NumberParsing.parseNumber(text, "en-US");

        // Assert
        assertThat(outcome.isFailure()).isTrue();
        Outcome.Failure<Double> failure = (Outcome.Failure<Double>) outcome;
        assertThat(failure.diagnostic().code()).isEqualTo(DiagnosticCode.NUMBER_PARSE_FAILED);
        assertThat(failure.diagnostic().message()).isEqualTo("Failed to parse number '" + text + "' for locale 'en-US'");
    }

    /**
     * Verifies that the decimal variant names itself in the diagnostic and rejects null.
     */
    @Test
    void parseDecimal_rejectsNonNumbers() {
        Outcome<BigDecimal> outcome = NumberParsing.parseDecimal("invalid", "en-US");
        Outcome<BigDecimal> missing = NumberParsing.parseDecimal(null, "en-US");

        assertThat(((Outcome.Failure<BigDecimal>) outcome).diagnostic().message())
                .isEqualTo("Failed to parse decimal 'invalid' for locale 'en-US'");
        assertThat(missing.isFailure()).isTrue();
    }

    /**
     * Verifies that what NUMBER writes can be read back for the same locale.
     */
    @ParameterizedTest
    @ValueSource(strings = {"en-US", "de-DE", "lv-LV", "fr-FR"})
    void parseDecimal_readsNumberFunctionOutput(String locale) {
        // Arrange
        FluentBundle bundle = new FluentBundle(BundleOptions.of(locale).withUseIsolating(false));
        bundle.addResource("amount = { NUMBER($n, minimumFractionDigits: 2) }");
        String formatted = bundle.formatValue("amount", Map.of("n", new BigDecimal("1234567.89"))).value();

        // Act
        BigDecimal parsed = value(NumberParsing.parseDecimal(formatted, locale));

        // Assert
        assertThat(parsed).isEqualByComparingTo("1234567.89");
    }

    private static <T> T value(Outcome<T> outcome) {
        assertThat(outcome).isInstanceOf(Outcome.Value.class);
        return ((Outcome.Value<T>) outcome).value();
    }
}
