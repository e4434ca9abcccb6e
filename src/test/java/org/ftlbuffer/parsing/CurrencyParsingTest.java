package org.ftlbuffer.parsing;

import org.ftlbuffer.diagnostics.DiagnosticCode;
import org.ftlbuffer.diagnostics.Outcome;
import org.ftlbuffer.runtime.BundleOptions;
import org.ftlbuffer.runtime.FluentBundle;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests reading locale-formatted money with {@link CurrencyParsing}.
 */
@Tag("unit")
class CurrencyParsingTest {

    /**
     * Verifies unambiguous symbols and ISO codes in several locales.
     */
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "€100.50       | en-US | 100.50  | EUR",
            "100,50 €      | lv-LV | 100.50  | EUR",
            "£999.99       | en-GB | 999.99  | GBP",
            "¥12,345       | ja-JP | 12345   | JPY",
            "USD 1,234.56  | en-US | 1234.56 | USD",
            "EUR 1.234,56  | de-DE | 1234.56 | EUR",
            "₩1,000        | ko-KR | 1000    | KRW"
    })
    void parseCurrency_readsSymbolsAndCodes(String text, String locale, String amount, String code) {
        // Act
        CurrencyAmount parsed = value(CurrencyParsing.parseCurrency(text, locale));

        // Assert
        assertThat(parsed.amount()).isEqualByComparingTo(amount);
        assertThat(parsed.currencyCode()).isEqualTo(code);
    }

    @Nested
    class AmbiguousSymbols {

        /**
         * Verifies that a dollar sign alone does not decide the currency.
         */
        @Test
        void dollarWithoutDefault_fails() {
            Outcome<CurrencyAmount> outcome = CurrencyParsing.parseCurrency("$100", "en-US");

            assertThat(failure(outcome).diagnostic().code()).isEqualTo(DiagnosticCode.AMBIGUOUS_CURRENCY);
            assertThat(failure(outcome).diagnostic().message()).isEqualTo("Ambiguous currency symbol '$' in '$100'");
        }

        /**
         * Verifies that an explicit default currency resolves the symbol.
         */
        @Test
        void dollarWithDefault_usesDefault() {
            CurrencyAmount parsed = value(CurrencyParsing.parseCurrency("$1,234.56", "en-US", "CAD", false));

            assertThat(parsed.amount()).isEqualByComparingTo("1234.56");
            assertThat(parsed.currencyCode()).isEqualTo("CAD");
        }

        /**
         * Verifies that the currency can be taken from the locale's country.
         */
        @Test
        void dollarInferredFromLocale() {
            assertThat(value(CurrencyParsing.parseCurrency("$100", "en-CA", null, true)).currencyCode()).isEqualTo("CAD");
            assertThat(value(CurrencyParsing.parseCurrency("$100", "en-AU", null, true)).currencyCode()).isEqualTo("AUD");
        }

        /**
         * Verifies that inference needs a country in the locale.
         */
        @Test
        void inferenceWithoutCountry_fails() {
            Outcome<CurrencyAmount> outcome = CurrencyParsing.parseCurrency("$100", "en", null, true);

            assertThat(failure(outcome).diagnostic().code()).isEqualTo(DiagnosticCode.AMBIGUOUS_CURRENCY);
            assertThat(failure(outcome).diagnostic().message())
                    .isEqualTo("Ambiguous currency symbol '$' and no currency for locale 'en'");
        }
    }

    @Nested
    class Failures {

        /**
         * Verifies that a plain number is not money.
         */
        @Test
        void noCurrency_fails() {
            Outcome<CurrencyAmount> outcome = CurrencyParsing.parseCurrency("1,234.56", "en-US");

            assertThat(failure(outcome).diagnostic().code()).isEqualTo(DiagnosticCode.CURRENCY_PARSE_FAILED);
            assertThat(failure(outcome).diagnostic().message()).isEqualTo("No currency symbol or code found in '1,234.56'");
        }

        /**
         * Verifies that three capital letters must be a known ISO 4217 code.
         */
        @Test
        void unknownCode_fails() {
            Outcome<CurrencyAmount> outcome = CurrencyParsing.parseCurrency("XYZ 12", "en-US");

            assertThat(failure(outcome).diagnostic().message()).isEqualTo("Unknown currency 'XYZ' in 'XYZ 12'");
        }

        /**
         * Verifies that the amount must be a number of the locale.
         */
        @Test
        void badAmount_fails() {
            Outcome<CurrencyAmount> outcome = CurrencyParsing.parseCurrency("€ lots", "en-US");

            assertThat(failure(outcome).diagnostic().message()).isEqualTo("Failed to parse amount 'lots' from '€ lots'");
        }
    }

    /**
     * Verifies that what CURRENCY writes can be read back for the same locale.
     */
    @ParameterizedTest
    @CsvSource({"de-DE,EUR", "lv-LV,EUR", "en-GB,GBP", "en-US,USD"})
    void parseCurrency_readsCurrencyFunctionOutput(String locale, String code) {
        // Arrange
        FluentBundle bundle = new FluentBundle(BundleOptions.of(locale).withUseIsolating(false));
        bundle.addResource("price = { CURRENCY($amount, currency: \"" + code + "\") }");
        String formatted = bundle.formatValue("price", Map.of("amount", new BigDecimal("1234.56"))).value();

        // Act
        CurrencyAmount parsed = value(CurrencyParsing.parseCurrency(formatted, locale, code, false));

        // Assert
        assertThat(parsed.amount()).isEqualByComparingTo("1234.56");
        assertThat(parsed.currencyCode()).isEqualTo(code);
    }

    private static <T> T value(Outcome<T> outcome) {
        assertThat(outcome).isInstanceOf(Outcome.Value.class);
        return ((Outcome.Value<T>) outcome).value();
    }

    private static <T> Outcome.Failure<T> failure(Outcome<T> outcome) {
        assertThat(outcome).isInstanceOf(Outcome.Failure.class);
        return (Outcome.Failure<T>) outcome;
    }
}
