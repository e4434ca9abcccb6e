package org.ftlbuffer.runtime.plural;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the CLDR plural categories computed by {@link PluralRules} for representative languages.
 */
@Tag("unit")
class PluralRulesTest {

    private final PluralRules rules = new PluralRules();

    /**
     * Verifies categories for integers across the rule families.
     */
    @ParameterizedTest(name = "{0} in {1} -> {2}")
    @CsvSource({
            "1, en-US, one",
            "0, en-US, other",
            "2, en, other",
            "5, ja-JP, other",
            "1, ja, other",
            "0, hi, one",
            "1, ru-RU, one",
            "21, ru, one",
            "11, ru, many",
            "3, pl, few",
            "14, uk, many",
            "25, ru, many",
            "0, ar, zero",
            "2, ar, two",
            "5, ar, few",
            "11, ar, many",
            "100, ar, other",
            "0, lv, zero",
            "1, lv, one",
            "11, lv, zero",
            "2, lv, other",
            "0, fr, one",
            "1, fr, one",
            "2, fr, other",
            "1000000, fr, many",
            "1, es, one",
            "1, xx-YY, one",
            "2, xx, other"
    })
    void integers(long number, String locale, String expected) {
        assertThat(rules.categoryFor(number, locale)).isEqualTo(expected);
    }

    /**
     * Verifies that visible decimals change the category where the rules say so.
     */
    @Test
    void decimals() {
        assertThat(rules.select(new BigDecimal("1.0"), "en")).isEqualTo(PluralCategory.ONE);
        assertThat(rules.select(new BigDecimal("1.5"), "en")).isEqualTo(PluralCategory.OTHER);
        assertThat(rules.select(1.5, "fr")).isEqualTo(PluralCategory.ONE);
        assertThat(rules.select(2.5, "ru")).isEqualTo(PluralCategory.OTHER);
        assertThat(rules.select(0.5, "hi")).isEqualTo(PluralCategory.ONE);
    }

    /**
     * Verifies that negative numbers use their absolute value and that non-finite numbers are other.
     */
    @Test
    void negativeAndNonFinite() {
        assertThat(rules.select(-1, "en")).isEqualTo(PluralCategory.ONE);
        assertThat(rules.select(Double.NaN, "en")).isEqualTo(PluralCategory.OTHER);
        assertThat(rules.select(Double.POSITIVE_INFINITY, "ru")).isEqualTo(PluralCategory.OTHER);
    }

    /**
     * Verifies the language extraction from locale codes.
     */
    @Test
    void language_ofLocaleCodes() {
        assertThat(PluralRules.language("pt_BR")).isEqualTo("pt");
        assertThat(PluralRules.language("EN-us")).isEqualTo("en");
        assertThat(PluralRules.language(null)).isEmpty();
        assertThat(PluralCategory.FEW.keyword()).isEqualTo("few");
        assertThat(PluralRules.SUPPORTED_LANGUAGES).hasSize(30);
    }
}
