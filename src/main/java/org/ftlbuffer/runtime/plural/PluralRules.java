package org.ftlbuffer.runtime.plural;

import org.ftlbuffer.util.NumericValues;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Set;

/**
 * Hand-written CLDR plural rules for 30 languages, grouped by rule family.
 * <p>
 * Operands follow CLDR: {@code n} is the absolute value, {@code i} its integer part, and a number
 * has visible decimals when its fractional part is not zero. Languages outside the supported set
 * use the {@code n = 1} rule.
 */
public final class PluralRules implements PluralRuleSelector {

    /** The languages with dedicated rules. */
    public static final Set<String> SUPPORTED_LANGUAGES = Set.of(
            "en", "zh", "hi", "es", "fr", "ar", "bn", "pt", "ru", "ja",
            "de", "jv", "ko", "vi", "te", "tr", "ta", "mr", "ur", "it",
            "th", "gu", "pl", "uk", "kn", "or", "ml", "my", "pa", "lv");

    private static final Set<String> NO_PLURAL = Set.of("zh", "ja", "jv", "ko", "vi", "th", "my");
    private static final Set<String> SIMPLE_ONE = Set.of("es", "te", "tr", "ta", "mr", "ur", "ml", "or");
    private static final Set<String> INTEGER_ONE = Set.of("en", "de");
    private static final Set<String> ZERO_ONE = Set.of("hi", "bn", "gu", "kn");
    private static final Set<String> SLAVIC = Set.of("ru", "pl", "uk");
    private static final Set<String> ROMANCE_MANY = Set.of("fr", "pt", "it");

    private static final BigInteger MILLION = BigInteger.valueOf(1_000_000);

    @Override
    public String categoryFor(Number number, String localeCode) {
        return select(number, localeCode).keyword();
    }

    /**
     * @param number     The value; non-numeric values (NaN, infinities) fall into {@code other}.
     * @param localeCode The locale code; only its language part is used.
     * @return The plural category.
     */
    public PluralCategory select(Number number, String localeCode) {
        BigDecimal value = NumericValues.toBigDecimal(number).orElse(null);
        if (value == null) {
            return PluralCategory.OTHER;
        }
        Operands n = new Operands(value.abs());
        String language = language(localeCode);

        if (NO_PLURAL.contains(language)) {
            return PluralCategory.OTHER;
        }
        if (SIMPLE_ONE.contains(language)) {
            return simpleOne(n);
        }
        if (INTEGER_ONE.contains(language)) {
            return n.integerIs(1) && !n.hasDecimals() ? PluralCategory.ONE : PluralCategory.OTHER;
        }
        if (ZERO_ONE.contains(language)) {
            return n.integerIs(0) || n.equalsInt(1) ? PluralCategory.ONE : PluralCategory.OTHER;
        }
        if (SLAVIC.contains(language)) {
            return slavic(n);
        }
        if (ROMANCE_MANY.contains(language)) {
            return romanceMany(n);
        }
        return switch (language) {
            case "pa" -> n.equalsInt(0) || n.equalsInt(1) ? PluralCategory.ONE : PluralCategory.OTHER;
            case "ar" -> arabic(n);
            case "lv" -> latvian(n);
            default -> simpleOne(n);
        };
    }

    static String language(String localeCode) {
        if (localeCode == null) {
            return "";
        }
        String normalized = localeCode.replace('-', '_');
        int separator = normalized.indexOf('_');
        return (separator < 0 ? normalized : normalized.substring(0, separator)).toLowerCase(Locale.ROOT);
    }

    private static PluralCategory simpleOne(Operands n) {
        return n.equalsInt(1) ? PluralCategory.ONE : PluralCategory.OTHER;
    }

    private static PluralCategory slavic(Operands n) {
        if (n.hasDecimals()) {
            return PluralCategory.OTHER;
        }
        int mod10 = n.integerMod(10);
        int mod100 = n.integerMod(100);
        if (mod10 == 1 && mod100 != 11) {
            return PluralCategory.ONE;
        }
        if (mod10 >= 2 && mod10 <= 4 && !(mod100 >= 12 && mod100 <= 14)) {
            return PluralCategory.FEW;
        }
        if (mod10 == 0 || mod10 >= 5 || (mod100 >= 11 && mod100 <= 14)) {
            return PluralCategory.MANY;
        }
        return PluralCategory.OTHER;
    }

    private static PluralCategory romanceMany(Operands n) {
        if (n.integerIs(0) || n.integerIs(1)) {
            return PluralCategory.ONE;
        }
        // Exact multiples of a million stand in for CLDR's compact-notation rule.
        if (!n.hasDecimals() && n.integer().mod(MILLION).signum() == 0) {
            return PluralCategory.MANY;
        }
        return PluralCategory.OTHER;
    }

    private static PluralCategory arabic(Operands n) {
        if (n.hasDecimals()) {
            return PluralCategory.OTHER;
        }
        if (n.integerIs(0)) {
            return PluralCategory.ZERO;
        }
        if (n.integerIs(1)) {
            return PluralCategory.ONE;
        }
        if (n.integerIs(2)) {
            return PluralCategory.TWO;
        }
        int mod100 = n.integerMod(100);
        if (mod100 >= 3 && mod100 <= 10) {
            return PluralCategory.FEW;
        }
        if (mod100 >= 11) {
            return PluralCategory.MANY;
        }
        return PluralCategory.OTHER;
    }

    private static PluralCategory latvian(Operands n) {
        if (n.hasDecimals()) {
            return PluralCategory.OTHER;
        }
        int mod10 = n.integerMod(10);
        int mod100 = n.integerMod(100);
        if (mod10 == 0 || (mod100 >= 11 && mod100 <= 19)) {
            return PluralCategory.ZERO;
        }
        if (mod10 == 1 && mod100 != 11) {
            return PluralCategory.ONE;
        }
        return PluralCategory.OTHER;
    }

    /**
     * The CLDR operands of a non-negative number.
     */
    private record Operands(BigDecimal n) {

        BigInteger integer() {
            return n.toBigInteger();
        }

        boolean hasDecimals() {
            return n.stripTrailingZeros().scale() > 0;
        }

        boolean integerIs(int value) {
            return integer().equals(BigInteger.valueOf(value));
        }

        boolean equalsInt(int value) {
            return n.compareTo(BigDecimal.valueOf(value)) == 0;
        }

        int integerMod(int modulus) {
            return integer().mod(BigInteger.valueOf(modulus)).intValue();
        }
    }
}
