package org.ftlbuffer.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Conversions between runtime argument values and {@link BigDecimal}.
 */
public final class NumericValues {

    private NumericValues() {
    }

    /**
     * Interprets a runtime value as a number.
     * <p>
     * Numbers convert exactly (floating point values through their shortest decimal representation),
     * strings convert if they hold a decimal number. Booleans, NaN, infinities and everything else
     * are not numeric.
     *
     * @param value The value, may be {@code null}.
     * @return The numeric value, or empty if {@code value} is not numeric.
     */
    public static Optional<BigDecimal> toBigDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof BigInteger integer) {
            return Optional.of(new BigDecimal(integer));
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(value instanceof Float ? new BigDecimal(value.toString()) : BigDecimal.valueOf(d));
        }
        if (value instanceof Number || value instanceof CharSequence) {
            return parse(value.toString());
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> parse(String text) {
        try {
            return Optional.of(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * @param value A runtime value.
     * @return {@code true} if {@code value} is a {@link Number} that converts to a {@link BigDecimal}.
     */
    public static boolean isNumber(Object value) {
        return value instanceof Number && toBigDecimal(value).isPresent();
    }
}
