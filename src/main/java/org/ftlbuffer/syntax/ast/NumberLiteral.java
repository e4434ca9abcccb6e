package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A number literal. The raw text is kept so that {@code 1.50} serializes unchanged.
 *
 * @param raw   The literal as written in the source.
 * @param value The parsed numeric value.
 */
public record NumberLiteral(String raw, BigDecimal value) implements Literal, VariantKey {

    public NumberLiteral {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(value, "value");
    }

    /**
     * @param raw The literal text, e.g. {@code -1.5}.
     * @return The literal with its value parsed from {@code raw}.
     * @throws NumberFormatException if {@code raw} is not a decimal number.
     */
    public static NumberLiteral of(String raw) {
        return new NumberLiteral(raw, new BigDecimal(raw));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitNumberLiteral(this);
    }
}
