package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.Objects;

/**
 * A quoted string literal.
 *
 * @param value The unescaped string value.
 */
public record StringLiteral(String value) implements Literal {

    public StringLiteral {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitStringLiteral(this);
    }
}
