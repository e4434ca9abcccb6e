package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.Objects;

/**
 * Literal text inside a pattern.
 *
 * @param value The text.
 */
public record TextElement(String value) implements PatternElement {

    public TextElement {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitTextElement(this);
    }
}
