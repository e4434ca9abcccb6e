package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.Objects;

/**
 * A name of a message, term, attribute, variable, function or named argument.
 *
 * @param name The identifier text.
 */
public record Identifier(String name) implements VariantKey {

    public Identifier {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitIdentifier(this);
    }
}
