package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A named sub-value of a message or term, written as {@code .id = pattern}.
 *
 * @param id    The attribute name.
 * @param value The attribute value, never empty.
 */
public record Attribute(Identifier id, Pattern value) implements SyntaxNode {

    public Attribute {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(id, value);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitAttribute(this);
    }
}
