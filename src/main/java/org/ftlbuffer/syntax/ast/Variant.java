package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * One branch of a select expression.
 *
 * @param key       The identifier or number that selects this variant.
 * @param value     The pattern produced when this variant is selected.
 * @param isDefault Whether this is the {@code *} default variant.
 */
public record Variant(VariantKey key, Pattern value, boolean isDefault) implements SyntaxNode {

    public Variant {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(key, value);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitVariant(this);
    }
}
