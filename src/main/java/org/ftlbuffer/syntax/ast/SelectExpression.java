package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses one of several variants based on a selector value.
 *
 * @param selector The expression whose value picks the variant.
 * @param variants The variants in source order. A parsed select expression has exactly one default.
 */
public record SelectExpression(InlineExpression selector, List<Variant> variants) implements Expression {

    public SelectExpression {
        Objects.requireNonNull(selector, "selector");
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    /**
     * @return The variant marked with {@code *}, or empty if there is none.
     */
    public Optional<Variant> defaultVariant() {
        return variants.stream().filter(Variant::isDefault).findFirst();
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(selector);
        children.addAll(variants);
        return children;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitSelectExpression(this);
    }
}
