package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * An expression between braces inside a pattern.
 *
 * @param expression The wrapped expression.
 */
public record Placeable(Expression expression) implements PatternElement {

    public Placeable {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitPlaceable(this);
    }
}
