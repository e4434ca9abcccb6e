package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A reference to a runtime argument, written as {@code $id}.
 *
 * @param id The variable name without the dollar sign.
 */
public record VariableReference(Identifier id) implements InlineExpression {

    public VariableReference {
        Objects.requireNonNull(id, "id");
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(id);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitVariableReference(this);
    }
}
