package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A {@code name: value} call argument. The value is always a literal.
 *
 * @param name  The argument name.
 * @param value The string or number literal.
 */
public record NamedArgument(Identifier name, Literal value) implements SyntaxNode {

    public NamedArgument {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(name, value);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitNamedArgument(this);
    }
}
