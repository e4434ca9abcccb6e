package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A call of a registered function such as {@code NUMBER($n, minimumFractionDigits: 2)}.
 *
 * @param id        The upper-case function name.
 * @param arguments The call arguments.
 */
public record FunctionReference(Identifier id, CallArguments arguments) implements InlineExpression {

    public FunctionReference {
        Objects.requireNonNull(id, "id");
        arguments = arguments == null ? CallArguments.EMPTY : arguments;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(id, arguments);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitFunctionReference(this);
    }
}
