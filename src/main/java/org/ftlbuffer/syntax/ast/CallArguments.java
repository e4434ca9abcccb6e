package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The arguments of a function call or a parameterized term reference.
 * Positional arguments always precede named ones and named argument names are unique.
 *
 * @param positional The positional arguments in order.
 * @param named      The named arguments in order.
 */
public record CallArguments(List<InlineExpression> positional, List<NamedArgument> named) implements SyntaxNode {

    public static final CallArguments EMPTY = new CallArguments(List.of(), List.of());

    public CallArguments {
        positional = positional == null ? List.of() : List.copyOf(positional);
        named = named == null ? List.of() : List.copyOf(named);
    }

    public boolean isEmpty() {
        return positional.isEmpty() && named.isEmpty();
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>(positional);
        children.addAll(named);
        return children;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitCallArguments(this);
    }
}
