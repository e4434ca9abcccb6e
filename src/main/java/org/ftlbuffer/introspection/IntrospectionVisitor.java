package org.ftlbuffer.introspection;

import org.ftlbuffer.syntax.ast.FunctionReference;
import org.ftlbuffer.syntax.ast.InlineExpression;
import org.ftlbuffer.syntax.ast.MessageReference;
import org.ftlbuffer.syntax.ast.NamedArgument;
import org.ftlbuffer.syntax.ast.SelectExpression;
import org.ftlbuffer.syntax.ast.TermReference;
import org.ftlbuffer.syntax.ast.VariableReference;
import org.ftlbuffer.syntax.ast.Variant;
import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks the patterns of one message and records variables, function calls and references.
 * Tracks the syntactic context so that a variable used as selector is told apart from one used in text.
 */
class IntrospectionVisitor extends AstVisitor {

    private final Set<VariableInfo> variables = new LinkedHashSet<>();
    private final Set<FunctionCallInfo> functions = new LinkedHashSet<>();
    private final Set<ReferenceInfo> references = new LinkedHashSet<>();
    private boolean hasSelectors;
    private VariableInfo.Context context = VariableInfo.Context.PATTERN;

    @Override
    public void visitVariableReference(VariableReference node) {
        variables.add(new VariableInfo(node.id().name(), context));
    }

    @Override
    public void visitMessageReference(MessageReference node) {
        String attribute = node.attribute() == null ? null : node.attribute().name();
        references.add(new ReferenceInfo(node.id().name(), ReferenceInfo.Kind.MESSAGE, attribute));
    }

    @Override
    public void visitTermReference(TermReference node) {
        String attribute = node.attribute() == null ? null : node.attribute().name();
        references.add(new ReferenceInfo(node.id().name(), ReferenceInfo.Kind.TERM, attribute));
        visit(node.arguments());
    }

    @Override
    public void visitFunctionReference(FunctionReference node) {
        List<String> positional = new ArrayList<>();
        for (InlineExpression argument : node.arguments().positional()) {
            if (argument instanceof VariableReference variable) {
                positional.add(variable.id().name());
            }
        }
        Set<String> named = new LinkedHashSet<>();
        for (NamedArgument argument : node.arguments().named()) {
            named.add(argument.name().name());
        }
        functions.add(new FunctionCallInfo(node.id().name(), positional, named));

        VariableInfo.Context outer = context;
        context = VariableInfo.Context.FUNCTION_ARG;
        visit(node.arguments());
        context = outer;
    }

    @Override
    public void visitSelectExpression(SelectExpression node) {
        hasSelectors = true;
        VariableInfo.Context outer = context;
        context = VariableInfo.Context.SELECTOR;
        visit(node.selector());
        context = VariableInfo.Context.VARIANT;
        visitAll(node.variants());
        context = outer;
    }

    @Override
    public void visitVariant(Variant node) {
        // Keys are never variables.
        visit(node.value());
    }

    MessageIntrospection result(String messageId) {
        return new MessageIntrospection(messageId, variables, functions, references, hasSelectors);
    }
}
