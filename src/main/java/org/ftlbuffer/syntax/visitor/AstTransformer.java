package org.ftlbuffer.syntax.visitor;

import org.ftlbuffer.syntax.ast.Attribute;
import org.ftlbuffer.syntax.ast.CallArguments;
import org.ftlbuffer.syntax.ast.Entry;
import org.ftlbuffer.syntax.ast.Expression;
import org.ftlbuffer.syntax.ast.FunctionReference;
import org.ftlbuffer.syntax.ast.Identifier;
import org.ftlbuffer.syntax.ast.InlineExpression;
import org.ftlbuffer.syntax.ast.Literal;
import org.ftlbuffer.syntax.ast.Message;
import org.ftlbuffer.syntax.ast.MessageReference;
import org.ftlbuffer.syntax.ast.NamedArgument;
import org.ftlbuffer.syntax.ast.Pattern;
import org.ftlbuffer.syntax.ast.PatternElement;
import org.ftlbuffer.syntax.ast.Placeable;
import org.ftlbuffer.syntax.ast.Resource;
import org.ftlbuffer.syntax.ast.SelectExpression;
import org.ftlbuffer.syntax.ast.SyntaxNode;
import org.ftlbuffer.syntax.ast.Term;
import org.ftlbuffer.syntax.ast.TermReference;
import org.ftlbuffer.syntax.ast.VariableReference;
import org.ftlbuffer.syntax.ast.Variant;
import org.ftlbuffer.syntax.ast.VariantKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Rebuilds a syntax tree by applying handlers to its nodes.
 * <p>
 * Handlers are registered per node class. The tree is processed bottom-up: the children of a node
 * are transformed first, the node is rebuilt from the transformed children, and then the handler
 * for its class (if any) decides what replaces it. Nodes without a handler are kept. The original
 * tree is never modified; unchanged subtrees are shared between the old and the new tree.
 * <p>
 * A {@link Transformed#delete()} or {@link Transformed#expand(List)} result is honoured wherever the
 * node is an element of a list (entries, attributes, pattern elements, variants, arguments) and
 * for optional children. Anywhere else, and for any node of the wrong type, the transformation
 * fails with an {@link IllegalStateException}.
 */
public class AstTransformer {

    private final Map<Class<? extends SyntaxNode>, Function<SyntaxNode, Transformed>> handlers;

    /**
     * Constructs a new AstTransformer.
     * @param handlers A map from node classes to their corresponding handlers.
     */
    public AstTransformer(Map<Class<? extends SyntaxNode>, Function<SyntaxNode, Transformed>> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * @return A builder for registering type-safe handlers.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Transforms a tree whose root must stay a single node of the same class.
     *
     * @param root The root node.
     * @param <T>  The kind of the root, e.g. {@link Resource}.
     * @return The transformed root.
     * @throws IllegalStateException if a handler deletes or expands the root, replaces it with a
     *                               different kind of node, or produces an invalid child anywhere.
     */
    @SuppressWarnings("unchecked")
    public <T extends SyntaxNode> T transform(T root) {
        return (T) single(root, root.getClass(), "root");
    }

    private Transformed apply(SyntaxNode node) {
        SyntaxNode rebuilt = rebuild(node);
        Function<SyntaxNode, Transformed> handler = handlers.get(rebuilt.getClass());
        if (handler == null) {
            return Transformed.replace(rebuilt);
        }
        Transformed result = handler.apply(rebuilt);
        if (result == null) {
            throw new IllegalStateException("Handler for " + rebuilt.getClass().getSimpleName() + " returned null");
        }
        return result;
    }

    private SyntaxNode rebuild(SyntaxNode node) {
        SyntaxNode rebuilt = rebuildChildren(node);
        // Keep the original instance when nothing below it changed.
        return rebuilt.equals(node) ? node : rebuilt;
    }

    private SyntaxNode rebuildChildren(SyntaxNode node) {
        if (node instanceof Resource resource) {
            return new Resource(list(resource.entries(), Entry.class));
        }
        if (node instanceof Message message) {
            return new Message(
                    single(message.id(), Identifier.class, "message id"),
                    optional(message.value(), Pattern.class, "message value"),
                    list(message.attributes(), Attribute.class),
                    message.span());
        }
        if (node instanceof Term term) {
            return new Term(
                    single(term.id(), Identifier.class, "term id"),
                    single(term.value(), Pattern.class, "term value"),
                    list(term.attributes(), Attribute.class),
                    term.span());
        }
        if (node instanceof Attribute attribute) {
            return new Attribute(
                    single(attribute.id(), Identifier.class, "attribute id"),
                    single(attribute.value(), Pattern.class, "attribute value"));
        }
        if (node instanceof Pattern pattern) {
            return new Pattern(list(pattern.elements(), PatternElement.class));
        }
        if (node instanceof Placeable placeable) {
            return new Placeable(single(placeable.expression(), Expression.class, "placeable expression"));
        }
        if (node instanceof VariableReference reference) {
            return new VariableReference(single(reference.id(), Identifier.class, "variable id"));
        }
        if (node instanceof MessageReference reference) {
            return new MessageReference(
                    single(reference.id(), Identifier.class, "message reference id"),
                    optional(reference.attribute(), Identifier.class, "message reference attribute"));
        }
        if (node instanceof TermReference reference) {
            return new TermReference(
                    single(reference.id(), Identifier.class, "term reference id"),
                    optional(reference.attribute(), Identifier.class, "term reference attribute"),
                    optional(reference.arguments(), CallArguments.class, "term reference arguments"));
        }
        if (node instanceof FunctionReference reference) {
            return new FunctionReference(
                    single(reference.id(), Identifier.class, "function id"),
                    single(reference.arguments(), CallArguments.class, "function arguments"));
        }
        if (node instanceof SelectExpression select) {
            return new SelectExpression(
                    single(select.selector(), InlineExpression.class, "selector"),
                    list(select.variants(), Variant.class));
        }
        if (node instanceof Variant variant) {
            return new Variant(
                    single(variant.key(), VariantKey.class, "variant key"),
                    single(variant.value(), Pattern.class, "variant value"),
                    variant.isDefault());
        }
        if (node instanceof CallArguments arguments) {
            return new CallArguments(
                    list(arguments.positional(), InlineExpression.class),
                    list(arguments.named(), NamedArgument.class));
        }
        if (node instanceof NamedArgument argument) {
            return new NamedArgument(
                    single(argument.name(), Identifier.class, "argument name"),
                    single(argument.value(), Literal.class, "argument value"));
        }
        // Leaves: Comment, Junk, TextElement, literals and Identifier.
        return node;
    }

    private <T extends SyntaxNode> List<T> list(List<? extends SyntaxNode> children, Class<T> type) {
        List<T> result = new ArrayList<>(children.size());
        for (SyntaxNode child : children) {
            for (SyntaxNode produced : apply(child).nodes()) {
                result.add(checked(produced, type, "list element"));
            }
        }
        return result;
    }

    private <T extends SyntaxNode> T single(SyntaxNode child, Class<T> type, String slot) {
        Transformed result = apply(child);
        if (!(result instanceof Transformed.Replace replace)) {
            throw new IllegalStateException("Cannot " + describe(result) + " the " + slot
                    + "; only list elements and optional children can be removed or expanded");
        }
        return checked(replace.node(), type, slot);
    }

    private <T extends SyntaxNode> T optional(SyntaxNode child, Class<T> type, String slot) {
        if (child == null) {
            return null;
        }
        List<SyntaxNode> produced = apply(child).nodes();
        if (produced.isEmpty()) {
            return null;
        }
        if (produced.size() > 1) {
            throw new IllegalStateException("Cannot expand the " + slot + " into " + produced.size() + " nodes");
        }
        return checked(produced.get(0), type, slot);
    }

    private static <T extends SyntaxNode> T checked(SyntaxNode node, Class<T> type, String slot) {
        if (!type.isInstance(node)) {
            throw new IllegalStateException("Transformation produced " + node.getClass().getSimpleName()
                    + " where the " + slot + " requires " + type.getSimpleName());
        }
        return type.cast(node);
    }

    private static String describe(Transformed result) {
        return result instanceof Transformed.Expand ? "expand" : "delete";
    }

    /**
     * Collects handlers keyed by node class.
     */
    public static final class Builder {
        private final Map<Class<? extends SyntaxNode>, Function<SyntaxNode, Transformed>> handlers = new HashMap<>();

        private Builder() {
        }

        /**
         * Registers the handler for one node class, replacing any earlier handler for it.
         * @param type    The concrete node class, e.g. {@code VariableReference.class}.
         * @param handler The function deciding what replaces each node of that class.
         * @param <T>     The node type.
         * @return This builder.
         */
        public <T extends SyntaxNode> Builder on(Class<T> type, Function<? super T, Transformed> handler) {
            handlers.put(type, node -> handler.apply(type.cast(node)));
            return this;
        }

        public AstTransformer build() {
            return new AstTransformer(handlers);
        }
    }
}
