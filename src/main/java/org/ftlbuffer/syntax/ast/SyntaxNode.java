package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the FTL syntax tree.
 * <p>
 * Nodes are immutable records. Trees are rebuilt, never edited in place.
 */
public sealed interface SyntaxNode
        permits Resource, Entry, Attribute, Pattern, PatternElement, Expression,
                Variant, VariantKey, CallArguments, NamedArgument {

    /**
     * Returns the direct child nodes in source order.
     * This allows generic passes to traverse the tree without knowing each node's structure.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<SyntaxNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Dispatches to the matching {@code visitXxx} method of the visitor.
     * @param visitor The visitor.
     */
    void accept(AstVisitor visitor);
}
