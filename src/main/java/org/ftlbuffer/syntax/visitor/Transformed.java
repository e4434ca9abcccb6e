package org.ftlbuffer.syntax.visitor;

import org.ftlbuffer.syntax.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

/**
 * The result of transforming one node: a replacement, a deletion, or an expansion into
 * several nodes. Deletion and expansion are only honoured where the node sits in a list.
 */
public sealed interface Transformed {

    /**
     * @param node The replacement node.
     * @return A result that replaces the original node with {@code node}.
     */
    static Transformed replace(SyntaxNode node) {
        return new Replace(node);
    }

    /**
     * @return A result that removes the original node from its parent list.
     */
    static Transformed delete() {
        return Delete.INSTANCE;
    }

    /**
     * @param nodes The nodes to splice in place of the original.
     * @return A result that replaces the original node with all of {@code nodes}.
     */
    static Transformed expand(List<? extends SyntaxNode> nodes) {
        return new Expand(List.copyOf(nodes));
    }

    /**
     * @return The resulting nodes: one for a replacement, none for a deletion.
     */
    List<SyntaxNode> nodes();

    record Replace(SyntaxNode node) implements Transformed {
        public Replace {
            Objects.requireNonNull(node, "node");
        }

        @Override
        public List<SyntaxNode> nodes() {
            return List.of(node);
        }
    }

    record Expand(List<SyntaxNode> replacements) implements Transformed {
        @Override
        public List<SyntaxNode> nodes() {
            return replacements;
        }
    }

    final class Delete implements Transformed {
        static final Delete INSTANCE = new Delete();

        private Delete() {
        }

        @Override
        public List<SyntaxNode> nodes() {
            return List.of();
        }

        @Override
        public String toString() {
            return "Delete";
        }
    }
}
