package org.ftlbuffer.syntax.visitor;

import org.ftlbuffer.syntax.ast.Attribute;
import org.ftlbuffer.syntax.ast.CallArguments;
import org.ftlbuffer.syntax.ast.Comment;
import org.ftlbuffer.syntax.ast.FunctionReference;
import org.ftlbuffer.syntax.ast.Identifier;
import org.ftlbuffer.syntax.ast.Junk;
import org.ftlbuffer.syntax.ast.Message;
import org.ftlbuffer.syntax.ast.MessageReference;
import org.ftlbuffer.syntax.ast.NamedArgument;
import org.ftlbuffer.syntax.ast.NumberLiteral;
import org.ftlbuffer.syntax.ast.Pattern;
import org.ftlbuffer.syntax.ast.Placeable;
import org.ftlbuffer.syntax.ast.Resource;
import org.ftlbuffer.syntax.ast.SelectExpression;
import org.ftlbuffer.syntax.ast.StringLiteral;
import org.ftlbuffer.syntax.ast.SyntaxNode;
import org.ftlbuffer.syntax.ast.Term;
import org.ftlbuffer.syntax.ast.TermReference;
import org.ftlbuffer.syntax.ast.TextElement;
import org.ftlbuffer.syntax.ast.Variant;
import org.ftlbuffer.syntax.ast.VariableReference;

import java.util.List;

/**
 * Base class for read-only passes over a syntax tree.
 * <p>
 * Every node calls back into the matching {@code visitXxx} method through
 * {@link SyntaxNode#accept(AstVisitor)}. The default implementation of each method simply
 * descends into the node's children, so a subclass only overrides the node kinds it cares about
 * and calls {@link #visitChildren(SyntaxNode)} where it wants to keep descending.
 */
public abstract class AstVisitor {

    /**
     * Visits a single node. Does nothing for {@code null}.
     * @param node The node to visit.
     */
    public void visit(SyntaxNode node) {
        if (node == null) {
            return;
        }
        node.accept(this);
    }

    /**
     * Visits a list of nodes in order.
     * @param nodes The nodes to visit.
     */
    public void visitAll(List<? extends SyntaxNode> nodes) {
        for (SyntaxNode node : nodes) {
            visit(node);
        }
    }

    /**
     * Visits all direct children of a node in source order.
     * @param node The parent node.
     */
    protected void visitChildren(SyntaxNode node) {
        visitAll(node.getChildren());
    }

    public void visitResource(Resource node) {
        visitChildren(node);
    }

    public void visitMessage(Message node) {
        visitChildren(node);
    }

    public void visitTerm(Term node) {
        visitChildren(node);
    }

    public void visitAttribute(Attribute node) {
        visitChildren(node);
    }

    public void visitComment(Comment node) {
        visitChildren(node);
    }

    public void visitJunk(Junk node) {
        visitChildren(node);
    }

    public void visitPattern(Pattern node) {
        visitChildren(node);
    }

    public void visitTextElement(TextElement node) {
        visitChildren(node);
    }

    public void visitPlaceable(Placeable node) {
        visitChildren(node);
    }

    public void visitStringLiteral(StringLiteral node) {
        visitChildren(node);
    }

    public void visitNumberLiteral(NumberLiteral node) {
        visitChildren(node);
    }

    public void visitVariableReference(VariableReference node) {
        visitChildren(node);
    }

    public void visitMessageReference(MessageReference node) {
        visitChildren(node);
    }

    public void visitTermReference(TermReference node) {
        visitChildren(node);
    }

    public void visitFunctionReference(FunctionReference node) {
        visitChildren(node);
    }

    public void visitSelectExpression(SelectExpression node) {
        visitChildren(node);
    }

    public void visitVariant(Variant node) {
        visitChildren(node);
    }

    public void visitCallArguments(CallArguments node) {
        visitChildren(node);
    }

    public void visitNamedArgument(NamedArgument node) {
        visitChildren(node);
    }

    public void visitIdentifier(Identifier node) {
        visitChildren(node);
    }
}
