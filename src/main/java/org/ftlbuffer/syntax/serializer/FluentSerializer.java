package org.ftlbuffer.syntax.serializer;

import org.ftlbuffer.syntax.ast.Attribute;
import org.ftlbuffer.syntax.ast.CallArguments;
import org.ftlbuffer.syntax.ast.Comment;
import org.ftlbuffer.syntax.ast.Entry;
import org.ftlbuffer.syntax.ast.FunctionReference;
import org.ftlbuffer.syntax.ast.Identifier;
import org.ftlbuffer.syntax.ast.InlineExpression;
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
import org.ftlbuffer.syntax.ast.Term;
import org.ftlbuffer.syntax.ast.TermReference;
import org.ftlbuffer.syntax.ast.TextElement;
import org.ftlbuffer.syntax.ast.VariableReference;
import org.ftlbuffer.syntax.ast.Variant;
import org.ftlbuffer.syntax.visitor.AstVisitor;

/**
 * Writes a syntax tree back to FTL text in a normalized layout.
 * <p>
 * Serializing a parsed resource, parsing the output and serializing again yields the same text.
 * Instances accumulate output and are single-use; call {@link #serialize(Resource)}.
 */
public class FluentSerializer extends AstVisitor {

    private final StringBuilder out = new StringBuilder();

    private FluentSerializer() {
    }

    /**
     * @param resource The resource to write.
     * @return The FTL text; entries are separated by a blank line.
     */
    public static String serialize(Resource resource) {
        FluentSerializer serializer = new FluentSerializer();
        serializer.visit(resource);
        return serializer.out.toString();
    }

    /**
     * @param pattern A pattern.
     * @return The pattern as it would appear after {@code =}.
     */
    public static String serializePattern(Pattern pattern) {
        FluentSerializer serializer = new FluentSerializer();
        serializer.visit(pattern);
        return serializer.out.toString();
    }

    @Override
    public void visitResource(Resource node) {
        boolean first = true;
        for (Entry entry : node.entries()) {
            if (!first) {
                out.append('\n');
            }
            first = false;
            visit(entry);
        }
    }

    @Override
    public void visitMessage(Message node) {
        out.append(node.id().name());
        writeValue(node.value());
        node.attributes().forEach(this::visit);
        out.append('\n');
    }

    @Override
    public void visitTerm(Term node) {
        out.append('-').append(node.id().name());
        writeValue(node.value());
        node.attributes().forEach(this::visit);
        out.append('\n');
    }

    @Override
    public void visitAttribute(Attribute node) {
        out.append("\n    .").append(node.id().name());
        writeValue(node.value());
    }

    private void writeValue(Pattern value) {
        if (value == null || value.isEmpty()) {
            out.append(" =");
            return;
        }
        out.append(" = ");
        visit(value);
    }

    @Override
    public void visitComment(Comment node) {
        for (String line : node.content().split("\n", -1)) {
            out.append(node.kind().sigil());
            if (!line.isEmpty()) {
                out.append(' ').append(line);
            }
            out.append('\n');
        }
    }

    @Override
    public void visitJunk(Junk node) {
        String content = node.content();
        int end = content.length();
        while (end > 0 && (content.charAt(end - 1) == '\n' || content.charAt(end - 1) == '\r')) {
            end--;
        }
        out.append(content, 0, end).append('\n');
    }

    @Override
    public void visitTextElement(TextElement node) {
        out.append(node.value());
    }

    @Override
    public void visitPlaceable(Placeable node) {
        out.append("{ ");
        visit(node.expression());
        out.append(" }");
    }

    @Override
    public void visitSelectExpression(SelectExpression node) {
        visit(node.selector());
        out.append(" ->");
        node.variants().forEach(this::visit);
        out.append('\n');
    }

    @Override
    public void visitVariant(Variant node) {
        out.append(node.isDefault() ? "\n  *[" : "\n   [");
        visit(node.key());
        out.append(']');
        if (!node.value().isEmpty()) {
            out.append(' ');
            visit(node.value());
        }
    }

    @Override
    public void visitStringLiteral(StringLiteral node) {
        out.append('"');
        for (int i = 0; i < node.value().length(); i++) {
            char c = node.value().charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04X", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    @Override
    public void visitNumberLiteral(NumberLiteral node) {
        out.append(node.raw());
    }

    @Override
    public void visitIdentifier(Identifier node) {
        out.append(node.name());
    }

    @Override
    public void visitVariableReference(VariableReference node) {
        out.append('$').append(node.id().name());
    }

    @Override
    public void visitMessageReference(MessageReference node) {
        out.append(node.id().name());
        if (node.attribute() != null) {
            out.append('.').append(node.attribute().name());
        }
    }

    @Override
    public void visitTermReference(TermReference node) {
        out.append('-').append(node.id().name());
        if (node.attribute() != null) {
            out.append('.').append(node.attribute().name());
        }
        if (node.arguments() != null) {
            visit(node.arguments());
        }
    }

    @Override
    public void visitFunctionReference(FunctionReference node) {
        out.append(node.id().name());
        visit(node.arguments());
    }

    @Override
    public void visitCallArguments(CallArguments node) {
        out.append('(');
        boolean first = true;
        for (InlineExpression argument : node.positional()) {
            first = separate(first);
            visit(argument);
        }
        for (NamedArgument argument : node.named()) {
            first = separate(first);
            visit(argument);
        }
        out.append(')');
    }

    private boolean separate(boolean first) {
        if (!first) {
            out.append(", ");
        }
        return false;
    }

    @Override
    public void visitNamedArgument(NamedArgument node) {
        out.append(node.name().name()).append(": ");
        visit(node.value());
    }
}
