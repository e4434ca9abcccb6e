package org.ftlbuffer.syntax.visitor;

import org.ftlbuffer.syntax.ast.Comment;
import org.ftlbuffer.syntax.ast.Identifier;
import org.ftlbuffer.syntax.ast.Message;
import org.ftlbuffer.syntax.ast.MessageReference;
import org.ftlbuffer.syntax.ast.Placeable;
import org.ftlbuffer.syntax.ast.Resource;
import org.ftlbuffer.syntax.ast.TextElement;
import org.ftlbuffer.syntax.ast.VariableReference;
import org.ftlbuffer.syntax.parser.FluentParser;
import org.ftlbuffer.syntax.serializer.FluentSerializer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the bottom-up rebuilding performed by {@link AstTransformer}.
 */
@Tag("unit")
class AstTransformerTest {

    private final FluentParser parser = new FluentParser();

    /**
     * Verifies that a handler can replace every node of a class and that the input tree stays untouched.
     */
    @Test
    void replace_renamesAllVariables() {
        // Arrange
        Resource original = parser.parse("a = { $x } and { $y }");
        AstTransformer transformer = AstTransformer.builder()
                .on(VariableReference.class, v -> Transformed.replace(new VariableReference(new Identifier("renamed"))))
                .build();

        // Act
        Resource transformed = transformer.transform(original);

        // Assert
        assertThat(FluentSerializer.serialize(transformed)).isEqualTo("a = { $renamed } and { $renamed }\n");
        assertThat(FluentSerializer.serialize(original)).isEqualTo("a = { $x } and { $y }\n");
    }

    /**
     * Verifies that deleting list elements removes them from the parent.
     */
    @Test
    void delete_removesComments() {
        Resource original = parser.parse("# note\na = b\n## group\nc = d\n");
        AstTransformer transformer = AstTransformer.builder()
                .on(Comment.class, c -> Transformed.delete())
                .build();

        Resource transformed = transformer.transform(original);

        assertThat(transformed.entries()).hasSize(2).allMatch(e -> e instanceof Message);
    }

    /**
     * Verifies that an expansion splices several nodes in place of one.
     */
    @Test
    void expand_splicesNodesIntoPattern() {
        Resource original = parser.parse("a = hi");
        AstTransformer transformer = AstTransformer.builder()
                .on(TextElement.class, t -> Transformed.expand(List.of(t, new TextElement("!"))))
                .build();

        Resource transformed = transformer.transform(original);

        assertThat(transformed.messages().get(0).value().elements())
                .containsExactly(new TextElement("hi"), new TextElement("!"));
    }

    /**
     * Verifies that deleting an optional child clears it.
     */
    @Test
    void delete_optionalChildBecomesNull() {
        Resource original = parser.parse("a = { other.attr }");
        AstTransformer transformer = AstTransformer.builder()
                .on(Identifier.class, id -> id.name().equals("attr") ? Transformed.delete() : Transformed.replace(id))
                .build();

        Resource transformed = transformer.transform(original);

        Placeable placeable = (Placeable) transformed.messages().get(0).value().elements().get(0);
        assertThat(placeable.expression()).isEqualTo(new MessageReference(new Identifier("other"), null));
    }

    /**
     * Verifies that a tree without matching handlers is returned as the same instance.
     */
    @Test
    void noMatchingHandler_sharesOriginalTree() {
        Resource original = parser.parse("a = { $x }\nb = c\n");
        AstTransformer transformer = AstTransformer.builder()
                .on(Comment.class, c -> Transformed.delete())
                .build();

        Resource transformed = transformer.transform(original);

        assertThat(transformed).isSameAs(original);
    }

    /**
     * Verifies that a required child cannot be deleted.
     */
    @Test
    void delete_requiredChildFails() {
        Resource original = parser.parse("a = b");
        AstTransformer transformer = AstTransformer.builder()
                .on(Identifier.class, id -> Transformed.delete())
                .build();

        assertThatThrownBy(() -> transformer.transform(original))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Cannot delete the message id");
    }

    /**
     * Verifies that a replacement of the wrong node kind is rejected.
     */
    @Test
    void replace_withWrongKindFails() {
        Resource original = parser.parse("a = { $x }");
        AstTransformer transformer = AstTransformer.builder()
                .on(VariableReference.class, v -> Transformed.replace(new TextElement("x")))
                .build();

        assertThatThrownBy(() -> transformer.transform(original))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Transformation produced TextElement where the placeable expression requires Expression");
    }

    /**
     * Verifies that a handler returning null is reported.
     */
    @Test
    void nullResult_fails() {
        Resource original = parser.parse("a = b");
        AstTransformer transformer = AstTransformer.builder()
                .on(TextElement.class, t -> null)
                .build();

        assertThatThrownBy(() -> transformer.transform(original))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("returned null");
    }
}
