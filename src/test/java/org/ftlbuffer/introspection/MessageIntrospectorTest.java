package org.ftlbuffer.introspection;

import org.ftlbuffer.syntax.ast.Resource;
import org.ftlbuffer.syntax.parser.FluentParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the static analysis performed by {@link MessageIntrospector}.
 */
@Tag("unit")
class MessageIntrospectorTest {

    private final FluentParser parser = new FluentParser();

    private MessageIntrospection introspectFirst(String source) {
        Resource resource = parser.parse(source);
        return MessageIntrospector.introspect(resource.messages().get(0));
    }

    /**
     * Verifies that each variable is recorded with the context it appears in.
     */
    @Test
    void variables_haveContexts() {
        // Act
        MessageIntrospection result = introspectFirst(
                "m = { $a } { NUMBER($b, minimumFractionDigits: 2) } { $c ->\n   *[x] { $d }\n}\n");

        // Assert
        assertThat(result.messageId()).isEqualTo("m");
        assertThat(result.variables()).containsExactly(
                new VariableInfo("a", VariableInfo.Context.PATTERN),
                new VariableInfo("b", VariableInfo.Context.FUNCTION_ARG),
                new VariableInfo("c", VariableInfo.Context.SELECTOR),
                new VariableInfo("d", VariableInfo.Context.VARIANT));
        assertThat(result.hasSelectors()).isTrue();
        assertThat(result.requiresVariable("d")).isTrue();
        assertThat(result.requiresVariable("z")).isFalse();
    }

    /**
     * Verifies the recorded function calls.
     */
    @Test
    void functions_areRecorded() {
        MessageIntrospection result = introspectFirst("m = { NUMBER($n, minimumFractionDigits: 2) } { DATETIME($d) }");

        assertThat(result.functionNames()).containsExactly("NUMBER", "DATETIME");
        assertThat(result.functions()).contains(
                new FunctionCallInfo("NUMBER", List.of("n"), Set.of("minimumFractionDigits")));
        assertThat(result.hasSelectors()).isFalse();
    }

    /**
     * Verifies message and term references, including attributes and term arguments.
     */
    @Test
    void references_areRecorded() {
        MessageIntrospection result = introspectFirst("m = { other.title } { -brand(case: \"x\") }\n    .a = { $inAttr }\n");

        assertThat(result.references()).containsExactly(
                new ReferenceInfo("other", ReferenceInfo.Kind.MESSAGE, "title"),
                new ReferenceInfo("brand", ReferenceInfo.Kind.TERM, null));
        assertThat(result.variableNames()).containsExactly("inAttr");
    }

    /**
     * Verifies that terms can be introspected like messages.
     */
    @Test
    void term_isIntrospected() {
        Resource resource = parser.parse("-brand = { $case -> *[nom] Acme }");

        MessageIntrospection result = MessageIntrospector.introspect(resource.terms().get(0));

        assertThat(result.messageId()).isEqualTo("brand");
        assertThat(result.variableNames()).containsExactly("case");
    }
}
