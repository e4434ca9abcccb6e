package org.ftlbuffer.diagnostics.validation;

import org.ftlbuffer.diagnostics.DiagnosticCode;
import org.ftlbuffer.syntax.ast.Message;
import org.ftlbuffer.syntax.parser.FluentParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the syntax and reference checks of {@link ResourceValidator}.
 */
@Tag("unit")
class ResourceValidatorTest {

    private final FluentParser parser = new FluentParser();
    private final ResourceValidator validator = new ResourceValidator();

    private ValidationResult validate(String source) {
        return validator.validate(parser.parse(source), source);
    }

    /**
     * Verifies that a clean resource produces neither errors nor warnings.
     */
    @Test
    void cleanResource_isValid() {
        ValidationResult result = validate("-brand = Acme\nhello = Hello from { -brand }\n    .title = { other }\nother = x\n");

        assertThat(result.isValid()).isTrue();
        assertThat(result.errorCount()).isZero();
        assertThat(result.warningCount()).isZero();
    }

    /**
     * Verifies that junk is reported with its start position and the parser's message.
     */
    @Test
    void junk_isReportedAsError() {
        // Arrange
        String source = "ok = fine\nbad = text } x\nnext = y\n";

        // Act
        ValidationResult result = validate(source);

        // Assert
        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).hasSize(1);
        ValidationError error = result.errors().get(0);
        assertThat(error.code()).isEqualTo(ValidationError.PARSE_ERROR);
        assertThat(error.message()).isEqualTo("Unbalanced closing brace in pattern");
        assertThat(error.content()).isEqualTo("bad = text } x\n");
        assertThat(error.line()).isEqualTo(2);
        assertThat(error.column()).isEqualTo(1);
        assertThat(error.diagnostic().code()).isEqualTo(DiagnosticCode.EXPECTED_TOKEN);
        assertThat(error.diagnostic().location().column()).isEqualTo(12);
    }

    /**
     * Verifies that an error at the end of the source is classified as unexpected end of input.
     */
    @Test
    void errorAtEndOfSource_isUnexpectedEof() {
        ValidationResult result = validate("ok = fine\nbad = { missing\n");

        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).diagnostic().code()).isEqualTo(DiagnosticCode.UNEXPECTED_EOF);
    }

    /**
     * Verifies duplicate detection, keeping messages and terms apart.
     */
    @Test
    void duplicateIds_areWarnings() {
        ValidationResult result = validate("a = 1\na = 2\n-a = 3\n");

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).containsExactly(new ValidationWarning(ValidationWarning.DUPLICATE_ID,
                "Duplicate message ID 'a' (later definition will overwrite earlier)", "a"));
    }

    /**
     * Verifies that references to missing messages and terms are reported.
     */
    @Test
    void undefinedReferences_areWarnings() {
        ValidationResult result = validate("a = { b } { -t }\n");

        assertThat(result.warnings()).extracting(ValidationWarning::message).containsExactly(
                "Message 'a' references undefined message 'b'",
                "Message 'a' references undefined term '-t'");
        assertThat(result.warnings()).extracting(ValidationWarning::context).containsExactly("b", "-t");
    }

    /**
     * Verifies that a message cycle is reported once with its path.
     */
    @Test
    void messageCycle_isReportedOnce() {
        ValidationResult result = validate("a = { b }\nb = { a }\n");

        assertThat(result.warnings()).containsExactly(new ValidationWarning(ValidationWarning.CIRCULAR_REFERENCE,
                "Circular message reference: a -> b -> a", "a -> b -> a"));
    }

    /**
     * Verifies that term cycles carry the term prefix.
     */
    @Test
    void termCycle_usesDashPrefix() {
        ValidationResult result = validate("-x = { -y }\n-y = { -x }\n");

        assertThat(result.warnings()).extracting(ValidationWarning::message)
                .containsExactly("Circular term reference: -x -> -y -> -x");
    }

    /**
     * Verifies that a cycle reached from a non-cyclic entry only contains the cycle itself.
     */
    @Test
    void cyclePath_isTrimmedToCycle() {
        ValidationResult result = validate("start = { a }\na = { b }\nb = { a }\nself = { self }\n");

        assertThat(result.warnings()).extracting(ValidationWarning::context)
                .containsExactly("a -> b -> a", "self -> self");
    }

    /**
     * Verifies that very long reference chains are walked without exhausting the stack.
     */
    @Test
    void longReferenceChain_isWalked() {
        // Arrange
        int length = 20000;
        StringBuilder open = new StringBuilder();
        for (int i = 0; i < length; i++) {
            open.append('m').append(i).append(" = { m").append(i + 1).append(" }\n");
        }
        String closed = open.toString().replace("m" + length + " }", "m0 }");

        // Act
        ValidationResult chain = validate(open.toString());
        ValidationResult cycle = validate(closed);

        // Assert
        assertThat(chain.warnings()).extracting(ValidationWarning::message)
                .containsExactly("Message 'm" + (length - 1) + "' references undefined message 'm" + length + "'");
        assertThat(cycle.warnings()).hasSize(1);
        ValidationWarning warning = cycle.warnings().get(0);
        assertThat(warning.code()).isEqualTo(ValidationWarning.CIRCULAR_REFERENCE);
        assertThat(warning.context()).startsWith("m0 -> m1 -> m2").endsWith("m" + (length - 1) + " -> m0");
    }

    /**
     * Verifies that references inside attributes and function arguments are collected.
     */
    @Test
    void referenceCollector_coversAttributesAndArguments() {
        Message message = parser.parse("a = { NUMBER(-count) }\n    .t = { b.x }\n").messages().get(0);

        ReferenceCollector collector = ReferenceCollector.of(message.value(), message.attributes());

        assertThat(collector.getMessageReferences()).containsExactly("b");
        assertThat(collector.getTermReferences()).containsExactly("count");
    }
}
