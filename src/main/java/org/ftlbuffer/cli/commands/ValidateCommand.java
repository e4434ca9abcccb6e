package org.ftlbuffer.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ftlbuffer.cli.CommandLineInterface;
import org.ftlbuffer.cli.OutputFormat;
import org.ftlbuffer.diagnostics.validation.ValidationError;
import org.ftlbuffer.diagnostics.validation.ValidationResult;
import org.ftlbuffer.diagnostics.validation.ValidationWarning;
import org.ftlbuffer.runtime.FluentBundle;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "validate",
    description = "Check FTL files for syntax errors, duplicate ids, undefined and circular references"
)
public class ValidateCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "The FTL files to validate")
    private List<Path> files;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private OutputFormat format = OutputFormat.TEXT;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final FluentBundle bundle = FluentBundle.fromConfig(parent.getConfig());
        final PrintWriter out = spec.commandLine().getOut();
        final ArrayNode report = MAPPER.createArrayNode();
        boolean failed = false;

        for (final Path file : files) {
            final String source;
            try {
                source = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                spec.commandLine().getErr().println("Cannot read " + file + ": " + e.getMessage());
                failed = true;
                continue;
            }
            final ValidationResult result = bundle.validateResource(source);
            failed |= !result.isValid();
            if (format == OutputFormat.JSON) {
                report.add(toJson(file, result));
            } else {
                printText(out, file, source, result);
            }
        }

        if (format == OutputFormat.JSON) {
            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        }
        out.flush();
        return failed ? 1 : 0;
    }

    private static void printText(final PrintWriter out, final Path file, final String source, final ValidationResult result) {
        out.printf("%s: %s (%d errors, %d warnings)%n", file, result.isValid() ? "OK" : "INVALID",
                result.errorCount(), result.warningCount());
        for (final ValidationError error : result.errors()) {
            out.println(error.diagnostic().format(source).indent(2).stripTrailing());
        }
        for (final ValidationWarning warning : result.warnings()) {
            out.printf("  warning[%s]: %s%n", warning.code(), warning.message());
        }
    }

    private static ObjectNode toJson(final Path file, final ValidationResult result) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("file", file.toString());
        node.put("valid", result.isValid());
        final ArrayNode errors = node.putArray("errors");
        for (final ValidationError error : result.errors()) {
            errors.addObject()
                    .put("code", error.code())
                    .put("message", error.message())
                    .put("line", error.line())
                    .put("column", error.column())
                    .put("content", error.content());
        }
        final ArrayNode warnings = node.putArray("warnings");
        for (final ValidationWarning warning : result.warnings()) {
            warnings.addObject()
                    .put("code", warning.code())
                    .put("message", warning.message())
                    .put("context", warning.context());
        }
        return node;
    }
}
