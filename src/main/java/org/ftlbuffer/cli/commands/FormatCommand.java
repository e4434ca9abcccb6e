package org.ftlbuffer.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ftlbuffer.cli.CommandLineInterface;
import org.ftlbuffer.cli.OutputFormat;
import org.ftlbuffer.diagnostics.Diagnostic;
import org.ftlbuffer.runtime.BundleOptions;
import org.ftlbuffer.runtime.FluentBundle;
import org.ftlbuffer.runtime.ResolveResult;
import org.ftlbuffer.util.NumericValues;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "format",
    description = "Format one message of an FTL file"
)
public class FormatCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Parameters(index = "0", paramLabel = "FILE", description = "The FTL file")
    private Path file;

    @Parameters(index = "1", paramLabel = "MESSAGE", description = "The message id")
    private String messageId;

    @Option(names = {"-a", "--attribute"}, description = "Format this attribute instead of the message value")
    private String attribute;

    @Option(names = "--arg", paramLabel = "NAME=VALUE",
        description = "A message argument; numeric values are passed as numbers. May be repeated.")
    private Map<String, String> args = new LinkedHashMap<>();

    @Option(names = {"-l", "--locale"}, description = "Locale code (default: ftlbuffer.bundle.locale)")
    private String locale;

    @Option(names = "--no-isolating", description = "Do not wrap placeables in bidi isolation marks")
    private boolean noIsolating;

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
        BundleOptions options = BundleOptions.fromConfig(parent.getConfig());
        if (locale != null) {
            options = options.withLocale(locale);
        }
        if (noIsolating) {
            options = options.withUseIsolating(false);
        }
        final FluentBundle bundle = new FluentBundle(options);
        bundle.addResource(Files.readString(file, StandardCharsets.UTF_8), file.toString());

        final ResolveResult result = bundle.formatPattern(messageId, toArguments(args), attribute);

        if (format == OutputFormat.JSON) {
            final ObjectNode node = MAPPER.createObjectNode();
            node.put("id", messageId);
            node.put("attribute", attribute);
            node.put("locale", options.locale());
            node.put("value", result.value());
            final ArrayNode diagnostics = node.putArray("diagnostics");
            for (final Diagnostic diagnostic : result.diagnostics()) {
                diagnostics.addObject()
                        .put("code", diagnostic.code().name())
                        .put("message", diagnostic.message());
            }
            spec.commandLine().getOut().println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node));
        } else {
            spec.commandLine().getOut().println(result.value());
            for (final Diagnostic diagnostic : result.diagnostics()) {
                spec.commandLine().getErr().println(diagnostic.format());
            }
        }
        spec.commandLine().getOut().flush();
        return result.hasErrors() ? 1 : 0;
    }

    private static Map<String, Object> toArguments(final Map<String, String> raw) {
        final Map<String, Object> converted = new LinkedHashMap<>();
        raw.forEach((name, value) -> converted.put(name,
                NumericValues.toBigDecimal(value).<Object>map(n -> n).orElse(value)));
        return converted;
    }
}
