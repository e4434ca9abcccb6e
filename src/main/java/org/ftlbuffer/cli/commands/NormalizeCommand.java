package org.ftlbuffer.cli.commands;

import org.ftlbuffer.syntax.ast.Resource;
import org.ftlbuffer.syntax.parser.FluentParser;
import org.ftlbuffer.syntax.serializer.FluentSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "normalize",
    description = "Parse an FTL file and print it in canonical layout"
)
public class NormalizeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(NormalizeCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "The FTL file")
    private Path file;

    @Option(names = {"-o", "--output"}, description = "Write to this file instead of standard output")
    private Path output;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final Resource resource = new FluentParser().parse(Files.readString(file, StandardCharsets.UTF_8));
        final String normalized = FluentSerializer.serialize(resource);
        if (!resource.junk().isEmpty()) {
            LOG.warn("{} contains {} unparsable entries; they are kept verbatim", file, resource.junk().size());
        }
        if (output != null) {
            Files.writeString(output, normalized, StandardCharsets.UTF_8);
        } else {
            spec.commandLine().getOut().print(normalized);
            spec.commandLine().getOut().flush();
        }
        return 0;
    }
}
