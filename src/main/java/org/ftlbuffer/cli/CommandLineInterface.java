package org.ftlbuffer.cli;

import com.typesafe.config.Config;
import org.ftlbuffer.cli.commands.FormatCommand;
import org.ftlbuffer.cli.commands.NormalizeCommand;
import org.ftlbuffer.cli.commands.ValidateCommand;
import org.ftlbuffer.config.ConfigLoader;
import org.ftlbuffer.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "ftlbuffer",
    mixinStandardHelpOptions = true,
    version = "ftlbuffer 1.0",
    description = "Validate, format and normalize FTL localization resources",
    subcommands = {
        ValidateCommand.class,
        FormatCommand.class,
        NormalizeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: ftlbuffer.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("ftlbuffer");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if {@code --config} names a file that does not exist.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            LOG.debug("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            config = ConfigLoader.load(configFile);
        } else {
            config = ConfigLoader.load();
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
