package org.ftlbuffer.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ftlbuffer.config.LoggingConfigurator;
import org.ftlbuffer.junit.extensions.logging.ExpectLog;
import org.ftlbuffer.junit.extensions.logging.LogLevel;
import org.ftlbuffer.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@DisplayName("CommandLineInterface Tests")
class CommandLineInterfaceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void cliInitialization() {
        assertThat(commandLine.getCommandName()).isEqualTo("ftlbuffer");
        assertThat(commandLine.getSubcommands()).containsKeys("validate", "format", "normalize");
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("reports a clean file as OK")
        void validFile() throws Exception {
            // Arrange
            Path file = write("ok.ftl", "hello = Hello\nbye = { hello }\n");

            // Act
            int exitCode = commandLine.execute("validate", file.toString());

            // Assert
            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains(file + ": OK (0 errors, 0 warnings)");
        }

        @Test
        @DisplayName("reports syntax errors and exits with 1")
        void invalidFile() throws Exception {
            Path file = write("broken.ftl", "hello = Hello\nbroken = {\n");

            int exitCode = commandLine.execute("validate", file.toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(out.toString()).contains(file + ": INVALID (1 errors, 0 warnings)");
        }

        @Test
        @DisplayName("prints a JSON report with warnings")
        void jsonReport() throws Exception {
            // Arrange
            Path file = write("refs.ftl", "a = { b }\n");

            // Act
            int exitCode = commandLine.execute("validate", "--format", "JSON", file.toString());

            // Assert
            assertThat(exitCode).isZero();
            JsonNode report = MAPPER.readTree(out.toString());
            assertThat(report).hasSize(1);
            assertThat(report.get(0).get("valid").asBoolean()).isTrue();
            assertThat(report.get(0).get("errors")).isEmpty();
            assertThat(report.get(0).get("warnings").get(0).get("code").asText()).isEqualTo("undefined-reference");
            assertThat(report.get(0).get("warnings").get(0).get("context").asText()).isEqualTo("b");
        }

        @Test
        @DisplayName("reports unreadable files")
        void missingFile() {
            int exitCode = commandLine.execute("validate", dir.resolve("nope.ftl").toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(err.toString()).contains("Cannot read");
        }
    }

    @Nested
    @DisplayName("format")
    class Format {

        @Test
        @DisplayName("formats a message with arguments")
        void formatsMessage() throws Exception {
            Path file = write("main.ftl", "hello = Hello, { $name }!\n");

            int exitCode = commandLine.execute("format", "--no-isolating", "--arg", "name=Anna", file.toString(), "hello");

            assertThat(exitCode).isZero();
            assertThat(out.toString().strip()).isEqualTo("Hello, Anna!");
        }

        @Test
        @DisplayName("uses the bundle settings of --config")
        void usesConfigFile() throws Exception {
            // Arrange
            Path config = write("custom.conf", "ftlbuffer.bundle { locale = \"de-DE\", use-isolating = false }\n");
            Path file = write("main.ftl", "total = { NUMBER($amount) }\n");

            // Act
            int exitCode = commandLine.execute("--config", config.toString(),
                    "format", "--arg", "amount=1234.5", file.toString(), "total");

            // Assert
            assertThat(exitCode).isZero();
            assertThat(out.toString().strip()).isEqualTo("1.234,5");
        }

        @Test
        @DisplayName("prints JSON and exits with 1 for a missing message")
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Message 'nope' not found")
        void missingMessageAsJson() throws Exception {
            // Arrange
            Path file = write("main.ftl", "hello = Hello\n");

            // Act
            int exitCode = commandLine.execute("format", "-f", "JSON", file.toString(), "nope");

            // Assert
            assertThat(exitCode).isEqualTo(1);
            JsonNode node = MAPPER.readTree(out.toString());
            assertThat(node.get("value").asText()).isEqualTo("{nope}");
            assertThat(node.get("locale").asText()).isEqualTo("en-US");
            assertThat(node.get("diagnostics").get(0).get("code").asText()).isEqualTo("MESSAGE_NOT_FOUND");
        }

        @Test
        @DisplayName("rejects a missing --config file")
        void missingConfigFile() throws Exception {
            Path file = write("main.ftl", "hello = Hello\n");

            int exitCode = commandLine.execute("--config", dir.resolve("absent.conf").toString(),
                    "format", file.toString(), "hello");

            assertThat(exitCode).isEqualTo(2);
            assertThat(err.toString()).contains("Configuration file specified via --config was not found");
        }
    }

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("prints the canonical layout")
        void printsToStdout() throws Exception {
            Path file = write("main.ftl", "a   =   b\nc = d");

            int exitCode = commandLine.execute("normalize", file.toString());

            assertThat(exitCode).isZero();
            assertThat(out.toString()).isEqualTo("a = b\n\nc = d\n");
        }

        @Test
        @DisplayName("writes to --output")
        void writesToFile() throws Exception {
            Path file = write("main.ftl", "a = b\n");
            Path target = dir.resolve("normalized.ftl");

            int exitCode = commandLine.execute("normalize", "-o", target.toString(), file.toString());

            assertThat(exitCode).isZero();
            assertThat(Files.readString(target)).isEqualTo("a = b\n");
            assertThat(out.toString()).isEmpty();
        }
    }
}
