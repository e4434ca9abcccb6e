package org.ftlbuffer.localization;

import org.ftlbuffer.diagnostics.FluentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests {@link PathResourceLoader} against a temporary directory tree.
 */
@Tag("unit")
class PathResourceLoaderTest {

    @TempDir
    Path root;

    private PathResourceLoader loader;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("en"));
        Files.writeString(root.resolve("en").resolve("main.ftl"), "hello = Hello\n", StandardCharsets.UTF_8);
        loader = new PathResourceLoader(root + "/{locale}");
    }

    /**
     * Verifies that the locale placeholder is substituted.
     */
    @Test
    void load_readsExistingFile() throws Exception {
        Optional<String> source = loader.load("en", "main.ftl");

        assertThat(source).contains("hello = Hello\n");
        assertThat(loader.describe("en", "main.ftl")).isEqualTo(root.resolve("en").resolve("main.ftl").toString());
    }

    /**
     * Verifies that missing files are reported as absent, not as errors.
     */
    @Test
    void load_missingFileIsEmpty() throws Exception {
        assertThat(loader.load("de", "main.ftl")).isEmpty();
        assertThat(loader.load("en", "other.ftl")).isEmpty();
    }

    /**
     * Verifies that unreadable content raises an exception.
     */
    @Test
    void load_invalidUtf8Fails() throws Exception {
        Files.write(root.resolve("en").resolve("broken.ftl"), new byte[]{(byte) 0xC3, (byte) 0x28});

        assertThatThrownBy(() -> loader.load("en", "broken.ftl"))
                .isInstanceOf(FluentException.class)
                .hasMessageStartingWith("Failed to read resource");
    }

    /**
     * Verifies loading a localization from disk with a locale that has no files.
     */
    @Test
    void localization_loadsFromDisk() throws Exception {
        FluentLocalization l10n = FluentLocalization.load(List.of("de", "en"), List.of("main.ftl"), loader, false);

        assertThat(l10n.formatValue("hello", null).value()).isEqualTo("Hello");
    }
}
