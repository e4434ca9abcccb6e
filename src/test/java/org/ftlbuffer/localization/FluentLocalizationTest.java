package org.ftlbuffer.localization;

import org.ftlbuffer.diagnostics.Diagnostic;
import org.ftlbuffer.diagnostics.DiagnosticCode;
import org.ftlbuffer.diagnostics.FluentException;
import org.ftlbuffer.junit.extensions.logging.ExpectLog;
import org.ftlbuffer.junit.extensions.logging.LogLevel;
import org.ftlbuffer.junit.extensions.logging.LogWatchExtension;
import org.ftlbuffer.runtime.FluentBundle;
import org.ftlbuffer.runtime.ResolveResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
@DisplayName("FluentLocalization Unit Tests")
class FluentLocalizationTest {

    @Mock
    private ResourceLoader loader;

    /**
     * Verifies that each message comes from the first locale defining it.
     */
    @Test
    void formatValue_fallsBackAlongChain() {
        // Arrange
        FluentLocalization l10n = new FluentLocalization(List.of("lv", "en"), false);
        l10n.addResource("lv", "welcome = Sveiki, { $name }!");
        l10n.addResource("en", "welcome = Hello, { $name }!\nbye = Goodbye");

        // Act
        ResolveResult welcome = l10n.formatValue("welcome", Map.of("name", "Anna"));
        ResolveResult bye = l10n.formatValue("bye", null);

        // Assert
        assertThat(welcome).isEqualTo(ResolveResult.of("Sveiki, Anna!"));
        assertThat(bye).isEqualTo(ResolveResult.of("Goodbye"));
        assertThat(l10n.hasMessage("bye")).isTrue();
    }

    /**
     * Verifies the fallback for a message that no locale defines.
     */
    @Test
    void formatValue_notFoundAnywhere() {
        FluentLocalization l10n = new FluentLocalization(List.of("lv", "en"));

        ResolveResult result = l10n.formatValue("nope", null);

        assertThat(result.value()).isEqualTo("{nope}");
        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .containsExactly("Message 'nope' not found in any locale");
        assertThat(l10n.hasMessage("nope")).isFalse();
    }

    /**
     * Verifies the generic fallback for an empty id.
     */
    @Test
    void formatValue_emptyId() {
        FluentLocalization l10n = new FluentLocalization(List.of("en"));

        ResolveResult result = l10n.formatValue("", null);

        assertThat(result.value()).isEqualTo("{???}");
        assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(DiagnosticCode.MESSAGE_NOT_FOUND);
    }

    /**
     * Verifies that resolution errors of the chosen locale are passed through without trying the next one.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Message 'welcome' resolved with 1 error.*")
    void formatValue_returnsErrorsOfChosenLocale() {
        FluentLocalization l10n = new FluentLocalization(List.of("lv", "en"), false);
        l10n.addResource("lv", "welcome = Sveiki, { $name }!");
        l10n.addResource("en", "welcome = Hello!");

        ResolveResult result = l10n.formatValue("welcome", Map.of());

        assertThat(result.value()).isEqualTo("Sveiki, {$name}!");
        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                .containsExactly(DiagnosticCode.VARIABLE_NOT_PROVIDED);
    }

    /**
     * Verifies the argument checks of the constructor and of addResource.
     */
    @Test
    void invalidArguments_areRejected() {
        assertThatThrownBy(() -> new FluentLocalization(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("At least one locale is required");

        FluentLocalization l10n = new FluentLocalization(List.of("lv", "en"));
        assertThatThrownBy(() -> l10n.addResource("fr", "a = b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Locale 'fr' not in fallback chain [lv, en]");
    }

    /**
     * Verifies that the loader is asked for every locale and missing resources are skipped.
     */
    @Test
    void load_usesLoaderForEveryLocale() throws Exception {
        // Arrange
        when(loader.load("lv", "main.ftl")).thenReturn(Optional.empty());
        when(loader.load("en", "main.ftl")).thenReturn(Optional.of("hello = Hi"));
        when(loader.describe("en", "main.ftl")).thenReturn("en/main.ftl");

        // Act
        FluentLocalization l10n = FluentLocalization.load(List.of("lv", "en"), List.of("main.ftl"), loader, true);

        // Assert
        assertThat(l10n.getLocales()).containsExactly("lv", "en");
        assertThat(l10n.formatValue("hello", null).value()).isEqualTo("Hi");
        assertThat(l10n.bundles()).extracting(FluentBundle::getLocale).containsExactly("lv", "en");
        assertThat(l10n.bundles().get(0).hasMessage("hello")).isFalse();
        verify(loader).load("lv", "main.ftl");
        verify(loader).load("en", "main.ftl");
    }

    /**
     * Verifies that read failures abort loading.
     */
    @Test
    void load_propagatesReadFailures() throws Exception {
        when(loader.load(anyString(), anyString())).thenThrow(new FluentException("disk on fire"));

        assertThatThrownBy(() -> FluentLocalization.load(List.of("en"), List.of("main.ftl"), loader, true))
                .isInstanceOf(FluentException.class)
                .hasMessage("disk on fire");
    }
}
