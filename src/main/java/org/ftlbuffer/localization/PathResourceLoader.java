package org.ftlbuffer.localization;

import org.ftlbuffer.diagnostics.FluentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads resources from the file system. The base path contains a {@code {locale}} placeholder,
 * e.g. {@code locales/{locale}}, and the resource id is resolved against it.
 */
public class PathResourceLoader implements ResourceLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PathResourceLoader.class);
    static final String LOCALE_PLACEHOLDER = "{locale}";

    private final String basePathTemplate;

    public PathResourceLoader(String basePathTemplate) {
        this.basePathTemplate = Objects.requireNonNull(basePathTemplate, "basePathTemplate");
    }

    /**
     * @param locale     The locale code substituted for {@code {locale}}.
     * @param resourceId The file name.
     * @return The path of the resource file.
     */
    public Path resolve(String locale, String resourceId) {
        return Path.of(basePathTemplate.replace(LOCALE_PLACEHOLDER, locale)).resolve(resourceId);
    }

    @Override
    public Optional<String> load(String locale, String resourceId) throws FluentException {
        Path path = resolve(locale, resourceId);
        if (!Files.isRegularFile(path)) {
            LOG.debug("Resource {} not found for locale {} at {}", resourceId, locale, path);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FluentException("Failed to read resource " + path, e);
        }
    }

    @Override
    public String describe(String locale, String resourceId) {
        return resolve(locale, resourceId).toString();
    }
}
