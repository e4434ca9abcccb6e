package org.ftlbuffer.localization;

import org.ftlbuffer.diagnostics.FluentException;

import java.util.Optional;

/**
 * Supplies the FTL source of a resource for a locale.
 */
@FunctionalInterface
public interface ResourceLoader {

    /**
     * @param locale     The locale code.
     * @param resourceId The resource name, e.g. {@code main.ftl}.
     * @return The FTL source, or empty if the resource does not exist for this locale.
     * @throws FluentException if the resource exists but cannot be read.
     */
    Optional<String> load(String locale, String resourceId) throws FluentException;

    /**
     * Describes where a resource is loaded from, for log messages.
     * @param locale     The locale code.
     * @param resourceId The resource name.
     * @return A human-readable location.
     */
    default String describe(String locale, String resourceId) {
        return locale + "/" + resourceId;
    }
}
