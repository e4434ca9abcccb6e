package org.ftlbuffer.localization;

import org.ftlbuffer.diagnostics.ErrorTemplates;
import org.ftlbuffer.diagnostics.FluentException;
import org.ftlbuffer.runtime.BundleOptions;
import org.ftlbuffer.runtime.FluentBundle;
import org.ftlbuffer.runtime.ResolveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Formats messages over an ordered chain of locales, falling back to the next locale when a
 * message is missing. Holds one {@link FluentBundle} per locale.
 */
public class FluentLocalization {

    private static final Logger LOG = LoggerFactory.getLogger(FluentLocalization.class);

    private final List<String> locales;
    private final Map<String, FluentBundle> bundles = new LinkedHashMap<>();

    public FluentLocalization(List<String> locales) {
        this(locales, true);
    }

    /**
     * @param locales      The locale codes in priority order.
     * @param useIsolating Whether the bundles wrap placeables in bidi isolation marks.
     * @throws IllegalArgumentException if {@code locales} is empty.
     */
    public FluentLocalization(List<String> locales, boolean useIsolating) {
        if (locales == null || locales.isEmpty()) {
            throw new IllegalArgumentException("At least one locale is required");
        }
        this.locales = List.copyOf(locales);
        for (String locale : this.locales) {
            bundles.put(locale, new FluentBundle(BundleOptions.of(locale).withUseIsolating(useIsolating)));
        }
    }

    /**
     * Creates a localization and loads every resource for every locale.
     * Resources missing for a locale are skipped.
     *
     * @param locales      The locale codes in priority order.
     * @param resourceIds  The resources to load, e.g. {@code main.ftl}.
     * @param loader       Where the resources come from.
     * @param useIsolating Whether the bundles wrap placeables in bidi isolation marks.
     * @return The loaded localization.
     * @throws FluentException if a resource exists but cannot be read.
     */
    public static FluentLocalization load(List<String> locales, List<String> resourceIds, ResourceLoader loader,
                                          boolean useIsolating) throws FluentException {
        FluentLocalization localization = new FluentLocalization(locales, useIsolating);
        for (String locale : localization.locales) {
            for (String resourceId : resourceIds) {
                Optional<String> source = loader.load(locale, resourceId);
                if (source.isEmpty()) {
                    LOG.debug("Skipping missing resource {} for locale {}", resourceId, locale);
                    continue;
                }
                localization.bundles.get(locale).addResource(source.get(), loader.describe(locale, resourceId));
            }
        }
        return localization;
    }

    public List<String> getLocales() {
        return locales;
    }

    /**
     * @param locale A locale of the chain.
     * @param source The FTL source.
     * @throws IllegalArgumentException if {@code locale} is not part of the chain.
     */
    public void addResource(String locale, String source) {
        FluentBundle bundle = bundles.get(locale);
        if (bundle == null) {
            throw new IllegalArgumentException("Locale '" + locale + "' not in fallback chain " + locales);
        }
        bundle.addResource(source);
    }

    /**
     * Formats a message with the first locale that defines it.
     * @param id   The message id.
     * @param args The arguments, may be {@code null}.
     * @return The text and diagnostics of that locale, or a fallback if no locale has the message.
     */
    public ResolveResult formatValue(String id, Map<String, ?> args) {
        if (id == null || id.isEmpty()) {
            return new ResolveResult("{???}", List.of(ErrorTemplates.invalidMessageId()));
        }
        for (FluentBundle bundle : bundles.values()) {
            if (bundle.hasMessage(id)) {
                return bundle.formatValue(id, args);
            }
        }
        LOG.debug("Message '{}' not found in locales {}", id, locales);
        return new ResolveResult("{" + id + "}", List.of(ErrorTemplates.messageNotFoundInAnyLocale(id)));
    }

    public boolean hasMessage(String id) {
        return bundles.values().stream().anyMatch(b -> b.hasMessage(id));
    }

    /**
     * @return The bundles in priority order.
     */
    public List<FluentBundle> bundles() {
        return new ArrayList<>(bundles.values());
    }
}
