package org.ftlbuffer.runtime;

import com.typesafe.config.Config;

import java.util.Objects;

/**
 * Settings of a {@link FluentBundle}.
 *
 * @param locale       The locale code, e.g. {@code en-US}.
 * @param useIsolating Whether placeables are wrapped in Unicode bidi isolation marks.
 * @param cacheEnabled Whether formatting results are cached.
 * @param cacheSize    The maximum number of cached results, used only when caching is enabled.
 */
public record BundleOptions(String locale, boolean useIsolating, boolean cacheEnabled, int cacheSize) {

    public static final int DEFAULT_CACHE_SIZE = 1000;

    private static final String BUNDLE_PATH = "ftlbuffer.bundle";

    public BundleOptions {
        Objects.requireNonNull(locale, "locale");
        if (locale.isBlank()) {
            throw new IllegalArgumentException("Locale must not be blank");
        }
        if (cacheEnabled && cacheSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive, got " + cacheSize);
        }
    }

    /**
     * @param locale The locale code.
     * @return Options with isolation on and caching off.
     */
    public static BundleOptions of(String locale) {
        return new BundleOptions(locale, true, false, DEFAULT_CACHE_SIZE);
    }

    /**
     * Reads the {@code ftlbuffer.bundle} section of a configuration:
     * <pre>
     * ftlbuffer.bundle {
     *   locale = "en-US"
     *   use-isolating = true
     *   cache { enabled = false, size = 1000 }
     * }
     * </pre>
     *
     * @param config The resolved configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a value is missing or has the wrong type.
     */
    public static BundleOptions fromConfig(Config config) {
        Config bundle = config.getConfig(BUNDLE_PATH);
        return new BundleOptions(
                bundle.getString("locale"),
                bundle.getBoolean("use-isolating"),
                bundle.getBoolean("cache.enabled"),
                bundle.getInt("cache.size"));
    }

    public BundleOptions withLocale(String newLocale) {
        return new BundleOptions(newLocale, useIsolating, cacheEnabled, cacheSize);
    }

    public BundleOptions withUseIsolating(boolean isolating) {
        return new BundleOptions(locale, isolating, cacheEnabled, cacheSize);
    }
}
