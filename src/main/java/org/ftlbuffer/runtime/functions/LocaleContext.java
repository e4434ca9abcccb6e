package org.ftlbuffer.runtime.functions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Maps locale codes as used in configuration and FTL ({@code en-US}, {@code de_DE}) to
 * {@link Locale} instances.
 *
 * @param localeCode The code as given.
 * @param locale     The resolved locale; {@code en-US} if the code could not be interpreted.
 */
public record LocaleContext(String localeCode, Locale locale) {

    private static final Logger LOG = LoggerFactory.getLogger(LocaleContext.class);

    /** The locale used when a code cannot be interpreted. */
    public static final Locale FALLBACK_LOCALE = Locale.US;

    /**
     * @param localeCode A BCP 47 tag or an underscore-separated code.
     * @return The context for that code.
     */
    public static LocaleContext of(String localeCode) {
        return new LocaleContext(localeCode, toLocale(localeCode));
    }

    /**
     * @param localeCode A BCP 47 tag or an underscore-separated code, may be {@code null}.
     * @return The matching locale, or {@link #FALLBACK_LOCALE} if the code has no valid language.
     */
    public static Locale toLocale(String localeCode) {
        if (localeCode == null || localeCode.isBlank()) {
            LOG.debug("Falling back to {} for empty locale code", FALLBACK_LOCALE.toLanguageTag());
            return FALLBACK_LOCALE;
        }
        Locale locale = Locale.forLanguageTag(localeCode.trim().replace('_', '-'));
        if (locale.getLanguage().isEmpty()) {
            LOG.debug("Falling back to {} for unknown locale: {}", FALLBACK_LOCALE.toLanguageTag(), localeCode);
            return FALLBACK_LOCALE;
        }
        return locale;
    }

    /**
     * @return The lower-case ISO language code, e.g. {@code de}.
     */
    public String language() {
        return locale.getLanguage();
    }
}
