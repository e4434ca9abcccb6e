package org.ftlbuffer.runtime.plural;

/**
 * Maps a number to the plural category keyword of a locale.
 */
@FunctionalInterface
public interface PluralRuleSelector {

    /**
     * @param number     The selector value.
     * @param localeCode The locale, e.g. {@code en-US} or {@code ru_RU}.
     * @return The category keyword: {@code zero}, {@code one}, {@code two}, {@code few}, {@code many} or {@code other}.
     */
    String categoryFor(Number number, String localeCode);
}
