package org.ftlbuffer.runtime.plural;

import java.util.Locale;

/**
 * The six CLDR plural categories. Variant keys in FTL use the lower-case keyword.
 */
public enum PluralCategory {
    ZERO,
    ONE,
    TWO,
    FEW,
    MANY,
    OTHER;

    /**
     * @return The keyword as written in a variant key, e.g. {@code few}.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
