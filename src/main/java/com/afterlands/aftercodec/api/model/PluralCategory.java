package com.afterlands.aftercodec.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * CLDR plural categories.
 *
 * <p>These tags are what a {@link Translation.Plural} is keyed by. Declaration order
 * is the canonical output order used by every format writer.</p>
 *
 * <h3>Category Usage by Language:</h3>
 * <pre>
 * English:    ONE (1), OTHER (0, 2+)
 * Polish:     ONE (1), FEW (2-4), MANY (5+), OTHER (fractions)
 * Arabic:     ZERO, ONE, TWO, FEW, MANY, OTHER
 * Japanese:   OTHER
 * </pre>
 *
 * @see <a href="https://cldr.unicode.org/index/cldr-spec/plural-rules">CLDR Plural Rules</a>
 */
public enum PluralCategory {

    ZERO,
    ONE,
    TWO,
    FEW,
    MANY,

    /**
     * Fallback category for counts not covered by the others.
     */
    OTHER;

    /**
     * Returns the lowercase key representation for this category.
     *
     * <p>Used in YAML files, Android {@code quantity} attributes and xcstrings variations.</p>
     *
     * @return Lowercase category name (e.g., "zero", "one", "other")
     */
    @NotNull
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a plural category from its string key.
     *
     * <p>Case-insensitive parsing. Returns null if key is invalid.</p>
     *
     * @param key Category key (e.g., "one", "FEW", "Other")
     * @return Corresponding PluralCategory, or null if not found
     */
    @Nullable
    public static PluralCategory fromKey(@Nullable String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }

        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isOther() {
        return this == OTHER;
    }
}
