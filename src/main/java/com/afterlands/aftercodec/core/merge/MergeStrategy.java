package com.afterlands.aftercodec.core.merge;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * How the merge engine resolves a (key, language) present in several inputs
 * with different values.
 *
 * <h3>Available Strategies:</h3>
 * <ul>
 *     <li>{@link #FIRST} - earliest input wins</li>
 *     <li>{@link #LAST} - latest input wins (default)</li>
 *     <li>{@link #ERROR} - abort with every conflict listed</li>
 * </ul>
 */
public enum MergeStrategy {
    FIRST,
    LAST,
    ERROR;

    /**
     * Parses a strategy name, case-insensitive.
     *
     * @param name Strategy name (e.g., "last")
     * @return Strategy, or null if unknown
     */
    @Nullable
    public static MergeStrategy fromKey(@Nullable String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @NotNull
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
