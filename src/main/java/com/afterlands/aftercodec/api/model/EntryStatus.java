package com.afterlands.aftercodec.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Translation status of a single entry.
 *
 * <p>Status never takes part in merge identity. It does affect completion
 * accounting: {@link #DO_NOT_TRANSLATE} entries are left out of the percentage.</p>
 */
public enum EntryStatus {
    /**
     * Not translated yet.
     */
    NEW,

    /**
     * Translated and reviewed.
     */
    TRANSLATED,

    /**
     * Modified, waiting for review.
     */
    NEEDS_REVIEW,

    /**
     * Source changed after the translation was made.
     */
    STALE,

    /**
     * Intentionally untranslated (brand names, identifiers).
     */
    DO_NOT_TRANSLATE;

    /**
     * Returns the snake_case key used in reports and xcstrings states.
     *
     * @return Lowercase key (e.g., "needs_review")
     */
    @NotNull
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether this entry counts towards the completion denominator.
     *
     * @return false only for DO_NOT_TRANSLATE
     */
    public boolean countsTowardsCompletion() {
        return this != DO_NOT_TRANSLATE;
    }

    /**
     * Parses a status accepting snake_case, kebab-case or spaced text.
     *
     * @param text Status text (e.g., "needs-review", "Do Not Translate")
     * @return Matching status, or null if unknown
     */
    @Nullable
    public static EntryStatus fromKey(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return null;
        }

        String normalized = text.trim()
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
