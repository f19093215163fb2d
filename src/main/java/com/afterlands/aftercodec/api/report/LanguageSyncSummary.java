package com.afterlands.aftercodec.api.report;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Sync counters of a single target language.
 *
 * @param language Target language
 * @param matched Entries matched by key or fallback
 * @param updated Matched entries whose value changed
 * @param unchanged Matched entries that already had the source value
 * @param fallbackMatches Matches found by the fallback phase
 * @param unmatched Keys with no match
 * @param ambiguous Keys with several fallback candidates
 * @param missingLanguage Keys whose match lacks the target language
 * @param typeMismatch Keys whose match has another shape
 */
public record LanguageSyncSummary(
        @NotNull String language,
        int matched,
        int updated,
        int unchanged,
        int fallbackMatches,
        @NotNull List<String> unmatched,
        @NotNull List<String> ambiguous,
        @NotNull List<String> missingLanguage,
        @NotNull List<String> typeMismatch
) {

    public LanguageSyncSummary {
        Objects.requireNonNull(language, "language cannot be null");
        unmatched = List.copyOf(unmatched);
        ambiguous = List.copyOf(ambiguous);
        missingLanguage = List.copyOf(missingLanguage);
        typeMismatch = List.copyOf(typeMismatch);
    }
}
