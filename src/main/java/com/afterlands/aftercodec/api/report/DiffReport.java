package com.afterlands.aftercodec.api.report;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structural diff between two resources.
 *
 * <p>Languages appear sorted by normalized code. The relation is anti-symmetric:
 * the keys added in {@code diff(a, b)} are exactly the keys removed in
 * {@code diff(b, a)}.</p>
 *
 * @param languages Per-language diffs, in language order
 * @param languageFilter Language the diff was restricted to, if any
 */
public record DiffReport(
        @NotNull Map<String, LanguageDiff> languages,
        @Nullable String languageFilter
) {

    public DiffReport {
        Objects.requireNonNull(languages, "languages cannot be null");
        languages = Collections.unmodifiableMap(new LinkedHashMap<>(languages));
    }

    @Nullable
    public LanguageDiff language(@NotNull String language) {
        return languages.get(language);
    }

    /**
     * Totals across languages.
     *
     * @return Summary
     */
    @NotNull
    public DiffSummary summary() {
        int added = 0;
        int removed = 0;
        int changed = 0;
        int unchanged = 0;
        for (LanguageDiff diff : languages.values()) {
            added += diff.added().size();
            removed += diff.removed().size();
            changed += diff.changed().size();
            unchanged += diff.unchanged();
        }
        return new DiffSummary(languages.size(), added, removed, changed, unchanged);
    }

    public boolean hasChanges() {
        return languages.values().stream().anyMatch(LanguageDiff::hasChanges);
    }
}
