package com.afterlands.aftercodec.core.stats;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Completion figures for a whole Resource, one {@link LanguageStats} per language
 * in sorted language order.
 *
 * @param uniqueKeys Distinct keys across all languages
 * @param languages Per-language figures
 */
public record ResourceStats(int uniqueKeys, @NotNull List<LanguageStats> languages) {

    public ResourceStats {
        Objects.requireNonNull(languages, "languages cannot be null");
        languages = List.copyOf(languages);
    }

    @NotNull
    public Optional<LanguageStats> language(@NotNull String language) {
        return languages.stream().filter(s -> s.language().equals(language)).findFirst();
    }

    public int totalEntries() {
        return languages.stream().mapToInt(LanguageStats::total).sum();
    }
}
