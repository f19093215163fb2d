package com.afterlands.aftercodec.api.report;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a sync, per target language.
 *
 * @param matchLanguage Language used for fallback value matching
 * @param languages Per-language counters, in target language order
 * @param issues Every entry left untouched, in target order
 */
public record SyncReport(
        @NotNull String matchLanguage,
        @NotNull Map<String, LanguageSyncSummary> languages,
        @NotNull List<SyncIssue> issues
) {

    public SyncReport {
        Objects.requireNonNull(matchLanguage, "matchLanguage cannot be null");
        languages = Collections.unmodifiableMap(new LinkedHashMap<>(languages));
        issues = List.copyOf(issues);
    }

    public int totalMatched() {
        return languages.values().stream().mapToInt(LanguageSyncSummary::matched).sum();
    }

    public int totalUpdated() {
        return languages.values().stream().mapToInt(LanguageSyncSummary::updated).sum();
    }

    public int totalUnchanged() {
        return languages.values().stream().mapToInt(LanguageSyncSummary::unchanged).sum();
    }

    public int totalFallbackMatches() {
        return languages.values().stream().mapToInt(LanguageSyncSummary::fallbackMatches).sum();
    }

    public long count(@NotNull SyncIssueKind kind) {
        return issues.stream().filter(issue -> issue.kind() == kind).count();
    }
}
