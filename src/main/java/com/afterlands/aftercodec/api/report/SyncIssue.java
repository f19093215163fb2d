package com.afterlands.aftercodec.api.report;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A target entry the sync left untouched, with the reason.
 *
 * @param kind Issue kind
 * @param language Target language
 * @param targetKey Target entry key
 * @param sourceKey Matched source key, if one was found
 * @param candidates Candidate source keys for ambiguous matches
 */
public record SyncIssue(
        @NotNull SyncIssueKind kind,
        @NotNull String language,
        @NotNull String targetKey,
        @Nullable String sourceKey,
        @NotNull List<String> candidates
) {

    public SyncIssue {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(language, "language cannot be null");
        Objects.requireNonNull(targetKey, "targetKey cannot be null");
        candidates = List.copyOf(candidates);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append(' ').append(targetKey).append(" [").append(language).append(']');
        if (sourceKey != null) sb.append(" <- ").append(sourceKey);
        if (!candidates.isEmpty()) sb.append(" candidates=").append(candidates);
        return sb.toString();
    }
}
