package com.afterlands.aftercodec.api.report;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Diff of a single language.
 *
 * @param language Normalized language code
 * @param added Keys only in the target, sorted
 * @param removed Keys only in the source, sorted
 * @param changed Keys in both with a different value or status, sorted by key
 * @param unchanged Number of identical keys
 */
public record LanguageDiff(
        @NotNull String language,
        @NotNull List<String> added,
        @NotNull List<String> removed,
        @NotNull List<ChangedEntry> changed,
        int unchanged
) {

    public LanguageDiff {
        Objects.requireNonNull(language, "language cannot be null");
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        changed = List.copyOf(changed);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !changed.isEmpty();
    }
}
