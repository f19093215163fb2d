package com.afterlands.aftercodec.api.report;

import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.Translation;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A key present on both sides of a diff whose value or status differs.
 *
 * @param key Entry key
 * @param before Value in the source resource
 * @param after Value in the target resource
 * @param beforeStatus Status in the source resource
 * @param afterStatus Status in the target resource
 */
public record ChangedEntry(
        @NotNull String key,
        @NotNull Translation before,
        @NotNull Translation after,
        @NotNull EntryStatus beforeStatus,
        @NotNull EntryStatus afterStatus
) {

    public ChangedEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(before, "before cannot be null");
        Objects.requireNonNull(after, "after cannot be null");
        Objects.requireNonNull(beforeStatus, "beforeStatus cannot be null");
        Objects.requireNonNull(afterStatus, "afterStatus cannot be null");
    }

    public boolean valueChanged() {
        return !before.equals(after);
    }

    public boolean statusChanged() {
        return beforeStatus != afterStatus;
    }
}
