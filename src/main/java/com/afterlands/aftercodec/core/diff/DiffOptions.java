package com.afterlands.aftercodec.core.diff;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Options for {@link DiffEngine}.
 *
 * @param languageFilter Restrict the diff to one language (any spelling), or null for all
 */
public record DiffOptions(@Nullable String languageFilter) {

    @NotNull
    public static DiffOptions defaults() {
        return new DiffOptions(null);
    }

    @NotNull
    public static DiffOptions language(@NotNull String language) {
        return new DiffOptions(language);
    }
}
