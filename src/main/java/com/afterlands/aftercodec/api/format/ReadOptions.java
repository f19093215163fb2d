package com.afterlands.aftercodec.api.format;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Options for {@link ResourceFormat#parse}.
 *
 * @param strict Fail on recoverable anomalies instead of warning
 * @param languageHint Language for single-language formats that do not declare one
 */
public record ReadOptions(boolean strict, @Nullable String languageHint) {

    @NotNull
    public static ReadOptions strict(@Nullable String languageHint) {
        return new ReadOptions(true, languageHint);
    }

    @NotNull
    public static ReadOptions permissive(@Nullable String languageHint) {
        return new ReadOptions(false, languageHint);
    }

    @NotNull
    public ReadOptions withLanguageHint(@Nullable String language) {
        return new ReadOptions(strict, language);
    }
}
