package com.afterlands.aftercodec.api.format;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Options for {@link ResourceFormat#serialize}.
 *
 * @param strict Fail on values the format cannot express instead of degrading them
 * @param language Language written by single-language formats; null requires the
 *                 resource to hold exactly one language
 */
public record WriteOptions(boolean strict, @Nullable String language) {

    @NotNull
    public static WriteOptions strict(@Nullable String language) {
        return new WriteOptions(true, language);
    }

    @NotNull
    public static WriteOptions permissive(@Nullable String language) {
        return new WriteOptions(false, language);
    }
}
