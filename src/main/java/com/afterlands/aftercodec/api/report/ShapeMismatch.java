package com.afterlands.aftercodec.api.report;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A key that is Singular in some languages and Plural in others.
 *
 * @param key Entry key
 * @param singularLanguages Languages holding a Singular value
 * @param pluralLanguages Languages holding a Plural value
 */
public record ShapeMismatch(
        @NotNull String key,
        @NotNull List<String> singularLanguages,
        @NotNull List<String> pluralLanguages
) {

    public ShapeMismatch {
        Objects.requireNonNull(key, "key cannot be null");
        singularLanguages = List.copyOf(singularLanguages);
        pluralLanguages = List.copyOf(pluralLanguages);
    }
}
