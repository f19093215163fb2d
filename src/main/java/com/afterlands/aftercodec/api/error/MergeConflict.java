package com.afterlands.aftercodec.api.error;

import com.afterlands.aftercodec.api.model.Translation;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * One (key, language) group whose inputs disagree.
 *
 * @param key Entry key
 * @param language Language code
 * @param values Distinct values in input order
 */
public record MergeConflict(
        @NotNull String key,
        @NotNull String language,
        @NotNull List<Translation> values
) {

    public MergeConflict {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(language, "language cannot be null");
        values = List.copyOf(Objects.requireNonNull(values, "values cannot be null"));
    }

    @Override
    public String toString() {
        return key + " [" + language + "]: " + values;
    }
}
