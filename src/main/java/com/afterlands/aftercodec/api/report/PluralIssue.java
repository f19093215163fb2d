package com.afterlands.aftercodec.api.report;

import com.afterlands.aftercodec.api.model.PluralCategory;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Plural entry missing categories required by its language.
 *
 * @param key Entry key
 * @param language Entry language
 * @param missing Required categories not populated
 * @param present Populated categories
 */
public record PluralIssue(
        @NotNull String key,
        @NotNull String language,
        @NotNull Set<PluralCategory> missing,
        @NotNull Set<PluralCategory> present
) {

    public PluralIssue {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(language, "language cannot be null");
        missing = Collections.unmodifiableSet(copy(missing));
        present = Collections.unmodifiableSet(copy(present));
    }

    private static EnumSet<PluralCategory> copy(Set<PluralCategory> categories) {
        EnumSet<PluralCategory> set = EnumSet.noneOf(PluralCategory.class);
        set.addAll(categories);
        return set;
    }
}
