package com.afterlands.aftercodec.core.plural;

import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.core.language.LanguageCodes;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link PluralCategoryTable} backed by an immutable map.
 *
 * <p>Lookup order: normalized code, then base language, then the default set.</p>
 */
public final class MapPluralCategoryTable implements PluralCategoryTable {

    private final Map<String, Set<PluralCategory>> categories;
    private final Set<PluralCategory> defaultCategories;

    /**
     * Creates a table.
     *
     * @param categories Language code to required categories (codes are normalized)
     * @param defaultCategories Categories for unknown languages
     */
    public MapPluralCategoryTable(
            @NotNull Map<String, Set<PluralCategory>> categories,
            @NotNull Set<PluralCategory> defaultCategories
    ) {
        Objects.requireNonNull(categories, "categories cannot be null");
        Objects.requireNonNull(defaultCategories, "defaultCategories cannot be null");
        if (defaultCategories.isEmpty()) {
            throw new IllegalArgumentException("defaultCategories cannot be empty");
        }

        Map<String, Set<PluralCategory>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<PluralCategory>> entry : categories.entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw new IllegalArgumentException("No plural categories for language '" + entry.getKey() + "'");
            }
            copy.put(LanguageCodes.normalize(entry.getKey()), immutable(entry.getValue()));
        }
        this.categories = Collections.unmodifiableMap(copy);
        this.defaultCategories = immutable(defaultCategories);
    }

    @Override
    @NotNull
    public Set<PluralCategory> requiredCategories(@NotNull String language) {
        Objects.requireNonNull(language, "language cannot be null");

        Set<PluralCategory> exact = categories.get(LanguageCodes.normalize(language));
        if (exact != null) {
            return exact;
        }
        return categories.getOrDefault(LanguageCodes.baseLanguage(language), defaultCategories);
    }

    /**
     * Returns a table where {@code overrides} replace or add languages.
     *
     * @param overrides Table entries taking precedence
     * @return Combined table
     */
    @NotNull
    public MapPluralCategoryTable overriddenBy(@NotNull MapPluralCategoryTable overrides) {
        Map<String, Set<PluralCategory>> combined = new LinkedHashMap<>(categories);
        combined.putAll(overrides.categories);
        return new MapPluralCategoryTable(combined, overrides.defaultCategories);
    }

    public boolean isKnown(@NotNull String language) {
        return categories.containsKey(LanguageCodes.normalize(language))
                || categories.containsKey(LanguageCodes.baseLanguage(language));
    }

    @NotNull
    public Set<String> languages() {
        return categories.keySet();
    }

    @NotNull
    public Set<PluralCategory> defaultCategories() {
        return defaultCategories;
    }

    private static Set<PluralCategory> immutable(Set<PluralCategory> categories) {
        return Collections.unmodifiableSet(EnumSet.copyOf(categories));
    }
}
