package com.afterlands.aftercodec.core.plural;

import com.afterlands.aftercodec.api.model.PluralCategory;
import org.jetbrains.annotations.NotNull;

import java.util.Set;

/**
 * Lookup of the CLDR plural categories a language requires.
 *
 * <p>Plural rules are data, not code: the validator only asks this table and never
 * branches on a language itself. The bundled implementation is loaded from
 * {@code plural-categories.yml}; tests and callers can supply their own.</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * PluralCategoryTable table = PluralCategoryTables.bundled();
 * table.requiredCategories("pl");    // [ONE, FEW, MANY, OTHER]
 * table.requiredCategories("pt_BR"); // base language "pt" -> [ONE, OTHER]
 * }</pre>
 */
@FunctionalInterface
public interface PluralCategoryTable {

    /**
     * Categories a complete plural entry in this language must populate.
     *
     * @param language Language code in any spelling
     * @return Required categories, never empty
     */
    @NotNull
    Set<PluralCategory> requiredCategories(@NotNull String language);
}
