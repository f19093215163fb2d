package com.afterlands.aftercodec.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The translated value of an entry.
 *
 * <p>Either a {@link Singular} string or a {@link Plural} mapping of CLDR categories
 * to strings. A Plural carries exactly the categories the source format supplied;
 * an absent category is meaningful and is never filled with an empty string.</p>
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * Translation hello = Translation.singular("Hello");
 * Translation items = Translation.plural(Map.of(
 *     PluralCategory.ONE, "1 item",
 *     PluralCategory.OTHER, "%d items"
 * ));
 * }</pre>
 */
public interface Translation {

    /**
     * Whether this value has plural forms.
     *
     * @return true for {@link Plural}
     */
    boolean isPlural();

    /**
     * Text used when a single string is needed (diff rendering, fallback matching).
     *
     * <p>Singular returns its text; Plural returns the OTHER form, or the last
     * populated category if OTHER is absent.</p>
     *
     * @return Representative text
     */
    @NotNull
    String primaryText();

    @NotNull
    static Singular singular(@NotNull String text) {
        return new Singular(text);
    }

    @NotNull
    static Plural plural(@NotNull Map<PluralCategory, String> forms) {
        return new Plural(forms);
    }

    /**
     * A single translation without plural forms.
     *
     * @param text Translated text (may be empty for untranslated entries)
     */
    record Singular(@NotNull String text) implements Translation {

        public Singular {
            Objects.requireNonNull(text, "text cannot be null");
        }

        @Override
        public boolean isPlural() {
            return false;
        }

        @Override
        @NotNull
        public String primaryText() {
            return text;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * A translation with CLDR plural forms.
     *
     * @param forms Category to text, in category order (never empty)
     */
    record Plural(@NotNull Map<PluralCategory, String> forms) implements Translation {

        /**
         * Compact constructor with validation.
         *
         * <p>Copies into an unmodifiable {@link EnumMap} so no instance shares its
         * mapping with another Resource.</p>
         */
        public Plural {
            Objects.requireNonNull(forms, "forms cannot be null");
            if (forms.isEmpty()) {
                throw new IllegalArgumentException("forms must contain at least one category");
            }

            EnumMap<PluralCategory, String> copy = new EnumMap<>(PluralCategory.class);
            for (Map.Entry<PluralCategory, String> form : forms.entrySet()) {
                copy.put(
                        Objects.requireNonNull(form.getKey(), "plural category cannot be null"),
                        Objects.requireNonNull(form.getValue(), "plural text cannot be null")
                );
            }
            forms = Collections.unmodifiableMap(copy);
        }

        @Override
        public boolean isPlural() {
            return true;
        }

        @Override
        @NotNull
        public String primaryText() {
            String other = forms.get(PluralCategory.OTHER);
            if (other != null) {
                return other;
            }
            String last = "";
            for (String text : forms.values()) {
                last = text;
            }
            return last;
        }

        /**
         * Categories populated by the source.
         *
         * @return Populated categories
         */
        @NotNull
        public Set<PluralCategory> categories() {
            return forms.keySet();
        }

        @Nullable
        public String get(@NotNull PluralCategory category) {
            return forms.get(category);
        }

        /**
         * Returns a copy with one category replaced or added.
         *
         * @param category Category to set
         * @param text Text for the category
         * @return New Plural instance
         */
        @NotNull
        public Plural with(@NotNull PluralCategory category, @NotNull String text) {
            EnumMap<PluralCategory, String> copy = new EnumMap<>(forms);
            copy.put(category, text);
            return new Plural(copy);
        }

        @Override
        public String toString() {
            return forms.entrySet().stream()
                    .map(e -> e.getKey().getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(" | "));
        }
    }
}
