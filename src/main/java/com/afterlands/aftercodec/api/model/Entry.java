package com.afterlands.aftercodec.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single translatable unit.
 *
 * <p>Immutable value object representing the value of one key in one language.
 * "Edits" produce a new Entry through the {@code with*} methods.</p>
 *
 * @param key Stable identifier (e.g., "welcome_title")
 * @param language Language code (e.g., "en", "pt-BR")
 * @param value Singular or plural translation
 * @param status Translation status
 * @param comment Optional translator comment
 * @param custom Format-specific extension data, in insertion order
 */
public record Entry(
        @NotNull String key,
        @NotNull String language,
        @NotNull Translation value,
        @NotNull EntryStatus status,
        @Nullable String comment,
        @NotNull Map<String, String> custom
) {

    /**
     * Compact constructor with validation.
     */
    public Entry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(language, "language cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(custom, "custom cannot be null");

        if (key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be empty");
        }
        if (language.isBlank()) {
            throw new IllegalArgumentException("language cannot be empty");
        }

        custom = Collections.unmodifiableMap(new LinkedHashMap<>(custom));
    }

    /**
     * Creates a translated singular entry.
     *
     * @param key Key
     * @param language Language code
     * @param text Translation text
     * @return Entry instance
     */
    @NotNull
    public static Entry of(@NotNull String key, @NotNull String language, @NotNull String text) {
        return new Entry(key, language, Translation.singular(text), EntryStatus.TRANSLATED, null, Map.of());
    }

    /**
     * Creates a translated entry with an arbitrary value.
     *
     * @param key Key
     * @param language Language code
     * @param value Translation value
     * @return Entry instance
     */
    @NotNull
    public static Entry of(@NotNull String key, @NotNull String language, @NotNull Translation value) {
        return new Entry(key, language, value, EntryStatus.TRANSLATED, null, Map.of());
    }

    @NotNull
    public EntryKey id() {
        return new EntryKey(key, language);
    }

    @NotNull
    public Entry withValue(@NotNull Translation newValue) {
        return new Entry(key, language, newValue, status, comment, custom);
    }

    @NotNull
    public Entry withStatus(@NotNull EntryStatus newStatus) {
        return new Entry(key, language, value, newStatus, comment, custom);
    }

    @NotNull
    public Entry withComment(@Nullable String newComment) {
        return new Entry(key, language, value, status, newComment, custom);
    }

    @NotNull
    public Entry withLanguage(@NotNull String newLanguage) {
        return new Entry(key, newLanguage, value, status, comment, custom);
    }

    @NotNull
    public Entry withCustom(@NotNull Map<String, String> newCustom) {
        return new Entry(key, language, value, status, comment, newCustom);
    }

    @Override
    public String toString() {
        return key + " [" + language + "] = \"" + value + "\" (" + status.getKey() + ")";
    }
}
