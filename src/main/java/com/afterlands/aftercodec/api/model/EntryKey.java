package com.afterlands.aftercodec.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of an entry inside a Resource: the (key, language) pair.
 *
 * @param key Entry key
 * @param language Language code, as written in the entry
 */
public record EntryKey(@NotNull String key, @NotNull String language) implements Comparable<EntryKey> {

    private static final Comparator<EntryKey> ORDER = Comparator
            .comparing(EntryKey::key)
            .thenComparing(EntryKey::language);

    public EntryKey {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(language, "language cannot be null");
    }

    @NotNull
    public static EntryKey of(@NotNull String key, @NotNull String language) {
        return new EntryKey(key, language);
    }

    /**
     * Orders by key, then language.
     */
    @Override
    public int compareTo(@NotNull EntryKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return key + " [" + language + "]";
    }
}
