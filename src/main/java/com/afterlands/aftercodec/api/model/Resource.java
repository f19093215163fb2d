package com.afterlands.aftercodec.api.model;

import com.afterlands.aftercodec.api.error.InvalidResourceException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical in-memory representation of a localization file.
 *
 * <p>A Resource is an immutable snapshot: ordered metadata plus an ordered list of
 * entries. Every operation that "changes" a Resource returns a new instance, so
 * callers can compute a result fully before writing anything to disk.</p>
 *
 * <h3>Invariant:</h3>
 * <p>Within one Resource a (key, language) pair identifies at most one entry.
 * The constructor rejects duplicates with an {@link InvalidResourceException}
 * naming every duplicated pair.</p>
 *
 * <h3>Well-known metadata keys:</h3>
 * <ul>
 *     <li>{@value #SOURCE_LANGUAGE} - language used as reference</li>
 *     <li>{@value #FORMAT_VERSION} - version declared by the source file</li>
 *     <li>{@value #DOMAIN} - logical domain / table name</li>
 * </ul>
 *
 * @param metadata Ordered metadata
 * @param entries Ordered entries
 * @author AfterLands Team
 * @since 1.0.0
 */
public record Resource(
        @NotNull Map<String, String> metadata,
        @NotNull List<Entry> entries
) {

    public static final String SOURCE_LANGUAGE = "source_language";
    public static final String FORMAT_VERSION = "format_version";
    public static final String DOMAIN = "domain";

    /**
     * Compact constructor with validation.
     */
    public Resource {
        Objects.requireNonNull(metadata, "metadata cannot be null");
        Objects.requireNonNull(entries, "entries cannot be null");

        Set<EntryKey> seen = new LinkedHashSet<>();
        Set<EntryKey> duplicates = new LinkedHashSet<>();
        for (Entry entry : entries) {
            Objects.requireNonNull(entry, "entry cannot be null");
            if (!seen.add(entry.id())) {
                duplicates.add(entry.id());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new InvalidResourceException("Duplicate (key, language) pairs: " + duplicates);
        }

        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        entries = List.copyOf(entries);
    }

    @NotNull
    public static Resource empty() {
        return new Resource(Map.of(), List.of());
    }

    @NotNull
    public static Resource of(@NotNull List<Entry> entries) {
        return new Resource(Map.of(), entries);
    }

    /**
     * Finds the entry for a key in a language (exact language match).
     *
     * @param key Entry key
     * @param language Language code
     * @return Entry if present
     */
    @NotNull
    public Optional<Entry> find(@NotNull String key, @NotNull String language) {
        for (Entry entry : entries) {
            if (entry.key().equals(key) && entry.language().equals(language)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Index of an entry, or -1.
     */
    public int indexOf(@NotNull EntryKey id) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Languages in first-seen order.
     *
     * @return Ordered set of language codes
     */
    @NotNull
    public Set<String> languages() {
        Set<String> languages = new LinkedHashSet<>();
        for (Entry entry : entries) {
            languages.add(entry.language());
        }
        return languages;
    }

    /**
     * Keys in first-seen order.
     *
     * @return Ordered set of keys
     */
    @NotNull
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Entry entry : entries) {
            keys.add(entry.key());
        }
        return keys;
    }

    @NotNull
    public Set<String> sortedKeys() {
        return new TreeSet<>(keys());
    }

    /**
     * Entries in a single language, in resource order.
     *
     * @param language Language code (exact)
     * @return Matching entries
     */
    @NotNull
    public List<Entry> entriesFor(@NotNull String language) {
        List<Entry> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.language().equals(language)) {
                result.add(entry);
            }
        }
        return result;
    }

    @Nullable
    public String metadata(@NotNull String key) {
        return metadata.get(key);
    }

    @NotNull
    public Optional<String> sourceLanguage() {
        return Optional.ofNullable(metadata.get(SOURCE_LANGUAGE));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @NotNull
    public Resource withEntries(@NotNull List<Entry> newEntries) {
        return new Resource(metadata, newEntries);
    }

    @NotNull
    public Resource withMetadata(@NotNull Map<String, String> newMetadata) {
        return new Resource(newMetadata, entries);
    }

    /**
     * Returns a copy with one metadata key set.
     *
     * @param key Metadata key
     * @param value Metadata value
     * @return New Resource instance
     */
    @NotNull
    public Resource withMetadata(@NotNull String key, @NotNull String value) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Resource(copy, entries);
    }

    /**
     * Restricts the resource to one language, keeping metadata.
     *
     * @param language Language to keep
     * @return New Resource instance
     */
    @NotNull
    public Resource onlyLanguage(@NotNull String language) {
        return new Resource(metadata, entriesFor(language));
    }

    @Override
    public String toString() {
        return "Resource[entries=" + entries.size() + ", languages=" + languages() + "]";
    }
}
