package com.afterlands.aftercodec.core.edit;

import com.afterlands.aftercodec.api.error.InvalidResourceException;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryKey;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Single-entry edits on a Resource.
 *
 * <p>Every operation returns a new Resource. A replaced entry keeps its index,
 * a new entry is appended.</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * ResourceEditor editor = new ResourceEditor(logger);
 * Resource updated = editor.set(resource, "welcome", "fr", Translation.singular("Bienvenue"), null);
 * Resource trimmed = editor.remove(updated, "legacy_key", null);
 * }</pre>
 */
public class ResourceEditor {

    private final Logger logger;

    public ResourceEditor(@NotNull Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
    }

    /**
     * Sets the value of (key, language), inserting the entry if absent.
     *
     * <p>An existing entry keeps its comment and custom data; its status becomes
     * {@code status} when given, otherwise TRANSLATED (or NEW for an empty value).</p>
     *
     * @param resource Resource to edit
     * @param key Entry key
     * @param language Language code
     * @param value New value
     * @param status Status override, or null
     * @return Edited Resource
     */
    @NotNull
    public Resource set(
            @NotNull Resource resource,
            @NotNull String key,
            @NotNull String language,
            @NotNull Translation value,
            @Nullable EntryStatus status
    ) {
        EntryStatus effective = status != null ? status : defaultStatus(value);
        List<Entry> entries = new ArrayList<>(resource.entries());
        int index = resource.indexOf(EntryKey.of(key, language));

        if (index >= 0) {
            entries.set(index, entries.get(index).withValue(value).withStatus(effective));
            logger.fine("[ResourceEditor] Updated " + key + " [" + language + "]");
        } else {
            entries.add(Entry.of(key, language, value).withStatus(effective));
            logger.fine("[ResourceEditor] Added " + key + " [" + language + "]");
        }
        return resource.withEntries(entries);
    }

    /**
     * Replaces or appends a whole entry.
     *
     * @param resource Resource to edit
     * @param entry Entry to store
     * @return Edited Resource
     */
    @NotNull
    public Resource put(@NotNull Resource resource, @NotNull Entry entry) {
        List<Entry> entries = new ArrayList<>(resource.entries());
        int index = resource.indexOf(entry.id());
        if (index >= 0) {
            entries.set(index, entry);
        } else {
            entries.add(entry);
        }
        return resource.withEntries(entries);
    }

    /**
     * Removes a key, in one language or in all of them.
     *
     * @param resource Resource to edit
     * @param key Entry key
     * @param language Language to remove, or null for every language
     * @return Edited Resource (same content if nothing matched)
     */
    @NotNull
    public Resource remove(@NotNull Resource resource, @NotNull String key, @Nullable String language) {
        List<Entry> entries = new ArrayList<>(resource.entries());
        boolean removed = entries.removeIf(entry -> entry.key().equals(key)
                && (language == null || entry.language().equals(language)));

        if (!removed) {
            logger.fine("[ResourceEditor] Nothing to remove for " + key
                    + (language != null ? " [" + language + "]" : ""));
            return resource;
        }
        return resource.withEntries(entries);
    }

    /**
     * Copies every language of one key to another key.
     *
     * @param resource Resource to edit
     * @param fromKey Existing key
     * @param toKey Destination key
     * @param overwrite Replace destination entries that already exist
     * @return Edited Resource
     * @throws InvalidResourceException if {@code fromKey} does not exist, or a destination
     *         entry exists and {@code overwrite} is false
     */
    @NotNull
    public Resource copy(
            @NotNull Resource resource,
            @NotNull String fromKey,
            @NotNull String toKey,
            boolean overwrite
    ) {
        List<Entry> sources = new ArrayList<>();
        for (Entry entry : resource.entries()) {
            if (entry.key().equals(fromKey)) {
                sources.add(entry);
            }
        }
        if (sources.isEmpty()) {
            throw new InvalidResourceException("Cannot copy '" + fromKey + "': key not found");
        }

        Resource result = resource;
        for (Entry source : sources) {
            boolean exists = result.indexOf(EntryKey.of(toKey, source.language())) >= 0;
            if (exists && !overwrite) {
                throw new InvalidResourceException("Cannot copy '" + fromKey + "' to '" + toKey
                        + "': " + source.language() + " already exists");
            }
            Entry copy = new Entry(toKey, source.language(), source.value(), source.status(),
                    source.comment(), source.custom());
            result = put(result, copy);
        }

        logger.fine("[ResourceEditor] Copied " + fromKey + " -> " + toKey + " (" + sources.size() + " languages)");
        return result;
    }

    @NotNull
    private static EntryStatus defaultStatus(@NotNull Translation value) {
        if (value instanceof Translation.Singular singular && singular.text().isEmpty()) {
            return EntryStatus.NEW;
        }
        return EntryStatus.TRANSLATED;
    }
}
