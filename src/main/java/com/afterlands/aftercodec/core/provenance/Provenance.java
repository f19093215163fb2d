package com.afterlands.aftercodec.core.provenance;

import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Where a value or a resource came from.
 *
 * <p>Stored inside existing maps under reserved keys (prefix {@value #PREFIX}):
 * entry {@code custom} for entries, {@code metadata} for resources. Nothing else in
 * the model changes shape, so formats that ignore these keys keep working.</p>
 *
 * <p>Applying a record sets every non-null field and removes the keys of null fields.</p>
 *
 * @param sourcePath File the data was read from
 * @param sourceFormat Format tag of that file
 * @param sourceLanguage Language the value was taken from
 * @param matchStrategy How a sync matched the value ("exact_key" or "fallback_translation")
 * @param sourceKey Source key the value was copied from
 */
public record Provenance(
        @Nullable String sourcePath,
        @Nullable String sourceFormat,
        @Nullable String sourceLanguage,
        @Nullable String matchStrategy,
        @Nullable String sourceKey
) {

    public static final String PREFIX = "aftercodec.provenance.";
    public static final String SOURCE_PATH = PREFIX + "source_path";
    public static final String SOURCE_FORMAT = PREFIX + "source_format";
    public static final String SOURCE_LANGUAGE = PREFIX + "source_language";
    public static final String MATCH_STRATEGY = PREFIX + "match_strategy";
    public static final String SOURCE_KEY = PREFIX + "source_key";

    /**
     * Provenance of a value copied by sync.
     */
    @NotNull
    public static Provenance ofMatch(@NotNull String matchStrategy, @NotNull String sourceKey, @NotNull String sourceLanguage) {
        return new Provenance(null, null, sourceLanguage, matchStrategy, sourceKey);
    }

    /**
     * Provenance of a resource read from a file.
     */
    @NotNull
    public static Provenance ofFile(@NotNull String sourcePath, @NotNull String sourceFormat) {
        return new Provenance(sourcePath, sourceFormat, null, null, null);
    }

    public boolean isEmpty() {
        return sourcePath == null && sourceFormat == null && sourceLanguage == null
                && matchStrategy == null && sourceKey == null;
    }

    @NotNull
    public Entry applyTo(@NotNull Entry entry) {
        return entry.withCustom(applyTo(entry.custom()));
    }

    @NotNull
    public Resource applyTo(@NotNull Resource resource) {
        return resource.withMetadata(applyTo(resource.metadata()));
    }

    @NotNull
    public static Optional<Provenance> of(@NotNull Entry entry) {
        return from(entry.custom());
    }

    @NotNull
    public static Optional<Provenance> of(@NotNull Resource resource) {
        return from(resource.metadata());
    }

    /**
     * Removes every provenance key from a map.
     *
     * @param map Source map
     * @return Copy without reserved keys
     */
    @NotNull
    public static Map<String, String> strip(@NotNull Map<String, String> map) {
        Map<String, String> copy = new LinkedHashMap<>(map);
        copy.keySet().removeIf(key -> key.startsWith(PREFIX));
        return copy;
    }

    @NotNull
    private Map<String, String> applyTo(@NotNull Map<String, String> map) {
        Map<String, String> copy = new LinkedHashMap<>(map);
        put(copy, SOURCE_PATH, sourcePath);
        put(copy, SOURCE_FORMAT, sourceFormat);
        put(copy, SOURCE_LANGUAGE, sourceLanguage);
        put(copy, MATCH_STRATEGY, matchStrategy);
        put(copy, SOURCE_KEY, sourceKey);
        return copy;
    }

    private static void put(Map<String, String> map, String key, @Nullable String value) {
        if (value != null) {
            map.put(key, value);
        } else {
            map.remove(key);
        }
    }

    @NotNull
    private static Optional<Provenance> from(@NotNull Map<String, String> map) {
        Provenance provenance = new Provenance(
                map.get(SOURCE_PATH),
                map.get(SOURCE_FORMAT),
                map.get(SOURCE_LANGUAGE),
                map.get(MATCH_STRATEGY),
                map.get(SOURCE_KEY)
        );
        return provenance.isEmpty() ? Optional.empty() : Optional.of(provenance);
    }
}
