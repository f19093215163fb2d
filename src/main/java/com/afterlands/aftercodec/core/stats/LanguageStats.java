package com.afterlands.aftercodec.core.stats;

import com.afterlands.aftercodec.api.model.EntryStatus;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Completion figures for one language.
 *
 * @param language Language code
 * @param total Number of entries
 * @param byStatus Entry count per status (every status present, zero when unused)
 * @param completionPercent translated / (total - do_not_translate), 100 when nothing is translatable
 * @param missingPluralEntries Plural entries lacking at least one required category
 * @param missingPluralCategories Sum of missing categories over those entries
 */
public record LanguageStats(
        @NotNull String language,
        int total,
        @NotNull Map<EntryStatus, Integer> byStatus,
        double completionPercent,
        int missingPluralEntries,
        int missingPluralCategories
) {

    public LanguageStats {
        Objects.requireNonNull(language, "language cannot be null");
        Objects.requireNonNull(byStatus, "byStatus cannot be null");

        EnumMap<EntryStatus, Integer> copy = new EnumMap<>(EntryStatus.class);
        for (EntryStatus status : EntryStatus.values()) {
            copy.put(status, byStatus.getOrDefault(status, 0));
        }
        byStatus = Collections.unmodifiableMap(copy);
    }

    public int count(@NotNull EntryStatus status) {
        return byStatus.get(status);
    }

    public boolean isComplete() {
        return completionPercent >= 100.0 && missingPluralEntries == 0;
    }
}
