package com.afterlands.aftercodec.core.stats;

import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.core.language.LanguageCodes;
import com.afterlands.aftercodec.core.plural.PluralCategoryTable;
import com.afterlands.aftercodec.core.plural.PluralValidator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Computes per-language completion statistics.
 *
 * <p>Only TRANSLATED entries count as done. DO_NOT_TRANSLATE entries are left out of
 * the denominator; a language with nothing left to translate is 100% complete.
 * Percentages are rounded to two decimals.</p>
 */
public class StatsCalculator {

    private final PluralCategoryTable table;
    private final Logger logger;

    public StatsCalculator(@NotNull PluralCategoryTable table, @NotNull Logger logger) {
        this.table = Objects.requireNonNull(table, "table cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
    }

    @NotNull
    public ResourceStats calculate(@NotNull Resource resource) {
        return calculate(resource, null);
    }

    /**
     * Computes statistics, optionally for one language only.
     *
     * @param resource Resource to inspect
     * @param languageFilter Language to keep (compared after normalization), or null for all
     * @return Statistics sorted by language
     */
    @NotNull
    public ResourceStats calculate(@NotNull Resource resource, @Nullable String languageFilter) {
        Map<String, List<Entry>> byLanguage = new TreeMap<>();
        for (Entry entry : resource.entries()) {
            if (languageFilter != null && !LanguageCodes.matches(entry.language(), languageFilter)) {
                continue;
            }
            byLanguage.computeIfAbsent(entry.language(), k -> new ArrayList<>()).add(entry);
        }

        List<LanguageStats> languages = new ArrayList<>();
        for (Map.Entry<String, List<Entry>> group : byLanguage.entrySet()) {
            languages.add(languageStats(group.getKey(), group.getValue()));
        }

        ResourceStats stats = new ResourceStats(resource.keys().size(), languages);
        logger.fine("[StatsCalculator] " + languages.size() + " languages, " + stats.uniqueKeys() + " keys");
        return stats;
    }

    @NotNull
    private LanguageStats languageStats(@NotNull String language, @NotNull List<Entry> entries) {
        Map<EntryStatus, Integer> byStatus = new EnumMap<>(EntryStatus.class);
        int translated = 0;
        int denominator = 0;
        int missingEntries = 0;
        int missingCategories = 0;

        for (Entry entry : entries) {
            byStatus.merge(entry.status(), 1, Integer::sum);
            if (entry.status() == EntryStatus.TRANSLATED) {
                translated++;
            }
            if (entry.status().countsTowardsCompletion()) {
                denominator++;
            }

            Set<PluralCategory> missing = PluralValidator.missingCategories(entry, table);
            if (!missing.isEmpty()) {
                missingEntries++;
                missingCategories += missing.size();
            }
        }

        double percent = denominator == 0 ? 100.0 : translated * 100.0 / denominator;
        percent = Math.round(percent * 100.0) / 100.0;

        return new LanguageStats(language, entries.size(), byStatus, percent, missingEntries, missingCategories);
    }
}
