package com.afterlands.aftercodec.core.diff;

import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.report.ChangedEntry;
import com.afterlands.aftercodec.api.report.DiffReport;
import com.afterlands.aftercodec.api.report.LanguageDiff;
import com.afterlands.aftercodec.core.language.LanguageCodes;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Structural diff between a source and a target resource.
 *
 * <p>For every language on either side (normalized, sorted):</p>
 * <ul>
 *     <li><b>added</b> - key present in target, absent in source</li>
 *     <li><b>removed</b> - key present in source, absent in target</li>
 *     <li><b>changed</b> - key in both with a different value or status</li>
 * </ul>
 *
 * <p>Plural values compare their full category map. All lists are sorted by key.</p>
 */
public class DiffEngine {

    private final Logger logger;

    public DiffEngine(@NotNull Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
    }

    @NotNull
    public DiffReport diff(@NotNull Resource source, @NotNull Resource target) {
        return diff(source, target, DiffOptions.defaults());
    }

    /**
     * Computes the diff.
     *
     * @param source Resource before
     * @param target Resource after
     * @param options Diff options
     * @return Diff report
     */
    @NotNull
    public DiffReport diff(@NotNull Resource source, @NotNull Resource target, @NotNull DiffOptions options) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        Map<String, Map<String, Entry>> before = index(source);
        Map<String, Map<String, Entry>> after = index(target);

        TreeSet<String> languages = new TreeSet<>(before.keySet());
        languages.addAll(after.keySet());

        String filter = options.languageFilter() != null
                ? LanguageCodes.normalize(options.languageFilter())
                : null;

        Map<String, LanguageDiff> result = new LinkedHashMap<>();
        for (String language : languages) {
            if (filter != null && !filter.equals(language)) {
                continue;
            }
            result.put(language, diffLanguage(
                    language,
                    before.getOrDefault(language, Map.of()),
                    after.getOrDefault(language, Map.of())
            ));
        }

        DiffReport report = new DiffReport(result, filter);
        logger.fine("[DiffEngine] " + report.summary());
        return report;
    }

    @NotNull
    private LanguageDiff diffLanguage(
            @NotNull String language,
            @NotNull Map<String, Entry> before,
            @NotNull Map<String, Entry> after
    ) {
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<ChangedEntry> changed = new ArrayList<>();
        int unchanged = 0;

        for (Map.Entry<String, Entry> entry : after.entrySet()) {
            if (!before.containsKey(entry.getKey())) {
                added.add(entry.getKey());
            }
        }

        for (Map.Entry<String, Entry> entry : before.entrySet()) {
            Entry old = entry.getValue();
            Entry now = after.get(entry.getKey());
            if (now == null) {
                removed.add(entry.getKey());
            } else if (!old.value().equals(now.value()) || old.status() != now.status()) {
                changed.add(new ChangedEntry(entry.getKey(), old.value(), now.value(), old.status(), now.status()));
            } else {
                unchanged++;
            }
        }

        changed.sort(Comparator.comparing(ChangedEntry::key));
        return new LanguageDiff(language, added, removed, changed, unchanged);
    }

    /**
     * normalized language -> key -> entry, keys sorted. The first spelling of a
     * (key, language) wins if two spellings normalize to the same code.
     */
    @NotNull
    private static Map<String, Map<String, Entry>> index(@NotNull Resource resource) {
        Map<String, Map<String, Entry>> index = new TreeMap<>();
        for (Entry entry : resource.entries()) {
            index.computeIfAbsent(LanguageCodes.normalize(entry.language()), l -> new TreeMap<>())
                    .putIfAbsent(entry.key(), entry);
        }
        return index;
    }
}
