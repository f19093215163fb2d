package com.afterlands.aftercodec.core.sync;

import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.api.report.LanguageSyncSummary;
import com.afterlands.aftercodec.api.report.SyncIssue;
import com.afterlands.aftercodec.api.report.SyncIssueKind;
import com.afterlands.aftercodec.api.report.SyncReport;
import com.afterlands.aftercodec.core.language.LanguageCodes;
import com.afterlands.aftercodec.core.provenance.Provenance;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Propagates values from a source resource into the entries a target already has.
 *
 * <p>The target's key set and entry order never change: sync only replaces values.
 * Each target entry is matched in two phases.</p>
 *
 * <h3>Phase 1 - exact key:</h3>
 * <p>The source has the same key. Its value for the target language is taken from
 * the same normalized language, or from the only source language sharing the
 * target's base language. The fallback phase is not consulted.</p>
 *
 * <h3>Phase 2 - fallback by match-language value:</h3>
 * <p>Source keys are indexed by their non-empty Singular text in the match language.
 * The target key itself, then the target's own match-language text, are looked up in
 * that index. One candidate matches; several candidates are narrowed to those with a
 * value in the target language; anything else is ambiguous.</p>
 *
 * <h3>Match language:</h3>
 * <ol>
 *     <li>{@link SyncOptions#matchLanguage()}</li>
 *     <li>source metadata {@code source_language}</li>
 *     <li>{@code en}, when the source has it</li>
 *     <li>first source language</li>
 * </ol>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * SyncResult result = engine.sync(source, target, SyncOptions.defaults()
 *         .withFailOnAmbiguous(true));
 * Resource updated = result.orThrow().resource();
 * }</pre>
 *
 * @author AfterLands Team
 * @since 1.0.0
 */
public class SyncEngine {

    public static final String EXACT_KEY = "exact_key";
    public static final String FALLBACK_TRANSLATION = "fallback_translation";

    private static final String DEFAULT_MATCH_LANGUAGE = "en";

    private final Logger logger;
    private final boolean debug;

    public SyncEngine(@NotNull Logger logger, boolean debug) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.debug = debug;
    }

    /**
     * Syncs source values into target.
     *
     * @param source Resource providing values
     * @param target Resource whose existing entries are updated
     * @param options Sync options
     * @return Updated target, report and policy violations
     */
    @NotNull
    public SyncResult sync(@NotNull Resource source, @NotNull Resource target, @NotNull SyncOptions options) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        String matchLanguage = inferMatchLanguage(source, options.matchLanguage());
        SourceIndex index = new SourceIndex(source, matchLanguage);
        Map<String, String> targetTokens = targetMatchTokens(target, matchLanguage);

        Map<String, Tally> tallies = new LinkedHashMap<>();
        List<SyncIssue> issues = new ArrayList<>();
        List<Entry> entries = new ArrayList<>(target.entries().size());

        for (Entry entry : target.entries()) {
            if (options.languageFilter() != null && !languageMatches(entry.language(), options.languageFilter())) {
                entries.add(entry);
                continue;
            }

            Tally tally = tallies.computeIfAbsent(entry.language(), Tally::new);
            Match match = index.find(entry.key(), entry.language(), targetTokens.get(entry.key()));

            if (match.sourceKey == null) {
                SyncIssueKind kind = match.ambiguous ? SyncIssueKind.AMBIGUOUS : SyncIssueKind.UNMATCHED;
                tally.record(kind, entry.key());
                issues.add(new SyncIssue(kind, entry.language(), entry.key(), null, match.candidates));
                entries.add(entry);
                continue;
            }

            Entry sourceEntry = index.valueFor(match.sourceKey, entry.language());
            if (sourceEntry == null) {
                tally.record(SyncIssueKind.MISSING_LANGUAGE, entry.key());
                issues.add(new SyncIssue(SyncIssueKind.MISSING_LANGUAGE, entry.language(), entry.key(), match.sourceKey, List.of()));
                entries.add(entry);
                continue;
            }

            if (sourceEntry.value().isPlural() != entry.value().isPlural()) {
                tally.record(SyncIssueKind.TYPE_MISMATCH, entry.key());
                issues.add(new SyncIssue(SyncIssueKind.TYPE_MISMATCH, entry.language(), entry.key(), match.sourceKey, List.of()));
                entries.add(entry);
                continue;
            }

            tally.matched++;
            if (match.fallback) {
                tally.fallbackMatches++;
            }

            if (sourceEntry.value().equals(entry.value())) {
                tally.unchanged++;
                entries.add(entry);
                continue;
            }

            Entry updated = entry.withValue(sourceEntry.value());
            if (options.recordProvenance()) {
                updated = Provenance.ofMatch(
                        match.fallback ? FALLBACK_TRANSLATION : EXACT_KEY,
                        match.sourceKey,
                        sourceEntry.language()
                ).applyTo(updated);
            }
            tally.updated++;
            entries.add(updated);

            if (debug) {
                logger.fine("[SyncEngine] " + entry.key() + " [" + entry.language() + "] <- "
                        + match.sourceKey + (match.fallback ? " (fallback)" : ""));
            }
        }

        Map<String, LanguageSyncSummary> summaries = new LinkedHashMap<>();
        for (Tally tally : tallies.values()) {
            summaries.put(tally.language, tally.toSummary());
        }
        SyncReport report = new SyncReport(matchLanguage, summaries, issues);

        List<String> violations = new ArrayList<>();
        long unmatched = report.count(SyncIssueKind.UNMATCHED);
        long ambiguous = report.count(SyncIssueKind.AMBIGUOUS);
        if (options.failOnUnmatched() && unmatched > 0) {
            violations.add("sync has " + unmatched + " unmatched entries");
        }
        if (options.failOnAmbiguous() && ambiguous > 0) {
            violations.add("sync has " + ambiguous + " ambiguous fallback matches");
        }

        logger.info("[SyncEngine] Synced " + summaries.size() + " language(s) using match language '"
                + matchLanguage + "': updated=" + report.totalUpdated()
                + ", unchanged=" + report.totalUnchanged()
                + ", fallback=" + report.totalFallbackMatches()
                + ", issues=" + issues.size());
        if (!violations.isEmpty()) {
            logger.warning("[SyncEngine] Policy violations: " + violations);
        }

        return new SyncResult(target.withEntries(entries), report, violations);
    }

    /**
     * Resolves the language used for fallback matching.
     *
     * @param source Source resource
     * @param explicit Explicitly requested language, may be null
     * @return Match language
     */
    @NotNull
    public static String inferMatchLanguage(@NotNull Resource source, @Nullable String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }

        String declared = source.metadata(Resource.SOURCE_LANGUAGE);
        if (declared != null && !declared.isBlank()) {
            return declared;
        }

        Set<String> languages = source.languages();
        for (String language : languages) {
            if (LanguageCodes.normalize(language).equals(DEFAULT_MATCH_LANGUAGE)) {
                return DEFAULT_MATCH_LANGUAGE;
            }
        }

        return languages.isEmpty() ? DEFAULT_MATCH_LANGUAGE : languages.iterator().next();
    }

    private static boolean languageMatches(@NotNull String language, @NotNull String requested) {
        return LanguageCodes.matches(language, requested) || LanguageCodes.sameBase(language, requested);
    }

    /**
     * Picks the language in {@code available} that best matches {@code wanted}:
     * same normalized code, else the only one sharing its base language.
     */
    @Nullable
    static String resolveLanguage(@NotNull Collection<String> available, @NotNull String wanted) {
        String normalized = LanguageCodes.normalize(wanted);
        String baseMatch = null;
        int baseMatches = 0;
        for (String language : available) {
            if (LanguageCodes.normalize(language).equals(normalized)) {
                return language;
            }
            if (LanguageCodes.sameBase(language, normalized)) {
                baseMatch = language;
                baseMatches++;
            }
        }
        return baseMatches == 1 ? baseMatch : null;
    }

    @NotNull
    private static Map<String, String> targetMatchTokens(@NotNull Resource target, @NotNull String matchLanguage) {
        Map<String, String> tokens = new LinkedHashMap<>();
        String language = resolveLanguage(target.languages(), matchLanguage);
        if (language == null) {
            return tokens;
        }
        for (Entry entry : target.entriesFor(language)) {
            String token = singularToken(entry.value());
            if (token != null) {
                tokens.put(entry.key(), token);
            }
        }
        return tokens;
    }

    @Nullable
    private static String singularToken(@NotNull Translation value) {
        if (value instanceof Translation.Singular singular && !singular.text().isEmpty()) {
            return singular.text();
        }
        return null;
    }

    // ══════════════════════════════════════════════
    // MATCHING
    // ══════════════════════════════════════════════

    private record Match(@Nullable String sourceKey, boolean fallback, boolean ambiguous, @NotNull List<String> candidates) {

        static final Match NONE = new Match(null, false, false, List.of());

        static Match exact(String key) {
            return new Match(key, false, false, List.of());
        }

        static Match fallback(String key) {
            return new Match(key, true, false, List.of());
        }

        static Match ambiguous(List<String> candidates) {
            return new Match(null, true, true, candidates);
        }
    }

    /**
     * Source entries by key and language, plus the match-language alias table.
     */
    private static final class SourceIndex {

        private final Map<String, Map<String, Entry>> byKey = new LinkedHashMap<>();
        private final Map<String, List<String>> aliases = new LinkedHashMap<>();

        SourceIndex(@NotNull Resource source, @NotNull String matchLanguage) {
            for (Entry entry : source.entries()) {
                byKey.computeIfAbsent(entry.key(), k -> new LinkedHashMap<>())
                        .putIfAbsent(LanguageCodes.normalize(entry.language()), entry);
            }

            String language = resolveLanguage(source.languages(), matchLanguage);
            if (language == null) {
                return;
            }
            for (Entry entry : source.entriesFor(language)) {
                String token = singularToken(entry.value());
                if (token == null) {
                    continue;
                }
                List<String> keys = aliases.computeIfAbsent(token, t -> new ArrayList<>());
                if (!keys.contains(entry.key())) {
                    keys.add(entry.key());
                }
            }
        }

        @NotNull
        Match find(@NotNull String targetKey, @NotNull String targetLanguage, @Nullable String targetToken) {
            if (byKey.containsKey(targetKey)) {
                return Match.exact(targetKey);
            }

            Match byKeyAlias = resolveAlias(targetKey, targetLanguage);
            if (byKeyAlias.sourceKey != null || byKeyAlias.ambiguous) {
                return byKeyAlias;
            }

            if (targetToken != null) {
                Match byToken = resolveAlias(targetToken, targetLanguage);
                if (byToken.sourceKey != null || byToken.ambiguous) {
                    return byToken;
                }
            }
            return Match.NONE;
        }

        @NotNull
        private Match resolveAlias(@NotNull String token, @NotNull String targetLanguage) {
            List<String> candidates = aliases.get(token);
            if (candidates == null || candidates.isEmpty()) {
                return Match.NONE;
            }
            if (candidates.size() == 1) {
                return Match.fallback(candidates.get(0));
            }

            List<String> narrowed = new ArrayList<>();
            for (String candidate : candidates) {
                if (valueFor(candidate, targetLanguage) != null) {
                    narrowed.add(candidate);
                }
            }
            if (narrowed.size() == 1) {
                return Match.fallback(narrowed.get(0));
            }
            return Match.ambiguous(narrowed.isEmpty() ? candidates : narrowed);
        }

        @Nullable
        Entry valueFor(@NotNull String key, @NotNull String targetLanguage) {
            Map<String, Entry> languages = byKey.get(key);
            if (languages == null) {
                return null;
            }
            String language = resolveLanguage(new LinkedHashSet<>(languages.keySet()), targetLanguage);
            return language == null ? null : languages.get(language);
        }
    }

    /**
     * Mutable per-language counters, frozen into a {@link LanguageSyncSummary}.
     */
    private static final class Tally {
        private final String language;
        private int matched;
        private int updated;
        private int unchanged;
        private int fallbackMatches;
        private final List<String> unmatched = new ArrayList<>();
        private final List<String> ambiguous = new ArrayList<>();
        private final List<String> missingLanguage = new ArrayList<>();
        private final List<String> typeMismatch = new ArrayList<>();

        Tally(String language) {
            this.language = language;
        }

        void record(SyncIssueKind kind, String key) {
            switch (kind) {
                case UNMATCHED -> unmatched.add(key);
                case AMBIGUOUS -> ambiguous.add(key);
                case MISSING_LANGUAGE -> missingLanguage.add(key);
                case TYPE_MISMATCH -> typeMismatch.add(key);
            }
        }

        LanguageSyncSummary toSummary() {
            return new LanguageSyncSummary(language, matched, updated, unchanged, fallbackMatches,
                    unmatched, ambiguous, missingLanguage, typeMismatch);
        }
    }
}
