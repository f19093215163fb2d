package com.afterlands.aftercodec.core.sync;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Options for {@link SyncEngine}.
 *
 * @param matchLanguage Language whose values link target keys to source keys in the
 *                      fallback phase; null to infer it from the source
 * @param languageFilter Only sync target entries of this language (or its base language)
 * @param failOnUnmatched Report a policy violation when any entry is unmatched
 * @param failOnAmbiguous Report a policy violation when any fallback is ambiguous
 * @param recordProvenance Record match details in updated entries' custom data
 */
public record SyncOptions(
        @Nullable String matchLanguage,
        @Nullable String languageFilter,
        boolean failOnUnmatched,
        boolean failOnAmbiguous,
        boolean recordProvenance
) {

    @NotNull
    public static SyncOptions defaults() {
        return new SyncOptions(null, null, false, false, false);
    }

    @NotNull
    public SyncOptions withMatchLanguage(@Nullable String language) {
        return new SyncOptions(language, languageFilter, failOnUnmatched, failOnAmbiguous, recordProvenance);
    }

    @NotNull
    public SyncOptions withLanguageFilter(@Nullable String language) {
        return new SyncOptions(matchLanguage, language, failOnUnmatched, failOnAmbiguous, recordProvenance);
    }

    @NotNull
    public SyncOptions withFailOnUnmatched(boolean fail) {
        return new SyncOptions(matchLanguage, languageFilter, fail, failOnAmbiguous, recordProvenance);
    }

    @NotNull
    public SyncOptions withFailOnAmbiguous(boolean fail) {
        return new SyncOptions(matchLanguage, languageFilter, failOnUnmatched, fail, recordProvenance);
    }

    @NotNull
    public SyncOptions withRecordProvenance(boolean record) {
        return new SyncOptions(matchLanguage, languageFilter, failOnUnmatched, failOnAmbiguous, record);
    }
}
