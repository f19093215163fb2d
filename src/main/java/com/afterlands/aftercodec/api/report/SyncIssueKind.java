package com.afterlands.aftercodec.api.report;

/**
 * Why a target entry was not updated by a sync.
 */
public enum SyncIssueKind {
    /** No source entry matched by key or by match-language value. */
    UNMATCHED,
    /** Fallback found several source keys and could not pick one. */
    AMBIGUOUS,
    /** The matched source key has no value in the target language. */
    MISSING_LANGUAGE,
    /** Source and target disagree on Singular vs Plural. */
    TYPE_MISMATCH
}
