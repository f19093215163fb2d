package com.afterlands.aftercodec.api.report;

/**
 * Totals across all languages of a diff.
 *
 * @param languages Number of languages compared
 * @param added Added keys
 * @param removed Removed keys
 * @param changed Changed keys
 * @param unchanged Unchanged keys
 */
public record DiffSummary(int languages, int added, int removed, int changed, int unchanged) {

    public int totalChanges() {
        return added + removed + changed;
    }
}
