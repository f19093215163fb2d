package com.afterlands.aftercodec.api.report;

/**
 * Severity attached to validation reports.
 */
public enum Severity {
    ERROR,
    WARNING;

    public static Severity of(ValidationMode mode) {
        return mode.isStrict() ? ERROR : WARNING;
    }
}
