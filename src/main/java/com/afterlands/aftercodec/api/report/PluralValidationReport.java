package com.afterlands.aftercodec.api.report;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Result of plural completeness validation.
 *
 * @param checked Number of Plural entries inspected
 * @param issues Entries missing required categories
 * @param shapeMismatches Keys whose shape differs between languages
 * @param severity ERROR when produced in strict mode, else WARNING
 */
public record PluralValidationReport(
        int checked,
        @NotNull List<PluralIssue> issues,
        @NotNull List<ShapeMismatch> shapeMismatches,
        @NotNull Severity severity
) {

    public PluralValidationReport {
        issues = List.copyOf(issues);
        shapeMismatches = List.copyOf(shapeMismatches);
        Objects.requireNonNull(severity, "severity cannot be null");
    }

    /**
     * No missing categories and no shape mismatches.
     */
    public boolean isClean() {
        return issues.isEmpty() && shapeMismatches.isEmpty();
    }
}
