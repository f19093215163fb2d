package com.afterlands.aftercodec.api.report;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Result of placeholder consistency validation.
 *
 * @param sourceLanguage Language whose signatures are the reference
 * @param checked Number of non-source entries compared
 * @param issues Mismatching entries
 * @param severity ERROR when produced in strict mode, else WARNING
 */
public record PlaceholderValidationReport(
        @NotNull String sourceLanguage,
        int checked,
        @NotNull List<PlaceholderIssue> issues,
        @NotNull Severity severity
) {

    public PlaceholderValidationReport {
        Objects.requireNonNull(sourceLanguage, "sourceLanguage cannot be null");
        issues = List.copyOf(issues);
        Objects.requireNonNull(severity, "severity cannot be null");
    }

    public boolean isClean() {
        return issues.isEmpty();
    }
}
