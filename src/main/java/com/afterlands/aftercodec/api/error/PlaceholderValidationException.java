package com.afterlands.aftercodec.api.error;

import com.afterlands.aftercodec.api.report.PlaceholderValidationReport;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown by strict placeholder validation when signatures disagree with the source language.
 */
public class PlaceholderValidationException extends CodecException {

    private final PlaceholderValidationReport report;

    public PlaceholderValidationException(@NotNull PlaceholderValidationReport report) {
        super(ErrorCode.PLACEHOLDER_VALIDATION, "Placeholder validation failed: "
                + report.issues().size() + " mismatch(es) against " + report.sourceLanguage());
        this.report = report;
    }

    @NotNull
    public PlaceholderValidationReport getReport() {
        return report;
    }
}
