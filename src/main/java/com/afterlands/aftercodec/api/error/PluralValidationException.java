package com.afterlands.aftercodec.api.error;

import com.afterlands.aftercodec.api.report.PluralValidationReport;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown by strict plural validation when required categories are missing.
 */
public class PluralValidationException extends CodecException {

    private final PluralValidationReport report;

    public PluralValidationException(@NotNull PluralValidationReport report) {
        super(ErrorCode.PLURAL_VALIDATION, "Plural validation failed: " + report.issues().size()
                + " entr" + (report.issues().size() == 1 ? "y" : "ies") + " missing required categories");
        this.report = report;
    }

    @NotNull
    public PluralValidationReport getReport() {
        return report;
    }
}
