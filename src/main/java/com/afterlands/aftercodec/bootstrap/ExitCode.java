package com.afterlands.aftercodec.bootstrap;

import com.afterlands.aftercodec.api.error.CodecException;
import com.afterlands.aftercodec.api.error.ErrorCode;
import com.afterlands.aftercodec.core.batch.BatchResult;
import org.jetbrains.annotations.NotNull;

/**
 * Process exit status reported by drivers built on the toolkit.
 */
public enum ExitCode {
    SUCCESS(0),
    FAILURE(1),
    PLURAL_VALIDATION(2);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Exit status for a failure.
     *
     * @param error Failure cause
     * @return PLURAL_VALIDATION for plural completeness failures, FAILURE otherwise
     */
    @NotNull
    public static ExitCode of(@NotNull Throwable error) {
        if (error instanceof CodecException codec && codec.getCode() == ErrorCode.PLURAL_VALIDATION) {
            return PLURAL_VALIDATION;
        }
        return FAILURE;
    }

    /**
     * Aggregate exit status of a batch run.
     *
     * <p>SUCCESS when nothing failed. When every failure is a plural validation
     * failure the run reports PLURAL_VALIDATION, otherwise FAILURE.</p>
     */
    @NotNull
    public static ExitCode of(@NotNull BatchResult result) {
        if (result.isSuccess()) {
            return SUCCESS;
        }
        boolean onlyPlural = result.failures().stream()
                .allMatch(failure -> of(failure.cause()) == PLURAL_VALIDATION);
        return onlyPlural ? PLURAL_VALIDATION : FAILURE;
    }
}
