package com.afterlands.aftercodec.core.batch;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a batch run: every input either succeeded or failed.
 *
 * @param succeeded Labels of inputs processed successfully, in input order
 * @param failures Failed inputs with their cause, in input order
 */
public record BatchResult(@NotNull List<String> succeeded, @NotNull List<Failure> failures) {

    public BatchResult {
        Objects.requireNonNull(succeeded, "succeeded cannot be null");
        Objects.requireNonNull(failures, "failures cannot be null");
        succeeded = List.copyOf(succeeded);
        failures = List.copyOf(failures);
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public int total() {
        return succeeded.size() + failures.size();
    }

    /**
     * One failed input.
     *
     * @param input Input label
     * @param cause What went wrong
     */
    public record Failure(@NotNull String input, @NotNull Exception cause) {

        public Failure {
            Objects.requireNonNull(input, "input cannot be null");
            Objects.requireNonNull(cause, "cause cannot be null");
        }

        @NotNull
        public String message() {
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
    }
}
