package com.afterlands.aftercodec.api.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Base class of every failure raised by the toolkit.
 *
 * <p>Unchecked, like the rest of the API. Callers that need to map failures to
 * exit codes switch on {@link #getCode()} instead of the concrete type.</p>
 *
 * @author AfterLands Team
 * @since 1.0.0
 */
public class CodecException extends RuntimeException {

    private final ErrorCode code;

    public CodecException(@NotNull ErrorCode code, @NotNull String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code cannot be null");
    }

    public CodecException(@NotNull ErrorCode code, @NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code cannot be null");
    }

    @NotNull
    public ErrorCode getCode() {
        return code;
    }
}
