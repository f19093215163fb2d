package com.afterlands.aftercodec.api.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a Resource cannot be serialized into a format.
 */
public class ResourceWriteException extends CodecException {

    private final String format;

    public ResourceWriteException(@NotNull String format, @NotNull String message) {
        super(ErrorCode.WRITE, "[" + format + "] " + message);
        this.format = format;
    }

    public ResourceWriteException(@NotNull String format, @NotNull String message, @Nullable Throwable cause) {
        super(ErrorCode.WRITE, "[" + format + "] " + message, cause);
        this.format = format;
    }

    @NotNull
    public String getFormat() {
        return format;
    }
}
