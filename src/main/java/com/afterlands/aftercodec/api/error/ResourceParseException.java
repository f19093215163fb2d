package com.afterlands.aftercodec.api.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a format adapter cannot read its input.
 */
public class ResourceParseException extends CodecException {

    private final String format;

    public ResourceParseException(@NotNull String format, @NotNull String message) {
        super(ErrorCode.PARSE, "[" + format + "] " + message);
        this.format = format;
    }

    public ResourceParseException(@NotNull String format, @NotNull String message, @Nullable Throwable cause) {
        super(ErrorCode.PARSE, "[" + format + "] " + message, cause);
        this.format = format;
    }

    /**
     * Tag of the format that failed.
     */
    @NotNull
    public String getFormat() {
        return format;
    }
}
