package com.afterlands.aftercodec.api.error;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when no registered format matches a tag or file extension.
 */
public class UnknownFormatException extends CodecException {

    public UnknownFormatException(@NotNull String message) {
        super(ErrorCode.UNKNOWN_FORMAT, message);
    }
}
