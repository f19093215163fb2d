package com.afterlands.aftercodec.api.error;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a Resource would violate the model invariants, or when an
 * operation receives input it cannot work with (e.g., merging nothing).
 */
public class InvalidResourceException extends CodecException {

    public InvalidResourceException(@NotNull String message) {
        super(ErrorCode.INVALID_RESOURCE, message);
    }
}
