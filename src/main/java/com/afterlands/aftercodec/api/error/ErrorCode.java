package com.afterlands.aftercodec.api.error;

/**
 * Machine-readable category of a {@link CodecException}.
 */
public enum ErrorCode {
    PARSE,
    WRITE,
    UNKNOWN_FORMAT,
    INVALID_RESOURCE,
    MERGE_CONFLICT,
    PLURAL_VALIDATION,
    PLACEHOLDER_VALIDATION,
    SYNC_POLICY
}
