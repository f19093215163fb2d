package com.afterlands.aftercodec.api.format;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Output of a serialization: file bytes plus degradation warnings.
 *
 * @param bytes Encoded file content
 * @param warnings Values that were collapsed or dropped
 */
public record SerializeResult(byte @NotNull [] bytes, @NotNull List<String> warnings) {

    public SerializeResult {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings cannot be null"));
    }

    /**
     * Content decoded as UTF-8.
     */
    @NotNull
    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
