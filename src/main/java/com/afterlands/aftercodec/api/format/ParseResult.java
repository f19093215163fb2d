package com.afterlands.aftercodec.api.format;

import com.afterlands.aftercodec.api.model.Resource;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Output of a parse: the resource plus warnings recorded in permissive mode.
 *
 * @param resource Parsed resource
 * @param warnings Human-readable warnings, in discovery order
 */
public record ParseResult(@NotNull Resource resource, @NotNull List<String> warnings) {

    public ParseResult {
        Objects.requireNonNull(resource, "resource cannot be null");
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings cannot be null"));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
