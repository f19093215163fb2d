package com.afterlands.aftercodec.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Placeholder signature of a string: argument ordinal to argument type.
 *
 * <p>Two strings are placeholder-compatible when their signatures are equal.
 * Ordinals are 1-based. {@code "Hello %1$@, you have %d items"} has the
 * signature {@code {1=string, 2=integer}}.</p>
 *
 * @param arguments Ordinal to type, sorted by ordinal
 */
public record PlaceholderSignature(@NotNull SortedMap<Integer, PlaceholderType> arguments) {

    public PlaceholderSignature {
        Objects.requireNonNull(arguments, "arguments cannot be null");
        arguments = Collections.unmodifiableSortedMap(new TreeMap<>(arguments));
    }

    @NotNull
    public static PlaceholderSignature empty() {
        return new PlaceholderSignature(new TreeMap<>());
    }

    @NotNull
    public static PlaceholderSignature of(@NotNull Map<Integer, PlaceholderType> arguments) {
        return new PlaceholderSignature(new TreeMap<>(arguments));
    }

    public boolean isEmpty() {
        return arguments.isEmpty();
    }

    public int size() {
        return arguments.size();
    }

    @Override
    public String toString() {
        return arguments.entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue().getKey())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
