package com.afterlands.aftercodec.api.report;

import com.afterlands.aftercodec.api.model.PlaceholderSignature;
import com.afterlands.aftercodec.api.model.PlaceholderType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A translation whose placeholder signature differs from the source language.
 *
 * @param key Entry key
 * @param language Entry language
 * @param expected Signature of the source language entry
 * @param actual Signature of this entry
 * @param missing Ordinals in the source but not here, with their type
 * @param extra Ordinals here but not in the source, with their type
 * @param typeChanged Ordinals present on both sides with different types
 */
public record PlaceholderIssue(
        @NotNull String key,
        @NotNull String language,
        @NotNull PlaceholderSignature expected,
        @NotNull PlaceholderSignature actual,
        @NotNull Map<Integer, PlaceholderType> missing,
        @NotNull Map<Integer, PlaceholderType> extra,
        @NotNull List<Integer> typeChanged
) {

    public PlaceholderIssue {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(language, "language cannot be null");
        Objects.requireNonNull(expected, "expected cannot be null");
        Objects.requireNonNull(actual, "actual cannot be null");
        missing = Collections.unmodifiableMap(new TreeMap<>(missing));
        extra = Collections.unmodifiableMap(new TreeMap<>(extra));
        typeChanged = List.copyOf(typeChanged);
    }

    /**
     * Builds an issue by comparing two signatures.
     *
     * @param key Entry key
     * @param language Entry language
     * @param expected Source signature
     * @param actual Entry signature
     * @return Issue describing the differences
     */
    @NotNull
    public static PlaceholderIssue between(
            @NotNull String key,
            @NotNull String language,
            @NotNull PlaceholderSignature expected,
            @NotNull PlaceholderSignature actual
    ) {
        Map<Integer, PlaceholderType> missing = new TreeMap<>();
        Map<Integer, PlaceholderType> extra = new TreeMap<>();
        List<Integer> typeChanged = new ArrayList<>();

        for (Map.Entry<Integer, PlaceholderType> arg : expected.arguments().entrySet()) {
            PlaceholderType other = actual.arguments().get(arg.getKey());
            if (other == null) {
                missing.put(arg.getKey(), arg.getValue());
            } else if (other != arg.getValue()) {
                typeChanged.add(arg.getKey());
            }
        }
        for (Map.Entry<Integer, PlaceholderType> arg : actual.arguments().entrySet()) {
            if (!expected.arguments().containsKey(arg.getKey())) {
                extra.put(arg.getKey(), arg.getValue());
            }
        }
        return new PlaceholderIssue(key, language, expected, actual, missing, extra, typeChanged);
    }
}
