package com.afterlands.aftercodec.core.placeholder;

import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.PlaceholderSignature;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.api.report.PlaceholderIssue;
import com.afterlands.aftercodec.core.language.LanguageCodes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Rewrites placeholders into one platform's syntax.
 *
 * <p>Only the syntax changes: positions, flags, width and precision are kept, and
 * every token keeps its argument type, so signatures are identical before and after.</p>
 *
 * <h3>Rewrites:</h3>
 * <pre>
 * APPLE:    %s -> %@     %1$s -> %1$@
 * ANDROID:  %@ -> %s     %1$@ -> %1$s    %ld -> %d    %i -> %d
 * </pre>
 *
 * <p>When a source language is given, entries whose signature already differs
 * from the source are left untouched and reported as unresolved.</p>
 */
public class PlaceholderNormalizer {

    private final Logger logger;

    public PlaceholderNormalizer(@NotNull Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
    }

    /**
     * Result of a normalization.
     *
     * @param resource Normalized resource
     * @param rewritten Number of entries whose text changed
     * @param unresolved Entries skipped because their signature mismatches the source
     */
    public record Result(@NotNull Resource resource, int rewritten, @NotNull List<PlaceholderIssue> unresolved) {

        public Result {
            Objects.requireNonNull(resource, "resource cannot be null");
            unresolved = List.copyOf(unresolved);
        }
    }

    /**
     * Rewrites placeholders in a single string.
     *
     * @param text Text
     * @param style Target style
     * @return Rewritten text
     */
    @NotNull
    public static String normalize(@NotNull String text, @NotNull PlaceholderStyle style) {
        List<PlaceholderToken> tokens = PlaceholderExtractor.extract(text);
        if (tokens.isEmpty()) {
            return text;
        }

        StringBuilder sb = new StringBuilder(text.length());
        int last = 0;
        for (PlaceholderToken token : tokens) {
            sb.append(text, last, token.start());
            sb.append(token.render(style));
            last = token.end();
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }

    @NotNull
    public Result normalize(@NotNull Resource resource, @NotNull PlaceholderStyle style) {
        return normalize(resource, style, null);
    }

    /**
     * Rewrites every entry of a resource.
     *
     * @param resource Resource
     * @param style Target style
     * @param sourceLanguage Reference language guarding against rewriting broken entries, or null
     * @return Normalized resource and unresolved entries
     */
    @NotNull
    public Result normalize(@NotNull Resource resource, @NotNull PlaceholderStyle style, @Nullable String sourceLanguage) {
        Objects.requireNonNull(resource, "resource cannot be null");
        Objects.requireNonNull(style, "style cannot be null");

        Map<String, PlaceholderSignature> reference = sourceLanguage != null
                ? PlaceholderValidator.sourceSignatures(resource, sourceLanguage)
                : Map.of();

        List<Entry> entries = new ArrayList<>(resource.entries().size());
        List<PlaceholderIssue> unresolved = new ArrayList<>();
        int rewritten = 0;

        for (Entry entry : resource.entries()) {
            PlaceholderSignature expected = reference.get(entry.key());
            if (expected != null && !LanguageCodes.matches(entry.language(), sourceLanguage)) {
                PlaceholderSignature actual = PlaceholderExtractor.signature(entry.value());
                if (!expected.equals(actual)) {
                    unresolved.add(PlaceholderIssue.between(entry.key(), entry.language(), expected, actual));
                    entries.add(entry);
                    continue;
                }
            }

            Translation value = normalize(entry.value(), style);
            if (value.equals(entry.value())) {
                entries.add(entry);
            } else {
                entries.add(entry.withValue(value));
                rewritten++;
            }
        }

        logger.fine("[PlaceholderNormalizer] " + style + ": rewrote " + rewritten + " entries, "
                + unresolved.size() + " unresolved");
        return new Result(resource.withEntries(entries), rewritten, unresolved);
    }

    @NotNull
    private static Translation normalize(@NotNull Translation value, @NotNull PlaceholderStyle style) {
        if (value instanceof Translation.Plural plural) {
            Map<PluralCategory, String> forms = new EnumMap<>(PluralCategory.class);
            for (Map.Entry<PluralCategory, String> form : plural.forms().entrySet()) {
                forms.put(form.getKey(), normalize(form.getValue(), style));
            }
            return Translation.plural(forms);
        }
        return Translation.singular(normalize(value.primaryText(), style));
    }
}
