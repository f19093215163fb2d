package com.afterlands.aftercodec.core.placeholder;

import com.afterlands.aftercodec.api.error.PlaceholderValidationException;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.PlaceholderSignature;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.report.PlaceholderIssue;
import com.afterlands.aftercodec.api.report.PlaceholderValidationReport;
import com.afterlands.aftercodec.api.report.Severity;
import com.afterlands.aftercodec.api.report.ValidationMode;
import com.afterlands.aftercodec.core.language.LanguageCodes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Checks that every translation uses the same placeholders as the source language.
 *
 * <p>For each key, the signature of every non-source entry must equal the source
 * entry's signature. Keys without a source entry are not checked.</p>
 *
 * <h3>Example:</h3>
 * <pre>
 * en: "Hello %1$@, you have %d items"   {1:string, 2:integer}
 * fr: "Bonjour %1$@"                    {1:string}
 *     -> missing {2:integer}
 * </pre>
 */
public class PlaceholderValidator {

    private static final String DEFAULT_SOURCE_LANGUAGE = "en";

    private final Logger logger;

    public PlaceholderValidator(@NotNull Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
    }

    @NotNull
    public PlaceholderValidationReport validate(@NotNull Resource resource, @NotNull ValidationMode mode) {
        return validate(resource, null, mode);
    }

    /**
     * Validates placeholder consistency.
     *
     * @param resource Resource to check
     * @param sourceLanguage Reference language; null to infer it
     * @param mode STRICT throws on any mismatch
     * @return Report
     * @throws PlaceholderValidationException in STRICT mode when signatures differ
     */
    @NotNull
    public PlaceholderValidationReport validate(
            @NotNull Resource resource,
            @Nullable String sourceLanguage,
            @NotNull ValidationMode mode
    ) {
        Objects.requireNonNull(resource, "resource cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");

        String source = resolveSourceLanguage(resource, sourceLanguage);
        Map<String, PlaceholderSignature> reference = sourceSignatures(resource, source);

        List<PlaceholderIssue> issues = new ArrayList<>();
        int checked = 0;

        for (Entry entry : resource.entries()) {
            if (LanguageCodes.matches(entry.language(), source)) {
                continue;
            }
            PlaceholderSignature expected = reference.get(entry.key());
            if (expected == null) {
                continue;
            }
            checked++;
            PlaceholderSignature actual = PlaceholderExtractor.signature(entry.value());
            if (!expected.equals(actual)) {
                issues.add(PlaceholderIssue.between(entry.key(), entry.language(), expected, actual));
            }
        }

        for (PlaceholderIssue issue : issues) {
            logger.warning("[PlaceholderValidator] " + issue.key() + " [" + issue.language() + "] expected "
                    + issue.expected() + " but found " + issue.actual());
        }
        logger.fine("[PlaceholderValidator] Checked " + checked + " entries against '" + source + "'");

        PlaceholderValidationReport report = new PlaceholderValidationReport(source, checked, issues, Severity.of(mode));
        if (mode.isStrict() && !issues.isEmpty()) {
            throw new PlaceholderValidationException(report);
        }
        return report;
    }

    /**
     * Source language: explicit value, else metadata {@code source_language},
     * else {@code en} when present, else the first language.
     *
     * @param resource Resource
     * @param explicit Explicit language, may be null
     * @return Source language as spelled in the resource when it occurs there
     */
    @NotNull
    public static String resolveSourceLanguage(@NotNull Resource resource, @Nullable String explicit) {
        String wanted = explicit;
        if (wanted == null || wanted.isBlank()) {
            wanted = resource.metadata(Resource.SOURCE_LANGUAGE);
        }

        Set<String> languages = resource.languages();
        if (wanted == null || wanted.isBlank()) {
            for (String language : languages) {
                if (LanguageCodes.matches(language, DEFAULT_SOURCE_LANGUAGE)) {
                    return language;
                }
            }
            return languages.isEmpty() ? DEFAULT_SOURCE_LANGUAGE : languages.iterator().next();
        }

        for (String language : languages) {
            if (LanguageCodes.matches(language, wanted)) {
                return language;
            }
        }
        return wanted;
    }

    /**
     * key -> signature of the source-language entry.
     */
    @NotNull
    static Map<String, PlaceholderSignature> sourceSignatures(@NotNull Resource resource, @NotNull String source) {
        Map<String, PlaceholderSignature> signatures = new LinkedHashMap<>();
        for (Entry entry : resource.entries()) {
            if (LanguageCodes.matches(entry.language(), source)) {
                signatures.putIfAbsent(entry.key(), PlaceholderExtractor.signature(entry.value()));
            }
        }
        return signatures;
    }
}
