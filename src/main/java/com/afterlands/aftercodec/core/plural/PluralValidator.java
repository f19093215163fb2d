package com.afterlands.aftercodec.core.plural;

import com.afterlands.aftercodec.api.error.PluralValidationException;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.api.report.PluralIssue;
import com.afterlands.aftercodec.api.report.PluralValidationReport;
import com.afterlands.aftercodec.api.report.Severity;
import com.afterlands.aftercodec.api.report.ShapeMismatch;
import com.afterlands.aftercodec.api.report.ValidationMode;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Checks that plural entries populate every category their language requires.
 *
 * <p>Also reports keys whose shape (Singular vs Plural) differs between languages.
 * Shapes are never coerced.</p>
 *
 * <h3>Examples:</h3>
 * <pre>
 * en  {other}        -> missing [one]
 * pl  {one, other}   -> missing [few, many]
 * ja  {other}        -> complete
 * </pre>
 */
public class PluralValidator {

    private final PluralCategoryTable table;
    private final Logger logger;

    public PluralValidator(@NotNull PluralCategoryTable table, @NotNull Logger logger) {
        this.table = Objects.requireNonNull(table, "table cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
    }

    /**
     * Required categories the entry does not populate.
     *
     * @param entry Entry to check
     * @param table Category table
     * @return Missing categories; empty for Singular values
     */
    @NotNull
    public static Set<PluralCategory> missingCategories(@NotNull Entry entry, @NotNull PluralCategoryTable table) {
        if (!(entry.value() instanceof Translation.Plural plural)) {
            return EnumSet.noneOf(PluralCategory.class);
        }
        Set<PluralCategory> missing = EnumSet.noneOf(PluralCategory.class);
        missing.addAll(table.requiredCategories(entry.language()));
        missing.removeAll(plural.categories());
        return missing;
    }

    /**
     * Validates every Plural entry of a resource.
     *
     * @param resource Resource to check
     * @param mode STRICT throws when categories are missing
     * @return Report (severity follows the mode)
     * @throws PluralValidationException in STRICT mode when any entry is incomplete
     */
    @NotNull
    public PluralValidationReport validate(@NotNull Resource resource, @NotNull ValidationMode mode) {
        Objects.requireNonNull(resource, "resource cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");

        List<PluralIssue> issues = new ArrayList<>();
        int checked = 0;

        for (Entry entry : resource.entries()) {
            if (!(entry.value() instanceof Translation.Plural plural)) {
                continue;
            }
            checked++;
            Set<PluralCategory> missing = missingCategories(entry, table);
            if (!missing.isEmpty()) {
                issues.add(new PluralIssue(entry.key(), entry.language(), missing, plural.categories()));
            }
        }

        List<ShapeMismatch> shapeMismatches = shapeMismatches(resource);
        PluralValidationReport report = new PluralValidationReport(checked, issues, shapeMismatches, Severity.of(mode));

        if (!report.isClean()) {
            for (PluralIssue issue : issues) {
                logger.warning("[PluralValidator] " + issue.key() + " [" + issue.language() + "] missing "
                        + issue.missing() + " (has " + issue.present() + ")");
            }
            for (ShapeMismatch mismatch : shapeMismatches) {
                logger.warning("[PluralValidator] " + mismatch.key() + " is singular in "
                        + mismatch.singularLanguages() + " but plural in " + mismatch.pluralLanguages());
            }
        }
        logger.fine("[PluralValidator] Checked " + checked + " plural entries, " + issues.size() + " incomplete");

        if (mode.isStrict() && !issues.isEmpty()) {
            throw new PluralValidationException(report);
        }
        return report;
    }

    @NotNull
    private static List<ShapeMismatch> shapeMismatches(@NotNull Resource resource) {
        Map<String, List<String>> singular = new LinkedHashMap<>();
        Map<String, List<String>> plural = new LinkedHashMap<>();
        for (Entry entry : resource.entries()) {
            Map<String, List<String>> bucket = entry.value().isPlural() ? plural : singular;
            bucket.computeIfAbsent(entry.key(), k -> new ArrayList<>()).add(entry.language());
        }

        List<ShapeMismatch> mismatches = new ArrayList<>();
        for (String key : resource.keys()) {
            if (singular.containsKey(key) && plural.containsKey(key)) {
                mismatches.add(new ShapeMismatch(key, singular.get(key), plural.get(key)));
            }
        }
        return mismatches;
    }
}
