package com.afterlands.aftercodec.core.report;

import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.PlaceholderType;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.api.report.ChangedEntry;
import com.afterlands.aftercodec.api.report.DiffReport;
import com.afterlands.aftercodec.api.report.LanguageDiff;
import com.afterlands.aftercodec.api.report.LanguageSyncSummary;
import com.afterlands.aftercodec.api.report.PlaceholderIssue;
import com.afterlands.aftercodec.api.report.PlaceholderValidationReport;
import com.afterlands.aftercodec.api.report.PluralIssue;
import com.afterlands.aftercodec.api.report.PluralValidationReport;
import com.afterlands.aftercodec.api.report.ShapeMismatch;
import com.afterlands.aftercodec.api.report.SyncIssue;
import com.afterlands.aftercodec.api.report.SyncReport;
import com.afterlands.aftercodec.core.stats.LanguageStats;
import com.afterlands.aftercodec.core.stats.ResourceStats;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Renders reports as JSON documents.
 *
 * <p>Each {@code toJson} method builds a {@link JsonObject} tree; {@code render}
 * methods serialize it with pretty printing.</p>
 *
 * <h3>Diff shape:</h3>
 * <pre>{@code
 * {
 *   "fr": {
 *     "added": ["new_key"],
 *     "removed": ["old_key"],
 *     "changed": [{ "key": "title", "before": "Titre", "after": "Le titre" }]
 *   }
 * }
 * }</pre>
 */
public class ReportJsonRenderer {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    // ══════════════════════════════════════════════
    // DIFF
    // ══════════════════════════════════════════════

    @NotNull
    public String render(@NotNull DiffReport report) {
        return gson.toJson(toJson(report));
    }

    @NotNull
    public JsonObject toJson(@NotNull DiffReport report) {
        JsonObject root = new JsonObject();
        for (LanguageDiff diff : report.languages().values()) {
            JsonObject language = new JsonObject();
            language.add("added", strings(diff.added()));
            language.add("removed", strings(diff.removed()));

            JsonArray changed = new JsonArray();
            for (ChangedEntry entry : diff.changed()) {
                JsonObject change = new JsonObject();
                change.addProperty("key", entry.key());
                change.add("before", translation(entry.before()));
                change.add("after", translation(entry.after()));
                if (entry.statusChanged()) {
                    change.addProperty("before_status", entry.beforeStatus().getKey());
                    change.addProperty("after_status", entry.afterStatus().getKey());
                }
                changed.add(change);
            }
            language.add("changed", changed);
            root.add(diff.language(), language);
        }
        return root;
    }

    // ══════════════════════════════════════════════
    // SYNC
    // ══════════════════════════════════════════════

    @NotNull
    public String render(@NotNull SyncReport report) {
        return gson.toJson(toJson(report));
    }

    @NotNull
    public JsonObject toJson(@NotNull SyncReport report) {
        JsonObject root = new JsonObject();
        root.addProperty("match_language", report.matchLanguage());

        JsonObject totals = new JsonObject();
        totals.addProperty("matched", report.totalMatched());
        totals.addProperty("updated", report.totalUpdated());
        totals.addProperty("unchanged", report.totalUnchanged());
        totals.addProperty("fallback_matches", report.totalFallbackMatches());
        root.add("totals", totals);

        JsonObject languages = new JsonObject();
        for (LanguageSyncSummary summary : report.languages().values()) {
            JsonObject language = new JsonObject();
            language.addProperty("matched", summary.matched());
            language.addProperty("updated", summary.updated());
            language.addProperty("unchanged", summary.unchanged());
            language.addProperty("fallback_matches", summary.fallbackMatches());
            language.add("unmatched", strings(summary.unmatched()));
            language.add("ambiguous", strings(summary.ambiguous()));
            language.add("missing_language", strings(summary.missingLanguage()));
            language.add("type_mismatch", strings(summary.typeMismatch()));
            languages.add(summary.language(), language);
        }
        root.add("languages", languages);

        JsonArray issues = new JsonArray();
        for (SyncIssue issue : report.issues()) {
            JsonObject json = new JsonObject();
            json.addProperty("kind", issue.kind().name().toLowerCase(Locale.ROOT));
            json.addProperty("language", issue.language());
            json.addProperty("target_key", issue.targetKey());
            if (issue.sourceKey() != null) {
                json.addProperty("source_key", issue.sourceKey());
            }
            if (!issue.candidates().isEmpty()) {
                json.add("candidates", strings(issue.candidates()));
            }
            issues.add(json);
        }
        root.add("issues", issues);
        return root;
    }

    // ══════════════════════════════════════════════
    // VALIDATION
    // ══════════════════════════════════════════════

    @NotNull
    public String render(@NotNull PluralValidationReport report) {
        return gson.toJson(toJson(report));
    }

    @NotNull
    public JsonObject toJson(@NotNull PluralValidationReport report) {
        JsonObject root = new JsonObject();
        root.addProperty("checked", report.checked());
        root.addProperty("severity", report.severity().name().toLowerCase(Locale.ROOT));

        JsonArray issues = new JsonArray();
        for (PluralIssue issue : report.issues()) {
            JsonObject json = new JsonObject();
            json.addProperty("key", issue.key());
            json.addProperty("language", issue.language());
            json.add("missing", categories(issue.missing()));
            json.add("present", categories(issue.present()));
            issues.add(json);
        }
        root.add("issues", issues);

        JsonArray mismatches = new JsonArray();
        for (ShapeMismatch mismatch : report.shapeMismatches()) {
            JsonObject json = new JsonObject();
            json.addProperty("key", mismatch.key());
            json.add("singular", strings(mismatch.singularLanguages()));
            json.add("plural", strings(mismatch.pluralLanguages()));
            mismatches.add(json);
        }
        root.add("shape_mismatches", mismatches);
        return root;
    }

    @NotNull
    public String render(@NotNull PlaceholderValidationReport report) {
        return gson.toJson(toJson(report));
    }

    @NotNull
    public JsonObject toJson(@NotNull PlaceholderValidationReport report) {
        JsonObject root = new JsonObject();
        root.addProperty("source_language", report.sourceLanguage());
        root.addProperty("checked", report.checked());
        root.addProperty("severity", report.severity().name().toLowerCase(Locale.ROOT));

        JsonArray issues = new JsonArray();
        for (PlaceholderIssue issue : report.issues()) {
            JsonObject json = new JsonObject();
            json.addProperty("key", issue.key());
            json.addProperty("language", issue.language());
            json.add("expected", signature(issue.expected().arguments()));
            json.add("actual", signature(issue.actual().arguments()));
            json.add("missing", signature(issue.missing()));
            json.add("extra", signature(issue.extra()));
            JsonArray typeChanged = new JsonArray();
            issue.typeChanged().forEach(typeChanged::add);
            json.add("type_changed", typeChanged);
            issues.add(json);
        }
        root.add("issues", issues);
        return root;
    }

    // ══════════════════════════════════════════════
    // STATS
    // ══════════════════════════════════════════════

    @NotNull
    public String render(@NotNull ResourceStats stats) {
        return gson.toJson(toJson(stats));
    }

    @NotNull
    public JsonObject toJson(@NotNull ResourceStats stats) {
        JsonObject summary = new JsonObject();
        summary.addProperty("languages", stats.languages().size());
        summary.addProperty("unique_keys", stats.uniqueKeys());

        JsonArray languages = new JsonArray();
        for (LanguageStats language : stats.languages()) {
            JsonObject json = new JsonObject();
            json.addProperty("language", language.language());
            json.addProperty("total", language.total());
            JsonObject byStatus = new JsonObject();
            for (Map.Entry<EntryStatus, Integer> count : language.byStatus().entrySet()) {
                byStatus.addProperty(count.getKey().getKey(), count.getValue());
            }
            json.add("by_status", byStatus);
            json.addProperty("completion_percent", language.completionPercent());
            json.addProperty("missing_plural_entries", language.missingPluralEntries());
            json.addProperty("missing_plural_categories_total", language.missingPluralCategories());
            languages.add(json);
        }

        JsonObject root = new JsonObject();
        root.add("summary", summary);
        root.add("languages", languages);
        return root;
    }

    // ══════════════════════════════════════════════
    // HELPERS
    // ══════════════════════════════════════════════

    /**
     * Singular renders as a string, Plural as a category object.
     */
    @NotNull
    private static JsonElement translation(@NotNull Translation value) {
        if (value instanceof Translation.Plural plural) {
            JsonObject forms = new JsonObject();
            for (Map.Entry<PluralCategory, String> form : plural.forms().entrySet()) {
                forms.addProperty(form.getKey().getKey(), form.getValue());
            }
            return forms;
        }
        return new JsonPrimitive(value.primaryText());
    }

    @NotNull
    private static JsonArray strings(@NotNull Collection<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    @NotNull
    private static JsonArray categories(@NotNull Collection<PluralCategory> values) {
        JsonArray array = new JsonArray();
        for (PluralCategory category : values) {
            array.add(category.getKey());
        }
        return array;
    }

    @NotNull
    private static JsonObject signature(@NotNull Map<Integer, PlaceholderType> arguments) {
        JsonObject json = new JsonObject();
        for (Map.Entry<Integer, PlaceholderType> argument : arguments.entrySet()) {
            json.addProperty(String.valueOf(argument.getKey()), argument.getValue().getKey());
        }
        return json;
    }
}
