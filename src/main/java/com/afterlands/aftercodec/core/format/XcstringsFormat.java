package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.error.ResourceParseException;
import com.afterlands.aftercodec.api.format.ParseResult;
import com.afterlands.aftercodec.api.format.ReadOptions;
import com.afterlands.aftercodec.api.format.SerializeResult;
import com.afterlands.aftercodec.api.format.WriteOptions;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.core.language.LanguageCodes;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Xcode string catalogs ({@code .xcstrings}), a multi-language JSON format.
 *
 * <h3>Structure:</h3>
 * <pre>{@code
 * {
 *   "sourceLanguage" : "en",
 *   "version" : "1.0",
 *   "strings" : {
 *     "greeting" : {
 *       "comment" : "Shown on launch",
 *       "extractionState" : "manual",
 *       "localizations" : {
 *         "en" : { "stringUnit" : { "state" : "translated", "value" : "Hello" } },
 *         "fr" : { "stringUnit" : { "state" : "needs_review", "value" : "Bonjour" } }
 *       }
 *     },
 *     "items" : {
 *       "localizations" : {
 *         "en" : { "variations" : { "plural" : {
 *           "one" : { "stringUnit" : { "state" : "translated", "value" : "%lld item" } },
 *           "other" : { "stringUnit" : { "state" : "translated", "value" : "%lld items" } }
 *         } } }
 *       }
 *     }
 *   }
 * }
 * }</pre>
 *
 * <h3>Mapping:</h3>
 * <ul>
 *     <li>{@code sourceLanguage} -> metadata {@code source_language}</li>
 *     <li>{@code version} -> metadata {@code format_version}</li>
 *     <li>{@code extractionState} -> entry custom {@code extraction_state}</li>
 *     <li>{@code shouldTranslate: false} -> DO_NOT_TRANSLATE</li>
 *     <li>a key without localizations -> empty NEW entry in the source language</li>
 * </ul>
 */
public class XcstringsFormat extends AbstractResourceFormat {

    public static final String TAG = "xcstrings";

    public static final String EXTRACTION_STATE = "extraction_state";
    public static final String COMMENT_AUTO_GENERATED = "is_comment_auto_generated";

    private static final String DEFAULT_VERSION = "1.0";

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public XcstringsFormat(@NotNull Logger logger, boolean debug) {
        super(logger, debug);
    }

    @Override
    @NotNull
    public String tag() {
        return TAG;
    }

    @Override
    @NotNull
    public Set<String> fileExtensions() {
        return Set.of("xcstrings");
    }

    @Override
    public boolean supportsPlurals() {
        return true;
    }

    @Override
    public boolean multiLanguage() {
        return true;
    }

    @Override
    @NotNull
    public ParseResult parse(byte @NotNull [] source, @NotNull ReadOptions options) {
        List<String> warnings = new ArrayList<>();

        JsonObject root;
        try {
            JsonElement element = JsonParser.parseString(decodeUtf8(source));
            if (!element.isJsonObject()) {
                throw new ResourceParseException(TAG, "Top level must be a JSON object");
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new ResourceParseException(TAG, "Malformed JSON: " + e.getMessage(), e);
        }

        String sourceLanguage = string(root, "sourceLanguage");
        if (sourceLanguage == null || sourceLanguage.isBlank()) {
            sourceLanguage = resolveReadLanguage(options, null, warnings);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(Resource.SOURCE_LANGUAGE, sourceLanguage);
        metadata.put(Resource.FORMAT_VERSION, orDefault(string(root, "version"), DEFAULT_VERSION));

        List<Entry> entries = new ArrayList<>();
        JsonObject strings = object(root, "strings");
        if (strings != null) {
            for (Map.Entry<String, JsonElement> item : strings.entrySet()) {
                if (!item.getValue().isJsonObject()) {
                    anomaly(options, warnings, "String '" + item.getKey() + "' is not an object, skipped");
                    continue;
                }
                readItem(item.getKey(), item.getValue().getAsJsonObject(), sourceLanguage, entries, options, warnings);
            }
        }

        if (debug) {
            logger.fine("[XcstringsFormat] Parsed " + entries.size() + " entries, source language " + sourceLanguage);
        }
        return new ParseResult(new Resource(metadata, entries), warnings);
    }

    private void readItem(
            @NotNull String key,
            @NotNull JsonObject item,
            @NotNull String sourceLanguage,
            @NotNull List<Entry> entries,
            @NotNull ReadOptions options,
            @NotNull List<String> warnings
    ) {
        String comment = string(item, "comment");
        Boolean shouldTranslateFlag = bool(item, "shouldTranslate", key, options, warnings);
        boolean shouldTranslate = shouldTranslateFlag == null || shouldTranslateFlag;

        Map<String, String> custom = new LinkedHashMap<>();
        String extractionState = string(item, "extractionState");
        if (extractionState != null) {
            custom.put(EXTRACTION_STATE, extractionState);
        }
        Boolean autoGenerated = bool(item, "isCommentAutoGenerated", key, options, warnings);
        if (autoGenerated != null) {
            custom.put(COMMENT_AUTO_GENERATED, String.valueOf(autoGenerated));
        }

        JsonObject localizations = object(item, "localizations");
        if (localizations == null || localizations.size() == 0) {
            EntryStatus status = shouldTranslate ? EntryStatus.NEW : EntryStatus.DO_NOT_TRANSLATE;
            entries.add(new Entry(key, sourceLanguage, Translation.singular(""), status, comment, custom));
            return;
        }

        for (Map.Entry<String, JsonElement> localization : localizations.entrySet()) {
            String language = localization.getKey();
            if (!localization.getValue().isJsonObject()) {
                anomaly(options, warnings, "Localization '" + key + "' [" + language + "] is not an object, skipped");
                continue;
            }
            JsonObject body = localization.getValue().getAsJsonObject();

            Translation value;
            String state;
            JsonObject unit = object(body, "stringUnit");
            JsonObject plural = object(object(body, "variations"), "plural");
            if (unit != null) {
                value = Translation.singular(orDefault(string(unit, "value"), ""));
                state = string(unit, "state");
            } else if (plural != null) {
                Map<PluralCategory, String> forms = new EnumMap<>(PluralCategory.class);
                state = null;
                for (Map.Entry<String, JsonElement> form : plural.entrySet()) {
                    PluralCategory category = PluralCategory.fromKey(form.getKey());
                    JsonObject formUnit = form.getValue().isJsonObject()
                            ? object(form.getValue().getAsJsonObject(), "stringUnit")
                            : null;
                    if (category == null || formUnit == null) {
                        anomaly(options, warnings, "Plural '" + key + "' [" + language + "] has invalid form '" + form.getKey() + "', skipped");
                        continue;
                    }
                    forms.put(category, orDefault(string(formUnit, "value"), ""));
                    if (state == null) {
                        state = string(formUnit, "state");
                    }
                }
                if (forms.isEmpty()) {
                    anomaly(options, warnings, "Plural '" + key + "' [" + language + "] has no forms, skipped");
                    continue;
                }
                value = Translation.plural(forms);
            } else {
                if (debug) {
                    logger.fine("[XcstringsFormat] Unsupported localization shape for '" + key + "' [" + language + "]");
                }
                continue;
            }

            EntryStatus status = shouldTranslate ? status(state, key, options, warnings) : EntryStatus.DO_NOT_TRANSLATE;
            entries.add(new Entry(key, language, value, status, comment, custom));
        }
    }

    @NotNull
    private EntryStatus status(@Nullable String state, @NotNull String key, @NotNull ReadOptions options, @NotNull List<String> warnings) {
        if (state == null) {
            return EntryStatus.TRANSLATED;
        }
        EntryStatus status = EntryStatus.fromKey(state);
        if (status == null || status == EntryStatus.DO_NOT_TRANSLATE) {
            anomaly(options, warnings, "Unknown state '" + state + "' for '" + key + "', treated as translated");
            return EntryStatus.TRANSLATED;
        }
        return status;
    }

    @Override
    @NotNull
    public SerializeResult serialize(@NotNull Resource resource, @NotNull WriteOptions options) {
        String sourceLanguage = resource.metadata(Resource.SOURCE_LANGUAGE);
        if (sourceLanguage == null || sourceLanguage.isBlank()) {
            sourceLanguage = options.language() != null
                    ? options.language()
                    : resource.languages().stream().findFirst().orElse(LanguageCodes.UNDETERMINED);
        }

        JsonObject root = new JsonObject();
        root.addProperty("sourceLanguage", sourceLanguage);

        Map<String, List<Entry>> byKey = new LinkedHashMap<>();
        for (Entry entry : resource.entries()) {
            byKey.computeIfAbsent(entry.key(), k -> new ArrayList<>()).add(entry);
        }

        JsonObject strings = new JsonObject();
        for (Map.Entry<String, List<Entry>> group : byKey.entrySet()) {
            strings.add(group.getKey(), writeItem(group.getValue()));
        }
        root.add("strings", strings);
        root.addProperty("version", orDefault(resource.metadata(Resource.FORMAT_VERSION), DEFAULT_VERSION));

        String json = gson.toJson(root) + "\n";
        return new SerializeResult(json.getBytes(StandardCharsets.UTF_8), List.of());
    }

    @NotNull
    private JsonObject writeItem(@NotNull List<Entry> entries) {
        JsonObject item = new JsonObject();
        Entry first = entries.get(0);

        String comment = entries.stream().map(Entry::comment).filter(c -> c != null).findFirst().orElse(null);
        if (comment != null) {
            item.addProperty("comment", comment);
        }
        String extractionState = first.custom().get(EXTRACTION_STATE);
        if (extractionState != null) {
            item.addProperty("extractionState", extractionState);
        }
        String autoGenerated = first.custom().get(COMMENT_AUTO_GENERATED);
        if (autoGenerated != null) {
            item.addProperty("isCommentAutoGenerated", Boolean.parseBoolean(autoGenerated));
        }

        JsonObject localizations = new JsonObject();
        boolean doNotTranslate = false;
        for (Entry entry : entries) {
            if (entry.status() == EntryStatus.DO_NOT_TRANSLATE) {
                doNotTranslate = true;
                if (entry.value().primaryText().isEmpty() && !entry.value().isPlural()) {
                    continue;
                }
            }
            String state = entry.status() == EntryStatus.DO_NOT_TRANSLATE
                    ? EntryStatus.TRANSLATED.getKey()
                    : entry.status().getKey();

            JsonObject localization = new JsonObject();
            if (entry.value() instanceof Translation.Plural plural) {
                JsonObject forms = new JsonObject();
                for (Map.Entry<PluralCategory, String> form : plural.forms().entrySet()) {
                    JsonObject formBody = new JsonObject();
                    formBody.add("stringUnit", stringUnit(state, form.getValue()));
                    forms.add(form.getKey().getKey(), formBody);
                }
                JsonObject variations = new JsonObject();
                variations.add("plural", forms);
                localization.add("variations", variations);
            } else {
                localization.add("stringUnit", stringUnit(state, entry.value().primaryText()));
            }
            localizations.add(entry.language(), localization);
        }

        if (localizations.size() > 0) {
            item.add("localizations", localizations);
        }
        if (doNotTranslate) {
            item.addProperty("shouldTranslate", false);
        }
        return item;
    }

    @NotNull
    private static JsonObject stringUnit(@NotNull String state, @NotNull String value) {
        JsonObject unit = new JsonObject();
        unit.addProperty("state", state);
        unit.addProperty("value", value);
        return unit;
    }

    @Nullable
    private static String string(@Nullable JsonObject object, @NotNull String member) {
        if (object == null || !object.has(member) || !object.get(member).isJsonPrimitive()) {
            return null;
        }
        return object.get(member).getAsString();
    }

    /**
     * Boolean member, or null when absent. A present member that is not a JSON
     * boolean is an anomaly and reads as absent.
     */
    @Nullable
    private Boolean bool(
            @NotNull JsonObject object,
            @NotNull String member,
            @NotNull String key,
            @NotNull ReadOptions options,
            @NotNull List<String> warnings
    ) {
        if (!object.has(member)) {
            return null;
        }
        JsonElement value = object.get(member);
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
            return value.getAsBoolean();
        }
        anomaly(options, warnings, "String '" + key + "' has a non-boolean '" + member + "', ignored");
        return null;
    }

    @Nullable
    private static JsonObject object(@Nullable JsonObject object, @NotNull String member) {
        if (object == null || !object.has(member) || !object.get(member).isJsonObject()) {
            return null;
        }
        return object.getAsJsonObject(member);
    }

    @NotNull
    private static String orDefault(@Nullable String value, @NotNull String fallback) {
        return value != null ? value : fallback;
    }
}
