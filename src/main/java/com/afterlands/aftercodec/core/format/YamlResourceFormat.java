package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.error.ResourceParseException;
import com.afterlands.aftercodec.api.error.ResourceWriteException;
import com.afterlands.aftercodec.api.format.ParseResult;
import com.afterlands.aftercodec.api.format.ReadOptions;
import com.afterlands.aftercodec.api.format.SerializeResult;
import com.afterlands.aftercodec.api.format.WriteOptions;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * YAML translation catalogs, one language per file.
 *
 * <h3>File Structure:</h3>
 * <pre>
 * # Simple translation
 * welcome: "Welcome!"
 *
 * # Nested sections are flattened with dots: menu.title, menu.exit
 * menu:
 *   title: "Main menu"
 *   exit: "Exit"
 *
 * # Plural forms (a section with 'other' and only category keys)
 * items:
 *   one: "%d item"
 *   other: "%d items"
 *
 * # Lists are joined with newlines
 * motd:
 *   - "Line 1"
 *   - "Line 2"
 * </pre>
 *
 * <p>A section holding {@code other} next to a non-category key is a nested section,
 * not a plural. The language comes from the read options. Output uses flat keys and
 * writes plural forms in category order.</p>
 */
public class YamlResourceFormat extends AbstractResourceFormat {

    public static final String TAG = "yaml";

    public YamlResourceFormat(@NotNull Logger logger, boolean debug) {
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
        return Set.of("yml", "yaml");
    }

    @Override
    public boolean supportsPlurals() {
        return true;
    }

    @Override
    public boolean multiLanguage() {
        return false;
    }

    @Override
    @NotNull
    public ParseResult parse(byte @NotNull [] source, @NotNull ReadOptions options) {
        List<String> warnings = new ArrayList<>();

        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(decodeUtf8(source));
        } catch (YAMLException e) {
            throw new ResourceParseException(TAG, "Malformed YAML: " + e.getMessage(), e);
        }

        String language = resolveReadLanguage(options, null, warnings);
        List<Entry> entries = new ArrayList<>();

        if (loaded != null) {
            if (!(loaded instanceof Map<?, ?> root)) {
                throw new ResourceParseException(TAG, "Top level must be a mapping of keys to translations");
            }
            loadSection(root, "", language, entries);
        }

        Set<String> seen = new HashSet<>();
        List<Entry> unique = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            if (seen.add(entry.key())) {
                unique.add(entry);
            } else {
                anomaly(options, warnings, "Key '" + entry.key() + "' is defined twice, keeping the first");
            }
        }
        entries = unique;

        if (debug) {
            logger.fine("[YamlResourceFormat] Loaded " + entries.size() + " translations [" + language + "]");
        }
        return new ParseResult(new Resource(Map.of(), entries), warnings);
    }

    /**
     * Recursively loads a section.
     */
    private void loadSection(
            @NotNull Map<?, ?> section,
            @NotNull String currentPath,
            @NotNull String language,
            @NotNull List<Entry> entries
    ) {
        for (Map.Entry<?, ?> item : section.entrySet()) {
            String key = String.valueOf(item.getKey());
            String fullKey = currentPath.isEmpty() ? key : currentPath + "." + key;
            Object value = item.getValue();

            if (value instanceof Map<?, ?> subsection) {
                Map<PluralCategory, String> pluralForms = parsePluralForms(subsection);
                if (pluralForms != null) {
                    entries.add(entry(fullKey, language, Translation.plural(pluralForms)));
                } else {
                    loadSection(subsection, fullKey, language, entries);
                }
            } else if (value instanceof List<?> lines) {
                List<String> text = new ArrayList<>(lines.size());
                for (Object line : lines) {
                    text.add(line == null ? "" : String.valueOf(line));
                }
                entries.add(entry(fullKey, language, Translation.singular(String.join("\n", text))));
            } else if (value == null) {
                entries.add(entry(fullKey, language, Translation.singular("")));
            } else {
                if (debug && !(value instanceof String)) {
                    logger.fine("[YamlResourceFormat] Coercing " + value.getClass().getSimpleName() + " at '" + fullKey + "' to text");
                }
                entries.add(entry(fullKey, language, Translation.singular(String.valueOf(value))));
            }
        }
    }

    @NotNull
    private static Entry entry(@NotNull String key, @NotNull String language, @NotNull Translation value) {
        EntryStatus status = value.primaryText().isEmpty() && !value.isPlural() ? EntryStatus.NEW : EntryStatus.TRANSLATED;
        return new Entry(key, language, value, status, null, Map.of());
    }

    /**
     * Plural forms of a section, or null when the section is a nested structure.
     *
     * <p>A plural section contains {@code other} and nothing but category keys with text values.</p>
     */
    @Nullable
    private static Map<PluralCategory, String> parsePluralForms(@NotNull Map<?, ?> section) {
        if (!section.containsKey(PluralCategory.OTHER.getKey())) {
            return null;
        }

        Map<PluralCategory, String> forms = new EnumMap<>(PluralCategory.class);
        for (Map.Entry<?, ?> item : section.entrySet()) {
            PluralCategory category = PluralCategory.fromKey(String.valueOf(item.getKey()));
            if (category == null || !(item.getValue() instanceof String text)) {
                return null;
            }
            forms.put(category, text);
        }
        return forms;
    }

    @Override
    @NotNull
    public SerializeResult serialize(@NotNull Resource resource, @NotNull WriteOptions options) {
        List<String> warnings = new ArrayList<>();
        String language = resolveWriteLanguage(resource, options);

        Map<String, Object> document = new LinkedHashMap<>();
        for (Entry entry : resource.entriesFor(language)) {
            if (entry.value() instanceof Translation.Plural plural) {
                if (!plural.categories().contains(PluralCategory.OTHER)) {
                    String message = "Plural '" + entry.key() + "' has no 'other' form and would read back as a nested section";
                    if (options.strict()) {
                        throw new ResourceWriteException(TAG, message);
                    }
                    warn(warnings, message);
                }
                Map<String, String> forms = new LinkedHashMap<>();
                for (Map.Entry<PluralCategory, String> form : plural.forms().entrySet()) {
                    forms.put(form.getKey().getKey(), form.getValue());
                }
                document.put(entry.key(), forms);
            } else {
                document.put(entry.key(), entry.value().primaryText());
            }
        }

        String text = document.isEmpty() ? "{}\n" : newDumper().dump(document);
        return new SerializeResult(text.getBytes(StandardCharsets.UTF_8), warnings);
    }

    @NotNull
    private static Yaml newDumper() {
        DumperOptions dumper = new DumperOptions();
        dumper.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumper.setIndent(2);
        dumper.setAllowUnicode(true);
        dumper.setWidth(Integer.MAX_VALUE);
        dumper.setSplitLines(false);
        return new Yaml(new Representer(dumper), dumper);
    }
}
