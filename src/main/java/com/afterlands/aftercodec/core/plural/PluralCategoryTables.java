package com.afterlands.aftercodec.core.plural;

import com.afterlands.aftercodec.api.model.PluralCategory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads {@link MapPluralCategoryTable}s from YAML.
 *
 * <h3>File format:</h3>
 * <pre>
 * default: [other]
 * groups:
 *   - categories: [one, other]
 *     languages: [en, de, pt]
 *   - categories: [one, few, many, other]
 *     languages: [ru, pl]
 * languages:          # optional, single-language entries
 *   cy: [zero, one, two, few, many, other]
 * </pre>
 *
 * <p>Entries under {@code languages} take precedence over {@code groups}.</p>
 */
public final class PluralCategoryTables {

    /**
     * Classpath location of the bundled CLDR-derived table.
     */
    public static final String BUNDLED_RESOURCE = "plural-categories.yml";

    private static volatile MapPluralCategoryTable bundled;

    private PluralCategoryTables() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * The bundled table, loaded once from the classpath.
     *
     * @return Bundled table
     */
    @NotNull
    public static MapPluralCategoryTable bundled() {
        MapPluralCategoryTable table = bundled;
        if (table == null) {
            synchronized (PluralCategoryTables.class) {
                table = bundled;
                if (table == null) {
                    table = loadBundled();
                    bundled = table;
                }
            }
        }
        return table;
    }

    /**
     * Loads a table file and lays it over the bundled table.
     *
     * @param file YAML file
     * @return Bundled table with the file's languages overriding it
     * @throws IOException if the file cannot be read
     */
    @NotNull
    public static MapPluralCategoryTable bundledWithOverrides(@NotNull Path file) throws IOException {
        return bundled().overriddenBy(load(file));
    }

    /**
     * Loads a table from a YAML file.
     *
     * @param file YAML file
     * @return Parsed table
     * @throws IOException if the file cannot be read
     */
    @NotNull
    public static MapPluralCategoryTable load(@NotNull Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, file.toString());
        }
    }

    @NotNull
    private static MapPluralCategoryTable loadBundled() {
        InputStream in = PluralCategoryTables.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Missing classpath resource " + BUNDLED_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + BUNDLED_RESOURCE, e);
        }
    }

    @NotNull
    static MapPluralCategoryTable parse(@NotNull Reader reader, @NotNull String origin) {
        Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        if (!(loaded instanceof Map<?, ?> root)) {
            throw new IllegalArgumentException(origin + ": expected a mapping at the top level");
        }

        Set<PluralCategory> defaults = root.containsKey("default")
                ? categories(root.get("default"), origin + ": default")
                : EnumSet.of(PluralCategory.OTHER);

        Map<String, Set<PluralCategory>> table = new LinkedHashMap<>();

        Object groups = root.get("groups");
        if (groups instanceof List<?> groupList) {
            for (Object group : groupList) {
                if (!(group instanceof Map<?, ?> groupMap)) {
                    throw new IllegalArgumentException(origin + ": group must be a mapping");
                }
                Set<PluralCategory> categories = categories(groupMap.get("categories"), origin + ": group");
                Object languages = groupMap.get("languages");
                if (!(languages instanceof List<?> languageList)) {
                    throw new IllegalArgumentException(origin + ": group needs a 'languages' list");
                }
                for (Object language : languageList) {
                    table.put(String.valueOf(language), categories);
                }
            }
        }

        Object languages = root.get("languages");
        if (languages instanceof Map<?, ?> languageMap) {
            for (Map.Entry<?, ?> entry : languageMap.entrySet()) {
                String language = String.valueOf(entry.getKey());
                table.put(language, categories(entry.getValue(), origin + ": " + language));
            }
        }

        return new MapPluralCategoryTable(table, defaults);
    }

    @NotNull
    private static Set<PluralCategory> categories(@Nullable Object value, @NotNull String where) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException(where + ": expected a non-empty list of plural categories");
        }
        Set<PluralCategory> categories = EnumSet.noneOf(PluralCategory.class);
        for (Object item : list) {
            PluralCategory category = PluralCategory.fromKey(String.valueOf(item));
            if (category == null) {
                throw new IllegalArgumentException(where + ": unknown plural category '" + item + "'");
            }
            categories.add(category);
        }
        return categories;
    }
}
