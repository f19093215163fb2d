package com.afterlands.aftercodec.config;

import com.afterlands.aftercodec.api.report.ValidationMode;
import com.afterlands.aftercodec.core.merge.MergeStrategy;
import com.afterlands.aftercodec.core.placeholder.PlaceholderStyle;
import com.afterlands.aftercodec.core.sync.SyncOptions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Toolkit configuration loaded from YAML.
 *
 * <h3>Layout:</h3>
 * <pre>{@code
 * strict: false
 * debug: false
 * merge:
 *   strategy: last
 * sync:
 *   match-language: ""
 *   fail-on-unmatched: false
 *   fail-on-ambiguous: false
 *   record-provenance: true
 * placeholders:
 *   source-language: ""
 *   style: apple
 * plural-table: ""
 * }</pre>
 *
 * <p>Missing keys take the defaults shown above. Blank strings mean "not set".
 * An unknown merge strategy or placeholder style is logged and replaced by the default.</p>
 *
 * @author AfterLands Team
 * @since 1.0.0
 */
public class AfterCodecConfig {

    /**
     * Classpath location of the bundled defaults.
     */
    public static final String BUNDLED_RESOURCE = "aftercodec.yml";

    private static final Logger LOGGER = Logger.getLogger("AfterCodec");

    private final boolean strict;
    private final boolean debug;

    // Merge
    private final MergeStrategy mergeStrategy;

    // Sync
    private final String matchLanguage;
    private final boolean failOnUnmatched;
    private final boolean failOnAmbiguous;
    private final boolean recordProvenance;

    // Placeholders
    private final String placeholderSourceLanguage;
    private final PlaceholderStyle placeholderStyle;

    private final String pluralTable;

    /**
     * Creates a config from a parsed YAML mapping.
     *
     * @param root Top-level mapping (may be empty)
     */
    public AfterCodecConfig(@NotNull Map<?, ?> root) {
        this.strict = bool(root, "strict", false);
        this.debug = bool(root, "debug", false);

        Map<?, ?> merge = section(root, "merge");
        this.mergeStrategy = parseMergeStrategy(string(merge, "strategy"));

        Map<?, ?> sync = section(root, "sync");
        this.matchLanguage = string(sync, "match-language");
        this.failOnUnmatched = bool(sync, "fail-on-unmatched", false);
        this.failOnAmbiguous = bool(sync, "fail-on-ambiguous", false);
        this.recordProvenance = bool(sync, "record-provenance", true);

        Map<?, ?> placeholders = section(root, "placeholders");
        this.placeholderSourceLanguage = string(placeholders, "source-language");
        this.placeholderStyle = parsePlaceholderStyle(string(placeholders, "style"));

        this.pluralTable = string(root, "plural-table");
    }

    /**
     * Configuration with every default.
     */
    @NotNull
    public static AfterCodecConfig defaults() {
        return new AfterCodecConfig(Collections.emptyMap());
    }

    /**
     * Loads the bundled {@value #BUNDLED_RESOURCE}.
     *
     * @return Bundled configuration
     */
    @NotNull
    public static AfterCodecConfig bundled() {
        InputStream in = AfterCodecConfig.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE);
        if (in == null) {
            LOGGER.warning("[AfterCodecConfig] Missing classpath resource " + BUNDLED_RESOURCE + ", using defaults");
            return defaults();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + BUNDLED_RESOURCE, e);
        }
    }

    /**
     * Loads a configuration file.
     *
     * @param file YAML file
     * @return Parsed configuration
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is not valid YAML or not a mapping
     */
    @NotNull
    public static AfterCodecConfig load(@NotNull Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, file.toString());
        }
    }

    @NotNull
    static AfterCodecConfig parse(@NotNull Reader reader, @NotNull String origin) {
        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (YAMLException e) {
            throw new IllegalArgumentException(origin + ": invalid YAML: " + e.getMessage(), e);
        }
        if (loaded == null) {
            return defaults();
        }
        if (!(loaded instanceof Map<?, ?> root)) {
            throw new IllegalArgumentException(origin + ": expected a mapping at the top level");
        }
        return new AfterCodecConfig(root);
    }

    @NotNull
    private static MergeStrategy parseMergeStrategy(@Nullable String value) {
        if (value == null) {
            return MergeStrategy.LAST;
        }
        MergeStrategy strategy = MergeStrategy.fromKey(value);
        if (strategy == null) {
            LOGGER.warning("[AfterCodecConfig] Unknown merge strategy '" + value + "', using 'last'");
            return MergeStrategy.LAST;
        }
        return strategy;
    }

    @NotNull
    private static PlaceholderStyle parsePlaceholderStyle(@Nullable String value) {
        if (value == null) {
            return PlaceholderStyle.APPLE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "apple", "ios", "macos" -> PlaceholderStyle.APPLE;
            case "android", "printf", "java" -> PlaceholderStyle.ANDROID;
            default -> {
                LOGGER.warning("[AfterCodecConfig] Unknown placeholder style '" + value + "', using 'apple'");
                yield PlaceholderStyle.APPLE;
            }
        };
    }

    @NotNull
    private static Map<?, ?> section(@NotNull Map<?, ?> parent, @NotNull String name) {
        Object value = parent.get(name);
        return value instanceof Map<?, ?> map ? map : Collections.emptyMap();
    }

    @Nullable
    private static String string(@NotNull Map<?, ?> parent, @NotNull String name) {
        Object value = parent.get(name);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    private static boolean bool(@NotNull Map<?, ?> parent, @NotNull String name, boolean fallback) {
        Object value = parent.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return fallback;
    }

    // ══════════════════════════════════════════════
    // DERIVED OPTIONS
    // ══════════════════════════════════════════════

    @NotNull
    public ValidationMode validationMode() {
        return strict ? ValidationMode.STRICT : ValidationMode.PERMISSIVE;
    }

    /**
     * Sync options built from the {@code sync} section.
     */
    @NotNull
    public SyncOptions syncOptions() {
        return SyncOptions.defaults()
                .withMatchLanguage(matchLanguage)
                .withFailOnUnmatched(failOnUnmatched)
                .withFailOnAmbiguous(failOnAmbiguous)
                .withRecordProvenance(recordProvenance);
    }

    // ══════════════════════════════════════════════
    // GETTERS
    // ══════════════════════════════════════════════

    public boolean isStrict() {
        return strict;
    }

    public boolean isDebug() {
        return debug;
    }

    @NotNull
    public MergeStrategy getMergeStrategy() {
        return mergeStrategy;
    }

    @Nullable
    public String getMatchLanguage() {
        return matchLanguage;
    }

    public boolean isFailOnUnmatched() {
        return failOnUnmatched;
    }

    public boolean isFailOnAmbiguous() {
        return failOnAmbiguous;
    }

    public boolean isRecordProvenance() {
        return recordProvenance;
    }

    @Nullable
    public String getPlaceholderSourceLanguage() {
        return placeholderSourceLanguage;
    }

    @NotNull
    public PlaceholderStyle getPlaceholderStyle() {
        return placeholderStyle;
    }

    /**
     * Extra plural table file overriding the bundled one.
     *
     * @return Path, or null when only the bundled table is used
     */
    @Nullable
    public Path getPluralTable() {
        return pluralTable != null ? Path.of(pluralTable) : null;
    }
}
