package com.afterlands.aftercodec.bootstrap;

import com.afterlands.aftercodec.api.format.ParseResult;
import com.afterlands.aftercodec.api.format.ReadOptions;
import com.afterlands.aftercodec.api.format.SerializeResult;
import com.afterlands.aftercodec.api.format.WriteOptions;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.report.DiffReport;
import com.afterlands.aftercodec.api.report.PlaceholderValidationReport;
import com.afterlands.aftercodec.api.report.PluralValidationReport;
import com.afterlands.aftercodec.api.report.ValidationMode;
import com.afterlands.aftercodec.config.AfterCodecConfig;
import com.afterlands.aftercodec.core.batch.BatchResult;
import com.afterlands.aftercodec.core.batch.BatchRunner;
import com.afterlands.aftercodec.core.diff.DiffEngine;
import com.afterlands.aftercodec.core.diff.DiffOptions;
import com.afterlands.aftercodec.core.edit.ResourceEditor;
import com.afterlands.aftercodec.core.format.FormatRegistry;
import com.afterlands.aftercodec.core.io.ResourceFileService;
import com.afterlands.aftercodec.core.merge.MergeEngine;
import com.afterlands.aftercodec.core.merge.MergeStrategy;
import com.afterlands.aftercodec.core.placeholder.PlaceholderNormalizer;
import com.afterlands.aftercodec.core.placeholder.PlaceholderValidator;
import com.afterlands.aftercodec.core.plural.PluralCategoryTable;
import com.afterlands.aftercodec.core.plural.PluralCategoryTables;
import com.afterlands.aftercodec.core.plural.PluralValidator;
import com.afterlands.aftercodec.core.report.ReportJsonRenderer;
import com.afterlands.aftercodec.core.stats.ResourceStats;
import com.afterlands.aftercodec.core.stats.StatsCalculator;
import com.afterlands.aftercodec.core.sync.SyncEngine;
import com.afterlands.aftercodec.core.sync.SyncOptions;
import com.afterlands.aftercodec.core.sync.SyncResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point that wires every toolkit service from an {@link AfterCodecConfig}.
 *
 * <h3>Service Initialization Order:</h3>
 * <ol>
 *     <li>Plural table (bundled, optionally overridden by {@code plural-table})</li>
 *     <li>Format registry and file service</li>
 *     <li>Merge, diff and sync engines</li>
 *     <li>Validators, normalizer, stats and editor</li>
 * </ol>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * AfterCodecToolkit toolkit = AfterCodecToolkit.create(AfterCodecConfig.load(path), logger);
 * Resource en = toolkit.read(Path.of("en.strings"), "en");
 * Resource fr = toolkit.read(Path.of("values-fr/strings.xml"), "fr");
 * Resource merged = toolkit.merge(List.of(en, fr));
 * toolkit.write(Path.of("Localizable.xcstrings"), merged, null);
 * }</pre>
 */
public class AfterCodecToolkit {

    private final AfterCodecConfig config;
    private final Logger logger;
    private final boolean debug;

    private final PluralCategoryTable pluralTable;
    private final FormatRegistry formats;
    private final ResourceFileService files;

    private final MergeEngine mergeEngine;
    private final DiffEngine diffEngine;
    private final SyncEngine syncEngine;

    private final PluralValidator pluralValidator;
    private final PlaceholderValidator placeholderValidator;
    private final PlaceholderNormalizer placeholderNormalizer;
    private final StatsCalculator statsCalculator;
    private final ResourceEditor editor;
    private final ReportJsonRenderer renderer;

    public AfterCodecToolkit(
            @NotNull AfterCodecConfig config,
            @NotNull PluralCategoryTable pluralTable,
            @NotNull Logger logger
    ) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.pluralTable = Objects.requireNonNull(pluralTable, "pluralTable cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.debug = config.isDebug();

        this.formats = FormatRegistry.defaults(logger, debug);
        this.files = new ResourceFileService(formats, logger, debug);

        this.mergeEngine = new MergeEngine(logger, debug);
        this.diffEngine = new DiffEngine(logger);
        this.syncEngine = new SyncEngine(logger, debug);

        this.pluralValidator = new PluralValidator(pluralTable, logger);
        this.placeholderValidator = new PlaceholderValidator(logger);
        this.placeholderNormalizer = new PlaceholderNormalizer(logger);
        this.statsCalculator = new StatsCalculator(pluralTable, logger);
        this.editor = new ResourceEditor(logger);
        this.renderer = new ReportJsonRenderer();

        if (debug) {
            logger.fine("[Toolkit] Initialized with formats " + formats.tags());
        }
    }

    /**
     * Creates a toolkit, loading the plural table named by the config.
     *
     * @param config Configuration
     * @param logger Logger shared by every service
     * @return Wired toolkit
     * @throws IOException if the configured plural table cannot be read
     */
    @NotNull
    public static AfterCodecToolkit create(@NotNull AfterCodecConfig config, @NotNull Logger logger) throws IOException {
        Path tableFile = config.getPluralTable();
        PluralCategoryTable table = tableFile != null
                ? PluralCategoryTables.bundledWithOverrides(tableFile)
                : PluralCategoryTables.bundled();
        if (tableFile != null) {
            logger.info("[Toolkit] Plural table overrides loaded from " + tableFile);
        }
        return new AfterCodecToolkit(config, table, logger);
    }

    // ══════════════════════════════════════════════
    // FILES
    // ══════════════════════════════════════════════

    /**
     * Reads a file with the configured strictness.
     *
     * @param file File to read (format inferred from the extension)
     * @param language Language hint for single-language formats, or null
     * @return Parsed Resource
     * @throws IOException if the file cannot be read
     */
    @NotNull
    public Resource read(@NotNull Path file, @Nullable String language) throws IOException {
        ReadOptions options = new ReadOptions(config.isStrict(), language);
        ParseResult result = files.read(file, null, options, false);
        return result.resource();
    }

    /**
     * Writes a Resource with the configured strictness.
     *
     * @param file Destination (format inferred from the extension)
     * @param resource Resource to write
     * @param language Language to emit for single-language formats, or null
     * @throws IOException if the file cannot be written
     */
    @NotNull
    public SerializeResult write(@NotNull Path file, @NotNull Resource resource, @Nullable String language) throws IOException {
        return files.write(file, resource, new WriteOptions(config.isStrict(), language));
    }

    /**
     * Converts a file into another format.
     *
     * @param input Source file
     * @param output Destination file
     * @param language Language hint used for both sides, or null
     * @return Converted Resource
     * @throws IOException if either file cannot be accessed
     */
    @NotNull
    public Resource convert(@NotNull Path input, @NotNull Path output, @Nullable String language) throws IOException {
        Resource resource = read(input, language);
        write(output, resource, language);
        return resource;
    }

    // ══════════════════════════════════════════════
    // OPERATIONS
    // ══════════════════════════════════════════════

    @NotNull
    public Resource merge(@NotNull List<Resource> resources) {
        return mergeEngine.merge(resources, config.getMergeStrategy());
    }

    @NotNull
    public Resource merge(@NotNull List<Resource> resources, @NotNull MergeStrategy strategy) {
        return mergeEngine.merge(resources, strategy);
    }

    /**
     * Reads and merges files, writing the result only when every input parsed and
     * the merge succeeded.
     *
     * @throws IOException if any file cannot be accessed
     */
    @NotNull
    public Resource mergeFiles(@NotNull List<Path> inputs, @NotNull Path output, @Nullable String language) throws IOException {
        List<Resource> resources = new ArrayList<>();
        for (Path input : inputs) {
            resources.add(read(input, language));
        }
        Resource merged = merge(resources);
        write(output, merged, language);
        return merged;
    }

    @NotNull
    public DiffReport diff(@NotNull Resource source, @NotNull Resource target) {
        return diffEngine.diff(source, target);
    }

    @NotNull
    public DiffReport diff(@NotNull Resource source, @NotNull Resource target, @NotNull DiffOptions options) {
        return diffEngine.diff(source, target, options);
    }

    /**
     * Syncs with the options from the {@code sync} config section.
     */
    @NotNull
    public SyncResult sync(@NotNull Resource source, @NotNull Resource target) {
        return syncEngine.sync(source, target, config.syncOptions());
    }

    @NotNull
    public SyncResult sync(@NotNull Resource source, @NotNull Resource target, @NotNull SyncOptions options) {
        return syncEngine.sync(source, target, options);
    }

    @NotNull
    public PluralValidationReport validatePlurals(@NotNull Resource resource) {
        return pluralValidator.validate(resource, config.validationMode());
    }

    @NotNull
    public PluralValidationReport validatePlurals(
            @NotNull Resource resource,
            @NotNull PluralCategoryTable table,
            @NotNull ValidationMode mode
    ) {
        return new PluralValidator(table, logger).validate(resource, mode);
    }

    @NotNull
    public PlaceholderValidationReport validatePlaceholders(@NotNull Resource resource) {
        return placeholderValidator.validate(resource, config.getPlaceholderSourceLanguage(), config.validationMode());
    }

    @NotNull
    public PlaceholderValidationReport validatePlaceholders(@NotNull Resource resource, @NotNull ValidationMode mode) {
        return placeholderValidator.validate(resource, config.getPlaceholderSourceLanguage(), mode);
    }

    /**
     * Rewrites placeholders into the configured style.
     */
    @NotNull
    public PlaceholderNormalizer.Result normalizePlaceholders(@NotNull Resource resource) {
        return placeholderNormalizer.normalize(resource, config.getPlaceholderStyle(), config.getPlaceholderSourceLanguage());
    }

    @NotNull
    public ResourceStats stats(@NotNull Resource resource) {
        return statsCalculator.calculate(resource);
    }

    @NotNull
    public ResourceStats stats(@NotNull Resource resource, @NotNull PluralCategoryTable table) {
        return new StatsCalculator(table, logger).calculate(resource);
    }

    /**
     * Converts every input file into {@code outputDir}, keeping the file name and
     * swapping the extension for the target format's first one.
     *
     * @param inputs Files to convert
     * @param outputDir Destination directory
     * @param targetFormat Format tag to write
     * @param language Language hint, or null
     * @return Successes and failures; failed inputs write nothing
     */
    @NotNull
    public BatchResult convertAll(
            @NotNull List<Path> inputs,
            @NotNull Path outputDir,
            @NotNull String targetFormat,
            @Nullable String language
    ) {
        String extension = formats.get(targetFormat).fileExtensions().stream().sorted().findFirst()
                .orElseThrow(() -> new IllegalStateException("Format " + targetFormat + " declares no extension"));

        return new BatchRunner(logger).run(inputs, Path::toString, input -> {
            Resource resource = read(input, language);
            String name = input.getFileName().toString();
            int dot = name.lastIndexOf('.');
            String base = dot > 0 ? name.substring(0, dot) : name;
            files.write(outputDir.resolve(base + "." + extension), targetFormat, resource,
                    new WriteOptions(config.isStrict(), language));
        });
    }

    // ══════════════════════════════════════════════
    // GETTERS
    // ══════════════════════════════════════════════

    @NotNull
    public AfterCodecConfig getConfig() {
        return config;
    }

    @NotNull
    public PluralCategoryTable getPluralTable() {
        return pluralTable;
    }

    @NotNull
    public FormatRegistry getFormats() {
        return formats;
    }

    @NotNull
    public ResourceFileService getFiles() {
        return files;
    }

    @NotNull
    public ResourceEditor getEditor() {
        return editor;
    }

    @NotNull
    public ReportJsonRenderer getRenderer() {
        return renderer;
    }
}
