package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.error.UnknownFormatException;
import com.afterlands.aftercodec.api.format.ResourceFormat;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Registry of {@link ResourceFormat} adapters, keyed by format tag.
 *
 * <p>Callers dispatch through the registry only; nothing else in the toolkit
 * knows which concrete adapters exist.</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * FormatRegistry registry = FormatRegistry.defaults(logger, false);
 * ResourceFormat android = registry.get("android");
 * ResourceFormat inferred = registry.forPath(Path.of("values-fr/strings.xml"));
 * }</pre>
 */
public class FormatRegistry {

    private final Map<String, ResourceFormat> byTag = new LinkedHashMap<>();
    private final Map<String, ResourceFormat> byExtension = new LinkedHashMap<>();
    private final Logger logger;
    private final boolean debug;

    public FormatRegistry(@NotNull Logger logger, boolean debug) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.debug = debug;
    }

    /**
     * Creates a registry with every bundled adapter.
     *
     * @param logger Logger shared by the adapters
     * @param debug Enable debug logging
     * @return Populated registry
     */
    @NotNull
    public static FormatRegistry defaults(@NotNull Logger logger, boolean debug) {
        FormatRegistry registry = new FormatRegistry(logger, debug);
        registry.register(new AppleStringsFormat(logger, debug));
        registry.register(new AndroidStringsFormat(logger, debug));
        registry.register(new YamlResourceFormat(logger, debug));
        registry.register(new XcstringsFormat(logger, debug));
        registry.register(new CsvResourceFormat(logger, debug));
        registry.register(new TsvResourceFormat(logger, debug));
        return registry;
    }

    /**
     * Registers a format. A later registration under the same tag replaces the earlier one.
     *
     * @param format Format adapter
     */
    public void register(@NotNull ResourceFormat format) {
        Objects.requireNonNull(format, "format cannot be null");
        String tag = format.tag().toLowerCase(Locale.ROOT);

        ResourceFormat previous = byTag.put(tag, format);
        if (previous != null) {
            byExtension.values().removeIf(f -> f == previous);
            logger.warning("[FormatRegistry] Format '" + tag + "' replaced by " + format);
        }
        for (String extension : format.fileExtensions()) {
            byExtension.put(extension.toLowerCase(Locale.ROOT), format);
        }

        if (debug) {
            logger.fine("[FormatRegistry] Registered " + tag + " " + format.fileExtensions());
        }
    }

    @NotNull
    public Optional<ResourceFormat> find(@NotNull String tag) {
        return Optional.ofNullable(byTag.get(tag.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolves a format by tag.
     *
     * @throws UnknownFormatException if no format has this tag
     */
    @NotNull
    public ResourceFormat get(@NotNull String tag) {
        return find(tag).orElseThrow(() -> new UnknownFormatException(
                "Unknown format '" + tag + "' (known: " + byTag.keySet() + ")"));
    }

    @NotNull
    public Optional<ResourceFormat> findByExtension(@NotNull String extension) {
        String normalized = extension.startsWith(".") ? extension.substring(1) : extension;
        return Optional.ofNullable(byExtension.get(normalized.toLowerCase(Locale.ROOT)));
    }

    /**
     * Infers the format of a file from its extension.
     *
     * @param path File path
     * @return Matching format
     * @throws UnknownFormatException if the extension is missing or unknown
     */
    @NotNull
    public ResourceFormat forPath(@NotNull Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString() : path.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            throw new UnknownFormatException("Cannot infer format of '" + path + "': no file extension");
        }
        String extension = name.substring(dot + 1);
        return findByExtension(extension).orElseThrow(() -> new UnknownFormatException(
                "Cannot infer format of '" + path + "': unknown extension '." + extension + "'"));
    }

    @NotNull
    public Collection<ResourceFormat> formats() {
        return Collections.unmodifiableCollection(byTag.values());
    }

    @NotNull
    public Set<String> tags() {
        return Collections.unmodifiableSet(byTag.keySet());
    }
}
