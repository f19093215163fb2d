package com.afterlands.aftercodec.core.io;

import com.afterlands.aftercodec.api.format.ParseResult;
import com.afterlands.aftercodec.api.format.ReadOptions;
import com.afterlands.aftercodec.api.format.ResourceFormat;
import com.afterlands.aftercodec.api.format.SerializeResult;
import com.afterlands.aftercodec.api.format.WriteOptions;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.core.format.FormatRegistry;
import com.afterlands.aftercodec.core.provenance.Provenance;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads and writes Resources on disk.
 *
 * <p>The format is inferred from the file extension unless a tag is given.
 * Writes go to a temporary sibling file first, which is then moved over the
 * destination, so a failed serialization never leaves a half-written file.</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * ResourceFileService files = new ResourceFileService(registry, logger, false);
 * Resource fr = files.read(Path.of("fr.strings"), ReadOptions.strict("fr")).resource();
 * files.write(Path.of("values-fr/strings.xml"), fr, WriteOptions.strict("fr"));
 * }</pre>
 */
public class ResourceFileService {

    private static final String TEMP_SUFFIX = ".tmp";

    private final FormatRegistry registry;
    private final Logger logger;
    private final boolean debug;

    public ResourceFileService(@NotNull FormatRegistry registry, @NotNull Logger logger, boolean debug) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.debug = debug;
    }

    @NotNull
    public ParseResult read(@NotNull Path file, @NotNull ReadOptions options) throws IOException {
        return read(file, null, options, false);
    }

    /**
     * Reads a file.
     *
     * @param file File to read
     * @param formatTag Format tag, or null to infer from the extension
     * @param options Read options
     * @param recordProvenance Store the file path and format in the Resource metadata
     * @return Parsed Resource and warnings
     * @throws IOException if the file cannot be read
     */
    @NotNull
    public ParseResult read(
            @NotNull Path file,
            @Nullable String formatTag,
            @NotNull ReadOptions options,
            boolean recordProvenance
    ) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        ResourceFormat format = resolve(file, formatTag);

        byte[] bytes = Files.readAllBytes(file);
        ParseResult result = format.parse(bytes, options);

        for (String warning : result.warnings()) {
            logger.warning("[ResourceFileService] " + file.getFileName() + ": " + warning);
        }
        if (debug) {
            logger.fine("[ResourceFileService] Read " + result.resource().size() + " entries from " + file
                    + " as " + format.tag());
        }

        if (!recordProvenance) {
            return result;
        }
        Resource tagged = Provenance.ofFile(file.toString(), format.tag()).applyTo(result.resource());
        return new ParseResult(tagged, result.warnings());
    }

    @NotNull
    public SerializeResult write(@NotNull Path file, @NotNull Resource resource, @NotNull WriteOptions options) throws IOException {
        return write(file, null, resource, options);
    }

    /**
     * Serializes a Resource and atomically replaces the destination.
     *
     * <p>Serialization happens before anything touches the disk; a
     * {@link com.afterlands.aftercodec.api.error.ResourceWriteException} leaves the
     * destination untouched.</p>
     *
     * @param file Destination file
     * @param formatTag Format tag, or null to infer from the extension
     * @param resource Resource to write
     * @param options Write options
     * @return Serialized bytes and warnings
     * @throws IOException if the file cannot be written
     */
    @NotNull
    public SerializeResult write(
            @NotNull Path file,
            @Nullable String formatTag,
            @NotNull Resource resource,
            @NotNull WriteOptions options
    ) throws IOException {
        ResourceFormat format = resolve(file, formatTag);
        SerializeResult result = format.serialize(resource, options);

        Path absolute = file.toAbsolutePath();
        Path directory = absolute.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }

        Path temp = absolute.resolveSibling(absolute.getFileName() + TEMP_SUFFIX);
        try {
            Files.write(temp, result.bytes());
            move(temp, absolute);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        for (String warning : result.warnings()) {
            logger.warning("[ResourceFileService] " + file.getFileName() + ": " + warning);
        }
        logger.info("[ResourceFileService] Wrote " + resource.size() + " entries to " + file + " (" + format.tag() + ")");
        return result;
    }

    @NotNull
    private ResourceFormat resolve(@NotNull Path file, @Nullable String formatTag) {
        return formatTag != null ? registry.get(formatTag) : registry.forPath(file);
    }

    private void move(@NotNull Path from, @NotNull Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("[ResourceFileService] Atomic move not supported for " + to + ", using plain replace");
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
