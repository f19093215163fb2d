package com.afterlands.aftercodec.api.format;

import com.afterlands.aftercodec.api.model.Resource;
import org.jetbrains.annotations.NotNull;

import java.util.Set;

/**
 * Capability implemented by every file format adapter.
 *
 * <p>Formats are looked up by {@link #tag()} through the format registry; the engines
 * never branch on a concrete format. An adapter converts bytes into a
 * {@link Resource} and back.</p>
 *
 * <h3>Strictness:</h3>
 * <ul>
 *     <li><b>strict</b> - recoverable anomalies (plural block without {@code other},
 *         unknown plural quantity, missing key attribute, unknown language) fail
 *         the whole operation</li>
 *     <li><b>permissive</b> - the anomaly is skipped or replaced by a best-effort
 *         fallback and reported as a warning</li>
 * </ul>
 *
 * <h3>Round trip:</h3>
 * <pre>{@code
 * ParseResult parsed = format.parse(format.serialize(resource, options).bytes(), readOptions);
 * // parsed.resource() equals resource, modulo what the format cannot express
 * }</pre>
 *
 * @author AfterLands Team
 * @since 1.0.0
 */
public interface ResourceFormat {

    /**
     * Registry tag (e.g., "android", "strings").
     *
     * @return Unique format tag
     */
    @NotNull
    String tag();

    /**
     * File extensions handled by this format, without the dot.
     *
     * @return Lowercase extensions
     */
    @NotNull
    Set<String> fileExtensions();

    /**
     * Whether the format can express {@code Plural} values.
     */
    boolean supportsPlurals();

    /**
     * Whether one file holds several languages.
     */
    boolean multiLanguage();

    /**
     * Parses raw bytes.
     *
     * @param source File content
     * @param options Read options
     * @return Parsed resource with warnings
     * @throws com.afterlands.aftercodec.api.error.ResourceParseException if the input is malformed
     */
    @NotNull
    ParseResult parse(byte @NotNull [] source, @NotNull ReadOptions options);

    /**
     * Serializes a resource.
     *
     * @param resource Resource to write
     * @param options Write options
     * @return Bytes with warnings
     * @throws com.afterlands.aftercodec.api.error.ResourceWriteException if the resource cannot be written
     */
    @NotNull
    SerializeResult serialize(@NotNull Resource resource, @NotNull WriteOptions options);
}
