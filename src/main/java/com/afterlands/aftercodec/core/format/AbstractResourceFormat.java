package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.error.ResourceParseException;
import com.afterlands.aftercodec.api.error.ResourceWriteException;
import com.afterlands.aftercodec.api.format.ReadOptions;
import com.afterlands.aftercodec.api.format.ResourceFormat;
import com.afterlands.aftercodec.api.format.WriteOptions;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.core.language.LanguageCodes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Shared plumbing for format adapters.
 *
 * <p>Handles the strict / permissive decisions every adapter faces: which language a
 * file holds, which language to write, and what to do with a value the format
 * cannot express.</p>
 */
public abstract class AbstractResourceFormat implements ResourceFormat {

    protected final Logger logger;
    protected final boolean debug;

    protected AbstractResourceFormat(@NotNull Logger logger, boolean debug) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.debug = debug;
    }

    /**
     * Language of a parsed single-language file.
     *
     * <p>The caller's hint wins, then the language the file declares. Without either,
     * strict mode fails and permissive mode falls back to {@value LanguageCodes#UNDETERMINED}.</p>
     */
    @NotNull
    protected String resolveReadLanguage(
            @NotNull ReadOptions options,
            @Nullable String declared,
            @NotNull List<String> warnings
    ) {
        if (options.languageHint() != null && !options.languageHint().isBlank()) {
            return options.languageHint().trim();
        }
        if (declared != null && !declared.isBlank()) {
            return declared.trim();
        }
        if (options.strict()) {
            throw new ResourceParseException(tag(), "Unknown language: file declares none and no language hint was given");
        }
        warn(warnings, "Unknown language, using '" + LanguageCodes.UNDETERMINED + "'");
        return LanguageCodes.UNDETERMINED;
    }

    /**
     * Language a single-language writer should emit.
     *
     * @throws ResourceWriteException when the choice is ambiguous
     */
    @NotNull
    protected String resolveWriteLanguage(@NotNull Resource resource, @NotNull WriteOptions options) {
        Set<String> languages = resource.languages();
        if (options.language() != null) {
            for (String language : languages) {
                if (LanguageCodes.matches(language, options.language())) {
                    return language;
                }
            }
            return options.language();
        }
        if (languages.size() > 1) {
            throw new ResourceWriteException(tag(), "Resource holds " + languages.size()
                    + " languages " + languages + "; choose one to write");
        }
        return languages.isEmpty() ? LanguageCodes.UNDETERMINED : languages.iterator().next();
    }

    /**
     * Collapses a Plural for a format without plural support.
     *
     * @return OTHER form, or the first populated form
     * @throws ResourceWriteException in strict mode
     */
    @NotNull
    protected String collapsePlural(
            @NotNull Entry entry,
            @NotNull Translation.Plural plural,
            @NotNull WriteOptions options,
            @NotNull List<String> warnings
    ) {
        if (options.strict()) {
            throw new ResourceWriteException(tag(), "Plural value for '" + entry.key()
                    + "' cannot be expressed in this format");
        }
        String other = plural.get(PluralCategory.OTHER);
        String text = other != null ? other : plural.forms().values().iterator().next();
        warn(warnings, "Collapsed plural '" + entry.key() + "' [" + entry.language() + "] to a single string");
        return text;
    }

    protected void warn(@NotNull List<String> warnings, @NotNull String message) {
        warnings.add(message);
        logger.warning("[" + getClass().getSimpleName() + "] " + message);
    }

    /**
     * Recoverable anomaly: throws in strict mode, records a warning otherwise.
     */
    protected void anomaly(@NotNull ReadOptions options, @NotNull List<String> warnings, @NotNull String message) {
        if (options.strict()) {
            throw new ResourceParseException(tag(), message);
        }
        warn(warnings, message);
    }

    /**
     * Decodes UTF-8, dropping a leading byte order mark.
     */
    @NotNull
    protected static String decodeUtf8(byte @NotNull [] source) {
        String text = new String(source, StandardCharsets.UTF_8);
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + tag() + "]";
    }
}
