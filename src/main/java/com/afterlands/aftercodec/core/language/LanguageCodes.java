package com.afterlands.aftercodec.core.language;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Language code normalization.
 *
 * <p>Files in the wild spell the same locale differently ("pt_BR", "pt-br",
 * " PT-BR "). Comparisons across resources always go through {@link #normalize}.</p>
 *
 * <h3>Examples:</h3>
 * <pre>
 * normalize("pt_BR")   -> "pt-br"
 * normalize(" EN ")    -> "en"
 * baseLanguage("zh-Hant-TW") -> "zh"
 * matches("en_US", "en-us")  -> true
 * </pre>
 */
public final class LanguageCodes {

    /**
     * Placeholder language used when a single-language file declares none.
     */
    public static final String UNDETERMINED = "und";

    private LanguageCodes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Trims, converts underscores to hyphens and lowercases.
     *
     * @param code Raw language code
     * @return Normalized code
     */
    @NotNull
    public static String normalize(@NotNull String code) {
        Objects.requireNonNull(code, "code cannot be null");
        return code.trim().replace('_', '-').toLowerCase(Locale.ROOT);
    }

    /**
     * Primary language subtag of a code.
     *
     * @param code Language code (any spelling)
     * @return Normalized base language (e.g., "pt" for "pt_BR")
     */
    @NotNull
    public static String baseLanguage(@NotNull String code) {
        String normalized = normalize(code);
        int dash = normalized.indexOf('-');
        return dash < 0 ? normalized : normalized.substring(0, dash);
    }

    /**
     * Whether two codes denote the same language after normalization.
     */
    public static boolean matches(@Nullable String a, @Nullable String b) {
        if (a == null || b == null) {
            return false;
        }
        return normalize(a).equals(normalize(b));
    }

    /**
     * Whether two codes share a base language (e.g., "pt-BR" and "pt-PT").
     */
    public static boolean sameBase(@NotNull String a, @NotNull String b) {
        return baseLanguage(a).equals(baseLanguage(b));
    }

    /**
     * Loose structural check: letters, digits and separators, starting with 2-3 letters.
     *
     * @param code Candidate code
     * @return true if the code looks like a BCP-47 / POSIX locale
     */
    public static boolean isWellFormed(@Nullable String code) {
        if (code == null) {
            return false;
        }
        return normalize(code).matches("[a-z]{2,3}(-[a-z0-9]{1,8})*");
    }
}
