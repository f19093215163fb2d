package com.afterlands.aftercodec.core.placeholder;

import com.afterlands.aftercodec.api.model.PlaceholderSignature;
import com.afterlands.aftercodec.api.model.PlaceholderType;
import com.afterlands.aftercodec.api.model.Translation;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts printf-style placeholders from translation text.
 *
 * <h3>Supported Syntax:</h3>
 * <ul>
 *     <li>{@code %@}, {@code %1$@}, {@code %ld}, {@code %lu}, {@code %lld} - Apple</li>
 *     <li>{@code %s}, {@code %1$s}, {@code %d}, {@code %u}, {@code %f}, {@code %x} - Android / printf</li>
 *     <li>optional flags, width, precision and length modifier ({@code %05.2f}, {@code %-10s})</li>
 *     <li>{@code %%} - literal percent, never a placeholder</li>
 * </ul>
 *
 * <p>A {@code %} that does not start a valid placeholder is ordinary text.</p>
 */
public final class PlaceholderExtractor {

    /**
     * {@code %%} or {@code %[n$][flags][width][.precision][length]conversion}.
     * The position is capped at nine digits so it always fits an int; a longer
     * one does not match and stays literal text.
     */
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile(
            "%%|%(?:(\\d{1,9})\\$)?([-+0#]*)(\\d+)?(?:\\.(\\d+))?(hh|h|ll|l|q|z|t|j|L)?([@sSdiDuUxXoOfFeEgGaA])"
    );

    private PlaceholderExtractor() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Tokens in occurrence order.
     *
     * @param text Translation text
     * @return Placeholders, excluding {@code %%}
     */
    @NotNull
    public static List<PlaceholderToken> extract(@NotNull String text) {
        List<PlaceholderToken> tokens = new ArrayList<>();
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);

        while (matcher.find()) {
            if (matcher.group(6) == null) {
                continue; // %%
            }
            char conversion = matcher.group(6).charAt(0);
            PlaceholderType type = PlaceholderType.fromConversion(conversion);
            if (type == null) {
                continue;
            }
            tokens.add(new PlaceholderToken(
                    matcher.start(),
                    matcher.end(),
                    matcher.group(1) != null ? Integer.valueOf(matcher.group(1)) : null,
                    matcher.group(2),
                    matcher.group(3),
                    matcher.group(4),
                    matcher.group(5),
                    conversion,
                    type
            ));
        }
        return tokens;
    }

    public static boolean hasPlaceholders(@NotNull String text) {
        return !extract(text).isEmpty();
    }

    /**
     * Signature of a text.
     *
     * <p>Positional tokens use their index. A non-positional token takes its
     * occurrence ordinal (the n-th placeholder is argument n). When two tokens
     * claim the same ordinal the first one wins.</p>
     *
     * @param text Translation text
     * @return Signature
     */
    @NotNull
    public static PlaceholderSignature signature(@NotNull String text) {
        Map<Integer, PlaceholderType> arguments = new TreeMap<>();
        int ordinal = 0;
        for (PlaceholderToken token : extract(text)) {
            ordinal++;
            int index = token.isPositional() ? token.position() : ordinal;
            arguments.putIfAbsent(index, token.type());
        }
        return PlaceholderSignature.of(arguments);
    }

    /**
     * Signature of an entry value: the text itself for Singular, the OTHER form
     * (or the last populated form) for Plural.
     *
     * @param value Translation value
     * @return Signature
     */
    @NotNull
    public static PlaceholderSignature signature(@NotNull Translation value) {
        return signature(value.primaryText());
    }
}
