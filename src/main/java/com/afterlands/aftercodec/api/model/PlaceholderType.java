package com.afterlands.aftercodec.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Argument type of a printf-style placeholder.
 *
 * <h3>Conversion mapping:</h3>
 * <pre>
 * &#64; s S          -> STRING
 * d i D          -> INTEGER
 * u U x X o O    -> UNSIGNED
 * f F e E g G a A -> FLOAT
 * </pre>
 */
public enum PlaceholderType {
    STRING,
    INTEGER,
    UNSIGNED,
    FLOAT;

    /**
     * Maps a conversion character to its type.
     *
     * @param conversion Conversion character
     * @return Type, or null if the character is not a conversion
     */
    @Nullable
    public static PlaceholderType fromConversion(char conversion) {
        return switch (conversion) {
            case '@', 's', 'S' -> STRING;
            case 'd', 'i', 'D' -> INTEGER;
            case 'u', 'U', 'x', 'X', 'o', 'O' -> UNSIGNED;
            case 'f', 'F', 'e', 'E', 'g', 'G', 'a', 'A' -> FLOAT;
            default -> null;
        };
    }

    @NotNull
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
