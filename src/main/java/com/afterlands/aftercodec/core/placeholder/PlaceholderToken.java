package com.afterlands.aftercodec.core.placeholder;

import com.afterlands.aftercodec.api.model.PlaceholderType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One printf-style placeholder found in a string.
 *
 * @param start Offset of the {@code %}
 * @param end Offset after the conversion character
 * @param position Explicit argument index ({@code %2$d} -> 2), or null
 * @param flags Flag characters ({@code -+0#}), possibly empty
 * @param width Field width digits, or null
 * @param precision Precision digits (without the dot), or null
 * @param length Length modifier ({@code l}, {@code ll}, ...), or null
 * @param conversion Conversion character
 * @param type Argument type of the conversion
 */
public record PlaceholderToken(
        int start,
        int end,
        @Nullable Integer position,
        @NotNull String flags,
        @Nullable String width,
        @Nullable String precision,
        @Nullable String length,
        char conversion,
        @NotNull PlaceholderType type
) {

    public PlaceholderToken {
        Objects.requireNonNull(flags, "flags cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
    }

    public boolean isPositional() {
        return position != null;
    }

    /**
     * Re-encodes this token in the given style.
     *
     * <p>Position, flags, width and precision are kept as written.</p>
     *
     * @param style Target style
     * @return Placeholder text
     */
    @NotNull
    public String render(@NotNull PlaceholderStyle style) {
        StringBuilder sb = new StringBuilder("%");
        if (position != null) sb.append(position).append('$');
        sb.append(flags);
        if (width != null) sb.append(width);
        if (precision != null) sb.append('.').append(precision);

        char target = conversion;
        switch (style) {
            case APPLE -> {
                if (length != null) sb.append(length);
                if (conversion == 's' || conversion == 'S') target = '@';
            }
            case ANDROID -> {
                if (conversion == '@') target = 's';
                else if (conversion == 'i' || conversion == 'D') target = 'd';
                else if (conversion == 'O') target = 'o';
            }
        }
        return sb.append(target).toString();
    }
}
