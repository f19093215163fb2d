package com.afterlands.aftercodec.core.placeholder;

/**
 * Target syntax of the placeholder normalizer.
 */
public enum PlaceholderStyle {
    /** Apple / Foundation: objects as {@code %@}, length modifiers kept ({@code %ld}). */
    APPLE,
    /** Android / java.util.Formatter: strings as {@code %s}, no length modifiers, {@code %i} as {@code %d}. */
    ANDROID
}
