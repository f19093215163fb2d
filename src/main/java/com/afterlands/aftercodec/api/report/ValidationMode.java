package com.afterlands.aftercodec.api.report;

/**
 * How a validator reacts to problems.
 */
public enum ValidationMode {
    /** Problems raise an exception after the whole resource was checked. */
    STRICT,
    /** Problems are reported as warnings only. */
    PERMISSIVE;

    public boolean isStrict() {
        return this == STRICT;
    }
}
