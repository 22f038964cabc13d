package com.raditha.staleflag.model;

/**
 * Kinds of problems reported per unit.
 */
public enum ErrorKind {
    /** The flag identifier resolves to conflicting literals; the unit is skipped. */
    AMBIGUOUS_BINDING(true),
    /** The site has a shape the rewriter does not handle; only that site is left alone. */
    UNSUPPORTED_EXPRESSION(false),
    RESOLUTION_DEPTH_EXCEEDED(false),
    FIXED_POINT_ITERATION_EXCEEDED(false),
    /** The parser rejected the unit; the unit is skipped. */
    PARSE_FAILURE(true),
    /** An unexpected failure while processing the unit; the unit is skipped. */
    INTERNAL_ERROR(true);

    private final boolean skipsUnit;

    ErrorKind(boolean skipsUnit) {
        this.skipsUnit = skipsUnit;
    }

    public boolean skipsUnit() {
        return skipsUnit;
    }
}
