package com.raditha.staleflag.model;

/**
 * The shape of the value a stale flag is permanently resolved to.
 */
public enum TreatmentKind {
    BOOLEAN,
    STRING,
    /** A qualified enum constant such as {@code Variant.CONTROL}. */
    ENUM;

    /**
     * Convert a configuration value to a TreatmentKind.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding kind
     * @throws IllegalArgumentException if the value is not a valid kind
     */
    public static TreatmentKind fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Treatment kind cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "boolean", "bool" -> BOOLEAN;
            case "string", "str" -> STRING;
            case "enum" -> ENUM;
            default -> throw new IllegalArgumentException(
                    "Invalid treatment kind: " + value + ". Must be: boolean, string, or enum");
        };
    }
}
