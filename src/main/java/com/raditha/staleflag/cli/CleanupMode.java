package com.raditha.staleflag.cli;

/**
 * What the CLI does with the rewritten sources.
 */
public enum CleanupMode {
    /**
     * Preview changes as unified diffs without touching any file.
     */
    DRY_RUN,

    /**
     * Write rewritten sources back to disk.
     */
    APPLY;

    /**
     * Convert a string value to CleanupMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding CleanupMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static CleanupMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("CleanupMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "dry-run" -> DRY_RUN;
            case "apply" -> APPLY;
            default -> throw new IllegalArgumentException(
                    "Invalid cleanup mode: " + value + ". Must be: dry-run or apply");
        };
    }

    public String toCliString() {
        return switch (this) {
            case DRY_RUN -> "dry-run";
            case APPLY -> "apply";
        };
    }
}
