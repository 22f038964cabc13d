package com.raditha.staleflag.model;

/**
 * A problem found in one unit.
 *
 * @param kind     error kind
 * @param message  human readable detail
 * @param location where in the unit, null when not tied to a node
 */
public record CleanupError(ErrorKind kind, String message, Range location) {

    public static CleanupError from(FlagCleanupException e) {
        return new CleanupError(e.getKind(), e.getMessage(), e.getLocation());
    }

    @Override
    public String toString() {
        String where = location != null ? " at " + location : "";
        return kind + where + ": " + message;
    }
}
