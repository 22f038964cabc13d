package com.raditha.staleflag.model;

/**
 * Raised while resolving or rewriting a unit. The engine turns it into a
 * {@link CleanupError}; it never escapes a run.
 */
public class FlagCleanupException extends RuntimeException {

    private final ErrorKind kind;
    private final transient Range location;

    public FlagCleanupException(ErrorKind kind, String message, Range location) {
        super(message);
        this.kind = kind;
        this.location = location;
    }

    public FlagCleanupException(ErrorKind kind, String message, Range location, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.location = location;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Range getLocation() {
        return location;
    }
}
