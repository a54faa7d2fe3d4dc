package com.phillippitts.denoisebatch.exception;

/**
 * Thrown when an output path cannot be resolved, created or written.
 */
public class PathException extends BatchDenoiseException {

    private final String path;

    public PathException(String message, String path) {
        super(message + ": " + path);
        this.path = path;
    }

    public PathException(String message, String path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
