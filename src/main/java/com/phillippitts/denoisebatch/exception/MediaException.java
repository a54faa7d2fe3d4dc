package com.phillippitts.denoisebatch.exception;

/**
 * Thrown when probing, decoding, encoding or remuxing a media file fails
 * (corrupt file, unsupported container or codec, tool crash).
 */
public class MediaException extends BatchDenoiseException {

    private final String path;

    public MediaException(String message) {
        super(message);
        this.path = null;
    }

    public MediaException(String message, String path) {
        super(message + " (file: " + path + ")");
        this.path = path;
    }

    public MediaException(String message, String path, Throwable cause) {
        super(message + " (file: " + path + ")", cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
