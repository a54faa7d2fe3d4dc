package com.phillippitts.denoisebatch.exception;

/**
 * Base exception for all denoise-batch application errors.
 * All domain exceptions extend this class so callers and the REST boundary can handle them uniformly.
 */
public class BatchDenoiseException extends RuntimeException {

    public BatchDenoiseException(String message) {
        super(message);
    }

    public BatchDenoiseException(String message, Throwable cause) {
        super(message, cause);
    }

    public BatchDenoiseException(Throwable cause) {
        super(cause);
    }
}
