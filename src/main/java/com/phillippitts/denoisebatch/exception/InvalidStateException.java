package com.phillippitts.denoisebatch.exception;

/**
 * Thrown when an operation is not legal in the current lifecycle state,
 * e.g. enqueueing into a sealed queue or starting a batch while one is running.
 */
public class InvalidStateException extends BatchDenoiseException {

    public InvalidStateException(String message) {
        super(message);
    }
}
