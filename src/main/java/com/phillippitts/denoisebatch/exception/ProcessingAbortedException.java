package com.phillippitts.denoisebatch.exception;

/**
 * Thrown at a chunk-boundary checkpoint when the running batch has been stopped.
 * The job that observes it is marked Failed and its partial output is deleted.
 */
public class ProcessingAbortedException extends BatchDenoiseException {

    public ProcessingAbortedException(String message) {
        super(message);
    }
}
