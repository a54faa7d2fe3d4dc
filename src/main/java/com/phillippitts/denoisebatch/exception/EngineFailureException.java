package com.phillippitts.denoisebatch.exception;

/**
 * Thrown when a noise-reduction engine fails internally, e.g. a missing model
 * resource, a crashed helper process or an unexpected runtime error inside the algorithm.
 */
public class EngineFailureException extends BatchDenoiseException {

    private final String engineName;

    public EngineFailureException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public EngineFailureException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public EngineFailureException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
