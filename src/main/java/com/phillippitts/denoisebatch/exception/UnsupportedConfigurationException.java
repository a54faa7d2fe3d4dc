package com.phillippitts.denoisebatch.exception;

/**
 * Thrown when an engine configuration is incompatible with the input stream
 * (sample rate, channel count) or names an engine kind nobody registered.
 */
public class UnsupportedConfigurationException extends BatchDenoiseException {

    private final String engineKind;

    public UnsupportedConfigurationException(String message, String engineKind) {
        super(message + " (engine: " + engineKind + ")");
        this.engineKind = engineKind;
    }

    public String getEngineKind() {
        return engineKind;
    }
}
