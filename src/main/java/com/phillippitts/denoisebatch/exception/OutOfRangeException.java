package com.phillippitts.denoisebatch.exception;

/**
 * Thrown when a numeric parameter falls outside its permitted range, including a preview
 * window that starts at or beyond the end of the file.
 */
public class OutOfRangeException extends BatchDenoiseException {

    private final String parameter;

    public OutOfRangeException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    /**
     * Checks {@code min <= value <= max} and throws otherwise.
     *
     * @param parameter parameter name used in the message
     * @param value value to check
     * @param min inclusive lower bound
     * @param max inclusive upper bound
     * @return the value, for use in compact constructors
     */
    public static double requireInRange(String parameter, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new OutOfRangeException(parameter, "value " + value + " not in [" + min + ", " + max + "]");
        }
        return value;
    }
}
