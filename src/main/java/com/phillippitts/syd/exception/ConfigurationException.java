package com.phillippitts.syd.exception;

/**
 * Thrown when caller input cannot be resolved into per-star configurations: override sequences
 * of the wrong length, values of the wrong type, too many forced noise components, or no stars.
 *
 * <p>Raised before any per-star work starts; nothing is written to disk once this is thrown.
 */
public class ConfigurationException extends SydException {

    private final String parameter;

    public ConfigurationException(String message) {
        super(message);
        this.parameter = null;
    }

    public ConfigurationException(String message, String parameter) {
        super(message + " (parameter: " + parameter + ")");
        this.parameter = parameter;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.parameter = null;
    }

    public ConfigurationException(String message, String parameter, Throwable cause) {
        super(message + " (parameter: " + parameter + ")", cause);
        this.parameter = parameter;
    }

    /**
     * @return name of the offending parameter, or null when the error is not tied to one
     */
    public String getParameter() {
        return parameter;
    }
}
