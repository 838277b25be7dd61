package com.phillippitts.callcopilot.exception;

/**
 * Thrown at startup when required configuration (usually a provider API key) is missing.
 * Fails the application context before any connection is accepted.
 */
public class ConfigurationException extends CallCopilotException {

    private final String propertyName;

    public ConfigurationException(String message, String propertyName) {
        super(message + " (property: " + propertyName + ")");
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
