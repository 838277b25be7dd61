package com.phillippitts.callcopilot.exception;

/**
 * Base exception for all call-copilot application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CallCopilotException extends RuntimeException {

    public CallCopilotException(String message) {
        super(message);
    }

    public CallCopilotException(String message, Throwable cause) {
        super(message, cause);
    }

    public CallCopilotException(Throwable cause) {
        super(cause);
    }
}
