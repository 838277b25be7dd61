package com.phillippitts.callcopilot.exception;

/**
 * Thrown when an inbound carrier frame is not valid JSON or names an unknown event.
 * The frame is dropped; the session is unaffected.
 */
public class ProtocolParseException extends CallCopilotException {

    private final String eventName;

    public ProtocolParseException(String message) {
        super(message);
        this.eventName = null;
    }

    public ProtocolParseException(String message, String eventName) {
        super(message + " (event: " + eventName + ")");
        this.eventName = eventName;
    }

    public ProtocolParseException(String message, Throwable cause) {
        super(message, cause);
        this.eventName = null;
    }

    /**
     * @return the {@code event} field of the offending frame, or {@code null} if it could not be read
     */
    public String getEventName() {
        return eventName;
    }
}
