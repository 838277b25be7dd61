package com.phillippitts.callcopilot.exception;

/**
 * Thrown when a session cannot be brought up, typically because the transcription
 * pipeline could not be created. Terminates that stream only.
 */
public class SessionFatalException extends CallCopilotException {

    private final String streamId;

    public SessionFatalException(String message, String streamId) {
        super(message + " (stream: " + streamId + ")");
        this.streamId = streamId;
    }

    public SessionFatalException(String message, String streamId, Throwable cause) {
        super(message + " (stream: " + streamId + ")", cause);
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }
}
