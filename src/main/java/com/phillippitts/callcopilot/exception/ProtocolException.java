package com.phillippitts.callcopilot.exception;

/**
 * Thrown when a well-formed event arrives out of sequence, e.g. a second start on a
 * connection that already owns a live stream.
 */
public class ProtocolException extends CallCopilotException {

    private final String streamId;

    public ProtocolException(String message, String streamId) {
        super(message + " (stream: " + streamId + ")");
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }
}
