package com.phillippitts.callcopilot.exception;

/**
 * Thrown when a media frame carries a payload that is empty or not base64.
 * Only that frame is dropped.
 */
public class InvalidPayloadException extends CallCopilotException {

    private final String streamId;
    private final int payloadLength;

    public InvalidPayloadException(String message, String streamId, int payloadLength) {
        super(message + " (stream: " + streamId + ", length: " + payloadLength + ")");
        this.streamId = streamId;
        this.payloadLength = payloadLength;
    }

    public String getStreamId() {
        return streamId;
    }

    public int getPayloadLength() {
        return payloadLength;
    }
}
