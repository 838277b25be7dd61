package com.phillippitts.callcopilot.exception;

/**
 * Thrown when a call to an external capability (case-management API, LLM, knowledge base,
 * transcription provider) fails.
 *
 * <p>{@link #isRetryable()} tells the retry executor whether another attempt may succeed:
 * network errors, HTTP 5xx, 408 and 429 are retryable; other 4xx responses and
 * malformed bodies are not.
 *
 * @see UpstreamExceptionBuilder
 */
public class UpstreamException extends CallCopilotException {

    /** Sentinel for failures that never produced an HTTP status. */
    public static final int NO_STATUS = -1;

    private final String destination;
    private final int statusCode;
    private final boolean retryable;

    public UpstreamException(String message, String destination, int statusCode, boolean retryable) {
        super(message);
        this.destination = destination;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public UpstreamException(String message, String destination, int statusCode, boolean retryable,
                             Throwable cause) {
        super(message, cause);
        this.destination = destination;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public String getDestination() {
        return destination;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Classifies an HTTP status as transient.
     *
     * @param status HTTP status code
     * @return true for 5xx, 408 and 429
     */
    public static boolean isRetryableStatus(int status) {
        return status >= 500 || status == 408 || status == 429;
    }
}
