package com.phillippitts.callcopilot.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link UpstreamException} with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw UpstreamExceptionBuilder.create("Frontend request failed")
 *         .destination("frontend")
 *         .status(503)
 *         .metadata("path", "/api/calls/intent")
 *         .build();
 *
 * throw UpstreamExceptionBuilder.create("LLM request failed")
 *         .destination("llm")
 *         .cause(ioException)
 *         .retryable(true)
 *         .build();
 * </pre>
 *
 * <p>When a status is set and {@link #retryable(boolean)} is not called, retryability is
 * derived from the status via {@link UpstreamException#isRetryableStatus(int)}. Without a
 * status and without an explicit flag, a failure with a cause is treated as a network error
 * and is retryable.
 */
public final class UpstreamExceptionBuilder {

    private final String message;
    private String destination;
    private Throwable cause;
    private Integer status;
    private Boolean retryable;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private UpstreamExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static UpstreamExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new UpstreamExceptionBuilder(message);
    }

    public UpstreamExceptionBuilder destination(String destination) {
        this.destination = destination;
        return this;
    }

    public UpstreamExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public UpstreamExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public UpstreamExceptionBuilder retryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    public UpstreamExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public UpstreamExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (destination={dest}, status={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed UpstreamException
     */
    public UpstreamException build() {
        String dest = destination != null ? destination : "unknown";
        int code = status != null ? status : UpstreamException.NO_STATUS;
        boolean canRetry = resolveRetryable();
        String detailed = buildDetailedMessage(dest);
        if (cause != null) {
            return new UpstreamException(detailed, dest, code, canRetry, cause);
        }
        return new UpstreamException(detailed, dest, code, canRetry);
    }

    private boolean resolveRetryable() {
        if (retryable != null) {
            return retryable;
        }
        if (status != null) {
            return UpstreamException.isRetryableStatus(status);
        }
        return cause != null;
    }

    private String buildDetailedMessage(String dest) {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" (destination=").append(dest);
        if (status != null) {
            sb.append(", status=").append(status);
        }
        if (durationMs != null) {
            sb.append(", durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(", ").append(entry.getKey()).append('=').append(entry.getValue());
        }
        sb.append(')');
        return sb.toString();
    }
}
