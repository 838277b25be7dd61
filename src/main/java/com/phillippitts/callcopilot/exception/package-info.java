/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.callcopilot.exception.CallCopilotException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.callcopilot.exception.ProtocolParseException} - malformed
 *       carrier frame or unknown event; frame dropped</li>
 *   <li>{@link com.phillippitts.callcopilot.exception.ProtocolException} - event out of
 *       sequence; frame dropped</li>
 *   <li>{@link com.phillippitts.callcopilot.exception.InvalidPayloadException} - media payload
 *       is not base64; frame dropped</li>
 *   <li>{@link com.phillippitts.callcopilot.exception.UpstreamException} - external capability
 *       failed; retried when {@code retryable}, then degraded</li>
 *   <li>{@link com.phillippitts.callcopilot.exception.CircuitOpenException} - breaker rejected
 *       the call without attempting it</li>
 *   <li>{@link com.phillippitts.callcopilot.exception.SessionFatalException} - pipeline could
 *       not be created; terminates one stream</li>
 *   <li>{@link com.phillippitts.callcopilot.exception.ConfigurationException} - missing
 *       credentials at startup; terminates the process</li>
 * </ul>
 *
 * <p>Per-frame and per-session exceptions are caught and logged by the session orchestrator
 * and never reach other sessions. Only {@code ConfigurationException} is process-fatal.
 *
 * @see com.phillippitts.callcopilot.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.callcopilot.exception;
