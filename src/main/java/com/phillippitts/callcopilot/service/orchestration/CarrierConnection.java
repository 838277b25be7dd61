package com.phillippitts.callcopilot.service.orchestration;

/**
 * The transport connection a carrier stream arrives on.
 */
public interface CarrierConnection {

    /** Unique id of this connection for the life of the process. */
    String id();

    /**
     * Closes the connection. Must not throw; implementations log their own failures.
     *
     * @param reason short reason sent to the carrier
     */
    void close(String reason);
}
