package com.phillippitts.callcopilot.service.orchestration;

/**
 * Drives the per-call state machine from carrier frames.
 *
 * <p>States: {@code AWAITING_START → ACTIVE → DRAINING → CLOSED}. Each call is independent;
 * a failure while handling one frame is logged and never reaches the transport or other
 * calls.
 */
public interface SessionOrchestrator {

    /**
     * Handles one inbound text frame. Returns without waiting on any downstream call.
     */
    void onFrame(CarrierConnection connection, String frame);

    /**
     * Handles the transport going away; drains the connection's stream if it is still active.
     */
    void onDisconnect(CarrierConnection connection);

    /** Number of registered sessions. */
    int activeSessionCount();
}
