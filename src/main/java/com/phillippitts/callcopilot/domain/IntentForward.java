package com.phillippitts.callcopilot.domain;

import java.util.Objects;

/**
 * Detected intent sent to the case-management backend.
 */
public record IntentForward(String callId, String intent, double confidence, String tenantId) {

    public IntentForward {
        Objects.requireNonNull(callId, "callId must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
    }
}
