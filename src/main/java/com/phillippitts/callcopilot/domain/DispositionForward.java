package com.phillippitts.callcopilot.domain;

import java.util.Objects;

/**
 * End-of-call notes and dispositions sent to the case-management backend.
 *
 * @param author recorded as the creator of the notes
 */
public record DispositionForward(String callId, String tenantId, DispositionSummary summary, String author) {

    public DispositionForward {
        Objects.requireNonNull(callId, "callId must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(author, "author must not be null");
    }
}
