package com.phillippitts.callcopilot.domain;

import java.util.Objects;

/**
 * Transcript item sent to the case-management backend.
 *
 * @param seq strictly increasing per call; the receiver uses it for ordering and de-duplication
 */
public record TranscriptForward(String callId, String text, long seq, SegmentType type, String tenantId) {

    public TranscriptForward {
        Objects.requireNonNull(callId, "callId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        if (seq <= 0) {
            throw new IllegalArgumentException("seq must be positive, got: " + seq);
        }
    }
}
