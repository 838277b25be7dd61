package com.phillippitts.callcopilot.service.pipeline;

import java.time.Instant;
import java.util.Objects;

/**
 * One transcript segment emitted by a transcription stream.
 *
 * @param text recognized text, never null
 * @param isFinal true when the provider will not revise this span again
 * @param confidence provider confidence in [0.0, 1.0]
 * @param receivedAt time the segment arrived from the provider
 */
public record TranscriptSegment(String text, boolean isFinal, double confidence, Instant receivedAt) {

    public TranscriptSegment {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0.0, 1.0], got: " + confidence);
        }
    }

    public static TranscriptSegment finalSegment(String text, double confidence) {
        return new TranscriptSegment(text, true, confidence, Instant.now());
    }

    public static TranscriptSegment partialSegment(String text, double confidence) {
        return new TranscriptSegment(text, false, confidence, Instant.now());
    }
}
