package com.phillippitts.callcopilot.service.pipeline;

/**
 * Receives segments from one transcription stream. Implementations must return quickly;
 * the provider calls this on its own I/O thread.
 */
@FunctionalInterface
public interface TranscriptSink {

    void onSegment(TranscriptSegment segment);
}
