package com.phillippitts.callcopilot.service.pipeline;

import com.phillippitts.callcopilot.exception.SessionFatalException;

/**
 * Owns exactly one transcription pipeline per active stream and the outbound connection
 * pool those pipelines share.
 *
 * <p>Only {@link #createPipeline} reports failure to the caller. Feed and stop failures are
 * logged and absorbed.
 */
public interface PipelineManager {

    /**
     * Opens a pipeline for {@code streamId}. A second call for a stream that already has a
     * live pipeline logs a warning and returns the existing handle.
     *
     * @throws SessionFatalException if the pipeline cannot be created
     */
    PipelineHandle createPipeline(String streamId, String callId, int sampleRateHz, TranscriptSink sink);

    /**
     * Sends audio to the stream's pipeline. Drops the bytes with a warning if no pipeline
     * is live for {@code streamId}.
     */
    void feedAudio(String streamId, byte[] audio);

    /**
     * Stops the stream's pipeline. No-op for unknown or already-stopped streams.
     */
    void stopPipeline(String streamId);

    /**
     * Stops every pipeline and releases the shared pool. Later calls are no-ops.
     */
    void shutdown();

    int activeCount();
}
