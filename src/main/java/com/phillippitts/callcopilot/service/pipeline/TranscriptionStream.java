package com.phillippitts.callcopilot.service.pipeline;

import java.util.concurrent.CompletableFuture;

/**
 * A live streaming-transcription connection for one call.
 *
 * <p>{@link #sendAudio(byte[])} must never block the caller: implementations queue or chain
 * sends and report failures through the returned future. {@link #close()} is idempotent.
 */
public interface TranscriptionStream extends AutoCloseable {

    /**
     * Sends a chunk of little-endian PCM16 mono audio.
     *
     * @param pcm audio bytes
     * @return future completing when the chunk has been handed to the provider
     */
    CompletableFuture<Void> sendAudio(byte[] pcm);

    @Override
    void close();
}
