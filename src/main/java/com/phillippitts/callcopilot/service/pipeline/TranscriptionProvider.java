package com.phillippitts.callcopilot.service.pipeline;

import com.phillippitts.callcopilot.exception.UpstreamException;

import java.net.http.HttpClient;

/**
 * Streaming speech-to-text capability. One implementation per provider, chosen at startup.
 *
 * <p>Implementations are stateless factories; all per-call state lives in the returned
 * {@link TranscriptionStream}.
 *
 * @see com.phillippitts.callcopilot.config.ProviderConfig
 */
public interface TranscriptionProvider {

    /**
     * Opens a stream for one call. May block the calling thread until the provider
     * connection is established.
     *
     * @param request stream parameters
     * @param sink receiver for emitted segments
     * @param httpClient shared client owned by the pipeline manager
     * @return live stream
     * @throws UpstreamException if the provider cannot be reached or rejects the request
     */
    TranscriptionStream open(PipelineRequest request, TranscriptSink sink, HttpClient httpClient);

    /** Provider name for logs. */
    String name();
}
