package com.phillippitts.callcopilot.service.pipeline.socket;

import com.phillippitts.callcopilot.exception.UpstreamExceptionBuilder;
import com.phillippitts.callcopilot.service.pipeline.PipelineRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Opens provider WebSockets on the pipeline manager's shared {@link HttpClient}.
 */
public final class ProviderSockets {

    private static final Logger LOG = LogManager.getLogger(ProviderSockets.class);

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private ProviderSockets() {
        // Utility class - prevent instantiation
    }

    /**
     * Connects and waits up to {@link #CONNECT_TIMEOUT} for the handshake.
     *
     * @throws com.phillippitts.callcopilot.exception.UpstreamException if the handshake fails
     *         or times out
     */
    public static WebSocket connect(HttpClient httpClient, URI uri, Map<String, String> headers,
                                    WebSocket.Listener listener, String provider, PipelineRequest request) {
        long start = System.nanoTime();
        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(CONNECT_TIMEOUT);
        headers.forEach(builder::header);
        try {
            WebSocket socket = builder.buildAsync(uri, listener)
                    .get(CONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("{} socket open for stream {} in {} ms", provider, request.streamId(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return socket;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw UpstreamExceptionBuilder.create("Interrupted while connecting to " + provider)
                    .destination(provider).cause(e).retryable(false).build();
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            throw UpstreamExceptionBuilder.create("Could not connect to " + provider)
                    .destination(provider)
                    .cause(cause)
                    .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
                    .metadata("sampleRate", request.sampleRateHz())
                    .build();
        }
    }
}
