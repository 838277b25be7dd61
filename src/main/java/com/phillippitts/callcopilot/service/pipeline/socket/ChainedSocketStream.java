package com.phillippitts.callcopilot.service.pipeline.socket;

import com.phillippitts.callcopilot.service.pipeline.TranscriptionStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.WebSocket;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link TranscriptionStream} over a provider WebSocket.
 *
 * <p>Sends are chained so at most one is outstanding on the socket and callers never wait
 * for them. On close the optional end-of-stream text message is sent after any queued
 * audio, followed by a normal close frame.
 */
public final class ChainedSocketStream implements TranscriptionStream {

    private static final Logger LOG = LogManager.getLogger(ChainedSocketStream.class);

    /**
     * Encodes one audio chunk onto the socket in the provider's wire format.
     */
    @FunctionalInterface
    public interface AudioWriter {
        CompletableFuture<WebSocket> write(WebSocket socket, byte[] pcm);
    }

    private final String provider;
    private final String streamId;
    private final WebSocket socket;
    private final AudioWriter writer;
    private final String endOfStream;
    private CompletableFuture<WebSocket> sendChain;
    private boolean closed;

    /**
     * @param endOfStream text sent before the close frame, or null for none
     */
    public ChainedSocketStream(String provider, String streamId, WebSocket socket, AudioWriter writer,
                               String endOfStream) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.streamId = Objects.requireNonNull(streamId, "streamId must not be null");
        this.socket = Objects.requireNonNull(socket, "socket must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.endOfStream = endOfStream;
        this.sendChain = CompletableFuture.completedFuture(socket);
    }

    @Override
    public synchronized CompletableFuture<Void> sendAudio(byte[] pcm) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Stream closed: " + streamId));
        }
        CompletableFuture<WebSocket> next = sendChain.thenCompose(ws -> writer.write(ws, pcm));
        // A failed send must not poison later sends
        sendChain = next.handle((ws, error) -> socket);
        return next.thenApply(ws -> null);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        CompletableFuture<WebSocket> drained = endOfStream == null
                ? sendChain
                : sendChain.thenCompose(ws -> ws.sendText(endOfStream, true));
        drained.thenCompose(ws -> ws.sendClose(WebSocket.NORMAL_CLOSURE, "stream stopped"))
                .whenComplete((ws, error) -> {
                    if (error != null) {
                        LOG.warn("{} close failed for stream {}: {}", provider, streamId, error.toString());
                        socket.abort();
                    }
                });
    }
}
