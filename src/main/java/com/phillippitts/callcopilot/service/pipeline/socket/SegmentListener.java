package com.phillippitts.callcopilot.service.pipeline.socket;

import com.phillippitts.callcopilot.service.pipeline.TranscriptSegment;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSink;
import com.phillippitts.callcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.WebSocket;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Reassembles provider text messages and hands parsed segments to the sink. A failing sink
 * is logged and does not stop the listener.
 */
public final class SegmentListener implements WebSocket.Listener {

    private static final Logger LOG = LogManager.getLogger(SegmentListener.class);

    private final String provider;
    private final String streamId;
    private final TranscriptSink sink;
    private final Function<String, Optional<TranscriptSegment>> parser;
    private final StringBuilder buffer = new StringBuilder();

    public SegmentListener(String provider, String streamId, TranscriptSink sink,
                           Function<String, Optional<TranscriptSegment>> parser) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.streamId = Objects.requireNonNull(streamId, "streamId must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        buffer.append(data);
        if (last) {
            String message = buffer.toString();
            buffer.setLength(0);
            parser.apply(message).ifPresent(this::deliver);
        }
        webSocket.request(1);
        return null;
    }

    private void deliver(TranscriptSegment segment) {
        try {
            sink.onSegment(segment);
        } catch (RuntimeException e) {
            LOG.error("Transcript sink failed for stream {} (text='{}')", streamId,
                    LogSanitizer.truncate(segment.text(), 40), e);
        }
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        LOG.debug("{} socket closed for stream {} (status={}, reason={})", provider, streamId, statusCode, reason);
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        LOG.warn("{} socket error for stream {}: {}", provider, streamId, error.toString());
    }
}
