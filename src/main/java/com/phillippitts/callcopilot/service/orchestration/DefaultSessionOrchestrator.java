package com.phillippitts.callcopilot.service.orchestration;

import com.phillippitts.callcopilot.config.properties.SessionProperties;
import com.phillippitts.callcopilot.exception.InvalidPayloadException;
import com.phillippitts.callcopilot.exception.ProtocolException;
import com.phillippitts.callcopilot.exception.ProtocolParseException;
import com.phillippitts.callcopilot.exception.SessionFatalException;
import com.phillippitts.callcopilot.service.disposition.DispositionService;
import com.phillippitts.callcopilot.service.fanout.SessionLogContext;
import com.phillippitts.callcopilot.service.fanout.TranscriptFanout;
import com.phillippitts.callcopilot.service.metrics.CopilotMetrics;
import com.phillippitts.callcopilot.service.pipeline.PipelineHandle;
import com.phillippitts.callcopilot.service.pipeline.PipelineManager;
import com.phillippitts.callcopilot.service.protocol.CarrierEvent;
import com.phillippitts.callcopilot.service.protocol.CarrierProtocolCodec;
import com.phillippitts.callcopilot.service.session.SessionRegistry;
import com.phillippitts.callcopilot.service.session.StreamSession;
import com.phillippitts.callcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link SessionOrchestrator}.
 *
 * <p>The receive path only decodes, updates session state and hands audio to the pipeline;
 * transcript fan-out and end-of-call disposition run on the fan-out executor. A session is
 * removed from the registry exactly once, when it reaches CLOSED.
 *
 * <p>Thread-safe: state lives in the {@link SessionRegistry} and in each
 * {@link StreamSession}; the only local state maps connections to the stream they carry.
 */
@Component
public class DefaultSessionOrchestrator implements SessionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultSessionOrchestrator.class);

    private final CarrierProtocolCodec codec;
    private final SessionRegistry registry;
    private final PipelineManager pipelines;
    private final TranscriptFanout fanout;
    private final DispositionService dispositions;
    private final SessionProperties properties;
    private final CopilotMetrics metrics;
    private final Clock clock;

    // connection id -> stream id
    private final Map<String, String> connectionStreams = new ConcurrentHashMap<>();

    public DefaultSessionOrchestrator(CarrierProtocolCodec codec,
                                      SessionRegistry registry,
                                      PipelineManager pipelines,
                                      TranscriptFanout fanout,
                                      DispositionService dispositions,
                                      SessionProperties properties,
                                      CopilotMetrics metrics,
                                      Clock clock) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.pipelines = Objects.requireNonNull(pipelines, "pipelines must not be null");
        this.fanout = Objects.requireNonNull(fanout, "fanout must not be null");
        this.dispositions = Objects.requireNonNull(dispositions, "dispositions must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void onFrame(CarrierConnection connection, String frame) {
        Objects.requireNonNull(connection, "connection must not be null");
        CarrierEvent event;
        try {
            event = codec.decode(frame);
        } catch (ProtocolParseException e) {
            LOG.warn("Dropping unparseable frame on connection {}: {}", connection.id(), e.getMessage());
            metrics.frameRejected("parse");
            return;
        } catch (InvalidPayloadException e) {
            LOG.warn("Dropping media frame with invalid payload: {}", e.getMessage());
            metrics.frameRejected("payload");
            return;
        }

        try {
            dispatch(connection, event);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error handling {} event on connection {}", event.name(), connection.id(), e);
        } finally {
            ThreadContext.remove(SessionLogContext.STREAM_ID);
            ThreadContext.remove(SessionLogContext.CALL_ID);
        }
    }

    private void dispatch(CarrierConnection connection, CarrierEvent event) {
        if (event instanceof CarrierEvent.Media media) {
            ThreadContext.put(SessionLogContext.STREAM_ID, media.streamId());
            handleMedia(media);
        } else if (event instanceof CarrierEvent.Start start) {
            ThreadContext.put(SessionLogContext.STREAM_ID, start.streamId());
            ThreadContext.put(SessionLogContext.CALL_ID, start.callId());
            handleStart(connection, start);
        } else if (event instanceof CarrierEvent.Stop stop) {
            ThreadContext.put(SessionLogContext.STREAM_ID, stop.streamId());
            connectionStreams.remove(connection.id(), stop.streamId());
            drain(stop.streamId(), "stop");
        } else if (event instanceof CarrierEvent.Dtmf dtmf) {
            ThreadContext.put(SessionLogContext.STREAM_ID, dtmf.streamId());
            LOG.info("DTMF on stream {}: digit={}, durationMs={}", dtmf.streamId(), dtmf.digit(), dtmf.durationMs());
        } else if (event instanceof CarrierEvent.Mark mark) {
            ThreadContext.put(SessionLogContext.STREAM_ID, mark.streamId());
            LOG.debug("Mark on stream {}: {}", mark.streamId(), mark.markName());
        } else {
            LOG.info("Carrier connected (connection={})", connection.id());
        }
        metrics.frameAccepted(event.name());
    }

    private void handleStart(CarrierConnection connection, CarrierEvent.Start start) {
        String streamId = start.streamId();
        String owned = connectionStreams.get(connection.id());
        if (owned != null && registry.get(owned).isPresent()) {
            ProtocolException error = new ProtocolException("Start received on a connection that already carries a stream",
                    owned);
            LOG.warn("{}; ignoring start for {}", error.getMessage(), streamId);
            metrics.frameRejected("protocol");
            return;
        }

        String tenantId = start.accountId() == null || start.accountId().isBlank()
                ? properties.getDefaultTenant() : start.accountId();
        StreamSession session = new StreamSession(streamId, start.callId(), tenantId, start.fromNumber(),
                start.toNumber(), start.encoding(), start.sampleRateHz(), clock.instant());

        SessionRegistry.Registration registration = registry.create(session);
        if (!registration.created()) {
            return;
        }

        PipelineHandle handle;
        try {
            handle = pipelines.createPipeline(streamId, session.getCallId(), session.getSampleRateHz(),
                    segment -> fanout.onSegment(session, segment));
        } catch (SessionFatalException e) {
            LOG.error("Session {} could not start; closing connection {}", streamId, connection.id(), e);
            session.close();
            registry.remove(session);
            metrics.sessionFailed();
            connection.close("transcription pipeline unavailable");
            return;
        }

        session.activate(handle);
        connectionStreams.put(connection.id(), streamId);
        metrics.sessionStarted();
        LOG.info("Session started (stream={}, call={}, tenant={}, sampleRate={}, from={}, to={})",
                streamId, session.getCallId(), tenantId, session.getSampleRateHz(),
                LogSanitizer.maskPhone(session.getFromNumber()), LogSanitizer.maskPhone(session.getToNumber()));
    }

    private void handleMedia(CarrierEvent.Media media) {
        if (media.rejected()) {
            LOG.warn("Dropping media for stream {} with no active session (seq={})", media.streamId(),
                    media.sequenceNumber());
            metrics.frameRejected("inactive");
            return;
        }
        StreamSession session = registry.get(media.streamId()).orElse(null);
        if (session == null || !session.isActive()) {
            LOG.warn("Dropping media for stream {}: session no longer active", media.streamId());
            metrics.frameRejected("inactive");
            return;
        }
        session.recordInboundFrame();
        pipelines.feedAudio(media.streamId(), media.audio());
    }

    @Override
    public void onDisconnect(CarrierConnection connection) {
        String streamId = connectionStreams.remove(connection.id());
        if (streamId == null) {
            LOG.debug("Connection {} closed with no live stream", connection.id());
            return;
        }
        ThreadContext.put(SessionLogContext.STREAM_ID, streamId);
        try {
            LOG.info("Connection {} closed while stream {} was live", connection.id(), streamId);
            drain(streamId, "disconnect");
        } finally {
            ThreadContext.remove(SessionLogContext.STREAM_ID);
        }
    }

    /**
     * ACTIVE → DRAINING → CLOSED. Only the first caller for a session does anything.
     *
     * @return future completing once the session is CLOSED and removed
     */
    CompletableFuture<Void> drain(String streamId, String trigger) {
        StreamSession session = registry.get(streamId).orElse(null);
        if (session == null) {
            LOG.debug("{} for unknown or closed stream {}; ignoring", trigger, streamId);
            return CompletableFuture.completedFuture(null);
        }
        if (!session.beginDraining()) {
            LOG.debug("{} for stream {} in state {}; ignoring", trigger, streamId, session.getState());
            return CompletableFuture.completedFuture(null);
        }

        pipelines.stopPipeline(streamId);

        CompletableFuture<Void> disposition;
        if (session.hasTranscript()) {
            disposition = dispositions.generateAndForward(session);
        } else {
            LOG.info("No transcript for stream {}; skipping disposition", streamId);
            disposition = CompletableFuture.completedFuture(null);
        }
        return disposition.whenComplete((v, error) -> close(session, trigger));
    }

    private void close(StreamSession session, String trigger) {
        if (!session.close()) {
            return;
        }
        registry.remove(session);
        metrics.sessionClosed(trigger);
        LOG.info("Session closed (stream={}, trigger={}, frames={}, finals={}, forwarded={}, durationSec={})",
                session.getStreamId(), trigger, session.getInboundSeq(), session.transcriptSnapshot().size(),
                session.getOutboundSeq(), Duration.between(session.getCreatedAt(), clock.instant()).toSeconds());
    }

    @Override
    public int activeSessionCount() {
        return registry.size();
    }
}
