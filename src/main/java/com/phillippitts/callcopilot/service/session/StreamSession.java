package com.phillippitts.callcopilot.service.session;

import com.phillippitts.callcopilot.service.pipeline.PipelineHandle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one live call.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * AWAITING_START → ACTIVE   (via activate)
 * ACTIVE         → DRAINING (via beginDraining)
 * DRAINING       → CLOSED   (via close)
 * AWAITING_START → CLOSED   (via close, when the pipeline could not be created)
 * </pre>
 *
 * <p>Identity fields and {@code sampleRateHz} are fixed at construction. Lifecycle state and
 * the pipeline handle are guarded by a {@link ReentrantLock}; counters are atomic; the
 * transcript log is guarded by its own monitor. Nothing here locks across sessions.
 */
public final class StreamSession {

    /**
     * Lifecycle states of a session.
     */
    public enum LifecycleState {
        AWAITING_START,
        ACTIVE,
        DRAINING,
        CLOSED
    }

    private final String streamId;
    private final String callId;
    private final String tenantId;
    private final String fromNumber;
    private final String toNumber;
    private final String encoding;
    private final int sampleRateHz;
    private final Instant createdAt;

    private final AtomicLong inboundSeq = new AtomicLong();
    private final AtomicLong outboundSeq = new AtomicLong();
    private final List<String> transcriptLog = new ArrayList<>();

    private final Lock lock = new ReentrantLock();
    private LifecycleState state = LifecycleState.AWAITING_START;
    private PipelineHandle pipelineHandle;

    public StreamSession(String streamId, String callId, String tenantId, String fromNumber, String toNumber,
                         String encoding, int sampleRateHz, Instant createdAt) {
        this.streamId = requireText(streamId, "streamId");
        this.callId = callId == null ? "" : callId;
        this.tenantId = requireText(tenantId, "tenantId");
        this.fromNumber = fromNumber == null ? "" : fromNumber;
        this.toNumber = toNumber == null ? "" : toNumber;
        this.encoding = encoding == null ? "" : encoding;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (sampleRateHz != 8000 && sampleRateHz != 16000) {
            throw new IllegalArgumentException("sampleRateHz must be 8000 or 16000, got: " + sampleRateHz);
        }
        this.sampleRateHz = sampleRateHz;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    /**
     * Moves AWAITING_START to ACTIVE and attaches the pipeline.
     *
     * @return false if the session was not awaiting start
     */
    public boolean activate(PipelineHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        lock.lock();
        try {
            if (state != LifecycleState.AWAITING_START) {
                return false;
            }
            state = LifecycleState.ACTIVE;
            pipelineHandle = handle;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves ACTIVE to DRAINING and detaches the pipeline. Only the first caller wins.
     *
     * @return true if this call performed the transition
     */
    public boolean beginDraining() {
        lock.lock();
        try {
            if (state != LifecycleState.ACTIVE) {
                return false;
            }
            state = LifecycleState.DRAINING;
            pipelineHandle = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the session to CLOSED from DRAINING or AWAITING_START.
     *
     * @return true if this call performed the transition
     */
    public boolean close() {
        lock.lock();
        try {
            if (state != LifecycleState.DRAINING && state != LifecycleState.AWAITING_START) {
                return false;
            }
            state = LifecycleState.CLOSED;
            pipelineHandle = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public LifecycleState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive() {
        return getState() == LifecycleState.ACTIVE;
    }

    public PipelineHandle getPipelineHandle() {
        lock.lock();
        try {
            return pipelineHandle;
        } finally {
            lock.unlock();
        }
    }

    /** Counts one accepted audio frame. */
    public long recordInboundFrame() {
        return inboundSeq.incrementAndGet();
    }

    /** Next sequence number for an item forwarded downstream; first value is 1. */
    public long nextOutboundSeq() {
        return outboundSeq.incrementAndGet();
    }

    /**
     * Appends a finalized transcript and assigns its forward sequence number in one step,
     * so log order and sequence order always agree.
     *
     * @return the outbound sequence number assigned to this entry
     */
    public long appendFinal(String text) {
        Objects.requireNonNull(text, "text must not be null");
        synchronized (transcriptLog) {
            transcriptLog.add(text);
            return outboundSeq.incrementAndGet();
        }
    }

    /** Up to {@code count} most recent final entries, oldest first. */
    public List<String> recentTranscripts(int count) {
        synchronized (transcriptLog) {
            int from = Math.max(0, transcriptLog.size() - count);
            return List.copyOf(transcriptLog.subList(from, transcriptLog.size()));
        }
    }

    public List<String> transcriptSnapshot() {
        synchronized (transcriptLog) {
            return Collections.unmodifiableList(new ArrayList<>(transcriptLog));
        }
    }

    public boolean hasTranscript() {
        synchronized (transcriptLog) {
            return !transcriptLog.isEmpty();
        }
    }

    public String getStreamId() {
        return streamId;
    }

    public String getCallId() {
        return callId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getFromNumber() {
        return fromNumber;
    }

    public String getToNumber() {
        return toNumber;
    }

    public String getEncoding() {
        return encoding;
    }

    public int getSampleRateHz() {
        return sampleRateHz;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getInboundSeq() {
        return inboundSeq.get();
    }

    public long getOutboundSeq() {
        return outboundSeq.get();
    }

    @Override
    public String toString() {
        return "StreamSession{streamId=" + streamId + ", callId=" + callId + ", state=" + getState()
                + ", sampleRateHz=" + sampleRateHz + '}';
    }
}
