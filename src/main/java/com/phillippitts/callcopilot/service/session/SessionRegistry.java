package com.phillippitts.callcopilot.service.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions keyed by stream id.
 *
 * <p>Every operation is atomic per key and no operation locks more than one key, so
 * sessions never contend with each other. A duplicate registration keeps the session
 * that got there first.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, StreamSession> sessions = new ConcurrentHashMap<>();

    /**
     * Outcome of {@link #create(StreamSession)}.
     *
     * @param session the registered session (the existing one if {@code created} is false)
     * @param created whether the given session was newly registered
     */
    public record Registration(StreamSession session, boolean created) {
    }

    /**
     * Registers {@code session} unless its stream id is already taken.
     */
    public Registration create(StreamSession session) {
        Objects.requireNonNull(session, "session must not be null");
        StreamSession existing = sessions.putIfAbsent(session.getStreamId(), session);
        if (existing != null) {
            LOG.warn("Session already registered for stream {}; keeping existing (state={})",
                    session.getStreamId(), existing.getState());
            return new Registration(existing, false);
        }
        return new Registration(session, true);
    }

    public Optional<StreamSession> get(String streamId) {
        if (streamId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(streamId));
    }

    /**
     * Removes {@code session} only if it is still the one registered for its stream id.
     * Safe to call more than once.
     *
     * @return true if this call removed it
     */
    public boolean remove(StreamSession session) {
        Objects.requireNonNull(session, "session must not be null");
        return sessions.remove(session.getStreamId(), session);
    }

    /**
     * Removes whatever session is registered under {@code streamId}.
     *
     * @return true if a session was removed
     */
    public boolean remove(String streamId) {
        return streamId != null && sessions.remove(streamId) != null;
    }

    public List<StreamSession> activeSessions() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
