package com.phillippitts.callcopilot.service.fanout;

import com.phillippitts.callcopilot.service.session.StreamSession;
import org.apache.logging.log4j.ThreadContext;

/**
 * Puts a session's identifiers into the Log4j2 ThreadContext for the duration of a task.
 */
public final class SessionLogContext {

    public static final String STREAM_ID = "streamId";
    public static final String CALL_ID = "callId";

    private SessionLogContext() {
    }

    public static Runnable wrap(StreamSession session, Runnable task) {
        return () -> {
            String previousStream = ThreadContext.get(STREAM_ID);
            String previousCall = ThreadContext.get(CALL_ID);
            ThreadContext.put(STREAM_ID, session.getStreamId());
            ThreadContext.put(CALL_ID, session.getCallId());
            try {
                task.run();
            } finally {
                restore(STREAM_ID, previousStream);
                restore(CALL_ID, previousCall);
            }
        };
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }
}
