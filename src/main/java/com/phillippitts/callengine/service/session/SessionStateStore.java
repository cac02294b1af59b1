package com.phillippitts.callengine.service.session;

import com.phillippitts.callengine.exception.SessionStoreException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Durable per-call state plus a cross-process notification stream.
 *
 * <p>The storage engine itself, and the retention/TTL of sessions after a call ends, belong to
 * the implementation. The engine only opens sessions, persists them and uses the stream
 * primitive to rendezvous on DTMF validation outcomes.
 */
public interface SessionStateStore {

    /**
     * Opens a handle on the session for a call, creating empty state on first use.
     *
     * @throws SessionStoreException when the store is unavailable
     */
    CallSession session(String callConnectionId);

    /**
     * Resolves the presentation (UI-facing) session id mapped to a call connection id.
     */
    Optional<String> presentationSessionId(String callConnectionId);

    /**
     * Appends an event to a stream and wakes any reader blocked on it.
     */
    void publishEvent(String streamKey, Map<String, String> fields);

    /**
     * Blocks until an event is appended to {@code streamKey} after this call starts, or until
     * the timeout elapses.
     *
     * @return the event fields, or empty on timeout
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<Map<String, String>> readEventBlocking(String streamKey, Duration timeout) throws InterruptedException;
}
