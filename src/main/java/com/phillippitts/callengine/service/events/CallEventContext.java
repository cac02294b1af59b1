package com.phillippitts.callengine.service.events;

import com.phillippitts.callengine.domain.EventEnvelope;
import com.phillippitts.callengine.exception.SessionStoreException;
import com.phillippitts.callengine.service.events.payload.CallEventPayload;
import com.phillippitts.callengine.service.session.CallSession;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-dispatch view of one event bound to one call.
 *
 * <p>Created fresh for every event and discarded after its handlers ran. The session handle is
 * opened lazily on first use and shared by all handlers of the same event, so a later handler
 * sees what an earlier one persisted.
 */
public class CallEventContext {

    private final EventEnvelope envelope;
    private final String callConnectionId;
    private final DecodedEvent decoded;
    private final CallEventRuntime runtime;
    private CallSession session;

    public CallEventContext(EventEnvelope envelope,
                            String callConnectionId,
                            DecodedEvent decoded,
                            CallEventRuntime runtime) {
        this.envelope = Objects.requireNonNull(envelope, "envelope");
        this.callConnectionId = Objects.requireNonNull(callConnectionId, "callConnectionId");
        this.decoded = Objects.requireNonNull(decoded, "decoded");
        this.runtime = runtime == null ? new CallEventRuntime(null, null, null, null) : runtime;
    }

    public EventEnvelope envelope() {
        return envelope;
    }

    public String callConnectionId() {
        return callConnectionId;
    }

    /**
     * The event type handlers should act on. For {@link EventTypes#WEBHOOK_EVENTS} this is the
     * embedded original type, not the envelope type.
     */
    public String eventType() {
        return decoded.effectiveType();
    }

    /**
     * Decoded payload. Never null; empty when the payload could not be decoded.
     */
    public Map<String, Object> eventData() {
        return decoded.data();
    }

    public CallEventPayload payload() {
        return decoded.payload();
    }

    public <T extends CallEventPayload> Optional<T> payload(Class<T> type) {
        return type.isInstance(decoded.payload()) ? Optional.of(type.cast(decoded.payload())) : Optional.empty();
    }

    public Object field(String name, Object defaultValue) {
        return decoded.data().getOrDefault(name, defaultValue);
    }

    public CallEventRuntime runtime() {
        return runtime;
    }

    /**
     * Opens (once) the session for this call.
     *
     * @return the session, or empty when no store is attached
     * @throws SessionStoreException when the store is attached but unavailable
     */
    public Optional<CallSession> session() {
        if (session == null && runtime.sessionStore() != null) {
            session = runtime.sessionStore().session(callConnectionId);
        }
        return Optional.ofNullable(session);
    }

    @Override
    public String toString() {
        return "CallEventContext{callConnectionId=" + callConnectionId
                + ", eventType=" + eventType()
                + ", envelopeType=" + envelope.type() + '}';
    }
}
