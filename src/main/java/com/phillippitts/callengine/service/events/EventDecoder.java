package com.phillippitts.callengine.service.events;

import com.phillippitts.callengine.domain.EventEnvelope;
import com.phillippitts.callengine.service.events.payload.CallEventPayloads;

import java.util.Map;

/**
 * Decodes an {@link EventEnvelope} into a {@link DecodedEvent}, unwrapping the
 * {@link EventTypes#WEBHOOK_EVENTS} meta-type one level.
 */
public final class EventDecoder {

    private EventDecoder() {}

    public static DecodedEvent decode(EventEnvelope envelope) {
        Map<String, Object> raw = EventData.toMap(envelope.data());
        String effectiveType = envelope.type();
        Map<String, Object> data = raw;

        if (EventTypes.WEBHOOK_EVENTS.equals(envelope.type())) {
            String original = EventData.string(raw, "eventType");
            if (original == null) {
                original = EventData.string(raw, "originalEventType");
            }
            if (original != null) {
                effectiveType = original;
            }
            Map<String, Object> inner = EventData.object(raw, "data");
            if (!inner.isEmpty()) {
                data = inner;
            }
        }
        return new DecodedEvent(effectiveType, raw, data, CallEventPayloads.decode(effectiveType, data));
    }
}
