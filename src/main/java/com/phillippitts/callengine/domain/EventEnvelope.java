package com.phillippitts.callengine.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One inbound protocol event as handed over by the transport layer.
 *
 * <p>{@code data} is untyped: webhooks deliver maps, JSON strings or raw bytes,
 * and synthesized events may carry arbitrary beans. The processor decodes it once at ingress.
 *
 * @param source origin of the event (e.g. "azure.communication.callautomation", "api/v1/lifecycle")
 * @param type catalog event type string
 * @param data opaque payload
 * @param headers transport headers, used as a fallback for call correlation
 * @param receivedAt when the transport received the event
 */
public record EventEnvelope(
        String source,
        String type,
        Object data,
        Map<String, String> headers,
        Instant receivedAt
) {
    public EventEnvelope {
        Objects.requireNonNull(type, "type");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }

    public static EventEnvelope of(String source, String type, Object data) {
        return new EventEnvelope(source, type, data, Map.of(), Instant.now());
    }
}
