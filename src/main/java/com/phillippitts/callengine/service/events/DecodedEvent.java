package com.phillippitts.callengine.service.events;

import com.phillippitts.callengine.service.events.payload.CallEventPayload;

import java.util.Map;

/**
 * Result of decoding an envelope once at ingress.
 *
 * @param effectiveType the embedded original type for webhook wrappers, else the envelope type
 * @param rawData the envelope payload as a map (outer wrapper for webhook events)
 * @param data the payload the handlers read (inner payload for webhook events)
 * @param payload typed view of {@code data} keyed by {@code effectiveType}
 */
public record DecodedEvent(
        String effectiveType,
        Map<String, Object> rawData,
        Map<String, Object> data,
        CallEventPayload payload
) {
}
