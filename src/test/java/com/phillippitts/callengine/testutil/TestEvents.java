package com.phillippitts.callengine.testutil;

import com.phillippitts.callengine.domain.EventEnvelope;
import com.phillippitts.callengine.service.events.EventTypes;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Envelope factories shaped like real provider webhooks.
 */
public final class TestEvents {

    public static final String PROVIDER_SOURCE = "azure.communication.callautomation";
    public static final String API_SOURCE = "api/v1";

    private TestEvents() {}

    public static EventEnvelope event(String type, String callId) {
        return EventEnvelope.of(PROVIDER_SOURCE, type, Map.of("callConnectionId", callId));
    }

    public static EventEnvelope callConnected(String callId) {
        return EventEnvelope.of(PROVIDER_SOURCE, EventTypes.CALL_CONNECTED, Map.of(
                "callConnectionId", callId,
                "callConnectionProperties", Map.of("connectedTime", "2024-05-01T10:00:00Z")));
    }

    public static EventEnvelope callDisconnected(String callId) {
        return EventEnvelope.of(PROVIDER_SOURCE, EventTypes.CALL_DISCONNECTED, Map.of(
                "callConnectionId", callId,
                "callConnectionState", "disconnected"));
    }

    public static EventEnvelope participantsUpdated(String callId) {
        return EventEnvelope.of(PROVIDER_SOURCE, EventTypes.PARTICIPANTS_UPDATED, Map.of(
                "callConnectionId", callId,
                "participants", List.of(
                        Map.of("identifier", Map.of(
                                        "kind", "phoneNumber",
                                        "rawId", "4:+14255550123",
                                        "phoneNumber", Map.of("value", "+14255550123")),
                                "isMuted", false),
                        Map.of("identifier", Map.of(
                                        "kind", "communicationUser",
                                        "rawId", "8:acs:resource_bot",
                                        "communicationUser", Map.of("id", "8:acs:resource_bot")),
                                "isMuted", true))));
    }

    public static EventEnvelope tone(String callId, String tone) {
        return tone(callId, tone, null);
    }

    public static EventEnvelope tone(String callId, String tone, Integer sequenceId) {
        Map<String, Object> data = new HashMap<>();
        data.put("callConnectionId", callId);
        data.put("tone", tone);
        if (sequenceId != null) {
            data.put("sequenceId", sequenceId);
        }
        return EventEnvelope.of(PROVIDER_SOURCE, EventTypes.DTMF_TONE_RECEIVED, data);
    }

    /**
     * Wraps a provider event in the {@code V1.Webhook.Events} meta-type.
     */
    public static EventEnvelope webhook(String callId, String originalType, Map<String, Object> inner) {
        Map<String, Object> innerData = new HashMap<>(inner);
        innerData.put("callConnectionId", callId);
        return EventEnvelope.of(API_SOURCE, EventTypes.WEBHOOK_EVENTS, Map.of(
                "eventType", originalType,
                "data", innerData));
    }
}
