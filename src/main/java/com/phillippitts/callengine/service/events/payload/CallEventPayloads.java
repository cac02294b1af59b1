package com.phillippitts.callengine.service.events.payload;

import com.phillippitts.callengine.domain.CallParticipant;
import com.phillippitts.callengine.domain.IdentifierKind;
import com.phillippitts.callengine.domain.ParticipantIdentifier;
import com.phillippitts.callengine.service.events.EventData;
import com.phillippitts.callengine.service.events.EventTypes;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decodes a payload map into the typed {@link CallEventPayload} for its event type.
 * Safe against malformed input: missing fields decode to nulls or empty collections.
 */
public final class CallEventPayloads {

    private CallEventPayloads() {}

    public static CallEventPayload decode(String eventType, Map<String, Object> data) {
        if (eventType == null) {
            return new GenericPayload(data);
        }
        return switch (eventType) {
            case EventTypes.CALL_CONNECTED -> callConnected(data);
            case EventTypes.CALL_DISCONNECTED ->
                    new CallDisconnectedPayload(EventData.string(data, "callConnectionState"));
            case EventTypes.CREATE_CALL_FAILED, EventTypes.ANSWER_CALL_FAILED,
                 EventTypes.PLAY_FAILED, EventTypes.RECOGNIZE_FAILED,
                 EventTypes.DTMF_TONE_FAILED, EventTypes.CALL_TRANSFER_FAILED -> resultInformation(data);
            case EventTypes.PARTICIPANTS_UPDATED -> new ParticipantsPayload(participants(data));
            case EventTypes.DTMF_TONE_RECEIVED ->
                    new DtmfTonePayload(EventData.string(data, "tone"), EventData.integer(data, "sequenceId"));
            case EventTypes.CALL_INITIATED -> new CallInitiatedPayload(
                    EventData.string(data, "target_number"),
                    defaultIfNull(EventData.string(data, "api_version"), "unknown"));
            case EventTypes.INBOUND_CALL_RECEIVED -> {
                Map<String, Object> from = EventData.object(data, "from");
                yield new InboundCallPayload(extractCallerId(from), from);
            }
            default -> new GenericPayload(data);
        };
    }

    private static CallConnectedPayload callConnected(Map<String, Object> data) {
        Map<String, Object> props = EventData.object(data, "callConnectionProperties");
        String connectedTime = EventData.string(props, "connectedTime");
        if (connectedTime == null) {
            connectedTime = EventData.string(data, "connectedTime");
        }
        return new CallConnectedPayload(connectedTime, EventData.string(data, "correlationId"));
    }

    private static ResultInformationPayload resultInformation(Map<String, Object> data) {
        Map<String, Object> info = EventData.object(data, "resultInformation");
        if (info.isEmpty()) {
            return ResultInformationPayload.EMPTY;
        }
        return new ResultInformationPayload(
                EventData.integer(info, "code"),
                EventData.integer(info, "subCode"),
                EventData.string(info, "message"));
    }

    /**
     * Parses the webhook {@code participants} array.
     */
    public static List<CallParticipant> participants(Map<String, Object> data) {
        List<CallParticipant> out = new ArrayList<>();
        for (Object entry : EventData.list(data, "participants")) {
            if (!(entry instanceof Map<?, ?> || entry instanceof JSONObject)) {
                continue;
            }
            Map<String, Object> participant = EventData.asMap(entry);
            Map<String, Object> identifier = EventData.object(participant, "identifier");
            out.add(new CallParticipant(identifier(identifier), EventData.bool(participant, "isMuted", false)));
        }
        return out;
    }

    static ParticipantIdentifier identifier(Map<String, Object> identifier) {
        IdentifierKind kind = IdentifierKind.fromWire(EventData.string(identifier, "kind"));
        String rawId = EventData.string(identifier, "rawId");
        String value = null;
        if (kind == IdentifierKind.PHONE_NUMBER) {
            value = EventData.string(EventData.object(identifier, "phoneNumber"), "value");
            if (value == null && rawId != null && rawId.startsWith("4:")) {
                value = rawId.substring(2);
            }
        } else if (kind == IdentifierKind.COMMUNICATION_USER) {
            value = EventData.string(EventData.object(identifier, "communicationUser"), "id");
        }
        return new ParticipantIdentifier(kind, rawId, value != null ? value : rawId);
    }

    /**
     * Extracts the caller id from an inbound {@code from} object: the phone number for
     * phone participants, otherwise the raw id, otherwise "unknown".
     */
    public static String extractCallerId(Map<String, Object> callerInfo) {
        if (callerInfo == null || callerInfo.isEmpty()) {
            return "unknown";
        }
        if ("phoneNumber".equals(EventData.string(callerInfo, "kind"))) {
            return defaultIfNull(EventData.string(EventData.object(callerInfo, "phoneNumber"), "value"), "unknown");
        }
        return defaultIfNull(EventData.string(callerInfo, "rawId"), "unknown");
    }

    private static String defaultIfNull(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
