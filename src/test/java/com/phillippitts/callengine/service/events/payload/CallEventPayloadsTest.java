package com.phillippitts.callengine.service.events.payload;

import com.phillippitts.callengine.domain.CallParticipant;
import com.phillippitts.callengine.domain.IdentifierKind;
import com.phillippitts.callengine.service.events.EventTypes;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CallEventPayloadsTest {

    @Test
    void decodesParticipantsWithPhoneFallbackToRawId() {
        Map<String, Object> data = Map.of("participants", List.of(
                Map.of("identifier", Map.of("kind", "phoneNumber", "rawId", "4:+15550001111"), "isMuted", false),
                Map.of("identifier", Map.of("kind", "communicationUser", "rawId", "8:acs:x",
                        "communicationUser", Map.of("id", "8:acs:x")), "isMuted", true),
                "not-a-participant"));

        List<CallParticipant> participants = CallEventPayloads.participants(data);

        assertThat(participants).hasSize(2);
        assertThat(participants.get(0).kind()).isEqualTo(IdentifierKind.PHONE_NUMBER);
        assertThat(participants.get(0).identifier().value()).isEqualTo("+15550001111");
        assertThat(participants.get(1).kind()).isEqualTo(IdentifierKind.COMMUNICATION_USER);
        assertThat(participants.get(1).muted()).isTrue();
    }

    @Test
    void decodesParticipantsGivenAsJsonObjects() {
        JSONObject participant = new JSONObject()
                .put("identifier", new JSONObject().put("kind", "phoneNumber")
                        .put("phoneNumber", new JSONObject().put("value", "+15550002222")))
                .put("isMuted", true);
        Map<String, Object> data = Map.of("participants", new JSONArray().put(participant));

        List<CallParticipant> participants = CallEventPayloads.participants(data);

        assertThat(participants).singleElement().satisfies(p -> {
            assertThat(p.kind()).isEqualTo(IdentifierKind.PHONE_NUMBER);
            assertThat(p.identifier().value()).isEqualTo("+15550002222");
            assertThat(p.muted()).isTrue();
        });
    }

    @Test
    void decodesResultInformationForFailures() {
        CallEventPayload payload = CallEventPayloads.decode(EventTypes.CREATE_CALL_FAILED, Map.of(
                "resultInformation", Map.of("code", 400, "subCode", 8510, "message", "Busy")));

        assertThat(payload).isInstanceOfSatisfying(ResultInformationPayload.class, r -> {
            assertThat(r.code()).isEqualTo(400);
            assertThat(r.subCode()).isEqualTo(8510);
            assertThat(r.message()).isEqualTo("Busy");
        });
    }

    @Test
    void missingResultInformationDecodesToEmpty() {
        assertThat(CallEventPayloads.decode(EventTypes.PLAY_FAILED, Map.of()))
                .isSameAs(ResultInformationPayload.EMPTY);
    }

    @Test
    void callConnectedReadsTimeFromPropertiesOrTopLevel() {
        CallEventPayload nested = CallEventPayloads.decode(EventTypes.CALL_CONNECTED,
                Map.of("callConnectionProperties", Map.of("connectedTime", "t1")));
        CallEventPayload flat = CallEventPayloads.decode(EventTypes.CALL_CONNECTED, Map.of("connectedTime", "t2"));

        assertThat(((CallConnectedPayload) nested).connectedTime()).isEqualTo("t1");
        assertThat(((CallConnectedPayload) flat).connectedTime()).isEqualTo("t2");
    }

    @Test
    void callerIdExtraction() {
        assertThat(CallEventPayloads.extractCallerId(null)).isEqualTo("unknown");
        assertThat(CallEventPayloads.extractCallerId(Map.of())).isEqualTo("unknown");
        assertThat(CallEventPayloads.extractCallerId(Map.of(
                "kind", "phoneNumber", "phoneNumber", Map.of("value", "+1555")))).isEqualTo("+1555");
        assertThat(CallEventPayloads.extractCallerId(Map.of("kind", "communicationUser", "rawId", "8:acs:y")))
                .isEqualTo("8:acs:y");
    }

    @Test
    void unknownTypesDecodeGenerically() {
        assertThat(CallEventPayloads.decode("Vendor.Other", Map.of("a", 1))).isInstanceOf(GenericPayload.class);
        assertThat(CallEventPayloads.decode(null, Map.of())).isInstanceOf(GenericPayload.class);
    }
}
