package com.phillippitts.callengine.service.events.payload;

import java.util.Map;

/**
 * @param callerId caller phone number or raw id, "unknown" when absent
 * @param callerInfo raw {@code from} object of the inbound event
 */
public record InboundCallPayload(String callerId, Map<String, Object> callerInfo) implements CallEventPayload {

    public InboundCallPayload {
        callerInfo = callerInfo == null ? Map.of() : callerInfo;
    }
}
