package com.phillippitts.callengine.service.events.payload;

/**
 * @param callConnectionState provider state at disconnect, used as the disconnect reason
 */
public record CallDisconnectedPayload(String callConnectionState) implements CallEventPayload {
}
