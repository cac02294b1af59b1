package com.phillippitts.callengine.service.events.payload;

/**
 * @param connectedTime provider timestamp of the connect, if reported
 * @param correlationId provider correlation id, if reported
 */
public record CallConnectedPayload(String connectedTime, String correlationId) implements CallEventPayload {
}
