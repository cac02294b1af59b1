package com.phillippitts.callengine.service.events.payload;

/**
 * @param tone raw tone token as sent by the provider ("five", "pound", "#", ...)
 * @param sequenceId 1-based position of the tone, or null when the provider did not send one
 */
public record DtmfTonePayload(String tone, Integer sequenceId) implements CallEventPayload {
}
