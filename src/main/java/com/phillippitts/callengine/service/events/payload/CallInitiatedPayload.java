package com.phillippitts.callengine.service.events.payload;

public record CallInitiatedPayload(String targetNumber, String apiVersion) implements CallEventPayload {
}
