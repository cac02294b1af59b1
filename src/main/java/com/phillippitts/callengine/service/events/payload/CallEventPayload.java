package com.phillippitts.callengine.service.events.payload;

/**
 * Typed view of an event payload, decoded once at ingress by {@link CallEventPayloads}.
 *
 * <p>Implementations are immutable records, one per event kind that handlers read fields from.
 * Event kinds without a dedicated record decode to {@link GenericPayload}.
 */
public interface CallEventPayload {
}
