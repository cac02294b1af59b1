package com.phillippitts.callengine.domain;

import java.util.Set;

/**
 * Read-only snapshot of cumulative processor statistics.
 *
 * @param eventsProcessed events dispatched since startup
 * @param eventsFailed events that failed outside handler isolation
 * @param eventsDropped events dropped for lack of a call connection id
 * @param handlerFailures isolated handler exceptions
 * @param registeredHandlers total handler registrations across event types
 * @param activeCalls size of the active-call cache
 * @param eventTypes event types with at least one registered handler
 */
public record ProcessorStats(
        long eventsProcessed,
        long eventsFailed,
        long eventsDropped,
        long handlerFailures,
        int registeredHandlers,
        int activeCalls,
        Set<String> eventTypes
) {
    public ProcessorStats {
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }
}
