package com.phillippitts.callengine.testutil;

import com.phillippitts.callengine.service.observer.CallStatusBroadcastEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    /**
     * Returns the captured call status broadcasts in publication order.
     */
    public List<CallStatusBroadcastEvent> statusEvents() {
        return events.stream()
                .filter(e -> e instanceof CallStatusBroadcastEvent)
                .map(e -> (CallStatusBroadcastEvent) e)
                .toList();
    }

    /**
     * Clears all captured events (useful for multi-iteration tests).
     */
    public void clear() {
        events.clear();
    }
}
