package com.phillippitts.callengine.service.health;

import com.phillippitts.callengine.domain.ProcessorStats;
import com.phillippitts.callengine.service.events.CallEventProcessor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the call event processor.
 *
 * <p>Reports UP with the processor's counters. Reports DOWN when no handlers are registered,
 * since every event would then be processed without effect.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class CallEventProcessorHealthIndicator implements HealthIndicator {

    private final CallEventProcessor processor;

    public CallEventProcessorHealthIndicator(CallEventProcessor processor) {
        this.processor = processor;
    }

    @Override
    public Health health() {
        ProcessorStats stats = processor.getStats();
        Health.Builder builder = stats.registeredHandlers() > 0
                ? Health.up()
                : Health.down().withDetail("status", "No handlers registered");
        return builder
                .withDetail("activeCalls", stats.activeCalls())
                .withDetail("registeredHandlers", stats.registeredHandlers())
                .withDetail("eventTypes", stats.eventTypes().size())
                .withDetail("eventsProcessed", stats.eventsProcessed())
                .withDetail("eventsDropped", stats.eventsDropped())
                .withDetail("handlerFailures", stats.handlerFailures())
                .build();
    }
}
