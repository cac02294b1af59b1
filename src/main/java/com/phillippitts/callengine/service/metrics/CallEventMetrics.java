package com.phillippitts.callengine.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for event dispatch and DTMF validation.
 *
 * <p>All meters live under {@code callengine.events}. Event types are used as tags; the catalog
 * is closed so cardinality stays bounded.
 */
public class CallEventMetrics {

    private static final String METRIC_PREFIX = "callengine.events";

    private final MeterRegistry registry;

    public CallEventMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementProcessed(String eventType) {
        Counter.builder(METRIC_PREFIX + ".processed")
                .description("Events dispatched through the handler registry")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void incrementDropped(String eventType) {
        Counter.builder(METRIC_PREFIX + ".dropped")
                .description("Events dropped for lack of a call connection id")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void incrementFailed(String eventType) {
        Counter.builder(METRIC_PREFIX + ".failed")
                .description("Events whose dispatch failed outside handler isolation")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    /**
     * @param handlerName name of the handler that threw
     * @param eventType type the handler was dispatched for
     */
    public void incrementHandlerFailure(String handlerName, String eventType) {
        Counter.builder(METRIC_PREFIX + ".handler.failure")
                .description("Handler invocations that threw")
                .tag("handler", handlerName)
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordDispatch(String eventType, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".dispatch")
                .description("Time spent running all handlers of one event")
                .tag("type", eventType)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records the outcome of a DTMF validation attempt.
     *
     * @param mode challenge or pin
     * @param outcome success or failure
     */
    public void recordValidation(String mode, String outcome) {
        Counter.builder("callengine.dtmf.validation")
                .description("DTMF validation attempts by mode and outcome")
                .tag("mode", mode)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records how a call was terminated after a validation failure.
     *
     * @param path graceful, provider or none
     */
    public void recordTermination(String path) {
        Counter.builder("callengine.dtmf.termination")
                .description("Call terminations triggered by DTMF validation failure")
                .tag("path", path)
                .register(registry)
                .increment();
    }
}
