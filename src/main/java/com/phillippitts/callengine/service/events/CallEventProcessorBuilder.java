package com.phillippitts.callengine.service.events;

import com.phillippitts.callengine.service.dtmf.DtmfValidationLifecycle;
import com.phillippitts.callengine.service.lifecycle.CallLifecycleHandlers;
import com.phillippitts.callengine.service.lifecycle.DefaultHandlerRegistration;
import com.phillippitts.callengine.service.metrics.CallEventMetrics;

import java.util.Objects;

/**
 * Builder for {@link CallEventProcessor}.
 *
 * <p>Owns the one-time bootstrap of the handler table: {@link #build()} registers the default
 * handlers exactly once on the processor it creates, when lifecycle handlers are supplied.
 *
 * <pre>{@code
 * CallEventProcessor processor = CallEventProcessorBuilder.builder()
 *     .metrics(metrics)
 *     .defaultHandlers(lifecycleHandlers, dtmfLifecycle)
 *     .build();
 * }</pre>
 */
public final class CallEventProcessorBuilder {

    private HandlerRegistry registry;
    private CallEventMetrics metrics;
    private CallLifecycleHandlers lifecycleHandlers;
    private DtmfValidationLifecycle dtmfLifecycle;

    private CallEventProcessorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static CallEventProcessorBuilder builder() {
        return new CallEventProcessorBuilder();
    }

    /**
     * @param registry dispatch table (optional, a new one is created when absent)
     * @return this builder
     */
    public CallEventProcessorBuilder registry(HandlerRegistry registry) {
        this.registry = registry;
        return this;
    }

    /**
     * @param metrics meters (optional)
     * @return this builder
     */
    public CallEventProcessorBuilder metrics(CallEventMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * Registers the standard handler table on build.
     *
     * @param lifecycleHandlers non-DTMF handlers (required)
     * @param dtmfLifecycle DTMF handlers (required)
     * @return this builder
     */
    public CallEventProcessorBuilder defaultHandlers(CallLifecycleHandlers lifecycleHandlers,
                                                     DtmfValidationLifecycle dtmfLifecycle) {
        this.lifecycleHandlers = Objects.requireNonNull(lifecycleHandlers, "lifecycleHandlers");
        this.dtmfLifecycle = Objects.requireNonNull(dtmfLifecycle, "dtmfLifecycle");
        return this;
    }

    public CallEventProcessor build() {
        CallEventProcessor processor = new CallEventProcessor(
                registry != null ? registry : new HandlerRegistry(), metrics);
        if (lifecycleHandlers != null) {
            DefaultHandlerRegistration.registerAll(processor, lifecycleHandlers, dtmfLifecycle);
        }
        return processor;
    }
}
