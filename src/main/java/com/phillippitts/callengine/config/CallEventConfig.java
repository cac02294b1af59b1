package com.phillippitts.callengine.config;

import com.phillippitts.callengine.config.properties.CallEventProperties;
import com.phillippitts.callengine.service.dtmf.CallTerminationService;
import com.phillippitts.callengine.service.dtmf.ChallengeValidationStrategy;
import com.phillippitts.callengine.service.dtmf.DtmfValidationLifecycle;
import com.phillippitts.callengine.service.dtmf.FixedPinValidationStrategy;
import com.phillippitts.callengine.service.events.CallEventProcessor;
import com.phillippitts.callengine.service.events.CallEventProcessorBuilder;
import com.phillippitts.callengine.service.events.CallEventRuntime;
import com.phillippitts.callengine.service.lifecycle.CallLifecycleHandlers;
import com.phillippitts.callengine.service.metrics.CallEventMetrics;
import com.phillippitts.callengine.service.observer.CallObserver;
import com.phillippitts.callengine.service.observer.CallStatusBroadcaster;
import com.phillippitts.callengine.service.observer.SpringEventCallObserver;
import com.phillippitts.callengine.service.session.InMemorySessionStateStore;
import com.phillippitts.callengine.service.session.SessionStateStore;
import com.phillippitts.callengine.service.telephony.DisabledTelephonyProvider;
import com.phillippitts.callengine.service.telephony.SessionTerminator;
import com.phillippitts.callengine.service.telephony.TelephonyProvider;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the call event processor and its collaborators.
 *
 * <p>The processor is built once here and the default handler table is registered during that
 * build, so there is exactly one bootstrap per application context.
 */
@Configuration
public class CallEventConfig {

    private static final Logger LOG = LogManager.getLogger(CallEventConfig.class);

    private final CallEventProperties properties;

    public CallEventConfig(CallEventProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CallEventMetrics callEventMetrics(MeterRegistry meterRegistry) {
        return new CallEventMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean(SessionStateStore.class)
    public SessionStateStore sessionStateStore() {
        LOG.info("No SessionStateStore bean; using in-memory session store");
        return new InMemorySessionStateStore();
    }

    @Bean
    @ConditionalOnMissingBean(TelephonyProvider.class)
    public TelephonyProvider telephonyProvider() {
        LOG.warn("No TelephonyProvider bean; provider operations are disabled");
        return new DisabledTelephonyProvider();
    }

    @Bean
    @ConditionalOnMissingBean(CallObserver.class)
    public CallObserver callObserver(ApplicationEventPublisher publisher) {
        return new SpringEventCallObserver(publisher);
    }

    @Bean
    public CallStatusBroadcaster callStatusBroadcaster(CallObserver observer,
                                                       @Qualifier("broadcastExecutor") Executor broadcastExecutor) {
        return new CallStatusBroadcaster(observer, broadcastExecutor);
    }

    @Bean
    public DtmfValidationLifecycle dtmfValidationLifecycle(CallEventMetrics metrics) {
        return new DtmfValidationLifecycle(
                ChallengeValidationStrategy.withRandomDigits(properties.getChallengeLength()),
                new FixedPinValidationStrategy(properties.getPinLength()),
                new CallTerminationService(metrics),
                metrics);
    }

    @Bean
    public CallLifecycleHandlers callLifecycleHandlers(DtmfValidationLifecycle dtmfValidationLifecycle) {
        LOG.info("DTMF validation {}", properties.isDtmfValidationEnabled() ? "enabled" : "disabled");
        return new CallLifecycleHandlers(dtmfValidationLifecycle, properties.isDtmfValidationEnabled());
    }

    @Bean
    public CallEventProcessor callEventProcessor(CallEventMetrics metrics,
                                                 CallLifecycleHandlers lifecycleHandlers,
                                                 DtmfValidationLifecycle dtmfValidationLifecycle) {
        return CallEventProcessorBuilder.builder()
                .metrics(metrics)
                .defaultHandlers(lifecycleHandlers, dtmfValidationLifecycle)
                .build();
    }

    /**
     * Collaborators handed to every batch. The session terminator is optional.
     */
    @Bean
    public CallEventRuntime callEventRuntime(SessionStateStore sessionStateStore,
                                             TelephonyProvider telephonyProvider,
                                             CallStatusBroadcaster broadcaster,
                                             ObjectProvider<SessionTerminator> terminator) {
        return new CallEventRuntime(
                sessionStateStore,
                telephonyProvider,
                properties.isBroadcastEnabled() ? broadcaster : null,
                terminator.getIfAvailable());
    }
}
