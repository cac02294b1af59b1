package com.phillippitts.callengine.service.observer;

import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Delivers call status notifications through the Spring event bus.
 */
public class SpringEventCallObserver implements CallObserver {

    private final ApplicationEventPublisher publisher;

    public SpringEventCallObserver(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void onCallStatus(CallStatusBroadcastEvent event) {
        publisher.publishEvent(event);
    }
}
