package com.phillippitts.callengine.service.events;

import java.util.Objects;

/**
 * A handler registered for one event type.
 *
 * <p>Handlers run sequentially on the dispatching thread. A handler may throw; the processor
 * catches, logs and counts the failure and continues with the next handler.
 */
@FunctionalInterface
public interface CallEventHandler {

    void handle(CallEventContext context) throws Exception;

    /**
     * Name used in logs and metrics tags.
     */
    default String handlerName() {
        return getClass().getSimpleName();
    }

    /**
     * Wraps a handler with a readable name. Lambdas and method references otherwise log as
     * synthetic class names.
     */
    static CallEventHandler named(String name, CallEventHandler delegate) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(delegate, "delegate");
        return new CallEventHandler() {
            @Override
            public void handle(CallEventContext context) throws Exception {
                delegate.handle(context);
            }

            @Override
            public String handlerName() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
