package com.phillippitts.callengine.service.events;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered dispatch table from event type to handlers.
 *
 * <p>Registration appends and never de-duplicates; the host registers its handlers once at
 * bootstrap. All access goes through a single lock so concurrent batches can read while the
 * host registers or unregisters at runtime.
 */
public class HandlerRegistry {

    private final Map<String, List<CallEventHandler>> handlers = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public void register(String eventType, CallEventHandler handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        lock.lock();
        try {
            handlers.computeIfAbsent(eventType, t -> new ArrayList<>()).add(handler);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the first registration of {@code handler} for {@code eventType}.
     *
     * @return true if a registration was removed
     */
    public boolean unregister(String eventType, CallEventHandler handler) {
        lock.lock();
        try {
            List<CallEventHandler> list = handlers.get(eventType);
            if (list == null || !list.remove(handler)) {
                return false;
            }
            if (list.isEmpty()) {
                handlers.remove(eventType);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the handlers for a type, in registration order. Never null.
     */
    public List<CallEventHandler> handlersFor(String eventType) {
        lock.lock();
        try {
            List<CallEventHandler> list = handlers.get(eventType);
            return list == null ? List.of() : List.copyOf(list);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> eventTypes() {
        lock.lock();
        try {
            return Set.copyOf(handlers.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return handlers.values().stream().mapToInt(List::size).sum();
        } finally {
            lock.unlock();
        }
    }
}
