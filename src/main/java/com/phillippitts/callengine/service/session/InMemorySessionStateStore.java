package com.phillippitts.callengine.service.session;

import com.phillippitts.callengine.exception.SessionStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Process-local {@link SessionStateStore}.
 *
 * <p>Used when no external store is wired and in tests. Sessions live until the process exits.
 * Each stream keeps only its most recent {@link #MAX_STREAM_EVENTS} events.
 * Stream readers block on a {@link CompletableFuture} that the next publish completes, so a
 * waiting thread does no polling.
 */
public class InMemorySessionStateStore implements SessionStateStore {

    private static final Logger LOG = LogManager.getLogger(InMemorySessionStateStore.class);

    static final int MAX_STREAM_EVENTS = 100;

    private final Map<String, Map<String, Object>> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> presentationSessions = new ConcurrentHashMap<>();
    private final Map<String, List<Map<String, String>>> streams = new ConcurrentHashMap<>();
    private final Map<String, List<CompletableFuture<Map<String, String>>>> waiters = new ConcurrentHashMap<>();

    @Override
    public CallSession session(String callConnectionId) {
        Objects.requireNonNull(callConnectionId, "callConnectionId");
        return new StagedSession(callConnectionId, new HashMap<>(snapshot(callConnectionId)));
    }

    @Override
    public Optional<String> presentationSessionId(String callConnectionId) {
        if (callConnectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(presentationSessions.get(callConnectionId));
    }

    /**
     * Maps a call connection id to the presentation session id the observer layer uses.
     */
    public void mapPresentationSession(String callConnectionId, String presentationSessionId) {
        presentationSessions.put(callConnectionId, presentationSessionId);
    }

    @Override
    public void publishEvent(String streamKey, Map<String, String> fields) {
        Map<String, String> event = Map.copyOf(fields);
        streams.compute(streamKey, (k, events) -> {
            List<Map<String, String>> list = events != null ? events : new CopyOnWriteArrayList<>();
            list.add(event);
            while (list.size() > MAX_STREAM_EVENTS) {
                list.remove(0);
            }
            return list;
        });
        List<CompletableFuture<Map<String, String>>> pending = waiters.remove(streamKey);
        if (pending != null) {
            pending.forEach(f -> f.complete(event));
        }
        LOG.debug("Stream event appended: stream={}, fields={}", streamKey, event);
    }

    @Override
    public Optional<Map<String, String>> readEventBlocking(String streamKey, Duration timeout)
            throws InterruptedException {
        CompletableFuture<Map<String, String>> future = new CompletableFuture<>();
        waiters.computeIfAbsent(streamKey, k -> new CopyOnWriteArrayList<>()).add(future);
        try {
            return Optional.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new SessionStoreException("Stream read failed", streamKey, e.getCause());
        } finally {
            waiters.computeIfPresent(streamKey, (k, pending) -> {
                pending.remove(future);
                return pending.isEmpty() ? null : pending;
            });
        }
    }

    /**
     * Returns the events appended to a stream so far.
     */
    public List<Map<String, String>> events(String streamKey) {
        return List.copyOf(streams.getOrDefault(streamKey, List.of()));
    }

    int waitingReaders(String streamKey) {
        List<CompletableFuture<Map<String, String>>> pending = waiters.get(streamKey);
        return pending == null ? 0 : pending.size();
    }

    /**
     * Returns a copy of the persisted state of a call, empty if none.
     */
    public Map<String, Object> snapshot(String callConnectionId) {
        Map<String, Object> stored = sessions.get(callConnectionId);
        if (stored == null) {
            return Map.of();
        }
        synchronized (stored) {
            return Collections.unmodifiableMap(new HashMap<>(stored));
        }
    }

    private void commit(String callConnectionId, Map<String, Object> staged) {
        Map<String, Object> stored = sessions.computeIfAbsent(callConnectionId, id -> new HashMap<>());
        synchronized (stored) {
            staged.forEach((k, v) -> {
                if (v == null) {
                    stored.remove(k);
                } else {
                    stored.put(k, v);
                }
            });
        }
    }

    private final class StagedSession implements CallSession {
        private final String callConnectionId;
        private final Map<String, Object> loaded;
        private final Map<String, Object> staged = new LinkedHashMap<>();

        private StagedSession(String callConnectionId, Map<String, Object> loaded) {
            this.callConnectionId = callConnectionId;
            this.loaded = loaded;
        }

        @Override
        public String callConnectionId() {
            return callConnectionId;
        }

        @Override
        public synchronized Object get(String key, Object defaultValue) {
            if (staged.containsKey(key)) {
                Object v = staged.get(key);
                return v == null ? defaultValue : v;
            }
            return loaded.getOrDefault(key, defaultValue);
        }

        @Override
        public synchronized void set(String key, Object value) {
            staged.put(key, value);
        }

        @Override
        public synchronized void update(Map<String, Object> values) {
            staged.putAll(values);
        }

        @Override
        public synchronized void persist() {
            if (staged.isEmpty()) {
                return;
            }
            Map<String, Object> batch = new HashMap<>(staged);
            commit(callConnectionId, batch);
            batch.forEach((k, v) -> {
                if (v == null) {
                    loaded.remove(k);
                } else {
                    loaded.put(k, v);
                }
            });
            staged.clear();
        }
    }
}
