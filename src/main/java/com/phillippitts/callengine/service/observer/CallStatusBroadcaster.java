package com.phillippitts.callengine.service.observer;

import com.phillippitts.callengine.service.session.SessionStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget delivery of call status notifications.
 *
 * <p>Each broadcast runs on the bounded broadcast executor so the dispatch loop never waits on
 * an observer. Delivery is best-effort: there is no retry, and failures are logged at WARN.
 * Notifications are addressed by presentation session id, resolved from the call connection id
 * through the session store; the call id itself is used when no mapping exists.
 */
public class CallStatusBroadcaster {

    private static final Logger LOG = LogManager.getLogger(CallStatusBroadcaster.class);

    private final CallObserver observer;
    private final Executor executor;

    public CallStatusBroadcaster(CallObserver observer, Executor executor) {
        this.observer = Objects.requireNonNull(observer, "observer");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Schedules a notification for the presentation session of a call.
     *
     * @param store session store holding the call-to-presentation mapping, may be null
     * @param callConnectionId call the notification is about
     * @param type notification type
     * @param fields body fields; serialized as JSON with {@code type} and {@code call_connection_id}
     */
    public void broadcast(SessionStateStore store, String callConnectionId, String type, Map<String, ?> fields) {
        try {
            executor.execute(() -> deliver(store, callConnectionId, type, fields));
        } catch (RejectedExecutionException e) {
            LOG.warn("Broadcast rejected: type={}, call={}", type, callConnectionId, e);
        }
    }

    private void deliver(SessionStateStore store, String callConnectionId, String type, Map<String, ?> fields) {
        try {
            String sessionId = resolveSessionId(store, callConnectionId);
            JSONObject body = new JSONObject();
            if (fields != null) {
                fields.forEach((k, v) -> body.put(k, (Object) v));
            }
            body.put("type", type);
            body.put("call_connection_id", callConnectionId);
            observer.onCallStatus(new CallStatusBroadcastEvent(
                    sessionId, callConnectionId, type, body.toString(), Instant.now()));
        } catch (RuntimeException e) {
            LOG.warn("Broadcast failed: type={}, call={}", type, callConnectionId, e);
        }
    }

    private static String resolveSessionId(SessionStateStore store, String callConnectionId) {
        if (store == null) {
            return callConnectionId;
        }
        try {
            return store.presentationSessionId(callConnectionId).orElse(callConnectionId);
        } catch (RuntimeException e) {
            LOG.warn("Presentation session lookup failed for call {}; using call id", callConnectionId, e);
            return callConnectionId;
        }
    }
}
