package com.phillippitts.callengine.service.observer;

import com.phillippitts.callengine.service.session.InMemorySessionStateStore;
import com.phillippitts.callengine.service.session.SessionStateStore;
import com.phillippitts.callengine.testutil.EventCapturingPublisher;
import com.phillippitts.callengine.testutil.SyncExecutor;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CallStatusBroadcasterTest {

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final CallStatusBroadcaster broadcaster =
            new CallStatusBroadcaster(new SpringEventCallObserver(publisher), new SyncExecutor());

    @Test
    void shouldAddressPresentationSessionWhenMapped() {
        InMemorySessionStateStore store = new InMemorySessionStateStore();
        store.mapPresentationSession("call-1", "web-9");

        broadcaster.broadcast(store, "call-1", "call_connected", Map.of("validation_flow", "none"));

        CallStatusBroadcastEvent event = publisher.statusEvents().get(0);
        assertThat(event.sessionId()).isEqualTo("web-9");
        assertThat(event.callConnectionId()).isEqualTo("call-1");
        assertThat(event.timestamp()).isNotNull();
        JSONObject body = new JSONObject(event.payloadJson());
        assertThat(body.getString("type")).isEqualTo("call_connected");
        assertThat(body.getString("call_connection_id")).isEqualTo("call-1");
        assertThat(body.getString("validation_flow")).isEqualTo("none");
    }

    @Test
    void shouldFallBackToCallIdWithoutMapping() {
        broadcaster.broadcast(new InMemorySessionStateStore(), "call-2", "call_cancelled", Map.of());
        broadcaster.broadcast(null, "call-3", "call_cancelled", null);

        assertThat(publisher.statusEvents())
                .extracting(CallStatusBroadcastEvent::sessionId)
                .containsExactly("call-2", "call-3");
    }

    @Test
    void shouldFallBackToCallIdWhenLookupFails() {
        SessionStateStore store = mock(SessionStateStore.class);
        when(store.presentationSessionId(anyString())).thenThrow(new IllegalStateException("down"));

        broadcaster.broadcast(store, "call-4", "call_connected", Map.of());

        assertThat(publisher.statusEvents()).singleElement()
                .extracting(CallStatusBroadcastEvent::sessionId).isEqualTo("call-4");
    }

    @Test
    void shouldSwallowObserverFailures() {
        CallStatusBroadcaster failing = new CallStatusBroadcaster(event -> {
            throw new IllegalStateException("socket closed");
        }, new SyncExecutor());

        assertThatCode(() -> failing.broadcast(null, "call-5", "call_connected", Map.of()))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldNotPropagateRejectedExecution() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };
        CallStatusBroadcaster rejecting = new CallStatusBroadcaster(new SpringEventCallObserver(publisher), saturated);

        assertThatCode(() -> rejecting.broadcast(null, "call-6", "call_connected", Map.of()))
                .doesNotThrowAnyException();
        assertThat(publisher.statusEvents()).isEmpty();
    }
}
