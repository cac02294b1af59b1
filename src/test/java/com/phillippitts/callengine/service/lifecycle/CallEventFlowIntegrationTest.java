package com.phillippitts.callengine.service.lifecycle;

import com.phillippitts.callengine.domain.EventEnvelope;
import com.phillippitts.callengine.domain.ProcessingSummary;
import com.phillippitts.callengine.service.dtmf.CallTerminationService;
import com.phillippitts.callengine.service.dtmf.ChallengeValidationStrategy;
import com.phillippitts.callengine.service.dtmf.DtmfValidationLifecycle;
import com.phillippitts.callengine.service.dtmf.FixedPinValidationStrategy;
import com.phillippitts.callengine.service.events.CallEventProcessor;
import com.phillippitts.callengine.service.events.CallEventProcessorBuilder;
import com.phillippitts.callengine.service.events.CallEventRuntime;
import com.phillippitts.callengine.service.events.EventTypes;
import com.phillippitts.callengine.service.metrics.CallEventMetrics;
import com.phillippitts.callengine.service.session.InMemorySessionStateStore;
import com.phillippitts.callengine.service.session.SessionKeys;
import com.phillippitts.callengine.testutil.RecordingTelephonyProvider;
import com.phillippitts.callengine.testutil.TestEvents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives whole batches through a processor wired with the standard handler table.
 */
class CallEventFlowIntegrationTest {

    private static final String CALL_A = "call-A";
    private static final String CALL_B = "call-B";

    private InMemorySessionStateStore store;
    private RecordingTelephonyProvider provider;
    private CallEventRuntime runtime;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStateStore();
        provider = RecordingTelephonyProvider.withCallerAndAgent("+14255550123");
        runtime = new CallEventRuntime(store, provider, null, null);
        registry = new SimpleMeterRegistry();
    }

    private CallEventProcessor processor(boolean dtmfValidationEnabled) {
        CallEventMetrics metrics = new CallEventMetrics(registry);
        DtmfValidationLifecycle dtmf = new DtmfValidationLifecycle(new ChallengeValidationStrategy(() -> "246"),
                new FixedPinValidationStrategy(4), new CallTerminationService(metrics), metrics);
        return CallEventProcessorBuilder.builder()
                .metrics(metrics)
                .defaultHandlers(new CallLifecycleHandlers(dtmf, dtmfValidationEnabled), dtmf)
                .build();
    }

    @Test
    void shortPinEndsCallButProcessorStillTracksItUntilDisconnect() {
        CallEventProcessor processor = processor(false);

        ProcessingSummary summary = processor.processEvents(List.of(
                TestEvents.callConnected(CALL_A),
                TestEvents.participantsUpdated(CALL_A),
                TestEvents.tone(CALL_A, "1", 1),
                TestEvents.tone(CALL_A, "2", 2),
                TestEvents.tone(CALL_A, "#", 3)), runtime);

        assertThat(summary.processed()).isEqualTo(5);
        assertThat(summary.status()).isEqualTo(ProcessingSummary.Status.SUCCESS);
        assertThat(store.snapshot(CALL_A))
                .containsEntry(SessionKeys.DTMF_VALIDATED, false)
                .containsEntry(SessionKeys.CALL_CANCELLED_DTMF_FAILURE, true)
                .doesNotContainKey(SessionKeys.ENTERED_PIN);
        assertThat(processor.getActiveCalls()).containsExactly(CALL_A);
        assertThat(provider.hangUps()).containsExactly(new RecordingTelephonyProvider.HangUp(CALL_A, true));
    }

    @Test
    void challengeFlowOpensGateAndNotifiesWaiters() {
        CallEventProcessor processor = processor(true);

        processor.processEvents(List.of(TestEvents.callConnected(CALL_A)), runtime);
        assertThat(DtmfValidationLifecycle.isDtmfValidationGateOpen(store, CALL_A)).isFalse();

        processor.processEvents(List.of(
                TestEvents.tone(CALL_A, "2"),
                TestEvents.tone(CALL_A, "four"),
                TestEvents.tone(CALL_A, "6"),
                TestEvents.tone(CALL_A, "pound")), runtime);

        assertThat(DtmfValidationLifecycle.isDtmfValidationGateOpen(store, CALL_A)).isTrue();
        assertThat(DtmfValidationLifecycle.getFreshDtmfValidationStatus(store, CALL_A)).isTrue();
        assertThat(store.events(DtmfValidationLifecycle.streamKey(CALL_A)))
                .containsExactly(Map.of("validation_status", "completed", "result", "success"));
        assertThat(provider.hangUps()).isEmpty();
        assertThat(registry.get("callengine.dtmf.validation").tag("mode", "challenge").tag("outcome", "success")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void callsInOneBatchAreIndependent() {
        CallEventProcessor processor = processor(false);

        processor.processEvents(List.of(
                TestEvents.callConnected(CALL_A),
                TestEvents.callConnected(CALL_B),
                TestEvents.tone(CALL_B, "9"),
                TestEvents.callDisconnected(CALL_A)), runtime);

        assertThat(processor.getActiveCalls()).containsExactly(CALL_B);
        assertThat(store.snapshot(CALL_A)).containsEntry(SessionKeys.CALL_ACTIVE, false);
        assertThat(store.snapshot(CALL_B))
                .containsEntry(SessionKeys.CALL_ACTIVE, true)
                .containsEntry(SessionKeys.DTMF_SEQUENCE, "9");
    }

    @Test
    void outOfRangeSequenceIdDoesNotStopTheBatch() {
        CallEventProcessor processor = processor(false);

        ProcessingSummary summary = processor.processEvents(List.of(
                TestEvents.callConnected(CALL_A),
                TestEvents.callConnected(CALL_B),
                TestEvents.tone(CALL_A, "1", Integer.MAX_VALUE),
                TestEvents.tone(CALL_B, "2")), runtime);

        assertThat(summary.processed()).isEqualTo(4);
        assertThat(summary.failed()).isZero();
        assertThat(store.snapshot(CALL_A).getOrDefault(SessionKeys.DTMF_SEQUENCE, "")).isEqualTo("");
        assertThat(store.snapshot(CALL_B)).containsEntry(SessionKeys.DTMF_SEQUENCE, "2");
    }

    @Test
    void webhookWrappedEventsReachLifecycleHandlers() {
        CallEventProcessor processor = processor(false);

        processor.processEvents(List.of(
                TestEvents.webhook(CALL_A, EventTypes.CALL_CONNECTED, Map.of()),
                TestEvents.webhook(CALL_A, EventTypes.DTMF_TONE_RECEIVED, Map.of("tone", "5"))), runtime);

        assertThat(processor.getActiveCalls()).containsExactly(CALL_A);
        assertThat(store.snapshot(CALL_A))
                .containsEntry(SessionKeys.STATUS, "connected")
                .containsEntry(SessionKeys.DTMF_SEQUENCE, "5")
                .containsEntry(SessionKeys.LAST_WEBHOOK_EVENT, EventTypes.DTMF_TONE_RECEIVED);
    }

    @Test
    void disconnectClassEventsRemoveActiveCall() {
        CallEventProcessor processor = processor(false);
        processor.processEvents(List.of(TestEvents.callConnected(CALL_A)), runtime);

        processor.processEvents(List.of(TestEvents.event(EventTypes.ANSWER_CALL_FAILED, CALL_A)), runtime);

        assertThat(processor.getActiveCalls()).isEmpty();
    }

    @Test
    void eventsWithoutCallIdAreDroppedNotFailed() {
        CallEventProcessor processor = processor(false);
        EventEnvelope anonymous = EventEnvelope.of(TestEvents.PROVIDER_SOURCE, EventTypes.CALL_CONNECTED, Map.of());

        ProcessingSummary summary = processor.processEvents(List.of(anonymous, TestEvents.callConnected(CALL_A)), runtime);

        assertThat(summary.dropped()).isEqualTo(1);
        assertThat(summary.processed()).isEqualTo(1);
        assertThat(summary.failed()).isZero();
    }

    @Test
    void defaultTableRegistersEveryStandardType() {
        CallEventProcessor processor = processor(false);

        assertThat(processor.getStats().registeredHandlers()).isEqualTo(15);
        assertThat(processor.getStats().eventTypes()).contains(
                EventTypes.CALL_CONNECTED,
                EventTypes.CALL_DISCONNECTED,
                EventTypes.DTMF_TONE_RECEIVED,
                EventTypes.WEBHOOK_EVENTS,
                EventTypes.DTMF_RECOGNITION_START_REQUESTED);
    }

    @Test
    void recognitionStartRequestTargetsCaller() {
        CallEventProcessor processor = processor(false);

        processor.processEvents(List.of(
                TestEvents.event(EventTypes.DTMF_RECOGNITION_START_REQUESTED, CALL_A)), runtime);

        assertThat(provider.recognitionStarts()).singleElement()
                .satisfies(start -> assertThat(start.target().value()).isEqualTo("+14255550123"));
    }
}
