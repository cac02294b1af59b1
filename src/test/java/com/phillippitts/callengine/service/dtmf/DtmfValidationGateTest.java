package com.phillippitts.callengine.service.dtmf;

import com.phillippitts.callengine.exception.SessionStoreException;
import com.phillippitts.callengine.service.session.CallSession;
import com.phillippitts.callengine.service.session.InMemorySessionStateStore;
import com.phillippitts.callengine.service.session.SessionKeys;
import com.phillippitts.callengine.service.session.SessionStateStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DtmfValidationGateTest {

    @Test
    void gateReflectsStoredFlag() {
        InMemorySessionStateStore store = new InMemorySessionStateStore();
        CallSession session = store.session("c1");
        session.set(SessionKeys.DTMF_VALIDATION_GATE_OPEN, false);
        session.persist();

        assertThat(DtmfValidationLifecycle.isDtmfValidationGateOpen(store, "c1")).isFalse();

        session.set(SessionKeys.DTMF_VALIDATION_GATE_OPEN, true);
        session.persist();

        assertThat(DtmfValidationLifecycle.isDtmfValidationGateOpen(store, "c1")).isTrue();
    }

    @Test
    void gateIsClosedForUnknownCall() {
        assertThat(DtmfValidationLifecycle.isDtmfValidationGateOpen(new InMemorySessionStateStore(), "nope"))
                .isFalse();
        assertThat(DtmfValidationLifecycle.getFreshDtmfValidationStatus(new InMemorySessionStateStore(), "nope"))
                .isFalse();
    }

    @Test
    void failsOpenWithoutStore() {
        assertThat(DtmfValidationLifecycle.isDtmfValidationGateOpen(null, "c1")).isTrue();
        assertThat(DtmfValidationLifecycle.getFreshDtmfValidationStatus(null, "c1")).isTrue();
    }

    @Test
    void failsOpenWhenStoreThrows() {
        SessionStateStore broken = mock(SessionStateStore.class);
        when(broken.session(anyString())).thenThrow(new SessionStoreException("connection refused", "c1"));

        assertThat(DtmfValidationLifecycle.isDtmfValidationGateOpen(broken, "c1")).isTrue();
        assertThat(DtmfValidationLifecycle.getFreshDtmfValidationStatus(broken, "c1")).isTrue();
    }

    @Test
    void freshStatusReadsPersistedValue() {
        InMemorySessionStateStore store = new InMemorySessionStateStore();
        CallSession writer = store.session("c2");
        writer.set(SessionKeys.DTMF_VALIDATED, true);
        writer.persist();

        assertThat(DtmfValidationLifecycle.getFreshDtmfValidationStatus(store, "c2")).isTrue();
    }
}
