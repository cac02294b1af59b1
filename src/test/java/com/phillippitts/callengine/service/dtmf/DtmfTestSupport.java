package com.phillippitts.callengine.service.dtmf;

import com.phillippitts.callengine.domain.EventEnvelope;
import com.phillippitts.callengine.service.events.CallEventContext;
import com.phillippitts.callengine.service.events.CallEventRuntime;
import com.phillippitts.callengine.service.events.EventDecoder;
import com.phillippitts.callengine.testutil.TestEvents;

/**
 * Builds contexts the way the processor does, for handler-level tests.
 */
final class DtmfTestSupport {

    static final String CALL_ID = "call-dtmf";

    private DtmfTestSupport() {}

    static CallEventContext context(EventEnvelope envelope, CallEventRuntime runtime) {
        return new CallEventContext(envelope, CALL_ID, EventDecoder.decode(envelope), runtime);
    }

    static CallEventContext tone(String tone, CallEventRuntime runtime) {
        return context(TestEvents.tone(CALL_ID, tone), runtime);
    }

    static CallEventContext tone(String tone, int sequenceId, CallEventRuntime runtime) {
        return context(TestEvents.tone(CALL_ID, tone, sequenceId), runtime);
    }

    static CallEventContext connected(CallEventRuntime runtime) {
        return context(TestEvents.callConnected(CALL_ID), runtime);
    }
}
