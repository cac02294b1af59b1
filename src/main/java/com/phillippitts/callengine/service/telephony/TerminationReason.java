package com.phillippitts.callengine.service.telephony;

/**
 * Why the engine asked for a call to be terminated.
 */
public enum TerminationReason {
    DTMF_VALIDATION_FAILED("dtmf_validation_failed"),
    DTMF_VALIDATION_TIMEOUT("dtmf_validation_timeout");

    private final String wireValue;

    TerminationReason(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
