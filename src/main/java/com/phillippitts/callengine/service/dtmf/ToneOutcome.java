package com.phillippitts.callengine.service.dtmf;

/**
 * Effect of one tone on a validation strategy's state.
 */
public enum ToneOutcome {
    /** Tone had no effect; nothing to persist. */
    IGNORED,
    /** Digit added to the input buffer. */
    ACCUMULATED,
    /** Input buffer cleared by {@code *}. */
    CLEARED,
    VALIDATED,
    REJECTED
}
