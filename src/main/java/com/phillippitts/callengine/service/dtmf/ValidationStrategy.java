package com.phillippitts.callengine.service.dtmf;

import com.phillippitts.callengine.service.session.CallSession;

/**
 * One DTMF validation mode.
 *
 * <p>A strategy only stages session writes; the lifecycle persists them and applies the side
 * effects of the outcome (completion notification, metrics, termination).
 */
public interface ValidationStrategy {

    /**
     * Mode name used in logs and metrics tags.
     */
    String mode();

    /**
     * Whether this strategy owns tones for the call in its current state.
     */
    boolean appliesTo(CallSession session);

    /**
     * Applies one normalized tone.
     *
     * @param session call session; writes are staged, not persisted
     * @param tone canonical tone, never null
     * @param sequenceId 1-based position reported by the provider, may be null
     */
    ToneOutcome onTone(CallSession session, String tone, Integer sequenceId);

    /**
     * Whether a {@link ToneOutcome#REJECTED} outcome ends the call.
     */
    boolean terminatesOnFailure();
}
