package com.phillippitts.callengine.service.dtmf;

import com.phillippitts.callengine.service.session.CallSession;
import com.phillippitts.callengine.service.session.SessionKeys;

/**
 * Validation state of a call as derived from its session.
 *
 * <pre>
 * NO_CHALLENGE -&gt; CHALLENGE_PENDING -&gt; VALIDATED | REJECTED
 * </pre>
 */
public enum ValidationState {
    NO_CHALLENGE,
    CHALLENGE_PENDING,
    VALIDATED,
    REJECTED;

    public static ValidationState of(CallSession session) {
        if (session.getBoolean(SessionKeys.VALIDATION_PENDING, false)) {
            return CHALLENGE_PENDING;
        }
        Object validated = session.get(SessionKeys.DTMF_VALIDATED, null);
        if (validated == null) {
            return NO_CHALLENGE;
        }
        return session.getBoolean(SessionKeys.DTMF_VALIDATED, false) ? VALIDATED : REJECTED;
    }
}
