package com.phillippitts.callengine.service.session;

/**
 * Keys of the per-call session context.
 */
public final class SessionKeys {

    private SessionKeys() {
        // Constants holder
    }

    // Call lifecycle
    public static final String CALL_DIRECTION = "call_direction";
    public static final String STATUS = "status";
    public static final String TARGET_NUMBER = "target_number";
    public static final String CALLER_ID = "caller_id";
    public static final String CALLER_INFO = "caller_info";
    public static final String API_VERSION = "api_version";
    public static final String CALL_INITIATED_VIA = "call_initiated_via";
    public static final String CALL_ANSWERED = "call_answered";
    public static final String ANSWERED_AT = "answered_at";
    public static final String CALL_ACTIVE = "call_active";
    public static final String CALL_DISCONNECTED = "call_disconnected";
    public static final String DISCONNECT_REASON = "disconnect_reason";
    public static final String LAST_WEBHOOK_EVENT = "last_webhook_event";

    // Fixed-length PIN mode
    public static final String DTMF_SEQUENCE = "dtmf_sequence";
    public static final String ENTERED_PIN = "entered_pin";

    // Shared validation outcome
    public static final String DTMF_VALIDATED = "dtmf_validated";
    public static final String DTMF_VALIDATION_GATE_OPEN = "dtmf_validation_gate_open";
    public static final String CALL_CANCELLED_DTMF_FAILURE = "call_cancelled_dtmf_failure";

    // Challenge mode
    public static final String VALIDATION_PENDING = "validation_pending";
    public static final String CHALLENGE_DIGITS = "aws_challenge_digits";
    public static final String CHALLENGE_INPUT = "aws_input_sequence";
}
