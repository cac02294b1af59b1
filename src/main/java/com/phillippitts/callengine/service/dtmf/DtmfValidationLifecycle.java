package com.phillippitts.callengine.service.dtmf;

import com.phillippitts.callengine.domain.CallParticipant;
import com.phillippitts.callengine.domain.IdentifierKind;
import com.phillippitts.callengine.domain.ParticipantIdentifier;
import com.phillippitts.callengine.service.events.CallEventContext;
import com.phillippitts.callengine.service.events.EventData;
import com.phillippitts.callengine.service.metrics.CallEventMetrics;
import com.phillippitts.callengine.service.session.CallSession;
import com.phillippitts.callengine.service.session.SessionKeys;
import com.phillippitts.callengine.service.session.SessionStateStore;
import com.phillippitts.callengine.service.telephony.CallConnection;
import com.phillippitts.callengine.service.telephony.TelephonyProvider;
import com.phillippitts.callengine.service.telephony.TerminationReason;
import com.phillippitts.callengine.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DTMF caller validation.
 *
 * <p>Two modes coexist. While a challenge is pending, tones go to the
 * {@link ChallengeValidationStrategy}; otherwise to the {@link FixedPinValidationStrategy}.
 * A rejected PIN ends the call; a rejected challenge only records the outcome.
 *
 * <p>Successful validation opens the gate and appends a completion event to
 * {@code dtmf_validation:{callConnectionId}}, which
 * {@link #waitForDtmfValidationCompletion} blocks on.
 *
 * <p>The gate predicates fail open: when the session store is missing or errors they report
 * the call as validated, favouring availability over enforcement.
 */
public class DtmfValidationLifecycle {

    private static final Logger LOG = LogManager.getLogger(DtmfValidationLifecycle.class);

    private static final String STREAM_KEY_PREFIX = "dtmf_validation:";

    private final ChallengeValidationStrategy challenge;
    private final ValidationStrategy pin;
    private final CallTerminationService termination;
    private final CallEventMetrics metrics;

    /**
     * @param challenge challenge mode
     * @param pin fixed-length PIN mode
     * @param termination cancellation procedure for terminating failures
     * @param metrics meters, or null to run uninstrumented
     */
    public DtmfValidationLifecycle(ChallengeValidationStrategy challenge,
                                   ValidationStrategy pin,
                                   CallTerminationService termination,
                                   CallEventMetrics metrics) {
        this.challenge = Objects.requireNonNull(challenge, "challenge");
        this.pin = Objects.requireNonNull(pin, "pin");
        this.termination = Objects.requireNonNull(termination, "termination");
        this.metrics = metrics;
    }

    public static String streamKey(String callConnectionId) {
        return STREAM_KEY_PREFIX + callConnectionId;
    }

    /**
     * Handles {@code ContinuousDtmfRecognitionToneReceived}.
     */
    public void handleDtmfToneReceived(CallEventContext context) {
        Object rawTone = context.field("tone", null);
        String tone = DtmfTone.normalize(rawTone);
        if (tone == null) {
            LOG.debug("Ignoring unrecognized DTMF token '{}' for call {}",
                    LogSanitizer.truncate(String.valueOf(rawTone), 32), context.callConnectionId());
            return;
        }
        Integer sequenceId = EventData.integer(context.eventData(), "sequenceId");

        try {
            Optional<CallSession> maybeSession = context.session();
            if (maybeSession.isEmpty()) {
                LOG.warn("No session store; DTMF tone dropped for call {}", context.callConnectionId());
                return;
            }
            CallSession session = maybeSession.get();
            ValidationStrategy strategy = challenge.appliesTo(session) ? challenge : pin;
            ToneOutcome outcome = strategy.onTone(session, tone, sequenceId);
            LOG.debug("DTMF tone {} (seq={}) -> {} [{}]", tone, sequenceId, outcome, strategy.mode());
            if (outcome == ToneOutcome.IGNORED) {
                return;
            }
            session.persist();

            if (outcome == ToneOutcome.VALIDATED) {
                recordValidation(strategy, "success");
                publishCompletion(context);
            } else if (outcome == ToneOutcome.REJECTED) {
                recordValidation(strategy, "failure");
                if (strategy.terminatesOnFailure()) {
                    termination.cancelCallForDtmfFailure(context);
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Error handling DTMF tone for call {}", context.callConnectionId(), e);
        }
    }

    /**
     * Starts challenge mode for a freshly connected call: stores the challenge, closes the gate
     * and starts continuous recognition against the caller.
     *
     * @return the challenge digits, or empty when no session store is attached
     */
    public Optional<String> startChallenge(CallEventContext context) {
        String digits = null;
        try {
            Optional<CallSession> session = context.session();
            if (session.isEmpty()) {
                LOG.warn("No session store; cannot start DTMF challenge for call {}", context.callConnectionId());
                return Optional.empty();
            }
            digits = challenge.begin(session.get());
            session.get().persist();
            LOG.info("DTMF challenge issued for call {}", context.callConnectionId());
        } catch (RuntimeException e) {
            LOG.error("Failed to set up DTMF challenge for call {}", context.callConnectionId(), e);
            return Optional.empty();
        }
        startRecognition(context);
        return Optional.of(digits);
    }

    /**
     * Handles {@code V1.DTMF.RecognitionStartRequested}.
     */
    public void handleDtmfRecognitionStartRequested(CallEventContext context) {
        LOG.info("DTMF recognition start requested for call {}", context.callConnectionId());
        startRecognition(context);
    }

    private void startRecognition(CallEventContext context) {
        Optional<TelephonyProvider> provider = context.runtime().provider();
        if (provider.isEmpty()) {
            LOG.error("No telephony provider; cannot start DTMF recognition for call {}", context.callConnectionId());
            return;
        }
        try {
            CallConnection connection = provider.get().getCallConnection(context.callConnectionId());
            Optional<ParticipantIdentifier> caller = connection.listParticipants().stream()
                    .map(CallParticipant::identifier)
                    .filter(id -> id.kind() == IdentifierKind.PHONE_NUMBER)
                    .findFirst();
            if (caller.isEmpty()) {
                LOG.warn("No caller participant for DTMF recognition on call {}", context.callConnectionId());
                return;
            }
            connection.startContinuousDtmfRecognition(caller.get(), "dtmf_recognition_" + context.callConnectionId());
            LOG.info("Started DTMF recognition for call {}", context.callConnectionId());
        } catch (RuntimeException e) {
            LOG.error("Failed to start DTMF recognition for call {}", context.callConnectionId(), e);
        }
    }

    /**
     * Runs the cancellation procedure directly.
     */
    public void cancelCallForDtmfFailure(CallEventContext context) {
        termination.cancelCallForDtmfFailure(context);
    }

    private void publishCompletion(CallEventContext context) {
        SessionStateStore store = context.runtime().sessionStore();
        if (store == null) {
            return;
        }
        try {
            store.publishEvent(streamKey(context.callConnectionId()), Map.of(
                    "validation_status", "completed",
                    "result", "success"));
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish DTMF completion for call {}", context.callConnectionId(), e);
        }
    }

    private void recordValidation(ValidationStrategy strategy, String outcome) {
        if (metrics != null) {
            metrics.recordValidation(strategy.mode(), outcome);
        }
    }

    /**
     * Whether the conversation pipeline may proceed for a call.
     *
     * @return the stored gate flag; true when the store is missing or fails
     */
    public static boolean isDtmfValidationGateOpen(SessionStateStore store, String callConnectionId) {
        if (store == null) {
            return true;
        }
        try {
            boolean open = store.session(callConnectionId).getBoolean(SessionKeys.DTMF_VALIDATION_GATE_OPEN, false);
            if (!open) {
                LOG.debug("DTMF validation gate closed for call {}", callConnectionId);
            }
            return open;
        } catch (RuntimeException e) {
            LOG.warn("Error checking DTMF validation gate for call {}; failing open", callConnectionId, e);
            return true;
        }
    }

    /**
     * Current {@code dtmf_validated} flag of a call.
     *
     * @return the stored flag; true when the store is missing or fails
     */
    public static boolean getFreshDtmfValidationStatus(SessionStateStore store, String callConnectionId) {
        if (store == null) {
            return true;
        }
        try {
            return store.session(callConnectionId).getBoolean(SessionKeys.DTMF_VALIDATED, false);
        } catch (RuntimeException e) {
            LOG.warn("Error reading DTMF validation status for call {}; assuming validated", callConnectionId, e);
            return true;
        }
    }

    /**
     * Blocks until the next validation notification for a call or until {@code timeout}.
     *
     * <p>On timeout the call is hung up for everyone, best-effort. A cancellation notice
     * returns false without a second hang-up; the cancellation procedure already ended the call.
     *
     * @return true iff a success notification arrived in time
     */
    public static boolean waitForDtmfValidationCompletion(SessionStateStore store,
                                                          TelephonyProvider provider,
                                                          String callConnectionId,
                                                          Duration timeout) {
        if (store == null) {
            LOG.error("No session store; cannot wait for DTMF validation of call {}", callConnectionId);
            return false;
        }
        String key = streamKey(callConnectionId);
        LOG.info("Waiting up to {} ms for DTMF validation on {}", timeout.toMillis(), key);
        Optional<Map<String, String>> event;
        try {
            event = store.readEventBlocking(key, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for DTMF validation of call {}", callConnectionId);
            return false;
        } catch (RuntimeException e) {
            LOG.error("Error waiting for DTMF validation of call {}", callConnectionId, e);
            return false;
        }

        if (event.isPresent()) {
            boolean success = "success".equals(event.get().get("result"));
            if (success) {
                LOG.info("DTMF validation completed for call {}", callConnectionId);
            } else {
                LOG.warn("DTMF validation ended without success for call {}: {}", callConnectionId, event.get());
            }
            return success;
        }

        LOG.warn("DTMF validation timed out for call {}", callConnectionId);
        if (provider != null) {
            try {
                provider.getCallConnection(callConnectionId).hangUp(true);
                LOG.info("Call {} hung up: {}", callConnectionId, TerminationReason.DTMF_VALIDATION_TIMEOUT.wireValue());
            } catch (RuntimeException e) {
                LOG.error("Hang-up after DTMF validation timeout failed for call {}", callConnectionId, e);
            }
        }
        return false;
    }
}
