package com.phillippitts.callengine.service.dtmf;

import com.phillippitts.callengine.service.events.CallEventContext;
import com.phillippitts.callengine.service.events.CallEventRuntime;
import com.phillippitts.callengine.service.metrics.CallEventMetrics;
import com.phillippitts.callengine.service.session.CallSession;
import com.phillippitts.callengine.service.session.SessionKeys;
import com.phillippitts.callengine.service.session.SessionStateStore;
import com.phillippitts.callengine.service.telephony.SessionTerminator;
import com.phillippitts.callengine.service.telephony.TelephonyProvider;
import com.phillippitts.callengine.service.telephony.TerminationReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * Ends a call whose DTMF validation failed.
 *
 * <p>The cancellation flags are persisted before anything is terminated, so a concurrent
 * reader of the session sees why the call is going away. Termination then tries the graceful
 * session terminator and falls back to a provider hang-up for every leg. Never throws.
 */
public class CallTerminationService {

    private static final Logger LOG = LogManager.getLogger(CallTerminationService.class);

    static final String PATH_GRACEFUL = "graceful";
    static final String PATH_PROVIDER = "provider";
    static final String PATH_NONE = "none";

    private final CallEventMetrics metrics;

    /**
     * @param metrics meters, or null to run uninstrumented
     */
    public CallTerminationService(CallEventMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Runs the cancellation procedure for the call of {@code context}.
     *
     * @return the termination path taken: graceful, provider or none
     */
    public String cancelCallForDtmfFailure(CallEventContext context) {
        String callId = context.callConnectionId();
        CallEventRuntime runtime = context.runtime();
        LOG.warn("Cancelling call {} after DTMF validation failure", callId);

        markCancelled(context);
        notifyFailure(runtime.sessionStore(), callId);
        runtime.observers().ifPresent(b -> b.broadcast(runtime.sessionStore(), callId, "call_cancelled",
                Map.of("reason", TerminationReason.DTMF_VALIDATION_FAILED.wireValue())));

        String path = terminate(runtime.gracefulTerminator(), runtime.provider(), callId);
        if (metrics != null) {
            metrics.recordTermination(path);
        }
        return path;
    }

    private static void markCancelled(CallEventContext context) {
        try {
            Optional<CallSession> session = context.session();
            if (session.isEmpty()) {
                LOG.warn("No session store; cancellation flags not recorded for call {}", context.callConnectionId());
                return;
            }
            session.get().update(Map.of(
                    SessionKeys.DTMF_VALIDATION_GATE_OPEN, false,
                    SessionKeys.CALL_CANCELLED_DTMF_FAILURE, true));
            session.get().persist();
        } catch (RuntimeException e) {
            LOG.error("Failed to record cancellation for call {}", context.callConnectionId(), e);
        }
    }

    private static void notifyFailure(SessionStateStore store, String callId) {
        if (store == null) {
            return;
        }
        try {
            store.publishEvent(DtmfValidationLifecycle.streamKey(callId), Map.of(
                    "validation_status", "failed",
                    "result", "cancelled",
                    "reason", TerminationReason.DTMF_VALIDATION_FAILED.wireValue()));
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish cancellation notice for call {}", callId, e);
        }
    }

    private static String terminate(Optional<SessionTerminator> terminator,
                                    Optional<TelephonyProvider> provider,
                                    String callId) {
        if (terminator.isPresent()) {
            try {
                if (terminator.get().terminate(callId, TerminationReason.DTMF_VALIDATION_FAILED)) {
                    LOG.info("Call {} terminated gracefully", callId);
                    return PATH_GRACEFUL;
                }
                LOG.warn("Graceful termination declined for call {}; hanging up via provider", callId);
            } catch (Exception e) {
                LOG.warn("Graceful termination failed for call {}; hanging up via provider", callId, e);
            }
        }
        if (provider.isPresent()) {
            try {
                provider.get().getCallConnection(callId).hangUp(true);
                LOG.info("Call {} hung up for everyone", callId);
                return PATH_PROVIDER;
            } catch (RuntimeException e) {
                LOG.error("Provider hang-up failed for call {}", callId, e);
            }
        }
        LOG.error("Call {} could not be terminated after DTMF validation failure", callId);
        return PATH_NONE;
    }
}
