package com.phillippitts.callengine.service.lifecycle;

import com.phillippitts.callengine.domain.CallParticipant;
import com.phillippitts.callengine.domain.IdentifierKind;
import com.phillippitts.callengine.service.dtmf.DtmfValidationLifecycle;
import com.phillippitts.callengine.service.events.CallEventContext;
import com.phillippitts.callengine.service.events.EventTypes;
import com.phillippitts.callengine.service.events.payload.CallConnectedPayload;
import com.phillippitts.callengine.service.events.payload.CallDisconnectedPayload;
import com.phillippitts.callengine.service.events.payload.CallEventPayloads;
import com.phillippitts.callengine.service.events.payload.CallInitiatedPayload;
import com.phillippitts.callengine.service.events.payload.InboundCallPayload;
import com.phillippitts.callengine.service.events.payload.ParticipantsPayload;
import com.phillippitts.callengine.service.events.payload.ResultInformationPayload;
import com.phillippitts.callengine.service.session.CallSession;
import com.phillippitts.callengine.service.session.SessionKeys;
import com.phillippitts.callengine.service.telephony.TelephonyProvider;
import com.phillippitts.callengine.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State transitions for the non-DTMF call events.
 *
 * <p>No handler lets an exception escape: session, provider and broadcast errors are logged and
 * the handler returns. Multi-field session writes are staged and persisted together, so a failed
 * persist leaves none of them behind.
 */
public class CallLifecycleHandlers {

    private static final Logger LOG = LogManager.getLogger(CallLifecycleHandlers.class);

    static final String BROADCAST_CALL_CONNECTED = "call_connected";

    private final DtmfValidationLifecycle dtmf;
    private final boolean dtmfValidationEnabled;

    public CallLifecycleHandlers(DtmfValidationLifecycle dtmf, boolean dtmfValidationEnabled) {
        this.dtmf = Objects.requireNonNull(dtmf, "dtmf");
        this.dtmfValidationEnabled = dtmfValidationEnabled;
    }

    public boolean isDtmfValidationEnabled() {
        return dtmfValidationEnabled;
    }

    /**
     * {@code V1.Call.Initiated}: records an API-placed outbound call.
     */
    public void handleCallInitiated(CallEventContext context) {
        CallInitiatedPayload payload = context.payload(CallInitiatedPayload.class)
                .orElse(new CallInitiatedPayload(null, "unknown"));
        LOG.info("Call initiated: call={}, target={}, api={}", context.callConnectionId(),
                LogSanitizer.maskPhone(payload.targetNumber()), payload.apiVersion());

        Map<String, Object> fields = new HashMap<>();
        fields.put(SessionKeys.CALL_INITIATED_VIA, "api");
        fields.put(SessionKeys.API_VERSION, payload.apiVersion());
        fields.put(SessionKeys.CALL_DIRECTION, "outbound");
        if (payload.targetNumber() != null) {
            fields.put(SessionKeys.TARGET_NUMBER, payload.targetNumber());
        }
        writeSession(context, fields, "call initiation");
    }

    /**
     * {@code V1.Call.InboundReceived}: records the caller of an inbound call.
     */
    public void handleInboundCallReceived(CallEventContext context) {
        InboundCallPayload payload = context.payload(InboundCallPayload.class)
                .orElse(new InboundCallPayload("unknown", Map.of()));
        LOG.info("Inbound call received from {}", LogSanitizer.maskPhone(payload.callerId()));

        Map<String, Object> fields = new HashMap<>();
        fields.put(SessionKeys.CALL_DIRECTION, "inbound");
        fields.put(SessionKeys.CALLER_ID, payload.callerId());
        fields.put(SessionKeys.CALLER_INFO, payload.callerInfo());
        fields.put(SessionKeys.API_VERSION, "v1");
        writeSession(context, fields, "inbound call");
    }

    /**
     * {@code V1.Call.Answered}.
     */
    public void handleCallAnswered(CallEventContext context) {
        LOG.info("Call answered: {}", context.callConnectionId());
        writeSession(context, Map.of(
                SessionKeys.CALL_ANSWERED, true,
                SessionKeys.ANSWERED_AT, Instant.now().toString()), "call answer");
    }

    /**
     * {@code CallConnected}: identifies the caller, starts DTMF validation when enabled, then
     * notifies observers. The conversation itself starts only once validation completes.
     */
    public void handleCallConnected(CallEventContext context) {
        String callId = context.callConnectionId();
        LOG.info("Call connected: {}", callId);

        List<CallParticipant> participants = listParticipants(context);
        Optional<CallParticipant> caller = firstOfKind(participants, IdentifierKind.PHONE_NUMBER);
        Optional<CallParticipant> providerLeg = firstOfKind(participants, IdentifierKind.COMMUNICATION_USER);
        if (caller.isEmpty()) {
            LOG.warn("Caller participant not found for call {}", callId);
        }
        if (providerLeg.isEmpty()) {
            LOG.warn("Provider participant not found for call {}", callId);
        }
        String callerId = caller.map(p -> p.identifier().value()).orElse(null);
        LOG.info("Caller phone number: {}", LogSanitizer.maskPhone(callerId));

        Map<String, Object> fields = new HashMap<>();
        fields.put(SessionKeys.CALL_ACTIVE, true);
        fields.put(SessionKeys.STATUS, "connected");
        if (callerId != null) {
            fields.put(SessionKeys.CALLER_ID, callerId);
        }
        writeSession(context, fields, "call connected");

        if (dtmfValidationEnabled) {
            dtmf.startChallenge(context);
        }

        broadcastConnected(context);
    }

    /**
     * {@code CallDisconnected}: marks the session inactive. The session is kept; retention
     * belongs to the store.
     */
    public void handleCallDisconnected(CallEventContext context) {
        String state = context.payload(CallDisconnectedPayload.class)
                .map(CallDisconnectedPayload::callConnectionState)
                .orElse(null);
        LOG.info("Call disconnected: call={}, state={}", context.callConnectionId(), state);

        Map<String, Object> fields = new HashMap<>();
        fields.put(SessionKeys.CALL_ACTIVE, false);
        fields.put(SessionKeys.CALL_DISCONNECTED, true);
        fields.put(SessionKeys.STATUS, "disconnected");
        if (state != null) {
            fields.put(SessionKeys.DISCONNECT_REASON, state);
        }
        writeSession(context, fields, "call disconnect");
    }

    public void handleCreateCallFailed(CallEventContext context) {
        LOG.error("Create call failed: call={}, reason={}", context.callConnectionId(), resultOf(context).describe());
    }

    public void handleAnswerCallFailed(CallEventContext context) {
        LOG.error("Answer call failed: call={}, reason={}", context.callConnectionId(), resultOf(context).describe());
    }

    /**
     * {@code ParticipantsUpdated}: logs the roster.
     */
    public void handleParticipantsUpdated(CallEventContext context) {
        List<CallParticipant> participants = context.payload(ParticipantsPayload.class)
                .map(ParticipantsPayload::participants)
                .orElseGet(() -> CallEventPayloads.participants(context.eventData()));
        LOG.info("Participants updated for call {}: {} participant(s)", context.callConnectionId(), participants.size());
        for (int i = 0; i < participants.size(); i++) {
            CallParticipant p = participants.get(i);
            LOG.info("  Participant {}: {}, muted: {}", i + 1, p.kind(), p.muted());
        }
    }

    public void handlePlayCompleted(CallEventContext context) {
        LOG.info("Play completed: {}", context.callConnectionId());
    }

    public void handlePlayFailed(CallEventContext context) {
        LOG.error("Play failed: call={}, reason={}", context.callConnectionId(), resultOf(context).describe());
    }

    public void handleRecognizeCompleted(CallEventContext context) {
        LOG.info("Recognize completed: call={}, result={}", context.callConnectionId(),
                context.field("recognitionType", "unknown"));
    }

    public void handleRecognizeFailed(CallEventContext context) {
        LOG.error("Recognize failed: call={}, reason={}", context.callConnectionId(), resultOf(context).describe());
    }

    /**
     * {@code V1.Webhook.Events}: routes on the embedded original event type and records it as
     * the last webhook event of the call.
     */
    public void handleWebhookEvents(CallEventContext context) {
        String type = context.eventType();
        LOG.info("Webhook event {} for call {}", type, context.callConnectionId());
        switch (type) {
            case EventTypes.CALL_CONNECTED -> handleCallConnected(context);
            case EventTypes.CALL_DISCONNECTED -> handleCallDisconnected(context);
            case EventTypes.CREATE_CALL_FAILED -> handleCreateCallFailed(context);
            case EventTypes.ANSWER_CALL_FAILED -> handleAnswerCallFailed(context);
            case EventTypes.PARTICIPANTS_UPDATED -> handleParticipantsUpdated(context);
            case EventTypes.DTMF_TONE_RECEIVED -> dtmf.handleDtmfToneReceived(context);
            case EventTypes.PLAY_COMPLETED -> handlePlayCompleted(context);
            case EventTypes.PLAY_FAILED -> handlePlayFailed(context);
            case EventTypes.RECOGNIZE_COMPLETED -> handleRecognizeCompleted(context);
            case EventTypes.RECOGNIZE_FAILED -> handleRecognizeFailed(context);
            default -> LOG.warn("Unhandled webhook event type: {}", type);
        }
        writeSession(context, Map.of(SessionKeys.LAST_WEBHOOK_EVENT, type), "webhook stats");
    }

    private List<CallParticipant> listParticipants(CallEventContext context) {
        Optional<TelephonyProvider> provider = context.runtime().provider();
        if (provider.isEmpty()) {
            LOG.warn("No telephony provider; participants unknown for call {}", context.callConnectionId());
            return List.of();
        }
        try {
            return provider.get().getCallConnection(context.callConnectionId()).listParticipants();
        } catch (RuntimeException e) {
            LOG.error("Failed to list participants for call {}", context.callConnectionId(), e);
            return List.of();
        }
    }

    private static Optional<CallParticipant> firstOfKind(List<CallParticipant> participants, IdentifierKind kind) {
        return participants.stream().filter(p -> p.kind() == kind).findFirst();
    }

    private void broadcastConnected(CallEventContext context) {
        context.runtime().observers().ifPresent(broadcaster -> {
            String connectedTime = context.payload(CallConnectedPayload.class)
                    .map(CallConnectedPayload::connectedTime)
                    .orElse(null);
            Map<String, Object> body = new HashMap<>();
            body.put("validation_flow", dtmfValidationEnabled ? "dtmf_challenge" : "none");
            if (connectedTime != null) {
                body.put("timestamp", connectedTime);
            }
            broadcaster.broadcast(context.runtime().sessionStore(), context.callConnectionId(),
                    BROADCAST_CALL_CONNECTED, body);
        });
    }

    private static ResultInformationPayload resultOf(CallEventContext context) {
        return context.payload(ResultInformationPayload.class).orElse(ResultInformationPayload.EMPTY);
    }

    private static void writeSession(CallEventContext context, Map<String, Object> fields, String what) {
        try {
            Optional<CallSession> session = context.session();
            if (session.isEmpty()) {
                LOG.debug("No session store; {} not recorded for call {}", what, context.callConnectionId());
                return;
            }
            session.get().update(fields);
            session.get().persist();
        } catch (RuntimeException e) {
            LOG.error("Failed to record {} for call {}", what, context.callConnectionId(), e);
        }
    }
}
