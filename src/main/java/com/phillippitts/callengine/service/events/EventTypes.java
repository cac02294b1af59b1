package com.phillippitts.callengine.service.events;

import java.util.Set;

/**
 * Catalog of protocol event type strings.
 *
 * <p>Two families coexist:
 * <ul>
 *   <li>provider-originated webhook events ({@code Microsoft.Communication.*})</li>
 *   <li>internally synthesized API events ({@code V1.*}), including the {@link #WEBHOOK_EVENTS}
 *       meta-type whose handler re-dispatches on the embedded original event type</li>
 * </ul>
 */
public final class EventTypes {

    private EventTypes() {
        // Constants holder
    }

    // Call management
    public static final String CALL_CONNECTED = "Microsoft.Communication.CallConnected";
    public static final String CALL_DISCONNECTED = "Microsoft.Communication.CallDisconnected";
    public static final String CALL_TRANSFER_ACCEPTED = "Microsoft.Communication.CallTransferAccepted";
    public static final String CALL_TRANSFER_FAILED = "Microsoft.Communication.CallTransferFailed";
    public static final String CREATE_CALL_FAILED = "Microsoft.Communication.CreateCallFailed";
    public static final String ANSWER_CALL_FAILED = "Microsoft.Communication.AnswerCallFailed";

    // Participants
    public static final String PARTICIPANTS_UPDATED = "Microsoft.Communication.ParticipantsUpdated";

    // DTMF
    public static final String DTMF_TONE_RECEIVED = "Microsoft.Communication.ContinuousDtmfRecognitionToneReceived";
    public static final String DTMF_TONE_FAILED = "Microsoft.Communication.ContinuousDtmfRecognitionToneFailed";
    public static final String DTMF_RECOGNITION_STOPPED = "Microsoft.Communication.ContinuousDtmfRecognitionStopped";

    // Media
    public static final String PLAY_COMPLETED = "Microsoft.Communication.PlayCompleted";
    public static final String PLAY_FAILED = "Microsoft.Communication.PlayFailed";
    public static final String PLAY_CANCELED = "Microsoft.Communication.PlayCanceled";

    // Recognition
    public static final String RECOGNIZE_COMPLETED = "Microsoft.Communication.RecognizeCompleted";
    public static final String RECOGNIZE_FAILED = "Microsoft.Communication.RecognizeFailed";
    public static final String RECOGNIZE_CANCELED = "Microsoft.Communication.RecognizeCanceled";

    // Synthesized API events
    public static final String CALL_INITIATED = "V1.Call.Initiated";
    public static final String INBOUND_CALL_RECEIVED = "V1.Call.InboundReceived";
    public static final String CALL_ANSWERED = "V1.Call.Answered";
    public static final String WEBHOOK_EVENTS = "V1.Webhook.Events";
    public static final String CALL_STATE_UPDATED = "V1.Call.StateUpdated";
    public static final String CALL_CLEANUP_REQUESTED = "V1.Call.CleanupRequested";
    public static final String DTMF_RECOGNITION_START_REQUESTED = "V1.DTMF.RecognitionStartRequested";

    private static final Set<String> CONNECT_CLASS = Set.of(CALL_CONNECTED, CALL_ANSWERED);

    private static final Set<String> DISCONNECT_CLASS = Set.of(
            CALL_DISCONNECTED, CREATE_CALL_FAILED, ANSWER_CALL_FAILED);

    /** Events that add the call to the active-call cache. */
    public static boolean isConnectClass(String type) {
        return type != null && CONNECT_CLASS.contains(type);
    }

    /** Events that remove the call from the active-call cache. */
    public static boolean isDisconnectClass(String type) {
        return type != null && DISCONNECT_CLASS.contains(type);
    }
}
