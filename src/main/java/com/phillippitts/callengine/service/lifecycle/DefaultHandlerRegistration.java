package com.phillippitts.callengine.service.lifecycle;

import com.phillippitts.callengine.service.dtmf.DtmfValidationLifecycle;
import com.phillippitts.callengine.service.events.CallEventHandler;
import com.phillippitts.callengine.service.events.CallEventProcessor;
import com.phillippitts.callengine.service.events.EventTypes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The standard handler table.
 *
 * <p>Registration is not idempotent: the host calls {@link #registerAll} exactly once per
 * processor, from {@link com.phillippitts.callengine.service.events.CallEventProcessorBuilder}.
 */
public final class DefaultHandlerRegistration {

    private static final Logger LOG = LogManager.getLogger(DefaultHandlerRegistration.class);

    private DefaultHandlerRegistration() {}

    public static void registerAll(CallEventProcessor processor,
                                   CallLifecycleHandlers lifecycle,
                                   DtmfValidationLifecycle dtmf) {
        // Synthesized events
        register(processor, EventTypes.CALL_INITIATED, "callInitiated", lifecycle::handleCallInitiated);
        register(processor, EventTypes.INBOUND_CALL_RECEIVED, "inboundCallReceived", lifecycle::handleInboundCallReceived);
        register(processor, EventTypes.CALL_ANSWERED, "callAnswered", lifecycle::handleCallAnswered);
        register(processor, EventTypes.WEBHOOK_EVENTS, "webhookEvents", lifecycle::handleWebhookEvents);

        // Provider call lifecycle
        register(processor, EventTypes.CALL_CONNECTED, "callConnected", lifecycle::handleCallConnected);
        register(processor, EventTypes.CALL_DISCONNECTED, "callDisconnected", lifecycle::handleCallDisconnected);
        register(processor, EventTypes.CREATE_CALL_FAILED, "createCallFailed", lifecycle::handleCreateCallFailed);
        register(processor, EventTypes.ANSWER_CALL_FAILED, "answerCallFailed", lifecycle::handleAnswerCallFailed);
        register(processor, EventTypes.PARTICIPANTS_UPDATED, "participantsUpdated", lifecycle::handleParticipantsUpdated);

        // DTMF
        register(processor, EventTypes.DTMF_TONE_RECEIVED, "dtmfToneReceived", dtmf::handleDtmfToneReceived);
        register(processor, EventTypes.DTMF_RECOGNITION_START_REQUESTED, "dtmfRecognitionStartRequested",
                dtmf::handleDtmfRecognitionStartRequested);

        // Media and recognition
        register(processor, EventTypes.PLAY_COMPLETED, "playCompleted", lifecycle::handlePlayCompleted);
        register(processor, EventTypes.PLAY_FAILED, "playFailed", lifecycle::handlePlayFailed);
        register(processor, EventTypes.RECOGNIZE_COMPLETED, "recognizeCompleted", lifecycle::handleRecognizeCompleted);
        register(processor, EventTypes.RECOGNIZE_FAILED, "recognizeFailed", lifecycle::handleRecognizeFailed);

        LOG.info("Registered {} default call event handlers", processor.getStats().registeredHandlers());
    }

    private static void register(CallEventProcessor processor, String type, String name, CallEventHandler handler) {
        processor.registerHandler(type, CallEventHandler.named(name, handler));
    }
}
