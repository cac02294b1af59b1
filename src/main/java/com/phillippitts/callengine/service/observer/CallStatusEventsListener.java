package com.phillippitts.callengine.service.observer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs call status notifications published on the event bus. A presentation transport
 * (websocket fan-out and the like) subscribes to the same events.
 */
@Component
class CallStatusEventsListener {
    private static final Logger LOG = LogManager.getLogger(CallStatusEventsListener.class);

    @EventListener
    void onCallStatus(CallStatusBroadcastEvent e) {
        LOG.info("Call status broadcast: type={}, session={}, call={}",
                e.type(), e.sessionId(), e.callConnectionId());
    }
}
