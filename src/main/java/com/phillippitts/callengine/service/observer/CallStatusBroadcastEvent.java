package com.phillippitts.callengine.service.observer;

import java.time.Instant;

/**
 * Status notification for the presentation layer.
 *
 * @param sessionId presentation session id the notification is addressed to
 * @param callConnectionId call the notification is about
 * @param type notification type (e.g. "call_connected")
 * @param payloadJson JSON body delivered to the presentation layer
 * @param timestamp when the notification was created
 */
public record CallStatusBroadcastEvent(
        String sessionId,
        String callConnectionId,
        String type,
        String payloadJson,
        Instant timestamp
) {
}
