package com.phillippitts.callengine.service.observer;

/**
 * Receives call status notifications for the presentation layer.
 */
@FunctionalInterface
public interface CallObserver {

    void onCallStatus(CallStatusBroadcastEvent event);
}
