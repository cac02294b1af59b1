package com.phillippitts.callengine.service.events;

import com.phillippitts.callengine.service.observer.CallStatusBroadcaster;
import com.phillippitts.callengine.service.session.SessionStateStore;
import com.phillippitts.callengine.service.telephony.SessionTerminator;
import com.phillippitts.callengine.service.telephony.TelephonyProvider;

import java.util.Optional;

/**
 * Collaborators handed to every context built during one batch.
 *
 * @param sessionStore durable per-call state; null when the host runs without one
 * @param telephony provider client; null when the host runs without one
 * @param broadcaster observer broadcast channel; null disables broadcasts
 * @param terminator graceful termination channel; null falls back to provider hang-up
 */
public record CallEventRuntime(
        SessionStateStore sessionStore,
        TelephonyProvider telephony,
        CallStatusBroadcaster broadcaster,
        SessionTerminator terminator
) {

    public Optional<SessionStateStore> store() {
        return Optional.ofNullable(sessionStore);
    }

    public Optional<TelephonyProvider> provider() {
        return Optional.ofNullable(telephony);
    }

    public Optional<CallStatusBroadcaster> observers() {
        return Optional.ofNullable(broadcaster);
    }

    public Optional<SessionTerminator> gracefulTerminator() {
        return Optional.ofNullable(terminator);
    }
}
