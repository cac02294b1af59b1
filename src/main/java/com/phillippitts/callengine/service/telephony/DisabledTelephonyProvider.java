package com.phillippitts.callengine.service.telephony;

import com.phillippitts.callengine.exception.TelephonyProviderException;

/**
 * Provider used when no telephony client is wired. Every operation fails fast, which the engine
 * treats like any other best-effort provider error.
 */
public final class DisabledTelephonyProvider implements TelephonyProvider {

    @Override
    public CallConnection getCallConnection(String callConnectionId) {
        throw new TelephonyProviderException("Telephony provider not configured", "getCallConnection");
    }
}
