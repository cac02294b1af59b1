package com.phillippitts.callengine.service.telephony;

import com.phillippitts.callengine.exception.TelephonyProviderException;

/**
 * Entry point to the telephony provider's call automation API.
 */
@FunctionalInterface
public interface TelephonyProvider {

    /**
     * Returns a handle on an existing call.
     *
     * @throws TelephonyProviderException when the provider is unreachable or not configured
     */
    CallConnection getCallConnection(String callConnectionId);
}
