package com.phillippitts.callengine.service.telephony;

import com.phillippitts.callengine.domain.CallParticipant;
import com.phillippitts.callengine.domain.ParticipantIdentifier;
import com.phillippitts.callengine.exception.TelephonyProviderException;

import java.util.List;

/**
 * Client handle on one live call at the telephony provider.
 *
 * <p>All operations may throw {@link TelephonyProviderException}; callers treat them as best-effort.
 */
public interface CallConnection {

    String callConnectionId();

    /**
     * Ends the call.
     *
     * @param forEveryone true to end the call for every participant, false to leave only this leg
     */
    void hangUp(boolean forEveryone);

    List<CallParticipant> listParticipants();

    /**
     * Starts continuous DTMF recognition against the given participant.
     *
     * @param target participant whose key presses are reported
     * @param operationContext correlation tag echoed back on the resulting tone events
     */
    void startContinuousDtmfRecognition(ParticipantIdentifier target, String operationContext);
}
