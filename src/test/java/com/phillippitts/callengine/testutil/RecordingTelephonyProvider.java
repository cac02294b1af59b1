package com.phillippitts.callengine.testutil;

import com.phillippitts.callengine.domain.CallParticipant;
import com.phillippitts.callengine.domain.ParticipantIdentifier;
import com.phillippitts.callengine.exception.TelephonyProviderException;
import com.phillippitts.callengine.service.telephony.CallConnection;
import com.phillippitts.callengine.service.telephony.TelephonyProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory telephony provider that records hang-ups and recognition starts.
 */
public class RecordingTelephonyProvider implements TelephonyProvider {

    public record HangUp(String callConnectionId, boolean forEveryone) {}

    public record RecognitionStart(String callConnectionId, ParticipantIdentifier target, String operationContext) {}

    private final List<CallParticipant> participants = new ArrayList<>();
    private final List<HangUp> hangUps = new CopyOnWriteArrayList<>();
    private final List<RecognitionStart> recognitionStarts = new CopyOnWriteArrayList<>();
    private volatile boolean unavailable;
    private volatile boolean failHangUp;

    /**
     * Default roster: one PSTN caller and one provider leg.
     */
    public static RecordingTelephonyProvider withCallerAndAgent(String callerNumber) {
        RecordingTelephonyProvider provider = new RecordingTelephonyProvider();
        provider.participants.add(new CallParticipant(ParticipantIdentifier.phoneNumber(callerNumber), false));
        provider.participants.add(new CallParticipant(
                ParticipantIdentifier.communicationUser("8:acs:resource_bot"), false));
        return provider;
    }

    public RecordingTelephonyProvider unavailable() {
        this.unavailable = true;
        return this;
    }

    public RecordingTelephonyProvider failingHangUp() {
        this.failHangUp = true;
        return this;
    }

    public List<HangUp> hangUps() {
        return List.copyOf(hangUps);
    }

    public List<RecognitionStart> recognitionStarts() {
        return List.copyOf(recognitionStarts);
    }

    @Override
    public CallConnection getCallConnection(String callConnectionId) {
        if (unavailable) {
            throw new TelephonyProviderException("Provider unavailable", "getCallConnection");
        }
        return new CallConnection() {
            @Override
            public String callConnectionId() {
                return callConnectionId;
            }

            @Override
            public void hangUp(boolean forEveryone) {
                if (failHangUp) {
                    throw new TelephonyProviderException("Hang-up rejected", "hangUp");
                }
                hangUps.add(new HangUp(callConnectionId, forEveryone));
            }

            @Override
            public List<CallParticipant> listParticipants() {
                return List.copyOf(participants);
            }

            @Override
            public void startContinuousDtmfRecognition(ParticipantIdentifier target, String operationContext) {
                recognitionStarts.add(new RecognitionStart(callConnectionId, target, operationContext));
            }
        };
    }
}
