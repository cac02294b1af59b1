package com.phillippitts.callengine.service.events.payload;

import com.phillippitts.callengine.domain.CallParticipant;

import java.util.List;

public record ParticipantsPayload(List<CallParticipant> participants) implements CallEventPayload {

    public ParticipantsPayload {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}
