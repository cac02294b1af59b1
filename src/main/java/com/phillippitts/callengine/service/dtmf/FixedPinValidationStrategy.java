package com.phillippitts.callengine.service.dtmf;

import com.phillippitts.callengine.service.session.CallSession;
import com.phillippitts.callengine.service.session.SessionKeys;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Fixed-length PIN mode, used whenever no challenge is pending.
 *
 * <p>{@code #} submits the buffer: it validates iff it holds exactly {@code pinLength} digits.
 * {@code #} on an empty buffer is ignored. A rejected PIN terminates the call.
 */
public class FixedPinValidationStrategy implements ValidationStrategy {

    private static final Logger LOG = LogManager.getLogger(FixedPinValidationStrategy.class);

    public static final String MODE = "pin";

    private final int pinLength;

    public FixedPinValidationStrategy(int pinLength) {
        if (pinLength < 1) {
            throw new IllegalArgumentException("pinLength must be >= 1");
        }
        this.pinLength = pinLength;
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public boolean appliesTo(CallSession session) {
        return !session.getBoolean(SessionKeys.VALIDATION_PENDING, false);
    }

    @Override
    public ToneOutcome onTone(CallSession session, String tone, Integer sequenceId) {
        DtmfSequenceBuffer buffer = DtmfSequenceBuffer.of(session.getString(SessionKeys.DTMF_SEQUENCE, ""));

        if (DtmfTone.STAR.equals(tone)) {
            session.set(SessionKeys.DTMF_SEQUENCE, "");
            LOG.info("DTMF sequence cleared for call {}", session.callConnectionId());
            return ToneOutcome.CLEARED;
        }
        if (!DtmfTone.POUND.equals(tone)) {
            if (!buffer.accepts(sequenceId)) {
                LOG.warn("Ignoring DTMF tone for call {}: sequenceId={} exceeds max sequence length {}",
                        session.callConnectionId(), sequenceId, DtmfSequenceBuffer.MAX_LENGTH);
                return ToneOutcome.IGNORED;
            }
            session.set(SessionKeys.DTMF_SEQUENCE, buffer.put(tone, sequenceId).toString());
            return ToneOutcome.ACCUMULATED;
        }
        if (buffer.isEmpty()) {
            LOG.debug("Ignoring # on empty DTMF sequence for call {}", session.callConnectionId());
            return ToneOutcome.IGNORED;
        }

        boolean valid = buffer.isCompletePin(pinLength);
        String sequence = buffer.toString();

        Map<String, Object> fields = new HashMap<>();
        fields.put(SessionKeys.DTMF_SEQUENCE, "");
        fields.put(SessionKeys.DTMF_VALIDATED, valid);
        fields.put(SessionKeys.ENTERED_PIN, valid ? sequence : null);
        if (valid) {
            fields.put(SessionKeys.DTMF_VALIDATION_GATE_OPEN, true);
        }
        session.update(fields);

        if (valid) {
            LOG.info("PIN validated for call {}", session.callConnectionId());
            return ToneOutcome.VALIDATED;
        }
        LOG.warn("PIN rejected for call {}: length={}, gaps={}",
                session.callConnectionId(), sequence.length(), buffer.hasGaps());
        return ToneOutcome.REJECTED;
    }

    @Override
    public boolean terminatesOnFailure() {
        return true;
    }
}
