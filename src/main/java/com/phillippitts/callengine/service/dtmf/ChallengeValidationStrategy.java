package com.phillippitts.callengine.service.dtmf;

import com.phillippitts.callengine.service.session.CallSession;
import com.phillippitts.callengine.service.session.SessionKeys;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.SecureRandom;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Challenge mode: the caller echoes a random code followed by {@code #}.
 *
 * <p>{@code *} clears the caller's input but keeps the challenge. A mismatch rejects the call's
 * validation without terminating it and no new challenge is offered.
 */
public class ChallengeValidationStrategy implements ValidationStrategy {

    private static final Logger LOG = LogManager.getLogger(ChallengeValidationStrategy.class);

    public static final String MODE = "challenge";

    private final Supplier<String> challengeGenerator;

    public ChallengeValidationStrategy(Supplier<String> challengeGenerator) {
        this.challengeGenerator = Objects.requireNonNull(challengeGenerator, "challengeGenerator");
    }

    /**
     * Uses a {@link SecureRandom} code of the given number of digits.
     */
    public static ChallengeValidationStrategy withRandomDigits(int length) {
        SecureRandom random = new SecureRandom();
        return new ChallengeValidationStrategy(() -> {
            StringBuilder sb = new StringBuilder(length);
            for (int i = 0; i < length; i++) {
                sb.append(random.nextInt(10));
            }
            return sb.toString();
        });
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public boolean appliesTo(CallSession session) {
        return session.getBoolean(SessionKeys.VALIDATION_PENDING, false);
    }

    /**
     * Stages a new challenge and closes the gate.
     *
     * @return the expected digits
     */
    public String begin(CallSession session) {
        String digits = challengeGenerator.get();
        Map<String, Object> fields = new HashMap<>();
        fields.put(SessionKeys.VALIDATION_PENDING, true);
        fields.put(SessionKeys.CHALLENGE_DIGITS, digits);
        fields.put(SessionKeys.CHALLENGE_INPUT, "");
        fields.put(SessionKeys.DTMF_VALIDATED, false);
        fields.put(SessionKeys.DTMF_VALIDATION_GATE_OPEN, false);
        session.update(fields);
        return digits;
    }

    @Override
    public ToneOutcome onTone(CallSession session, String tone, Integer sequenceId) {
        String input = session.getString(SessionKeys.CHALLENGE_INPUT, "");
        if (DtmfTone.STAR.equals(tone)) {
            session.set(SessionKeys.CHALLENGE_INPUT, "");
            return ToneOutcome.CLEARED;
        }
        if (!DtmfTone.POUND.equals(tone)) {
            session.set(SessionKeys.CHALLENGE_INPUT, input + tone);
            return ToneOutcome.ACCUMULATED;
        }

        String expected = session.getString(SessionKeys.CHALLENGE_DIGITS, "");
        boolean valid = !expected.isEmpty() && expected.equals(input);

        Map<String, Object> fields = new HashMap<>();
        fields.put(SessionKeys.VALIDATION_PENDING, false);
        fields.put(SessionKeys.DTMF_VALIDATED, valid);
        fields.put(SessionKeys.CHALLENGE_DIGITS, null);
        fields.put(SessionKeys.CHALLENGE_INPUT, null);
        if (valid) {
            fields.put(SessionKeys.DTMF_VALIDATION_GATE_OPEN, true);
        }
        session.update(fields);

        if (valid) {
            LOG.info("Challenge validated for call {}", session.callConnectionId());
            return ToneOutcome.VALIDATED;
        }
        LOG.warn("Challenge mismatch for call {}: {} digit(s) entered",
                session.callConnectionId(), input.length());
        return ToneOutcome.REJECTED;
    }

    @Override
    public boolean terminatesOnFailure() {
        return false;
    }
}
