package com.phillippitts.callengine.service.dtmf;

/**
 * Digit buffer for fixed-length PIN entry.
 *
 * <p>Tones carrying a 1-based sequence id are placed at that position and the buffer grows to
 * fit; positions not yet filled hold {@link #GAP}. Tones without a sequence id are appended.
 * The buffer never grows past {@link #MAX_LENGTH}; a tone that would push it further is dropped.
 * The buffer round-trips through its string form so it can live in the session.
 */
final class DtmfSequenceBuffer {

    static final char GAP = '-';

    static final int MAX_LENGTH = 64;

    private final StringBuilder digits;

    private DtmfSequenceBuffer(String initial) {
        this.digits = new StringBuilder(initial == null ? "" : initial);
    }

    static DtmfSequenceBuffer of(String stored) {
        return new DtmfSequenceBuffer(stored);
    }

    /**
     * True when a tone at this sequence id fits within {@link #MAX_LENGTH}.
     */
    boolean accepts(Integer sequenceId) {
        if (sequenceId == null || sequenceId < 1) {
            return digits.length() < MAX_LENGTH;
        }
        return sequenceId <= MAX_LENGTH;
    }

    DtmfSequenceBuffer put(String tone, Integer sequenceId) {
        if (!accepts(sequenceId)) {
            return this;
        }
        if (sequenceId == null || sequenceId < 1) {
            digits.append(tone);
            return this;
        }
        int index = sequenceId - 1;
        while (digits.length() <= index) {
            digits.append(GAP);
        }
        digits.setCharAt(index, tone.charAt(0));
        return this;
    }

    boolean isEmpty() {
        return digits.length() == 0;
    }

    boolean hasGaps() {
        return digits.indexOf(String.valueOf(GAP)) >= 0;
    }

    /**
     * True when the buffer holds exactly {@code length} digits with no gaps.
     */
    boolean isCompletePin(int length) {
        if (digits.length() != length) {
            return false;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return digits.toString();
    }
}
