package com.phillippitts.callengine.service.dtmf;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DtmfSequenceBufferTest {

    @Test
    void placesTonesBySequenceIdAndGrows() {
        DtmfSequenceBuffer buffer = DtmfSequenceBuffer.of("")
                .put("3", 3)
                .put("1", 1);

        assertThat(buffer).hasToString("1-3");
        assertThat(buffer.hasGaps()).isTrue();

        buffer.put("2", 2).put("4", 4);

        assertThat(buffer).hasToString("1234");
        assertThat(buffer.isCompletePin(4)).isTrue();
    }

    @Test
    void appendsTonesWithoutSequenceId() {
        DtmfSequenceBuffer buffer = DtmfSequenceBuffer.of("12").put("3", null);

        assertThat(buffer).hasToString("123");
        assertThat(buffer.isCompletePin(4)).isFalse();
    }

    @Test
    void laterToneOverwritesSamePosition() {
        DtmfSequenceBuffer buffer = DtmfSequenceBuffer.of("").put("1", 1).put("9", 1);

        assertThat(buffer).hasToString("9");
    }

    @Test
    void bufferWithGapIsNeverACompletePin() {
        DtmfSequenceBuffer buffer = DtmfSequenceBuffer.of("").put("1", 1).put("2", 2).put("4", 4);

        assertThat(buffer.toString()).hasSize(4);
        assertThat(buffer.isCompletePin(4)).isFalse();
    }

    @Test
    void dropsTonesBeyondMaxLength() {
        DtmfSequenceBuffer buffer = DtmfSequenceBuffer.of("12");

        assertThat(buffer.accepts(Integer.MAX_VALUE)).isFalse();
        assertThat(buffer.accepts(DtmfSequenceBuffer.MAX_LENGTH + 1)).isFalse();
        assertThat(buffer.put("3", Integer.MAX_VALUE)).hasToString("12");
        assertThat(buffer.put("3", DtmfSequenceBuffer.MAX_LENGTH)).hasToString(
                "12" + "-".repeat(DtmfSequenceBuffer.MAX_LENGTH - 3) + "3");
    }

    @Test
    void stopsAppendingAtMaxLength() {
        DtmfSequenceBuffer buffer = DtmfSequenceBuffer.of("1".repeat(DtmfSequenceBuffer.MAX_LENGTH));

        assertThat(buffer.accepts(null)).isFalse();
        assertThat(buffer.put("2", null).toString()).hasSize(DtmfSequenceBuffer.MAX_LENGTH).doesNotContain("2");
    }
}
