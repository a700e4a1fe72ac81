package com.phillippitts.voicecalc.service.audio;

import org.junit.jupiter.api.Test;

import static com.phillippitts.voicecalc.testutil.FakeSegmentSource.tone;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoiceActivityGateTest {

    private final VoiceActivityGate gate = new VoiceActivityGate(VoiceActivityGate.DEFAULT_THRESHOLD);

    @Test
    void passesSpeechAboveThreshold() {
        assertThat(gate.passes(tone(3200, 800))).isTrue();
    }

    @Test
    void rejectsSegmentsAtOrBelowThreshold() {
        assertThat(gate.passes(tone(3200, 150))).isFalse();
        assertThat(gate.passes(tone(3200, 40))).isFalse();
    }

    @Test
    void rejectsEmptyAndAllZeroSegments() {
        assertThat(gate.passes(new byte[0])).isFalse();
        assertThat(gate.passes(null)).isFalse();
        assertThat(new VoiceActivityGate(0.0).passes(new byte[3200])).isFalse();
    }

    @Test
    void negativeThresholdIsRejected() {
        assertThatThrownBy(() -> new VoiceActivityGate(-1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
