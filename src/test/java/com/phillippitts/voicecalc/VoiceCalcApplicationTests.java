package com.phillippitts.voicecalc;

import com.phillippitts.voicecalc.domain.SessionState;
import com.phillippitts.voicecalc.domain.VoiceAction;
import com.phillippitts.voicecalc.service.session.VoiceSession;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(
    properties = {
        "voice.classifier.dataset-path=target/test-data/voice_intent_dataset.json",
        "voice.classifier.synthetic-corpus=false",
        "audio.capture.calibration-ms=100"
    }
)
class VoiceCalcApplicationTests {

    @Autowired
    private VoiceSession session;

    @Test
    void contextLoadsWithIdleSession() {
        assertThat(session.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void typedTranscriptIsInterpretedWithoutMicrophone() {
        assertThat(session.interpret("clear").action()).isEqualTo(VoiceAction.CLEAR);
    }
}
