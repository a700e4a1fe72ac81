package com.phillippitts.voicecalc;

import com.phillippitts.voicecalc.config.audio.AudioCaptureProperties;
import com.phillippitts.voicecalc.config.properties.ClassifierProperties;
import com.phillippitts.voicecalc.config.properties.SessionProperties;
import com.phillippitts.voicecalc.config.stt.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperConfig.class,
        AudioCaptureProperties.class,
        SessionProperties.class,
        ClassifierProperties.class
})
public class VoiceCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceCalcApplication.class, args);
    }

}
