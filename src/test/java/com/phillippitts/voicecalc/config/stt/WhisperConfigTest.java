package com.phillippitts.voicecalc.config.stt;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class WhisperConfigTest {

    private Validator validator;

    @BeforeEach
    void setup() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void defaultsAreValid() {
        WhisperConfig config = WhisperConfig.defaults();

        assertThat(config.binaryPath()).isEqualTo("tools/whisper.cpp/main");
        assertThat(config.timeoutSeconds()).isEqualTo(10);
        assertThat(validator.validate(config)).isEmpty();
    }

    @Test
    void shouldRejectBlankBinaryPath() {
        WhisperConfig config = new WhisperConfig(" ", "models/ggml.bin", 10, "en", 4, 1048576);
        Set<ConstraintViolation<WhisperConfig>> violations = validator.validate(config);

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("binary path must not be blank");
    }

    @Test
    void shouldRejectNonPositiveTimeoutAndThreads() {
        WhisperConfig config = new WhisperConfig("bin/whisper", "models/ggml.bin", 0, "en", 0, 1048576);

        assertThat(validator.validate(config))
                .extracting(ConstraintViolation::getMessage)
                .containsExactlyInAnyOrder("Timeout must be positive", "Thread count must be positive");
    }
}
