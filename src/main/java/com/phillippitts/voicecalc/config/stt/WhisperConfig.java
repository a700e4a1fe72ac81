package com.phillippitts.voicecalc.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp transcriber.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/main
 * stt.whisper.model-path=models/ggml-base.en.bin
 * stt.whisper.timeout-seconds=10
 * stt.whisper.language=en
 * stt.whisper.threads=4
 * stt.whisper.max-stdout-bytes=1048576
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp binary executable
 * @param modelPath Path to the GGML model file (.bin)
 * @param timeoutSeconds Maximum time to wait for one transcription (in seconds)
 * @param language Language code for transcription (e.g., "en")
 * @param threads Number of CPU threads to use for transcription
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper binary path must not be blank")
        @DefaultValue("tools/whisper.cpp/main")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        @DefaultValue("models/ggml-base.en.bin")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("10")
        int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        @DefaultValue("en")
        String language,

        @Positive(message = "Thread count must be positive")
        @DefaultValue("4")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("1048576")
        int maxStdoutBytes
) {
    /**
     * Standard values. Default stdout cap: 1MB.
     */
    public static WhisperConfig defaults() {
        return new WhisperConfig("tools/whisper.cpp/main", "models/ggml-base.en.bin", 10, "en", 4, 1048576);
    }
}
