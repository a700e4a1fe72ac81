package com.phillippitts.voicecalc.service.stt.whisper;

import com.phillippitts.voicecalc.config.stt.WhisperConfig;
import com.phillippitts.voicecalc.exception.TranscriptionException;
import com.phillippitts.voicecalc.service.audio.WavWriter;
import com.phillippitts.voicecalc.service.audio.capture.AudioSegment;
import com.phillippitts.voicecalc.service.stt.SpeechTranscriber;
import com.phillippitts.voicecalc.service.stt.TranscriptionOutcome;
import com.phillippitts.voicecalc.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link SpeechTranscriber} running whisper.cpp on a temporary WAV file per segment.
 *
 * <p>Classification of outcomes:
 * <ul>
 *   <li>empty output or only non-speech markers: {@link TranscriptionOutcome.Unintelligible}</li>
 *   <li>timeout, non-zero exit, process or temp file I/O failure: {@link TranscriptionOutcome.ServiceError}</li>
 *   <li>anything else: {@link TranscriptionOutcome.Recognized}</li>
 * </ul>
 *
 * <p>The temporary file is always deleted.
 */
public class WhisperTranscriber implements SpeechTranscriber {

    private static final Logger LOG = LogManager.getLogger(WhisperTranscriber.class);

    private final WhisperConfig cfg;
    private final WhisperProcessManager manager;

    public WhisperTranscriber(WhisperConfig cfg, WhisperProcessManager manager) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
        LOG.info("Whisper transcriber configured: bin={}, model={}, timeout={}s, lang={}, threads={}",
                cfg.binaryPath(), cfg.modelPath(), cfg.timeoutSeconds(), cfg.language(), cfg.threads());
    }

    @Override
    public TranscriptionOutcome transcribe(AudioSegment segment) {
        Objects.requireNonNull(segment, "segment");
        if (segment.size() == 0) {
            return new TranscriptionOutcome.Unintelligible();
        }
        Path wav = null;
        try {
            wav = Files.createTempFile("voicecalc-", ".wav");
            WavWriter.write(segment.pcm(), wav);
            String stdout = manager.transcribe(wav, cfg);
            String text = WhisperOutputParser.extractText(stdout);
            if (!WhisperOutputParser.isSpeech(text)) {
                LOG.debug("Whisper returned no speech for {} ms segment", segment.durationMillis());
                return new TranscriptionOutcome.Unintelligible();
            }
            LOG.debug("Whisper transcript: '{}'", LogSanitizer.truncate(text));
            return new TranscriptionOutcome.Recognized(text);
        } catch (TranscriptionException e) {
            LOG.warn("Whisper transcription failed: {}", e.getMessage());
            return new TranscriptionOutcome.ServiceError(e.getMessage());
        } catch (IOException e) {
            LOG.warn("Failed to prepare WAV for whisper: {}", e.toString());
            return new TranscriptionOutcome.ServiceError("Failed to write temporary WAV: " + e.getMessage());
        } finally {
            deleteQuietly(wav);
        }
    }

    @Override
    public String name() {
        return WhisperProcessManager.ENGINE;
    }

    private static void deleteQuietly(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.debug("Could not delete temporary WAV {}: {}", wav, e.toString());
        }
    }
}
