package com.phillippitts.voicecalc.config;

import com.phillippitts.voicecalc.config.audio.AudioCaptureProperties;
import com.phillippitts.voicecalc.config.properties.ClassifierProperties;
import com.phillippitts.voicecalc.config.properties.SessionProperties;
import com.phillippitts.voicecalc.config.stt.WhisperConfig;
import com.phillippitts.voicecalc.service.audio.VoiceActivityGate;
import com.phillippitts.voicecalc.service.audio.capture.JavaSoundSegmentSource;
import com.phillippitts.voicecalc.service.audio.capture.SpeechSegmentSource;
import com.phillippitts.voicecalc.service.expression.ExpressionNormalizer;
import com.phillippitts.voicecalc.service.expression.Lexer;
import com.phillippitts.voicecalc.service.intent.IntentInterpreter;
import com.phillippitts.voicecalc.service.intent.IntentModel;
import com.phillippitts.voicecalc.service.intent.IntentResolver;
import com.phillippitts.voicecalc.service.metrics.VoiceMetrics;
import com.phillippitts.voicecalc.service.session.VoiceEventChannel;
import com.phillippitts.voicecalc.service.session.VoiceSession;
import com.phillippitts.voicecalc.service.stt.SpeechTranscriber;
import com.phillippitts.voicecalc.service.stt.whisper.WhisperProcessManager;
import com.phillippitts.voicecalc.service.stt.whisper.WhisperTranscriber;
import com.phillippitts.voicecalc.service.training.CorpusIntentClassifierFactory;
import com.phillippitts.voicecalc.service.training.TrainingCorpusRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the voice pipeline explicitly: interpretation, training, audio, transcription and the
 * session that ties them together.
 */
@Configuration
public class VoiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // --- interpretation ---

    @Bean
    public Lexer lexer() {
        return new Lexer();
    }

    @Bean
    public ExpressionNormalizer expressionNormalizer() {
        return new ExpressionNormalizer();
    }

    @Bean
    public IntentResolver intentResolver() {
        return new IntentResolver();
    }

    @Bean
    public TrainingCorpusRepository trainingCorpusRepository(ClassifierProperties props) {
        return new TrainingCorpusRepository(Path.of(props.datasetPath()));
    }

    /**
     * Trains the initial classifier at startup; a corpus that yields no samples fails fast.
     */
    @Bean
    public IntentModel intentModel(TrainingCorpusRepository repository, ClassifierProperties props) {
        return new IntentModel(new CorpusIntentClassifierFactory(repository, props.syntheticCorpus()));
    }

    @Bean
    public IntentInterpreter intentInterpreter(Lexer lexer,
                                               ExpressionNormalizer normalizer,
                                               IntentModel intentModel,
                                               IntentResolver resolver) {
        return new IntentInterpreter(lexer, normalizer, intentModel, resolver);
    }

    // --- audio & transcription ---

    @Bean
    public VoiceActivityGate voiceActivityGate(AudioCaptureProperties props) {
        return new VoiceActivityGate(props.getEnergyThreshold());
    }

    @Bean
    public SpeechSegmentSource speechSegmentSource(AudioCaptureProperties props,
                                                   ApplicationEventPublisher publisher) {
        return new JavaSoundSegmentSource(props, publisher);
    }

    @Bean(destroyMethod = "close")
    public WhisperProcessManager whisperProcessManager() {
        return new WhisperProcessManager();
    }

    @Bean
    public SpeechTranscriber speechTranscriber(WhisperConfig cfg, WhisperProcessManager manager) {
        return new WhisperTranscriber(cfg, manager);
    }

    // --- session ---

    @Bean
    public VoiceEventChannel voiceEventChannel(SessionProperties props) {
        return new VoiceEventChannel(props.eventQueueCapacity(), props.eventOfferTimeout());
    }

    @Bean
    public VoiceMetrics voiceMetrics(MeterRegistry registry) {
        return new VoiceMetrics(registry);
    }

    @Bean
    public VoiceSession voiceSession(SpeechSegmentSource source,
                                     SpeechTranscriber transcriber,
                                     IntentInterpreter interpreter,
                                     IntentModel intentModel,
                                     VoiceEventChannel events,
                                     VoiceActivityGate gate,
                                     VoiceMetrics metrics,
                                     SessionProperties props,
                                     @Qualifier("captureExecutor") Executor captureExecutor,
                                     Clock clock) {
        return new VoiceSession(source, transcriber, interpreter, intentModel, events, gate,
                metrics, props, captureExecutor, clock);
    }
}
