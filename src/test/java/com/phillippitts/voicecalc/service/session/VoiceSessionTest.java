package com.phillippitts.voicecalc.service.session;

import com.phillippitts.voicecalc.config.properties.SessionProperties;
import com.phillippitts.voicecalc.domain.IntentResult;
import com.phillippitts.voicecalc.domain.SessionState;
import com.phillippitts.voicecalc.exception.AudioCaptureException;
import com.phillippitts.voicecalc.service.audio.VoiceActivityGate;
import com.phillippitts.voicecalc.service.audio.capture.AcquireResult;
import com.phillippitts.voicecalc.service.audio.capture.AudioSegment;
import com.phillippitts.voicecalc.service.expression.ExpressionNormalizer;
import com.phillippitts.voicecalc.service.expression.Lexer;
import com.phillippitts.voicecalc.service.intent.IntentInterpreter;
import com.phillippitts.voicecalc.service.intent.IntentModel;
import com.phillippitts.voicecalc.service.intent.IntentResolver;
import com.phillippitts.voicecalc.service.metrics.VoiceMetrics;
import com.phillippitts.voicecalc.service.session.VoiceEvent.ResultEvent;
import com.phillippitts.voicecalc.service.session.VoiceEvent.StatusEvent;
import com.phillippitts.voicecalc.service.session.VoiceEvent.StatusLevel;
import com.phillippitts.voicecalc.testutil.FakeSegmentSource;
import com.phillippitts.voicecalc.testutil.FakeTranscriber;
import com.phillippitts.voicecalc.testutil.KeywordClassifier;
import com.phillippitts.voicecalc.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class VoiceSessionTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeSegmentSource source;
    private FakeTranscriber transcriber;
    private VoiceEventChannel channel;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private ExecutorService executor;
    private VoiceSession session;
    private final List<VoiceEvent> seen = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        source = new FakeSegmentSource();
        transcriber = new FakeTranscriber();
        channel = new VoiceEventChannel(256, Duration.ofMillis(200));
        registry = new SimpleMeterRegistry();
        clock = new MutableClock();
        executor = Executors.newCachedThreadPool();
        session = newSession(SessionProperties.defaults());
    }

    private VoiceSession newSession(SessionProperties props) {
        IntentModel model = new IntentModel(KeywordClassifier::new);
        IntentInterpreter interpreter = new IntentInterpreter(new Lexer(), new ExpressionNormalizer(),
                model, new IntentResolver());
        return new VoiceSession(source, transcriber, interpreter, model, channel,
                new VoiceActivityGate(VoiceActivityGate.DEFAULT_THRESHOLD), new VoiceMetrics(registry),
                props, executor, clock);
    }

    @AfterEach
    void tearDown() {
        transcriber.release();
        session.stop();
        executor.shutdownNow();
    }

    @Test
    void startCalibratesThenListens() {
        SessionState afterStart = session.start();

        assertThat(afterStart).isIn(SessionState.CALIBRATING, SessionState.LISTENING);
        await().atMost(WAIT).until(() -> session.state() == SessionState.LISTENING);
        assertThat(source.openCount()).isEqualTo(1);
        assertThat(statusMessages()).contains("Calibrating microphone…", "Listening for commands…");
    }

    @Test
    void fragmentsWithinGapAreStitchedAndLaterOnesStartOver() {
        transcriber.says("five plus two").says("four").says("six");
        source.speech()
                .then(() -> {
                    clock.advance(Duration.ofMillis(1000));
                    return captured();
                })
                .then(() -> {
                    clock.advance(Duration.ofMillis(2000));
                    return captured();
                });

        session.start();

        List<ResultEvent> results = awaitResults(3);
        assertThat(results).extracting(ResultEvent::action)
                .containsExactly("append_expression", "append_expression", "append_expression");
        assertThat(results).extracting(ResultEvent::expression)
                .containsExactly("5+2", "5+2 4", "6");
    }

    @Test
    void calculateFlushesBufferAndClearsIt() {
        transcriber.says("five plus two").says("equals").says("three");
        source.speech().speech().speech();

        session.start();

        List<ResultEvent> results = awaitResults(3);
        assertThat(results.get(1).action()).isEqualTo("calculate");
        assertThat(results.get(1).intent()).isEqualTo("calculate");
        assertThat(results.get(1).expression()).isEqualTo("5+2");
        assertThat(results.get(1).confidence()).isGreaterThanOrEqualTo(0.6);
        assertThat(results.get(2).expression()).isEqualTo("3");
    }

    @Test
    void clearDropsBufferAndCarriesNoExpression() {
        transcriber.says("five plus two").says("clear").says("nine");
        source.speech().speech().speech();

        session.start();

        List<ResultEvent> results = awaitResults(3);
        assertThat(results.get(1).action()).isEqualTo("clear");
        assertThat(results.get(1).expression()).isNull();
        assertThat(results.get(2).expression()).isEqualTo("9");
    }

    @Test
    void lowEnergySegmentsAreNeverTranscribed() {
        transcriber.says("nine");
        source.silence().silence().speech();

        session.start();

        List<ResultEvent> results = awaitResults(1);
        assertThat(results.get(0).expression()).isEqualTo("9");
        assertThat(transcriber.callCount()).isEqualTo(1);
        assertThat(registry.get("voicecalc.segment.discarded").counter().count()).isEqualTo(2.0);
        assertThat(statuses()).anySatisfy(s -> {
            assertThat(s.message()).isEqualTo("Discarded low-energy audio");
            assertThat(s.level()).isEqualTo(StatusLevel.DEBUG);
        });
    }

    @Test
    void unintelligibleAudioIsAWarningAndLoopContinues() {
        transcriber.mumbles().says("eight");
        source.speech().speech();

        session.start();

        List<ResultEvent> results = awaitResults(1);
        assertThat(results.get(0).expression()).isEqualTo("8");
        assertThat(session.state()).isEqualTo(SessionState.LISTENING);
        assertThat(statuses()).anySatisfy(s -> {
            assertThat(s.message()).isEqualTo("Could not understand audio");
            assertThat(s.level()).isEqualTo(StatusLevel.WARNING);
        });
    }

    @Test
    void serviceErrorFailsTheSession() {
        transcriber.fails("whisper exited with code 1");
        source.speech();

        session.start();

        await().atMost(WAIT).until(() -> session.state() == SessionState.ERROR);
        await().atMost(WAIT).until(source::isClosed);
        assertThat(statuses()).anySatisfy(s -> {
            assertThat(s.message()).isEqualTo("Speech service error: whisper exited with code 1");
            assertThat(s.level()).isEqualTo(StatusLevel.ERROR);
            assertThat(s.state()).isEqualTo("error");
        });
        assertThat(results()).isEmpty();
    }

    @Test
    void deviceLossFailsTheSession() {
        source.deviceLost("line closed");

        session.start();

        await().atMost(WAIT).until(() -> session.state() == SessionState.ERROR);
        assertThat(statusMessages()).contains("Microphone error: line closed");
    }

    @Test
    void calibrationFailureFailsTheSession() {
        source.openFailure = new AudioCaptureException("CALIBRATION_FAILED", "Microphone stopped during calibration", null);

        session.start();

        await().atMost(WAIT).until(() -> session.state() == SessionState.ERROR);
        assertThat(statusMessages())
                .contains("Microphone calibration failed: Microphone stopped during calibration");
    }

    @Test
    void missingDeviceFailsStartWithoutWorker() {
        source.deviceAvailable = false;

        SessionState state = session.start();

        assertThat(state).isEqualTo(SessionState.ERROR);
        assertThat(session.state()).isEqualTo(SessionState.ERROR);
        assertThat(source.openCount()).isZero();
        assertThat(statuses()).anySatisfy(s -> {
            assertThat(s.message()).isEqualTo("Microphone unavailable on this host");
            assertThat(s.level()).isEqualTo(StatusLevel.ERROR);
        });
        assertThat(session.status().micAvailable()).isFalse();
        assertThat(session.status().micError()).isEqualTo("No capture device found");
    }

    @Test
    void spokenStopEndsSessionAndReleasesDevice() {
        transcriber.says("stop listening");
        source.speech();

        session.start();

        List<ResultEvent> results = awaitResults(1);
        assertThat(results.get(0).action()).isEqualTo("stop");
        await().atMost(WAIT).until(() -> session.state() == SessionState.IDLE);
        await().atMost(WAIT).until(source::isClosed);
        assertThat(statusMessages()).contains("Voice capture stopped");
    }

    @Test
    void stopReturnsToIdleAndIsIdempotent() {
        session.start();
        await().atMost(WAIT).until(() -> session.state() == SessionState.LISTENING);

        assertThat(session.stop()).isEqualTo(SessionState.IDLE);
        assertThat(source.isClosed()).isTrue();
        assertThat(statusMessages()).contains("Stopping microphone stream…", "Voice capture stopped");

        assertThat(session.stop()).isEqualTo(SessionState.IDLE);
        assertThat(statusMessages()).contains("Voice capture idle");
    }

    @Test
    void lateTranscriptionFailureDoesNotReviveAStoppedSession() {
        session = newSession(new SessionProperties(1500, 3000, 7000, 200, 256, 2000, 20000));
        transcriber.fails("whisper timed out").holdsUntilReleased();
        source.speech();

        session.start();
        await().atMost(WAIT).until(transcriber::hasBeenCalled);

        assertThat(session.stop()).isEqualTo(SessionState.IDLE);
        transcriber.release();
        await().atMost(WAIT).until(() -> transcriber.returnedCount() == 1 && source.closeCount() >= 2);

        assertThat(session.state()).isEqualTo(SessionState.IDLE);
        assertThat(statusMessages()).doesNotContain("Speech service error: whisper timed out");
        assertThat(statuses()).noneSatisfy(s -> assertThat(s.level()).isEqualTo(StatusLevel.ERROR));
    }

    @Test
    void lateTranscriptionResultIsDroppedAfterStop() {
        session = newSession(new SessionProperties(1500, 3000, 7000, 200, 256, 2000, 20000));
        transcriber.says("five plus two").holdsUntilReleased();
        source.speech();

        session.start();
        await().atMost(WAIT).until(transcriber::hasBeenCalled);

        assertThat(session.stop()).isEqualTo(SessionState.IDLE);
        transcriber.release();
        await().atMost(WAIT).until(() -> transcriber.returnedCount() == 1 && source.closeCount() >= 2);

        assertThat(session.state()).isEqualTo(SessionState.IDLE);
        assertThat(results()).isEmpty();
    }

    @Test
    void shutdownStopsARunningSession() {
        session.start();
        await().atMost(WAIT).until(() -> session.state() == SessionState.LISTENING);

        session.shutdown();

        assertThat(session.state()).isEqualTo(SessionState.IDLE);
        assertThat(source.isClosed()).isTrue();
    }

    @Test
    void startWhileRunningIsANoop() {
        session.start();
        await().atMost(WAIT).until(() -> session.state() == SessionState.LISTENING);

        assertThat(session.start()).isEqualTo(SessionState.LISTENING);
        assertThat(source.openCount()).isEqualTo(1);
        assertThat(statusMessages()).contains("Voice capture already running");
    }

    @Test
    void startRecoversFromError() {
        transcriber.fails("boom");
        source.speech();
        session.start();
        await().atMost(WAIT).until(() -> session.state() == SessionState.ERROR);

        session.start();

        await().atMost(WAIT).until(() -> session.state() == SessionState.LISTENING);
        assertThat(source.openCount()).isEqualTo(2);
    }

    @Test
    void stopFromErrorSettlesIdle() {
        source.deviceAvailable = false;
        session.start();

        assertThat(session.stop()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void interpretBypassesTheLoop() {
        IntentResult result = session.interpret("seven times five");

        assertThat(result.expression()).isEqualTo("7*5");
        assertThat(result.action().wireName()).isEqualTo("append_expression");
        assertThat(channel.size()).isZero();
    }

    @Test
    void reloadModelAnnouncesItself() {
        session.reloadModel();

        assertThat(statusMessages()).contains("Intent model reloaded");
    }

    @Test
    void actionsAreCounted() {
        transcriber.says("one plus one").says("equals");
        source.speech().speech();

        session.start();
        awaitResults(2);

        assertThat(registry.get("voicecalc.utterance.actions").tag("action", "calculate").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("voicecalc.utterance.actions").tag("action", "append_expression").counter().count())
                .isEqualTo(1.0);
    }

    // --- helpers ---

    private static AcquireResult captured() {
        return new AcquireResult.Captured(new AudioSegment(FakeSegmentSource.LOUD));
    }

    private void drain() {
        Optional<VoiceEvent> next;
        while ((next = channel.poll(Duration.ZERO)).isPresent()) {
            seen.add(next.get());
        }
    }

    private List<ResultEvent> awaitResults(int count) {
        await().atMost(WAIT).until(() -> results().size() >= count);
        return results();
    }

    private List<ResultEvent> results() {
        drain();
        return seen.stream().filter(ResultEvent.class::isInstance).map(ResultEvent.class::cast).toList();
    }

    private List<StatusEvent> statuses() {
        drain();
        return seen.stream().filter(StatusEvent.class::isInstance).map(StatusEvent.class::cast).toList();
    }

    private List<String> statusMessages() {
        return statuses().stream().map(StatusEvent::message).toList();
    }
}
