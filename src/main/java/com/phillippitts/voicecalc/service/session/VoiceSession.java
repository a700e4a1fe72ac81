package com.phillippitts.voicecalc.service.session;

import com.phillippitts.voicecalc.config.properties.SessionProperties;
import com.phillippitts.voicecalc.domain.IntentResult;
import com.phillippitts.voicecalc.domain.SessionState;
import com.phillippitts.voicecalc.domain.VoiceAction;
import com.phillippitts.voicecalc.exception.AudioCaptureException;
import com.phillippitts.voicecalc.service.audio.VoiceActivityGate;
import com.phillippitts.voicecalc.service.audio.capture.AcquireResult;
import com.phillippitts.voicecalc.service.audio.capture.AudioSegment;
import com.phillippitts.voicecalc.service.audio.capture.SpeechSegmentSource;
import com.phillippitts.voicecalc.service.intent.IntentInterpreter;
import com.phillippitts.voicecalc.service.intent.IntentModel;
import com.phillippitts.voicecalc.service.metrics.VoiceMetrics;
import com.phillippitts.voicecalc.service.session.VoiceEvent.StatusLevel;
import com.phillippitts.voicecalc.service.stt.SpeechTranscriber;
import com.phillippitts.voicecalc.service.stt.TranscriptionOutcome;
import com.phillippitts.voicecalc.util.LogSanitizer;
import com.phillippitts.voicecalc.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Continuous voice capture session: microphone segments in, calculator actions out.
 *
 * <p>One worker runs the capture loop. Per iteration it checks the cancellation flag, waits a
 * bounded time for a segment, rechecks the flag, applies the energy gate, transcribes,
 * interprets, stitches the result with the fragment buffer and publishes exactly one result
 * event. A spoken stop command ends the loop.
 *
 * <p>Error handling:
 * <ul>
 *   <li>acquire timeout, unintelligible audio, low-energy segment: absorbed, loop continues</li>
 *   <li>calibration failure, device loss, transcription service failure: session enters ERROR,
 *       loop ends, an error-level status event is published</li>
 *   <li>no device at start: ERROR without a worker</li>
 * </ul>
 *
 * <p>{@link #start()} and {@link #stop()} are serialized on this instance and only flip the
 * cancellation flag and the state machine; the fragment buffer belongs to the worker.
 * {@link #stop()} waits (bounded) for the worker to exit, so the device is released before the
 * session reports IDLE.
 */
public class VoiceSession {

    private static final Logger LOG = LogManager.getLogger(VoiceSession.class);

    static final String MDC_SESSION_KEY = "voiceSession";

    private final SpeechSegmentSource source;
    private final SpeechTranscriber transcriber;
    private final IntentInterpreter interpreter;
    private final IntentModel intentModel;
    private final VoiceEventChannel events;
    private final VoiceActivityGate gate;
    private final VoiceMetrics metrics;
    private final SessionProperties props;
    private final Executor workerExecutor;
    private final Clock clock;

    private final SessionStateMachine stateMachine = new SessionStateMachine();
    private final AtomicBoolean running = new AtomicBoolean(false);
    // Bumped on every start and stop; a worker only touches state while its generation is current
    private final AtomicLong generation = new AtomicLong();
    private final Object workerGuard = new Object();
    private final Object lifecycle = new Object();
    private volatile CountDownLatch workerExited = new CountDownLatch(0);

    public VoiceSession(SpeechSegmentSource source,
                        SpeechTranscriber transcriber,
                        IntentInterpreter interpreter,
                        IntentModel intentModel,
                        VoiceEventChannel events,
                        VoiceActivityGate gate,
                        VoiceMetrics metrics,
                        SessionProperties props,
                        Executor workerExecutor,
                        Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.transcriber = Objects.requireNonNull(transcriber, "transcriber");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.intentModel = Objects.requireNonNull(intentModel, "intentModel");
        this.events = Objects.requireNonNull(events, "events");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.props = Objects.requireNonNull(props, "props");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // --- control boundary ---------------------------------------------------

    /**
     * Starts capturing. No-op (status re-emitted) while already running.
     *
     * @return state after the call: CALIBRATING when a worker was spawned, ERROR when no device
     *         is available, otherwise the unchanged current state
     */
    public SessionState start() {
        synchronized (lifecycle) {
            SessionState current = stateMachine.current();
            if (current.isRunning()) {
                emitStatus("Voice capture already running", StatusLevel.INFO);
                return current;
            }
            if (current == SessionState.STOPPING || !awaitWorkerExit()) {
                emitStatus("Voice capture is still stopping", StatusLevel.WARNING);
                return stateMachine.current();
            }
            if (!source.isDeviceAvailable()) {
                stateMachine.fail();
                LOG.warn("Start requested but no capture device is available: {}",
                        source.deviceError().orElse("unknown"));
                emitStatus("Microphone unavailable on this host", StatusLevel.ERROR);
                return SessionState.ERROR;
            }
            if (!stateMachine.transition(current, SessionState.CALIBRATING)) {
                return stateMachine.current();
            }
            long workerGeneration;
            synchronized (workerGuard) {
                workerGeneration = generation.incrementAndGet();
                running.set(true);
            }
            CountDownLatch exited = new CountDownLatch(1);
            workerExited = exited;
            emitStatus("Calibrating microphone…", StatusLevel.INFO);
            String sessionId = UUID.randomUUID().toString().substring(0, 8);
            try {
                workerExecutor.execute(() -> runCapture(sessionId, workerGeneration, exited));
            } catch (RejectedExecutionException e) {
                exited.countDown();
                fail("Voice capture worker could not be started: " + e.getMessage());
            }
            return stateMachine.current();
        }
    }

    /**
     * Stops capturing and waits (bounded) for the worker to exit. Idempotent.
     *
     * @return state after the call, normally IDLE
     */
    public SessionState stop() {
        synchronized (lifecycle) {
            SessionState current = stateMachine.current();
            if (!current.isRunning() && current != SessionState.STOPPING) {
                retireWorker();
                awaitWorkerExit();
                stateMachine.settleIdle();
                emitStatus("Voice capture idle", StatusLevel.INFO);
                return stateMachine.current();
            }

            retireWorker();
            // The worker may move CALIBRATING -> LISTENING concurrently
            SessionState observed = current;
            while (observed.isRunning() && !stateMachine.transition(observed, SessionState.STOPPING)) {
                observed = stateMachine.current();
            }
            emitStatus("Stopping microphone stream…", StatusLevel.INFO);
            source.close();
            if (!awaitWorkerExit()) {
                LOG.warn("Capture worker did not exit within {} ms", props.stopTimeoutMs());
            }
            stateMachine.settleIdle();
            emitStatus("Voice capture stopped", StatusLevel.INFO);
            return stateMachine.current();
        }
    }

    public SessionStatus status() {
        return new SessionStatus(stateMachine.current(), source.isDeviceAvailable(),
                source.deviceError().orElse(null));
    }

    public SessionState state() {
        return stateMachine.current();
    }

    /**
     * Interprets a transcript synchronously, bypassing capture and the fragment buffer.
     */
    public IntentResult interpret(String transcript) {
        return interpreter.interpret(transcript);
    }

    /**
     * Retrains the intent classifier and swaps it in atomically.
     */
    public void reloadModel() {
        intentModel.reload();
        emitStatus("Intent model reloaded", StatusLevel.INFO);
    }

    @PreDestroy
    public void shutdown() {
        if (running.get() || stateMachine.current().isRunning()) {
            LOG.info("Stopping voice session on shutdown");
            stop();
        }
    }

    // --- capture worker -----------------------------------------------------

    private void runCapture(String sessionId, long workerGeneration, CountDownLatch exited) {
        ThreadContext.put(MDC_SESSION_KEY, sessionId);
        UtteranceStitcher stitcher = new UtteranceStitcher(props.gapTimeout());
        try {
            if (!calibrate(workerGeneration)) {
                return;
            }
            captureLoop(workerGeneration, stitcher);
        } catch (RuntimeException e) {
            LOG.error("Capture loop failed unexpectedly", e);
            failFromWorker(workerGeneration, "Voice capture failed: " + e.getMessage());
        } finally {
            stitcher.reset();
            source.close();
            synchronized (workerGuard) {
                if (generation.get() == workerGeneration) {
                    running.set(false);
                }
            }
            exited.countDown();
            LOG.info("Capture worker exited in state {}", stateMachine.current());
            ThreadContext.remove(MDC_SESSION_KEY);
        }
    }

    private boolean calibrate(long workerGeneration) {
        try {
            source.open();
        } catch (AudioCaptureException e) {
            failFromWorker(workerGeneration, "Microphone calibration failed: " + e.getMessage());
            return false;
        }
        if (!isCurrent(workerGeneration)) {
            return false;
        }
        if (!stateMachine.transition(SessionState.CALIBRATING, SessionState.LISTENING)) {
            return false;
        }
        emitStatus("Listening for commands…", StatusLevel.INFO);
        return true;
    }

    private void captureLoop(long workerGeneration, UtteranceStitcher stitcher) {
        while (isCurrent(workerGeneration)) {
            AcquireResult acquired = source.acquireSegment(props.acquireTimeout(), props.maxSegment());
            if (!isCurrent(workerGeneration)) {
                break;
            }
            if (acquired instanceof AcquireResult.TimedOut) {
                continue;
            }
            if (acquired instanceof AcquireResult.DeviceLost lost) {
                failFromWorker(workerGeneration, "Microphone error: " + lost.reason());
                return;
            }
            AudioSegment segment = ((AcquireResult.Captured) acquired).segment();

            if (!gate.passes(segment.pcm())) {
                metrics.incrementDiscardedSegment();
                emitStatus("Discarded low-energy audio", StatusLevel.DEBUG);
                continue;
            }

            long start = System.nanoTime();
            TranscriptionOutcome outcome = transcriber.transcribe(segment);
            metrics.recordTranscriptionLatency(transcriber.name(), System.nanoTime() - start);
            if (!isCurrent(workerGeneration)) {
                LOG.debug("Session stopped during transcription; outcome dropped");
                break;
            }

            if (outcome instanceof TranscriptionOutcome.Unintelligible) {
                metrics.incrementTranscriptionFailure("unintelligible");
                emitStatus("Could not understand audio", StatusLevel.WARNING);
                continue;
            }
            if (outcome instanceof TranscriptionOutcome.ServiceError error) {
                metrics.incrementTranscriptionFailure("service");
                failFromWorker(workerGeneration, "Speech service error: " + error.message());
                return;
            }
            String transcript = ((TranscriptionOutcome.Recognized) outcome).text();

            IntentResult stitched = stitcher.stitch(interpreter.interpret(transcript), clock.instant());
            synchronized (workerGuard) {
                if (generation.get() != workerGeneration) {
                    LOG.debug("Session stopped before result could be emitted; dropped");
                    break;
                }
                events.publish(VoiceEvent.ResultEvent.of(stitched, TimeUtils.epochSeconds(clock)));
            }
            metrics.recordAction(stitched.action());
            LOG.debug("Utterance '{}' -> {} {}", LogSanitizer.truncate(transcript),
                    stitched.action().wireName(), stitched.expression());

            if (stitched.action() == VoiceAction.STOP) {
                stopFromWorker(workerGeneration);
                return;
            }
        }
    }

    /**
     * Spoken stop: LISTENING → STOPPING → IDLE with the device released in between.
     */
    private void stopFromWorker(long workerGeneration) {
        synchronized (workerGuard) {
            if (generation.get() != workerGeneration) {
                return;
            }
            running.set(false);
            if (!stateMachine.transition(SessionState.LISTENING, SessionState.STOPPING)) {
                return;
            }
            emitStatus("Stopping microphone stream…", StatusLevel.INFO);
            source.close();
            if (stateMachine.transition(SessionState.STOPPING, SessionState.IDLE)) {
                emitStatus("Voice capture stopped", StatusLevel.INFO);
            }
        }
    }

    /**
     * Fails the session unless it has been stopped or restarted since this worker was spawned.
     */
    private void failFromWorker(long workerGeneration, String message) {
        synchronized (workerGuard) {
            if (generation.get() != workerGeneration) {
                LOG.info("Ignoring failure of a stopped capture worker: {}", message);
                return;
            }
            fail(message);
        }
    }

    private boolean isCurrent(long workerGeneration) {
        return running.get() && generation.get() == workerGeneration;
    }

    private void retireWorker() {
        synchronized (workerGuard) {
            running.set(false);
            generation.incrementAndGet();
        }
    }

    private void fail(String message) {
        running.set(false);
        SessionState previous = stateMachine.fail();
        LOG.error("Voice session failed (was {}): {}", previous, message);
        emitStatus(message, StatusLevel.ERROR);
    }

    private boolean awaitWorkerExit() {
        try {
            return workerExited.await(props.stopTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void emitStatus(String message, StatusLevel level) {
        events.publish(VoiceEvent.StatusEvent.of(message, level, stateMachine.current(),
                TimeUtils.epochSeconds(clock)));
    }
}
