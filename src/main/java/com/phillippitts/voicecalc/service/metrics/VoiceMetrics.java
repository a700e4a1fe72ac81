package com.phillippitts.voicecalc.service.metrics;

import com.phillippitts.voicecalc.domain.VoiceAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation of the capture loop.
 *
 * <ul>
 *   <li>{@code voicecalc.utterance.actions{action}}: emitted result events per action</li>
 *   <li>{@code voicecalc.segment.discarded}: segments rejected by the energy gate</li>
 *   <li>{@code voicecalc.transcription.failures{kind}}: unintelligible / service failures</li>
 *   <li>{@code voicecalc.transcription.latency{engine}}: time spent in the transcriber</li>
 * </ul>
 *
 * <p>All metrics are available at /actuator/prometheus.
 */
public class VoiceMetrics {

    private static final String METRIC_PREFIX = "voicecalc";

    private final MeterRegistry registry;

    public VoiceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAction(VoiceAction action) {
        Counter.builder(METRIC_PREFIX + ".utterance.actions")
                .description("Result events emitted per action")
                .tag("action", action.wireName())
                .register(registry)
                .increment();
    }

    public void incrementDiscardedSegment() {
        Counter.builder(METRIC_PREFIX + ".segment.discarded")
                .description("Audio segments discarded by the energy gate")
                .register(registry)
                .increment();
    }

    /**
     * @param kind {@code unintelligible} or {@code service}
     */
    public void incrementTranscriptionFailure(String kind) {
        Counter.builder(METRIC_PREFIX + ".transcription.failures")
                .description("Transcriptions that produced no text")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordTranscriptionLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken to transcribe one segment")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
