package com.phillippitts.voicecalc.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Timing and buffering settings of the voice session. Binds to {@code voice.session}.
 *
 * <p>All durations are in milliseconds.
 *
 * @param gapTimeoutMs         fragments further apart than this start a new expression burst
 * @param acquireTimeoutMs     bounded wait for one audio segment; cancellation is rechecked after it
 * @param maxSegmentMs         longest segment the audio source may return
 * @param stopTimeoutMs        how long {@code stop()} waits for the capture worker to exit
 * @param eventQueueCapacity   bound of the outbound event channel
 * @param eventOfferTimeoutMs  how long the worker blocks on a full event channel before dropping
 * @param keepaliveIntervalMs  idle time after which event consumers send a keepalive
 */
@ConfigurationProperties(prefix = "voice.session")
@Validated
public record SessionProperties(
        @Positive @DefaultValue("1500") long gapTimeoutMs,
        @Positive @DefaultValue("3000") long acquireTimeoutMs,
        @Positive @DefaultValue("7000") long maxSegmentMs,
        @Positive @DefaultValue("3000") long stopTimeoutMs,
        @Min(value = 1, message = "Event queue capacity must be at least 1")
        @DefaultValue("256") int eventQueueCapacity,
        @Positive @DefaultValue("2000") long eventOfferTimeoutMs,
        @Positive @DefaultValue("20000") long keepaliveIntervalMs
) {

    /**
     * Values used when nothing is configured.
     */
    public static SessionProperties defaults() {
        return new SessionProperties(1500, 3000, 7000, 3000, 256, 2000, 20000);
    }

    public Duration gapTimeout() {
        return Duration.ofMillis(gapTimeoutMs);
    }

    public Duration acquireTimeout() {
        return Duration.ofMillis(acquireTimeoutMs);
    }

    public Duration maxSegment() {
        return Duration.ofMillis(maxSegmentMs);
    }

    public Duration stopTimeout() {
        return Duration.ofMillis(stopTimeoutMs);
    }

    public Duration eventOfferTimeout() {
        return Duration.ofMillis(eventOfferTimeoutMs);
    }

    public Duration keepaliveInterval() {
        return Duration.ofMillis(keepaliveIntervalMs);
    }
}
