package com.phillippitts.voicecalc.service.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO hand-off from the capture worker to event consumers.
 *
 * <p>Producers block up to the offer timeout when the channel is full and the event is dropped
 * (and counted) only after that. Consumers poll with a timeout so they can send keepalives while
 * nothing happens. Events are delivered in publish order.
 */
public class VoiceEventChannel {

    private static final Logger LOG = LogManager.getLogger(VoiceEventChannel.class);

    private final BlockingQueue<VoiceEvent> queue;
    private final Duration offerTimeout;
    private final AtomicLong dropped = new AtomicLong();

    public VoiceEventChannel(int capacity, Duration offerTimeout) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.offerTimeout = Objects.requireNonNull(offerTimeout, "offerTimeout");
    }

    /**
     * Publishes an event, waiting for space up to the offer timeout.
     *
     * @return {@code true} if enqueued, {@code false} if dropped
     */
    public boolean publish(VoiceEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            if (queue.offer(event, offerTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            long total = dropped.incrementAndGet();
            LOG.warn("Event channel full for {} ms; dropped {} event (total dropped={})",
                    offerTimeout.toMillis(), event.type(), total);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dropped.incrementAndGet();
            LOG.debug("Interrupted while publishing {} event", event.type());
            return false;
        }
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or empty on timeout or interruption
     */
    public Optional<VoiceEvent> poll(Duration timeout) {
        try {
            return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    public int size() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
