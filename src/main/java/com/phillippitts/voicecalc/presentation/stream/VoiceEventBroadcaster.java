package com.phillippitts.voicecalc.presentation.stream;

import com.phillippitts.voicecalc.config.properties.SessionProperties;
import com.phillippitts.voicecalc.service.session.VoiceEvent;
import com.phillippitts.voicecalc.service.session.VoiceEventChannel;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Single consumer of the session event channel that fans events out to SSE subscribers.
 *
 * <p>Result and status events are sent as unnamed {@code data:} frames carrying the JSON
 * payload (the payload's {@code type} field tells them apart). After a quiet
 * keepalive interval a {@code ping} event with an empty JSON object is sent instead.
 *
 * <p>Events are drained even when nobody is subscribed, so the bounded channel never applies
 * backpressure to the capture worker because of an absent UI.
 */
@Component
public class VoiceEventBroadcaster {

    private static final Logger LOG = LogManager.getLogger(VoiceEventBroadcaster.class);

    static final String PING_DATA = "{}";

    private final VoiceEventChannel channel;
    private final Duration keepalive;
    private final Executor executor;
    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public VoiceEventBroadcaster(VoiceEventChannel channel,
                                 SessionProperties props,
                                 @Qualifier("streamExecutor") Executor executor) {
        this.channel = channel;
        this.keepalive = props.keepaliveInterval();
        this.executor = executor;
    }

    @PostConstruct
    void start() {
        if (running.compareAndSet(false, true)) {
            executor.execute(this::dispatchLoop);
        }
    }

    @PreDestroy
    void shutdown() {
        running.set(false);
        for (SseEmitter emitter : emitters) {
            emitter.complete();
        }
        emitters.clear();
    }

    /**
     * Registers a new subscriber. The emitter never times out on its own; it is dropped when a
     * send fails or the client disconnects.
     */
    public SseEmitter subscribe() {
        return register(new SseEmitter(0L));
    }

    // Package-private for tests
    SseEmitter register(SseEmitter emitter) {
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        LOG.debug("Event stream subscriber added (total={})", emitters.size());
        return emitter;
    }

    int subscriberCount() {
        return emitters.size();
    }

    private void dispatchLoop() {
        LOG.info("Event stream dispatcher started (keepalive={} ms)", keepalive.toMillis());
        while (running.get()) {
            if (!dispatchOnce(keepalive)) {
                break;
            }
        }
        LOG.info("Event stream dispatcher stopped");
    }

    /**
     * Waits up to {@code wait} for one event and delivers it, or a keepalive when none arrives.
     *
     * @return {@code false} if the dispatcher thread was interrupted
     */
    boolean dispatchOnce(Duration wait) {
        Optional<VoiceEvent> next = channel.poll(wait);
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        VoiceEvent event = next.orElseGet(VoiceEvent.Keepalive::new);
        broadcast(() -> frameFor(event));
        return true;
    }

    static SseEmitter.SseEventBuilder frameFor(VoiceEvent event) {
        if (event instanceof VoiceEvent.Keepalive keepaliveEvent) {
            return SseEmitter.event().name(keepaliveEvent.type()).data(PING_DATA);
        }
        return SseEmitter.event().data(event, MediaType.APPLICATION_JSON);
    }

    // A builder is consumed by send, so every subscriber gets its own
    private void broadcast(Supplier<SseEmitter.SseEventBuilder> event) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(event.get());
            } catch (IOException | IllegalStateException e) {
                LOG.debug("Dropping event stream subscriber: {}", e.getMessage());
                emitters.remove(emitter);
                emitter.completeWithError(e);
            }
        }
    }
}
