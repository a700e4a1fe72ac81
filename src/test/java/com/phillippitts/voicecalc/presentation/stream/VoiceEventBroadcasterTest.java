package com.phillippitts.voicecalc.presentation.stream;

import com.phillippitts.voicecalc.config.properties.SessionProperties;
import com.phillippitts.voicecalc.domain.IntentLabel;
import com.phillippitts.voicecalc.domain.IntentResult;
import com.phillippitts.voicecalc.domain.SessionState;
import com.phillippitts.voicecalc.domain.VoiceAction;
import com.phillippitts.voicecalc.service.session.VoiceEvent;
import com.phillippitts.voicecalc.service.session.VoiceEventChannel;
import com.phillippitts.voicecalc.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceEventBroadcasterTest {

    private static final Duration SHORT = Duration.ofMillis(20);

    private VoiceEventChannel channel;
    private VoiceEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        channel = new VoiceEventChannel(16, Duration.ofMillis(50));
        broadcaster = new VoiceEventBroadcaster(channel, SessionProperties.defaults(), new SyncExecutor());
    }

    @Test
    void resultEventIsSentAsJsonDataFrame() {
        RecordingEmitter emitter = new RecordingEmitter();
        broadcaster.register(emitter);
        VoiceEvent.ResultEvent result = VoiceEvent.ResultEvent.of(new IntentResult("five plus two",
                IntentLabel.EXPRESSION, 0.9, VoiceAction.APPEND_EXPRESSION, "5+2", 1.0), 1735725600.0);
        channel.publish(result);

        assertThat(broadcaster.dispatchOnce(SHORT)).isTrue();

        assertThat(emitter.frames).hasSize(1);
        Set<ResponseBodyEmitter.DataWithMediaType> frame = emitter.frames.get(0);
        assertThat(frame).anySatisfy(part -> {
            assertThat(part.getData()).isEqualTo(result);
            assertThat(part.getMediaType()).isEqualTo(MediaType.APPLICATION_JSON);
        });
        assertThat(text(frame)).startsWith("data:").doesNotContain("event:");
    }

    @Test
    void quietChannelProducesPing() {
        RecordingEmitter emitter = new RecordingEmitter();
        broadcaster.register(emitter);

        broadcaster.dispatchOnce(SHORT);

        assertThat(text(emitter.frames.get(0)))
                .contains("event:ping")
                .contains(VoiceEventBroadcaster.PING_DATA);
    }

    @Test
    void everySubscriberReceivesTheSameFrame() {
        RecordingEmitter first = new RecordingEmitter();
        RecordingEmitter second = new RecordingEmitter();
        broadcaster.register(first);
        broadcaster.register(second);
        channel.publish(VoiceEvent.StatusEvent.of("Listening for commands…", VoiceEvent.StatusLevel.INFO,
                SessionState.LISTENING, 1.0));

        broadcaster.dispatchOnce(SHORT);

        assertThat(text(second.frames.get(0))).isEqualTo(text(first.frames.get(0)));
        assertThat(second.frames.get(0)).hasSameSizeAs(first.frames.get(0));
    }

    @Test
    void failingSubscriberIsDropped() {
        RecordingEmitter healthy = new RecordingEmitter();
        RecordingEmitter broken = new RecordingEmitter();
        broken.failSends = true;
        broadcaster.register(healthy);
        broadcaster.register(broken);

        broadcaster.dispatchOnce(SHORT);

        assertThat(broadcaster.subscriberCount()).isEqualTo(1);
        assertThat(healthy.frames).hasSize(1);
    }

    @Test
    void publishedKeepaliveIsSentAsPing() {
        RecordingEmitter emitter = new RecordingEmitter();
        broadcaster.register(emitter);
        channel.publish(new VoiceEvent.Keepalive());

        broadcaster.dispatchOnce(SHORT);

        assertThat(text(emitter.frames.get(0)))
                .contains("event:ping")
                .contains(VoiceEventBroadcaster.PING_DATA)
                .doesNotContain("\"type\"");
    }

    @Test
    void eventsAreDrainedWithoutSubscribers() {
        channel.publish(new VoiceEvent.Keepalive());

        broadcaster.dispatchOnce(SHORT);

        assertThat(channel.size()).isZero();
    }

    @Test
    void interruptedDispatcherStops() {
        Thread.currentThread().interrupt();
        try {
            assertThat(broadcaster.dispatchOnce(SHORT)).isFalse();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shutdownCompletesSubscribers() {
        broadcaster.subscribe();
        broadcaster.subscribe();

        broadcaster.shutdown();

        assertThat(broadcaster.subscriberCount()).isZero();
    }

    private static String text(Set<ResponseBodyEmitter.DataWithMediaType> frame) {
        StringBuilder sb = new StringBuilder();
        for (ResponseBodyEmitter.DataWithMediaType part : frame) {
            if (part.getData() instanceof String s) {
                sb.append(s);
            }
        }
        return sb.toString();
    }

    /**
     * Records built frames instead of writing to a response.
     */
    static final class RecordingEmitter extends SseEmitter {
        final List<Set<ResponseBodyEmitter.DataWithMediaType>> frames = new CopyOnWriteArrayList<>();
        volatile boolean failSends;

        RecordingEmitter() {
            super(0L);
        }

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            if (failSends) {
                throw new IOException("Broken pipe");
            }
            frames.add(builder.build());
        }
    }
}
