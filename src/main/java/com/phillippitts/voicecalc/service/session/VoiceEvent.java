package com.phillippitts.voicecalc.service.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.phillippitts.voicecalc.domain.IntentResult;
import com.phillippitts.voicecalc.domain.SessionState;

import java.util.Locale;
import java.util.Objects;

/**
 * Outbound event of the voice session feed. Serialized as JSON by the transport layer.
 *
 * <p>Timestamps are epoch seconds with millisecond precision.
 */
public sealed interface VoiceEvent permits VoiceEvent.ResultEvent, VoiceEvent.StatusEvent, VoiceEvent.Keepalive {

    @JsonProperty("type")
    String type();

    /** One interpreted utterance. */
    record ResultEvent(
            String raw,
            String intent,
            double confidence,
            String action,
            String expression,
            @JsonProperty("expression_confidence") double expressionConfidence,
            double timestamp
    ) implements VoiceEvent {

        public static ResultEvent of(IntentResult result, double timestamp) {
            return new ResultEvent(result.raw(), result.intent().wireName(), result.confidence(),
                    result.action().wireName(), result.expression(), result.expressionConfidence(), timestamp);
        }

        @Override
        @JsonProperty("type")
        public String type() {
            return "result";
        }
    }

    /** Lifecycle or diagnostic message. */
    record StatusEvent(String message, StatusLevel level, String state, double timestamp) implements VoiceEvent {

        public StatusEvent {
            Objects.requireNonNull(message, "message must not be null");
            Objects.requireNonNull(level, "level must not be null");
            Objects.requireNonNull(state, "state must not be null");
        }

        public static StatusEvent of(String message, StatusLevel level, SessionState state, double timestamp) {
            return new StatusEvent(message, level, state.wireName(), timestamp);
        }

        @Override
        @JsonProperty("type")
        public String type() {
            return "status";
        }
    }

    /** Sent by consumers after a quiet period; carries no payload. */
    record Keepalive() implements VoiceEvent {
        @Override
        @JsonProperty("type")
        public String type() {
            return "ping";
        }
    }

    enum StatusLevel {
        DEBUG, INFO, WARNING, ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
