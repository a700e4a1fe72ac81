package com.phillippitts.voicecalc.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fluent builder for {@link TranscriptionException} carrying process diagnostics.
 *
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Non-zero exit: 1")
 *         .engine("whisper")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * <p>Resulting message: {@code {message} (exitCode=.., durationMs=.., key=value, ...)}.
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String engineName = "unknown";
    private Throwable cause;
    private final Map<String, String> details = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        if (engineName != null) {
            this.engineName = engineName;
        }
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder exitCode(int exitCode) {
        details.put("exitCode", String.valueOf(exitCode));
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        details.put("durationMs", String.valueOf(durationMs));
        return this;
    }

    /**
     * Adds a key/value pair to the message; null keys or values are skipped.
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            details.put(key, String.valueOf(value));
        }
        return this;
    }

    public TranscriptionException build() {
        String detailed = message;
        if (!details.isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ", " (", ")");
            details.forEach((k, v) -> joiner.add(k + "=" + v));
            detailed = message + joiner;
        }
        return cause != null
                ? new TranscriptionException(detailed, engineName, cause)
                : new TranscriptionException(detailed, engineName);
    }
}
