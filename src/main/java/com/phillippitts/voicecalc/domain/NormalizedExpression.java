package com.phillippitts.voicecalc.domain;

import java.util.Objects;

/**
 * Output of the expression normalizer.
 *
 * <p>{@code text} only contains characters from {@code 0-9 + - * / % ( ) .} and may be empty,
 * meaning "no usable expression". Confidence is still meaningful for an empty text (for example
 * an utterance made only of filler words).
 *
 * @param text       sanitized expression, never null
 * @param confidence share of tokens the normalizer recognized, in [0, 1]
 */
public record NormalizedExpression(String text, double confidence) {

    private static final NormalizedExpression EMPTY = new NormalizedExpression("", 0.0);

    public NormalizedExpression {
        Objects.requireNonNull(text, "text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static NormalizedExpression empty() {
        return EMPTY;
    }

    public boolean hasExpression() {
        return !text.isEmpty();
    }

    /**
     * Returns the expression text, or {@code null} when it is empty.
     */
    public String textOrNull() {
        return text.isEmpty() ? null : text;
    }
}
