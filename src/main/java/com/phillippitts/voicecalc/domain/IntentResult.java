package com.phillippitts.voicecalc.domain;

import java.util.Objects;

/**
 * Interpretation of one utterance: the resolved intent, the action to perform and the
 * normalized expression (if any).
 *
 * @param raw                  transcript as received
 * @param intent               resolved intent label (may differ from the classifier's label)
 * @param confidence           resolved intent confidence
 * @param action               action to perform
 * @param expression           normalized expression, or {@code null} when none was recognized
 * @param expressionConfidence normalizer confidence
 */
public record IntentResult(
        String raw,
        IntentLabel intent,
        double confidence,
        VoiceAction action,
        String expression,
        double expressionConfidence
) {

    public IntentResult {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }

    /**
     * Returns a copy with the given action and expression (used when fragments are stitched).
     */
    public IntentResult withAction(VoiceAction newAction, String newExpression) {
        return new IntentResult(raw, intent, confidence, newAction, newExpression, expressionConfidence);
    }
}
