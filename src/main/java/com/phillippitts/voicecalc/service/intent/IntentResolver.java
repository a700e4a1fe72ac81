package com.phillippitts.voicecalc.service.intent;

import com.phillippitts.voicecalc.domain.ClassifierOutput;
import com.phillippitts.voicecalc.domain.IntentLabel;
import com.phillippitts.voicecalc.domain.IntentResult;
import com.phillippitts.voicecalc.domain.NormalizedExpression;
import com.phillippitts.voicecalc.domain.VoiceAction;

import java.util.List;
import java.util.Locale;

/**
 * Combines classifier output, normalizer output and keyword overrides into exactly one action.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>transcript contains {@code equals}, {@code equal}, {@code result} or {@code calculate}:
 *       label becomes {@code calculate}, confidence raised to at least {@value #TRIGGER_CONFIDENCE_FLOOR}</li>
 *   <li>calculate, clear, backspace and stop map to the action of the same name</li>
 *   <li>expression appends only when the normalized text is non-empty, otherwise noop</li>
 *   <li>noop with a non-empty normalized text is promoted to expression / append</li>
 *   <li>anything else is noop</li>
 * </ol>
 *
 * <p>No other component derives an action. Stateless and thread-safe.
 */
public final class IntentResolver {

    static final double TRIGGER_CONFIDENCE_FLOOR = 0.6;

    private static final List<String> CALCULATE_TRIGGERS = List.of("equals", "equal", "result", "calculate");

    public IntentResult resolve(String transcript, ClassifierOutput classified, NormalizedExpression normalized) {
        String raw = transcript == null ? "" : transcript;
        IntentLabel label = classified.label();
        double confidence = classified.confidence();

        if (containsCalculateTrigger(raw)) {
            label = IntentLabel.CALCULATE;
            confidence = Math.max(confidence, TRIGGER_CONFIDENCE_FLOOR);
        }

        VoiceAction action;
        switch (label) {
            case CALCULATE -> action = VoiceAction.CALCULATE;
            case CLEAR -> action = VoiceAction.CLEAR;
            case BACKSPACE -> action = VoiceAction.BACKSPACE;
            case STOP -> action = VoiceAction.STOP;
            case EXPRESSION -> action = normalized.hasExpression() ? VoiceAction.APPEND_EXPRESSION : VoiceAction.NOOP;
            case NOOP -> {
                if (normalized.hasExpression()) {
                    label = IntentLabel.EXPRESSION;
                    action = VoiceAction.APPEND_EXPRESSION;
                } else {
                    action = VoiceAction.NOOP;
                }
            }
            default -> action = VoiceAction.NOOP;
        }

        return new IntentResult(raw, label, confidence, action, normalized.textOrNull(), normalized.confidence());
    }

    private static boolean containsCalculateTrigger(String transcript) {
        String lowered = transcript.toLowerCase(Locale.ROOT);
        for (String trigger : CALCULATE_TRIGGERS) {
            if (lowered.contains(trigger)) {
                return true;
            }
        }
        return false;
    }
}
