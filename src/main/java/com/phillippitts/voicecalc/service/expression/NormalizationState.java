package com.phillippitts.voicecalc.service.expression;

import com.phillippitts.voicecalc.domain.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable scratch state for a single {@link ExpressionNormalizer#normalize(List)} pass.
 * Never shared between passes.
 */
final class NormalizationState {

    private final List<String> builder = new ArrayList<>();
    private Character pendingOperator;
    private boolean wrapPending;

    private long numberWordValue;
    private int numberWordCount;

    private Token previous;
    private int matched;

    // --- output -------------------------------------------------------------

    void emit(String symbol) {
        builder.add(symbol);
    }

    /**
     * Emits a number and then the operator held back while no operand was available.
     */
    void emitNumber(long value) {
        builder.add(Long.toString(value));
        if (pendingOperator != null) {
            builder.add(String.valueOf(pendingOperator));
            pendingOperator = null;
        }
    }

    /**
     * Appends an operator, buffering it when there is no operand to its left.
     */
    void emitOperator(char symbol) {
        if (builder.isEmpty() || Vocabulary.isOperatorSymbol(builder.get(builder.size() - 1))) {
            pendingOperator = symbol;
            return;
        }
        if (wrapPending) {
            // A prefix that already opens or closes with a bracket keeps that bracket
            if (!"(".equals(builder.get(0))) {
                builder.add(0, "(");
            }
            if (!")".equals(builder.get(builder.size() - 1))) {
                builder.add(")");
            }
            wrapPending = false;
        }
        builder.add(String.valueOf(symbol));
    }

    void requestWrap() {
        wrapPending = true;
    }

    // --- spelled-out numbers ------------------------------------------------

    void accumulateNumberWord(String word) {
        numberWordValue = NumberWords.accumulate(numberWordValue, word);
        numberWordCount++;
    }

    /**
     * Emits the accumulated spelled-out number, if any.
     */
    void flushNumberWords() {
        if (numberWordCount == 0) {
            return;
        }
        matched += numberWordCount;
        emitNumber(numberWordValue);
        numberWordValue = 0;
        numberWordCount = 0;
    }

    // --- bookkeeping --------------------------------------------------------

    void markMatched() {
        matched++;
    }

    int matched() {
        return matched;
    }

    Token previous() {
        return previous;
    }

    void advance(Token token) {
        previous = token;
    }

    String joined() {
        return String.join("", builder);
    }
}
