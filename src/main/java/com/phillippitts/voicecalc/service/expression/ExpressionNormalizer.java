package com.phillippitts.voicecalc.service.expression;

import com.phillippitts.voicecalc.domain.NormalizedExpression;
import com.phillippitts.voicecalc.domain.Token;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts a token sequence of spoken math into a calculator-friendly expression string.
 *
 * <p>Single deterministic pass over the tokens. Each token is handled by the first matching
 * {@link TokenRule}; consecutive number words are accumulated and flushed as one number when
 * any other kind of token arrives or the input ends.
 *
 * <p>Examples:
 * <pre>
 * seven times five                                   → 7*5
 * forty six plus seven whole multiply four           → (46+7)*4
 * open bracket three plus four close bracket times nine → (3+4)*9
 * add six and eight                                  → 6+8
 * </pre>
 *
 * <p>The result is sanitized: characters outside {@code 0-9 + - * / % ( ) .} are removed,
 * runs of operators and of decimal points are collapsed, and trailing operators are dropped.
 * The output is not guaranteed to be a well-formed expression.
 *
 * <p>Confidence is the share of tokens recognized by any rule (fillers included), capped at 1.
 * This method never throws; worst case it returns an empty text.
 *
 * <p>Thread-safe: holds no state between calls.
 *
 * @since 1.0
 */
public final class ExpressionNormalizer {

    private static final Logger LOG = LogManager.getLogger(ExpressionNormalizer.class);

    private static final Pattern DISALLOWED = Pattern.compile("[^0-9+\\-*/%().]");
    private static final Pattern OPERATOR_RUN = Pattern.compile("([+\\-*/%])[+\\-*/%]+");
    private static final Pattern DECIMAL_RUN = Pattern.compile("\\.{2,}");
    private static final Pattern TRAILING_OPERATORS = Pattern.compile("[+\\-*/%]+$");

    /**
     * Normalizes a token sequence.
     *
     * @param tokens tokens in transcript order (null or empty yields an empty result)
     * @return expression text and confidence
     */
    public NormalizedExpression normalize(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return NormalizedExpression.empty();
        }
        NormalizationState state = new NormalizationState();
        for (Token token : tokens) {
            TokenRule rule = TokenRule.classify(token);
            if (rule != TokenRule.NUMBER_WORD) {
                state.flushNumberWords();
            }
            rule.apply(token, state);
            state.advance(token);
        }
        state.flushNumberWords();

        String text = sanitize(state.joined());
        double confidence = Math.min(1.0, (double) state.matched() / tokens.size());
        LOG.debug("Normalized {} tokens into {} chars (confidence={})", tokens.size(), text.length(), confidence);
        return new NormalizedExpression(text, confidence);
    }

    /**
     * Applies the character-level clean-up to a raw expression.
     */
    static String sanitize(String raw) {
        String expression = DISALLOWED.matcher(raw).replaceAll("");
        expression = OPERATOR_RUN.matcher(expression).replaceAll("$1");
        expression = DECIMAL_RUN.matcher(expression).replaceAll(".");
        return TRAILING_OPERATORS.matcher(expression).replaceAll("");
    }
}
