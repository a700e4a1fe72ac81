package com.phillippitts.voicecalc.service.intent;

import com.phillippitts.voicecalc.domain.ClassifierOutput;
import com.phillippitts.voicecalc.domain.IntentResult;
import com.phillippitts.voicecalc.domain.NormalizedExpression;
import com.phillippitts.voicecalc.service.expression.ExpressionNormalizer;
import com.phillippitts.voicecalc.service.expression.Lexer;
import com.phillippitts.voicecalc.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Turns one transcript into one {@link IntentResult}: lexer, normalizer, classifier, resolver.
 *
 * <p>Used by the capture loop for every utterance and by the synchronous interpret endpoint.
 * Holds no per-call state.
 */
public class IntentInterpreter {

    private static final Logger LOG = LogManager.getLogger(IntentInterpreter.class);

    private final Lexer lexer;
    private final ExpressionNormalizer normalizer;
    private final IntentClassifier classifier;
    private final IntentResolver resolver;

    public IntentInterpreter(Lexer lexer,
                             ExpressionNormalizer normalizer,
                             IntentClassifier classifier,
                             IntentResolver resolver) {
        this.lexer = Objects.requireNonNull(lexer, "lexer must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    public IntentResult interpret(String transcript) {
        String text = transcript == null ? "" : transcript.strip();
        ClassifierOutput classified = classifier.classify(text);
        NormalizedExpression normalized = normalizer.normalize(lexer.tokenize(text));
        IntentResult result = resolver.resolve(text, classified, normalized);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Interpreted '{}' as {} (label={}, confidence={}, expression={})",
                    LogSanitizer.truncate(text), result.action().wireName(), result.intent().wireName(),
                    String.format("%.2f", result.confidence()), result.expression());
        }
        return result;
    }
}
