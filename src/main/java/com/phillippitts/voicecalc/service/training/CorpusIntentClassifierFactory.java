package com.phillippitts.voicecalc.service.training;

import com.phillippitts.voicecalc.domain.TrainingSample;
import com.phillippitts.voicecalc.exception.TrainingCorpusException;
import com.phillippitts.voicecalc.service.intent.IntentClassifier;
import com.phillippitts.voicecalc.service.intent.IntentClassifierFactory;
import com.phillippitts.voicecalc.service.intent.TfidfIntentClassifier;
import com.phillippitts.voicecalc.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Trains a {@link TfidfIntentClassifier} from the stored corpus, optionally merged with the
 * synthetic expression phrases.
 *
 * <p>Merging is by case-insensitive, trimmed text; the first occurrence wins, so stored samples
 * take precedence over generated ones. Blank texts are skipped.
 */
public class CorpusIntentClassifierFactory implements IntentClassifierFactory {

    private static final Logger LOG = LogManager.getLogger(CorpusIntentClassifierFactory.class);

    private final TrainingCorpusRepository repository;
    private final boolean includeSynthetic;

    public CorpusIntentClassifierFactory(TrainingCorpusRepository repository, boolean includeSynthetic) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.includeSynthetic = includeSynthetic;
    }

    @Override
    public IntentClassifier create() {
        long start = System.nanoTime();
        List<TrainingSample> merged = merge(repository.list(),
                includeSynthetic ? SyntheticExpressionCorpus.generate() : List.of());
        if (merged.isEmpty()) {
            throw new TrainingCorpusException("Cannot train intent classifier without samples");
        }
        TfidfIntentClassifier classifier = TfidfIntentClassifier.train(merged);
        LOG.info("Trained intent classifier on {} samples in {} ms", merged.size(), TimeUtils.elapsedMillis(start));
        return classifier;
    }

    static List<TrainingSample> merge(List<TrainingSample> stored, List<TrainingSample> synthetic) {
        Map<String, TrainingSample> byText = new LinkedHashMap<>();
        List<TrainingSample> all = new ArrayList<>(stored.size() + synthetic.size());
        all.addAll(stored);
        all.addAll(synthetic);
        for (TrainingSample sample : all) {
            String text = sample.text().strip();
            if (text.isEmpty()) {
                continue;
            }
            byText.putIfAbsent(text.toLowerCase(Locale.ROOT), new TrainingSample(text, sample.label()));
        }
        return new ArrayList<>(byText.values());
    }
}
