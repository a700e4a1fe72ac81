package com.phillippitts.voicecalc.service.intent;

import com.phillippitts.voicecalc.domain.ClassifierOutput;
import com.phillippitts.voicecalc.domain.IntentLabel;
import com.phillippitts.voicecalc.domain.TrainingSample;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Nearest-centroid intent classifier over TF-IDF vectors of unigrams and bigrams.
 *
 * <p>Training computes smoothed inverse document frequencies
 * ({@code idf = ln((1 + n) / (1 + df)) + 1}), L2-normalized sample vectors and one
 * L2-normalized centroid per label. Classification picks the centroid with the highest cosine
 * similarity; the confidence is a softmax over the similarities, so it behaves like a
 * probability. Input sharing no feature with the training data classifies as
 * {@link IntentLabel#NOOP} with zero confidence.
 *
 * <p>Immutable after construction and therefore thread-safe. Ties resolve to the label declared
 * first in {@link IntentLabel}.
 */
public final class TfidfIntentClassifier implements IntentClassifier {

    private static final Pattern TERM = Pattern.compile("[a-z']+|\\d+|[+\\-*/()=%]");

    /** Sharpens the softmax so that a clearly closest centroid reads as high confidence. */
    private static final double SOFTMAX_SCALE = 10.0;

    private final Map<String, Double> idf;
    private final Map<IntentLabel, Map<String, Double>> centroids;

    private TfidfIntentClassifier(Map<String, Double> idf, Map<IntentLabel, Map<String, Double>> centroids) {
        this.idf = idf;
        this.centroids = centroids;
    }

    /**
     * Trains a classifier.
     *
     * @param samples labeled samples; texts without any term are ignored
     * @return trained classifier
     * @throws IllegalArgumentException if no usable sample remains
     */
    public static TfidfIntentClassifier train(Collection<TrainingSample> samples) {
        List<Map<String, Integer>> termCounts = new ArrayList<>();
        List<IntentLabel> labels = new ArrayList<>();
        Map<String, Integer> documentFrequency = new HashMap<>();

        for (TrainingSample sample : samples) {
            Map<String, Integer> counts = countFeatures(sample.text());
            if (counts.isEmpty()) {
                continue;
            }
            termCounts.add(counts);
            labels.add(sample.label());
            counts.keySet().forEach(term -> documentFrequency.merge(term, 1, Integer::sum));
        }
        if (termCounts.isEmpty()) {
            throw new IllegalArgumentException("Cannot train intent classifier without samples");
        }

        int n = termCounts.size();
        Map<String, Double> idf = new HashMap<>(documentFrequency.size() * 2);
        documentFrequency.forEach((term, df) -> idf.put(term, Math.log((1.0 + n) / (1.0 + df)) + 1.0));

        Map<IntentLabel, Map<String, Double>> sums = new EnumMap<>(IntentLabel.class);
        for (int i = 0; i < n; i++) {
            Map<String, Double> vector = weigh(termCounts.get(i), idf);
            Map<String, Double> sum = sums.computeIfAbsent(labels.get(i), l -> new HashMap<>());
            vector.forEach((term, weight) -> sum.merge(term, weight, Double::sum));
        }
        Map<IntentLabel, Map<String, Double>> centroids = new EnumMap<>(IntentLabel.class);
        sums.forEach((label, sum) -> centroids.put(label, Map.copyOf(normalize(sum))));
        return new TfidfIntentClassifier(Map.copyOf(idf), centroids);
    }

    @Override
    public ClassifierOutput classify(String text) {
        if (text == null || text.isBlank()) {
            return ClassifierOutput.noop();
        }
        Map<String, Double> query = weigh(countFeatures(text), idf);
        if (query.isEmpty()) {
            return ClassifierOutput.noop();
        }

        Map<IntentLabel, Double> similarities = new EnumMap<>(IntentLabel.class);
        IntentLabel best = null;
        double bestSimilarity = -1.0;
        for (Map.Entry<IntentLabel, Map<String, Double>> entry : centroids.entrySet()) {
            double similarity = dot(query, entry.getValue());
            similarities.put(entry.getKey(), similarity);
            if (similarity > bestSimilarity) {
                best = entry.getKey();
                bestSimilarity = similarity;
            }
        }
        if (best == null || bestSimilarity <= 0.0) {
            return ClassifierOutput.noop();
        }

        double denominator = 0.0;
        for (double similarity : similarities.values()) {
            denominator += Math.exp(SOFTMAX_SCALE * (similarity - bestSimilarity));
        }
        double confidence = Math.min(1.0, Math.max(0.0, 1.0 / denominator));
        return new ClassifierOutput(best, confidence);
    }

    /**
     * Labels this classifier can predict.
     */
    public Collection<IntentLabel> labels() {
        return centroids.keySet();
    }

    // --- feature extraction -------------------------------------------------

    static List<String> terms(String text) {
        List<String> terms = new ArrayList<>();
        if (text == null) {
            return terms;
        }
        Matcher matcher = TERM.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            terms.add(matcher.group());
        }
        return terms;
    }

    private static Map<String, Integer> countFeatures(String text) {
        List<String> terms = terms(text);
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < terms.size(); i++) {
            counts.merge(terms.get(i), 1, Integer::sum);
            if (i > 0) {
                counts.merge(terms.get(i - 1) + ' ' + terms.get(i), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static Map<String, Double> weigh(Map<String, Integer> counts, Map<String, Double> idf) {
        Map<String, Double> vector = new HashMap<>();
        counts.forEach((term, count) -> {
            Double weight = idf.get(term);
            if (weight != null) {
                vector.put(term, count * weight);
            }
        });
        return normalize(vector);
    }

    private static Map<String, Double> normalize(Map<String, Double> vector) {
        double norm = 0.0;
        for (double value : vector.values()) {
            norm += value * value;
        }
        if (norm == 0.0) {
            return vector;
        }
        double length = Math.sqrt(norm);
        vector.replaceAll((term, value) -> value / length);
        return vector;
    }

    private static double dot(Map<String, Double> sparse, Map<String, Double> dense) {
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : sparse.entrySet()) {
            Double other = dense.get(entry.getKey());
            if (other != null) {
                sum += entry.getValue() * other;
            }
        }
        return sum;
    }
}
