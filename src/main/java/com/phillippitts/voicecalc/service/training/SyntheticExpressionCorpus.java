package com.phillippitts.voicecalc.service.training;

import com.phillippitts.voicecalc.domain.IntentLabel;
import com.phillippitts.voicecalc.domain.TrainingSample;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.phillippitts.voicecalc.service.expression.NumberWords.toWords;

/**
 * Generates spoken arithmetic phrases labeled {@code expression}.
 *
 * <p>Covers the operator synonyms, the reordering phrasings ("subtract A from B"), modulus and
 * remainder questions, bracket and "whole" groupings, plus digit and symbol forms. The output is
 * deterministic and free of case-insensitive duplicates.
 */
public final class SyntheticExpressionCorpus {

    private static final int[] NUMBERS = {
            3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 14, 15, 16, 18, 19, 20, 22,
            24, 25, 27, 30, 32, 36, 40, 42, 45, 48, 50, 54, 60, 64, 72, 84, 96
    };
    private static final int[] MODULUS_NUMBERS = {19, 23, 36, 53, 64, 75};
    private static final int TRIPLE_COUNT = 10;
    private static final int BRACKET_COUNT = 12;

    private SyntheticExpressionCorpus() {
    }

    public static List<TrainingSample> generate() {
        Map<String, TrainingSample> phrases = new LinkedHashMap<>();

        for (int a : NUMBERS) {
            for (int b : NUMBERS) {
                String wa = toWords(a);
                String wb = toWords(b);
                add(phrases, wa + " plus " + wb);
                add(phrases, "add " + wa + " to " + wb);
                add(phrases, "sum of " + wa + " and " + wb);
                add(phrases, wa + " minus " + wb);
                add(phrases, "subtract " + wb + " from " + wa);
                add(phrases, "take away " + wb + " from " + wa);
                add(phrases, wa + " times " + wb);
                add(phrases, wa + " multiply by " + wb);
                add(phrases, "product of " + wa + " and " + wb);
                add(phrases, wa + " divided by " + wb);
                add(phrases, "divide " + wa + " by " + wb);
                add(phrases, wa + " over " + wb);
                add(phrases, wa + " mod " + wb);
                add(phrases, "modulus of " + wa + " and " + wb);
                add(phrases, a + " + " + b);
                add(phrases, a + " - " + b);
                add(phrases, a + " * " + b);
                add(phrases, a + " / " + b);
            }
        }

        for (int a : MODULUS_NUMBERS) {
            for (int b = 2; b < 12; b++) {
                String wa = toWords(a);
                String wb = toWords(b);
                add(phrases, "remainder when " + wa + " is divided by " + wb);
                add(phrases, "what's the remainder if " + wa + " is divided by " + wb);
                add(phrases, a + " % " + b);
            }
        }

        for (int i = 0; i < TRIPLE_COUNT; i++) {
            for (int j = 0; j < TRIPLE_COUNT; j++) {
                for (int k = 0; k < TRIPLE_COUNT; k++) {
                    int a = NUMBERS[i];
                    int b = NUMBERS[j];
                    int c = NUMBERS[k];
                    String wa = toWords(a);
                    String wb = toWords(b);
                    String wc = toWords(c);
                    add(phrases, wa + " plus " + wb + " minus " + wc);
                    add(phrases, wa + " plus " + wb + " times " + wc);
                    add(phrases, wa + " minus " + wb + " divided by " + wc);
                    add(phrases, "open bracket " + wa + " plus " + wb + " close bracket times " + wc);
                    add(phrases, "open bracket " + wa + " minus " + wb + " close bracket divided by " + wc);
                    add(phrases, a + " + " + b + " - " + c);
                    add(phrases, "(" + a + " + " + b + ") * " + c);
                    add(phrases, "(" + a + " - " + b + ") / " + c);
                    add(phrases, wa + " plus " + wb + " whole divide by " + wc);
                    add(phrases, wa + " plus " + wb + " whole multiply by " + wc);
                }
            }
        }

        for (int i = 0; i < BRACKET_COUNT; i++) {
            for (int j = 0; j < BRACKET_COUNT; j++) {
                for (int k = 0; k < BRACKET_COUNT; k++) {
                    String wa = toWords(NUMBERS[i]);
                    String wb = toWords(NUMBERS[j]);
                    String wc = toWords(NUMBERS[k]);
                    add(phrases, "open parenthesis " + wa + " plus " + wb + " close parenthesis times " + wc);
                    add(phrases, wa + " plus open bracket " + wb + " times " + wc + " close bracket");
                }
            }
        }

        return new ArrayList<>(phrases.values());
    }

    private static void add(Map<String, TrainingSample> phrases, String text) {
        String cleaned = text.strip();
        if (cleaned.isEmpty()) {
            return;
        }
        phrases.putIfAbsent(cleaned.toLowerCase(Locale.ROOT), new TrainingSample(cleaned, IntentLabel.EXPRESSION));
    }
}
