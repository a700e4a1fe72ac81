package com.phillippitts.voicecalc.service.expression;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Conversion between spelled-out numbers and integers.
 *
 * <p>Parsing uses positional combination: ones and tens are added to the running value and
 * {@code hundred} multiplies it (a bare "hundred" counts as one hundred).
 *
 * @since 1.0
 */
public final class NumberWords {

    private static final List<String> SMALL = List.of(
            "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine",
            "ten", "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen",
            "seventeen", "eighteen", "nineteen");

    private static final List<String> TENS = List.of(
            "", "", "twenty", "thirty", "forty", "fifty", "sixty", "seventy", "eighty", "ninety");

    private static final int HUNDRED = 100;

    private static final Map<String, Integer> VALUES = buildValues();

    private NumberWords() {
        // Utility class
    }

    private static Map<String, Integer> buildValues() {
        Map<String, Integer> values = new HashMap<>();
        for (int i = 0; i < SMALL.size(); i++) {
            values.put(SMALL.get(i), i);
        }
        for (int i = 2; i < TENS.size(); i++) {
            values.put(TENS.get(i), i * 10);
        }
        values.put("hundred", HUNDRED);
        return Map.copyOf(values);
    }

    public static boolean isNumberWord(String word) {
        return VALUES.containsKey(word);
    }

    /**
     * Adds one number word to a running value.
     *
     * @param current value accumulated so far
     * @param word    a word for which {@link #isNumberWord(String)} is true
     * @return new accumulated value
     */
    static long accumulate(long current, String word) {
        int value = VALUES.get(word);
        if (value == HUNDRED) {
            long base = current == 0 ? 1 : current;
            // Saturate instead of overflowing on absurd "hundred hundred ..." runs
            return base > Long.MAX_VALUE / HUNDRED ? base : base * HUNDRED;
        }
        return current > Long.MAX_VALUE - value ? current : current + value;
    }

    /**
     * Collapses a sequence of number words into one integer.
     *
     * @return the value, or empty if the sequence is empty or contains a non-number word
     */
    public static OptionalLong parse(List<String> words) {
        if (words == null || words.isEmpty()) {
            return OptionalLong.empty();
        }
        long current = 0;
        for (String word : words) {
            if (!isNumberWord(word)) {
                return OptionalLong.empty();
            }
            current = accumulate(current, word);
        }
        return OptionalLong.of(current);
    }

    /**
     * Spells out an integer. Values of a thousand or more fall back to digits.
     *
     * @param value integer to spell
     * @return words such as {@code "forty six"} or {@code "minus three"}
     */
    public static String toWords(int value) {
        if (value == Integer.MIN_VALUE) {
            return String.valueOf(value);
        }
        if (value < 0) {
            return "minus " + toWords(-value);
        }
        if (value < SMALL.size()) {
            return SMALL.get(value);
        }
        if (value < HUNDRED) {
            String base = TENS.get(value / 10);
            int remainder = value % 10;
            return remainder == 0 ? base : base + " " + SMALL.get(remainder);
        }
        if (value < 1000) {
            String base = SMALL.get(value / HUNDRED) + " hundred";
            int remainder = value % HUNDRED;
            return remainder == 0 ? base : base + " " + toWords(remainder);
        }
        return String.valueOf(value);
    }
}
