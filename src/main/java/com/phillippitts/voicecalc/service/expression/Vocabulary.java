package com.phillippitts.voicecalc.service.expression;

import java.util.Map;
import java.util.Set;

/**
 * Closed vocabulary of spoken arithmetic recognized by the normalizer.
 */
final class Vocabulary {

    /** Connectives consumed silently (still counted as recognized). */
    static final Set<String> FILLER_WORDS = Set.of(
            "by", "of", "the", "a", "an", "and", "then", "from", "to", "with",
            "is", "are", "was", "were", "be", "being", "been", "into", "per");

    /** Words that wrap everything said so far in parentheses before the next operator. */
    static final Set<String> GROUPING_WORDS = Set.of("whole", "entire", "all");

    static final Map<String, Character> OPERATOR_WORDS = Map.ofEntries(
            Map.entry("plus", '+'),
            Map.entry("add", '+'),
            Map.entry("sum", '+'),
            Map.entry("minus", '-'),
            Map.entry("subtract", '-'),
            Map.entry("negative", '-'),
            Map.entry("times", '*'),
            Map.entry("x", '*'),
            Map.entry("multiply", '*'),
            Map.entry("multiplied", '*'),
            Map.entry("divide", '/'),
            Map.entry("divided", '/'),
            Map.entry("over", '/'),
            Map.entry("slash", '/'),
            Map.entry("percent", '%'),
            Map.entry("mod", '%'),
            Map.entry("modulo", '%'),
            Map.entry("modulus", '%'),
            Map.entry("remainder", '%'));

    static final Set<String> BRACKET_WORDS = Set.of("bracket", "parenthesis", "parentheses");

    static final Set<String> OPENING_WORDS = Set.of("open", "opening", "left");

    static final Set<String> CLOSING_WORDS = Set.of("close", "closing", "right");

    static final Set<String> DECIMAL_WORDS = Set.of("point", "dot", "decimal", "comma");

    static final Set<String> EQUALS_WORDS = Set.of("equals", "equal");

    /** Symbols that may end up in the normalized text. */
    static final String OPERATOR_SYMBOLS = "+-*/%";

    private Vocabulary() {
        // Utility class
    }

    static boolean isOperatorSymbol(String symbol) {
        return symbol.length() == 1 && OPERATOR_SYMBOLS.indexOf(symbol.charAt(0)) >= 0;
    }
}
