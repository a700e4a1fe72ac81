package com.phillippitts.voicecalc.domain;

import java.util.Objects;

/**
 * Lexical token produced from a transcript, in transcript order.
 *
 * <p>Tokens are immutable values. The variant set is closed: numbers, operator symbols,
 * brackets, the two special symbols {@code .} and {@code =}, and plain words.
 *
 * @since 1.0
 */
public sealed interface Token
        permits Token.NumberToken, Token.OperatorToken, Token.BracketToken,
                Token.SpecialToken, Token.WordToken {

    /**
     * Returns the token as it would appear in an expression (or the word itself).
     */
    String text();

    /** Run of digits. */
    record NumberToken(long value) implements Token {
        public NumberToken {
            if (value < 0) {
                throw new IllegalArgumentException("Number token must be non-negative, got: " + value);
            }
        }

        @Override
        public String text() {
            return Long.toString(value);
        }
    }

    /** One of {@code + - * / %}. */
    record OperatorToken(char symbol) implements Token {
        public OperatorToken {
            if ("+-*/%".indexOf(symbol) < 0) {
                throw new IllegalArgumentException("Unsupported operator symbol: " + symbol);
            }
        }

        @Override
        public String text() {
            return String.valueOf(symbol);
        }
    }

    /** Opening or closing round bracket. */
    record BracketToken(boolean open) implements Token {
        @Override
        public String text() {
            return open ? "(" : ")";
        }
    }

    /** Decimal point or equals sign. */
    record SpecialToken(char symbol) implements Token {
        public SpecialToken {
            if (symbol != '.' && symbol != '=') {
                throw new IllegalArgumentException("Unsupported special symbol: " + symbol);
            }
        }

        @Override
        public String text() {
            return String.valueOf(symbol);
        }
    }

    /** Run of letters, already lower-cased. */
    record WordToken(String word) implements Token {
        public WordToken {
            Objects.requireNonNull(word, "word must not be null");
        }

        @Override
        public String text() {
            return word;
        }
    }
}
