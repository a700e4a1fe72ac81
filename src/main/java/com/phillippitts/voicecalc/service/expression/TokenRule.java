package com.phillippitts.voicecalc.service.expression;

import com.phillippitts.voicecalc.domain.Token;

/**
 * Ordered classification rules for the normalizer. The declaration order is the evaluation
 * order and the first rule whose {@link #matches(Token)} returns true handles the token.
 *
 * <p>Overlapping vocabulary is resolved by this order: "into" and "is" are fillers, not an
 * operator or an equals sign, and bracket words are tried before the opening and closing
 * words they usually follow.
 */
enum TokenRule {

    FILLER {
        @Override
        boolean matches(Token token) {
            return isWordIn(token, Vocabulary.FILLER_WORDS);
        }

        @Override
        void apply(Token token, NormalizationState state) {
            state.markMatched();
        }
    },

    GROUPING {
        @Override
        boolean matches(Token token) {
            return isWordIn(token, Vocabulary.GROUPING_WORDS);
        }

        @Override
        void apply(Token token, NormalizationState state) {
            state.requestWrap();
            state.markMatched();
        }
    },

    OPERATOR {
        @Override
        boolean matches(Token token) {
            return token instanceof Token.OperatorToken
                    || token instanceof Token.WordToken w && Vocabulary.OPERATOR_WORDS.containsKey(w.word());
        }

        @Override
        void apply(Token token, NormalizationState state) {
            char symbol = token instanceof Token.OperatorToken op
                    ? op.symbol()
                    : Vocabulary.OPERATOR_WORDS.get(token.text());
            state.emitOperator(symbol);
            state.markMatched();
        }
    },

    BRACKET_SYMBOL {
        @Override
        boolean matches(Token token) {
            return token instanceof Token.BracketToken;
        }

        @Override
        void apply(Token token, NormalizationState state) {
            state.emit(token.text());
            state.markMatched();
        }
    },

    BRACKET_WORD {
        @Override
        boolean matches(Token token) {
            return isWordIn(token, Vocabulary.BRACKET_WORDS);
        }

        @Override
        void apply(Token token, NormalizationState state) {
            Token previous = state.previous();
            boolean afterOpening = isWordIn(previous, Vocabulary.OPENING_WORDS);
            boolean afterClosing = isWordIn(previous, Vocabulary.CLOSING_WORDS);
            // "open bracket" / "close bracket": the first word already emitted the bracket
            if (!afterOpening && !afterClosing) {
                state.emit("(");
            }
            state.markMatched();
        }
    },

    SPECIAL {
        @Override
        boolean matches(Token token) {
            return token instanceof Token.SpecialToken
                    || isWordIn(token, Vocabulary.DECIMAL_WORDS)
                    || isWordIn(token, Vocabulary.EQUALS_WORDS)
                    || isWordIn(token, Vocabulary.OPENING_WORDS)
                    || isWordIn(token, Vocabulary.CLOSING_WORDS);
        }

        @Override
        void apply(Token token, NormalizationState state) {
            state.emit(specialSymbol(token));
            state.markMatched();
        }

        private String specialSymbol(Token token) {
            if (token instanceof Token.SpecialToken) {
                return token.text();
            }
            String word = token.text();
            if (Vocabulary.DECIMAL_WORDS.contains(word)) {
                return ".";
            }
            if (Vocabulary.EQUALS_WORDS.contains(word)) {
                return "=";
            }
            return Vocabulary.OPENING_WORDS.contains(word) ? "(" : ")";
        }
    },

    DIGITS {
        @Override
        boolean matches(Token token) {
            return token instanceof Token.NumberToken;
        }

        @Override
        void apply(Token token, NormalizationState state) {
            state.emitNumber(((Token.NumberToken) token).value());
            state.markMatched();
        }
    },

    NUMBER_WORD {
        @Override
        boolean matches(Token token) {
            return token instanceof Token.WordToken w && NumberWords.isNumberWord(w.word());
        }

        @Override
        void apply(Token token, NormalizationState state) {
            // Counted as matched when the accumulated number is flushed
            state.accumulateNumberWord(token.text());
        }
    },

    UNMATCHED {
        @Override
        boolean matches(Token token) {
            return true;
        }

        @Override
        void apply(Token token, NormalizationState state) {
            // Unknown words contribute nothing and are not counted
        }
    };

    abstract boolean matches(Token token);

    abstract void apply(Token token, NormalizationState state);

    /**
     * Returns the first rule that accepts the token. Never null: {@link #UNMATCHED} accepts all.
     */
    static TokenRule classify(Token token) {
        for (TokenRule rule : values()) {
            if (rule.matches(token)) {
                return rule;
            }
        }
        return UNMATCHED;
    }

    private static boolean isWordIn(Token token, java.util.Set<String> words) {
        return token instanceof Token.WordToken w && words.contains(w.word());
    }
}
