package com.phillippitts.voicecalc.service.expression;

import com.phillippitts.voicecalc.domain.NormalizedExpression;
import com.phillippitts.voicecalc.domain.Token;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ExpressionNormalizerTest {

    private final Lexer lexer = new Lexer();
    private final ExpressionNormalizer normalizer = new ExpressionNormalizer();

    private NormalizedExpression normalize(String transcript) {
        return normalizer.normalize(lexer.tokenize(transcript));
    }

    @Test
    void spokenProductIsFullyRecognized() {
        NormalizedExpression result = normalize("seven times five");

        assertThat(result.text()).isEqualTo("7*5");
        assertThat(result.confidence()).isEqualTo(1.0);
    }

    @Test
    void subtractFromIsReordered() {
        NormalizedExpression result = normalize("subtract seven from nineteen");

        assertThat(result.text()).isEqualTo("19-7");
        assertThat(result.confidence()).isEqualTo(1.0);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "open bracket three plus four close bracket times nine | (3+4)*9",
            "forty six plus seven whole multiply four             | (46+7)*4",
            "open bracket three plus four close bracket whole times nine | (3+4)*9",
            "twenty three mod five                                | 23%5",
            "remainder when twenty three is divided by five       | 23%5",
            "add six and eight                                    | 6+8",
            "three point five                                     | 3.5",
            "one hundred twenty three minus 4                     | 123-4",
            "twelve divided by four                               | 12/4",
            "5 + 3                                                | 5+3",
            "five plus three equals                               | 5+3",
            "nine plus                                            | 9",
            "sum of two and three                                 | 2+3",
            "(2 + 3) * 4                                          | (2+3)*4"
    })
    void normalizesSpokenArithmetic(String transcript, String expected) {
        assertThat(normalize(transcript).text()).isEqualTo(expected);
    }

    @Test
    void leadingOperatorWaitsForItsOperand() {
        // "add six" with no left operand: the plus is emitted after six
        assertThat(normalize("add six").text()).isEqualTo("6");
        assertThat(normalize("add six and eight").text()).isEqualTo("6+8");
    }

    @Test
    void unknownWordsLowerConfidence() {
        NormalizedExpression result = normalize("banana seven");

        assertThat(result.text()).isEqualTo("7");
        assertThat(result.confidence()).isEqualTo(0.5);
    }

    @Test
    void fillerOnlyUtteranceHasEmptyTextButFullConfidence() {
        NormalizedExpression result = normalize("the and of");

        assertThat(result.text()).isEmpty();
        assertThat(result.hasExpression()).isFalse();
        assertThat(result.confidence()).isEqualTo(1.0);
    }

    @Test
    void emptyInputIsEmptyResult() {
        assertThat(normalizer.normalize(List.of())).isEqualTo(NormalizedExpression.empty());
        assertThat(normalizer.normalize(null).text()).isEmpty();
        assertThat(normalize("hello there").confidence()).isZero();
    }

    @Test
    void sanitizeCollapsesRunsAndStripsTrailingOperators() {
        assertThat(ExpressionNormalizer.sanitize("5+*3")).isEqualTo("5+3");
        assertThat(ExpressionNormalizer.sanitize("1...5")).isEqualTo("1.5");
        assertThat(ExpressionNormalizer.sanitize("8*/")).isEqualTo("8");
        assertThat(ExpressionNormalizer.sanitize("4=x2")).isEqualTo("42");
    }

    /**
     * Whatever tokens arrive, the output stays inside the calculator alphabet, has no operator
     * runs, no repeated decimal points and no trailing operator.
     */
    @Test
    void outputAlphabetHoldsForRandomTokenSequences() {
        List<Token> pool = tokenPool();
        Random random = new Random(20240517L);

        for (int run = 0; run < 2_000; run++) {
            int length = random.nextInt(12);
            List<Token> tokens = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                tokens.add(pool.get(random.nextInt(pool.size())));
            }

            NormalizedExpression result = normalizer.normalize(tokens);

            assertThat(result.text()).as("tokens %s", tokens)
                    .matches("[0-9+\\-*/%().]*")
                    .doesNotContainPattern("[+\\-*/%]{2}")
                    .doesNotContain("..")
                    .doesNotContainPattern("[+\\-*/%]$");
            assertThat(result.confidence()).isBetween(0.0, 1.0);
        }
    }

    private static List<Token> tokenPool() {
        List<Token> pool = new ArrayList<>();
        for (String word : List.of("one", "seven", "twenty", "hundred", "plus", "minus", "times", "x",
                "divide", "over", "mod", "percent", "open", "close", "bracket", "left", "right",
                "point", "dot", "equals", "whole", "the", "and", "by", "banana", "please", "negative")) {
            pool.add(new Token.WordToken(word));
        }
        for (char op : "+-*/%".toCharArray()) {
            pool.add(new Token.OperatorToken(op));
        }
        pool.add(new Token.NumberToken(0));
        pool.add(new Token.NumberToken(42));
        pool.add(new Token.BracketToken(true));
        pool.add(new Token.BracketToken(false));
        pool.add(new Token.SpecialToken('.'));
        pool.add(new Token.SpecialToken('='));
        return pool;
    }
}
