package com.phillippitts.voicecalc.service.expression;

import com.phillippitts.voicecalc.domain.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-form transcript into typed {@link Token}s.
 *
 * <p>Processing happens in two steps:
 * <ol>
 *   <li>Phrase rewriting: an ordered table of multi-word rewrites is applied to the lower-cased
 *       transcript. Rewrites that change word order ("subtract A from B" → "B minus A") run
 *       before operator-synonym rewrites ("divided by" → "divide") so that the latter cannot
 *       break the patterns of the former.</li>
 *   <li>Splitting: maximal runs of letters become words, runs of digits become numbers, and
 *       each of {@code + - * / ( ) = %} becomes an operator, bracket or special token.
 *       Everything else is dropped.</li>
 * </ol>
 *
 * <p>Pure and deterministic; never throws for non-null input.
 *
 * @since 1.0
 */
public final class Lexer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN = Pattern.compile("[a-z]+|\\d+|[+\\-*/()=%]");

    private static final String OPERAND = "([a-z0-9 ]+?)";
    private static final String TAIL = "([a-z0-9 ]+)";

    /** Word-order rewrites; applied first. */
    private static final List<Rewrite> REORDER_REWRITES = List.of(
            Rewrite.pattern("remainder when " + OPERAND + " is divided by " + TAIL, "$1 mod $2"),
            Rewrite.pattern("what's the remainder if " + OPERAND + " is divided by " + TAIL, "$1 mod $2"),
            Rewrite.pattern("subtract " + OPERAND + " from " + TAIL, "$2 minus $1"),
            Rewrite.pattern("take away " + OPERAND + " from " + TAIL, "$2 minus $1"),
            Rewrite.pattern("add " + OPERAND + " to " + TAIL, "$2 plus $1"),
            Rewrite.pattern("sum of " + OPERAND + " and " + TAIL, "$1 plus $2"),
            Rewrite.pattern("difference between " + OPERAND + " and " + TAIL, "$1 minus $2")
    );

    /** Operator-synonym rewrites; applied after the reorder rewrites, in this order. */
    private static final List<Rewrite> SYNONYM_REWRITES = List.of(
            Rewrite.literal("whole multiplied by", "whole multiply"),
            Rewrite.literal("whole multiply by", "whole multiply"),
            Rewrite.literal("whole divided by", "whole divide"),
            Rewrite.literal("divided by", "divide"),
            Rewrite.literal("multiplied by", "multiply"),
            Rewrite.literal("times by", "multiply"),
            Rewrite.literal("multiply by", "multiply"),
            Rewrite.literal("multiply with", "multiply"),
            Rewrite.literal("multiplied with", "multiply"),
            Rewrite.literal("divide by", "divide"),
            Rewrite.literal("divided into", "divide"),
            Rewrite.literal("to the power of", "power"),
            Rewrite.literal("raised to", "power"),
            Rewrite.literal("left bracket", "open bracket"),
            Rewrite.literal("left parenthesis", "open parenthesis"),
            Rewrite.literal("right bracket", "close bracket"),
            Rewrite.literal("right parenthesis", "close parenthesis")
    );

    /**
     * Applies the phrase rewrite table to a transcript.
     *
     * @param transcript raw transcript (may be null)
     * @return lower-cased, whitespace-collapsed and rewritten text
     */
    public String rewrite(String transcript) {
        if (transcript == null) {
            return "";
        }
        String cleaned = WHITESPACE.matcher(transcript.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
        for (Rewrite rewrite : REORDER_REWRITES) {
            cleaned = rewrite.apply(cleaned);
        }
        for (Rewrite rewrite : SYNONYM_REWRITES) {
            cleaned = rewrite.apply(cleaned);
        }
        return cleaned;
    }

    /**
     * Tokenizes a transcript.
     *
     * @param transcript raw transcript (may be null or blank)
     * @return tokens in transcript order; empty when nothing usable was found
     */
    public List<Token> tokenize(String transcript) {
        String cleaned = rewrite(transcript);
        List<Token> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(cleaned);
        while (m.find()) {
            tokens.add(toToken(m.group()));
        }
        return tokens;
    }

    private static Token toToken(String lexeme) {
        char first = lexeme.charAt(0);
        if (Character.isDigit(first)) {
            try {
                return new Token.NumberToken(Long.parseLong(lexeme));
            } catch (NumberFormatException overflow) {
                // Too many digits for a long; keep it as an unmatched word
                return new Token.WordToken(lexeme);
            }
        }
        if (Character.isLetter(first)) {
            return new Token.WordToken(lexeme);
        }
        return switch (first) {
            case '(' -> new Token.BracketToken(true);
            case ')' -> new Token.BracketToken(false);
            case '=' -> new Token.SpecialToken('=');
            default -> new Token.OperatorToken(first);
        };
    }

    /**
     * One entry of the rewrite table.
     */
    private record Rewrite(Pattern pattern, String replacement) {

        static Rewrite pattern(String regex, String replacement) {
            return new Rewrite(Pattern.compile(regex), replacement);
        }

        static Rewrite literal(String phrase, String replacement) {
            return new Rewrite(Pattern.compile(Pattern.quote(phrase)), Matcher.quoteReplacement(replacement));
        }

        String apply(String input) {
            return pattern.matcher(input).replaceAll(replacement);
        }
    }
}
