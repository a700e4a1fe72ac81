package com.phillippitts.voicecalc.service.stt.whisper;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans whisper.cpp text output into a transcript.
 *
 * <p>Timestamp prefixes ({@code [00:00:00.000 --> 00:00:02.000]}) are removed, lines are joined
 * with single spaces, and non-speech annotations such as {@code [BLANK_AUDIO]},
 * {@code (inaudible)}, {@code [Music]} or {@code *coughs*} are stripped. An empty result means
 * whisper heard nothing usable.
 */
final class WhisperOutputParser {

    private static final Pattern TIMESTAMP = Pattern.compile(
            "\\[\\d{2}:\\d{2}:\\d{2}[.,]\\d{3}\\s*-->\\s*\\d{2}:\\d{2}:\\d{2}[.,]\\d{3}]");
    private static final Pattern BRACKETED = Pattern.compile("\\[[^\\]]*]");
    private static final Pattern PARENTHESIZED = Pattern.compile("\\([^)]*\\)");
    private static final Pattern STARRED = Pattern.compile("\\*[^*]*\\*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Parenthesized words that whisper emits for non-speech audio. */
    private static final Set<String> NON_SPEECH = Set.of(
            "inaudible", "silence", "music", "noise", "applause", "laughter", "static", "blank audio");

    private WhisperOutputParser() {}

    static String extractText(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return "";
        }
        String text = TIMESTAMP.matcher(stdout).replaceAll(" ");
        text = BRACKETED.matcher(text).replaceAll(" ");
        text = STARRED.matcher(text).replaceAll(" ");
        text = PARENTHESIZED.matcher(text).replaceAll(match -> isNonSpeech(match.group()) ? " " : Matcher.quoteReplacement(match.group()));
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Whether the cleaned text carries any recognizable content.
     */
    static boolean isSpeech(String cleaned) {
        if (cleaned == null || cleaned.isBlank()) {
            return false;
        }
        for (int i = 0; i < cleaned.length(); i++) {
            if (Character.isLetterOrDigit(cleaned.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNonSpeech(String parenthesized) {
        String inner = parenthesized.substring(1, parenthesized.length() - 1)
                .toLowerCase(Locale.ROOT).replace('_', ' ').strip();
        return NON_SPEECH.contains(inner);
    }
}
