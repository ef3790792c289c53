package com.phillippitts.fstintent.service.recognition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility for turning a raw sentence into grammar tokens.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Lowercase ({@link Locale#ROOT})</li>
 *   <li>Split on runs of Unicode whitespace, including no-break spaces</li>
 *   <li>Filter out empty tokens</li>
 *   <li>Null, empty or whitespace-only input yields no tokens</li>
 *   <li>Return immutable list</li>
 * </ul>
 */
public final class SentenceTokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private SentenceTokenizer() {
        // Prevent instantiation
    }

    /**
     * @param sentence raw sentence (may be null or blank)
     * @return immutable list of lowercase tokens (empty if the sentence is blank)
     */
    public static List<String> tokenize(String sentence) {
        if (sentence == null || sentence.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String part : WHITESPACE.split(sentence.toLowerCase(Locale.ROOT))) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }
}
