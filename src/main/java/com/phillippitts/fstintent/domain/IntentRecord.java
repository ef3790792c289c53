package com.phillippitts.fstintent.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable result of decoding one accepting grammar path for a sentence.
 *
 * <p>{@code text} is the space-joined {@code tokens}; marker symbols never contribute to either.
 * Entities appear in the order their tags were closed.
 *
 * @param text     visible text of the path
 * @param tokens   literal tokens of the path, in order
 * @param intent   intent name and confidence
 * @param entities captured entity slots, in tag-close order
 */
public record IntentRecord(
        String text,
        List<String> tokens,
        RecognizedIntent intent,
        List<EntityValue> entities
) {

    public IntentRecord {
        Objects.requireNonNull(text, "text");
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        Objects.requireNonNull(intent, "intent");
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    /**
     * Returns a copy whose confidence is divided by {@code pathCount}, spreading probability
     * mass uniformly over the ambiguous parses of a sentence.
     *
     * @param pathCount number of paths decoded for the sentence (must be positive)
     * @return record with the scaled confidence
     */
    public IntentRecord withConfidenceSplit(int pathCount) {
        if (pathCount <= 0) {
            throw new IllegalArgumentException("pathCount must be positive, got: " + pathCount);
        }
        return new IntentRecord(text, tokens,
                new RecognizedIntent(intent.name(), intent.confidence() / pathCount), entities);
    }

    /**
     * @return true when the path produced at least one literal token
     */
    public boolean hasText() {
        return !tokens.isEmpty();
    }
}
