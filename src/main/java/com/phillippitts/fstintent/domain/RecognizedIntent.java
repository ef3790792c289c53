package com.phillippitts.fstintent.domain;

import java.util.Objects;

/**
 * Intent name and confidence of a single recognized parse.
 *
 * @param name       intent name (empty when the path produced no literal tokens or no label)
 * @param confidence confidence score between 0.0 and 1.0
 */
public record RecognizedIntent(String name, double confidence) {

    public RecognizedIntent {
        Objects.requireNonNull(name, "Intent name must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
    }

    /**
     * @return intent with empty name and zero confidence
     */
    public static RecognizedIntent none() {
        return new RecognizedIntent("", 0.0);
    }
}
