package com.phillippitts.fstintent.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for sentence recognition.
 */
@Validated
@ConfigurationProperties(prefix = "fst.recognition")
public class RecognitionProperties {

    /** Emit the value of {@code entity:value} tags instead of the matched tokens. */
    private final boolean replaceTags;

    /** Longest path (in arcs) explored before a grammar is treated as cyclic. */
    @Min(1)
    private final int maxPathDepth;

    /** Characters of a sentence shown in log lines. */
    @Min(0)
    private final int logPreviewChars;

    @ConstructorBinding
    public RecognitionProperties(Boolean replaceTags, Integer maxPathDepth, Integer logPreviewChars) {
        this.replaceTags = replaceTags == null || replaceTags;
        int depth = maxPathDepth == null ? 10_000 : maxPathDepth;
        if (depth < 1) {
            throw new IllegalArgumentException("fst.recognition.max-path-depth must be >= 1");
        }
        this.maxPathDepth = depth;
        int preview = logPreviewChars == null ? 80 : logPreviewChars;
        if (preview < 0) {
            throw new IllegalArgumentException("fst.recognition.log-preview-chars must be >= 0");
        }
        this.logPreviewChars = preview;
    }

    public boolean isReplaceTags() {
        return replaceTags;
    }

    public int getMaxPathDepth() {
        return maxPathDepth;
    }

    public int getLogPreviewChars() {
        return logPreviewChars;
    }
}
