package com.phillippitts.fstintent.service.recognition;

/**
 * Per-call recognition options.
 *
 * @param intentName  intent name to assign to every record, or null to use the grammar's
 *                    {@code __label__} markers
 * @param replaceTags whether {@code entity:value} tags emit their replacement value
 */
public record RecognitionOptions(String intentName, boolean replaceTags) {

    public static RecognitionOptions defaults() {
        return new RecognitionOptions(null, true);
    }

    /**
     * Returns options with request-level overrides applied; null overrides keep this value.
     */
    public RecognitionOptions override(String intentNameOverride, Boolean replaceTagsOverride) {
        return new RecognitionOptions(
                intentNameOverride != null ? intentNameOverride : intentName,
                replaceTagsOverride != null ? replaceTagsOverride : replaceTags
        );
    }
}
