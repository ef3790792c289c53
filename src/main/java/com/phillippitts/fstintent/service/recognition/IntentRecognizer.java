package com.phillippitts.fstintent.service.recognition;

/**
 * Recognizes intents in single sentences against the configured grammar.
 *
 * <p><b>Error Handling:</b> implementations never throw for a sentence; malformed grammar paths,
 * unknown symbols and runaway traversals are reported as a failed {@link RecognitionOutcome}.
 *
 * <p><b>Thread Safety:</b> implementations must be stateless and thread-safe; the grammar is
 * shared read-only.
 *
 * @see RecognitionOutcome
 */
public interface IntentRecognizer {

    /**
     * @param sentence raw sentence (may be blank)
     * @param options  intent name override and tag replacement policy
     * @return outcome with the ordered intent records, or the failure reason
     */
    RecognitionOutcome recognize(String sentence, RecognitionOptions options);
}
