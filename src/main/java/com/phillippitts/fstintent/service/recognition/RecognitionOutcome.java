package com.phillippitts.fstintent.service.recognition;

import com.phillippitts.fstintent.domain.IntentRecord;

import java.util.List;
import java.util.Objects;

/**
 * Result of recognizing one sentence: either the decoded records (possibly none) or the reason
 * the sentence could not be processed.
 *
 * @param sentence      the sentence as given by the caller
 * @param records       decoded records; empty for failures and unmatched sentences
 * @param failureReason short machine-readable reason, null on success
 * @param cause         underlying exception, null on success
 */
public record RecognitionOutcome(
        String sentence,
        List<IntentRecord> records,
        String failureReason,
        Throwable cause
) {

    public static final String REASON_MALFORMED_TAGS = "malformed_tags";
    public static final String REASON_UNKNOWN_SYMBOL = "unknown_symbol";
    public static final String REASON_CYCLIC_GRAMMAR = "cyclic_grammar";
    public static final String REASON_UNEXPECTED = "unexpected_error";

    public RecognitionOutcome {
        records = records == null ? List.of() : List.copyOf(records);
        if (failureReason != null && !records.isEmpty()) {
            throw new IllegalArgumentException("failed outcome must not carry records");
        }
    }

    public static RecognitionOutcome success(String sentence, List<IntentRecord> records) {
        return new RecognitionOutcome(sentence, records, null, null);
    }

    public static RecognitionOutcome failure(String sentence, String reason, Throwable cause) {
        Objects.requireNonNull(reason, "reason");
        return new RecognitionOutcome(sentence, List.of(), reason, cause);
    }

    public boolean isFailure() {
        return failureReason != null;
    }

    /**
     * @return true when the sentence was processed and matched at least one grammar path
     */
    public boolean isMatched() {
        return !records.isEmpty();
    }
}
