package com.phillippitts.fstintent.service.recognition;

import com.phillippitts.fstintent.config.properties.RecognitionProperties;
import com.phillippitts.fstintent.domain.IntentRecord;
import com.phillippitts.fstintent.service.metrics.RecognitionMetrics;
import com.phillippitts.fstintent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Batch entry point: recognizes a list of sentences and maps each sentence to its records.
 *
 * <p><b>Failure isolation:</b> a sentence whose recognition fails contributes an empty list and a
 * WARN log line (sentence preview and reason); the remaining sentences are processed normally.
 * No exception escapes {@link #recognizeAll(List, RecognitionOptions)}. Failures are deterministic
 * for a given grammar and sentence, so nothing is retried.
 *
 * <p>Sentences are independent; the map preserves input order (a repeated sentence keeps the
 * position of its first occurrence).
 */
@Service
public class BatchRecognitionService {

    private static final Logger LOG = LogManager.getLogger(BatchRecognitionService.class);

    private final IntentRecognizer recognizer;
    private final RecognitionMetrics metrics;
    private final RecognitionProperties props;

    public BatchRecognitionService(IntentRecognizer recognizer, RecognitionMetrics metrics,
                                   RecognitionProperties props) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * @param sentences sentences to recognize, in order
     * @param options   intent name override and tag replacement policy
     * @return sentence → ordered intent records (empty for unmatched or failed sentences)
     */
    public Map<String, List<IntentRecord>> recognizeAll(List<String> sentences, RecognitionOptions options) {
        Objects.requireNonNull(sentences, "sentences must not be null");
        long start = System.nanoTime();
        Map<String, List<IntentRecord>> results = new LinkedHashMap<>();
        int failures = 0;
        for (String sentence : sentences) {
            RecognitionOutcome outcome = recognizeOne(sentence, options);
            if (outcome.isFailure()) {
                failures++;
            }
            results.put(sentence, outcome.records());
        }
        LOG.info("Recognized batch of {} sentence(s) in {} ms (failures={})",
                sentences.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), failures);
        return results;
    }

    /**
     * Recognizes a single sentence with the same isolation and logging as a batch.
     *
     * @return ordered intent records, empty when unmatched or failed
     */
    public List<IntentRecord> recognize(String sentence, RecognitionOptions options) {
        return recognizeOne(sentence, options).records();
    }

    private RecognitionOutcome recognizeOne(String sentence, RecognitionOptions options) {
        long start = System.nanoTime();
        RecognitionOutcome outcome;
        try {
            outcome = recognizer.recognize(sentence, options);
        } catch (RuntimeException e) {
            outcome = RecognitionOutcome.failure(sentence, RecognitionOutcome.REASON_UNEXPECTED, e);
        }
        metrics.recordLatency(System.nanoTime() - start);

        String preview = LogSanitizer.preview(sentence, props.getLogPreviewChars());
        if (outcome.isFailure()) {
            metrics.incrementFailure(outcome.failureReason());
            if (RecognitionOutcome.REASON_UNEXPECTED.equals(outcome.failureReason())) {
                LOG.error("Unexpected error recognizing {}", preview, outcome.cause());
            } else {
                LOG.warn("Recognition failed for {}: reason={}, detail={}", preview,
                        outcome.failureReason(), outcome.cause() == null ? "" : outcome.cause().getMessage());
            }
        } else if (outcome.isMatched()) {
            metrics.recordMatched(outcome.records().size());
            LOG.debug("Matched {} with {} path(s)", preview, outcome.records().size());
        } else {
            metrics.incrementUnmatched();
            LOG.debug("No grammar path for {}", preview);
        }
        return outcome;
    }
}
