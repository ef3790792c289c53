package com.phillippitts.fstintent.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for intent recognition.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Recognition latency per sentence</li>
 *   <li>Matched / unmatched sentence counts</li>
 *   <li>Failures by reason (malformed_tags, unknown_symbol, cyclic_grammar, unexpected_error)</li>
 *   <li>Number of accepting paths per matched sentence (grammar ambiguity)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class RecognitionMetrics {

    private static final String METRIC_PREFIX = "fstintent.recognition";

    private final MeterRegistry registry;

    public RecognitionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param durationNanos time spent recognizing one sentence
     */
    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to recognize one sentence")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a sentence that matched and records how many paths it produced.
     */
    public void recordMatched(int pathCount) {
        Counter.builder(METRIC_PREFIX + ".matched")
                .description("Number of sentences matching at least one grammar path")
                .register(registry)
                .increment();
        DistributionSummary.builder(METRIC_PREFIX + ".paths")
                .description("Accepting grammar paths per matched sentence")
                .register(registry)
                .record(pathCount);
    }

    public void incrementUnmatched() {
        Counter.builder(METRIC_PREFIX + ".unmatched")
                .description("Number of sentences matching no grammar path")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason tag
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of sentences that failed to decode")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
