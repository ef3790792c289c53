package com.phillippitts.fstintent.service.recognition;

import com.phillippitts.fstintent.config.properties.RecognitionProperties;
import com.phillippitts.fstintent.domain.IntentRecord;
import com.phillippitts.fstintent.domain.RecognizedIntent;
import com.phillippitts.fstintent.exception.MalformedTagException;
import com.phillippitts.fstintent.service.decode.SymbolDecoder;
import com.phillippitts.fstintent.service.fst.FstComposer;
import com.phillippitts.fstintent.service.fst.PathEnumerator;
import com.phillippitts.fstintent.service.metrics.RecognitionMetrics;
import com.phillippitts.fstintent.testutil.GrammarFixtures;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchRecognitionServiceTest {

    private static final RecognitionOptions OPTIONS = RecognitionOptions.defaults();

    private MeterRegistry registry;
    private RecognitionMetrics metrics;
    private RecognitionProperties props;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RecognitionMetrics(registry);
        props = new RecognitionProperties(true, 10_000, 80);
    }

    @Test
    void isolatesUnexpectedRecognizerExceptions() {
        IntentRecognizer recognizer = mock(IntentRecognizer.class);
        when(recognizer.recognize(eq("bad"), any())).thenThrow(new IllegalStateException("boom"));
        when(recognizer.recognize(eq("good"), any()))
                .thenReturn(RecognitionOutcome.success("good", List.of(record("good"))));
        BatchRecognitionService service = new BatchRecognitionService(recognizer, metrics, props);

        Map<String, List<IntentRecord>> results = service.recognizeAll(List.of("bad", "good"), OPTIONS);

        assertThat(results).containsOnlyKeys("bad", "good");
        assertThat(results.get("bad")).isEmpty();
        assertThat(results.get("good")).extracting(IntentRecord::text).containsExactly("good");
        assertThat(failureCount(RecognitionOutcome.REASON_UNEXPECTED)).isEqualTo(1.0);
    }

    @Test
    void recordsKnownFailureReason() {
        IntentRecognizer recognizer = mock(IntentRecognizer.class);
        when(recognizer.recognize(eq("x"), any())).thenReturn(RecognitionOutcome.failure("x",
                RecognitionOutcome.REASON_MALFORMED_TAGS, new MalformedTagException("a", "b")));
        BatchRecognitionService service = new BatchRecognitionService(recognizer, metrics, props);

        assertThat(service.recognize("x", OPTIONS)).isEmpty();
        assertThat(failureCount(RecognitionOutcome.REASON_MALFORMED_TAGS)).isEqualTo(1.0);
    }

    @Test
    void preservesInputOrderAndCollapsesDuplicates() {
        BatchRecognitionService service = new BatchRecognitionService(homeRecognizer(), metrics, props);

        Map<String, List<IntentRecord>> results = service.recognizeAll(
                List.of("turn off the light", "play prince", "open the door", "turn off the light"), OPTIONS);

        assertThat(results.keySet()).containsExactly("turn off the light", "play prince", "open the door");
        assertThat(results.get("turn off the light")).hasSize(2);
        assertThat(results.get("play prince")).hasSize(1);
        assertThat(results.get("open the door")).isEmpty();
    }

    @Test
    void emptyBatchYieldsEmptyMap() {
        BatchRecognitionService service = new BatchRecognitionService(homeRecognizer(), metrics, props);

        assertThat(service.recognizeAll(List.of(), OPTIONS)).isEmpty();
    }

    @Test
    void countsMatchedUnmatchedAndLatency() {
        BatchRecognitionService service = new BatchRecognitionService(homeRecognizer(), metrics, props);

        service.recognizeAll(List.of("turn off the light", "play prince", "open the door"), OPTIONS);

        Counter matched = registry.find("fstintent.recognition.matched").counter();
        Counter unmatched = registry.find("fstintent.recognition.unmatched").counter();
        Timer latency = registry.find("fstintent.recognition.latency").timer();
        assertThat(matched).isNotNull();
        assertThat(matched.count()).isEqualTo(2.0);
        assertThat(unmatched).isNotNull();
        assertThat(unmatched.count()).isEqualTo(1.0);
        assertThat(latency).isNotNull();
        assertThat(latency.count()).isEqualTo(3);
        assertThat(registry.find("fstintent.recognition.paths").summary().totalAmount()).isEqualTo(3.0);
    }

    @Test
    void optionsReachTheRecognizer() {
        BatchRecognitionService service = new BatchRecognitionService(homeRecognizer(), metrics, props);

        List<IntentRecord> records = service.recognize("set the light to red", new RecognitionOptions("Color", false));

        assertThat(records).singleElement().satisfies(r -> {
            assertThat(r.intent().name()).isEqualTo("Color");
            assertThat(r.entities().get(0).value()).isEqualTo("red");
        });
    }

    private double failureCount(String reason) {
        Counter counter = registry.find("fstintent.recognition.failure").tag("reason", reason).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private static IntentRecognizer homeRecognizer() {
        return new FstIntentRecognizer(GrammarFixtures.home(), new FstComposer(), new PathEnumerator(),
                new SymbolDecoder());
    }

    private static IntentRecord record(String text) {
        return new IntentRecord(text, List.of(text), new RecognizedIntent("Test", 1.0), List.of());
    }
}
