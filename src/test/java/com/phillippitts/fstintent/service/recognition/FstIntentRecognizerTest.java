package com.phillippitts.fstintent.service.recognition;

import com.phillippitts.fstintent.domain.EntityValue;
import com.phillippitts.fstintent.domain.IntentRecord;
import com.phillippitts.fstintent.exception.CyclicGrammarException;
import com.phillippitts.fstintent.exception.MalformedTagException;
import com.phillippitts.fstintent.exception.UnknownSymbolException;
import com.phillippitts.fstintent.service.decode.SymbolDecoder;
import com.phillippitts.fstintent.service.fst.Arc;
import com.phillippitts.fstintent.service.fst.FstComposer;
import com.phillippitts.fstintent.service.fst.Grammar;
import com.phillippitts.fstintent.service.fst.PathEnumerator;
import com.phillippitts.fstintent.service.fst.PathMode;
import com.phillippitts.fstintent.service.fst.SymbolTable;
import com.phillippitts.fstintent.service.fst.TropicalWeight;
import com.phillippitts.fstintent.service.fst.VectorFst;
import com.phillippitts.fstintent.testutil.GrammarFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FstIntentRecognizerTest {

    private Grammar home;
    private FstIntentRecognizer recognizer;

    @BeforeEach
    void setUp() {
        home = GrammarFixtures.home();
        recognizer = recognizerFor(home, new PathEnumerator());
    }

    @Test
    void recognizesSingleIntentWithFullConfidence() {
        RecognitionOutcome outcome = recognizer.recognize("Turn ON the light ", RecognitionOptions.defaults());

        assertThat(outcome.isFailure()).isFalse();
        assertThat(outcome.records()).hasSize(1);
        IntentRecord record = outcome.records().get(0);
        assertThat(record.intent().name()).isEqualTo("LightOn");
        assertThat(record.intent().confidence()).isEqualTo(1.0);
        assertThat(record.text()).isEqualTo("turn on the light");
        assertThat(record.tokens()).containsExactly("turn", "on", "the", "light");
        assertThat(record.entities()).isEmpty();
    }

    @Test
    void splitsConfidenceAcrossAmbiguousPaths() {
        RecognitionOutcome outcome = recognizer.recognize("turn off the light", RecognitionOptions.defaults());

        assertThat(outcome.records()).extracting(r -> r.intent().name())
                .containsExactly("LightOff", "PowerOff");
        assertThat(outcome.records()).allSatisfy(r -> assertThat(r.intent().confidence()).isEqualTo(0.5));
        assertThat(outcome.records()).allSatisfy(r -> assertThat(r.text()).isEqualTo("turn off the light"));
    }

    @Test
    void capturesEntityTokens() {
        RecognitionOutcome outcome = recognizer.recognize("play the beatles", RecognitionOptions.defaults());

        assertThat(outcome.records()).singleElement().satisfies(record -> {
            assertThat(record.intent().name()).isEqualTo("PlayArtist");
            assertThat(record.entities()).containsExactly(new EntityValue("artist", "the beatles"));
        });
    }

    @Test
    void appliesTagReplacementPolicy() {
        RecognitionOutcome replaced = recognizer.recognize("set the light to red", new RecognitionOptions(null, true));
        RecognitionOutcome kept = recognizer.recognize("set the light to red", new RecognitionOptions(null, false));

        assertThat(replaced.records().get(0).entities()).containsExactly(new EntityValue("color", "FF0000"));
        assertThat(kept.records().get(0).entities()).containsExactly(new EntityValue("color", "red"));
        assertThat(replaced.records().get(0).text()).isEqualTo("set the light to red");
    }

    @Test
    void intentNameOverrideAppliesToEveryPath() {
        RecognitionOutcome outcome = recognizer.recognize("turn off the light",
                new RecognitionOptions("home", true));

        assertThat(outcome.records()).extracting(r -> r.intent().name()).containsExactly("home", "home");
    }

    @Test
    void unmatchedSentenceIsEmptySuccess() {
        RecognitionOutcome outcome = recognizer.recognize("open the pod bay doors", RecognitionOptions.defaults());

        assertThat(outcome.isFailure()).isFalse();
        assertThat(outcome.records()).isEmpty();
    }

    @Test
    void partialSentenceDoesNotMatch() {
        assertThat(recognizer.recognize("turn on the", RecognitionOptions.defaults()).records()).isEmpty();
        assertThat(recognizer.recognize("turn on the light please", RecognitionOptions.defaults()).records())
                .isEmpty();
    }

    @Test
    void blankSentenceIsEmptySuccess() {
        assertThat(recognizer.recognize("   ", RecognitionOptions.defaults()).records()).isEmpty();
        assertThat(recognizer.recognize(null, RecognitionOptions.defaults()).isFailure()).isFalse();
    }

    @Test
    void everyGrammarSentenceRoundTripsWithConservedConfidence() {
        PathEnumerator enumerator = new PathEnumerator();
        List<List<String>> sentences = enumerator.enumerate(home.fst(), PathMode.LITERAL_ONLY);

        assertThat(sentences).hasSize(6);
        for (List<String> tokens : sentences) {
            String sentence = String.join(" ", tokens);
            List<IntentRecord> records = recognizer.recognize(sentence, RecognitionOptions.defaults()).records();

            assertThat(records).as(sentence).isNotEmpty();
            assertThat(records).allSatisfy(r -> assertThat(r.text()).isEqualTo(sentence));
            double total = records.stream().mapToDouble(r -> r.intent().confidence()).sum();
            assertThat(total).as(sentence).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void fileNameIntentForGrammarWithoutLabels() {
        Grammar lightOn = GrammarFixtures.lightOn();
        FstIntentRecognizer plain = recognizerFor(lightOn, new PathEnumerator());

        List<IntentRecord> withName = plain.recognize("turn on the light",
                new RecognitionOptions(lightOn.name(), true)).records();
        List<IntentRecord> withoutName = plain.recognize("turn on the light",
                RecognitionOptions.defaults()).records();

        assertThat(withName.get(0).intent().name()).isEqualTo("light_on");
        assertThat(withoutName.get(0).intent().name()).isEmpty();
        assertThat(withoutName.get(0).intent().confidence()).isEqualTo(1.0);
    }

    @Test
    void mismatchedTagsFailOnlyThatSentence() {
        Grammar broken = GrammarFixtures.grammar("broken",
                "0 1 <eps> __begin__a",
                "1 2 x x",
                "2 3 <eps> __end__b",
                "3",
                "0 4 y y",
                "4");
        FstIntentRecognizer brokenRecognizer = recognizerFor(broken, new PathEnumerator());

        RecognitionOutcome failed = brokenRecognizer.recognize("x", RecognitionOptions.defaults());
        RecognitionOutcome fine = brokenRecognizer.recognize("y", RecognitionOptions.defaults());

        assertThat(failed.failureReason()).isEqualTo(RecognitionOutcome.REASON_MALFORMED_TAGS);
        assertThat(failed.cause()).isInstanceOf(MalformedTagException.class);
        assertThat(fine.isFailure()).isFalse();
        assertThat(fine.records()).hasSize(1);
    }

    @Test
    void cyclicGrammarIsReportedAsFailure() {
        Grammar cyclic = GrammarFixtures.grammar("cyclic",
                "0 1 go go",
                "1 2 <eps> a",
                "2 1 <eps> b",
                "2 3 <eps> c",
                "3");
        FstIntentRecognizer bounded = recognizerFor(cyclic, new PathEnumerator(100));

        RecognitionOutcome outcome = bounded.recognize("go", RecognitionOptions.defaults());

        assertThat(outcome.failureReason()).isEqualTo(RecognitionOutcome.REASON_CYCLIC_GRAMMAR);
        assertThat(outcome.cause()).isInstanceOf(CyclicGrammarException.class);
    }

    @Test
    void unknownOutputLabelIsReportedAsFailure() {
        SymbolTable symbols = new SymbolTable("syms");
        VectorFst fst = new VectorFst(symbols, symbols);
        int s0 = fst.addState();
        int s1 = fst.addState();
        fst.setStart(s0);
        fst.setFinal(s1, TropicalWeight.ONE);
        fst.addArc(s0, new Arc(symbols.add("go"), 99L, TropicalWeight.ONE, s1));
        FstIntentRecognizer dangling = recognizerFor(new Grammar("dangling", fst), new PathEnumerator());

        RecognitionOutcome outcome = dangling.recognize("go", RecognitionOptions.defaults());

        assertThat(outcome.failureReason()).isEqualTo(RecognitionOutcome.REASON_UNKNOWN_SYMBOL);
        assertThat(outcome.cause()).isInstanceOf(UnknownSymbolException.class);
    }

    @Test
    void explicitGrammarOverloadIgnoresConfiguredGrammar() {
        Grammar other = GrammarFixtures.grammar("other", "0 1 <eps> __label__Go", "1 2 go go", "2");

        RecognitionOutcome outcome = recognizer.recognize("go", other.fst(), null, true);

        assertThat(outcome.records()).singleElement()
                .satisfies(r -> assertThat(r.intent().name()).isEqualTo("Go"));
        assertThat(recognizer.getGrammar()).isSameAs(home);
    }

    @Test
    void matchesDigitWordsFromGrammarWithoutSymbolFile() {
        Grammar timer = GrammarFixtures.grammar("timer",
                "0 1 <eps> __label__Timer", "1 2 set set", "2 3 1 1", "3 4 minute minute", "4");

        RecognitionOutcome outcome = recognizerFor(timer, new PathEnumerator())
                .recognize("set 1 minute", RecognitionOptions.defaults());

        assertThat(outcome.records()).hasSize(1);
        assertThat(outcome.records().get(0).intent().name()).isEqualTo("Timer");
        assertThat(outcome.records().get(0).text()).isEqualTo("set 1 minute");
    }

    private static FstIntentRecognizer recognizerFor(Grammar grammar, PathEnumerator enumerator) {
        return new FstIntentRecognizer(grammar, new FstComposer(), enumerator, new SymbolDecoder());
    }
}
