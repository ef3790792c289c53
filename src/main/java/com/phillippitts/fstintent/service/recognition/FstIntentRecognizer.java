package com.phillippitts.fstintent.service.recognition;

import com.phillippitts.fstintent.domain.IntentRecord;
import com.phillippitts.fstintent.exception.CyclicGrammarException;
import com.phillippitts.fstintent.exception.MalformedTagException;
import com.phillippitts.fstintent.exception.UnknownSymbolException;
import com.phillippitts.fstintent.service.decode.SymbolDecoder;
import com.phillippitts.fstintent.service.fst.Fst;
import com.phillippitts.fstintent.service.fst.FstComposer;
import com.phillippitts.fstintent.service.fst.Grammar;
import com.phillippitts.fstintent.service.fst.PathEnumerator;
import com.phillippitts.fstintent.service.fst.PathMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link IntentRecognizer} that matches sentences against a grammar transducer.
 *
 * <p>Pipeline per sentence:
 * <ol>
 *   <li>Tokenize (trim, lowercase, whitespace split); blank sentences match nothing</li>
 *   <li>Build the sentence's linear acceptor, compose it with the grammar, project to outputs</li>
 *   <li>Enumerate every accepting path with its marker symbols</li>
 *   <li>Decode each path into an {@link IntentRecord}</li>
 *   <li>Divide every confidence by the number of paths</li>
 * </ol>
 *
 * <p>Failures in steps 2-5 abort the sentence only and come back as
 * {@link RecognitionOutcome#failure(String, String, Throwable)}.
 */
public class FstIntentRecognizer implements IntentRecognizer {

    private static final Logger LOG = LogManager.getLogger(FstIntentRecognizer.class);

    private final Grammar grammar;
    private final FstComposer composer;
    private final PathEnumerator enumerator;
    private final SymbolDecoder decoder;

    public FstIntentRecognizer(Grammar grammar, FstComposer composer, PathEnumerator enumerator,
                               SymbolDecoder decoder) {
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
        this.composer = Objects.requireNonNull(composer, "composer must not be null");
        this.enumerator = Objects.requireNonNull(enumerator, "enumerator must not be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
    }

    @Override
    public RecognitionOutcome recognize(String sentence, RecognitionOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return recognize(sentence, grammar.fst(), options.intentName(), options.replaceTags());
    }

    /**
     * Recognizes one sentence against an explicit grammar transducer.
     *
     * @param sentence           raw sentence (may be null or blank)
     * @param grammarFst         grammar transducer
     * @param intentNameOverride intent name for every record, or null to use label markers
     * @param replaceTags        tag replacement policy
     * @return outcome; never throws for grammar or decoding problems
     */
    public RecognitionOutcome recognize(String sentence, Fst grammarFst, String intentNameOverride,
                                        boolean replaceTags) {
        List<String> tokens = SentenceTokenizer.tokenize(sentence);
        if (tokens.isEmpty()) {
            LOG.debug("Blank sentence, nothing to recognize");
            return RecognitionOutcome.success(sentence, List.of());
        }

        try {
            Fst composed = composer.apply(tokens, grammarFst);
            List<List<String>> paths = enumerator.enumerate(composed, PathMode.ALL_SYMBOLS);

            List<IntentRecord> records = new ArrayList<>(paths.size());
            for (List<String> path : paths) {
                records.add(decoder.decode(path, intentNameOverride, replaceTags));
            }
            List<IntentRecord> split = new ArrayList<>(records.size());
            for (IntentRecord record : records) {
                split.add(record.withConfidenceSplit(records.size()));
            }
            LOG.debug("Recognized {} path(s) for {} token(s)", split.size(), tokens.size());
            return RecognitionOutcome.success(sentence, split);
        } catch (MalformedTagException e) {
            return RecognitionOutcome.failure(sentence, RecognitionOutcome.REASON_MALFORMED_TAGS, e);
        } catch (UnknownSymbolException e) {
            return RecognitionOutcome.failure(sentence, RecognitionOutcome.REASON_UNKNOWN_SYMBOL, e);
        } catch (CyclicGrammarException e) {
            return RecognitionOutcome.failure(sentence, RecognitionOutcome.REASON_CYCLIC_GRAMMAR, e);
        } catch (RuntimeException e) {
            return RecognitionOutcome.failure(sentence, RecognitionOutcome.REASON_UNEXPECTED, e);
        }
    }

    public Grammar getGrammar() {
        return grammar;
    }
}
