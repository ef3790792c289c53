package com.phillippitts.fstintent.config;

import com.phillippitts.fstintent.config.properties.GrammarProperties;
import com.phillippitts.fstintent.config.properties.RecognitionProperties;
import com.phillippitts.fstintent.service.decode.SymbolDecoder;
import com.phillippitts.fstintent.service.fst.FstComposer;
import com.phillippitts.fstintent.service.fst.Grammar;
import com.phillippitts.fstintent.service.fst.PathEnumerator;
import com.phillippitts.fstintent.service.fst.io.GrammarLoader;
import com.phillippitts.fstintent.service.recognition.FstIntentRecognizer;
import com.phillippitts.fstintent.service.recognition.IntentRecognizer;
import com.phillippitts.fstintent.service.recognition.RecognitionOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Wires the grammar and the recognition pipeline.
 */
@Configuration
public class GrammarConfig {

    @Bean
    public GrammarLoader grammarLoader() {
        return new GrammarLoader();
    }

    @Bean
    public Grammar grammar(GrammarLoader loader, GrammarProperties props) {
        return loader.load(Paths.get(props.getPath()), toPath(props.getInputSymbols()),
                toPath(props.getOutputSymbols()));
    }

    @Bean
    public FstComposer fstComposer() {
        return new FstComposer();
    }

    @Bean
    public PathEnumerator pathEnumerator(RecognitionProperties props) {
        return new PathEnumerator(props.getMaxPathDepth());
    }

    @Bean
    public SymbolDecoder symbolDecoder() {
        return new SymbolDecoder();
    }

    @Bean
    public IntentRecognizer intentRecognizer(Grammar grammar, FstComposer composer, PathEnumerator enumerator,
                                             SymbolDecoder decoder) {
        return new FstIntentRecognizer(grammar, composer, enumerator, decoder);
    }

    /**
     * Options used when a caller does not override them: the configured intent name (or the
     * grammar name when {@code use-file-name-as-intent} is set) and the tag replacement policy.
     */
    @Bean
    public RecognitionOptions defaultRecognitionOptions(Grammar grammar, GrammarProperties grammarProps,
                                                        RecognitionProperties recognitionProps) {
        String intentName = grammarProps.getIntentName();
        if (intentName == null && grammarProps.isUseFileNameAsIntent()) {
            intentName = grammar.name();
        }
        return new RecognitionOptions(intentName, recognitionProps.isReplaceTags());
    }

    private static Path toPath(String s) {
        return s == null ? null : Paths.get(s);
    }
}
