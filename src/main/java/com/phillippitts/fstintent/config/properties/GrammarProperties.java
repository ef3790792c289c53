package com.phillippitts.fstintent.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties locating the grammar transducer.
 *
 * <p>Example application.properties:
 * <pre>
 * fst.grammar.path=grammars/light_on.fst.txt
 * fst.grammar.input-symbols=grammars/words.syms
 * fst.grammar.output-symbols=grammars/outputs.syms
 * fst.grammar.intent-name=
 * fst.grammar.use-file-name-as-intent=false
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "fst.grammar")
public class GrammarProperties {

    /** Path to the AT&T text FST. */
    @NotBlank
    private final String path;

    /** Input symbol table; located next to the FST when blank. */
    private final String inputSymbols;

    /** Output symbol table; defaults to the input table when blank. */
    private final String outputSymbols;

    /** Intent name forced onto every record; label markers decide when blank. */
    private final String intentName;

    /**
     * Use the grammar file name as the intent name (the classic fstaccept behavior).
     * Ignored when {@code intent-name} is set.
     */
    private final boolean useFileNameAsIntent;

    @ConstructorBinding
    public GrammarProperties(String path, String inputSymbols, String outputSymbols, String intentName,
                             Boolean useFileNameAsIntent) {
        this.path = path;
        this.inputSymbols = blankToNull(inputSymbols);
        this.outputSymbols = blankToNull(outputSymbols);
        this.intentName = blankToNull(intentName);
        this.useFileNameAsIntent = useFileNameAsIntent != null && useFileNameAsIntent;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    public String getPath() {
        return path;
    }

    public String getInputSymbols() {
        return inputSymbols;
    }

    public String getOutputSymbols() {
        return outputSymbols;
    }

    public String getIntentName() {
        return intentName;
    }

    public boolean isUseFileNameAsIntent() {
        return useFileNameAsIntent;
    }
}
