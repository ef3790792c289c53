package com.phillippitts.fstintent.presentation.cli;

import com.phillippitts.fstintent.domain.IntentRecord;
import com.phillippitts.fstintent.presentation.json.IntentJsonWriter;
import com.phillippitts.fstintent.service.fst.Grammar;
import com.phillippitts.fstintent.service.fst.PathEnumerator;
import com.phillippitts.fstintent.service.recognition.BatchRecognitionService;
import com.phillippitts.fstintent.service.recognition.RecognitionOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Command-line front end: recognizes the non-option arguments and prints the JSON result.
 *
 * <p>Usage (with {@code fst.cli.enabled=true} and {@code spring.main.web-application-type=none}):
 * <pre>
 * java -jar fst-intent.jar --fst.grammar.path=grammars/light_on.fst.txt "turn on the light"
 * java -jar fst-intent.jar ... --dont-replace "set the temperature to seventy"
 * java -jar fst-intent.jar ... --print-paths=all_sentences.txt
 * </pre>
 *
 * <ul>
 *   <li>{@code --dont-replace} - emit the matched tokens of {@code entity:value} tags</li>
 *   <li>{@code --print-paths[=file]} - print every sentence the grammar accepts, one per line</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(name = "fst.cli.enabled", havingValue = "true")
public class FstAcceptCommandLineRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(FstAcceptCommandLineRunner.class);

    static final String DONT_REPLACE = "dont-replace";
    static final String PRINT_PATHS = "print-paths";

    private final BatchRecognitionService recognitionService;
    private final PathEnumerator pathEnumerator;
    private final Grammar grammar;
    private final RecognitionOptions defaultOptions;
    private final PrintStream out;

    @Autowired
    public FstAcceptCommandLineRunner(BatchRecognitionService recognitionService, PathEnumerator pathEnumerator,
                                      Grammar grammar, RecognitionOptions defaultOptions) {
        this(recognitionService, pathEnumerator, grammar, defaultOptions, System.out);
    }

    FstAcceptCommandLineRunner(BatchRecognitionService recognitionService, PathEnumerator pathEnumerator,
                               Grammar grammar, RecognitionOptions defaultOptions, PrintStream out) {
        this.recognitionService = recognitionService;
        this.pathEnumerator = pathEnumerator;
        this.grammar = grammar;
        this.defaultOptions = defaultOptions;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (args.containsOption(PRINT_PATHS)) {
            printPaths(args.getOptionValues(PRINT_PATHS));
        }

        List<String> sentences = args.getNonOptionArgs();
        if (sentences.isEmpty()) {
            if (!args.containsOption(PRINT_PATHS)) {
                LOG.warn("No sentences given; nothing to recognize");
            }
            return;
        }

        RecognitionOptions options = args.containsOption(DONT_REPLACE)
                ? defaultOptions.override(null, Boolean.FALSE)
                : defaultOptions;
        Map<String, List<IntentRecord>> results = recognitionService.recognizeAll(sentences, options);
        out.println(IntentJsonWriter.write(results));
        out.flush();
    }

    private void printPaths(List<String> targets) throws IOException {
        if (targets == null || targets.isEmpty() || targets.get(0).isBlank()) {
            int count = pathEnumerator.print(grammar.fst(), out);
            out.flush();
            LOG.info("Printed {} path(s) of grammar '{}'", count, grammar.name());
            return;
        }
        Path file = Paths.get(targets.get(0));
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            int count = pathEnumerator.print(grammar.fst(), writer);
            LOG.info("Wrote {} path(s) of grammar '{}' to {}", count, grammar.name(), file);
        }
    }
}
