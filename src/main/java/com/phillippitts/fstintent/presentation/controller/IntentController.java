package com.phillippitts.fstintent.presentation.controller;

import com.phillippitts.fstintent.domain.IntentRecord;
import com.phillippitts.fstintent.service.fst.Grammar;
import com.phillippitts.fstintent.service.recognition.BatchRecognitionService;
import com.phillippitts.fstintent.service.recognition.RecognitionOptions;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for recognizing intents against the loaded grammar.
 */
@RestController
@RequestMapping("/api/intents")
class IntentController {

    private static final Logger LOG = LogManager.getLogger(IntentController.class);

    private final BatchRecognitionService recognitionService;
    private final Grammar grammar;
    private final RecognitionOptions defaultOptions;

    IntentController(BatchRecognitionService recognitionService, Grammar grammar,
                     RecognitionOptions defaultOptions) {
        this.recognitionService = recognitionService;
        this.grammar = grammar;
        this.defaultOptions = defaultOptions;
    }

    /**
     * Recognizes every sentence of the request. Sentences that fail map to an empty list.
     */
    @PostMapping("/recognize")
    ResponseEntity<Map<String, List<IntentRecord>>> recognize(@Valid @RequestBody RecognizeRequest request) {
        RecognitionOptions options = defaultOptions.override(request.intentName(), request.replaceTags());
        LOG.info("Recognize request: sentences={}, intentName={}, replaceTags={}",
                request.sentences().size(), options.intentName(), options.replaceTags());
        return ResponseEntity.ok(recognitionService.recognizeAll(request.sentences(), options));
    }

    @GetMapping("/grammar")
    ResponseEntity<GrammarInfo> grammar() {
        return ResponseEntity.ok(new GrammarInfo(
                grammar.name(),
                grammar.fst().numStates(),
                grammar.fst().totalArcs()
        ));
    }

    /**
     * Summary of the loaded grammar.
     */
    record GrammarInfo(String name, int states, int arcs) {}
}
