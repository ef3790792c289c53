package com.phillippitts.fstintent.presentation.controller;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of {@code POST /api/intents/recognize}.
 *
 * @param sentences   sentences to recognize (at least one)
 * @param intentName  optional intent name override for every record
 * @param replaceTags optional tag replacement override
 */
record RecognizeRequest(
        @NotEmpty List<@NotNull String> sentences,
        String intentName,
        Boolean replaceTags
) {}
