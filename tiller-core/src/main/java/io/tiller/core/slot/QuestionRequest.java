package io.tiller.core.slot;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Input to {@link QuestionGenerator#generate(QuestionRequest)}.
///
/// @param intent active intent, not null
/// @param missingFields fields that need a question, in order, never null
/// @param knownFields values already collected, never null
/// @param utterance the current user message, not null
public record QuestionRequest(
        String intent,
        List<String> missingFields,
        Map<String, Object> knownFields,
        String utterance) {

    public QuestionRequest {
        Objects.requireNonNull(intent, "intent must not be null");
        missingFields = missingFields != null ? List.copyOf(missingFields) : List.of();
        knownFields = knownFields != null ? Map.copyOf(knownFields) : Map.of();
        Objects.requireNonNull(utterance, "utterance must not be null");
    }
}
