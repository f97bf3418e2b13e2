package io.tiller.core.slot;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Input to one {@link ExtractionService} call.
///
/// @param instruction system instruction describing the task, not null
/// @param fields names of the fields to extract, in question order, never null
/// @param fieldTypes type hint per field where known, never null
/// @param context bounded window of prior conversation, oldest first, never null
/// @param utterance the current user message, not null
/// @param outstanding questions the user is answering, empty on a fresh turn
public record ExtractionRequest(
        String instruction,
        List<String> fields,
        Map<String, String> fieldTypes,
        List<ConversationMessage> context,
        String utterance,
        List<FollowUpQuestion> outstanding) {

    public ExtractionRequest {
        Objects.requireNonNull(instruction, "instruction must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
        fieldTypes = fieldTypes != null ? Map.copyOf(fieldTypes) : Map.of();
        context = context != null ? List.copyOf(context) : List.of();
        Objects.requireNonNull(utterance, "utterance must not be null");
        outstanding = outstanding != null ? List.copyOf(outstanding) : List.of();
    }
}
