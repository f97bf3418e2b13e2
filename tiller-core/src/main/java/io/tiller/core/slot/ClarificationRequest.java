package io.tiller.core.slot;

import io.tiller.core.plan.ExecutionPlan;
import java.util.List;
import java.util.Objects;

/// Input to {@link SlotClarifier#clarify}.
///
/// @param sessionId conversation identifier, not null
/// @param intent intent of the current turn, not null
/// @param utterance current user message, not null
/// @param history prior conversation, oldest first, never null
/// @param plan plan computed for this turn; may be null when resuming a suspension
/// @param seed caller-supplied values, never null (may be empty)
public record ClarificationRequest(
        String sessionId,
        String intent,
        String utterance,
        List<ConversationMessage> history,
        ExecutionPlan plan,
        FieldSet seed) {

    public ClarificationRequest {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(utterance, "utterance must not be null");
        history = history != null ? List.copyOf(history) : List.of();
        seed = seed != null ? seed.copy() : new FieldSet();
    }
}
