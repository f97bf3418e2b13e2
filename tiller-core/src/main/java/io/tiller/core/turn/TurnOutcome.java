package io.tiller.core.turn;

import io.tiller.core.execution.ExecutionReport;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.router.ConsentPrompt;
import io.tiller.core.slot.FieldSet;
import io.tiller.core.slot.FollowUpQuestions;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Result of one processed turn.
///
/// @param status turn status, not null
/// @param sessionId conversation id, not null
/// @param fields field values known after this turn, never null
/// @param questions follow-up questions, non-null only for `CLARIFYING`
/// @param missingFields required fields still unfilled, never null
/// @param plan plan that was (or will be) executed, may be null
/// @param report execution outcomes, null for `CLARIFYING`
/// @param consentPrompt prompt to show, non-null only for `CONSENT_REQUIRED`
/// @param resumed whether the turn resumed a suspension
public record TurnOutcome(
        TurnStatus status,
        String sessionId,
        FieldSet fields,
        FollowUpQuestions questions,
        List<String> missingFields,
        ExecutionPlan plan,
        ExecutionReport report,
        ConsentPrompt consentPrompt,
        boolean resumed) {

    public TurnOutcome {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        fields = fields != null ? fields.copy() : new FieldSet();
        missingFields = missingFields != null ? List.copyOf(missingFields) : List.of();
    }

    public Optional<ExecutionReport> executionReport() {
        return Optional.ofNullable(report);
    }
}
