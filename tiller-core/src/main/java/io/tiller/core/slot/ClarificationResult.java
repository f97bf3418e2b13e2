package io.tiller.core.slot;

import io.tiller.core.plan.ExecutionPlan;
import java.util.List;
import java.util.Objects;

/// Outcome of one clarification pass.
///
/// @param state state the machine ended in, not null
/// @param proceed whether execution may start this turn
/// @param fields values collected so far, never null
/// @param questions follow-up questions when suspended, never null
/// @param missingFields required fields still unfilled, never null
/// @param plan plan to execute; the suspended plan when this turn resumed, may be null
/// @param resumed whether this turn resumed an earlier suspension
/// @param degraded whether the clarifier failed internally and let the turn proceed
public record ClarificationResult(
        ClarificationState state,
        boolean proceed,
        FieldSet fields,
        FollowUpQuestions questions,
        List<String> missingFields,
        ExecutionPlan plan,
        boolean resumed,
        boolean degraded) {

    public ClarificationResult {
        Objects.requireNonNull(state, "state must not be null");
        fields = fields != null ? fields.copy() : new FieldSet();
        questions = questions != null ? questions : FollowUpQuestions.of(List.of());
        missingFields = missingFields != null ? List.copyOf(missingFields) : List.of();
    }

    static ClarificationResult resolved(FieldSet fields, ExecutionPlan plan, boolean resumed) {
        return new ClarificationResult(
                ClarificationState.RESOLVED, true, fields, null, List.of(), plan, resumed, false);
    }

    static ClarificationResult suspended(
            FieldSet fields,
            FollowUpQuestions questions,
            List<String> missing,
            ExecutionPlan plan,
            boolean resumed) {
        return new ClarificationResult(
                ClarificationState.SUSPENDED, false, fields, questions, missing, plan, resumed, false);
    }

    static ClarificationResult failedOpen(FieldSet fields, ExecutionPlan plan, boolean resumed) {
        return new ClarificationResult(
                ClarificationState.RESOLVED, true, fields, null, List.of(), plan, resumed, true);
    }
}
