package io.tiller.server.api;

import io.tiller.core.execution.CapabilityOutcome;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.plan.PlanStep;
import io.tiller.core.router.ConsentPrompt;
import io.tiller.core.slot.FollowUpQuestions;
import io.tiller.core.turn.TurnOutcome;
import java.util.List;
import java.util.Map;

/// JSON view of a {@link TurnOutcome}.
///
/// Only the parts relevant to the status are filled: `questions` for
/// `CLARIFYING`, `consentPrompt` for `CONSENT_REQUIRED`, `outcomes` once the plan
/// ran.
///
/// @param status turn status name, not null
/// @param sessionId conversation id, not null
/// @param resumed whether the turn resumed a suspension
/// @param fields field values known after the turn, never null
/// @param missingFields required fields still unfilled, never null
/// @param questions follow-up questions, may be null
/// @param plan planned steps, never null
/// @param outcomes capability outcomes in run order, never null
/// @param consentPrompt consent prompt, may be null
public record TurnResponse(
        String status,
        String sessionId,
        boolean resumed,
        Map<String, Object> fields,
        List<String> missingFields,
        Questions questions,
        List<Step> plan,
        List<Outcome> outcomes,
        ConsentPrompt consentPrompt) {

    static TurnResponse from(TurnOutcome outcome) {
        return new TurnResponse(
                outcome.status().name(),
                outcome.sessionId(),
                outcome.resumed(),
                outcome.fields().values(),
                outcome.missingFields(),
                outcome.questions() != null ? Questions.from(outcome.questions()) : null,
                steps(outcome.plan()),
                outcome.executionReport()
                        .map(report -> report.outcomes().stream().map(Outcome::from).toList())
                        .orElse(List.of()),
                outcome.consentPrompt());
    }

    static List<Step> steps(ExecutionPlan plan) {
        if (plan == null) {
            return List.of();
        }
        return plan.steps().stream().map(Step::from).toList();
    }

    /// Follow-up questions with their optional framing lines.
    public record Questions(String intro, List<Question> questions, String closing) {

        static Questions from(FollowUpQuestions questions) {
            return new Questions(
                    questions.intro(),
                    questions.questions().stream()
                            .map(q -> new Question(q.fieldName(), q.questionText()))
                            .toList(),
                    questions.closing());
        }
    }

    public record Question(String field, String question) {}

    public record Step(String id, List<String> capabilities, boolean parallel) {

        static Step from(PlanStep step) {
            return new Step(step.id(), step.capabilities(), step.parallel());
        }
    }

    public record Outcome(
            String capability, String status, Map<String, Object> output, String error) {

        static Outcome from(CapabilityOutcome outcome) {
            return new Outcome(
                    outcome.capability(),
                    outcome.status().name(),
                    outcome.output(),
                    outcome.error());
        }
    }
}
