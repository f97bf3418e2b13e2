package io.tiller.core.suspend;

import io.tiller.core.execution.ConsentHalt;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.slot.FieldSet;
import io.tiller.core.slot.FollowUpQuestion;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Snapshot that lets a turn resume on a later, independent request.
///
/// A state with a non-empty `outstandingQuestions` list is the only signal that a
/// session is suspended for clarification. A state holding a {@link ConsentHalt}
/// marks a plan waiting for consent. A state with neither is stale and is treated
/// as absent.
///
/// ### Contracts
/// - **Precondition**: `sessionId` and `intent` not null; `fields` not null
/// - **Postcondition**: lists and maps are unmodifiable; `fields` is a private copy
///
/// @param sessionId conversation identifier, not null
/// @param intent intent the plan was built for, not null
/// @param fields values collected so far, never null
/// @param outstandingQuestions questions awaiting an answer, in ask order, never null
/// @param plan plan computed before suspension, not null
/// @param fieldOwners field to the capabilities that declared it, never null
/// @param version write counter, incremented on every save of the same session
/// @param consentHalt where the plan stopped for consent, null for a clarification
public record SuspendState(
        String sessionId,
        String intent,
        FieldSet fields,
        List<FollowUpQuestion> outstandingQuestions,
        ExecutionPlan plan,
        Map<String, List<String>> fieldOwners,
        long version,
        ConsentHalt consentHalt) {

    public SuspendState {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
        fields = fields.copy();
        outstandingQuestions =
                outstandingQuestions != null ? List.copyOf(outstandingQuestions) : List.of();
        Map<String, List<String>> owners = new LinkedHashMap<>();
        if (fieldOwners != null) {
            fieldOwners.forEach((field, names) -> owners.put(field, List.copyOf(names)));
        }
        fieldOwners = Collections.unmodifiableMap(owners);
    }

    /// Creates a clarification state.
    public SuspendState(
            String sessionId,
            String intent,
            FieldSet fields,
            List<FollowUpQuestion> outstandingQuestions,
            ExecutionPlan plan,
            Map<String, List<String>> fieldOwners,
            long version) {
        this(sessionId, intent, fields, outstandingQuestions, plan, fieldOwners, version, null);
    }

    /// Creates a state for a plan waiting for consent.
    ///
    /// @param sessionId conversation identifier, not null
    /// @param intent intent the plan was built for, not null
    /// @param fields resolved field values, not null
    /// @param plan the halted plan, not null
    /// @param halt where the plan stopped, not null
    /// @param version write counter
    /// @return new state, never null
    public static SuspendState awaitingConsent(
            String sessionId,
            String intent,
            FieldSet fields,
            ExecutionPlan plan,
            ConsentHalt halt,
            long version) {
        Objects.requireNonNull(halt, "halt must not be null");
        return new SuspendState(sessionId, intent, fields, List.of(), plan, Map.of(), version, halt);
    }

    /// Returns whether the plan of this state is waiting for consent.
    ///
    /// @return true if a consent halt is recorded
    public boolean isAwaitingConsent() {
        return consentHalt != null;
    }

    /// Returns whether this state represents an active suspension.
    ///
    /// @return true if at least one question is outstanding
    public boolean isSuspended() {
        return !outstandingQuestions.isEmpty();
    }

    /// Returns the fields the outstanding questions ask for.
    ///
    /// @return field names in ask order, never null
    public List<String> outstandingFields() {
        return outstandingQuestions.stream().map(FollowUpQuestion::fieldName).toList();
    }

    /// Returns the next revision of this state with updated fields and questions.
    ///
    /// @param updatedFields new field values, not null
    /// @param questions remaining questions, not null
    /// @return new state with `version + 1`, never null
    public SuspendState revise(FieldSet updatedFields, List<FollowUpQuestion> questions) {
        return new SuspendState(
                sessionId, intent, updatedFields, questions, plan, fieldOwners, version + 1, null);
    }

    /// Returns the durable-store key for a session.
    ///
    /// @param sessionId conversation identifier, not null
    /// @return `suspend:{sessionId}`, never null
    public static String key(String sessionId) {
        return "suspend:" + sessionId;
    }
}
