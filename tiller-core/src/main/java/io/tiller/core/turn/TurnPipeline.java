package io.tiller.core.turn;

import io.tiller.core.degradation.DegradationPolicy;
import io.tiller.core.execution.CapabilityInvocation;
import io.tiller.core.execution.ConsentHalt;
import io.tiller.core.execution.ExecutionReport;
import io.tiller.core.execution.PlanExecutor;
import io.tiller.core.plan.DependencyPlanner;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.plan.PlanningException;
import io.tiller.core.plan.PlanningRequest;
import io.tiller.core.router.ConsentConfirmation;
import io.tiller.core.router.ConsentFlags;
import io.tiller.core.slot.ClarificationRequest;
import io.tiller.core.slot.ClarificationResult;
import io.tiller.core.slot.ClarificationState;
import io.tiller.core.slot.FieldSet;
import io.tiller.core.slot.Provenance;
import io.tiller.core.slot.SlotClarifier;
import io.tiller.core.suspend.SuspendState;
import io.tiller.core.suspend.SuspendStateStore;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Processes one user turn: resume or plan, clarify, execute.
///
/// ### Flow
/// 1. A turn that resumes a suspension for the same intent reuses the suspended plan;
///    otherwise the {@link DependencyPlanner} plans the turn's selection.
/// 2. The {@link SlotClarifier} fills fields or suspends with follow-up questions.
/// 3. Resolved turns run through the {@link PlanExecutor}. Consent confirmations
///    (see {@link ConsentConfirmation}) set the per-query consent flag.
///
/// ### Consent halts
/// A plan that stops for consent is kept in the suspend store with its fields and
/// routing progress. The next turn of the session clears it. A confirming turn
/// continues the kept plan where it stopped, skipping planning and clarification
/// and the tiers already fetched; any other turn is handled as a new query.
///
/// Failures of the suspend store follow {@link DegradationPolicy#SUSPEND_STORE}:
/// fail-open treats the turn as fresh (or drops the consent halt), fail-closed
/// propagates the failure.
///
/// ### Usage
/// {@snippet :
/// SuspendStateStore store = new SuspendStateStore(repository, Duration.ofHours(1));
/// TurnOutcome outcome = pipeline.handle(
///     TurnRequest.of("session-1", "travel", "Find me a hotel", "travel_search_hotels"), store);
/// }
///
/// @implNote Thread-safe. The {@link SuspendStateStore} is request-scoped and must not
/// be shared between concurrent turns.
public class TurnPipeline {

    private static final Logger logger = Logger.getLogger(TurnPipeline.class.getName());

    private final DependencyPlanner planner;
    private final SlotClarifier clarifier;
    private final PlanExecutor executor;
    private final DegradationPolicy degradationPolicy;

    public TurnPipeline(
            DependencyPlanner planner,
            SlotClarifier clarifier,
            PlanExecutor executor,
            DegradationPolicy degradationPolicy) {
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.clarifier = Objects.requireNonNull(clarifier, "clarifier must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.degradationPolicy =
                Objects.requireNonNull(degradationPolicy, "degradationPolicy must not be null");
    }

    /// Handles a turn.
    ///
    /// @apiNote **Side effects**: reads and writes suspend state, calls capability
    /// handlers and through them external sources
    ///
    /// @param request the turn, not null
    /// @param store request-scoped suspend store, not null
    /// @return turn outcome, never null
    /// @throws PlanningException if the selection cannot be planned
    public TurnOutcome handle(TurnRequest request, SuspendStateStore store)
            throws PlanningException {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(store, "store must not be null");

        Optional<SuspendState> awaiting =
                read(request, () -> store.findConsentHalt(request.sessionId()));
        if (awaiting.isPresent()) {
            discard(request.sessionId(), store);
            if (ConsentConfirmation.isConfirmation(request.action(), request.utterance())) {
                return resumeAfterConsent(request, awaiting.get(), store);
            }
            logger.info(
                    "Consent not confirmed for session "
                            + request.sessionId()
                            + "; treating turn as a new query");
        }

        Optional<SuspendState> suspended =
                read(request, () -> store.findResumable(request.sessionId(), request.intent()));
        ExecutionPlan plan =
                suspended.isPresent()
                        ? null
                        : planner.plan(
                                new PlanningRequest(
                                        request.intent(),
                                        request.selectedCapabilities(),
                                        request.complexity()));

        ClarificationResult clarification =
                clarifier.clarify(
                        new ClarificationRequest(
                                request.sessionId(),
                                request.intent(),
                                request.utterance(),
                                request.history(),
                                plan,
                                FieldSet.of(request.fields(), Provenance.USER_SUPPLIED)),
                        store);

        if (clarification.state() == ClarificationState.SUSPENDED) {
            return new TurnOutcome(
                    TurnStatus.CLARIFYING,
                    request.sessionId(),
                    clarification.fields(),
                    clarification.questions(),
                    clarification.missingFields(),
                    clarification.plan(),
                    null,
                    null,
                    clarification.resumed());
        }

        ExecutionPlan toRun = clarification.plan() != null ? clarification.plan() : plan;
        if (toRun == null || toRun.isEmpty()) {
            logger.info("Nothing to execute for session " + request.sessionId());
            return finished(
                    request.sessionId(),
                    clarification.fields(),
                    toRun,
                    ExecutionReport.completed(List.of()),
                    clarification.resumed());
        }

        ExecutionReport report =
                executor.execute(
                        toRun,
                        new CapabilityInvocation(
                                toRun.capabilityNames().get(0),
                                request.sessionId(),
                                request.actorId(),
                                request.intent(),
                                request.utterance(),
                                clarification.fields().values(),
                                Map.of(),
                                consentFlags(request)));

        if (report.halted()) {
            saveConsentHalt(
                    request.intent(), clarification.fields(), toRun, report, request, store);
        }
        return finished(
                request.sessionId(), clarification.fields(), toRun, report, clarification.resumed());
    }

    /// Continues a plan that stopped for consent, with the intent, fields and
    /// message of the halted turn and the consent of this one.
    private TurnOutcome resumeAfterConsent(
            TurnRequest request, SuspendState halted, SuspendStateStore store) {
        ConsentHalt halt = halted.consentHalt();
        logger.info(
                "Consent confirmed for session "
                        + request.sessionId()
                        + "; resuming at step "
                        + halt.stepId());

        ExecutionReport report =
                executor.resume(
                        halted.plan(),
                        new CapabilityInvocation(
                                halted.plan().capabilityNames().get(0),
                                request.sessionId(),
                                request.actorId(),
                                halted.intent(),
                                halt.utterance(),
                                halted.fields().values(),
                                Map.of(),
                                consentFlags(request)),
                        halt);

        if (report.halted()) {
            saveConsentHalt(
                    halted.intent(), halted.fields(), halted.plan(), report, request, store);
        }
        return finished(request.sessionId(), halted.fields(), halted.plan(), report, true);
    }

    private void saveConsentHalt(
            String intent,
            FieldSet fields,
            ExecutionPlan plan,
            ExecutionReport report,
            TurnRequest request,
            SuspendStateStore store) {
        try {
            store.save(
                    SuspendState.awaitingConsent(
                            request.sessionId(),
                            intent,
                            fields,
                            plan,
                            report.consentHalt(),
                            store.nextVersion(request.sessionId())));
            logger.info(
                    "Session "
                            + request.sessionId()
                            + " waiting for consent at step "
                            + report.consentHalt().stepId());
        } catch (RuntimeException e) {
            if (!degradationPolicy.isFailOpen(DegradationPolicy.SUSPEND_STORE)) {
                throw e;
            }
            logger.log(
                    Level.WARNING,
                    "Could not keep consent halt for session "
                            + request.sessionId()
                            + "; a confirmation will start over",
                    e);
        }
    }

    static ConsentFlags consentFlags(TurnRequest request) {
        ConsentFlags flags = new ConsentFlags(request.extendedSearchEnabled(), false);
        return ConsentConfirmation.isConfirmation(request.action(), request.utterance())
                ? flags.withPerQuery()
                : flags;
    }

    private Optional<SuspendState> read(
            TurnRequest request, Supplier<Optional<SuspendState>> lookup) {
        try {
            return lookup.get();
        } catch (RuntimeException e) {
            if (!degradationPolicy.isFailOpen(DegradationPolicy.SUSPEND_STORE)) {
                throw e;
            }
            logger.log(
                    Level.WARNING,
                    "Suspend store unavailable for session "
                            + request.sessionId()
                            + "; treating turn as fresh",
                    e);
            return Optional.empty();
        }
    }

    private void discard(String sessionId, SuspendStateStore store) {
        try {
            store.delete(sessionId);
        } catch (RuntimeException e) {
            if (!degradationPolicy.isFailOpen(DegradationPolicy.SUSPEND_STORE)) {
                throw e;
            }
            logger.log(Level.WARNING, "Could not clear consent halt for session " + sessionId, e);
        }
    }

    private static TurnOutcome finished(
            String sessionId,
            FieldSet fields,
            ExecutionPlan plan,
            ExecutionReport report,
            boolean resumed) {
        if (report.halted()) {
            return new TurnOutcome(
                    TurnStatus.CONSENT_REQUIRED,
                    sessionId,
                    fields,
                    null,
                    List.of(),
                    plan,
                    report,
                    report.consentPrompt().orElse(null),
                    resumed);
        }
        return new TurnOutcome(
                TurnStatus.COMPLETED, sessionId, fields, null, List.of(), plan, report, null, resumed);
    }
}
