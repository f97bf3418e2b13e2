package io.tiller.core.slot;

import io.tiller.core.contract.ContractRegistry;
import io.tiller.core.degradation.DegradationPolicy;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.suspend.SuspendState;
import io.tiller.core.suspend.SuspendStateStore;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Slot-filling state machine that makes sure a plan's required fields are
/// present before it runs.
///
/// ### Fresh turn (`COLLECTING`)
/// 1. Union required and optional fields across the planned capabilities.
/// 2. Satisfy required fields from filled aliases; ask extraction for the alias
///    instead of the field when the field has one.
/// 3. One extraction call over all unfilled fields with a bounded history window.
/// 4. Inject intent defaults for fields still missing.
/// 5. Resolve if nothing required is missing, otherwise persist a suspend state
///    and return follow-up questions.
///
/// ### Resumed turn (`SUSPENDED`)
/// One extraction call for the outstanding questions plus unfilled optional
/// fields. Required fields still unset are asked again; optional ones are
/// dropped silently.
///
/// ### Failure policy
/// Internal failures are governed by {@link DegradationPolicy#CLARIFIER}; by
/// default the turn proceeds with whatever fields exist.
///
/// @implNote Thread-safe. Per-turn state lives in the request, the result and the
/// caller-supplied {@link SuspendStateStore}.
///
/// @see FieldRequirements
/// @see SuspendStateStore
public class SlotClarifier {

    private static final Logger logger = Logger.getLogger(SlotClarifier.class.getName());

    private static final String EXTRACTION_INSTRUCTION =
            """
            You extract structured values from a conversation.
            Return a value for each listed field only if the user stated it or it can be \
            inferred unambiguously; otherwise return null for that field.
            Dates are ISO-8601 (yyyy-MM-dd). Today's date is %s.
            """;

    private final ContractRegistry registry;
    private final ExtractionService extractionService;
    private final QuestionGenerator questionGenerator;
    private final FieldDefaults defaults;
    private final DegradationPolicy degradationPolicy;
    private final ClarifierSettings settings;
    private final Clock clock;

    public SlotClarifier(
            ContractRegistry registry,
            ExtractionService extractionService,
            QuestionGenerator questionGenerator,
            FieldDefaults defaults,
            DegradationPolicy degradationPolicy,
            ClarifierSettings settings,
            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.extractionService =
                Objects.requireNonNull(extractionService, "extractionService must not be null");
        this.questionGenerator =
                Objects.requireNonNull(questionGenerator, "questionGenerator must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.degradationPolicy =
                Objects.requireNonNull(degradationPolicy, "degradationPolicy must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Runs one clarification pass for a turn.
    ///
    /// Resumes when the store holds a suspension for the session and intent,
    /// otherwise clarifies the request's plan from scratch.
    ///
    /// ### Contracts
    /// - **Precondition**: `request.plan()` is non-null unless a suspension exists
    /// - **Postcondition**: `RESOLVED` results leave no suspend state behind
    ///
    /// @param request turn input, not null
    /// @param store suspend store scoped to this request, not null
    /// @return the outcome, never null
    /// @throws ClarificationException if clarification fails and the clarifier
    ///         is configured to fail closed
    public ClarificationResult clarify(ClarificationRequest request, SuspendStateStore store) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(store, "store must not be null");

        if (settings.skipIntents().contains(request.intent())) {
            logger.fine("Skipping clarification for intent " + request.intent());
            return ClarificationResult.resolved(request.seed(), request.plan(), false);
        }

        Optional<SuspendState> suspended = Optional.empty();
        try {
            suspended = store.findResumable(request.sessionId(), request.intent());
            return suspended.isPresent()
                    ? resume(request, suspended.get(), store)
                    : collect(request, store);
        } catch (RuntimeException e) {
            ExecutionPlan plan = suspended.map(SuspendState::plan).orElse(request.plan());
            if (!degradationPolicy.isFailOpen(DegradationPolicy.CLARIFIER)) {
                throw new ClarificationException(
                        "Clarification failed for session " + request.sessionId(), e);
            }
            logger.log(
                    Level.WARNING,
                    "Clarification failed for session "
                            + request.sessionId()
                            + "; proceeding with available fields",
                    e);
            FieldSet available =
                    suspended.map(s -> mergeSeed(s.fields(), request.seed())).orElse(request.seed());
            if (suspended.isPresent()) {
                dropSuspension(request.sessionId(), store);
            }
            return ClarificationResult.failedOpen(available, plan, suspended.isPresent());
        }
    }

    /// The turn proceeds without the suspension, so a later turn must not resume it.
    private static void dropSuspension(String sessionId, SuspendStateStore store) {
        try {
            store.delete(sessionId);
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Could not drop suspension of session " + sessionId + " after failing open",
                    e);
        }
    }

    // -----------------------------------------------------------------------
    // Fresh path
    // -----------------------------------------------------------------------

    private ClarificationResult collect(ClarificationRequest request, SuspendStateStore store) {
        ExecutionPlan plan =
                Objects.requireNonNull(request.plan(), "plan must not be null on a fresh turn");
        FieldRequirements requirements = FieldRequirements.of(plan, registry);
        FieldSet fields = request.seed().copy();

        requirements.applyAliases(fields);

        List<String> toExtract = fieldsToExtract(requirements, fields);
        if (!toExtract.isEmpty()) {
            Map<String, Object> extracted =
                    extractionService.extract(
                            extractionRequest(request, requirements, toExtract, List.of()));
            merge(fields, extracted, requirements.knownFields());
        }

        List<String> missing = recompute(requirements, fields);
        if (!missing.isEmpty()) {
            if (injectDefaults(request.intent(), fields, missing)) {
                missing = recompute(requirements, fields);
            }
        }

        if (missing.isEmpty()) {
            store.delete(request.sessionId());
            logger.info(
                    "Resolved all fields for session "
                            + request.sessionId()
                            + " (intent="
                            + request.intent()
                            + ")");
            return ClarificationResult.resolved(fields, plan, false);
        }

        FollowUpQuestions questions = questionsFor(request, fields, missing);
        SuspendState state =
                new SuspendState(
                        request.sessionId(),
                        request.intent(),
                        fields,
                        questions.questions(),
                        plan,
                        requirements.owners(),
                        store.nextVersion(request.sessionId()));
        store.save(state);
        logger.info(
                "Suspending session " + request.sessionId() + ", missing fields: " + missing);
        return ClarificationResult.suspended(fields, questions, missing, plan, false);
    }

    private static List<String> fieldsToExtract(FieldRequirements requirements, FieldSet fields) {
        Set<String> toExtract = new LinkedHashSet<>();
        for (String field : requirements.required()) {
            if (fields.isFilled(field)) {
                continue;
            }
            Optional<String> alias = requirements.aliasFor(field);
            if (alias.isEmpty()) {
                toExtract.add(field);
            } else if (!fields.isFilled(alias.get())) {
                toExtract.add(alias.get());
            }
        }
        for (String field : requirements.optional()) {
            if (!fields.isFilled(field)) {
                toExtract.add(field);
            }
        }
        return List.copyOf(toExtract);
    }

    private boolean injectDefaults(String intent, FieldSet fields, List<String> missing) {
        Map<String, Supplier<Object>> declared = defaults.forIntent(intent);
        boolean injected = false;
        for (String field : missing) {
            Supplier<Object> value = declared.get(field);
            if (value != null && fields.put(field, value.get(), Provenance.DEFAULT_INJECTED)) {
                logger.fine("Injected default for field " + field);
                injected = true;
            }
        }
        return injected;
    }

    // -----------------------------------------------------------------------
    // Resume path
    // -----------------------------------------------------------------------

    private ClarificationResult resume(
            ClarificationRequest request, SuspendState state, SuspendStateStore store) {
        ExecutionPlan plan = state.plan();
        FieldRequirements requirements = FieldRequirements.of(plan, registry);
        FieldSet fields = mergeSeed(state.fields(), request.seed());

        List<String> outstanding = state.outstandingFields();
        Set<String> toExtract = new LinkedHashSet<>(outstanding);
        for (String field : requirements.optional()) {
            if (!fields.isFilled(field)) {
                toExtract.add(field);
            }
        }

        Map<String, Object> extracted =
                extractionService.extract(
                        extractionRequest(
                                request,
                                requirements,
                                List.copyOf(toExtract),
                                state.outstandingQuestions()));
        Set<String> accepted = new LinkedHashSet<>(requirements.knownFields());
        accepted.addAll(outstanding);
        merge(fields, extracted, accepted);
        requirements.applyAliases(fields);

        List<String> stillMissing = new ArrayList<>();
        for (String field : outstanding) {
            if (fields.isFilled(field)) {
                continue;
            }
            if (requirements.required().contains(field)) {
                stillMissing.add(field);
            } else {
                logger.fine("Dropping unanswered optional field " + field);
            }
        }

        if (stillMissing.isEmpty()) {
            store.delete(request.sessionId());
            logger.info("Resumed and resolved session " + request.sessionId());
            return ClarificationResult.resolved(fields, plan, true);
        }

        FollowUpQuestions questions = questionsFor(request, fields, stillMissing);
        store.save(state.revise(fields, questions.questions()));
        logger.info(
                "Session "
                        + request.sessionId()
                        + " still suspended, missing fields: "
                        + stillMissing);
        return ClarificationResult.suspended(fields, questions, stillMissing, plan, true);
    }

    private static FieldSet mergeSeed(FieldSet stored, FieldSet seed) {
        FieldSet merged = stored.copy();
        merged.putAll(seed);
        return merged;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static List<String> recompute(FieldRequirements requirements, FieldSet fields) {
        requirements.applyAliases(fields);
        return requirements.missingRequired(fields);
    }

    private ExtractionRequest extractionRequest(
            ClarificationRequest request,
            FieldRequirements requirements,
            List<String> fields,
            List<FollowUpQuestion> outstanding) {
        Map<String, String> types = new LinkedHashMap<>();
        for (String field : fields) {
            String type = requirements.fieldTypes().get(field);
            if (type != null) {
                types.put(field, type);
            }
        }
        String instruction = String.format(EXTRACTION_INSTRUCTION, LocalDate.now(clock));
        return new ExtractionRequest(
                instruction, fields, types, window(request.history()), request.utterance(), outstanding);
    }

    /// Keeps the last `historyWindow` user messages.
    private List<ConversationMessage> window(List<ConversationMessage> history) {
        List<ConversationMessage> userMessages =
                history.stream().filter(m -> m.role() == ConversationMessage.Role.USER).toList();
        int from = Math.max(0, userMessages.size() - settings.historyWindow());
        return userMessages.subList(from, userMessages.size());
    }

    private static void merge(FieldSet fields, Map<String, Object> extracted, Set<String> accepted) {
        if (extracted == null) {
            return;
        }
        extracted.forEach(
                (name, value) -> {
                    if (accepted.contains(name)) {
                        fields.put(name, value, Provenance.EXTRACTED);
                    }
                });
    }

    /// Generates one question per missing field, falling back to the field name
    /// when generation fails or skips a field.
    private FollowUpQuestions questionsFor(
            ClarificationRequest request, FieldSet fields, List<String> missing) {
        FollowUpQuestions generated;
        try {
            generated =
                    questionGenerator.generate(
                            new QuestionRequest(
                                    request.intent(), missing, fields.values(), request.utterance()));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Question generation failed; using fallback questions", e);
            generated = null;
        }

        Map<String, FollowUpQuestion> byField = new LinkedHashMap<>();
        if (generated != null) {
            for (FollowUpQuestion question : generated.questions()) {
                if (missing.contains(question.fieldName()) && !question.questionText().isBlank()) {
                    byField.putIfAbsent(question.fieldName(), question);
                }
            }
        }
        List<FollowUpQuestion> ordered = new ArrayList<>(missing.size());
        for (String field : missing) {
            ordered.add(byField.getOrDefault(field, FollowUpQuestion.fallback(field)));
        }
        return generated != null
                ? new FollowUpQuestions(generated.intro(), ordered, generated.closing())
                : FollowUpQuestions.of(ordered);
    }
}
