package io.tiller.core.execution;

import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.plan.PlanStep;
import io.tiller.core.router.RouterCheckpoint;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Runs an {@link ExecutionPlan} step by step.
///
/// ### Semantics
/// - Steps run in plan order; each step sees the outputs of all earlier steps.
/// - A `parallel` step fans its capabilities out on the executor and joins before
///   the next step starts.
/// - A failing or missing handler yields a `FAILURE` outcome; siblings and later
///   steps still run.
/// - A `CONSENT_REQUIRED` outcome halts execution after its step completes. The
///   report then carries a {@link ConsentHalt} from which {@link #resume} continues.
///
/// @implNote Thread-safe. The ExecutorService is owned by the caller and is NOT shut
/// down here.
public class PlanExecutor {

    private static final Logger logger = Logger.getLogger(PlanExecutor.class.getName());

    private final CapabilityHandlerRegistry handlers;
    private final ExecutorService executorService;
    private final Duration capabilityTimeout;

    /// Creates a plan executor.
    ///
    /// @param handlers handler lookup, not null
    /// @param executorService pool for parallel steps, not null
    /// @param capabilityTimeout upper bound for one parallel capability, positive
    public PlanExecutor(
            CapabilityHandlerRegistry handlers,
            ExecutorService executorService,
            Duration capabilityTimeout) {
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.capabilityTimeout =
                Objects.requireNonNull(capabilityTimeout, "capabilityTimeout must not be null");
    }

    /// Executes a plan.
    ///
    /// @param plan plan to run, not null
    /// @param invocation turn-level input; the capability name is replaced per run, not null
    /// @return outcomes in plan order, never null
    public ExecutionReport execute(ExecutionPlan plan, CapabilityInvocation invocation) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(invocation, "invocation must not be null");
        return runFrom(plan, 0, invocation, new ArrayList<>(), null);
    }

    /// Continues a plan that halted for consent.
    ///
    /// Outcomes recorded in the halt are kept as they are. In the halted step only
    /// the capabilities that did not finish run again, each from its routing
    /// checkpoint; later steps then run as usual.
    ///
    /// @param plan the plan that halted, not null
    /// @param invocation turn-level input carrying the confirmed consent, not null
    /// @param halt where the plan stopped, not null
    /// @return outcomes of the whole plan, the kept ones first, never null
    /// @throws IllegalArgumentException if the halted step is not part of the plan
    public ExecutionReport resume(
            ExecutionPlan plan, CapabilityInvocation invocation, ConsentHalt halt) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(invocation, "invocation must not be null");
        Objects.requireNonNull(halt, "halt must not be null");

        int index = -1;
        for (int i = 0; i < plan.steps().size(); i++) {
            if (plan.steps().get(i).id().equals(halt.stepId())) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new IllegalArgumentException("Halted step not in plan: " + halt.stepId());
        }
        logger.info("Resuming plan at step " + halt.stepId() + " after consent");
        return runFrom(plan, index, invocation, new ArrayList<>(halt.completed()), halt);
    }

    private ExecutionReport runFrom(
            ExecutionPlan plan,
            int fromStep,
            CapabilityInvocation invocation,
            List<CapabilityOutcome> outcomes,
            ConsentHalt resumed) {
        Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();
        outcomes.forEach(o -> outputs.put(o.capability(), o.output()));

        for (int i = fromStep; i < plan.steps().size(); i++) {
            PlanStep step = plan.steps().get(i);
            List<String> pending = step.capabilities();
            Map<String, RouterCheckpoint> checkpoints = Map.of();
            if (resumed != null && i == fromStep) {
                pending = pending.stream().filter(c -> !resumed.isCompleted(c)).toList();
                checkpoints = resumed.checkpoints();
            }

            List<CapabilityOutcome> stepOutcomes =
                    step.parallel() && pending.size() > 1
                            ? runParallel(step.id(), pending, invocation, outputs, checkpoints)
                            : runSequential(pending, invocation, outputs, checkpoints);
            for (CapabilityOutcome outcome : stepOutcomes) {
                outcomes.add(outcome);
                outputs.put(outcome.capability(), outcome.output());
            }
            if (stepOutcomes.stream().anyMatch(o -> o.status() == OutcomeStatus.CONSENT_REQUIRED)) {
                logger.info("Halting plan after step " + step.id() + ": consent required");
                return new ExecutionReport(
                        outcomes, ConsentHalt.at(step.id(), invocation.utterance(), outcomes));
            }
        }

        ExecutionReport report = ExecutionReport.completed(outcomes);
        if (!report.failedCapabilities().isEmpty()) {
            logger.warning("Partial failures in plan execution: " + report.failedCapabilities());
        }
        return report;
    }

    private List<CapabilityOutcome> runSequential(
            List<String> capabilities,
            CapabilityInvocation invocation,
            Map<String, Map<String, Object>> outputs,
            Map<String, RouterCheckpoint> checkpoints) {
        List<CapabilityOutcome> results = new ArrayList<>();
        for (String capability : capabilities) {
            CapabilityOutcome outcome =
                    run(
                            invocation
                                    .forCapability(capability, outputs)
                                    .resuming(checkpoints.get(capability)));
            outputs.put(capability, outcome.output());
            results.add(outcome);
        }
        return results;
    }

    private List<CapabilityOutcome> runParallel(
            String stepId,
            List<String> capabilities,
            CapabilityInvocation invocation,
            Map<String, Map<String, Object>> outputs,
            Map<String, RouterCheckpoint> checkpoints) {
        logger.info(
                "Executing parallel step: "
                        + stepId
                        + " with "
                        + capabilities.size()
                        + " capabilities");
        List<Future<CapabilityOutcome>> futures = new ArrayList<>();
        for (String capability : capabilities) {
            CapabilityInvocation scoped =
                    invocation
                            .forCapability(capability, outputs)
                            .resuming(checkpoints.get(capability));
            futures.add(executorService.submit(() -> run(scoped)));
        }

        List<CapabilityOutcome> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Future<CapabilityOutcome> future = futures.get(i);
            String capability = capabilities.get(i);
            try {
                results.add(future.get(capabilityTimeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                logger.warning(
                        "Capability timed out after "
                                + capabilityTimeout.toMillis()
                                + "ms: "
                                + capability);
                results.add(CapabilityOutcome.failure(capability, "timeout"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                results.add(CapabilityOutcome.failure(capability, cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Parallel step interrupted: " + stepId, e);
            }
        }
        return results;
    }

    /// Never throws; handler failures become `FAILURE` outcomes.
    private CapabilityOutcome run(CapabilityInvocation invocation) {
        String capability = invocation.capability();
        CapabilityHandler handler = handlers.get(capability).orElse(null);
        if (handler == null) {
            logger.warning("No handler registered for capability: " + capability);
            return CapabilityOutcome.failure(capability, "no handler registered");
        }
        try {
            CapabilityOutcome outcome = handler.handle(invocation);
            return outcome != null
                    ? outcome
                    : CapabilityOutcome.failure(capability, "handler returned no outcome");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CapabilityOutcome.failure(capability, "interrupted");
        } catch (Exception e) {
            logger.warning(
                    "Capability failed: "
                            + capability
                            + " - "
                            + e.getClass().getSimpleName()
                            + ": "
                            + e.getMessage());
            return CapabilityOutcome.failure(
                    capability, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
