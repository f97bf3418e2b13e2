package io.tiller.core.plan;

import io.tiller.core.contract.Contract;
import io.tiller.core.contract.ContractRegistry;
import io.tiller.core.contract.UnknownCapabilityException;
import java.util.HashSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/// Structural and ordering checks for execution plans.
///
/// Computed plans satisfy these checks by construction; pre-authored templates
/// are checked before use so a bad template fails at startup or first use
/// rather than mid-execution.
///
/// ### Checks
/// - every step id is unique
/// - every capability name is registered
/// - no capability appears twice
/// - every predecessor/successor pair present in the plan is ordered
///
/// @implNote Thread-safe. Stateless beyond the registry reference.
public class PlanValidator {

    private final ContractRegistry registry;

    public PlanValidator(ContractRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Validates a plan.
    ///
    /// @param plan the plan to check, not null
    /// @throws PlanningException if the plan is structurally invalid or violates ordering
    /// @throws UnknownCapabilityException if a step references an unregistered capability
    public void validate(ExecutionPlan plan) throws PlanningException {
        Objects.requireNonNull(plan, "plan must not be null");

        Set<String> stepIds = new HashSet<>();
        Set<String> seen = new HashSet<>();
        for (PlanStep step : plan.steps()) {
            if (!stepIds.add(step.id())) {
                throw new PlanningException("Duplicate step id: " + step.id());
            }
            for (String capability : step.capabilities()) {
                if (!registry.contains(capability)) {
                    throw new UnknownCapabilityException(capability);
                }
                if (!seen.add(capability)) {
                    throw new PlanningException(
                            "Capability planned more than once: " + capability,
                            Set.of(capability));
                }
            }
        }

        for (String capability : seen) {
            Contract contract = registry.require(capability);
            int index = plan.stepIndexOf(capability).orElseThrow();
            for (String predecessor : contract.predecessors()) {
                checkOrder(plan, predecessor, capability);
            }
            for (String successor : contract.successors()) {
                OptionalInt after = plan.stepIndexOf(successor);
                if (after.isPresent() && after.getAsInt() < index) {
                    throw orderViolation(capability, successor);
                }
            }
        }
    }

    private static void checkOrder(ExecutionPlan plan, String before, String after)
            throws PlanningException {
        OptionalInt beforeIndex = plan.stepIndexOf(before);
        OptionalInt afterIndex = plan.stepIndexOf(after);
        if (beforeIndex.isPresent()
                && afterIndex.isPresent()
                && beforeIndex.getAsInt() > afterIndex.getAsInt()) {
            throw orderViolation(before, after);
        }
    }

    private static PlanningException orderViolation(String before, String after) {
        return new PlanningException(
                "Plan runs '" + after + "' before its predecessor '" + before + "'",
                Set.of(before, after));
    }
}
