package io.tiller.core.plan;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/// Ordered list of {@link PlanStep}s produced for one turn.
///
/// Invariant: for any predecessor `A` and successor `B` both present in the plan,
/// the step holding `A` does not come after the step holding `B`. The
/// {@link DependencyPlanner} guarantees it for computed plans and
/// {@link PlanValidator} checks it for templates.
///
/// @param steps ordered steps, never null
/// @see DependencyPlanner
public record ExecutionPlan(List<PlanStep> steps) {

    private static final String STEP_ID_PREFIX = "step_";

    public ExecutionPlan {
        Objects.requireNonNull(steps, "steps must not be null");
        steps = List.copyOf(steps);
    }

    /// Creates a plan with one sequential step per capability, in the given order.
    ///
    /// @param capabilities ordered capability names, not null
    /// @return new plan with step ids `step_0`, `step_1`, ..., never null
    public static ExecutionPlan sequential(List<String> capabilities) {
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        List<PlanStep> steps =
                IntStream.range(0, capabilities.size())
                        .mapToObj(i -> PlanStep.single(STEP_ID_PREFIX + i, capabilities.get(i)))
                        .toList();
        return new ExecutionPlan(steps);
    }

    public static ExecutionPlan of(PlanStep... steps) {
        return new ExecutionPlan(List.of(steps));
    }

    /// Returns every capability name in step order.
    ///
    /// @return flattened names, never null
    public List<String> capabilityNames() {
        return steps.stream().flatMap(s -> s.capabilities().stream()).toList();
    }

    /// Returns the index of the step holding a capability.
    ///
    /// @param capability capability name, not null
    /// @return step index, or empty if the capability is not planned
    public OptionalInt stepIndexOf(String capability) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).capabilities().contains(capability)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
