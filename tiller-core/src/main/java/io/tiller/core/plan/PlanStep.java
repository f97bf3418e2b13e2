package io.tiller.core.plan;

import java.util.List;
import java.util.Objects;

/// A single step of an {@link ExecutionPlan}.
///
/// A sequential step carries exactly one capability. A parallel step fans its
/// capabilities out concurrently and joins before the next step starts.
///
/// ### Contracts
/// - **Precondition**: `id` not blank; `capabilities` not empty
/// - **Postcondition**: `capabilities` is unmodifiable
///
/// @param id step identifier, unique within a plan, not null
/// @param capabilities capability names invoked by this step, never empty
/// @param parallel whether the capabilities run concurrently
public record PlanStep(String id, List<String> capabilities, boolean parallel) {

    public PlanStep {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        if (capabilities.isEmpty()) {
            throw new IllegalArgumentException("Step " + id + " has no capabilities");
        }
        capabilities = List.copyOf(capabilities);
    }

    /// Creates a sequential single-capability step.
    ///
    /// @param id step identifier, not null
    /// @param capability capability name, not null
    /// @return new step, never null
    public static PlanStep single(String id, String capability) {
        return new PlanStep(id, List.of(capability), false);
    }

    /// Creates a parallel fan-out step.
    ///
    /// @param id step identifier, not null
    /// @param capabilities capability names to run concurrently, not empty
    /// @return new step, never null
    public static PlanStep parallel(String id, String... capabilities) {
        return new PlanStep(id, List.of(capabilities), true);
    }
}
