package io.tiller.core.execution;

/// Runs one capability of an execution plan.
///
/// Handlers are registered with a {@link CapabilityHandlerRegistry} under the
/// capability name they serve.
///
/// @see PlanExecutor
@FunctionalInterface
public interface CapabilityHandler {

    /// Runs the capability.
    ///
    /// @param invocation capability input, not null
    /// @return outcome, never null
    /// @throws Exception if the run fails; the executor records it as a failed outcome
    CapabilityOutcome handle(CapabilityInvocation invocation) throws Exception;
}
