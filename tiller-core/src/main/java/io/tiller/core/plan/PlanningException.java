package io.tiller.core.plan;

import java.io.Serial;
import java.util.Set;

/// Thrown when a valid execution plan cannot be produced.
///
/// Raised for cyclic dependency graphs, malformed templates and plans that
/// violate a predecessor/successor constraint. Planning never drops a
/// constraint to recover.
///
/// @see DependencyPlanner#plan(PlanningRequest)
public class PlanningException extends Exception {

    @Serial private static final long serialVersionUID = -2264017893317659041L;

    private final Set<String> unresolved;

    public PlanningException(String message) {
        this(message, Set.of());
    }

    /// Creates an exception naming the capabilities that could not be ordered.
    ///
    /// @param message description of the failure
    /// @param unresolved capability names involved in the failure, not null
    public PlanningException(String message, Set<String> unresolved) {
        super(message);
        this.unresolved = Set.copyOf(unresolved);
    }

    /// Returns the capabilities the planner could not place.
    ///
    /// @return unmodifiable set, empty for structural failures
    public Set<String> getUnresolved() {
        return unresolved;
    }
}
