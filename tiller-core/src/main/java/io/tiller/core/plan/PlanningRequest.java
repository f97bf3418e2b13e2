package io.tiller.core.plan;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Input to {@link DependencyPlanner#plan(PlanningRequest)}.
///
/// @param intent active intent, not null
/// @param selected entry-point capability names in selection order, never null
/// @param complexity complexity class for template lookup, may be null
public record PlanningRequest(String intent, Set<String> selected, QueryComplexity complexity) {

    public PlanningRequest {
        Objects.requireNonNull(intent, "intent must not be null");
        selected =
                selected != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(selected))
                        : Set.of();
    }

    public static PlanningRequest of(String intent, String... selected) {
        return new PlanningRequest(intent, new LinkedHashSet<>(List.of(selected)), null);
    }
}
