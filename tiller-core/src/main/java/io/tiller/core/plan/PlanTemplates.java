package io.tiller.core.plan;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Pre-authored plans keyed by intent and, optionally, complexity class.
///
/// Templates are the only source of `parallel=true` steps; the planner never
/// groups capabilities on its own. A template registered without a complexity
/// applies to every complexity of its intent unless a more specific one exists.
///
/// ### Usage
/// {@snippet :
/// PlanTemplates templates = new PlanTemplates();
/// templates.register("product", QueryComplexity.STANDARD, ExecutionPlan.of(
///     PlanStep.single("step_0", "product_extractor"),
///     PlanStep.parallel("step_1", "product_search", "product_evidence"),
///     PlanStep.single("step_2", "product_compose")));
/// }
///
/// @implNote Thread-safe.
public class PlanTemplates {

    private static final String ANY = "*";

    private final Map<String, ExecutionPlan> templates = new ConcurrentHashMap<>();

    /// Registers a template for one complexity class of an intent.
    ///
    /// @param intent intent name, not null
    /// @param complexity complexity class, or null for every class
    /// @param plan the template, not null
    public void register(String intent, QueryComplexity complexity, ExecutionPlan plan) {
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
        templates.put(key(intent, complexity), plan);
    }

    /// Registers a template for every complexity class of an intent.
    public void register(String intent, ExecutionPlan plan) {
        register(intent, null, plan);
    }

    /// Finds the most specific template for a request.
    ///
    /// @param intent intent name, not null
    /// @param complexity complexity class, may be null
    /// @return the template, or empty if the planner should compute the plan
    public Optional<ExecutionPlan> find(String intent, QueryComplexity complexity) {
        Objects.requireNonNull(intent, "intent must not be null");
        if (complexity != null) {
            ExecutionPlan specific = templates.get(key(intent, complexity));
            if (specific != null) {
                return Optional.of(specific);
            }
        }
        return Optional.ofNullable(templates.get(key(intent, null)));
    }

    public boolean isEmpty() {
        return templates.isEmpty();
    }

    private static String key(String intent, QueryComplexity complexity) {
        return intent + "#" + (complexity != null ? complexity.name() : ANY);
    }
}
