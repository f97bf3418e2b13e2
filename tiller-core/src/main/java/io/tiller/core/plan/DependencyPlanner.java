package io.tiller.core.plan;

import io.tiller.core.contract.Contract;
import io.tiller.core.contract.ContractRegistry;
import io.tiller.core.contract.DefaultMode;
import io.tiller.core.contract.UnknownCapabilityException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Converts a set of selected capabilities into a dependency-ordered {@link ExecutionPlan}.
///
/// ### Algorithm
/// 1. **Expansion**: breadth-first closure over predecessors and successors of
///    the selected capabilities. Contracts with {@link DefaultMode#ALWAYS_REQUIRED}
///    are always added; {@link DefaultMode#ALWAYS_OPTIONAL} contracts are added once
///    all of their predecessors are present. Dependencies on contracts that do not
///    apply to the intent are skipped.
/// 2. **Graph build**: `P -> C` for each predecessor `P` of `C`, `C -> S` for each
///    successor `S` of `C`, restricted to expanded capabilities.
/// 3. **Kahn's sort**: among ready capabilities, those without an order hint go
///    first in discovery order, then hinted ones by ascending hint.
/// 4. **Cycle check**: leftover capabilities fail the plan with a
///    {@link PlanningException}.
///
/// When a template exists for the request's intent and complexity, the template is
/// validated and returned instead.
///
/// ### Contracts
/// - **Postcondition**: every returned plan is a linear extension of all
///   predecessor/successor edges among its capabilities
/// - **Postcondition**: never silently drops a capability to break a cycle
///
/// ### Usage
/// {@snippet :
/// DependencyPlanner planner = new DependencyPlanner(registry);
/// ExecutionPlan plan = planner.plan(PlanningRequest.of("travel", "travel_search_hotels"));
/// }
///
/// @implNote Thread-safe. Holds no per-request state.
///
/// @see PlanValidator
/// @see PlanTemplates
public class DependencyPlanner {

    private static final Logger logger = Logger.getLogger(DependencyPlanner.class.getName());

    private static final Comparator<Node> READY_ORDER =
            Comparator.<Node>comparingInt(n -> n.hint != null ? 1 : 0)
                    .thenComparingInt(n -> n.hint != null ? n.hint : 0)
                    .thenComparingInt(n -> n.discoveryIndex);

    private final ContractRegistry registry;
    private final PlanTemplates templates;
    private final PlanValidator validator;
    private final String epilogue;

    public DependencyPlanner(ContractRegistry registry) {
        this(registry, new PlanTemplates(), null);
    }

    /// Creates a planner.
    ///
    /// @param registry contract source, not null
    /// @param templates pre-authored plans, not null (may be empty)
    /// @param epilogue capability forced to the final step when planned and
    ///        nothing is ordered after it, may be null
    public DependencyPlanner(ContractRegistry registry, PlanTemplates templates, String epilogue) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.validator = new PlanValidator(registry);
        this.epilogue = epilogue;
    }

    /// Produces the execution plan for a request.
    ///
    /// @param request intent, selection and complexity, not null
    /// @return validated plan, never null
    /// @throws PlanningException if the dependency graph is cyclic or a template is invalid
    /// @throws UnknownCapabilityException if a selected or referenced capability is unknown
    public ExecutionPlan plan(PlanningRequest request) throws PlanningException {
        Objects.requireNonNull(request, "request must not be null");

        Optional<ExecutionPlan> template = templates.find(request.intent(), request.complexity());
        if (template.isPresent()) {
            validator.validate(template.get());
            logger.fine(
                    "Using template plan for intent="
                            + request.intent()
                            + ", complexity="
                            + request.complexity());
            return template.get();
        }

        Set<String> expanded = expand(request.selected(), request.intent());
        List<String> ordered = order(expanded);
        ExecutionPlan plan = ExecutionPlan.sequential(moveEpilogueLast(ordered));

        logger.info(
                "Planned "
                        + plan.steps().size()
                        + " step(s) for intent="
                        + request.intent()
                        + ": "
                        + plan.capabilityNames());
        return plan;
    }

    /// Expands a selection to its dependency closure for an intent.
    ///
    /// @param selected entry-point capability names, not null
    /// @param intent active intent, not null
    /// @return expanded names in discovery order, never null
    /// @throws UnknownCapabilityException if any name is not registered
    public Set<String> expand(Set<String> selected, String intent) {
        Objects.requireNonNull(selected, "selected must not be null");
        Objects.requireNonNull(intent, "intent must not be null");

        Set<String> accumulated = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String name : selected) {
            registry.require(name);
            if (accumulated.add(name)) {
                queue.add(name);
            }
        }

        List<Contract> intentContracts = registry.forIntent(intent);
        boolean changed = true;
        while (changed) {
            drain(queue, accumulated, intent);

            changed = false;
            for (Contract contract : intentContracts) {
                if (accumulated.contains(contract.name()) || !isDefaultReady(contract, accumulated)) {
                    continue;
                }
                accumulated.add(contract.name());
                queue.add(contract.name());
                changed = true;
            }
        }
        return accumulated;
    }

    /// Orders capabilities topologically.
    ///
    /// @param capabilities names to order, in discovery order, not null
    /// @return ordered names, never null
    /// @throws PlanningException if the capabilities contain a dependency cycle
    public List<String> order(Set<String> capabilities) throws PlanningException {
        Objects.requireNonNull(capabilities, "capabilities must not be null");

        Map<String, Node> nodes = new LinkedHashMap<>();
        int index = 0;
        for (String name : capabilities) {
            nodes.put(name, new Node(registry.require(name), index++));
        }

        for (Node node : nodes.values()) {
            for (String predecessor : node.contract.predecessors()) {
                link(nodes.get(predecessor), node);
            }
            for (String successor : node.contract.successors()) {
                link(node, nodes.get(successor));
            }
        }

        PriorityQueue<Node> ready = new PriorityQueue<>(READY_ORDER);
        nodes.values().stream().filter(n -> n.inDegree == 0).forEach(ready::add);

        List<String> ordered = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            Node next = ready.poll();
            ordered.add(next.contract.name());
            for (Node target : next.outgoing) {
                if (--target.inDegree == 0) {
                    ready.add(target);
                }
            }
        }

        if (ordered.size() < nodes.size()) {
            Set<String> unresolved = new LinkedHashSet<>(nodes.keySet());
            ordered.forEach(unresolved::remove);
            Set<String> cyclic = cyclicSubset(unresolved, nodes);
            throw new PlanningException(
                    "Cyclic dependency between capabilities: " + new TreeSet<>(cyclic),
                    cyclic);
        }
        return ordered;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private void drain(Deque<String> queue, Set<String> accumulated, String intent) {
        while (!queue.isEmpty()) {
            Contract contract = registry.require(queue.poll());
            List<String> neighbours = new ArrayList<>(contract.predecessors());
            neighbours.addAll(contract.successors());
            for (String neighbour : neighbours) {
                Contract dependency = registry.require(neighbour);
                if (!dependency.appliesTo(intent)) {
                    logger.fine(
                            "Skipping dependency "
                                    + neighbour
                                    + " of "
                                    + contract.name()
                                    + ": not applicable to intent "
                                    + intent);
                    continue;
                }
                if (accumulated.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
    }

    private static boolean isDefaultReady(Contract contract, Set<String> accumulated) {
        if (contract.defaultMode() == DefaultMode.ALWAYS_REQUIRED) {
            return true;
        }
        return contract.defaultMode() == DefaultMode.ALWAYS_OPTIONAL
                && !contract.predecessors().isEmpty()
                && accumulated.containsAll(contract.predecessors());
    }

    private static void link(Node from, Node to) {
        if (from == null || to == null) {
            return;
        }
        if (from.outgoing.add(to)) {
            to.inDegree++;
        }
    }

    /// Narrows the unsorted remainder to capabilities that sit on a cycle;
    /// the rest of the remainder is only blocked downstream of one.
    private static Set<String> cyclicSubset(Set<String> unresolved, Map<String, Node> nodes) {
        Set<String> cyclic = new LinkedHashSet<>();
        for (String name : unresolved) {
            Node start = nodes.get(name);
            if (reaches(start, start)) {
                cyclic.add(name);
            }
        }
        return cyclic.isEmpty() ? unresolved : cyclic;
    }

    private static boolean reaches(Node from, Node target) {
        Deque<Node> stack = new ArrayDeque<>(from.outgoing);
        Set<Node> visited = new HashSet<>();
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            if (current == target) {
                return true;
            }
            if (visited.add(current)) {
                stack.addAll(current.outgoing);
            }
        }
        return false;
    }

    private List<String> moveEpilogueLast(List<String> ordered) {
        if (epilogue == null || !ordered.contains(epilogue) || ordered.size() < 2) {
            return ordered;
        }
        Contract contract = registry.require(epilogue);
        boolean constrainedAfter =
                contract.successors().stream().anyMatch(ordered::contains)
                        || ordered.stream()
                                .map(registry::require)
                                .anyMatch(c -> c.predecessors().contains(epilogue));
        if (constrainedAfter) {
            logger.warning(
                    "Epilogue capability " + epilogue + " has planned successors; keeping order");
            return ordered;
        }
        List<String> result = new ArrayList<>(ordered);
        result.remove(epilogue);
        result.add(epilogue);
        return result;
    }

    private static final class Node {
        private final Contract contract;
        private final Integer hint;
        private final int discoveryIndex;
        private final Set<Node> outgoing = new LinkedHashSet<>();
        private int inDegree;

        private Node(Contract contract, int discoveryIndex) {
            this.contract = contract;
            this.hint = contract.orderHint();
            this.discoveryIndex = discoveryIndex;
        }
    }
}
