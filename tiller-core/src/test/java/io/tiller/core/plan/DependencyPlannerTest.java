package io.tiller.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tiller.core.contract.Contract;
import io.tiller.core.contract.DefaultContractRegistry;
import io.tiller.core.contract.DefaultMode;
import io.tiller.core.contract.UnknownCapabilityException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DependencyPlannerTest {

    private DefaultContractRegistry registry;
    private DependencyPlanner planner;

    @BeforeEach
    void setUp() {
        registry = new DefaultContractRegistry();
        planner = new DependencyPlanner(registry);
    }

    private static Set<String> ordered(String... names) {
        return new LinkedHashSet<>(List.of(names));
    }

    @Nested
    class Ordering {

        @Test
        void shouldPlacePredecessorsBeforeDependents() throws Exception {
            registry.register(Contract.builder("geo").intent("travel").build());
            registry.register(
                    Contract.builder("flights").intent("travel").predecessors("geo").build());
            registry.register(
                    Contract.builder("hotels").intent("travel").predecessors("flights").build());

            ExecutionPlan plan = planner.plan(PlanningRequest.of("travel", "hotels"));

            assertThat(plan.capabilityNames()).containsExactly("geo", "flights", "hotels");
            assertThat(plan.steps()).allSatisfy(step -> assertThat(step.parallel()).isFalse());
        }

        @Test
        void shouldTreatSuccessorsAsReverseEdges() throws Exception {
            registry.register(Contract.builder("search").intent("product").successors("rank").build());
            registry.register(Contract.builder("rank").intent("product").build());

            ExecutionPlan plan = planner.plan(PlanningRequest.of("product", "rank", "search"));

            assertThat(plan.capabilityNames()).containsExactly("search", "rank");
        }

        @Test
        void shouldOrderUnhintedBeforeHinted() throws Exception {
            registry.register(Contract.builder("late").orderHint(10).build());
            registry.register(Contract.builder("early").orderHint(1).build());
            registry.register(Contract.builder("free").build());

            List<String> order = planner.order(ordered("late", "early", "free"));

            assertThat(order).containsExactly("free", "early", "late");
        }

        @Test
        void shouldKeepDiscoveryOrderAmongEqualCandidates() throws Exception {
            registry.register(Contract.builder("b").build());
            registry.register(Contract.builder("a").build());

            assertThat(planner.order(ordered("b", "a"))).containsExactly("b", "a");
        }

        @Test
        void shouldRespectEveryEdgeOfRandomAcyclicGraphs() throws Exception {
            Random random = new Random(20260301L);
            for (int round = 0; round < 200; round++) {
                DefaultContractRegistry graph = new DefaultContractRegistry();
                int size = 2 + random.nextInt(14);
                List<String> names = new ArrayList<>();
                for (int i = 0; i < size; i++) {
                    names.add("c" + i);
                }

                // Edges only point from a lower to a higher index, so the graph is acyclic.
                List<List<String>> predecessors = new ArrayList<>();
                List<List<String>> successors = new ArrayList<>();
                List<int[]> edges = new ArrayList<>();
                for (int i = 0; i < size; i++) {
                    predecessors.add(new ArrayList<>());
                    successors.add(new ArrayList<>());
                }
                for (int from = 0; from < size; from++) {
                    for (int to = from + 1; to < size; to++) {
                        if (random.nextInt(4) != 0) {
                            continue;
                        }
                        edges.add(new int[] {from, to});
                        if (random.nextBoolean()) {
                            predecessors.get(to).add(names.get(from));
                        } else {
                            successors.get(from).add(names.get(to));
                        }
                    }
                }

                List<Integer> registration = new ArrayList<>();
                for (int i = 0; i < size; i++) {
                    registration.add(i);
                }
                Collections.shuffle(registration, random);
                for (int i : registration) {
                    Contract.Builder builder =
                            Contract.builder(names.get(i))
                                    .predecessors(predecessors.get(i).toArray(String[]::new))
                                    .successors(successors.get(i).toArray(String[]::new));
                    if (random.nextBoolean()) {
                        builder.orderHint(random.nextInt(5));
                    }
                    graph.register(builder.build());
                }

                Set<String> discovery = new LinkedHashSet<>();
                registration.forEach(i -> discovery.add(names.get(i)));
                List<String> order = new DependencyPlanner(graph).order(discovery);

                assertThat(order).containsExactlyInAnyOrderElementsOf(names);
                for (int[] edge : edges) {
                    assertThat(order.indexOf(names.get(edge[0])))
                            .as("round %d: %s before %s", round, names.get(edge[0]), names.get(edge[1]))
                            .isLessThan(order.indexOf(names.get(edge[1])));
                }
            }
        }

        @Test
        void shouldFailWithCycleMembers() {
            registry.register(Contract.builder("a").predecessors("b").build());
            registry.register(Contract.builder("b").predecessors("a").build());
            registry.register(Contract.builder("c").predecessors("a").build());
            registry.register(Contract.builder("d").build());

            assertThatThrownBy(() -> planner.order(ordered("a", "b", "c", "d")))
                    .isInstanceOf(PlanningException.class)
                    .hasMessageContaining("[a, b]")
                    .satisfies(
                            e ->
                                    assertThat(((PlanningException) e).getUnresolved())
                                            .containsExactlyInAnyOrder("a", "b"));
        }
    }

    @Nested
    class Expansion {

        @Test
        void shouldAddAlwaysRequiredContracts() {
            registry.register(Contract.builder("hotels").intent("travel").build());
            registry.register(
                    Contract.builder("safety")
                            .intent("travel")
                            .defaultMode(DefaultMode.ALWAYS_REQUIRED)
                            .build());

            assertThat(planner.expand(ordered("hotels"), "travel"))
                    .containsExactly("hotels", "safety");
        }

        @Test
        void shouldAddAlwaysOptionalOnlyWhenPredecessorsPresent() {
            registry.register(Contract.builder("hotels").intent("travel").build());
            registry.register(Contract.builder("flights").intent("travel").build());
            registry.register(
                    Contract.builder("bundle")
                            .intent("travel")
                            .predecessors("hotels", "flights")
                            .defaultMode(DefaultMode.ALWAYS_OPTIONAL)
                            .build());

            assertThat(planner.expand(ordered("hotels"), "travel")).containsExactly("hotels");
            assertThat(planner.expand(ordered("hotels", "flights"), "travel"))
                    .containsExactly("hotels", "flights", "bundle");
        }

        @Test
        void shouldSkipDependenciesOfOtherIntents() {
            registry.register(Contract.builder("reviews").intent("review_deep_dive").build());
            registry.register(
                    Contract.builder("hotels").intent("travel").predecessors("reviews").build());

            assertThat(planner.expand(ordered("hotels"), "travel")).containsExactly("hotels");
        }

        @Test
        void shouldRejectUnknownSelection() {
            assertThatThrownBy(() -> planner.expand(ordered("ghost"), "travel"))
                    .isInstanceOf(UnknownCapabilityException.class);
        }
    }

    @Nested
    class TemplatesAndEpilogue {

        @Test
        void shouldReturnTemplateForMatchingComplexity() throws Exception {
            registry.register(Contract.builder("search").build());
            registry.register(Contract.builder("reviews").build());
            registry.register(Contract.builder("summary").build());
            PlanTemplates templates = new PlanTemplates();
            ExecutionPlan template =
                    ExecutionPlan.of(
                            PlanStep.parallel("gather", "search", "reviews"),
                            PlanStep.single("write", "summary"));
            templates.register("product", QueryComplexity.DEEP_RESEARCH, template);
            DependencyPlanner templated = new DependencyPlanner(registry, templates, null);

            ExecutionPlan plan =
                    templated.plan(
                            new PlanningRequest(
                                    "product", Set.of("search"), QueryComplexity.DEEP_RESEARCH));

            assertThat(plan).isEqualTo(template);
        }

        @Test
        void shouldRejectTemplateWithUnknownCapability() {
            PlanTemplates templates = new PlanTemplates();
            templates.register("product", ExecutionPlan.sequential(List.of("ghost")));
            DependencyPlanner templated = new DependencyPlanner(registry, templates, null);

            assertThatThrownBy(() -> templated.plan(PlanningRequest.of("product")))
                    .isInstanceOf(UnknownCapabilityException.class);
        }

        @Test
        void shouldMoveEpilogueToTheEnd() throws Exception {
            registry.register(Contract.builder("next_step_suggestion").build());
            registry.register(Contract.builder("search").build());
            DependencyPlanner withEpilogue =
                    new DependencyPlanner(registry, new PlanTemplates(), "next_step_suggestion");

            ExecutionPlan plan =
                    withEpilogue.plan(
                            PlanningRequest.of("product", "next_step_suggestion", "search"));

            assertThat(plan.capabilityNames()).containsExactly("search", "next_step_suggestion");
        }
    }
}
