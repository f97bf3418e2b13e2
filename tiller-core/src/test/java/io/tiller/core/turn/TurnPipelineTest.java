package io.tiller.core.turn;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.tiller.core.MutableClock;
import io.tiller.core.TillerConfig;
import io.tiller.core.TillerEnvironment;
import io.tiller.core.TillerFactory;
import io.tiller.core.contract.Contract;
import io.tiller.core.contract.DefaultContractRegistry;
import io.tiller.core.degradation.DegradationPolicy;
import io.tiller.core.execution.CapabilityInvocation;
import io.tiller.core.execution.CapabilityOutcome;
import io.tiller.core.execution.OutcomeStatus;
import io.tiller.core.router.ConsentFlags;
import io.tiller.core.router.ConsentRecord;
import io.tiller.core.router.ConsentType;
import io.tiller.core.router.InMemoryConsentLedger;
import io.tiller.core.router.ResultItem;
import io.tiller.core.router.RouterCheckpoint;
import io.tiller.core.router.SourceDefinition;
import io.tiller.core.router.SourcePayload;
import io.tiller.core.router.SourceRegistry;
import io.tiller.core.router.StaticTierRoutingTable;
import io.tiller.core.slot.ExtractionService;
import io.tiller.core.suspend.SuspendState;
import io.tiller.core.suspend.SuspendStateRepository;
import io.tiller.core.suspend.SuspendStateStore;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TurnPipelineTest {

    private MutableClock clock;
    private DefaultContractRegistry registry;
    private ExtractionService extraction;
    private InMemoryConsentLedger ledger;
    private List<CapabilityInvocation> hotelCalls;
    private List<String> fetched;
    private TillerEnvironment env;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        registry = new DefaultContractRegistry();
        registry.register(
                Contract.builder("travel_search_hotels")
                        .intent("travel")
                        .requiredFields("destination", "check_in")
                        .build());
        registry.register(Contract.builder("product_search").intent("product").build());
        extraction = mock(ExtractionService.class);
        ledger = new InMemoryConsentLedger();
        hotelCalls = new CopyOnWriteArrayList<>();
        fetched = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (env != null) {
            env.close();
        }
    }

    private TillerEnvironment build(SuspendStateRepository repository, DegradationPolicy policy) {
        SourceRegistry sources = new SourceRegistry();
        sources.register(SourceDefinition.of("affiliate", "affiliate", 1));
        sources.register(SourceDefinition.of("forum", "forum", 3));
        TillerFactory.Builder builder =
                TillerFactory.builder()
                        .config(TillerConfig.builder().threadPoolSize(2).tiers(1, 2).build())
                        .contractRegistry(registry)
                        .extractionService(extraction)
                        .sourceRegistry(sources)
                        .routingTable(
                                StaticTierRoutingTable.builder()
                                        .route("product", 1, "affiliate")
                                        .route("product", 2, "forum")
                                        .build())
                        .sourceFetcher(
                                (source, request) -> {
                                    fetched.add(source.name());
                                    return source.name().equals("affiliate")
                                            ? payload("a")
                                            : payload("b", "c", "d");
                                })
                        .consentLedger(ledger)
                        .routedCapability("product_search")
                        .handler(
                                "travel_search_hotels",
                                inv -> {
                                    hotelCalls.add(inv);
                                    return CapabilityOutcome.success(
                                            inv.capability(), Map.of("hotels", 2));
                                })
                        .clock(clock);
        if (repository != null) {
            builder.suspendRepository(repository);
        }
        if (policy != null) {
            builder.degradationPolicy(policy);
        }
        env = builder.build();
        return env;
    }

    private static SourcePayload payload(String... names) {
        return new SourcePayload(
                Arrays.stream(names)
                        .map(n -> ResultItem.of(n, BigDecimal.ONE))
                        .toList(),
                List.of());
    }

    @Nested
    class Clarification {

        @Test
        void shouldAskThenResumeAndExecuteWithMergedFields() throws Exception {
            TillerEnvironment env = build(null, null);
            when(extraction.extract(any()))
                    .thenReturn(Map.of("destination", "Lisbon"))
                    .thenReturn(Map.of("check_in", "2026-04-02"));

            TurnOutcome first =
                    env.getTurnPipeline()
                            .handle(
                                    TurnRequest.of(
                                            "s1", "travel", "Hotels in Lisbon", "travel_search_hotels"),
                                    env.newSuspendStore());

            assertThat(first.status()).isEqualTo(TurnStatus.CLARIFYING);
            assertThat(first.missingFields()).containsExactly("check_in");
            assertThat(first.executionReport()).isEmpty();
            assertThat(hotelCalls).isEmpty();

            TurnOutcome second =
                    env.getTurnPipeline()
                            .handle(TurnRequest.of("s1", "travel", "April 2nd"), env.newSuspendStore());

            assertThat(second.status()).isEqualTo(TurnStatus.COMPLETED);
            assertThat(second.resumed()).isTrue();
            assertThat(hotelCalls)
                    .singleElement()
                    .satisfies(
                            inv ->
                                    assertThat(inv.fields())
                                            .containsEntry("destination", "Lisbon")
                                            .containsEntry("check_in", "2026-04-02"));
            assertThat(env.getSuspendRepository().find("s1")).isEmpty();
        }

        @Test
        void shouldCompleteWithEmptyReportWhenNothingIsSelected() throws Exception {
            TillerEnvironment env = build(null, null);

            TurnOutcome outcome =
                    env.getTurnPipeline()
                            .handle(TurnRequest.of("s1", "travel", "hello"), env.newSuspendStore());

            assertThat(outcome.status()).isEqualTo(TurnStatus.COMPLETED);
            assertThat(outcome.report().outcomes()).isEmpty();
        }
    }

    @Nested
    class Consent {

        @Test
        void shouldPromptAndThenSearchDeeperOnConfirmation() throws Exception {
            TillerEnvironment env = build(null, null);

            TurnOutcome prompt =
                    env.getTurnPipeline()
                            .handle(
                                    TurnRequest.of("s1", "product", "headphones", "product_search"),
                                    env.newSuspendStore());

            assertThat(prompt.status()).isEqualTo(TurnStatus.CONSENT_REQUIRED);
            assertThat(prompt.consentPrompt().tier()).isEqualTo(2);
            assertThat(prompt.consentPrompt().type()).isEqualTo(ConsentType.PER_QUERY);
            assertThat(ledger.records()).isEmpty();

            TurnRequest confirm =
                    new TurnRequest(
                            "s1",
                            "u1",
                            "product",
                            "headphones",
                            List.of(),
                            Set.of("product_search"),
                            null,
                            Map.of(),
                            "consent_confirm",
                            false);
            TurnOutcome deeper = env.getTurnPipeline().handle(confirm, env.newSuspendStore());

            assertThat(deeper.status()).isEqualTo(TurnStatus.COMPLETED);
            assertThat(deeper.resumed()).isTrue();
            assertThat(deeper.report().outcome("product_search").orElseThrow().status())
                    .isEqualTo(OutcomeStatus.SUCCESS);
            assertThat(deeper.report().outputs().get("product_search"))
                    .containsEntry("tier_reached", 2);
            assertThat(ledger.records()).extracting(ConsentRecord::actorId).containsExactly("u1");
            assertThat(fetched).containsExactly("affiliate", "forum");
        }

        @Test
        void shouldKeepHaltedPlanInSuspendStore() throws Exception {
            TillerEnvironment env = build(null, null);

            env.getTurnPipeline()
                    .handle(
                            TurnRequest.of("s1", "product", "headphones", "product_search"),
                            env.newSuspendStore());

            SuspendState kept = env.getSuspendRepository().find("s1").orElseThrow();
            assertThat(kept.isAwaitingConsent()).isTrue();
            assertThat(kept.isSuspended()).isFalse();
            assertThat(kept.intent()).isEqualTo("product");
            assertThat(kept.plan().capabilityNames()).containsExactly("product_search");
            assertThat(kept.consentHalt().utterance()).isEqualTo("headphones");
            RouterCheckpoint checkpoint = kept.consentHalt().checkpoints().get("product_search");
            assertThat(checkpoint.resumeTier()).isEqualTo(2);
            assertThat(checkpoint.tierReached()).isEqualTo(1);
            assertThat(checkpoint.items()).extracting(ResultItem::name).containsExactly("a");
        }

        @Test
        void shouldContinueHaltedPlanOnPlainConfirmation() throws Exception {
            TillerEnvironment env = build(null, null);
            env.getTurnPipeline()
                    .handle(
                            TurnRequest.of("s1", "product", "headphones", "product_search"),
                            env.newSuspendStore());

            TurnOutcome deeper =
                    env.getTurnPipeline()
                            .handle(TurnRequest.of("s1", "general", "yes please"), env.newSuspendStore());

            assertThat(deeper.status()).isEqualTo(TurnStatus.COMPLETED);
            assertThat(deeper.resumed()).isTrue();
            assertThat(deeper.plan().capabilityNames()).containsExactly("product_search");
            Map<String, Object> output = deeper.report().outputs().get("product_search");
            assertThat(output).containsEntry("tier_reached", 2);
            assertThat((List<?>) output.get("items")).hasSize(4);
            assertThat(fetched).containsExactly("affiliate", "forum");
            assertThat(env.getSuspendRepository().find("s1")).isEmpty();
        }

        @Test
        void shouldDropHaltWhenNextTurnIsNotConfirmation() throws Exception {
            TillerEnvironment env = build(null, null);
            env.getTurnPipeline()
                    .handle(
                            TurnRequest.of("s1", "product", "headphones", "product_search"),
                            env.newSuspendStore());
            when(extraction.extract(any()))
                    .thenReturn(Map.of("destination", "Lisbon", "check_in", "2026-04-02"));

            TurnOutcome other =
                    env.getTurnPipeline()
                            .handle(
                                    TurnRequest.of(
                                            "s1", "travel", "Hotels in Lisbon", "travel_search_hotels"),
                                    env.newSuspendStore());

            assertThat(other.status()).isEqualTo(TurnStatus.COMPLETED);
            assertThat(other.resumed()).isFalse();
            assertThat(hotelCalls).hasSize(1);
            assertThat(fetched).containsExactly("affiliate");
            assertThat(env.getSuspendRepository().find("s1")).isEmpty();
        }

        @Test
        void shouldDeriveConsentFlagsFromRequest() {
            TurnRequest standing =
                    new TurnRequest(
                            "s1", null, "product", "more", null, null, null, null, null, true);
            TurnRequest confirmed = TurnRequest.of("s1", "product", "yes");

            assertThat(TurnPipeline.consentFlags(standing)).isEqualTo(new ConsentFlags(true, false));
            assertThat(TurnPipeline.consentFlags(confirmed)).isEqualTo(new ConsentFlags(false, true));
        }
    }

    @Nested
    class SuspendStoreFailures {

        private SuspendStateRepository brokenRepository() {
            SuspendStateRepository repository = mock(SuspendStateRepository.class);
            when(repository.find(anyString())).thenThrow(new IllegalStateException("db down"));
            return repository;
        }

        @Test
        void shouldPropagateWhenFailClosed() {
            TillerEnvironment env = build(brokenRepository(), null);
            SuspendStateStore store = new SuspendStateStore(env.getSuspendRepository(), Duration.ofHours(1));

            assertThatThrownBy(
                            () ->
                                    env.getTurnPipeline()
                                            .handle(
                                                    TurnRequest.of(
                                                            "s1",
                                                            "travel",
                                                            "Hotels",
                                                            "travel_search_hotels"),
                                                    store))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("db down");
        }

        @Test
        void shouldTreatTurnAsFreshWhenFailOpen() throws Exception {
            DegradationPolicy open =
                    DegradationPolicy.withOverrides(
                            component ->
                                    component.equals(DegradationPolicy.SUSPEND_STORE)
                                            ? Optional.of("fail_open")
                                            : Optional.empty());
            TillerEnvironment env = build(brokenRepository(), open);

            TurnOutcome outcome =
                    env.getTurnPipeline()
                            .handle(
                                    TurnRequest.of("s1", "travel", "Hotels", "travel_search_hotels"),
                                    env.newSuspendStore());

            assertThat(outcome.status()).isEqualTo(TurnStatus.COMPLETED);
            assertThat(hotelCalls).hasSize(1);
        }
    }
}
