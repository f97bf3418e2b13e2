package io.tiller.core;

import io.tiller.core.contract.ContractRegistry;
import io.tiller.core.contract.DefaultContractRegistry;
import io.tiller.core.degradation.DegradationPolicy;
import io.tiller.core.execution.CapabilityHandler;
import io.tiller.core.execution.CapabilityHandlerRegistry;
import io.tiller.core.execution.PlanExecutor;
import io.tiller.core.execution.TieredCapabilityHandler;
import io.tiller.core.plan.DependencyPlanner;
import io.tiller.core.plan.PlanTemplates;
import io.tiller.core.router.CircuitBreaker;
import io.tiller.core.router.ConsentLedger;
import io.tiller.core.router.FeatureFlags;
import io.tiller.core.router.InMemoryConsentLedger;
import io.tiller.core.router.InMemorySourceUsageLog;
import io.tiller.core.router.ParallelFetcher;
import io.tiller.core.router.SourceFetcher;
import io.tiller.core.router.SourceRegistry;
import io.tiller.core.router.SourceUsageLog;
import io.tiller.core.router.StaticTierRoutingTable;
import io.tiller.core.router.SufficiencyThreshold;
import io.tiller.core.router.SufficiencyValidator;
import io.tiller.core.router.TierRoutingTable;
import io.tiller.core.router.TieredRouter;
import io.tiller.core.slot.ExtractionService;
import io.tiller.core.slot.FieldDefaults;
import io.tiller.core.slot.QuestionGenerator;
import io.tiller.core.slot.SlotClarifier;
import io.tiller.core.suspend.InMemorySuspendStateRepository;
import io.tiller.core.suspend.SuspendStateRepository;
import io.tiller.core.turn.TurnPipeline;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for wiring {@link TillerEnvironment} instances.
///
/// Every collaborator has an in-memory or no-op default, so a builder with only a
/// contract registry already yields a working planner and clarifier. Extraction
/// defaults to "extract nothing", questions to the field-name fallback and source
/// fetching to an error, which the router reports as unavailable sources.
///
/// ### Usage
/// {@snippet :
/// TillerEnvironment env = TillerFactory.builder()
///     .config(TillerConfig.builder().tiers(2, 4).build())
///     .contractRegistry(registry)
///     .extractionService(extraction)
///     .sourceFetcher(fetcher)
///     .routedCapability("product_search")
///     .build();
/// }
///
/// @see TillerEnvironment
/// @see TillerConfig
public final class TillerFactory {

    private static final Logger logger = Logger.getLogger(TillerFactory.class.getName());

    private TillerFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link TillerEnvironment}.
    public static class Builder {
        private TillerConfig config = new TillerConfig();
        private ContractRegistry contractRegistry;
        private PlanTemplates templates;
        private SourceRegistry sourceRegistry;
        private TierRoutingTable routingTable;
        private FeatureFlags featureFlags;
        private Map<String, SufficiencyThreshold> thresholds;
        private SourceFetcher sourceFetcher;
        private ExtractionService extractionService;
        private QuestionGenerator questionGenerator;
        private FieldDefaults fieldDefaults;
        private DegradationPolicy degradationPolicy;
        private SuspendStateRepository suspendRepository;
        private ConsentLedger consentLedger;
        private SourceUsageLog usageLog;
        private ExecutorService executorService;
        private ExecutorService fetchExecutorService;
        private Clock clock = Clock.systemUTC();
        private final List<String> routedCapabilities = new ArrayList<>();
        private final Map<String, CapabilityHandler> handlers = new LinkedHashMap<>();

        private Builder() {}

        public Builder config(TillerConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder contractRegistry(ContractRegistry contractRegistry) {
            this.contractRegistry = contractRegistry;
            return this;
        }

        public Builder templates(PlanTemplates templates) {
            this.templates = templates;
            return this;
        }

        public Builder sourceRegistry(SourceRegistry sourceRegistry) {
            this.sourceRegistry = sourceRegistry;
            return this;
        }

        public Builder routingTable(TierRoutingTable routingTable) {
            this.routingTable = routingTable;
            return this;
        }

        public Builder featureFlags(FeatureFlags featureFlags) {
            this.featureFlags = featureFlags;
            return this;
        }

        public Builder thresholds(Map<String, SufficiencyThreshold> thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder sourceFetcher(SourceFetcher sourceFetcher) {
            this.sourceFetcher = sourceFetcher;
            return this;
        }

        public Builder extractionService(ExtractionService extractionService) {
            this.extractionService = extractionService;
            return this;
        }

        public Builder questionGenerator(QuestionGenerator questionGenerator) {
            this.questionGenerator = questionGenerator;
            return this;
        }

        public Builder fieldDefaults(FieldDefaults fieldDefaults) {
            this.fieldDefaults = fieldDefaults;
            return this;
        }

        public Builder degradationPolicy(DegradationPolicy degradationPolicy) {
            this.degradationPolicy = degradationPolicy;
            return this;
        }

        public Builder suspendRepository(SuspendStateRepository suspendRepository) {
            this.suspendRepository = suspendRepository;
            return this;
        }

        public Builder consentLedger(ConsentLedger consentLedger) {
            this.consentLedger = consentLedger;
            return this;
        }

        public Builder usageLog(SourceUsageLog usageLog) {
            this.usageLog = usageLog;
            return this;
        }

        /// Supplies the pool for parallel plan steps.
        /// {@link TillerEnvironment#close()} shuts it down.
        ///
        /// @param executorService pool, not null
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Supplies the pool for source fetches. Kept apart from the plan pool so that
        /// a parallel step waiting on fetches cannot starve them.
        ///
        /// @param fetchExecutorService pool, not null
        /// @return this builder for chaining, never null
        public Builder fetchExecutorService(ExecutorService fetchExecutorService) {
            this.fetchExecutorService = fetchExecutorService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /// Serves a capability through the tiered router.
        ///
        /// @param capability capability name, not null
        /// @return this builder for chaining, never null
        public Builder routedCapability(String capability) {
            routedCapabilities.add(Objects.requireNonNull(capability, "capability must not be null"));
            return this;
        }

        /// Serves a capability with a custom handler.
        ///
        /// @param capability capability name, not null
        /// @param handler handler, not null
        /// @return this builder for chaining, never null
        public Builder handler(String capability, CapabilityHandler handler) {
            handlers.put(
                    Objects.requireNonNull(capability, "capability must not be null"),
                    Objects.requireNonNull(handler, "handler must not be null"));
            return this;
        }

        /// Builds the environment, filling unset collaborators with defaults.
        ///
        /// @apiNote **Side effects**: creates fixed thread pools for those not provided
        ///
        /// @return the configured environment, never null
        public TillerEnvironment build() {
            if (contractRegistry == null) {
                contractRegistry = new DefaultContractRegistry();
            }
            if (templates == null) {
                templates = new PlanTemplates();
            }
            if (sourceRegistry == null) {
                sourceRegistry = new SourceRegistry();
            }
            if (routingTable == null) {
                routingTable = StaticTierRoutingTable.builder().build();
            }
            if (featureFlags == null) {
                featureFlags = FeatureFlags.allEnabled();
            }
            if (thresholds == null) {
                thresholds = SufficiencyThreshold.defaults();
            }
            if (sourceFetcher == null) {
                sourceFetcher =
                        (source, request) -> {
                            throw new IllegalStateException(
                                    "No source fetcher configured for " + source.provider());
                        };
            }
            if (extractionService == null) {
                extractionService = request -> Map.of();
            }
            if (questionGenerator == null) {
                questionGenerator = QuestionGenerator.fallback();
            }
            if (fieldDefaults == null) {
                fieldDefaults = FieldDefaults.none();
            }
            if (degradationPolicy == null) {
                degradationPolicy = DegradationPolicy.defaults();
            }
            if (suspendRepository == null) {
                suspendRepository = new InMemorySuspendStateRepository(clock);
            }
            if (consentLedger == null) {
                consentLedger = new InMemoryConsentLedger();
            }
            if (usageLog == null) {
                usageLog = new InMemorySourceUsageLog();
            }
            if (executorService == null) {
                executorService = Executors.newFixedThreadPool(config.getThreadPoolSize());
            }
            if (fetchExecutorService == null) {
                fetchExecutorService = Executors.newFixedThreadPool(config.getThreadPoolSize());
            }

            DependencyPlanner planner =
                    new DependencyPlanner(
                            contractRegistry, templates, config.getEpilogueCapability());
            SlotClarifier clarifier =
                    new SlotClarifier(
                            contractRegistry,
                            extractionService,
                            questionGenerator,
                            fieldDefaults,
                            degradationPolicy,
                            config.clarifierSettings(),
                            clock);
            CircuitBreaker circuitBreaker =
                    new CircuitBreaker(
                            config.getCircuitThreshold(), config.getCircuitResetTimeout(), clock);
            ParallelFetcher fetcher =
                    new ParallelFetcher(
                            fetchExecutorService,
                            sourceFetcher,
                            circuitBreaker,
                            usageLog,
                            degradationPolicy,
                            clock);
            SufficiencyValidator validator =
                    new SufficiencyValidator(
                            thresholds,
                            config.getMaxAutoTier(),
                            config.getMaxTier(),
                            config.getConsentMode());
            TieredRouter router =
                    new TieredRouter(
                            sourceRegistry,
                            routingTable,
                            featureFlags,
                            circuitBreaker,
                            fetcher,
                            validator,
                            consentLedger,
                            degradationPolicy,
                            clock);

            CapabilityHandlerRegistry handlerRegistry = new CapabilityHandlerRegistry();
            TieredCapabilityHandler routed = new TieredCapabilityHandler(router);
            routedCapabilities.forEach(name -> handlerRegistry.register(name, routed));
            handlers.forEach(handlerRegistry::register);

            PlanExecutor executor =
                    new PlanExecutor(handlerRegistry, executorService, config.getCapabilityTimeout());
            TurnPipeline pipeline =
                    new TurnPipeline(planner, clarifier, executor, degradationPolicy);

            logger.info(
                    "Tiller environment ready: "
                            + contractRegistry.size()
                            + " contract(s), "
                            + sourceRegistry.size()
                            + " source(s)");
            return new TillerEnvironment(
                    contractRegistry,
                    planner,
                    clarifier,
                    router,
                    circuitBreaker,
                    handlerRegistry,
                    pipeline,
                    suspendRepository,
                    consentLedger,
                    usageLog,
                    degradationPolicy,
                    List.of(executorService, fetchExecutorService),
                    config.getSuspendTtl());
        }
    }
}
