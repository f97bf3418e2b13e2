package io.tiller.core;

import io.tiller.core.contract.ContractRegistry;
import io.tiller.core.degradation.DegradationPolicy;
import io.tiller.core.execution.CapabilityHandlerRegistry;
import io.tiller.core.plan.DependencyPlanner;
import io.tiller.core.router.CircuitBreaker;
import io.tiller.core.router.ConsentLedger;
import io.tiller.core.router.SourceUsageLog;
import io.tiller.core.router.TieredRouter;
import io.tiller.core.slot.SlotClarifier;
import io.tiller.core.suspend.SuspendStateRepository;
import io.tiller.core.suspend.SuspendStateStore;
import io.tiller.core.turn.TurnPipeline;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/// Container holding the wired Tiller components.
///
/// ### Contracts
/// - **Invariant**: component references are immutable after construction
///
/// @implNote Safe for concurrent reads. {@link #newSuspendStore()} hands out a fresh
/// request-scoped store on every call.
///
/// @apiNote Create instances via {@link TillerFactory#builder()} rather than direct
/// construction.
public final class TillerEnvironment implements AutoCloseable {

    private final ContractRegistry contractRegistry;
    private final DependencyPlanner planner;
    private final SlotClarifier clarifier;
    private final TieredRouter router;
    private final CircuitBreaker circuitBreaker;
    private final CapabilityHandlerRegistry handlers;
    private final TurnPipeline turnPipeline;
    private final SuspendStateRepository suspendRepository;
    private final ConsentLedger consentLedger;
    private final SourceUsageLog usageLog;
    private final DegradationPolicy degradationPolicy;
    private final List<ExecutorService> executorServices;
    private final Duration suspendTtl;

    TillerEnvironment(
            ContractRegistry contractRegistry,
            DependencyPlanner planner,
            SlotClarifier clarifier,
            TieredRouter router,
            CircuitBreaker circuitBreaker,
            CapabilityHandlerRegistry handlers,
            TurnPipeline turnPipeline,
            SuspendStateRepository suspendRepository,
            ConsentLedger consentLedger,
            SourceUsageLog usageLog,
            DegradationPolicy degradationPolicy,
            List<ExecutorService> executorServices,
            Duration suspendTtl) {
        this.contractRegistry = contractRegistry;
        this.planner = planner;
        this.clarifier = clarifier;
        this.router = router;
        this.circuitBreaker = circuitBreaker;
        this.handlers = handlers;
        this.turnPipeline = turnPipeline;
        this.suspendRepository = suspendRepository;
        this.consentLedger = consentLedger;
        this.usageLog = usageLog;
        this.degradationPolicy = degradationPolicy;
        this.executorServices = List.copyOf(executorServices);
        this.suspendTtl = suspendTtl;
    }

    public ContractRegistry getContractRegistry() {
        return contractRegistry;
    }

    public DependencyPlanner getPlanner() {
        return planner;
    }

    public SlotClarifier getClarifier() {
        return clarifier;
    }

    public TieredRouter getRouter() {
        return router;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public CapabilityHandlerRegistry getHandlers() {
        return handlers;
    }

    public TurnPipeline getTurnPipeline() {
        return turnPipeline;
    }

    /// Returns the durable tier of the suspend store.
    ///
    /// @return suspend state repository, never null
    public SuspendStateRepository getSuspendRepository() {
        return suspendRepository;
    }

    public ConsentLedger getConsentLedger() {
        return consentLedger;
    }

    public SourceUsageLog getUsageLog() {
        return usageLog;
    }

    public DegradationPolicy getDegradationPolicy() {
        return degradationPolicy;
    }

    /// Creates a request-scoped suspend store over the durable repository.
    ///
    /// @return new store with an empty local tier, never null
    public SuspendStateStore newSuspendStore() {
        return new SuspendStateStore(suspendRepository, suspendTtl);
    }

    /// Shuts down the plan and fetch thread pools.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block.
    @Override
    public void close() {
        executorServices.forEach(ExecutorService::shutdown);
    }
}
