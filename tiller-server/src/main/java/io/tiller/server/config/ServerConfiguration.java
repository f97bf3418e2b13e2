package io.tiller.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tiller.core.TillerEnvironment;
import io.tiller.core.plan.DependencyPlanner;
import io.tiller.core.router.ConsentLedger;
import io.tiller.core.router.SourceUsageLog;
import io.tiller.core.suspend.SuspendStateRepository;
import io.tiller.core.turn.TurnPipeline;
import io.tiller.serialization.TillerSerializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI configuration for server-specific beans.
///
/// Core components are produced by {@link TillerEnvironmentProducer} via
/// {@link io.tiller.core.TillerFactory}. This class produces the shared
/// `ObjectMapper` and delegating producers that expose environment components for
/// direct injection.
///
/// The request-scoped suspend store is not a bean; callers obtain one per request
/// from {@link TillerEnvironment#newSuspendStore()}.
@ApplicationScoped
public class ServerConfiguration {

    // ========== Utility Beans ==========

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return TillerSerializer.createMapper();
    }

    // ========== TillerEnvironment Component Delegates ==========

    @Produces
    @Singleton
    public TurnPipeline turnPipeline(TillerEnvironment env) {
        return env.getTurnPipeline();
    }

    @Produces
    @Singleton
    public DependencyPlanner dependencyPlanner(TillerEnvironment env) {
        return env.getPlanner();
    }

    /// Produces the durable suspend tier for CDI injection.
    ///
    /// @param env the initialized environment, not null
    /// @return the suspend state repository, never null
    @Produces
    @Singleton
    public SuspendStateRepository suspendStateRepository(TillerEnvironment env) {
        return env.getSuspendRepository();
    }

    @Produces
    @Singleton
    public ConsentLedger consentLedger(TillerEnvironment env) {
        return env.getConsentLedger();
    }

    @Produces
    @Singleton
    public SourceUsageLog sourceUsageLog(TillerEnvironment env) {
        return env.getUsageLog();
    }
}
