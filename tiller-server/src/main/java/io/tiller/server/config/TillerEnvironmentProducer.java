package io.tiller.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import io.tiller.adapter.langchain4j.LangChain4jExtractionService;
import io.tiller.adapter.langchain4j.LangChain4jModelFactory;
import io.tiller.adapter.langchain4j.LangChain4jQuestionGenerator;
import io.tiller.core.TillerConfig;
import io.tiller.core.TillerEnvironment;
import io.tiller.core.TillerFactory;
import io.tiller.core.contract.DefaultContractRegistry;
import io.tiller.core.degradation.DegradationPolicy;
import io.tiller.core.router.ConsentMode;
import io.tiller.core.router.SourceDefinition;
import io.tiller.core.router.SourceFetcher;
import io.tiller.core.router.SourceRegistry;
import io.tiller.core.slot.FieldDefaults;
import io.tiller.serialization.model.JacksonModelResponseParser;
import io.tiller.server.capability.ServerCapabilityHandler;
import io.tiller.server.catalog.StandardCatalog;
import io.tiller.server.persistence.JdbcConsentLedger;
import io.tiller.server.persistence.JdbcSourceUsageLog;
import io.tiller.server.persistence.JdbcSuspendStateRepository;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.sql.DataSource;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the Tiller runtime environment.
///
/// Wires the planner, clarifier, router and turn pipeline via {@link TillerFactory}
/// from the {@link StandardCatalog} and `tiller.*` configuration.
///
/// ### Durable tiers
/// When a datasource is active, the suspend store, consent ledger and source usage
/// log are backed by PostgreSQL; otherwise the in-memory defaults of the factory
/// are used.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `tiller.suspend.ttl` | Duration | `1H` | Lifetime of a suspended clarification |
/// | `tiller.clarifier.history-window` | int | `5` | User messages sent to extraction |
/// | `tiller.clarifier.skip-intents` | list | `intro,unclear` | Intents that bypass clarification |
/// | `tiller.circuit.threshold` | int | `3` | Consecutive failures that open a circuit |
/// | `tiller.circuit.reset-timeout` | Duration | `300S` | Open time before a trial call |
/// | `tiller.router.max-auto-tier` | int | `2` | Highest tier entered without consent |
/// | `tiller.router.max-tier` | int | `4` | Highest tier entered at all |
/// | `tiller.router.consent-mode` | `EITHER`/`BOTH` | `EITHER` | How consent flags combine |
/// | `tiller.router.capabilities` | list | `product_search,travel_search_flights,travel_search_hotels` | Capabilities served by the router |
/// | `tiller.executor.pool-size` | int | `10` | Size of the plan and fetch pools |
/// | `tiller.executor.capability-timeout` | Duration | `30S` | Per-capability timeout |
/// | `tiller.planner.epilogue` | String | `next_step_suggestion` | Capability forced last |
/// | `tiller.sources.<name>.timeout` | Duration | `5S` | Per-source fetch timeout |
/// | `tiller.flags.<FLAG>` | boolean | see {@link StandardCatalog#defaultFlags()} | Source feature flags |
/// | `tiller.degradation.<component>` | `fail_open`/`fail_closed` | see {@link DegradationPolicy} | Failure policy overrides |
/// | `tiller.model.name` | String | - | Chat model for extraction and questions |
/// | `tiller.credentials.<KEY>` | String | - | Provider API keys, e.g. `ANTHROPIC_API_KEY` |
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
///
/// @see TillerEnvironment
/// @see TillerFactory
@ApplicationScoped
public class TillerEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(TillerEnvironmentProducer.class);

    static final String CREDENTIALS_PREFIX = "tiller.credentials.";
    static final List<String> DEFAULT_ROUTED_CAPABILITIES =
            List.of("product_search", "travel_search_flights", "travel_search_hotels");

    private TillerEnvironment tillerEnvironment;

    @Inject Config config;

    @Inject Instance<DataSource> dataSourceInstance;

    @Inject Instance<SourceFetcher> sourceFetcherInstance;

    @Inject Instance<ServerCapabilityHandler> capabilityHandlers;

    @Inject ObjectMapper objectMapper;

    /// Produces the Tiller runtime environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @ApplicationScoped
    public TillerEnvironment tillerEnvironment() {
        Clock clock = Clock.systemUTC();

        TillerFactory.Builder factoryBuilder =
                TillerFactory.builder()
                        .config(buildConfig())
                        .clock(clock)
                        .contractRegistry(new DefaultContractRegistry(StandardCatalog.contracts()))
                        .templates(StandardCatalog.templates())
                        .sourceRegistry(buildSourceRegistry())
                        .routingTable(StandardCatalog.routingTable())
                        .featureFlags(
                                new ConfigFeatureFlags(config, StandardCatalog.defaultFlags()))
                        .fieldDefaults(FieldDefaults.travel(clock))
                        .degradationPolicy(
                                DegradationPolicy.withOverrides(
                                        component ->
                                                config.getOptionalValue(
                                                        "tiller.degradation." + component,
                                                        String.class)));

        boolean dsActive =
                config.getOptionalValue("quarkus.datasource.active", Boolean.class).orElse(true);

        if (dsActive && dataSourceInstance.isResolvable()) {
            DataSource ds = dataSourceInstance.get();
            factoryBuilder
                    .suspendRepository(new JdbcSuspendStateRepository(ds, objectMapper, clock))
                    .consentLedger(new JdbcConsentLedger(ds))
                    .usageLog(new JdbcSourceUsageLog(ds));
            LOG.info("Using JDBC persistence (PostgreSQL)");
        } else {
            LOG.info("Using in-memory persistence");
        }

        configureModel(factoryBuilder);

        if (sourceFetcherInstance.isResolvable()) {
            factoryBuilder.sourceFetcher(sourceFetcherInstance.get());
            LOG.info("Using CDI-provided SourceFetcher");
        } else {
            LOG.warn("No SourceFetcher bean found; every source will report as unavailable");
        }

        routedCapabilities().forEach(factoryBuilder::routedCapability);
        for (ServerCapabilityHandler handler : capabilityHandlers) {
            factoryBuilder.handler(handler.capability(), handler);
            LOG.infov("Registered capability handler: {0}", handler.capability());
        }

        tillerEnvironment = factoryBuilder.build();

        LOG.info("Configured TillerEnvironment via TillerFactory");
        return tillerEnvironment;
    }

    /// Reads the core configuration from `tiller.*` properties.
    TillerConfig buildConfig() {
        TillerConfig defaults = new TillerConfig();
        Set<String> skipIntents =
                config.getOptionalValues("tiller.clarifier.skip-intents", String.class)
                        .<Set<String>>map(LinkedHashSet::new)
                        .orElse(defaults.getSkipIntents());
        return TillerConfig.builder()
                .suspendTtl(duration("tiller.suspend.ttl", defaults.getSuspendTtl()))
                .historyWindow(integer("tiller.clarifier.history-window", defaults.getHistoryWindow()))
                .skipIntents(skipIntents)
                .circuitThreshold(integer("tiller.circuit.threshold", defaults.getCircuitThreshold()))
                .circuitResetTimeout(
                        duration("tiller.circuit.reset-timeout", defaults.getCircuitResetTimeout()))
                .tiers(
                        integer("tiller.router.max-auto-tier", defaults.getMaxAutoTier()),
                        integer("tiller.router.max-tier", defaults.getMaxTier()))
                .consentMode(
                        ConsentMode.parse(
                                config.getOptionalValue("tiller.router.consent-mode", String.class)
                                        .orElse(null)))
                .threadPoolSize(integer("tiller.executor.pool-size", defaults.getThreadPoolSize()))
                .capabilityTimeout(
                        duration(
                                "tiller.executor.capability-timeout",
                                defaults.getCapabilityTimeout()))
                .epilogueCapability(
                        config.getOptionalValue("tiller.planner.epilogue", String.class)
                                .orElse(StandardCatalog.NEXT_STEP_SUGGESTION))
                .build();
    }

    /// Builds the source registry, applying `tiller.sources.<name>.timeout` overrides.
    SourceRegistry buildSourceRegistry() {
        SourceRegistry registry = new SourceRegistry();
        for (SourceDefinition source : StandardCatalog.sources()) {
            Optional<Duration> timeout =
                    config.getOptionalValue(
                            "tiller.sources." + source.name() + ".timeout", Duration.class);
            registry.register(
                    timeout.map(
                                    t ->
                                            new SourceDefinition(
                                                    source.name(),
                                                    source.provider(),
                                                    source.costCents(),
                                                    t,
                                                    source.requiresConsent(),
                                                    source.featureFlag()))
                            .orElse(source));
        }
        return registry;
    }

    List<String> routedCapabilities() {
        return config.getOptionalValues("tiller.router.capabilities", String.class)
                .orElse(DEFAULT_ROUTED_CAPABILITIES);
    }

    /// Extracts `tiller.credentials.*` into a map keyed by the suffix.
    Map<String, String> extractCredentials() {
        Map<String, String> credentials = new LinkedHashMap<>();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(CREDENTIALS_PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(
                                value ->
                                        credentials.put(
                                                propertyName.substring(CREDENTIALS_PREFIX.length()),
                                                value));
            }
        }
        return credentials;
    }

    private void configureModel(TillerFactory.Builder factoryBuilder) {
        Optional<String> modelName = config.getOptionalValue("tiller.model.name", String.class);
        if (modelName.isEmpty()) {
            LOG.info("No tiller.model.name configured; extraction disabled, fallback questions");
            return;
        }
        if (!LangChain4jModelFactory.supportsModel(modelName.get())) {
            throw new IllegalStateException("Unsupported tiller.model.name: " + modelName.get());
        }
        ChatModel model = LangChain4jModelFactory.create(modelName.get(), extractCredentials());
        JacksonModelResponseParser parser = new JacksonModelResponseParser(objectMapper);
        factoryBuilder
                .extractionService(new LangChain4jExtractionService(model, parser))
                .questionGenerator(new LangChain4jQuestionGenerator(model, parser));
        LOG.infov("Using LangChain4j model {0} for extraction and questions", modelName.get());
    }

    private Duration duration(String key, Duration defaultValue) {
        return config.getOptionalValue(key, Duration.class).orElse(defaultValue);
    }

    private int integer(String key, int defaultValue) {
        return config.getOptionalValue(key, Integer.class).orElse(defaultValue);
    }

    /// Cleanup callback invoked when the application shuts down.
    ///
    /// Closes the environment to release its thread pools.
    @PreDestroy
    public void cleanup() {
        if (tillerEnvironment != null) {
            tillerEnvironment.close();
            LOG.info("TillerEnvironment closed");
        }
    }
}
