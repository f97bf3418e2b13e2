package io.tiller.core.router;

import io.tiller.core.degradation.DegradationPolicy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fetches external sources tier by tier until the results are sufficient.
///
/// ### Loop
/// 1. Resolve the tier's sources, dropping unregistered ones and those behind a
///    disabled feature flag. Empty tiers are skipped.
/// 2. A tier that is gated, or holds a source with `requiresConsent`, needs consent.
///    Without it the call stops with `CONSENT_REQUIRED`.
/// 3. Drop sources whose circuit is open. For a consent tier, append a
///    {@link ConsentRecord} before taking any circuit permit.
/// 4. Fetch the tier in parallel and merge into the cumulative results.
/// 5. Ask the {@link SufficiencyValidator} what to do next.
///
/// A call that stopped for consent can continue later from a {@link RouterCheckpoint}.
///
/// ### Contracts
/// - **Invariant**: no source of a gated tier, and no source requiring consent, is
///   called without consent
/// - **Invariant**: every gated tier entered has a consent record appended first
/// - **Postcondition**: `tierReached` is the highest tier actually fetched
///
/// @implNote Thread-safe. Per-call state lives in a {@link ResultAccumulator}.
///
/// @see ParallelFetcher
/// @see CircuitBreaker
public class TieredRouter {

    private static final Logger logger = Logger.getLogger(TieredRouter.class.getName());

    private final SourceRegistry sources;
    private final TierRoutingTable routingTable;
    private final FeatureFlags featureFlags;
    private final CircuitBreaker circuitBreaker;
    private final ParallelFetcher fetcher;
    private final SufficiencyValidator validator;
    private final ConsentLedger consentLedger;
    private final DegradationPolicy degradationPolicy;
    private final Clock clock;

    public TieredRouter(
            SourceRegistry sources,
            TierRoutingTable routingTable,
            FeatureFlags featureFlags,
            CircuitBreaker circuitBreaker,
            ParallelFetcher fetcher,
            SufficiencyValidator validator,
            ConsentLedger consentLedger,
            DegradationPolicy degradationPolicy,
            Clock clock) {
        this.sources = Objects.requireNonNull(sources, "sources must not be null");
        this.routingTable = Objects.requireNonNull(routingTable, "routingTable must not be null");
        this.featureFlags = Objects.requireNonNull(featureFlags, "featureFlags must not be null");
        this.circuitBreaker =
                Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.consentLedger = Objects.requireNonNull(consentLedger, "consentLedger must not be null");
        this.degradationPolicy =
                Objects.requireNonNull(degradationPolicy, "degradationPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Routes a request through the tiers, starting at tier 1.
    ///
    /// @apiNote **Side effects**: calls external sources, updates circuit state,
    /// appends usage and consent records
    ///
    /// @param request query and consent flags, not null
    /// @return cumulative results with final status, never null
    /// @throws UnknownIntentException if the routing table does not cover the intent
    public RouterResult route(RouterRequest request) {
        return route(request, null);
    }

    /// Routes a request, continuing from an earlier consent stop when a checkpoint
    /// is given. The checkpoint's results seed the cumulative results and routing
    /// starts at its resume tier.
    ///
    /// @apiNote **Side effects**: calls external sources, updates circuit state,
    /// appends usage and consent records
    ///
    /// @param request query and consent flags, not null
    /// @param checkpoint progress of the stopped request, may be null
    /// @return cumulative results with final status, never null
    /// @throws UnknownIntentException if the routing table does not cover the intent
    public RouterResult route(RouterRequest request, RouterCheckpoint checkpoint) {
        Objects.requireNonNull(request, "request must not be null");
        if (!routingTable.supports(request.intent())) {
            throw new UnknownIntentException(request.intent());
        }

        ResultAccumulator results = new ResultAccumulator();
        int tierReached = 0;
        int tier = 1;
        if (checkpoint != null) {
            results.restore(checkpoint);
            tierReached = checkpoint.tierReached();
            tier = checkpoint.resumeTier();
            logger.info("Resuming " + request.intent() + " at tier " + tier);
        }
        while (tier <= validator.maxTier()) {
            List<SourceDefinition> enabled = enabledSources(request.intent(), tier);
            if (enabled.isEmpty()) {
                logger.fine("No enabled sources in tier " + tier + " for " + request.intent());
                tier++;
                continue;
            }

            boolean needsConsent = needsConsent(tier, enabled);
            if (needsConsent && !request.consent().satisfies(validator.consentMode())) {
                return consentRequired(
                        request.intent(), results, tier, request.consent(), tierReached);
            }

            List<SourceDefinition> closed = new ArrayList<>();
            for (SourceDefinition source : enabled) {
                if (circuitBreaker.isOpen(source.name())) {
                    logger.info("Skipping source with open circuit: " + source.name());
                    results.markUnavailable(source.name());
                } else {
                    closed.add(source);
                }
            }
            if (closed.isEmpty()) {
                tier++;
                continue;
            }

            // before tryAcquire: only the fetch releases a permit once it is taken
            if (needsConsent) {
                recordConsent(request, tier);
            }

            List<SourceDefinition> permitted = new ArrayList<>();
            for (SourceDefinition source : closed) {
                if (circuitBreaker.tryAcquire(source.name())) {
                    permitted.add(source);
                } else {
                    results.markUnavailable(source.name());
                }
            }
            if (permitted.isEmpty()) {
                tier++;
                continue;
            }

            logger.info(
                    "Fetching tier " + tier + " for " + request.intent() + ": " + names(permitted));
            FetchRequest fetchRequest =
                    new FetchRequest(request.intent(), request.query(), tier, request.parameters());
            Map<String, SourceOutcome> outcomes =
                    fetcher.fetchAll(permitted, fetchRequest, request.sessionId(), request.actorId());
            outcomes.values().forEach(results::add);
            tierReached = tier;

            ValidationDecision decision =
                    validator.validate(
                            request.intent(),
                            tier,
                            results.items(),
                            results.snippets(),
                            results.sourcesUsed().size(),
                            request.requestedItems(),
                            request.consent());
            switch (decision.verdict()) {
                case SUFFICIENT -> {
                    return result(RouterStatus.SUCCESS, results, null, tierReached, null);
                }
                case ESCALATE -> tier = decision.nextTier();
                case CONSENT_REQUIRED -> {
                    return consentRequired(
                            request.intent(),
                            results,
                            decision.nextTier(),
                            request.consent(),
                            tierReached);
                }
                default -> {
                    return partial(results, tierReached);
                }
            }
        }
        return partial(results, tierReached);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private List<SourceDefinition> enabledSources(String intent, int tier) {
        List<SourceDefinition> enabled = new ArrayList<>();
        for (String name : routingTable.sourcesFor(intent, tier)) {
            Optional<SourceDefinition> source = sources.get(name);
            if (source.isEmpty()) {
                logger.warning("Routing table references unregistered source: " + name);
                continue;
            }
            if (source.get().flag().map(f -> !featureFlags.isEnabled(f)).orElse(false)) {
                continue;
            }
            enabled.add(source.get());
        }
        return enabled;
    }

    /// A tier needs consent when it is gated by number or holds a source that
    /// requires consent wherever it is routed.
    private boolean needsConsent(int tier, List<SourceDefinition> enabled) {
        return validator.isGated(tier) || enabled.stream().anyMatch(SourceDefinition::requiresConsent);
    }

    /// Asks for consent for the first gated tier at or after `fromTier` that has
    /// sources; when none is left the results so far are final.
    private RouterResult consentRequired(
            String intent,
            ResultAccumulator results,
            int fromTier,
            ConsentFlags consent,
            int tierReached) {
        for (int tier = fromTier; tier <= validator.maxTier(); tier++) {
            if (!enabledSources(intent, tier).isEmpty()) {
                ConsentPrompt prompt =
                        ConsentPrompt.of(tier, consent.missing(validator.consentMode()));
                logger.info("Consent required before tier " + tier);
                return result(
                        RouterStatus.CONSENT_REQUIRED, results, prompt, tierReached, prompt.message());
            }
        }
        return partial(results, tierReached);
    }

    private void recordConsent(RouterRequest request, int tier) {
        ConsentRecord record =
                new ConsentRecord(request.actorId(), request.sessionId(), tier, clock.instant());
        try {
            consentLedger.append(record);
        } catch (RuntimeException e) {
            if (!degradationPolicy.isFailOpen(DegradationPolicy.CONSENT_LEDGER)) {
                throw e;
            }
            logger.log(Level.WARNING, "Failed to record consent for tier " + tier, e);
        }
    }

    private static RouterResult partial(ResultAccumulator results, int tierReached) {
        return result(
                RouterStatus.PARTIAL,
                results,
                null,
                tierReached,
                ValidationDecision.MAX_TIER_MESSAGE);
    }

    private static RouterResult result(
            RouterStatus status,
            ResultAccumulator results,
            ConsentPrompt prompt,
            int tierReached,
            String message) {
        return new RouterResult(
                status,
                results.items(),
                results.snippets(),
                results.sourcesUsed(),
                results.sourcesUnavailable(),
                prompt,
                tierReached,
                message);
    }

    private static List<String> names(List<SourceDefinition> sources) {
        return sources.stream().map(SourceDefinition::name).toList();
    }
}
