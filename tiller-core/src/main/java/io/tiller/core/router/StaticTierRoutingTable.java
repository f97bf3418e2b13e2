package io.tiller.core.router;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/// {@link TierRoutingTable} backed by an in-memory `intent -> tier -> sources` map.
///
/// ### Usage
/// {@snippet :
/// TierRoutingTable table = StaticTierRoutingTable.builder()
///     .route("product", 1, "amazon_affiliate", "ebay_affiliate")
///     .route("product", 2, "bing_search")
///     .route("product", 3, "reddit_api")
///     .build();
/// }
///
/// @implNote Thread-safe. Immutable after {@link Builder#build()}.
public final class StaticTierRoutingTable implements TierRoutingTable {

    private final Map<String, Map<Integer, List<String>>> routes;

    private StaticTierRoutingTable(Map<String, Map<Integer, List<String>>> routes) {
        this.routes = routes;
    }

    @Override
    public List<String> sourcesFor(String intent, int tier) {
        Objects.requireNonNull(intent, "intent must not be null");
        Map<Integer, List<String>> tiers = routes.get(intent);
        if (tiers == null) {
            throw new UnknownIntentException(intent);
        }
        return tiers.getOrDefault(tier, List.of());
    }

    @Override
    public Set<String> intents() {
        return Collections.unmodifiableSet(routes.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link StaticTierRoutingTable}.
    public static final class Builder {
        private final Map<String, Map<Integer, List<String>>> routes = new ConcurrentHashMap<>();

        private Builder() {}

        /// Declares the sources of one tier of an intent.
        ///
        /// @param intent intent name, not null
        /// @param tier tier number, >= 1
        /// @param sources source names in fetch order, may be empty
        /// @return this builder for chaining, never null
        public Builder route(String intent, int tier, String... sources) {
            Objects.requireNonNull(intent, "intent must not be null");
            if (tier < 1) {
                throw new IllegalArgumentException("tier must be >= 1");
            }
            routes.computeIfAbsent(intent, k -> new TreeMap<>()).put(tier, List.of(sources));
            return this;
        }

        public StaticTierRoutingTable build() {
            Map<String, Map<Integer, List<String>>> copy = new ConcurrentHashMap<>();
            routes.forEach((intent, tiers) -> copy.put(intent, Map.copyOf(tiers)));
            return new StaticTierRoutingTable(copy);
        }
    }
}
