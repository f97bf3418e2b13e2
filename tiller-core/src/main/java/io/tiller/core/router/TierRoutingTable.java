package io.tiller.core.router;

import java.util.List;
import java.util.Set;

/// Resolves the external sources of a tier for an intent.
///
/// Tiers are numbered from 1. A tier without sources resolves to an empty list.
///
/// @see StaticTierRoutingTable
public interface TierRoutingTable {

    /// Returns the source names configured for a tier.
    ///
    /// @param intent classified intent, not null
    /// @param tier tier number, >= 1
    /// @return source names in fetch order, never null (may be empty)
    /// @throws UnknownIntentException if the intent has no routing rules
    List<String> sourcesFor(String intent, int tier);

    /// Returns the intents this table routes.
    ///
    /// @return routed intents, never null
    Set<String> intents();

    default boolean supports(String intent) {
        return intents().contains(intent);
    }
}
