package io.tiller.core.router;

import java.util.Map;

/// Minimum result volume an intent needs before the router stops escalating.
///
/// @param minItems minimum deduplicated items, >= 0
/// @param minSnippets minimum snippets, >= 0
/// @param minSources minimum distinct successful sources, >= 0
/// @param requireAllItems every requested item must appear in the results
public record SufficiencyThreshold(
        int minItems, int minSnippets, int minSources, boolean requireAllItems) {

    public SufficiencyThreshold {
        if (minItems < 0 || minSnippets < 0 || minSources < 0) {
            throw new IllegalArgumentException("thresholds must be >= 0");
        }
    }

    public static SufficiencyThreshold items(int minItems) {
        return new SufficiencyThreshold(minItems, 0, 0, false);
    }

    /// Built-in thresholds for the standard commerce and travel intents.
    ///
    /// @return intent to threshold, never null
    public static Map<String, SufficiencyThreshold> defaults() {
        return Map.of(
                "product", items(3),
                "comparison", new SufficiencyThreshold(0, 0, 0, true),
                "price_check", items(1),
                "review_deep_dive", new SufficiencyThreshold(0, 5, 2, false),
                "travel", new SufficiencyThreshold(1, 3, 0, false));
    }
}
