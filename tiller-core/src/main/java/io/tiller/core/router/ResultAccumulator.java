package io.tiller.core.router;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Cumulative results across the tiers fetched for one request.
///
/// Items are deduplicated by {@link ResultItem#dedupeKey()}, first occurrence wins.
/// Snippets are concatenated in arrival order.
///
/// @implNote **Not thread-safe**. Owned by a single routing call.
final class ResultAccumulator {

    private final Map<String, ResultItem> items = new LinkedHashMap<>();
    private final List<String> snippets = new ArrayList<>();
    private final Set<String> sourcesUsed = new LinkedHashSet<>();
    private final Set<String> sourcesUnavailable = new LinkedHashSet<>();

    void add(SourceOutcome outcome) {
        if (!outcome.isSuccess()) {
            sourcesUnavailable.add(outcome.source());
            return;
        }
        sourcesUsed.add(outcome.source());
        for (ResultItem item : outcome.payload().items()) {
            items.putIfAbsent(item.dedupeKey(), item);
        }
        snippets.addAll(outcome.payload().snippets());
    }

    void restore(RouterCheckpoint checkpoint) {
        for (ResultItem item : checkpoint.items()) {
            items.putIfAbsent(item.dedupeKey(), item);
        }
        snippets.addAll(checkpoint.snippets());
        sourcesUsed.addAll(checkpoint.sourcesUsed());
        sourcesUnavailable.addAll(checkpoint.sourcesUnavailable());
    }

    void markUnavailable(String source) {
        sourcesUnavailable.add(source);
    }

    List<ResultItem> items() {
        return List.copyOf(items.values());
    }

    List<String> snippets() {
        return List.copyOf(snippets);
    }

    List<String> sourcesUsed() {
        return List.copyOf(sourcesUsed);
    }

    List<String> sourcesUnavailable() {
        return List.copyOf(sourcesUnavailable);
    }
}
