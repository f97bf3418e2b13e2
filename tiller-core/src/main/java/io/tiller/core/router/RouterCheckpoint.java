package io.tiller.core.router;

import java.util.List;
import java.util.Objects;

/// Routing progress kept when a request stopped before a gated tier, so that a
/// confirmed request can continue there without fetching the earlier tiers again.
///
/// @param resumeTier tier the consent prompt asked for, >= 1
/// @param tierReached highest tier fetched before the stop, 0 if none
/// @param items deduplicated items collected so far, never null
/// @param snippets snippets collected so far, never null
/// @param sourcesUsed sources that answered so far, never null
/// @param sourcesUnavailable sources that failed or were skipped so far, never null
public record RouterCheckpoint(
        int resumeTier,
        int tierReached,
        List<ResultItem> items,
        List<String> snippets,
        List<String> sourcesUsed,
        List<String> sourcesUnavailable) {

    public RouterCheckpoint {
        if (resumeTier < 1) {
            throw new IllegalArgumentException("resumeTier must be >= 1");
        }
        items = items != null ? List.copyOf(items) : List.of();
        snippets = snippets != null ? List.copyOf(snippets) : List.of();
        sourcesUsed = sourcesUsed != null ? List.copyOf(sourcesUsed) : List.of();
        sourcesUnavailable = sourcesUnavailable != null ? List.copyOf(sourcesUnavailable) : List.of();
    }

    /// Captures a result that stopped for consent.
    ///
    /// @param result router result with status `CONSENT_REQUIRED`, not null
    /// @return checkpoint resuming at the prompt's tier, never null
    /// @throws IllegalArgumentException if the result carries no consent prompt
    public static RouterCheckpoint from(RouterResult result) {
        Objects.requireNonNull(result, "result must not be null");
        ConsentPrompt prompt =
                result.prompt()
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Only a consent stop can be resumed, got "
                                                        + result.status()));
        return new RouterCheckpoint(
                prompt.tier(),
                result.tierReached(),
                result.items(),
                result.snippets(),
                result.sourcesUsed(),
                result.sourcesUnavailable());
    }
}
