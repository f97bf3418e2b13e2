package io.tiller.core.router;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Output of a routing call.
///
/// @param status final status, not null
/// @param items deduplicated items across all fetched tiers, never null
/// @param snippets snippets across all fetched tiers, never null
/// @param sourcesUsed sources that answered successfully, never null
/// @param sourcesUnavailable sources that failed, timed out or were circuit-open, never null
/// @param consentPrompt prompt to show, non-null only for `CONSENT_REQUIRED`
/// @param tierReached highest tier actually fetched, 0 if none
/// @param message user-facing note, may be null
public record RouterResult(
        RouterStatus status,
        List<ResultItem> items,
        List<String> snippets,
        List<String> sourcesUsed,
        List<String> sourcesUnavailable,
        ConsentPrompt consentPrompt,
        int tierReached,
        String message) {

    public RouterResult {
        Objects.requireNonNull(status, "status must not be null");
        items = items != null ? List.copyOf(items) : List.of();
        snippets = snippets != null ? List.copyOf(snippets) : List.of();
        sourcesUsed = sourcesUsed != null ? List.copyOf(sourcesUsed) : List.of();
        sourcesUnavailable = sourcesUnavailable != null ? List.copyOf(sourcesUnavailable) : List.of();
    }

    public Optional<ConsentPrompt> prompt() {
        return Optional.ofNullable(consentPrompt);
    }
}
