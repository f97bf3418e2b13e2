package io.tiller.core.router;

import java.util.List;

/// Items and text snippets returned by one source call.
///
/// @param items result items, never null
/// @param snippets free-text snippets, never null
public record SourcePayload(List<ResultItem> items, List<String> snippets) {

    private static final SourcePayload EMPTY = new SourcePayload(List.of(), List.of());

    public SourcePayload {
        items = items != null ? List.copyOf(items) : List.of();
        snippets = snippets != null ? List.copyOf(snippets) : List.of();
    }

    public static SourcePayload empty() {
        return EMPTY;
    }
}
