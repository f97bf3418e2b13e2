package io.tiller.core.router;

import java.util.Map;
import java.util.Objects;

/// Query handed to a {@link SourceFetcher}.
///
/// @param intent classified intent, not null
/// @param query search text, not null
/// @param tier tier being fetched, >= 1
/// @param parameters resolved fields of the turn, never null
public record FetchRequest(String intent, String query, int tier, Map<String, Object> parameters) {

    public FetchRequest {
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(query, "query must not be null");
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }
}
