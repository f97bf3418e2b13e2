package io.tiller.core.router;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Input to {@link TieredRouter#route(RouterRequest)}.
///
/// @param intent classified intent, not null
/// @param query search text, not null
/// @param sessionId conversation id, not null
/// @param actorId user id, may be null
/// @param requestedItems items named by the user, never null
/// @param consent consent flags, never null
/// @param parameters resolved turn fields, never null
public record RouterRequest(
        String intent,
        String query,
        String sessionId,
        String actorId,
        List<String> requestedItems,
        ConsentFlags consent,
        Map<String, Object> parameters) {

    public RouterRequest {
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        requestedItems = requestedItems != null ? List.copyOf(requestedItems) : List.of();
        consent = consent != null ? consent : ConsentFlags.none();
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static RouterRequest of(String intent, String query, String sessionId) {
        return new RouterRequest(intent, query, sessionId, null, List.of(), ConsentFlags.none(), Map.of());
    }

    public RouterRequest withConsent(ConsentFlags flags) {
        return new RouterRequest(
                intent, query, sessionId, actorId, requestedItems, flags, parameters);
    }
}
