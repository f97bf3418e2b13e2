package io.tiller.core.turn;

import io.tiller.core.plan.QueryComplexity;
import io.tiller.core.slot.ConversationMessage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// One user turn as seen by the {@link TurnPipeline}.
///
/// Intent classification and capability selection happen upstream.
///
/// @param sessionId conversation id, not null
/// @param actorId user id, may be null
/// @param intent classified intent, not null
/// @param utterance current user message, not null
/// @param history prior conversation, oldest first, never null
/// @param selectedCapabilities entry-point capabilities, never null
/// @param complexity complexity class for template lookup, may be null
/// @param fields caller-supplied field values, never null
/// @param action client action id such as `consent_confirm`, may be null
/// @param extendedSearchEnabled the user's standing extended-search opt-in
public record TurnRequest(
        String sessionId,
        String actorId,
        String intent,
        String utterance,
        List<ConversationMessage> history,
        Set<String> selectedCapabilities,
        QueryComplexity complexity,
        Map<String, Object> fields,
        String action,
        boolean extendedSearchEnabled) {

    public TurnRequest {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(utterance, "utterance must not be null");
        history = history != null ? List.copyOf(history) : List.of();
        selectedCapabilities =
                selectedCapabilities != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(selectedCapabilities))
                        : Set.of();
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    /// Creates a minimal turn with no history, fields or action.
    ///
    /// @param sessionId conversation id, not null
    /// @param intent classified intent, not null
    /// @param utterance user message, not null
    /// @param selected entry-point capabilities
    /// @return new request, never null
    public static TurnRequest of(
            String sessionId, String intent, String utterance, String... selected) {
        return new TurnRequest(
                sessionId,
                null,
                intent,
                utterance,
                List.of(),
                new LinkedHashSet<>(List.of(selected)),
                null,
                Map.of(),
                null,
                false);
    }
}
