package io.tiller.core.execution;

import io.tiller.core.router.RouterCheckpoint;
import io.tiller.core.router.RouterRequest;
import io.tiller.core.router.RouterResult;
import io.tiller.core.router.TieredRouter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// {@link CapabilityHandler} that answers a search capability through the
/// {@link TieredRouter}.
///
/// The query is the `query` field when present, the utterance otherwise. Requested
/// items come from the `items` field, given as a list or a comma-separated string.
/// A resumed invocation continues routing from its checkpoint. A consent stop hands
/// its checkpoint back on the outcome.
///
/// ### Output keys
/// `items`, `snippets`, `sources_used`, `sources_unavailable`, `tier_reached`, and
/// `message` when the router returned one.
public class TieredCapabilityHandler implements CapabilityHandler {

    public static final String QUERY_FIELD = "query";
    public static final String ITEMS_FIELD = "items";

    private final TieredRouter router;

    public TieredCapabilityHandler(TieredRouter router) {
        this.router = Objects.requireNonNull(router, "router must not be null");
    }

    @Override
    public CapabilityOutcome handle(CapabilityInvocation invocation) {
        Object queryField = invocation.fields().get(QUERY_FIELD);
        String query = queryField != null ? queryField.toString() : invocation.utterance();

        RouterResult result =
                router.route(
                        new RouterRequest(
                                invocation.intent(),
                                query,
                                invocation.sessionId(),
                                invocation.actorId(),
                                requestedItems(invocation.fields().get(ITEMS_FIELD)),
                                invocation.consent(),
                                invocation.fields()),
                        invocation.checkpoint());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("items", result.items());
        output.put("snippets", result.snippets());
        output.put("sources_used", result.sourcesUsed());
        output.put("sources_unavailable", result.sourcesUnavailable());
        output.put("tier_reached", result.tierReached());
        if (result.message() != null) {
            output.put("message", result.message());
        }

        OutcomeStatus status =
                switch (result.status()) {
                    case SUCCESS -> OutcomeStatus.SUCCESS;
                    case PARTIAL -> OutcomeStatus.PARTIAL;
                    case CONSENT_REQUIRED -> OutcomeStatus.CONSENT_REQUIRED;
                };
        return new CapabilityOutcome(
                invocation.capability(),
                status,
                output,
                null,
                result.consentPrompt(),
                status == OutcomeStatus.CONSENT_REQUIRED ? RouterCheckpoint.from(result) : null);
    }

    static List<String> requestedItems(Object raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        if (raw instanceof Collection<?> collection) {
            collection.stream().filter(Objects::nonNull).map(Object::toString).forEach(items::add);
        } else {
            items.addAll(Arrays.asList(raw.toString().split(",")));
        }
        return items.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
    }
}
