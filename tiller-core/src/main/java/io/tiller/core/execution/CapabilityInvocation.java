package io.tiller.core.execution;

import io.tiller.core.router.ConsentFlags;
import io.tiller.core.router.RouterCheckpoint;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Everything a {@link CapabilityHandler} receives for one capability run.
///
/// @param capability capability being run, not null
/// @param sessionId conversation id, not null
/// @param actorId user id, may be null
/// @param intent classified intent, not null
/// @param utterance current user message, never null
/// @param fields resolved field values, never null
/// @param upstream outputs of capabilities from earlier steps, never null
/// @param consent consent flags of the turn, never null
/// @param checkpoint routing progress this capability stopped at for consent, null
///        unless the capability is being resumed
public record CapabilityInvocation(
        String capability,
        String sessionId,
        String actorId,
        String intent,
        String utterance,
        Map<String, Object> fields,
        Map<String, Map<String, Object>> upstream,
        ConsentFlags consent,
        RouterCheckpoint checkpoint) {

    public CapabilityInvocation {
        Objects.requireNonNull(capability, "capability must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        utterance = utterance != null ? utterance : "";
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
        upstream =
                upstream != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(upstream))
                        : Map.of();
        consent = consent != null ? consent : ConsentFlags.none();
    }

    /// Creates an invocation that does not resume a consent stop.
    public CapabilityInvocation(
            String capability,
            String sessionId,
            String actorId,
            String intent,
            String utterance,
            Map<String, Object> fields,
            Map<String, Map<String, Object>> upstream,
            ConsentFlags consent) {
        this(capability, sessionId, actorId, intent, utterance, fields, upstream, consent, null);
    }

    /// Returns a copy addressed to another capability with the given upstream outputs.
    ///
    /// @param name capability name, not null
    /// @param outputs upstream outputs, not null
    /// @return new invocation, never null
    public CapabilityInvocation forCapability(String name, Map<String, Map<String, Object>> outputs) {
        return new CapabilityInvocation(
                name, sessionId, actorId, intent, utterance, fields, outputs, consent, null);
    }

    /// Returns a copy that continues from a consent stop.
    ///
    /// @param resumeFrom routing progress of this capability, may be null
    /// @return new invocation, never null
    public CapabilityInvocation resuming(RouterCheckpoint resumeFrom) {
        return new CapabilityInvocation(
                capability,
                sessionId,
                actorId,
                intent,
                utterance,
                fields,
                upstream,
                consent,
                resumeFrom);
    }
}
