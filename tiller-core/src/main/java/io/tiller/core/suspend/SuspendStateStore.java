package io.tiller.core.suspend;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Two-tier read/write-through cache for {@link SuspendState}.
///
/// The local tier memoizes durable reads for the lifetime the caller chooses,
/// typically one request. It caches absence as well as presence, so repeated
/// lookups for a session without a suspension never reach the durable tier twice.
///
/// ### Semantics
/// - **Read**: a local hit (including cached absence) returns without a durable
///   lookup; a miss reads the durable tier and caches the outcome.
/// - **Write**: local tier first, then the durable tier with the TTL refreshed.
/// - **Delete**: both tiers.
///
/// This is not a lock. When another component may have written the durable tier
/// directly, call {@link #invalidate(String)} or read with `forceReload`.
///
/// ### Usage
/// {@snippet :
/// SuspendStateStore store = new SuspendStateStore(repository, Duration.ofHours(1));
/// Optional<SuspendState> state = store.findResumable("session-1", "travel");
/// }
///
/// @implNote Scoped to one owner at a time. Create a new store per request
/// rather than sharing one across sessions for the life of the process.
///
/// @see SuspendStateRepository for the durable tier
public final class SuspendStateStore {

    private static final Logger logger = Logger.getLogger(SuspendStateStore.class.getName());

    private final SuspendStateRepository repository;
    private final Duration ttl;
    private final Map<String, Optional<SuspendState>> local = new ConcurrentHashMap<>();

    /// Creates a store over a durable tier.
    ///
    /// @param repository durable tier, not null
    /// @param ttl time to live applied on every write, positive
    public SuspendStateStore(SuspendStateRepository repository, Duration ttl) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /// Reads the state of a session through the local tier.
    ///
    /// @param sessionId conversation identifier, not null
    /// @return the state, or empty if none is stored
    public Optional<SuspendState> get(String sessionId) {
        return get(sessionId, false);
    }

    /// Reads the state of a session.
    ///
    /// @param sessionId conversation identifier, not null
    /// @param forceReload bypass the local tier and refresh it from the durable tier
    /// @return the state, or empty if none is stored
    public Optional<SuspendState> get(String sessionId, boolean forceReload) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (!forceReload) {
            Optional<SuspendState> cached = local.get(sessionId);
            if (cached != null) {
                return cached;
            }
        }
        Optional<SuspendState> loaded = repository.find(sessionId);
        local.put(sessionId, loaded);
        return loaded;
    }

    /// Writes a state to both tiers, refreshing its TTL.
    ///
    /// @apiNote **Side effects**: updates the local tier, then the durable tier
    ///
    /// @param state the state to store, not null
    public void save(SuspendState state) {
        Objects.requireNonNull(state, "state must not be null");
        local.put(state.sessionId(), Optional.of(state));
        repository.save(state, ttl);
    }

    /// Removes the state of a session from both tiers.
    ///
    /// The local tier remembers the absence afterwards.
    ///
    /// @param sessionId conversation identifier, not null
    public void delete(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        local.put(sessionId, Optional.empty());
        repository.delete(sessionId);
    }

    /// Drops the local entry so that the next read goes to the durable tier.
    ///
    /// @param sessionId conversation identifier, not null
    public void invalidate(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        local.remove(sessionId);
    }

    /// Drops every local entry.
    public void clear() {
        local.clear();
    }

    /// Returns whether the session holds an active suspension.
    ///
    /// @param sessionId conversation identifier, not null
    /// @return true if a state with outstanding questions exists
    public boolean isSuspended(String sessionId) {
        return get(sessionId).map(SuspendState::isSuspended).orElse(false);
    }

    /// Returns the suspension a turn with the given intent should resume.
    ///
    /// Stale states are ignored. A suspension recorded for a different intent is
    /// discarded from both tiers, since the user has moved on.
    ///
    /// @param sessionId conversation identifier, not null
    /// @param intent intent of the current turn, not null
    /// @return the resumable state, or empty if the turn starts fresh
    public Optional<SuspendState> findResumable(String sessionId, String intent) {
        Objects.requireNonNull(intent, "intent must not be null");
        Optional<SuspendState> state = get(sessionId);
        if (state.isEmpty() || !state.get().isSuspended()) {
            return Optional.empty();
        }
        if (!state.get().intent().equals(intent)) {
            logger.info(
                    "Intent changed from "
                            + state.get().intent()
                            + " to "
                            + intent
                            + "; discarding suspension for session "
                            + sessionId);
            delete(sessionId);
            return Optional.empty();
        }
        return state;
    }

    /// Returns the consent halt a session is waiting on.
    ///
    /// @param sessionId conversation identifier, not null
    /// @return the halted state, or empty if no plan is waiting for consent
    public Optional<SuspendState> findConsentHalt(String sessionId) {
        return get(sessionId).filter(SuspendState::isAwaitingConsent);
    }

    /// Returns the version the next write for a session should carry.
    ///
    /// @param sessionId conversation identifier, not null
    /// @return one past the stored version, or 1 if nothing is stored
    public long nextVersion(String sessionId) {
        return get(sessionId).map(s -> s.version() + 1).orElse(1L);
    }

    /// Returns whether the local tier holds an entry (present or absent) for a session.
    ///
    /// @param sessionId conversation identifier, not null
    /// @return true if a read would be served locally
    public boolean isCached(String sessionId) {
        return local.containsKey(sessionId);
    }
}
