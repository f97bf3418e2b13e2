package io.tiller.core.suspend;

import java.time.Duration;
import java.util.Optional;

/// Durable, TTL-bounded tier of the suspend/resume store.
///
/// The durable tier is authoritative across processes. Entries are keyed by
/// {@link SuspendState#key(String)} and expire once their TTL elapses without a
/// refresh.
///
/// ### Contracts
/// - **Postcondition**: `find` never returns an expired entry
/// - **Postcondition**: `save` refreshes the TTL of an existing entry
///
/// @implNote Implementations must be thread-safe.
///
/// @see InMemorySuspendStateRepository
/// @see SuspendStateStore for the process-local tier
public interface SuspendStateRepository {

    /// Loads the state of a session.
    ///
    /// @param sessionId conversation identifier, not null
    /// @return the stored state, or empty if absent or expired
    Optional<SuspendState> find(String sessionId);

    /// Stores a state, replacing any previous one and resetting its TTL.
    ///
    /// @apiNote **Side effects**: writes to the durable store
    ///
    /// @param state the state to store, not null
    /// @param ttl time to live from now, positive
    /// @throws ConcurrentSuspendException if a newer version was written concurrently
    void save(SuspendState state, Duration ttl);

    /// Removes the state of a session.
    ///
    /// @param sessionId conversation identifier, not null
    /// @return true if a state was removed
    boolean delete(String sessionId);

    /// Removes expired entries eagerly.
    ///
    /// Expired entries are already invisible to {@link #find(String)}; purging only
    /// reclaims space.
    ///
    /// @return number of entries removed
    default int purgeExpired() {
        return 0;
    }
}
