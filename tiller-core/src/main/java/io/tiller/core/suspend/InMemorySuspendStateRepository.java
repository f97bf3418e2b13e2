package io.tiller.core.suspend;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory implementation of {@link SuspendStateRepository}.
///
/// Default when no database is configured and in tests. Entries expire lazily on
/// read and eagerly through {@link #purgeExpired()}.
///
/// @implNote Thread-safe. Backed by a ConcurrentHashMap; the version check and
/// write happen atomically inside `compute`.
public final class InMemorySuspendStateRepository implements SuspendStateRepository {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySuspendStateRepository() {
        this(Clock.systemUTC());
    }

    public InMemorySuspendStateRepository(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<SuspendState> find(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        String key = SuspendState.key(sessionId);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.state);
    }

    @Override
    public void save(SuspendState state, Duration ttl) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        Instant now = clock.instant();
        entries.compute(
                SuspendState.key(state.sessionId()),
                (key, existing) -> {
                    if (existing != null
                            && !existing.isExpired(now)
                            && existing.state.version() >= state.version()) {
                        throw new ConcurrentSuspendException(state.sessionId(), state.version());
                    }
                    return new Entry(state, now.plus(ttl));
                });
    }

    @Override
    public boolean delete(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return entries.remove(SuspendState.key(sessionId)) != null;
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    private record Entry(SuspendState state, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
