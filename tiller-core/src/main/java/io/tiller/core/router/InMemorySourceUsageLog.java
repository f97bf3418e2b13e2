package io.tiller.core.router;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/// Process-local {@link SourceUsageLog}.
///
/// @implNote Thread-safe.
public final class InMemorySourceUsageLog implements SourceUsageLog {

    private final List<SourceUsage> entries = new CopyOnWriteArrayList<>();

    @Override
    public void record(SourceUsage usage) {
        entries.add(Objects.requireNonNull(usage, "usage must not be null"));
    }

    @Override
    public List<SourceUsage> findBySession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return entries.stream().filter(u -> u.sessionId().equals(sessionId)).toList();
    }

    public List<SourceUsage> entries() {
        return List.copyOf(entries);
    }
}
