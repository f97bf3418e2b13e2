package io.tiller.core.router;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/// Process-local {@link ConsentLedger}.
///
/// @implNote Thread-safe.
public final class InMemoryConsentLedger implements ConsentLedger {

    private final List<ConsentRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(ConsentRecord record) {
        records.add(Objects.requireNonNull(record, "record must not be null"));
    }

    @Override
    public List<ConsentRecord> findBySession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return records.stream().filter(r -> r.sessionId().equals(sessionId)).toList();
    }

    public List<ConsentRecord> records() {
        return List.copyOf(records);
    }
}
