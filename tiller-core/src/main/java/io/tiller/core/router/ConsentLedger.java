package io.tiller.core.router;

import java.util.List;

/// Append-only store of {@link ConsentRecord}s.
public interface ConsentLedger {

    void append(ConsentRecord record);

    List<ConsentRecord> findBySession(String sessionId);
}
