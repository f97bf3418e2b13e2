package io.tiller.core.router;

import java.util.List;

/// Append-only sink for {@link SourceUsage} records.
public interface SourceUsageLog {

    /// Appends a usage record.
    ///
    /// @param usage record to append, not null
    void record(SourceUsage usage);

    /// Returns usage recorded for a session, oldest first.
    ///
    /// @param sessionId conversation id, not null
    /// @return records, never null
    List<SourceUsage> findBySession(String sessionId);
}
