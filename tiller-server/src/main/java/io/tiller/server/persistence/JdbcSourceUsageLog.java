package io.tiller.server.persistence;

import io.tiller.core.router.SourceUsage;
import io.tiller.core.router.SourceUsageLog;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;

/// PostgreSQL-backed log of source calls, one row per fetch attempt.
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection. Write
/// failures propagate as {@link PersistenceException}; the fetcher decides
/// whether to swallow them according to the degradation policy.
public class JdbcSourceUsageLog implements SourceUsageLog {

    // --- SQL constants ---

    private static final String SQL_RECORD =
            """
            INSERT INTO tiller.source_usage
                (actor_id, session_id, source, tier, cost_cents, latency_ms,
                 success, error, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_FIND_BY_SESSION =
            """
            SELECT actor_id, session_id, source, tier, cost_cents, latency_ms,
                   success, error, created_at
            FROM tiller.source_usage
            WHERE session_id = ?
            ORDER BY id
            """;

    private final JdbcSupport jdbc;

    public JdbcSourceUsageLog(DataSource dataSource) {
        this.jdbc = new JdbcSupport(Objects.requireNonNull(dataSource, "dataSource"));
    }

    @Override
    public void record(SourceUsage usage) {
        Objects.requireNonNull(usage, "usage must not be null");

        jdbc.update(
                SQL_RECORD,
                ps -> {
                    ps.setString(1, usage.actorId());
                    ps.setString(2, usage.sessionId());
                    ps.setString(3, usage.source());
                    ps.setInt(4, usage.tier());
                    ps.setInt(5, usage.costCents());
                    ps.setLong(6, usage.latencyMs());
                    ps.setBoolean(7, usage.success());
                    ps.setString(8, usage.error());
                    ps.setObject(9, JdbcSupport.utc(usage.timestamp()));
                },
                "Failed to record source usage: " + usage.source());
    }

    @Override
    public List<SourceUsage> findBySession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");

        return jdbc.queryList(
                SQL_FIND_BY_SESSION,
                ps -> ps.setString(1, sessionId),
                rs ->
                        new SourceUsage(
                                rs.getString("actor_id"),
                                rs.getString("session_id"),
                                rs.getString("source"),
                                rs.getInt("tier"),
                                rs.getInt("cost_cents"),
                                rs.getLong("latency_ms"),
                                rs.getBoolean("success"),
                                rs.getString("error"),
                                JdbcSupport.instant(rs, "created_at")),
                "Failed to load source usage for session: " + sessionId);
    }
}
