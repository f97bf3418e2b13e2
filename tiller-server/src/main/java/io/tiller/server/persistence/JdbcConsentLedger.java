package io.tiller.server.persistence;

import io.tiller.core.router.ConsentLedger;
import io.tiller.core.router.ConsentRecord;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;

/// PostgreSQL-backed append-only consent audit ledger.
///
/// Rows are never updated or deleted by the application.
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection.
public class JdbcConsentLedger implements ConsentLedger {

    // --- SQL constants ---

    private static final String SQL_APPEND =
            """
            INSERT INTO tiller.consent_records (actor_id, session_id, tier_requested, created_at)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SQL_FIND_BY_SESSION =
            """
            SELECT actor_id, session_id, tier_requested, created_at
            FROM tiller.consent_records
            WHERE session_id = ?
            ORDER BY id
            """;

    private final JdbcSupport jdbc;

    public JdbcConsentLedger(DataSource dataSource) {
        this.jdbc = new JdbcSupport(Objects.requireNonNull(dataSource, "dataSource"));
    }

    @Override
    public void append(ConsentRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        jdbc.update(
                SQL_APPEND,
                ps -> {
                    ps.setString(1, record.actorId());
                    ps.setString(2, record.sessionId());
                    ps.setInt(3, record.tierRequested());
                    ps.setObject(4, JdbcSupport.utc(record.timestamp()));
                },
                "Failed to append consent record for session: " + record.sessionId());
    }

    @Override
    public List<ConsentRecord> findBySession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");

        return jdbc.queryList(
                SQL_FIND_BY_SESSION,
                ps -> ps.setString(1, sessionId),
                rs ->
                        new ConsentRecord(
                                rs.getString("actor_id"),
                                rs.getString("session_id"),
                                rs.getInt("tier_requested"),
                                JdbcSupport.instant(rs, "created_at")),
                "Failed to load consent records for session: " + sessionId);
    }
}
