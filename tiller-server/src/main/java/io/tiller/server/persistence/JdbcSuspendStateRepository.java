package io.tiller.server.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tiller.core.suspend.ConcurrentSuspendException;
import io.tiller.core.suspend.SuspendState;
import io.tiller.core.suspend.SuspendStateRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// PostgreSQL-backed durable tier of the suspend/resume store.
///
/// Each session has at most one row keyed by {@link SuspendState#key(String)}. The
/// state document is stored as JSONB next to its `version` and `expires_at`.
/// Expired rows are invisible to {@link #find(String)} and are deleted by
/// {@link #purgeExpired()}.
///
/// ### Optimistic versioning
/// `save` is an UPSERT whose update branch only fires when the stored row is
/// older (`version < new version`) or already expired. Zero affected rows means a
/// concurrent turn wrote first, which surfaces as {@link ConcurrentSuspendException}.
///
/// ### Contracts
/// - **Precondition**: Flyway migration `V1__create_schema` has run
/// - **Postcondition**: `save` refreshes `expires_at` to `now + ttl`
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection from the
/// Agroal pool via {@link JdbcSupport}.
///
/// @see io.tiller.core.suspend.SuspendStateStore for the process-local tier
public class JdbcSuspendStateRepository implements SuspendStateRepository {

    // --- SQL constants ---

    private static final String SQL_SAVE =
            """
            INSERT INTO tiller.suspend_states AS s
                (session_key, session_id, intent, version, state, updated_at, expires_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?, ?)
            ON CONFLICT (session_key)
            DO UPDATE SET
                intent     = EXCLUDED.intent,
                version    = EXCLUDED.version,
                state      = EXCLUDED.state,
                updated_at = EXCLUDED.updated_at,
                expires_at = EXCLUDED.expires_at
            WHERE s.version < EXCLUDED.version OR s.expires_at <= EXCLUDED.updated_at
            """;

    private static final String SQL_FIND =
            """
            SELECT state FROM tiller.suspend_states
            WHERE session_key = ? AND expires_at > ?
            """;

    private static final String SQL_DELETE =
            "DELETE FROM tiller.suspend_states WHERE session_key = ?";

    private static final String SQL_PURGE_EXPIRED =
            "DELETE FROM tiller.suspend_states WHERE expires_at <= ?";

    private final JdbcSupport jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcSuspendStateRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this(dataSource, objectMapper, Clock.systemUTC());
    }

    public JdbcSuspendStateRepository(
            DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = new JdbcSupport(Objects.requireNonNull(dataSource, "dataSource"));
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<SuspendState> find(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");

        return jdbc.queryOne(
                SQL_FIND,
                ps -> {
                    ps.setString(1, SuspendState.key(sessionId));
                    ps.setObject(2, JdbcSupport.utc(clock.instant()));
                },
                rs -> readState(rs.getString("state")),
                "Failed to load suspend state for session: " + sessionId);
    }

    @Override
    public void save(SuspendState state, Duration ttl) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");

        String json = writeState(state);
        Instant now = clock.instant();
        int updated =
                jdbc.update(
                        SQL_SAVE,
                        ps -> {
                            ps.setString(1, SuspendState.key(state.sessionId()));
                            ps.setString(2, state.sessionId());
                            ps.setString(3, state.intent());
                            ps.setLong(4, state.version());
                            ps.setString(5, json);
                            ps.setObject(6, JdbcSupport.utc(now));
                            ps.setObject(7, JdbcSupport.utc(now.plus(ttl)));
                        },
                        "Failed to save suspend state for session: " + state.sessionId());

        if (updated == 0) {
            throw new ConcurrentSuspendException(state.sessionId(), state.version());
        }
    }

    @Override
    public boolean delete(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");

        return jdbc.update(
                        SQL_DELETE,
                        ps -> ps.setString(1, SuspendState.key(sessionId)),
                        "Failed to delete suspend state for session: " + sessionId)
                > 0;
    }

    @Override
    public int purgeExpired() {
        return jdbc.update(
                SQL_PURGE_EXPIRED,
                ps -> ps.setObject(1, JdbcSupport.utc(clock.instant())),
                "Failed to purge expired suspend states");
    }

    // --- Internal helpers ---

    private String writeState(SuspendState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize suspend state to JSON", e);
        }
    }

    private SuspendState readState(String json) {
        try {
            return objectMapper.readValue(json, SuspendState.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize suspend state from JSON", e);
        }
    }
}
