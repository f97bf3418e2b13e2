package io.tiller.server.persistence;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;

/// Statement runner shared by the Tiller JDBC repositories.
///
/// SQL always comes from a `static final` constant of the calling repository and
/// parameters are always bound through a {@link StatementPreparer}. Every statement
/// runs on its own pooled connection in auto-commit mode; none of the Tiller tables
/// needs a multi-statement transaction.
///
/// Timestamps are written as `TIMESTAMPTZ` in UTC through {@link #utc(Instant)} and
/// read back with {@link #instant(ResultSet, String)}.
///
/// @implNote Thread-safe. Holds no state besides the pool.
final class JdbcSupport {

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /// Runs an INSERT, UPDATE or DELETE.
    ///
    /// @return number of affected rows
    /// @throws PersistenceException if the statement fails
    int update(String sql, StatementPreparer preparer, String errorContext) {
        return execute(sql, preparer, PreparedStatement::executeUpdate, errorContext);
    }

    /// Runs a SELECT expected to match at most one row; extra rows are ignored.
    ///
    /// @return the first mapped row, or empty, never null
    /// @throws PersistenceException if the query fails
    <T> Optional<T> queryOne(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        return execute(
                sql,
                preparer,
                ps -> {
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next() ? Optional.of(mapper.map(rs)) : Optional.<T>empty();
                    }
                },
                errorContext);
    }

    /// Runs a SELECT and maps every row in result order.
    ///
    /// @return mapped rows, never null
    /// @throws PersistenceException if the query fails
    <T> List<T> queryList(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        return execute(
                sql,
                preparer,
                ps -> {
                    List<T> rows = new ArrayList<>();
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            rows.add(mapper.map(rs));
                        }
                    }
                    return rows;
                },
                errorContext);
    }

    static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private <R> R execute(
            String sql,
            StatementPreparer preparer,
            StatementAction<R> action,
            String errorContext) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            return action.run(ps);
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Binds the parameters of a statement.
    ///
    /// {@snippet :
    /// StatementPreparer bySession = ps -> ps.setString(1, sessionId);
    /// }
    @FunctionalInterface
    interface StatementPreparer {
        void prepare(PreparedStatement ps) throws SQLException;
    }

    /// Maps the current row of a result set.
    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    private interface StatementAction<R> {
        R run(PreparedStatement ps) throws SQLException;
    }
}
