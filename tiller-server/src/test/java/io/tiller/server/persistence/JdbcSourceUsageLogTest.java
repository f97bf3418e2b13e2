package io.tiller.server.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import io.tiller.core.router.SourceUsage;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcSourceUsageLogTest extends JdbcTestBase {

    private JdbcSourceUsageLog usageLog;

    @BeforeEach
    void setUp() throws SQLException {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement()) {
            st.executeUpdate("DELETE FROM tiller.source_usage");
        }
        usageLog = new JdbcSourceUsageLog(dataSource);
    }

    @Test
    void record_thenFindBySession() {
        Instant at = Instant.parse("2026-03-01T10:00:00Z");
        SourceUsage ok = new SourceUsage("user-1", "s-1", "amadeus", 1, 0, 140, true, null, at);
        SourceUsage failed =
                new SourceUsage("user-1", "s-1", "serpapi", 4, 1, 8000, false, "timeout", at);
        usageLog.record(ok);
        usageLog.record(failed);
        usageLog.record(new SourceUsage("user-2", "s-2", "booking", 1, 0, 90, true, null, at));

        assertThat(usageLog.findBySession("s-1")).containsExactly(ok, failed);
    }
}
