package io.tiller.server.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import io.tiller.core.router.ConsentRecord;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcConsentLedgerTest extends JdbcTestBase {

    private JdbcConsentLedger ledger;

    @BeforeEach
    void setUp() throws SQLException {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement()) {
            st.executeUpdate("DELETE FROM tiller.consent_records");
        }
        ledger = new JdbcConsentLedger(dataSource);
    }

    @Test
    void append_thenFindBySessionInInsertionOrder() {
        Instant first = Instant.parse("2026-03-01T10:00:00Z");
        Instant second = Instant.parse("2026-03-01T10:05:00Z");
        ledger.append(new ConsentRecord("user-1", "s-1", 3, first));
        ledger.append(new ConsentRecord("user-1", "s-2", 3, first));
        ledger.append(new ConsentRecord(null, "s-1", 4, second));

        List<ConsentRecord> records = ledger.findBySession("s-1");

        assertThat(records)
                .containsExactly(
                        new ConsentRecord("user-1", "s-1", 3, first),
                        new ConsentRecord(null, "s-1", 4, second));
    }

    @Test
    void findBySession_unknownSessionIsEmpty() {
        assertThat(ledger.findBySession("nobody")).isEmpty();
    }
}
