package io.tiller.server.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.router.ConsentRecord;
import io.tiller.core.router.InMemoryConsentLedger;
import io.tiller.core.router.InMemorySourceUsageLog;
import io.tiller.core.router.SourceUsage;
import io.tiller.core.slot.FieldSet;
import io.tiller.core.slot.FollowUpQuestion;
import io.tiller.core.slot.Provenance;
import io.tiller.core.suspend.InMemorySuspendStateRepository;
import io.tiller.core.suspend.SuspendState;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SessionResourceTest {

    private InMemorySuspendStateRepository repository;
    private InMemoryConsentLedger ledger;
    private InMemorySourceUsageLog usageLog;
    private SessionResource resource;

    @BeforeEach
    void setUp() {
        repository = new InMemorySuspendStateRepository();
        ledger = new InMemoryConsentLedger();
        usageLog = new InMemorySourceUsageLog();
        resource = new SessionResource(repository, ledger, usageLog);
    }

    private static SuspendState suspended(String sessionId, List<FollowUpQuestion> questions) {
        FieldSet fields = new FieldSet();
        fields.put("destination", "Lisbon", Provenance.EXTRACTED);
        return new SuspendState(
                sessionId,
                "travel",
                fields,
                questions,
                ExecutionPlan.sequential(List.of("travel_search_hotels", "travel_compose")),
                Map.of(),
                1);
    }

    @Nested
    class Suspension {

        @Test
        void shouldDescribeActiveSuspension() {
            repository.save(
                    suspended("s-1", List.of(new FollowUpQuestion("check_in", "When?"))),
                    Duration.ofHours(1));

            Map<String, Object> entity;
            try (Response response = resource.getSuspension("s-1")) {
                assertThat(response.getStatus()).isEqualTo(200);
                entity = (Map<String, Object>) response.getEntity();
            }

            assertThat(entity.get("intent")).isEqualTo("travel");
            assertThat(entity.get("version")).isEqualTo(1L);
            assertThat((List<String>) entity.get("outstandingFields")).containsExactly("check_in");
            assertThat((List<String>) entity.get("filledFields")).containsExactly("destination");
            assertThat((List<TurnResponse.Step>) entity.get("plan")).hasSize(2);
        }

        @Test
        void shouldReturn404WhenNothingStored() {
            assertThatThrownBy(() -> resource.getSuspension("missing"))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void shouldTreatStateWithoutQuestionsAsAbsent() {
            repository.save(suspended("s-2", List.of()), Duration.ofHours(1));

            assertThatThrownBy(() -> resource.getSuspension("s-2"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        void shouldDeleteSuspension() {
            repository.save(
                    suspended("s-1", List.of(new FollowUpQuestion("check_in", "When?"))),
                    Duration.ofHours(1));

            try (Response response = resource.deleteSuspension("s-1")) {
                assertThat(response.getStatus()).isEqualTo(204);
            }
            assertThat(repository.find("s-1")).isEmpty();
        }

        @Test
        void shouldReturn404WhenDeletingUnknownSession() {
            assertThatThrownBy(() -> resource.deleteSuspension("missing"))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Test
    void shouldListConsentsOfSession() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        ledger.append(new ConsentRecord("user-1", "s-1", 3, now));
        ledger.append(new ConsentRecord("user-2", "s-2", 3, now));

        assertThat(resource.listConsents("s-1"))
                .singleElement()
                .extracting(ConsentRecord::actorId)
                .isEqualTo("user-1");
    }

    @Test
    void shouldListUsageOfSession() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        usageLog.record(new SourceUsage("user-1", "s-1", "amadeus", 1, 0, 120, true, null, now));
        usageLog.record(
                new SourceUsage("user-1", "s-1", "skyscanner", 2, 0, 5000, false, "timeout", now));

        assertThat(resource.listUsage("s-1"))
                .extracting(SourceUsage::source)
                .containsExactly("amadeus", "skyscanner");
    }
}
