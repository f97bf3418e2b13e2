package io.tiller.core.suspend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tiller.core.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySuspendStateRepositoryTest {

    private MutableClock clock;
    private InMemorySuspendStateRepository repository;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        repository = new InMemorySuspendStateRepository(clock);
    }

    @Test
    void shouldExpireStateAfterTtl() {
        repository.save(SuspendStateStoreTest.state("s1", 1), Duration.ofHours(1));

        clock.advance(Duration.ofMinutes(59));
        assertThat(repository.find("s1")).isPresent();

        clock.advance(Duration.ofMinutes(2));
        assertThat(repository.find("s1")).isEmpty();
    }

    @Test
    void shouldRefreshTtlOnSave() {
        repository.save(SuspendStateStoreTest.state("s1", 1), Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(50));
        repository.save(SuspendStateStoreTest.state("s1", 2), Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(50));

        assertThat(repository.find("s1")).isPresent();
    }

    @Test
    void shouldRejectStaleVersion() {
        repository.save(SuspendStateStoreTest.state("s1", 2), Duration.ofHours(1));

        assertThatThrownBy(
                        () ->
                                repository.save(
                                        SuspendStateStoreTest.state("s1", 2), Duration.ofHours(1)))
                .isInstanceOf(ConcurrentSuspendException.class);
    }

    @Test
    void shouldAcceptAnyVersionOnceExpired() {
        repository.save(SuspendStateStoreTest.state("s1", 5), Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(2));

        repository.save(SuspendStateStoreTest.state("s1", 1), Duration.ofMinutes(1));

        assertThat(repository.find("s1")).map(SuspendState::version).contains(1L);
    }

    @Test
    void shouldPurgeExpiredEntries() {
        repository.save(SuspendStateStoreTest.state("s1", 1), Duration.ofMinutes(1));
        repository.save(SuspendStateStoreTest.state("s2", 1), Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(5));

        assertThat(repository.purgeExpired()).isEqualTo(1);
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    void shouldReportWhetherDeleteRemovedAnything() {
        repository.save(SuspendStateStoreTest.state("s1", 1), Duration.ofHours(1));

        assertThat(repository.delete("s1")).isTrue();
        assertThat(repository.delete("s1")).isFalse();
    }
}
