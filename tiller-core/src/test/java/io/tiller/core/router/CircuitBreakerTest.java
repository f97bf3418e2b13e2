package io.tiller.core.router;

import static org.assertj.core.api.Assertions.assertThat;

import io.tiller.core.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {

    private static final String SOURCE = "bing_search";
    private static final Duration RESET = Duration.ofSeconds(300);

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        breaker = new CircuitBreaker(3, RESET, clock);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.recordFailure(SOURCE);
        }
    }

    @Nested
    class Opening {

        @Test
        void shouldStayClosedBelowThreshold() {
            fail(2);

            assertThat(breaker.state(SOURCE).status()).isEqualTo(CircuitStatus.CLOSED);
            assertThat(breaker.state(SOURCE).consecutiveFailures()).isEqualTo(2);
            assertThat(breaker.tryAcquire(SOURCE)).isTrue();
        }

        @Test
        void shouldOpenAtExactlyThreshold() {
            fail(3);

            CircuitState state = breaker.state(SOURCE);
            assertThat(state.status()).isEqualTo(CircuitStatus.OPEN);
            assertThat(state.openedAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
            assertThat(breaker.tryAcquire(SOURCE)).isFalse();
            assertThat(breaker.isOpen(SOURCE)).isTrue();
        }

        @Test
        void shouldResetFailureCountOnSuccess() {
            fail(2);
            breaker.recordSuccess(SOURCE);
            fail(2);

            assertThat(breaker.state(SOURCE).status()).isEqualTo(CircuitStatus.CLOSED);
        }
    }

    @Nested
    class HalfOpen {

        @BeforeEach
        void open() {
            fail(3);
        }

        @Test
        void shouldRefuseTrialBeforeResetTimeout() {
            clock.advance(RESET.minusSeconds(1));

            assertThat(breaker.tryAcquire(SOURCE)).isFalse();
            assertThat(breaker.state(SOURCE).status()).isEqualTo(CircuitStatus.OPEN);
        }

        @Test
        void shouldPermitExactlyOneTrialAfterResetTimeout() {
            clock.advance(RESET);

            assertThat(breaker.tryAcquire(SOURCE)).isTrue();
            assertThat(breaker.state(SOURCE).status()).isEqualTo(CircuitStatus.HALF_OPEN);
            assertThat(breaker.tryAcquire(SOURCE)).isFalse();
        }

        @Test
        void shouldCloseAfterSuccessfulTrial() {
            clock.advance(RESET);
            breaker.tryAcquire(SOURCE);

            breaker.recordSuccess(SOURCE);

            assertThat(breaker.state(SOURCE)).isEqualTo(CircuitState.INITIAL);
            assertThat(breaker.tryAcquire(SOURCE)).isTrue();
        }

        @Test
        void shouldReopenAndRestartTimerAfterFailedTrial() {
            clock.advance(RESET.plusSeconds(10));
            breaker.tryAcquire(SOURCE);

            breaker.recordFailure(SOURCE);

            CircuitState state = breaker.state(SOURCE);
            assertThat(state.status()).isEqualTo(CircuitStatus.OPEN);
            assertThat(state.openedAt()).isEqualTo(Instant.parse("2026-01-01T00:05:10Z"));

            clock.advance(RESET.minusSeconds(1));
            assertThat(breaker.tryAcquire(SOURCE)).isFalse();
            clock.advance(Duration.ofSeconds(1));
            assertThat(breaker.tryAcquire(SOURCE)).isTrue();
        }

        @Test
        void shouldReturnToOpenWhenTrialIsAbandoned() {
            clock.advance(RESET);
            breaker.tryAcquire(SOURCE);

            breaker.abandon(SOURCE);

            CircuitState state = breaker.state(SOURCE);
            assertThat(state.status()).isEqualTo(CircuitStatus.OPEN);
            assertThat(state.openedAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
            assertThat(breaker.tryAcquire(SOURCE)).isTrue();
        }
    }

    @Test
    void shouldIgnoreAbandonOutsideHalfOpen() {
        fail(1);

        breaker.abandon(SOURCE);
        breaker.abandon("never_called");

        assertThat(breaker.state(SOURCE).status()).isEqualTo(CircuitStatus.CLOSED);
        assertThat(breaker.state(SOURCE).consecutiveFailures()).isEqualTo(1);
        assertThat(breaker.state("never_called")).isEqualTo(CircuitState.INITIAL);
    }

    @Test
    void shouldTrackSourcesIndependently() {
        fail(3);

        assertThat(breaker.tryAcquire("reddit_api")).isTrue();
        assertThat(breaker.state("reddit_api")).isEqualTo(CircuitState.INITIAL);
    }
}
