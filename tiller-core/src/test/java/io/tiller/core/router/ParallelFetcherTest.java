package io.tiller.core.router;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.tiller.core.MutableClock;
import io.tiller.core.degradation.DegradationMode;
import io.tiller.core.degradation.DegradationPolicy;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParallelFetcherTest {

    private final CountDownLatch release = new CountDownLatch(1);

    private ExecutorService executor;
    private MutableClock clock;
    private CircuitBreaker breaker;
    private InMemorySourceUsageLog usageLog;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        breaker = new CircuitBreaker(3, Duration.ofMinutes(5), clock);
        usageLog = new InMemorySourceUsageLog();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    private SourcePayload answer(SourceDefinition source, FetchRequest request) throws Exception {
        if (source.name().equals("slow")) {
            release.await(10, TimeUnit.SECONDS);
            return SourcePayload.empty();
        }
        if (source.name().startsWith("sleepy")) {
            Thread.sleep(300);
            return new SourcePayload(List.of(ResultItem.of(source.name(), BigDecimal.ONE)), List.of());
        }
        if (source.name().equals("broken")) {
            throw new IllegalStateException("HTTP 503");
        }
        return new SourcePayload(
                List.of(ResultItem.of(source.name() + " item", BigDecimal.TEN)), List.of());
    }

    private ParallelFetcher fetcher(SourceUsageLog log, DegradationPolicy policy) {
        return new ParallelFetcher(executor, this::answer, breaker, log, policy, clock);
    }

    private static FetchRequest request() {
        return new FetchRequest("product", "headphones", 1, Map.of());
    }

    @Test
    void shouldIsolateTimeoutsAndErrorsFromHealthySources() {
        SourceDefinition fast = SourceDefinition.of("fast", "fast", 2);
        SourceDefinition slow =
                new SourceDefinition("slow", "slow", 5, Duration.ofMillis(100), false, null);
        SourceDefinition broken = SourceDefinition.of("broken", "broken", 1);

        Map<String, SourceOutcome> outcomes =
                fetcher(usageLog, DegradationPolicy.defaults())
                        .fetchAll(List.of(slow, fast, broken), request(), "s1", "u1");

        assertThat(outcomes).containsOnlyKeys("slow", "fast", "broken");
        assertThat(outcomes.keySet()).containsExactly("slow", "fast", "broken");
        assertThat(outcomes.get("fast").status()).isEqualTo(FetchStatus.SUCCESS);
        assertThat(outcomes.get("fast").payload().items()).hasSize(1);
        assertThat(outcomes.get("slow").status()).isEqualTo(FetchStatus.TIMEOUT);
        assertThat(outcomes.get("broken").status()).isEqualTo(FetchStatus.ERROR);
        assertThat(outcomes.get("broken").error()).isEqualTo("IllegalStateException: HTTP 503");
    }

    @Test
    void shouldStartTimeoutWhenSourceStartsRunning() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            SourceDefinition first =
                    new SourceDefinition("sleepy_a", "a", 1, Duration.ofMillis(500), false, null);
            SourceDefinition second =
                    new SourceDefinition("sleepy_b", "b", 1, Duration.ofMillis(500), false, null);
            ParallelFetcher queued =
                    new ParallelFetcher(
                            single, this::answer, breaker, usageLog, DegradationPolicy.defaults(), clock);

            Map<String, SourceOutcome> outcomes =
                    queued.fetchAll(List.of(first, second), request(), "s1", null);

            assertThat(outcomes.get("sleepy_a").status()).isEqualTo(FetchStatus.SUCCESS);
            assertThat(outcomes.get("sleepy_b").status()).isEqualTo(FetchStatus.SUCCESS);
            assertThat(breaker.state("sleepy_b")).isEqualTo(CircuitState.INITIAL);
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void shouldNotChargeCircuitForCallThatNeverStarted() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        CountDownLatch occupied = new CountDownLatch(1);
        try {
            single.submit(
                    () -> {
                        occupied.countDown();
                        release.await(10, TimeUnit.SECONDS);
                        return null;
                    });
            occupied.await(5, TimeUnit.SECONDS);
            for (int i = 0; i < 3; i++) {
                breaker.recordFailure("trial");
            }
            clock.advance(Duration.ofMinutes(5));
            assertThat(breaker.tryAcquire("trial")).isTrue();
            SourceDefinition fast =
                    new SourceDefinition("fast", "fast", 2, Duration.ofMillis(100), false, null);
            SourceDefinition trial =
                    new SourceDefinition("trial", "trial", 2, Duration.ofMillis(100), false, null);
            ParallelFetcher saturated =
                    new ParallelFetcher(
                            single, this::answer, breaker, usageLog, DegradationPolicy.defaults(), clock);

            Map<String, SourceOutcome> outcomes =
                    saturated.fetchAll(List.of(fast, trial), request(), "s1", null);

            assertThat(outcomes.values())
                    .extracting(SourceOutcome::status)
                    .containsOnly(FetchStatus.NOT_STARTED);
            assertThat(breaker.state("fast")).isEqualTo(CircuitState.INITIAL);
            assertThat(breaker.state("trial").status()).isEqualTo(CircuitStatus.OPEN);
            assertThat(breaker.tryAcquire("trial")).isTrue();
            assertThat(usageLog.entries()).isEmpty();
        } finally {
            release.countDown();
            single.shutdownNow();
        }
    }

    @Test
    void shouldReleaseUnreportedPermitsWhenUsageLogFailsClosed() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure("recovering");
        }
        clock.advance(Duration.ofMinutes(5));
        assertThat(breaker.tryAcquire("recovering")).isTrue();
        SourceUsageLog failing =
                new SourceUsageLog() {
                    @Override
                    public void record(SourceUsage usage) {
                        throw new IllegalStateException("log down");
                    }

                    @Override
                    public List<SourceUsage> findBySession(String sessionId) {
                        return List.of();
                    }
                };
        DegradationPolicy closed =
                DegradationPolicy.withOverrides(
                        key ->
                                key.equals(DegradationPolicy.SOURCE_USAGE_LOG)
                                        ? Optional.of(DegradationMode.FAIL_CLOSED.name())
                                        : Optional.empty());

        assertThatThrownBy(
                        () ->
                                fetcher(failing, closed)
                                        .fetchAll(
                                                List.of(
                                                        SourceDefinition.of("fast", "fast", 2),
                                                        SourceDefinition.of(
                                                                "recovering", "recovering", 1)),
                                                request(),
                                                "s1",
                                                null))
                .isInstanceOf(IllegalStateException.class);

        assertThat(breaker.state("recovering").status()).isEqualTo(CircuitStatus.OPEN);
        assertThat(breaker.tryAcquire("recovering")).isTrue();
    }

    @Test
    void shouldReleasePermitsWhenPoolRejectsCalls() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure("recovering");
        }
        clock.advance(Duration.ofMinutes(5));
        assertThat(breaker.tryAcquire("recovering")).isTrue();
        executor.shutdown();

        assertThatThrownBy(
                        () ->
                                fetcher(usageLog, DegradationPolicy.defaults())
                                        .fetchAll(
                                                List.of(
                                                        SourceDefinition.of(
                                                                "recovering", "recovering", 1)),
                                                request(),
                                                "s1",
                                                null))
                .isInstanceOf(RejectedExecutionException.class);

        assertThat(breaker.state("recovering").status()).isEqualTo(CircuitStatus.OPEN);
        assertThat(usageLog.findBySession("s1")).isEmpty();
    }

    @Test
    void shouldReportOutcomesToCircuitBreaker() {
        breaker.recordFailure("fast");

        fetcher(usageLog, DegradationPolicy.defaults())
                .fetchAll(
                        List.of(
                                SourceDefinition.of("fast", "fast", 2),
                                SourceDefinition.of("broken", "broken", 1)),
                        request(),
                        "s1",
                        "u1");

        assertThat(breaker.state("fast")).isEqualTo(CircuitState.INITIAL);
        assertThat(breaker.state("broken").consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void shouldRecordUsageWithZeroCostForFailures() {
        fetcher(usageLog, DegradationPolicy.defaults())
                .fetchAll(
                        List.of(
                                SourceDefinition.of("fast", "fast", 2),
                                SourceDefinition.of("broken", "broken", 7)),
                        request(),
                        "s1",
                        "u1");

        assertThat(usageLog.entries())
                .extracting(SourceUsage::source, SourceUsage::costCents, SourceUsage::success)
                .containsExactly(
                        tuple("fast", 2, true),
                        tuple("broken", 0, false));
        assertThat(usageLog.entries())
                .allSatisfy(
                        u -> {
                            assertThat(u.actorId()).isEqualTo("u1");
                            assertThat(u.tier()).isEqualTo(1);
                            assertThat(u.timestamp()).isEqualTo(clock.instant());
                        });
    }

    @Test
    void shouldIgnoreUsageLogFailureWhenFailOpen() {
        SourceUsageLog failing =
                new SourceUsageLog() {
                    @Override
                    public void record(SourceUsage usage) {
                        throw new IllegalStateException("log down");
                    }

                    @Override
                    public List<SourceUsage> findBySession(String sessionId) {
                        return List.of();
                    }
                };

        Map<String, SourceOutcome> outcomes =
                fetcher(failing, DegradationPolicy.defaults())
                        .fetchAll(List.of(SourceDefinition.of("fast", "fast", 2)), request(), "s1", null);

        assertThat(outcomes.get("fast").isSuccess()).isTrue();

        DegradationPolicy closed =
                DegradationPolicy.withOverrides(
                        key ->
                                key.equals(DegradationPolicy.SOURCE_USAGE_LOG)
                                        ? Optional.of(DegradationMode.FAIL_CLOSED.name())
                                        : Optional.empty());

        assertThatThrownBy(
                        () ->
                                fetcher(failing, closed)
                                        .fetchAll(
                                                List.of(SourceDefinition.of("fast", "fast", 2)),
                                                request(),
                                                "s1",
                                                null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("log down");
    }
}
