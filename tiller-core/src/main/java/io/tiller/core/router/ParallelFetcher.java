package io.tiller.core.router;

import io.tiller.core.degradation.DegradationPolicy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fetches all sources of a tier concurrently, each bounded by its own timeout.
///
/// Every call outcome is reported to the {@link CircuitBreaker} and written to the
/// {@link SourceUsageLog}. A failing source never affects its siblings, and a call
/// that waits in a saturated pool is not charged to its source.
///
/// @implNote Thread-safe. The ExecutorService is owned by the caller and is NOT shut
/// down here. Timed-out calls are cancelled with interruption.
public class ParallelFetcher {

    private static final Logger logger = Logger.getLogger(ParallelFetcher.class.getName());

    private final ExecutorService executorService;
    private final SourceFetcher fetcher;
    private final CircuitBreaker circuitBreaker;
    private final SourceUsageLog usageLog;
    private final DegradationPolicy degradationPolicy;
    private final Clock clock;

    public ParallelFetcher(
            ExecutorService executorService,
            SourceFetcher fetcher,
            CircuitBreaker circuitBreaker,
            SourceUsageLog usageLog,
            DegradationPolicy degradationPolicy,
            Clock clock) {
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.circuitBreaker =
                Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        this.usageLog = Objects.requireNonNull(usageLog, "usageLog must not be null");
        this.degradationPolicy =
                Objects.requireNonNull(degradationPolicy, "degradationPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Fetches a tier's sources in parallel.
    ///
    /// Callers must already hold a {@link CircuitBreaker#tryAcquire(String)} permit
    /// for each source. Each source's timeout runs from the moment its call starts.
    /// A call still queued when its timeout has passed since submission is not made
    /// at all: it yields `NOT_STARTED`, releases its permit and counts neither for
    /// nor against the circuit. Permits of sources left unreported because the
    /// fetch is aborted are released the same way.
    ///
    /// @param sources sources to call, not null
    /// @param request query, not null
    /// @param sessionId conversation id for usage records, not null
    /// @param actorId user id for usage records, may be null
    /// @return outcomes keyed by source name in input order, never null
    /// @throws IllegalStateException if the calling thread is interrupted
    public Map<String, SourceOutcome> fetchAll(
            List<SourceDefinition> sources, FetchRequest request, String sessionId, String actorId) {
        Objects.requireNonNull(sources, "sources must not be null");
        Objects.requireNonNull(request, "request must not be null");

        List<Attempt> attempts = new ArrayList<>(sources.size());
        for (SourceDefinition source : sources) {
            attempts.add(new Attempt(source));
        }

        Map<String, SourceOutcome> outcomes = new LinkedHashMap<>();
        try {
            long submitted = System.nanoTime();
            for (Attempt attempt : attempts) {
                attempt.future = executorService.submit(() -> attempt.run(fetcher, request));
            }
            for (Attempt attempt : attempts) {
                SourceOutcome outcome = await(attempt, submitted);
                outcomes.put(attempt.source.name(), outcome);
                report(attempt.source, outcome, request.tier(), sessionId, actorId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Tier fetch interrupted", e);
        } finally {
            for (Attempt attempt : attempts) {
                if (!outcomes.containsKey(attempt.source.name())) {
                    if (attempt.future != null) {
                        attempt.future.cancel(true);
                    }
                    circuitBreaker.abandon(attempt.source.name());
                }
            }
        }
        return outcomes;
    }

    private SourceOutcome await(Attempt attempt, long submittedNanos) throws InterruptedException {
        SourceDefinition source = attempt.source;
        long timeoutNanos = source.timeout().toNanos();

        boolean started =
                attempt.started.await(
                        remainingNanos(submittedNanos + timeoutNanos), TimeUnit.NANOSECONDS);
        if (!started && attempt.skip()) {
            attempt.future.cancel(false);
            logger.warning(
                    "Source never started within "
                            + source.timeout().toMillis()
                            + "ms, fetch pool saturated: "
                            + source.name());
            return SourceOutcome.failure(
                    source.name(), FetchStatus.NOT_STARTED, "fetch pool saturated", Duration.ZERO);
        }
        // the call claimed its slot first; its start mark follows immediately
        attempt.started.await();

        try {
            SourcePayload payload =
                    attempt.future.get(
                            remainingNanos(attempt.startedNanos + timeoutNanos),
                            TimeUnit.NANOSECONDS);
            return SourceOutcome.success(source.name(), payload, attempt.elapsed());
        } catch (TimeoutException e) {
            attempt.future.cancel(true);
            logger.warning(
                    "Source timed out after " + source.timeout().toMillis() + "ms: " + source.name());
            return SourceOutcome.failure(
                    source.name(), FetchStatus.TIMEOUT, "timeout", attempt.elapsed());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warning("Source failed: " + source.name() + " - " + cause.getMessage());
            return SourceOutcome.failure(
                    source.name(),
                    FetchStatus.ERROR,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                    attempt.elapsed());
        }
    }

    private void report(
            SourceDefinition source,
            SourceOutcome outcome,
            int tier,
            String sessionId,
            String actorId) {
        if (outcome.status() == FetchStatus.NOT_STARTED) {
            circuitBreaker.abandon(source.name());
            return;
        }
        if (outcome.isSuccess()) {
            circuitBreaker.recordSuccess(source.name());
        } else {
            circuitBreaker.recordFailure(source.name());
        }

        SourceUsage usage =
                new SourceUsage(
                        actorId,
                        sessionId,
                        source.name(),
                        tier,
                        outcome.isSuccess() ? source.costCents() : 0,
                        outcome.latency().toMillis(),
                        outcome.isSuccess(),
                        outcome.error(),
                        clock.instant());
        try {
            usageLog.record(usage);
        } catch (RuntimeException e) {
            if (!degradationPolicy.isFailOpen(DegradationPolicy.SOURCE_USAGE_LOG)) {
                throw e;
            }
            logger.log(Level.WARNING, "Failed to record usage for source " + source.name(), e);
        }
    }

    private static long remainingNanos(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    /// One submitted source call. The pool thread and the waiting caller race to
    /// claim it: the thread to run it, the caller to skip it.
    private static final class Attempt {

        private final SourceDefinition source;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedNanos;
        private Future<SourcePayload> future;

        Attempt(SourceDefinition source) {
            this.source = source;
        }

        SourcePayload run(SourceFetcher fetcher, FetchRequest request) throws Exception {
            if (!claimed.compareAndSet(false, true)) {
                throw new CancellationException("Skipped before start: " + source.name());
            }
            startedNanos = System.nanoTime();
            started.countDown();
            return fetcher.fetch(source, request);
        }

        boolean skip() {
            return claimed.compareAndSet(false, true);
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startedNanos);
        }
    }
}
