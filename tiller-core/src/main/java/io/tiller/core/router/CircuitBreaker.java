package io.tiller.core.router;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/// Per-source failure tracker that stops calling a repeatedly failing source.
///
/// ### Transitions
/// - `CLOSED`: every call is permitted. The `threshold`-th consecutive failure
///   opens the circuit and records `openedAt`.
/// - `OPEN`: calls are refused until `resetTimeout` has elapsed since `openedAt`;
///   the first request after that becomes the single trial call (`HALF_OPEN`).
/// - `HALF_OPEN`: further requests are refused. A successful trial closes the
///   circuit; a failed trial reopens it with a fresh `openedAt`.
///
/// A success always resets the failure count and closes the circuit. A permit
/// that is granted but never reported must be returned with {@link #abandon(String)},
/// otherwise a `HALF_OPEN` circuit would refuse every later call.
///
/// ### Usage
/// {@snippet :
/// CircuitBreaker breaker = new CircuitBreaker(3, Duration.ofMinutes(5), Clock.systemUTC());
/// if (breaker.tryAcquire("bing_search")) {
///     try {
///         call();
///         breaker.recordSuccess("bing_search");
///     } catch (Exception e) {
///         breaker.recordFailure("bing_search");
///     }
/// }
/// }
///
/// @implNote Thread-safe. State transitions are atomic per source. Intended to live
/// for the whole process; state is never persisted or surfaced to users.
public class CircuitBreaker {

    private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

    public static final int DEFAULT_THRESHOLD = 3;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(300);

    private final int threshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final Map<String, CircuitState> states = new ConcurrentHashMap<>();

    public CircuitBreaker() {
        this(DEFAULT_THRESHOLD, DEFAULT_RESET_TIMEOUT, Clock.systemUTC());
    }

    /// Creates a circuit breaker.
    ///
    /// @param threshold consecutive failures that open a circuit, >= 1
    /// @param resetTimeout time an open circuit waits before a trial call, positive
    /// @param clock time source, not null
    public CircuitBreaker(int threshold, Duration resetTimeout, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        this.threshold = threshold;
        this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Asks permission to call a source.
    ///
    /// An open circuit whose reset timeout has elapsed moves to `HALF_OPEN` and
    /// grants exactly this call as its trial.
    ///
    /// @apiNote **Side effects**: may move the circuit from `OPEN` to `HALF_OPEN`
    ///
    /// @param source source name, not null
    /// @return true if the call may proceed
    public boolean tryAcquire(String source) {
        Objects.requireNonNull(source, "source must not be null");
        Instant now = clock.instant();
        AtomicBoolean permitted = new AtomicBoolean();
        states.compute(
                source,
                (name, current) -> {
                    CircuitState state = current != null ? current : CircuitState.INITIAL;
                    switch (state.status()) {
                        case CLOSED -> {
                            permitted.set(true);
                            return state;
                        }
                        case OPEN -> {
                            if (!now.isBefore(state.openedAt().plus(resetTimeout))) {
                                permitted.set(true);
                                logger.info("Circuit half-open, permitting trial call: " + name);
                                return new CircuitState(
                                        CircuitStatus.HALF_OPEN,
                                        state.consecutiveFailures(),
                                        state.openedAt());
                            }
                            return state;
                        }
                        default -> {
                            return state;
                        }
                    }
                });
        return permitted.get();
    }

    /// Records a successful call, closing the circuit.
    ///
    /// @param source source name, not null
    public void recordSuccess(String source) {
        Objects.requireNonNull(source, "source must not be null");
        CircuitState previous = states.put(source, CircuitState.INITIAL);
        if (previous != null && previous.status() != CircuitStatus.CLOSED) {
            logger.info("Circuit closed: " + source);
        }
    }

    /// Records a failed call.
    ///
    /// @param source source name, not null
    public void recordFailure(String source) {
        Objects.requireNonNull(source, "source must not be null");
        Instant now = clock.instant();
        states.compute(
                source,
                (name, current) -> {
                    CircuitState state = current != null ? current : CircuitState.INITIAL;
                    int failures = state.consecutiveFailures() + 1;
                    if (state.status() == CircuitStatus.HALF_OPEN) {
                        logger.warning("Trial call failed, circuit reopened: " + name);
                        return new CircuitState(CircuitStatus.OPEN, failures, now);
                    }
                    if (state.status() == CircuitStatus.OPEN) {
                        return new CircuitState(CircuitStatus.OPEN, failures, state.openedAt());
                    }
                    if (failures >= threshold) {
                        logger.warning(
                                "Circuit opened after " + failures + " consecutive failures: " + name);
                        return new CircuitState(CircuitStatus.OPEN, failures, now);
                    }
                    return new CircuitState(CircuitStatus.CLOSED, failures, state.openedAt());
                });
    }

    /// Releases a permit whose call never produced an outcome.
    ///
    /// A trial that was granted but never made puts the circuit back to `OPEN`
    /// with its original `openedAt`, so the next request may try again at once.
    /// Other states are left unchanged.
    ///
    /// @param source source name, not null
    public void abandon(String source) {
        Objects.requireNonNull(source, "source must not be null");
        states.computeIfPresent(
                source,
                (name, state) -> {
                    if (state.status() != CircuitStatus.HALF_OPEN) {
                        return state;
                    }
                    logger.info("Trial call abandoned, circuit back to open: " + name);
                    return new CircuitState(
                            CircuitStatus.OPEN, state.consecutiveFailures(), state.openedAt());
                });
    }

    /// Returns the current state of a source's circuit.
    ///
    /// @param source source name, not null
    /// @return state snapshot, {@link CircuitState#INITIAL} for unseen sources
    public CircuitState state(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return states.getOrDefault(source, CircuitState.INITIAL);
    }

    /// Returns whether calls to a source are currently suppressed.
    ///
    /// Does not grant a trial call; use {@link #tryAcquire(String)} before calling.
    ///
    /// @param source source name, not null
    /// @return true if the circuit is open and its reset timeout has not elapsed,
    ///         or a trial call is in flight
    public boolean isOpen(String source) {
        CircuitState state = state(source);
        return switch (state.status()) {
            case CLOSED -> false;
            case HALF_OPEN -> true;
            case OPEN -> clock.instant().isBefore(state.openedAt().plus(resetTimeout));
        };
    }

    public void reset(String source) {
        states.remove(source);
    }
}
