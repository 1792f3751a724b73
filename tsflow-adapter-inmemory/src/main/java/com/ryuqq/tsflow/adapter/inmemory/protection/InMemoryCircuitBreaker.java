package com.ryuqq.tsflow.adapter.inmemory.protection;

import com.ryuqq.tsflow.core.exception.ErrorClassifier;
import com.ryuqq.tsflow.core.exception.ErrorKind;
import com.ryuqq.tsflow.core.protection.CircuitBreaker;
import com.ryuqq.tsflow.core.protection.CircuitBreakerConfig;
import com.ryuqq.tsflow.core.protection.CircuitBreakerState;
import com.ryuqq.tsflow.core.protection.ResilienceEventListener;
import com.ryuqq.tsflow.core.protection.noop.NoOpResilienceEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link CircuitBreaker} SPI.
 *
 * <p>Tracks consecutive failures of a single logical endpoint inside the current process.
 * All state lives behind one {@link ReentrantLock}, so transitions are atomic with respect
 * to concurrent callers sharing the breaker.</p>
 *
 * <p><strong>State Machine:</strong></p>
 * <pre>
 * CLOSED    --(consecutive failures == failureThreshold)--&gt; OPEN
 * OPEN      --(tryAcquire() after recoveryTimeout)--------&gt; HALF_OPEN (caller becomes the probe)
 * HALF_OPEN --(probe success)-----------------------------&gt; CLOSED
 * HALF_OPEN --(probe failure)-----------------------------&gt; OPEN (recovery timer restarts)
 * </pre>
 *
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>The OPEN → HALF_OPEN check is lazy: the injected {@link Clock} is read on
 *       {@link #tryAcquire()}, no timer thread is involved</li>
 *   <li>HALF_OPEN admits exactly one in-flight probe; other callers are rejected until the
 *       probe reports back</li>
 *   <li>Caller errors ({@link ErrorKind#isCallerError()}: AUTHENTICATION, DATA_VALIDATION) are not
 *       counted. A probe ending that way only releases the probe slot</li>
 *   <li>Results reported while OPEN (calls admitted before the circuit opened) are ignored</li>
 *   <li>{@link #releasePermit()} (cancelled calls) never changes the failure count</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CircuitBreaker breaker = new InMemoryCircuitBreaker("bars-endpoint", CircuitBreakerConfig.defaults());
 *
 * if (breaker.tryAcquire()) {
 *     try {
 *         fetch();
 *         breaker.recordSuccess();
 *     } catch (RuntimeException e) {
 *         breaker.recordFailure(e);
 *         throw e;
 *     }
 * }
 * </pre>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ResilienceEventListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean probeInFlight;

    public InMemoryCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), NoOpResilienceEventListener.INSTANCE);
    }

    /**
     * Constructor.
     *
     * @param name endpoint name
     * @param config thresholds
     * @param clock time source for the recovery timeout
     * @param listener receives state transitions
     * @throws IllegalArgumentException if any argument is null or name is blank
     */
    public InMemoryCircuitBreaker(
        String name,
        CircuitBreakerConfig config,
        Clock clock,
        ResilienceEventListener listener
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.listener = listener;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean tryAcquire() {
        Transition transition = null;
        boolean permitted;

        lock.lock();
        try {
            permitted = switch (state) {
                case CLOSED -> true;
                case OPEN -> {
                    if (!recoveryElapsed()) {
                        yield false;
                    }
                    transition = moveTo(CircuitBreakerState.HALF_OPEN);
                    probeInFlight = true;
                    yield true;
                }
                case HALF_OPEN -> {
                    boolean free = !probeInFlight;
                    probeInFlight = true;
                    yield free;
                }
            };
        } finally {
            lock.unlock();
        }

        publish(transition);
        return permitted;
    }

    @Override
    public void recordSuccess() {
        Transition transition = null;

        lock.lock();
        try {
            if (state == CircuitBreakerState.HALF_OPEN) {
                transition = moveTo(CircuitBreakerState.CLOSED);
                probeInFlight = false;
                consecutiveFailures = 0;
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures = 0;
            }
        } finally {
            lock.unlock();
        }

        publish(transition);
    }

    @Override
    public void recordFailure(Throwable throwable) {
        ErrorKind kind = ErrorClassifier.classify(throwable);
        Transition transition = null;

        lock.lock();
        try {
            if (kind.isCallerError()) {
                if (state == CircuitBreakerState.HALF_OPEN) {
                    probeInFlight = false;
                }
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures++;
                if (consecutiveFailures >= config.failureThreshold()) {
                    transition = open();
                }
            } else if (state == CircuitBreakerState.HALF_OPEN) {
                transition = open();
            }
        } finally {
            lock.unlock();
        }

        publish(transition);
    }

    @Override
    public void releasePermit() {
        lock.lock();
        try {
            if (state == CircuitBreakerState.HALF_OPEN) {
                probeInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public void reset() {
        Transition transition;

        lock.lock();
        try {
            transition = moveTo(CircuitBreakerState.CLOSED);
            consecutiveFailures = 0;
            openedAt = null;
            probeInFlight = false;
        } finally {
            lock.unlock();
        }

        publish(transition);
    }

    /**
     * Current consecutive failure count (CLOSED state only).
     *
     * @return counted failures since the last success
     */
    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time left until a probe is admitted.
     *
     * @return remaining time, or {@link Duration#ZERO} unless OPEN
     */
    public Duration remainingOpenTime() {
        lock.lock();
        try {
            if (state != CircuitBreakerState.OPEN) {
                return Duration.ZERO;
            }
            Duration elapsed = Duration.between(openedAt, clock.instant());
            Duration remaining = config.recoveryTimeout().minus(elapsed);
            return remaining.isNegative() ? Duration.ZERO : remaining;
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private Transition open() {
        Transition transition = moveTo(CircuitBreakerState.OPEN);
        openedAt = clock.instant();
        probeInFlight = false;
        consecutiveFailures = 0;
        return transition;
    }

    // caller holds lock
    private Transition moveTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = next;
        return previous == next ? null : new Transition(previous, next);
    }

    // caller holds lock
    private boolean recoveryElapsed() {
        return !clock.instant().isBefore(openedAt.plus(config.recoveryTimeout()));
    }

    private void publish(Transition transition) {
        if (transition == null) {
            return;
        }
        if (transition.to() == CircuitBreakerState.OPEN) {
            log.warn("Circuit {} {} → {} (retry after {})", name, transition.from(), transition.to(),
                config.recoveryTimeout());
        } else {
            log.info("Circuit {} {} → {}", name, transition.from(), transition.to());
        }
        try {
            listener.onStateTransition(name, transition.from(), transition.to());
        } catch (RuntimeException e) {
            log.warn("ResilienceEventListener.onStateTransition failed for {}", name, e);
        }
    }

    private record Transition(CircuitBreakerState from, CircuitBreakerState to) {
    }
}
