package com.ryuqq.tsflow.adapter.inmemory.protection;

import com.ryuqq.tsflow.core.protection.CircuitBreaker;
import com.ryuqq.tsflow.core.protection.CircuitBreakerConfig;
import com.ryuqq.tsflow.core.protection.CircuitBreakerRegistry;
import com.ryuqq.tsflow.core.protection.ResilienceEventListener;
import com.ryuqq.tsflow.core.protection.noop.NoOpResilienceEventListener;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CircuitBreakerRegistry} SPI.
 *
 * <p>Keeps exactly one {@link InMemoryCircuitBreaker} per endpoint name using
 * {@link ConcurrentHashMap#computeIfAbsent}. All breakers share the registry's
 * clock and event listener.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>State is process-local; remote workers keep their own breakers</li>
 *   <li>State is lost on process restart</li>
 * </ul>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreakerRegistry implements CircuitBreakerRegistry {

    private final ConcurrentHashMap<String, InMemoryCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ResilienceEventListener listener;

    public InMemoryCircuitBreakerRegistry() {
        this(Clock.systemUTC(), NoOpResilienceEventListener.INSTANCE);
    }

    public InMemoryCircuitBreakerRegistry(Clock clock, ResilienceEventListener listener) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.clock = clock;
        this.listener = listener;
    }

    @Override
    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return breakers.computeIfAbsent(name, key -> new InMemoryCircuitBreaker(key, config, clock, listener));
    }

    @Override
    public Optional<CircuitBreaker> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * Registered endpoint names.
     *
     * @return snapshot of names
     */
    public Set<String> names() {
        return Set.copyOf(breakers.keySet());
    }

    /**
     * Resets every registered breaker to CLOSED.
     */
    public void resetAll() {
        breakers.values().forEach(InMemoryCircuitBreaker::reset);
    }
}
