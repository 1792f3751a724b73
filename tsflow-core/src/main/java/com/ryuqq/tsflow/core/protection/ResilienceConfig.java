package com.ryuqq.tsflow.core.protection;

import java.time.Duration;

/**
 * 재시도와 Circuit Breaker 설정을 묶은 통합 설정.
 *
 * <p>retry 가 null 이면 재시도 없이 1회만 시도합니다.
 * circuitBreakerEnabled 가 false 이면 Circuit Breaker 를 거치지 않습니다.</p>
 *
 * <p><strong>프리셋:</strong></p>
 * <ul>
 *   <li>{@link #defaults()}: 3회 지수 백오프(1s~16s), 임계값 5, 복구 30s</li>
 *   <li>{@link #forHighAvailability()}: 5회 jitter 백오프(500ms~8s), 임계값 3, 복구 15s</li>
 *   <li>{@link #forBatchProcessing()}: 2회 고정 5s, 임계값 10, 복구 60s</li>
 * </ul>
 *
 * @param retry 재시도 설정 (null 이면 재시도 비활성)
 * @param circuitBreaker Circuit Breaker 설정
 * @param circuitBreakerEnabled Circuit Breaker 사용 여부
 * @author TsFlow Team
 * @since 1.0.0
 */
public record ResilienceConfig(
    RetryConfig retry,
    CircuitBreakerConfig circuitBreaker,
    boolean circuitBreakerEnabled
) {

    public ResilienceConfig {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
    }

    public static ResilienceConfig defaults() {
        return new ResilienceConfig(RetryConfig.defaults(), CircuitBreakerConfig.defaults(), true);
    }

    public static ResilienceConfig forHighAvailability() {
        return new ResilienceConfig(
            new RetryConfig(5, RetryStrategy.EXPONENTIAL_BACKOFF_JITTER, Duration.ofMillis(500), Duration.ofSeconds(8)),
            new CircuitBreakerConfig(3, Duration.ofSeconds(15)),
            true
        );
    }

    public static ResilienceConfig forBatchProcessing() {
        return new ResilienceConfig(
            new RetryConfig(2, RetryStrategy.FIXED, Duration.ofSeconds(5), Duration.ofSeconds(5)),
            new CircuitBreakerConfig(10, Duration.ofSeconds(60)),
            true
        );
    }

    /**
     * 유효 최대 시도 횟수.
     *
     * @return retry 가 없으면 1
     */
    public int maxAttempts() {
        return retry == null ? 1 : retry.maxAttempts();
    }

    public ResilienceConfig withRetry(RetryConfig retry) {
        return new ResilienceConfig(retry, circuitBreaker, circuitBreakerEnabled);
    }

    public ResilienceConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new ResilienceConfig(retry, circuitBreaker, circuitBreakerEnabled);
    }

    public ResilienceConfig withoutRetry() {
        return new ResilienceConfig(null, circuitBreaker, circuitBreakerEnabled);
    }

    public ResilienceConfig withCircuitBreakerDisabled() {
        return new ResilienceConfig(retry, circuitBreaker, false);
    }
}
