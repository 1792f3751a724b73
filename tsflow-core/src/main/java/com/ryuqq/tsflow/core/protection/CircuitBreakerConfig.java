package com.ryuqq.tsflow.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * @param failureThreshold OPEN 전이까지 허용하는 연속 실패 수 (양수)
 * @param recoveryTimeout OPEN 진입 후 probe 허용까지 대기 시간 (양수)
 * @author TsFlow Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException failureThreshold 가 양수가 아니거나 recoveryTimeout 이 양수가 아닌 경우
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive (current: " + recoveryTimeout + ")");
        }
    }

    /**
     * 기본 설정 (failureThreshold=5, recoveryTimeout=30s).
     *
     * @return 기본 설정
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT);
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout);
    }
}
