package com.ryuqq.tsflow.core.protection;

import java.time.Duration;

/**
 * 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 시도를 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>strategy: 지연 계산 전략 (기본 EXPONENTIAL_BACKOFF)</li>
 *   <li>baseDelay: 기본 지연 (기본 1s)</li>
 *   <li>maxDelay: 지연 상한 (기본 16s)</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param strategy 재시도 전략
 * @param baseDelay 기본 지연 (0 이상)
 * @param maxDelay 최대 지연 (baseDelay 이상)
 * @author TsFlow Team
 * @since 1.0.0
 */
public record RetryConfig(
    int maxAttempts,
    RetryStrategy strategy,
    Duration baseDelay,
    Duration maxDelay
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final RetryStrategy DEFAULT_STRATEGY = RetryStrategy.EXPONENTIAL_BACKOFF;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(16);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 (current: " + maxAttempts + ")");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative (current: " + baseDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")");
        }
    }

    /**
     * 기본 설정 (3회, EXPONENTIAL_BACKOFF, 1s ~ 16s).
     *
     * @return 기본 설정
     */
    public static RetryConfig defaults() {
        return new RetryConfig(DEFAULT_MAX_ATTEMPTS, DEFAULT_STRATEGY, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, strategy, baseDelay, maxDelay);
    }

    public RetryConfig withStrategy(RetryStrategy strategy) {
        return new RetryConfig(maxAttempts, strategy, baseDelay, maxDelay);
    }

    public RetryConfig withBaseDelay(Duration baseDelay) {
        return new RetryConfig(maxAttempts, strategy, baseDelay, maxDelay);
    }

    public RetryConfig withMaxDelay(Duration maxDelay) {
        return new RetryConfig(maxAttempts, strategy, baseDelay, maxDelay);
    }
}
