package com.ryuqq.tsflow.core.protection;

/**
 * 재시도 지연 계산 전략.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public enum RetryStrategy {

    /** 매 시도 baseDelay. */
    FIXED,

    /** baseDelay * attempt, maxDelay 로 상한. */
    LINEAR_BACKOFF,

    /** baseDelay * 2^(attempt-1), maxDelay 로 상한. */
    EXPONENTIAL_BACKOFF,

    /**
     * 지수 백오프에 [0.5, 1.0] 균등 난수 배율 적용.
     *
     * <p>동시에 실패한 호출자들의 재시도 시점을 분산시켜 Thundering Herd 를 방지합니다.</p>
     */
    EXPONENTIAL_BACKOFF_JITTER
}
