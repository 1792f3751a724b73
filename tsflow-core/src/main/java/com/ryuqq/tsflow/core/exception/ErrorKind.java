package com.ryuqq.tsflow.core.exception;

/**
 * 오류 종류.
 *
 * <p>재시도 여부와 Circuit Breaker 집계 여부는 종류 단위로 결정됩니다.</p>
 *
 * <ul>
 *   <li>재시도 가능: CONNECTION, TIMEOUT, SERVER, DATA_SERVICE, RESOURCE_EXHAUSTION</li>
 *   <li>호출자 오류 (Circuit Breaker 미집계): AUTHENTICATION, DATA_VALIDATION</li>
 * </ul>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public enum ErrorKind {

    CONNECTION(true, false),
    TIMEOUT(true, false),
    AUTHENTICATION(false, true),
    SERVER(true, false),
    DATA_SERVICE(true, false),
    DATA_VALIDATION(false, true),
    SERIALIZATION(false, false),
    RESOURCE_EXHAUSTION(true, false),
    CIRCUIT_OPEN(false, false),
    RETRY_EXHAUSTED(false, false),
    PARTITION_DISPATCH(false, false),
    UNKNOWN(false, false);

    private final boolean retryable;
    private final boolean callerError;

    ErrorKind(boolean retryable, boolean callerError) {
        this.retryable = retryable;
        this.callerError = callerError;
    }

    /**
     * 재시도로 회복 가능한 종류인지 확인.
     *
     * @return 재시도 가능 여부
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * 호출자 측 오류(인증, 요청 검증)인지 확인.
     *
     * <p>호출자 오류는 엔드포인트 상태와 무관하므로 Circuit Breaker 실패로 집계하지 않습니다.</p>
     *
     * @return 호출자 오류 여부
     */
    public boolean isCallerError() {
        return callerError;
    }
}
