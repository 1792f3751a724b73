package com.ryuqq.tsflow.core.exception;

import java.time.Duration;
import java.util.Map;

/**
 * Circuit Breaker 가 OPEN 상태라 호출이 즉시 거부된 경우.
 *
 * <p>재시도 대상이 아니며, 재시도 예산도 소모하지 않습니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class CircuitOpenException extends DataTransferException {

    private final String circuitName;
    private final Duration retryAfter;

    /**
     * 생성자.
     *
     * @param circuitName 거부한 Circuit Breaker 이름 (엔드포인트)
     * @param retryAfter 다음 probe 허용까지 남은 시간 (알 수 없으면 null)
     */
    public CircuitOpenException(String circuitName, Duration retryAfter) {
        super("Circuit breaker '" + circuitName + "' is open", null,
            Map.of("circuitName", circuitName, "retryAfterMs", retryAfter == null ? -1L : retryAfter.toMillis()));
        this.circuitName = circuitName;
        this.retryAfter = retryAfter;
    }

    public String getCircuitName() {
        return circuitName;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CIRCUIT_OPEN;
    }
}
