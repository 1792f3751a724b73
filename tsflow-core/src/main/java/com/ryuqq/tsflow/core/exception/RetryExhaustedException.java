package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 재시도 예산 소진.
 *
 * <p>시도 횟수와 마지막 실패 원인을 함께 전달합니다.
 * 마지막 원인은 {@link #getCause()} 로도 조회할 수 있습니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends DataTransferException {

    private final int attemptCount;

    public RetryExhaustedException(String message, int attemptCount, Throwable lastError) {
        super(message, lastError, Map.of("attemptCount", attemptCount));
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        this.attemptCount = attemptCount;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    /**
     * 마지막 시도의 실패 원인.
     *
     * @return 마지막 예외
     */
    public Throwable getLastError() {
        return getCause();
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RETRY_EXHAUSTED;
    }
}
