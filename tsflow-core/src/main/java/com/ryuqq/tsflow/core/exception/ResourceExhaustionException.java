package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 서버 측 자원 고갈 (커넥션 풀 소진, 메모리 부족 등).
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class ResourceExhaustionException extends DataTransferException {

    public ResourceExhaustionException(String message) {
        this(message, null, null);
    }

    public ResourceExhaustionException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public ResourceExhaustionException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause, details);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RESOURCE_EXHAUSTION;
    }
}
