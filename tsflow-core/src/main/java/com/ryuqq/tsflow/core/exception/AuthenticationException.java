package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 인증/인가 실패. 재시도하지 않으며 Circuit Breaker 에 집계되지 않습니다.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class AuthenticationException extends DataTransferException {

    public AuthenticationException(String message) {
        this(message, null, null);
    }

    public AuthenticationException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public AuthenticationException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause, details);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTHENTICATION;
    }
}
