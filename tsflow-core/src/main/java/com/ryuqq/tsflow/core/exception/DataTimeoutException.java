package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 원격 호출 시간 초과 (재시도 가능).
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class DataTimeoutException extends DataTransferException {

    public DataTimeoutException(String message) {
        this(message, null, null);
    }

    public DataTimeoutException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public DataTimeoutException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause, details);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
