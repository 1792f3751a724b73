package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 원격 엔드포인트 연결 실패 (재시도 가능).
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class DataConnectionException extends DataTransferException {

    public DataConnectionException(String message) {
        this(message, null, null);
    }

    public DataConnectionException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public DataConnectionException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause, details);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONNECTION;
    }
}
