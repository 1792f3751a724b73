package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 원격 서버 내부 오류 (재시도 가능).
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class ServerException extends DataTransferException {

    public ServerException(String message) {
        this(message, null, null);
    }

    public ServerException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public ServerException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause, details);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SERVER;
    }
}
