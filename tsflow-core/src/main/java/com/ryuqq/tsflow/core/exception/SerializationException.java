package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 배치 직렬화/역직렬화 실패.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class SerializationException extends DataTransferException {

    public SerializationException(String message) {
        this(message, null, null);
    }

    public SerializationException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public SerializationException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause, details);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SERIALIZATION;
    }
}
