package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 요청 또는 응답 데이터 검증 실패. 재시도하지 않습니다.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class DataValidationException extends DataTransferException {

    public DataValidationException(String message) {
        this(message, null, null);
    }

    public DataValidationException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public DataValidationException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause, details);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DATA_VALIDATION;
    }
}
