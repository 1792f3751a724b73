package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 데이터 서비스의 쿼리 단위 실패.
 *
 * <p>{@link ServerException} 의 특수화로, 서버는 정상이나 특정 쿼리 처리가 실패한 경우입니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class DataServiceException extends ServerException {

    public DataServiceException(String message) {
        this(message, null, null);
    }

    public DataServiceException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public DataServiceException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause, details);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DATA_SERVICE;
    }
}
