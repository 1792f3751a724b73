package com.ryuqq.tsflow.core.exception;

import java.util.Map;

/**
 * 데이터 전송 계층 예외의 공통 상위 타입.
 *
 * <p>모든 하위 예외는 unchecked 이며 message, cause, 그리고 진단용
 * details 맵을 공유합니다. 종류별 분기는 {@link #kind()} 로 수행합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public abstract class DataTransferException extends RuntimeException {

    private final Map<String, Object> details;

    protected DataTransferException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause);
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * 오류 종류.
     *
     * @return ErrorKind
     */
    public abstract ErrorKind kind();

    /**
     * 재시도 가능 여부.
     *
     * @return kind().isRetryable()
     */
    public boolean isRetryable() {
        return kind().isRetryable();
    }

    /**
     * 진단용 부가 정보.
     *
     * @return 불변 맵 (없으면 빈 맵)
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
