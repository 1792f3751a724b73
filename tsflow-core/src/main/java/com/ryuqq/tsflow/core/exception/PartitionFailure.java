package com.ryuqq.tsflow.core.exception;

import com.ryuqq.tsflow.core.model.TimeRange;

/**
 * 단일 파티션 실패 기록.
 *
 * @param partitionIndex 파티션 순번 (0부터)
 * @param timeRange 파티션 구간
 * @param cause 실패 원인
 * @author TsFlow Team
 * @since 1.0.0
 */
public record PartitionFailure(int partitionIndex, TimeRange timeRange, Throwable cause) {

    public PartitionFailure {
        if (partitionIndex < 0) {
            throw new IllegalArgumentException("partitionIndex must be non-negative (current: " + partitionIndex + ")");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    /**
     * 실패 원인의 오류 종류.
     *
     * @return ErrorKind
     */
    public ErrorKind kind() {
        return ErrorClassifier.classify(cause);
    }
}
