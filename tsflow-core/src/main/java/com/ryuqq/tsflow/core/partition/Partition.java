package com.ryuqq.tsflow.core.partition;

import com.ryuqq.tsflow.core.model.TimeRange;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;

/**
 * 분할된 하위 쿼리.
 *
 * <p>원본 쿼리를 좁은 시간 구간으로 복제한 것이며, index 순서로 정렬하면
 * 구간들이 원본 구간을 빈틈과 겹침 없이 정확히 재구성합니다.</p>
 *
 * @param index 0부터 시작하는 파티션 순번
 * @param total 전체 파티션 수
 * @param query 구간이 좁혀진 쿼리
 * @param <Q> 쿼리 타입
 * @author TsFlow Team
 * @since 1.0.0
 */
public record Partition<Q extends TimeSeriesQuery<Q>>(int index, int total, Q query) {

    public Partition {
        if (total <= 0) {
            throw new IllegalArgumentException("total must be positive (current: " + total + ")");
        }
        if (index < 0 || index >= total) {
            throw new IllegalArgumentException(
                "index must be in [0, " + total + ") (current: " + index + ")");
        }
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
    }

    public TimeRange timeRange() {
        return query.timeRange();
    }

    /**
     * 로그용 식별 문자열.
     *
     * @return "1/3 [start, end)" 형식
     */
    public String describe() {
        return (index + 1) + "/" + total + " " + timeRange();
    }
}
