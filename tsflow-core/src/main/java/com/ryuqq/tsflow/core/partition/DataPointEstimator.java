package com.ryuqq.tsflow.core.partition;

import com.ryuqq.tsflow.core.model.TimeSeriesQuery;

/**
 * 쿼리가 반환할 데이터 포인트 수 추정기.
 *
 * <p>0 이하는 "알 수 없음"으로 취급되어 분할하지 않습니다.</p>
 *
 * @param <Q> 쿼리 타입
 * @author TsFlow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DataPointEstimator<Q extends TimeSeriesQuery<Q>> {

    long estimate(Q query);
}
