package com.ryuqq.tsflow.core.model;

/**
 * 시계열 데이터 요청 파라미터 계약.
 *
 * <p>모든 시계열 데이터 소스가 공통으로 필요로 하는 정보(조회 구간)와,
 * 파티션 분할을 위한 두 가지 훅을 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link #withTimeRange(TimeRange)}: 구간만 좁힌 복제본 생성 (파티션 생성용)</li>
 *   <li>{@link #estimateDataPoints()}: 구간 내 추정 데이터 포인트 수 (0 = 알 수 없음)</li>
 * </ul>
 *
 * <p>구현체는 불변이어야 합니다. 파티션은 여러 워커 스레드에서 동시에 읽힙니다.</p>
 *
 * @param <Q> 구체 쿼리 타입 (self type)
 * @author TsFlow Team
 * @since 1.0.0
 */
public interface TimeSeriesQuery<Q extends TimeSeriesQuery<Q>> {

    /**
     * 조회 구간.
     *
     * @return TimeRange
     */
    TimeRange timeRange();

    /**
     * 조회 구간만 교체한 복제본 생성.
     *
     * @param range 새 조회 구간
     * @return 나머지 파라미터가 동일한 새 쿼리
     */
    Q withTimeRange(TimeRange range);

    /**
     * 구간 내 추정 데이터 포인트 수.
     *
     * @return 추정 포인트 수, 알 수 없으면 0
     */
    default long estimateDataPoints() {
        return 0L;
    }
}
