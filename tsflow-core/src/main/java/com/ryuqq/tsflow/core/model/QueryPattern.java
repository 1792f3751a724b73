package com.ryuqq.tsflow.core.model;

/**
 * 시계열 쿼리 사용 패턴.
 *
 * <p>패턴에 따라 {@link OptimizationHint} 의 기본값과
 * 파티션 분할 정책이 달라집니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public enum QueryPattern {

    /**
     * 최신 데이터, 작은 조회 구간.
     *
     * <p>짧은 구간은 분할하지 않고, 긴 구간은 고정 윈도우로 나눕니다.</p>
     */
    REAL_TIME,

    /**
     * 넓은 구간의 집계성 조회.
     */
    HISTORICAL,

    /**
     * 누락 데이터 복구용 재수집.
     */
    BACKFILL,

    /**
     * 복잡한 분석 쿼리.
     *
     * <p>추정 데이터 포인트 기준으로 공격적으로 분할합니다.</p>
     */
    ANALYTICS
}
