package com.ryuqq.tsflow.application.dispatcher;

import com.ryuqq.tsflow.application.runtime.BackendInfo;
import com.ryuqq.tsflow.core.model.OptimizationHint;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;

/**
 * 시계열 쿼리 분할 실행 진입점.
 *
 * <p>쿼리를 힌트에 따라 파티션으로 나누고, 각 파티션을 재시도/Circuit Breaker 로 보호된
 * 조회 작업으로 실행 백엔드에 제출한 뒤, 결과 배치를 하나의 스트림으로 돌려줍니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * stream(query, hint)
 *   ↓
 * 1. QueryPlanner.plan(query, hint) → 파티션 목록
 * 2. 백엔드 선택 (최초 1회, 캐시)
 * 3. 파티션별 resilient(fetch(partition)) 제출
 * 4. 결과 재조립
 *    - preserveOrder=true: 파티션 index 순서
 *    - preserveOrder=false: 완료 순서
 * 5. 실패 파티션은 기록 후 건너뜀
 *    - 전부 실패 → PartitionDispatchException
 *    - 단일 파티션 실패 → 원본 예외
 * </pre>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public interface QueryDispatcher {

    /**
     * 힌트에 따라 분할 실행.
     *
     * <p>반환 즉시 파티션 작업이 제출되기 시작하며, 예외는 스트림 소비 중에 전파됩니다.</p>
     *
     * @param query 쿼리
     * @param hint 최적화 힌트
     * @param <Q> 쿼리 타입
     * @return 배치 스트림
     * @throws IllegalArgumentException query 또는 hint 가 null 이거나 등록된 DataFetcher 가 없는 경우
     * @throws IllegalStateException 이미 close 된 경우
     */
    <Q extends TimeSeriesQuery<Q>> BatchStream stream(Q query, OptimizationHint hint);

    /**
     * HISTORICAL 기본 힌트로 분할 실행.
     *
     * @param query 쿼리
     * @param <Q> 쿼리 타입
     * @return 배치 스트림
     */
    default <Q extends TimeSeriesQuery<Q>> BatchStream stream(Q query) {
        return stream(query, OptimizationHint.forHistorical());
    }

    /**
     * 실행 백엔드 정보 조회.
     *
     * <p>아직 선택되지 않았다면 이 시점에 선택합니다.</p>
     *
     * @return BackendInfo
     */
    BackendInfo backendInfo();
}
