package com.ryuqq.tsflow.core.partition;

import com.ryuqq.tsflow.core.model.OptimizationHint;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;

import java.util.List;

/**
 * 쿼리 패턴별 분할 계획 수립.
 *
 * <ul>
 *   <li>REAL_TIME: threshold 이하면 분할 없음, 초과 시 realTimeWindow 단위 분할</li>
 *   <li>ANALYTICS: hint 의 targetBatchSize / maxWorkers 로 적극 분할</li>
 *   <li>HISTORICAL, BACKFILL: {@link Partitioner#getOptimalPartitions}</li>
 * </ul>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class QueryPlanner {

    private final Partitioner partitioner;

    public QueryPlanner() {
        this(new Partitioner());
    }

    public QueryPlanner(Partitioner partitioner) {
        if (partitioner == null) {
            throw new IllegalArgumentException("partitioner cannot be null");
        }
        this.partitioner = partitioner;
    }

    /**
     * 분할 계획 수립.
     *
     * @param query 원본 쿼리
     * @param hint 최적화 힌트
     * @param <Q> 쿼리 타입
     * @return index 순 파티션 목록 (최소 1개)
     * @throws IllegalArgumentException query 또는 hint 가 null 인 경우
     */
    public <Q extends TimeSeriesQuery<Q>> List<Partition<Q>> plan(Q query, OptimizationHint hint) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (hint == null) {
            throw new IllegalArgumentException("hint cannot be null");
        }

        return switch (hint.pattern()) {
            case REAL_TIME -> partitioner.exceedsThreshold(query)
                ? partitioner.splitByWindow(query, partitioner.getConfig().realTimeWindow())
                : partitioner.getOptimalPartitions(query, 1);
            case ANALYTICS -> partitioner.splitByEstimatedVolume(query, hint.targetBatchSize(), hint.maxWorkers());
            case HISTORICAL, BACKFILL -> partitioner.getOptimalPartitions(query, hint.maxWorkers());
        };
    }

    public Partitioner getPartitioner() {
        return partitioner;
    }
}
