package com.ryuqq.tsflow.core.partition;

import com.ryuqq.tsflow.core.model.TimeRange;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 시간 구간 기반 쿼리 분할기.
 *
 * <p>모든 분할 결과는 다음을 만족합니다:</p>
 * <ul>
 *   <li>첫 파티션의 start == 원본 start, 마지막 파티션의 end == 원본 end</li>
 *   <li>인접 파티션은 빈틈 없이 맞닿음 (이전 end == 다음 start)</li>
 *   <li>start 오름차순, 겹침 없음</li>
 *   <li>같은 입력이면 같은 경계 (결정적)</li>
 * </ul>
 *
 * <p>상태가 없으므로 thread-safe 합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class Partitioner {

    private final PartitioningConfig config;

    public Partitioner() {
        this(PartitioningConfig.defaults());
    }

    public Partitioner(PartitioningConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 고정 크기 window 로 분할.
     *
     * <p>마지막 파티션은 원본 end 에서 잘립니다.</p>
     *
     * @param query 원본 쿼리
     * @param window window 크기 (양수)
     * @param <Q> 쿼리 타입
     * @return start 오름차순 파티션 목록
     * @throws IllegalArgumentException window 가 양수가 아닌 경우
     */
    public <Q extends TimeSeriesQuery<Q>> List<Partition<Q>> splitByWindow(Q query, Duration window) {
        requireQuery(query);
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive (current: " + window + ")");
        }

        TimeRange range = query.timeRange();
        List<TimeRange> ranges = new ArrayList<>();
        Instant cursor = range.start();
        while (cursor.isBefore(range.end())) {
            Instant next = cursor.plus(window);
            if (next.isAfter(range.end())) {
                next = range.end();
            }
            ranges.add(TimeRange.of(cursor, next));
            cursor = next;
        }
        return toPartitions(query, ranges);
    }

    /**
     * n 개의 같은 길이 구간으로 분할.
     *
     * <p>나누어떨어지지 않는 나노초는 앞쪽 파티션에 1ns 씩 더해
     * 마지막 end 가 원본 end 와 정확히 일치하도록 합니다.</p>
     *
     * @param query 원본 쿼리
     * @param n 파티션 수 (양수)
     * @param <Q> 쿼리 타입
     * @return 파티션 목록
     * @throws IllegalArgumentException n 이 양수가 아닌 경우
     */
    public <Q extends TimeSeriesQuery<Q>> List<Partition<Q>> splitByCount(Q query, int n) {
        requireQuery(query);
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive (current: " + n + ")");
        }
        if (n == 1) {
            return single(query);
        }

        TimeRange range = query.timeRange();
        Duration total = range.duration();
        // 구간이 292년을 넘으면 toNanos() 가 overflow 하므로 Duration 단위로 나눈다
        int count = total.compareTo(Duration.ofNanos(n)) < 0 ? (int) total.toNanos() : n;
        Duration step = total.dividedBy(count);
        long remainder = total.minus(step.multipliedBy(count)).toNanos();

        List<TimeRange> ranges = new ArrayList<>(count);
        Instant cursor = range.start();
        for (int i = 0; i < count; i++) {
            Instant next = (i == count - 1)
                ? range.end()
                : cursor.plus(step).plusNanos(i < remainder ? 1 : 0);
            ranges.add(TimeRange.of(cursor, next));
            cursor = next;
        }
        return toPartitions(query, ranges);
    }

    /**
     * 추정 데이터 포인트 기준 분할 (쿼리 자체 추정값 사용).
     *
     * @see #splitByEstimatedVolume(TimeSeriesQuery, long, int, DataPointEstimator)
     */
    public <Q extends TimeSeriesQuery<Q>> List<Partition<Q>> splitByEstimatedVolume(
        Q query, long targetPoints, int maxWorkers
    ) {
        return splitByEstimatedVolume(query, targetPoints, maxWorkers, TimeSeriesQuery::estimateDataPoints);
    }

    /**
     * 추정 데이터 포인트 기준 분할.
     *
     * <p>파티션 수 = max(1, min(maxWorkers, ceil(P / targetPoints))).
     * 추정값 P 가 0 이하이면 분할하지 않습니다.</p>
     *
     * <p><strong>예시:</strong> 4년치 1분봉 (P=2,102,400), targetPoints=50,000, maxWorkers=8
     * → ceil(42.05)=43 → min(8, 43) = 8 파티션</p>
     *
     * @param query 원본 쿼리
     * @param targetPoints 파티션당 목표 포인트 수 (양수)
     * @param maxWorkers 최대 파티션 수 (양수)
     * @param estimator 데이터 포인트 추정기
     * @param <Q> 쿼리 타입
     * @return 파티션 목록
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public <Q extends TimeSeriesQuery<Q>> List<Partition<Q>> splitByEstimatedVolume(
        Q query, long targetPoints, int maxWorkers, DataPointEstimator<Q> estimator
    ) {
        requireQuery(query);
        if (targetPoints <= 0) {
            throw new IllegalArgumentException("targetPoints must be positive (current: " + targetPoints + ")");
        }
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive (current: " + maxWorkers + ")");
        }
        if (estimator == null) {
            throw new IllegalArgumentException("estimator cannot be null");
        }

        long points = estimator.estimate(query);
        if (points <= 0) {
            return single(query);
        }

        long needed = points / targetPoints + (points % targetPoints == 0 ? 0 : 1);
        int count = (int) Math.max(1, Math.min(maxWorkers, needed));
        return splitByCount(query, count);
    }

    /**
     * 기본 분할 전략.
     *
     * <p>구간 길이가 threshold 이하이면 분할하지 않고,
     * 그 외에는 기본 목표 포인트 수로 {@link #splitByEstimatedVolume} 합니다.</p>
     *
     * @param query 원본 쿼리
     * @param maxWorkers 최대 파티션 수
     * @param <Q> 쿼리 타입
     * @return 파티션 목록
     */
    public <Q extends TimeSeriesQuery<Q>> List<Partition<Q>> getOptimalPartitions(Q query, int maxWorkers) {
        requireQuery(query);
        if (!exceedsThreshold(query)) {
            return single(query);
        }
        return splitByEstimatedVolume(query, config.defaultTargetPoints(), maxWorkers);
    }

    /**
     * 구간 길이가 분할 threshold 를 초과하는지 확인.
     *
     * @param query 쿼리
     * @return threshold 초과 시 true
     */
    public boolean exceedsThreshold(TimeSeriesQuery<?> query) {
        return query.timeRange().duration().compareTo(config.threshold()) > 0;
    }

    public PartitioningConfig getConfig() {
        return config;
    }

    private static <Q extends TimeSeriesQuery<Q>> List<Partition<Q>> single(Q query) {
        return List.of(new Partition<>(0, 1, query));
    }

    private static <Q extends TimeSeriesQuery<Q>> List<Partition<Q>> toPartitions(Q query, List<TimeRange> ranges) {
        int total = ranges.size();
        List<Partition<Q>> partitions = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            partitions.add(new Partition<>(i, total, query.withTimeRange(ranges.get(i))));
        }
        return Collections.unmodifiableList(partitions);
    }

    private static void requireQuery(TimeSeriesQuery<?> query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (query.timeRange() == null) {
            throw new IllegalArgumentException("query.timeRange cannot be null");
        }
    }
}
