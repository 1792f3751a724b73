package com.ryuqq.tsflow.core.model;

/**
 * 쿼리 최적화 힌트.
 *
 * <p>쿼리 사용 패턴에서 도출되는 튜닝 값 묶음으로,
 * 파티션 크기와 동시 실행 수를 결정하는 데 사용됩니다.
 * 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>프리셋:</strong></p>
 * <ul>
 *   <li>{@link #forRealTime()}: maxWorkers=1, targetBatchSize=5,000, preferRecentData=true</li>
 *   <li>{@link #forAnalytics()}: maxWorkers=가용 CPU 수, targetBatchSize=50,000</li>
 *   <li>{@link #forHistorical()}, {@link #forBackfill()}: 기본값 기반</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * OptimizationHint hint = OptimizationHint.builder(QueryPattern.ANALYTICS)
 *     .maxWorkers(8)
 *     .targetBatchSize(50_000)
 *     .build();
 * }</pre>
 *
 * @param pattern 쿼리 패턴 (필수)
 * @param maxWorkers 최대 파티션 수 (양수)
 * @param targetBatchSize 파티션당 목표 데이터 포인트 수 (양수)
 * @param preferRecentData 최신 데이터 우선 처리 여부
 * @param enableCaching 결과 캐싱 허용 여부
 * @author TsFlow Team
 * @since 1.0.0
 */
public record OptimizationHint(
    QueryPattern pattern,
    int maxWorkers,
    int targetBatchSize,
    boolean preferRecentData,
    boolean enableCaching
) {

    public static final int DEFAULT_MAX_WORKERS = 8;
    public static final int DEFAULT_TARGET_BATCH_SIZE = 10_000;

    private static final int REAL_TIME_TARGET_BATCH_SIZE = 5_000;
    private static final int ANALYTICS_TARGET_BATCH_SIZE = 50_000;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException pattern 이 null 이거나 수치 값이 양수가 아닌 경우
     */
    public OptimizationHint {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern cannot be null");
        }
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive (current: " + maxWorkers + ")");
        }
        if (targetBatchSize <= 0) {
            throw new IllegalArgumentException("targetBatchSize must be positive (current: " + targetBatchSize + ")");
        }
    }

    /**
     * 실시간 조회용 프리셋.
     *
     * @return REAL_TIME 힌트
     */
    public static OptimizationHint forRealTime() {
        return new OptimizationHint(QueryPattern.REAL_TIME, 1, REAL_TIME_TARGET_BATCH_SIZE, true, true);
    }

    /**
     * 분석 조회용 프리셋.
     *
     * <p>maxWorkers 는 현재 JVM 의 가용 프로세서 수를 사용합니다.</p>
     *
     * @return ANALYTICS 힌트
     */
    public static OptimizationHint forAnalytics() {
        int processors = Runtime.getRuntime().availableProcessors();
        return new OptimizationHint(QueryPattern.ANALYTICS, processors, ANALYTICS_TARGET_BATCH_SIZE, false, true);
    }

    /**
     * 대용량 과거 조회용 프리셋.
     *
     * @return HISTORICAL 힌트
     */
    public static OptimizationHint forHistorical() {
        return builder(QueryPattern.HISTORICAL).build();
    }

    /**
     * 재수집용 프리셋.
     *
     * @return BACKFILL 힌트 (캐싱 비활성)
     */
    public static OptimizationHint forBackfill() {
        return builder(QueryPattern.BACKFILL).enableCaching(false).build();
    }

    /**
     * 커스텀 힌트 빌더.
     *
     * @param pattern 쿼리 패턴 (필수)
     * @return Builder
     */
    public static Builder builder(QueryPattern pattern) {
        return new Builder().pattern(pattern);
    }

    /**
     * 패턴 없이 시작하는 빌더. {@link Builder#build()} 전에 pattern 을 지정해야 합니다.
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * OptimizationHint 빌더.
     *
     * <p>지정하지 않은 선택 항목은 기본값(maxWorkers=8, targetBatchSize=10,000,
     * preferRecentData=false, enableCaching=true)을 사용합니다.</p>
     */
    public static final class Builder {

        private QueryPattern pattern;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int targetBatchSize = DEFAULT_TARGET_BATCH_SIZE;
        private boolean preferRecentData;
        private boolean enableCaching = true;

        private Builder() {
        }

        public Builder pattern(QueryPattern pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder targetBatchSize(int targetBatchSize) {
            this.targetBatchSize = targetBatchSize;
            return this;
        }

        public Builder preferRecentData(boolean preferRecentData) {
            this.preferRecentData = preferRecentData;
            return this;
        }

        public Builder enableCaching(boolean enableCaching) {
            this.enableCaching = enableCaching;
            return this;
        }

        /**
         * 힌트 생성.
         *
         * @return OptimizationHint
         * @throws IllegalArgumentException pattern 미지정 또는 유효하지 않은 값인 경우
         */
        public OptimizationHint build() {
            return new OptimizationHint(pattern, maxWorkers, targetBatchSize, preferRecentData, enableCaching);
        }
    }
}
