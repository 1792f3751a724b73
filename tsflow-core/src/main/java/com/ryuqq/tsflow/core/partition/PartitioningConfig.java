package com.ryuqq.tsflow.core.partition;

import java.time.Duration;

/**
 * 분할 기준값.
 *
 * @param threshold 이 길이 이하의 쿼리는 분할하지 않음 (기본 1시간)
 * @param realTimeWindow REAL_TIME 패턴의 고정 window 크기 (기본 15분)
 * @param defaultTargetPoints 파티션당 목표 데이터 포인트 수 (기본 10,000)
 * @author TsFlow Team
 * @since 1.0.0
 */
public record PartitioningConfig(
    Duration threshold,
    Duration realTimeWindow,
    long defaultTargetPoints
) {

    public static final Duration DEFAULT_THRESHOLD = Duration.ofHours(1);
    public static final Duration DEFAULT_REAL_TIME_WINDOW = Duration.ofMinutes(15);
    public static final long DEFAULT_TARGET_POINTS = 10_000L;

    public PartitioningConfig {
        if (threshold == null || threshold.isNegative()) {
            throw new IllegalArgumentException("threshold must be non-negative (current: " + threshold + ")");
        }
        if (realTimeWindow == null || realTimeWindow.isNegative() || realTimeWindow.isZero()) {
            throw new IllegalArgumentException("realTimeWindow must be positive (current: " + realTimeWindow + ")");
        }
        if (defaultTargetPoints <= 0) {
            throw new IllegalArgumentException(
                "defaultTargetPoints must be positive (current: " + defaultTargetPoints + ")");
        }
    }

    public static PartitioningConfig defaults() {
        return new PartitioningConfig(DEFAULT_THRESHOLD, DEFAULT_REAL_TIME_WINDOW, DEFAULT_TARGET_POINTS);
    }

    public PartitioningConfig withThreshold(Duration threshold) {
        return new PartitioningConfig(threshold, realTimeWindow, defaultTargetPoints);
    }

    public PartitioningConfig withRealTimeWindow(Duration realTimeWindow) {
        return new PartitioningConfig(threshold, realTimeWindow, defaultTargetPoints);
    }

    public PartitioningConfig withDefaultTargetPoints(long defaultTargetPoints) {
        return new PartitioningConfig(threshold, realTimeWindow, defaultTargetPoints);
    }
}
