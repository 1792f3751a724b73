package com.ryuqq.tsflow.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 시계열 쿼리의 조회 구간.
 *
 * <p>반열린 구간 {@code [start, end)} 를 나타내며, 파티션 분할 시
 * 인접한 구간끼리 경계를 공유합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>start, end 는 null 불가</li>
 *   <li>start &lt; end (길이 0 이하의 구간 불가)</li>
 * </ul>
 *
 * @param start 구간 시작 시각 (포함)
 * @param end 구간 종료 시각 (제외)
 * @author TsFlow Team
 * @since 1.0.0
 */
public record TimeRange(Instant start, Instant end) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException start/end 가 null 이거나 start &gt;= end 인 경우
     */
    public TimeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end cannot be null (start: " + start + ", end: " + end + ")");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException(
                String.format("start must be before end (start: %s, end: %s)", start, end));
        }
    }

    /**
     * TimeRange 생성.
     *
     * @param start 시작 시각
     * @param end 종료 시각
     * @return TimeRange 인스턴스
     */
    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    /**
     * 구간 길이.
     *
     * @return end - start
     */
    public Duration duration() {
        return Duration.between(start, end);
    }

    /**
     * 시각이 구간에 포함되는지 확인.
     *
     * @param instant 확인할 시각
     * @return start &lt;= instant &lt; end 이면 true
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
