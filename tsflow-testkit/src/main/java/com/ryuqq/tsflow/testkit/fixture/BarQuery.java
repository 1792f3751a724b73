package com.ryuqq.tsflow.testkit.fixture;

import com.ryuqq.tsflow.core.model.TimeRange;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;

import java.time.Duration;
import java.time.Instant;

/**
 * OHLC 봉 조회 테스트 쿼리.
 *
 * <p>추정 포인트 수는 구간 길이를 봉 간격으로 나눈 값입니다.</p>
 *
 * @param symbol 종목
 * @param interval 봉 간격
 * @param timeRange 조회 구간
 * @author TsFlow Team
 * @since 1.0.0
 */
public record BarQuery(String symbol, Duration interval, TimeRange timeRange) implements TimeSeriesQuery<BarQuery> {

    public BarQuery {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or blank");
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
        if (timeRange == null) {
            throw new IllegalArgumentException("timeRange cannot be null");
        }
    }

    /**
     * 1분봉 쿼리.
     *
     * @param symbol 종목
     * @param start ISO-8601 시작 시각
     * @param end ISO-8601 종료 시각
     * @return BarQuery
     */
    public static BarQuery minutes(String symbol, String start, String end) {
        return new BarQuery(symbol, Duration.ofMinutes(1), TimeRange.of(Instant.parse(start), Instant.parse(end)));
    }

    @Override
    public BarQuery withTimeRange(TimeRange range) {
        return new BarQuery(symbol, interval, range);
    }

    @Override
    public long estimateDataPoints() {
        return timeRange.duration().dividedBy(interval);
    }
}
