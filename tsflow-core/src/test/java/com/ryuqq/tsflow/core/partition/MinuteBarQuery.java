package com.ryuqq.tsflow.core.partition;

import com.ryuqq.tsflow.core.model.TimeRange;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;

import java.time.Instant;

/**
 * 1분봉 테스트 쿼리 (포인트 수 = 구간 분 단위 길이).
 */
record MinuteBarQuery(String symbol, TimeRange timeRange) implements TimeSeriesQuery<MinuteBarQuery> {

    static MinuteBarQuery of(String symbol, String start, String end) {
        return new MinuteBarQuery(symbol, TimeRange.of(Instant.parse(start), Instant.parse(end)));
    }

    @Override
    public MinuteBarQuery withTimeRange(TimeRange range) {
        return new MinuteBarQuery(symbol, range);
    }

    @Override
    public long estimateDataPoints() {
        return timeRange.duration().toMinutes();
    }
}
