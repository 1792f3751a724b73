package com.ryuqq.tsflow.testkit.fixture;

import com.ryuqq.tsflow.core.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BarQuery 테스트.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
@DisplayName("BarQuery 테스트")
class BarQueryTest {

    @Test
    @DisplayName("데이터 포인트 추정치는 구간 길이 / 봉 간격")
    void estimateDataPoints() {
        BarQuery day = BarQuery.minutes("AAPL", "2024-01-01T00:00:00Z", "2024-01-02T00:00:00Z");

        assertThat(day.estimateDataPoints()).isEqualTo(1_440);
    }

    @Test
    @DisplayName("withTimeRange 는 구간만 바꾼다")
    void withTimeRange() {
        BarQuery query = BarQuery.minutes("AAPL", "2024-01-01T00:00:00Z", "2024-01-02T00:00:00Z");
        TimeRange hour = TimeRange.of(Instant.parse("2024-01-01T05:00:00Z"), Instant.parse("2024-01-01T06:00:00Z"));

        BarQuery narrowed = query.withTimeRange(hour);

        assertThat(narrowed).isEqualTo(new BarQuery("AAPL", Duration.ofMinutes(1), hour));
    }

    @Test
    @DisplayName("간격은 양수여야 한다")
    void interval_검증() {
        TimeRange hour = TimeRange.of(Instant.parse("2024-01-01T05:00:00Z"), Instant.parse("2024-01-01T06:00:00Z"));

        assertThatThrownBy(() -> new BarQuery("AAPL", Duration.ZERO, hour))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("interval must be positive");
    }
}
