package com.ryuqq.tsflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimeRange Value Object 테스트.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
class TimeRangeTest {

    private static final Instant TEN = Instant.parse("2024-01-01T10:00:00Z");
    private static final Instant TWELVE = Instant.parse("2024-01-01T12:00:00Z");

    @Test
    void of_ValidRange_ComputesDuration() {
        TimeRange range = TimeRange.of(TEN, TWELVE);

        assertEquals(Duration.ofHours(2), range.duration());
    }

    @Test
    void contains_IsHalfOpen() {
        TimeRange range = TimeRange.of(TEN, TWELVE);

        assertTrue(range.contains(TEN));
        assertTrue(range.contains(TWELVE.minusNanos(1)));
        assertFalse(range.contains(TWELVE));
    }

    @Test
    void of_EmptyOrReversed_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TimeRange.of(TEN, TEN));
        assertThrows(IllegalArgumentException.class, () -> TimeRange.of(TWELVE, TEN));
    }

    @Test
    void of_NullBound_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> TimeRange.of(null, TWELVE)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }
}
