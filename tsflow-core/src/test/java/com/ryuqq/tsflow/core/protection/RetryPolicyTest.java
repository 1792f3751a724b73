package com.ryuqq.tsflow.core.protection;

import com.ryuqq.tsflow.core.exception.AuthenticationException;
import com.ryuqq.tsflow.core.exception.CircuitOpenException;
import com.ryuqq.tsflow.core.exception.DataConnectionException;
import com.ryuqq.tsflow.core.exception.DataServiceException;
import com.ryuqq.tsflow.core.exception.DataTimeoutException;
import com.ryuqq.tsflow.core.exception.DataValidationException;
import com.ryuqq.tsflow.core.exception.ResourceExhaustionException;
import com.ryuqq.tsflow.core.exception.SerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicy 테스트.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
@DisplayName("RetryPolicy 테스트")
class RetryPolicyTest {

    // ============================================================
    // 1. 지연 계산
    // ============================================================

    @Test
    @DisplayName("기본 설정은 1s, 2s, 4s, 8s, 16s, 16s 순으로 증가하고 16s 에서 멈춘다")
    void nextDelay_지수백오프_기본값() {
        // given
        RetryPolicy policy = new RetryPolicy(RetryConfig.defaults());

        // when & then
        assertEquals(Duration.ofSeconds(1), policy.nextDelay(1));
        assertEquals(Duration.ofSeconds(2), policy.nextDelay(2));
        assertEquals(Duration.ofSeconds(4), policy.nextDelay(3));
        assertEquals(Duration.ofSeconds(8), policy.nextDelay(4));
        assertEquals(Duration.ofSeconds(16), policy.nextDelay(5));
        assertEquals(Duration.ofSeconds(16), policy.nextDelay(6));
    }

    @Test
    @DisplayName("지수 백오프 지연은 단조 증가하고 maxDelay 를 넘지 않는다")
    void nextDelay_단조증가_상한() {
        // given
        RetryConfig config = new RetryConfig(100, RetryStrategy.EXPONENTIAL_BACKOFF,
            Duration.ofMillis(250), Duration.ofSeconds(30));
        RetryPolicy policy = new RetryPolicy(config);

        // when & then
        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 100; attempt++) {
            Duration delay = policy.nextDelay(attempt);
            assertTrue(delay.compareTo(previous) >= 0, "attempt " + attempt);
            assertTrue(delay.compareTo(config.maxDelay()) <= 0, "attempt " + attempt);
            previous = delay;
        }
    }

    @Test
    @DisplayName("아주 큰 attempt 에서도 overflow 없이 maxDelay 를 돌려준다")
    void nextDelay_overflow_없음() {
        RetryPolicy policy = new RetryPolicy(RetryConfig.defaults().withMaxAttempts(Integer.MAX_VALUE));

        assertEquals(Duration.ofSeconds(16), policy.nextDelay(64));
        assertEquals(Duration.ofSeconds(16), policy.nextDelay(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("FIXED 는 항상 baseDelay 다")
    void nextDelay_고정() {
        RetryPolicy policy = new RetryPolicy(
            new RetryConfig(5, RetryStrategy.FIXED, Duration.ofSeconds(5), Duration.ofSeconds(5)));

        assertEquals(Duration.ofSeconds(5), policy.nextDelay(1));
        assertEquals(Duration.ofSeconds(5), policy.nextDelay(4));
    }

    @Test
    @DisplayName("LINEAR_BACKOFF 는 baseDelay * attempt 이고 maxDelay 로 상한된다")
    void nextDelay_선형() {
        RetryPolicy policy = new RetryPolicy(
            new RetryConfig(10, RetryStrategy.LINEAR_BACKOFF, Duration.ofSeconds(3), Duration.ofSeconds(10)));

        assertEquals(Duration.ofSeconds(3), policy.nextDelay(1));
        assertEquals(Duration.ofSeconds(9), policy.nextDelay(3));
        assertEquals(Duration.ofSeconds(10), policy.nextDelay(4));
    }

    @Test
    @DisplayName("JITTER 는 지수 지연의 [0.5, 1.0] 배율 구간에 있다")
    void nextDelay_jitter_범위() {
        RetryConfig config = RetryConfig.defaults().withStrategy(RetryStrategy.EXPONENTIAL_BACKOFF_JITTER);

        RetryPolicy lowest = new RetryPolicy(config, () -> 0.0);
        RetryPolicy highest = new RetryPolicy(config, () -> 0.999_999);
        RetryPolicy random = new RetryPolicy(config);

        assertEquals(Duration.ofMillis(2000), lowest.nextDelay(3));
        assertEquals(Duration.ofMillis(3999), highest.nextDelay(3));
        for (int i = 0; i < 50; i++) {
            Duration delay = random.nextDelay(3);
            assertTrue(delay.toMillis() >= 2000 && delay.toMillis() <= 4000, delay.toString());
        }
    }

    @Test
    @DisplayName("attempt 가 양수가 아니면 거부한다")
    void nextDelay_잘못된_attempt() {
        RetryPolicy policy = new RetryPolicy(RetryConfig.defaults());

        assertThrows(IllegalArgumentException.class, () -> policy.nextDelay(0));
    }

    // ============================================================
    // 2. 재시도 여부
    // ============================================================

    @Test
    @DisplayName("일시적 오류는 시도 횟수가 남아 있으면 재시도한다")
    void shouldRetry_일시적_오류() {
        RetryPolicy policy = new RetryPolicy(RetryConfig.defaults());

        assertTrue(policy.shouldRetry(new DataConnectionException("refused"), 1));
        assertTrue(policy.shouldRetry(new DataTimeoutException("slow"), 2));
        assertTrue(policy.shouldRetry(new DataServiceException("500"), 1));
        assertTrue(policy.shouldRetry(new ResourceExhaustionException("pool"), 1));
        assertTrue(policy.shouldRetry(new SocketTimeoutException("read"), 1));
        assertTrue(policy.shouldRetry(new IOException("reset"), 1));
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 4, 10})
    @DisplayName("attempt 가 maxAttempts 이상이면 재시도하지 않는다")
    void shouldRetry_예산_소진(int attempt) {
        RetryPolicy policy = new RetryPolicy(RetryConfig.defaults());

        assertFalse(policy.shouldRetry(new DataTimeoutException("slow"), attempt));
    }

    @Test
    @DisplayName("호출자 오류와 분류 불가 오류는 재시도하지 않는다")
    void shouldRetry_재시도_불가() {
        RetryPolicy policy = new RetryPolicy(RetryConfig.defaults());

        assertFalse(policy.shouldRetry(new AuthenticationException("denied"), 1));
        assertFalse(policy.shouldRetry(new DataValidationException("bad range"), 1));
        assertFalse(policy.shouldRetry(new SerializationException("corrupt"), 1));
        assertFalse(policy.shouldRetry(new CircuitOpenException("ep", Duration.ofSeconds(30)), 1));
        assertFalse(policy.shouldRetry(new IllegalStateException("bug"), 1));
    }
}
