package com.ryuqq.tsflow.core.protection;

import com.ryuqq.tsflow.core.exception.ErrorClassifier;
import com.ryuqq.tsflow.core.exception.ErrorKind;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재시도 정책.
 *
 * <p>시도 횟수별 지연 시간을 계산하고, 실패한 호출을 재시도할지 결정합니다.</p>
 *
 * <p><strong>지연 알고리즘:</strong></p>
 * <pre>
 * FIXED                      : delay = baseDelay
 * LINEAR_BACKOFF             : delay = min(baseDelay * attempt, maxDelay)
 * EXPONENTIAL_BACKOFF        : delay = min(baseDelay * 2^(attempt-1), maxDelay)
 * EXPONENTIAL_BACKOFF_JITTER : delay = min(baseDelay * 2^(attempt-1), maxDelay) * U[0.5, 1.0]
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, maxDelay=16000ms, EXPONENTIAL_BACKOFF):</strong></p>
 * <ul>
 *   <li>attempt=1: 1000ms</li>
 *   <li>attempt=2: 2000ms</li>
 *   <li>attempt=3: 4000ms</li>
 *   <li>attempt=10: 16000ms (maxDelay 로 상한)</li>
 * </ul>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private static final double JITTER_MIN = 0.5;
    private static final double JITTER_MAX = 1.0;
    // 2^62 이상은 long 범위를 넘으므로 시프트 전에 상한 처리
    private static final int MAX_SHIFT = 62;

    private final RetryConfig config;
    private final DoubleSupplier random;

    /**
     * 생성자 (ThreadLocalRandom 기반 jitter).
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config 가 null 인 경우
     */
    public RetryPolicy(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 생성자 (난수 공급자 주입).
     *
     * @param config 재시도 설정
     * @param random [0, 1) 범위 난수 공급자
     * @throws IllegalArgumentException 의존성이 null 인 경우
     */
    public RetryPolicy(RetryConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.config = config;
        this.random = random;
    }

    /**
     * 다음 재시도까지의 지연 시간 계산.
     *
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 재시도 전 대기 시간
     * @throws IllegalArgumentException attempt 가 양수가 아닌 경우
     */
    public Duration nextDelay(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }

        long baseMs = config.baseDelay().toMillis();
        long maxMs = config.maxDelay().toMillis();

        long delayMs = switch (config.strategy()) {
            case FIXED -> baseMs;
            case LINEAR_BACKOFF -> cappedMultiply(baseMs, attempt, maxMs);
            case EXPONENTIAL_BACKOFF -> exponential(baseMs, attempt, maxMs);
            case EXPONENTIAL_BACKOFF_JITTER -> {
                double factor = JITTER_MIN + (JITTER_MAX - JITTER_MIN) * random.getAsDouble();
                yield (long) (exponential(baseMs, attempt, maxMs) * factor);
            }
        };

        return Duration.ofMillis(Math.min(delayMs, maxMs));
    }

    /**
     * 재시도 여부 판단.
     *
     * <p>다음 중 하나라도 해당하면 false:</p>
     * <ul>
     *   <li>attempt &gt;= maxAttempts</li>
     *   <li>오류 종류가 재시도 불가 (인증, 검증, Circuit OPEN, 분류 불가 등)</li>
     * </ul>
     *
     * @param error 발생한 예외
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 재시도 여부
     */
    public boolean shouldRetry(Throwable error, int attempt) {
        if (attempt >= config.maxAttempts()) {
            return false;
        }
        return isRetryable(error);
    }

    /**
     * 오류 종류만으로 재시도 가능 여부 판단.
     *
     * @param error 발생한 예외
     * @return 재시도 가능한 종류면 true
     */
    public boolean isRetryable(Throwable error) {
        ErrorKind kind = ErrorClassifier.classify(error);
        return kind.isRetryable();
    }

    public RetryConfig getConfig() {
        return config;
    }

    private static long exponential(long baseMs, int attempt, long maxMs) {
        int shift = attempt - 1;
        if (shift >= MAX_SHIFT) {
            return maxMs;
        }
        return cappedMultiply(baseMs, 1L << shift, maxMs);
    }

    private static long cappedMultiply(long value, long multiplier, long cap) {
        if (value == 0) {
            return 0;
        }
        if (multiplier > cap / value) {
            return cap;
        }
        return Math.min(value * multiplier, cap);
    }
}
