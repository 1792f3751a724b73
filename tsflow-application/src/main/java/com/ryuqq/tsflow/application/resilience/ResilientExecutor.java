package com.ryuqq.tsflow.application.resilience;

import com.ryuqq.tsflow.core.exception.CircuitOpenException;
import com.ryuqq.tsflow.core.exception.ErrorClassifier;
import com.ryuqq.tsflow.core.exception.ErrorKind;
import com.ryuqq.tsflow.core.exception.RetryExhaustedException;
import com.ryuqq.tsflow.core.protection.CircuitBreaker;
import com.ryuqq.tsflow.core.protection.CircuitBreakerRegistry;
import com.ryuqq.tsflow.core.protection.ResilienceConfig;
import com.ryuqq.tsflow.core.protection.ResilienceEventListener;
import com.ryuqq.tsflow.core.protection.RetryPolicy;
import com.ryuqq.tsflow.core.protection.Sleeper;
import com.ryuqq.tsflow.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.tsflow.core.protection.noop.NoOpResilienceEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * 재시도와 Circuit Breaker 로 보호된 작업 실행기.
 *
 * <p>breaker-guard(retry-loop(operation)) 구조로 동작합니다.
 * 매 시도마다 Circuit Breaker 의 허가를 먼저 받으므로, 재시도 도중 회로가 열리면
 * 남은 재시도 예산과 관계없이 즉시 {@link CircuitOpenException} 으로 중단됩니다.</p>
 *
 * <p><strong>실행 흐름 (attempt = 1..maxAttempts):</strong></p>
 * <pre>
 * 1. breaker.tryAcquire() == false → CircuitOpenException (재시도 예산 소모 없음)
 * 2. operation 실행
 *    ├─ 성공 → recordSuccess() → 결과 반환
 *    ├─ 취소 (인터럽트) → releasePermit() → CancellationException (재시도 없음)
 *    └─ 실패 → recordFailure(e) → 오류 분류
 *         ├─ 재시도 불가 (인증, 검증, Circuit OPEN, 분류 불가) → 원본 예외 그대로 전파
 *         ├─ 예산 남음 → nextDelay(attempt) 만큼 대기 후 다음 시도
 *         └─ 예산 소진 → RetryExhaustedException (maxAttempts=1 이면 원본 예외)
 * </pre>
 *
 * <p>작업 중 또는 대기 중 인터럽트는 쿼리 취소로 간주하여 {@link CancellationException} 을 던지고
 * 인터럽트 플래그를 유지합니다. 취소된 호출은 엔드포인트 실패로 집계하지 않습니다.</p>
 *
 * <p>Circuit Breaker 는 {@link CircuitBreakerRegistry} 에서 엔드포인트 이름으로 조회하므로,
 * 같은 레지스트리를 공유하는 모든 호출이 엔드포인트별 상태를 공유합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class ResilientExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResilientExecutor.class);

    private final CircuitBreakerRegistry registry;
    private final ResilienceConfig defaultConfig;
    private final Sleeper sleeper;
    private final ResilienceEventListener listener;

    /**
     * 기본 설정 생성자.
     *
     * @param registry Circuit Breaker 레지스트리
     */
    public ResilientExecutor(CircuitBreakerRegistry registry) {
        this(registry, ResilienceConfig.defaults(), Sleeper.THREAD, NoOpResilienceEventListener.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param registry Circuit Breaker 레지스트리
     * @param defaultConfig config 를 지정하지 않은 호출에 적용할 설정
     * @param sleeper 재시도 대기 전략
     * @param listener 관측 이벤트 수신자
     * @throws IllegalArgumentException 의존성이 null 인 경우
     */
    public ResilientExecutor(
        CircuitBreakerRegistry registry,
        ResilienceConfig defaultConfig,
        Sleeper sleeper,
        ResilienceEventListener listener
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.registry = registry;
        this.defaultConfig = defaultConfig;
        this.sleeper = sleeper;
        this.listener = listener;
    }

    /**
     * 기본 설정으로 실행.
     *
     * @param name 엔드포인트 이름
     * @param operation 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    public <T> T execute(String name, Supplier<T> operation) {
        return execute(name, operation, defaultConfig);
    }

    /**
     * 지정한 설정으로 실행.
     *
     * <ul>
     *   <li>circuitBreakerEnabled=false: Circuit Breaker 를 거치지 않음</li>
     *   <li>retry=null: 1회만 시도</li>
     * </ul>
     *
     * @param name 엔드포인트 이름
     * @param operation 실행할 작업
     * @param config 보호 설정
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws CircuitOpenException 회로가 열려 있어 호출이 거부된 경우
     * @throws RetryExhaustedException 재시도 예산을 모두 소진한 경우
     * @throws CancellationException 호출 또는 재시도 대기 중 인터럽트(취소)된 경우
     */
    public <T> T execute(String name, Supplier<T> operation, ResilienceConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        CircuitBreaker breaker = config.circuitBreakerEnabled()
            ? registry.getOrCreate(name, config.circuitBreaker())
            : new NoOpCircuitBreaker(name, config.circuitBreaker());
        RetryPolicy policy = config.retry() == null ? null : new RetryPolicy(config.retry());

        return execute(breaker, policy, operation);
    }

    /**
     * 주어진 Circuit Breaker 와 재시도 정책으로 실행.
     *
     * @param breaker Circuit Breaker
     * @param policy 재시도 정책 (null 이면 1회만 시도)
     * @param operation 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    public <T> T execute(CircuitBreaker breaker, RetryPolicy policy, Supplier<T> operation) {
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        String name = breaker.name();
        int maxAttempts = policy == null ? 1 : policy.getConfig().maxAttempts();

        for (int attempt = 1; ; attempt++) {
            if (!breaker.tryAcquire()) {
                notifyRejected(name);
                log.debug("Call to {} rejected: circuit {}", name, breaker.getState());
                throw new CircuitOpenException(name, breaker.getConfig().recoveryTimeout());
            }

            RuntimeException failure;
            try {
                T result = operation.get();
                breaker.recordSuccess();
                if (attempt > 1) {
                    log.info("Call to {} succeeded on attempt {}/{}", name, attempt, maxAttempts);
                }
                return result;
            } catch (RuntimeException e) {
                if (Thread.currentThread().isInterrupted() || ErrorClassifier.isCancellation(e)) {
                    breaker.releasePermit();
                    log.debug("Call to {} cancelled on attempt {}", name, attempt);
                    throw cancelled(name, e);
                }
                breaker.recordFailure(e);
                failure = e;
            } catch (Error e) {
                breaker.recordFailure(e);
                throw e;
            }

            ErrorKind kind = ErrorClassifier.classify(failure);
            if (!kind.isRetryable()) {
                log.debug("Call to {} failed with non-retryable {} on attempt {}", name, kind, attempt);
                throw failure;
            }

            if (attempt >= maxAttempts) {
                if (maxAttempts == 1) {
                    throw failure;
                }
                log.warn("Call to {} failed after {} attempts, last error: {}", name, attempt, kind);
                throw new RetryExhaustedException(
                    "Call to " + name + " failed after " + attempt + " attempts", attempt, failure);
            }

            Duration delay = policy.nextDelay(attempt);
            log.warn("Call to {} failed with {} on attempt {}/{}, retrying in {}ms",
                name, kind, attempt, maxAttempts, delay.toMillis());
            notifyRetry(name, attempt, kind, delay);
            pause(name, delay);
        }
    }

    public ResilienceConfig getDefaultConfig() {
        return defaultConfig;
    }

    public CircuitBreakerRegistry getRegistry() {
        return registry;
    }

    private void pause(String name, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Retry wait for " + name + " interrupted");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    private static CancellationException cancelled(String name, RuntimeException cause) {
        if (cause instanceof CancellationException cancellation) {
            return cancellation;
        }
        CancellationException cancelled = new CancellationException("Call to " + name + " cancelled");
        cancelled.initCause(cause);
        return cancelled;
    }

    private void notifyRetry(String name, int attempt, ErrorKind kind, Duration delay) {
        try {
            listener.onRetry(name, attempt, kind, delay);
        } catch (RuntimeException e) {
            log.warn("ResilienceEventListener.onRetry failed for {}", name, e);
        }
    }

    private void notifyRejected(String name) {
        try {
            listener.onCallRejected(name);
        } catch (RuntimeException e) {
            log.warn("ResilienceEventListener.onCallRejected failed for {}", name, e);
        }
    }
}
