package com.ryuqq.tsflow.application.resilience;

import com.ryuqq.tsflow.core.exception.AuthenticationException;
import com.ryuqq.tsflow.core.exception.CircuitOpenException;
import com.ryuqq.tsflow.core.exception.DataConnectionException;
import com.ryuqq.tsflow.core.exception.DataTimeoutException;
import com.ryuqq.tsflow.core.exception.ErrorKind;
import com.ryuqq.tsflow.core.exception.RetryExhaustedException;
import com.ryuqq.tsflow.core.protection.CircuitBreaker;
import com.ryuqq.tsflow.core.protection.CircuitBreakerConfig;
import com.ryuqq.tsflow.core.protection.CircuitBreakerRegistry;
import com.ryuqq.tsflow.core.protection.CircuitBreakerState;
import com.ryuqq.tsflow.core.protection.ResilienceConfig;
import com.ryuqq.tsflow.core.protection.ResilienceEventListener;
import com.ryuqq.tsflow.core.protection.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResilientExecutor 단위 테스트.
 *
 * <p>Circuit Breaker 와 레지스트리는 Mock 으로 대체하고, 대기 시간은 기록만 합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ResilientExecutor 테스트")
class ResilientExecutorTest {

    private static final String ENDPOINT = "bars-endpoint";

    @Mock
    private CircuitBreakerRegistry registry;

    @Mock
    private CircuitBreaker breaker;

    @Mock
    private ResilienceEventListener listener;

    private final List<Duration> sleeps = new ArrayList<>();
    private ResilientExecutor executor;

    @BeforeEach
    void setUp() {
        lenient().when(registry.getOrCreate(eq(ENDPOINT), any())).thenReturn(breaker);
        lenient().when(breaker.name()).thenReturn(ENDPOINT);
        lenient().when(breaker.tryAcquire()).thenReturn(true);
        lenient().when(breaker.getConfig()).thenReturn(CircuitBreakerConfig.defaults());
        lenient().when(breaker.getState()).thenReturn(CircuitBreakerState.OPEN);

        Sleeper recording = sleeps::add;
        executor = new ResilientExecutor(registry, ResilienceConfig.defaults(), recording, listener);
    }

    @AfterEach
    void tearDown() {
        // 인터럽트 테스트가 남긴 플래그 정리
        Thread.interrupted();
    }

    // ============================================================
    // 1. 성공 경로
    // ============================================================

    @Test
    @DisplayName("첫 시도 성공 시 결과를 반환하고 성공을 기록한다")
    void execute_첫시도_성공() {
        // when
        String result = executor.execute(ENDPOINT, () -> "ok");

        // then
        assertThat(result).isEqualTo("ok");
        verify(breaker).recordSuccess();
        verify(breaker, never()).recordFailure(any());
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("일시적 오류 후 재시도하여 성공한다")
    void execute_재시도_후_성공() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = executor.execute(ENDPOINT, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new DataConnectionException("refused");
            }
            return "ok";
        });

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        verify(breaker, times(2)).recordFailure(any(DataConnectionException.class));
        verify(breaker).recordSuccess();
        verify(listener).onRetry(ENDPOINT, 1, ErrorKind.CONNECTION, Duration.ofSeconds(1));
        verify(listener).onRetry(ENDPOINT, 2, ErrorKind.CONNECTION, Duration.ofSeconds(2));
    }

    // ============================================================
    // 2. 실패 경로
    // ============================================================

    @Test
    @DisplayName("타임아웃이 3번 연속되면 RetryExhaustedException(attemptCount=3) 이다")
    void execute_재시도_소진() {
        // given
        DataTimeoutException last = new DataTimeoutException("third");
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.execute(ENDPOINT, () -> {
            if (calls.incrementAndGet() == 3) {
                throw last;
            }
            throw new DataTimeoutException("slow");
        }))
            .isInstanceOfSatisfying(RetryExhaustedException.class, exhausted -> {
                assertThat(exhausted.getAttemptCount()).isEqualTo(3);
                assertThat(exhausted.getLastError()).isSameAs(last);
            });
        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    @DisplayName("재시도 불가 오류는 즉시 원본 그대로 전파된다")
    void execute_재시도_불가_원본_전파() {
        // given
        AuthenticationException denied = new AuthenticationException("token expired");
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.execute(ENDPOINT, () -> {
            calls.incrementAndGet();
            throw denied;
        })).isSameAs(denied);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
        verify(breaker).recordFailure(denied);
    }

    @Test
    @DisplayName("분류할 수 없는 오류는 재시도하지 않는다")
    void execute_분류불가_오류() {
        IllegalStateException bug = new IllegalStateException("bug");

        assertThatThrownBy(() -> executor.execute(ENDPOINT, () -> {
            throw bug;
        })).isSameAs(bug);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("UncheckedIOException 으로 감싼 소켓 타임아웃은 재시도한다")
    void execute_UncheckedIOException_재시도() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute(ENDPOINT, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new UncheckedIOException(new SocketTimeoutException("read timed out"));
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        verify(listener).onRetry(ENDPOINT, 1, ErrorKind.TIMEOUT, Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("maxAttempts=1 이면 재시도 가능 오류도 원본 그대로 전파된다")
    void execute_단일시도_원본_전파() {
        DataTimeoutException timeout = new DataTimeoutException("slow");
        ResilienceConfig single = ResilienceConfig.defaults().withoutRetry();

        assertThatThrownBy(() -> executor.execute(ENDPOINT, () -> {
            throw timeout;
        }, single)).isSameAs(timeout);
    }

    // ============================================================
    // 3. Circuit Breaker 연동
    // ============================================================

    @Test
    @DisplayName("회로가 열려 있으면 작업을 실행하지 않고 CircuitOpenException 을 던진다")
    void execute_회로_열림() {
        // given
        when(breaker.tryAcquire()).thenReturn(false);
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.execute(ENDPOINT, calls::incrementAndGet))
            .isInstanceOfSatisfying(CircuitOpenException.class, open -> {
                assertThat(open.getCircuitName()).isEqualTo(ENDPOINT);
                assertThat(open.getRetryAfter()).isEqualTo(Duration.ofSeconds(30));
            });
        assertThat(calls).hasValue(0);
        verify(listener).onCallRejected(ENDPOINT);
    }

    @Test
    @DisplayName("재시도 중 회로가 열리면 남은 예산과 무관하게 중단된다")
    void execute_재시도중_회로_열림() {
        // given
        when(breaker.tryAcquire()).thenReturn(true, false);
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.execute(ENDPOINT, () -> {
            calls.incrementAndGet();
            throw new DataConnectionException("refused");
        })).isInstanceOf(CircuitOpenException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Circuit Breaker 를 끄면 레지스트리를 조회하지 않는다")
    void execute_회로_비활성() {
        ResilienceConfig noCircuit = ResilienceConfig.defaults().withCircuitBreakerDisabled();

        String result = executor.execute(ENDPOINT, () -> "ok", noCircuit);

        assertThat(result).isEqualTo("ok");
        verify(registry, never()).getOrCreate(anyString(), any());
    }

    @Test
    @DisplayName("엔드포인트 이름과 설정으로 레지스트리에서 Circuit Breaker 를 가져온다")
    void execute_레지스트리_조회() {
        ResilienceConfig config = ResilienceConfig.forHighAvailability();

        executor.execute(ENDPOINT, () -> "ok", config);

        verify(registry).getOrCreate(ENDPOINT, config.circuitBreaker());
    }

    // ============================================================
    // 4. 취소
    // ============================================================

    @Test
    @DisplayName("재시도 대기 중 인터럽트되면 CancellationException 을 던지고 인터럽트 플래그를 복원한다")
    void execute_대기중_인터럽트() {
        // given
        Sleeper interrupted = duration -> {
            throw new InterruptedException("cancelled");
        };
        ResilientExecutor cancellable = new ResilientExecutor(registry, ResilienceConfig.defaults(), interrupted, listener);

        // when & then
        assertThatThrownBy(() -> cancellable.execute(ENDPOINT, () -> {
            throw new DataTimeoutException("slow");
        }))
            .isInstanceOf(CancellationException.class)
            .hasCauseInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    @DisplayName("작업 중 인터럽트되면 실패로 기록하지 않고 허용만 반납한 뒤 재시도 없이 CancellationException 을 던진다")
    void execute_작업중_인터럽트() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.execute(ENDPOINT, () -> {
            calls.incrementAndGet();
            Thread.currentThread().interrupt();
            throw new DataTimeoutException("read aborted");
        }))
            .isInstanceOf(CancellationException.class)
            .hasCauseInstanceOf(DataTimeoutException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(breaker).releasePermit();
        verify(breaker, never()).recordFailure(any());
        verify(listener, never()).onRetry(anyString(), anyInt(), any(), any());
    }

    @Test
    @DisplayName("원인 체인에 InterruptedException 이 있으면 인터럽트 플래그가 없어도 취소로 본다")
    void execute_인터럽트_원인_취소() {
        // when & then
        assertThatThrownBy(() -> executor.execute(ENDPOINT, () -> {
            throw new IllegalStateException("fetch interrupted", new InterruptedException());
        }))
            .isInstanceOf(CancellationException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        verify(breaker).releasePermit();
        verify(breaker, never()).recordFailure(any());
    }

    @Test
    @DisplayName("작업이 던진 CancellationException 은 그대로 전파된다")
    void execute_취소_원본_전파() {
        // given
        CancellationException cancelled = new CancellationException("caller gave up");

        // when & then
        assertThatThrownBy(() -> executor.execute(ENDPOINT, () -> {
            throw cancelled;
        })).isSameAs(cancelled);
        verify(breaker).releasePermit();
        verify(breaker, never()).recordFailure(any());
    }

    @Test
    @DisplayName("리스너 예외는 실행 흐름에 영향을 주지 않는다")
    void execute_리스너_예외_무시() {
        // given
        doThrow(new IllegalStateException("listener broken"))
            .when(listener).onRetry(anyString(), anyInt(), any(), any());
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = executor.execute(ENDPOINT, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new DataTimeoutException("slow");
            }
            return "ok";
        });

        // then
        assertThat(result).isEqualTo("ok");
    }
}
