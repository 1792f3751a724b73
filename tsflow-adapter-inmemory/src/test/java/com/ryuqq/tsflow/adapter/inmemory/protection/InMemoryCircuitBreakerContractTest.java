package com.ryuqq.tsflow.adapter.inmemory.protection;

import com.ryuqq.tsflow.core.exception.ErrorKind;
import com.ryuqq.tsflow.core.protection.CircuitBreaker;
import com.ryuqq.tsflow.core.protection.CircuitBreakerConfig;
import com.ryuqq.tsflow.core.protection.CircuitBreakerState;
import com.ryuqq.tsflow.core.protection.ResilienceEventListener;
import com.ryuqq.tsflow.testkit.contract.AbstractCircuitBreakerContractTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryCircuitBreaker Contract Test.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
@DisplayName("InMemoryCircuitBreaker Contract Test")
class InMemoryCircuitBreakerContractTest extends AbstractCircuitBreakerContractTest {

    @Override
    protected CircuitBreaker createBreaker(
        String name, CircuitBreakerConfig config, Clock clock, ResilienceEventListener listener
    ) {
        return new InMemoryCircuitBreaker(name, config, clock, listener);
    }

    @Test
    @DisplayName("OPEN 상태에서 남은 대기 시간을 계산한다")
    void remainingOpenTime_계산() {
        failTimes(THRESHOLD);
        clock.advance(Duration.ofSeconds(10));

        InMemoryCircuitBreaker inMemory = (InMemoryCircuitBreaker) breaker;

        assertThat(inMemory.remainingOpenTime()).isEqualTo(Duration.ofSeconds(20));
        clock.advance(Duration.ofMinutes(5));
        assertThat(inMemory.remainingOpenTime()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("연속 실패 수를 노출한다")
    void consecutiveFailures_노출() {
        failTimes(3);

        assertThat(((InMemoryCircuitBreaker) breaker).getConsecutiveFailures()).isEqualTo(3);
    }

    @Test
    @DisplayName("리스너 예외는 상태 전이를 막지 않는다")
    void listener_예외_무시() {
        ResilienceEventListener broken = new ResilienceEventListener() {
            @Override
            public void onRetry(String name, int attempt, ErrorKind kind, Duration delay) {
                // unused
            }

            @Override
            public void onStateTransition(String name, CircuitBreakerState from,
                                          CircuitBreakerState to) {
                throw new IllegalStateException("listener broken");
            }

            @Override
            public void onCallRejected(String name) {
                // unused
            }
        };
        breaker = new InMemoryCircuitBreaker(NAME, new CircuitBreakerConfig(1, RECOVERY), clock, broken);

        breaker.tryAcquire();
        breaker.recordFailure(new IOException("reset"));

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }
}
