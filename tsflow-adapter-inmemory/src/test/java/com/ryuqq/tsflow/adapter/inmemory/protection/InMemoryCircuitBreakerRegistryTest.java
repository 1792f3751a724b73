package com.ryuqq.tsflow.adapter.inmemory.protection;

import com.ryuqq.tsflow.core.exception.DataConnectionException;
import com.ryuqq.tsflow.core.protection.CircuitBreaker;
import com.ryuqq.tsflow.core.protection.CircuitBreakerConfig;
import com.ryuqq.tsflow.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryCircuitBreakerRegistry 테스트.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
@DisplayName("InMemoryCircuitBreakerRegistry 테스트")
class InMemoryCircuitBreakerRegistryTest {

    @Test
    @DisplayName("같은 이름은 같은 인스턴스를 돌려주고, 이후 config 는 무시한다")
    void getOrCreate_같은_이름_같은_인스턴스() {
        // given
        InMemoryCircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry();

        // when
        CircuitBreaker first = registry.getOrCreate("bars", CircuitBreakerConfig.defaults());
        CircuitBreaker second = registry.getOrCreate("bars", new CircuitBreakerConfig(1, Duration.ofSeconds(1)));

        // then
        assertThat(second).isSameAs(first);
        assertThat(second.getConfig()).isEqualTo(CircuitBreakerConfig.defaults());
        assertThat(registry.find("bars")).containsSame(first);
        assertThat(registry.find("ticks")).isEmpty();
    }

    @Test
    @DisplayName("엔드포인트마다 독립된 상태를 가진다")
    void getOrCreate_엔드포인트별_독립() {
        InMemoryCircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry();
        CircuitBreakerConfig config = new CircuitBreakerConfig(1, Duration.ofSeconds(30));
        CircuitBreaker bars = registry.getOrCreate("bars", config);
        CircuitBreaker ticks = registry.getOrCreate("ticks", config);

        bars.tryAcquire();
        bars.recordFailure(new DataConnectionException("refused"));

        assertThat(bars.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(ticks.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(registry.names()).containsExactlyInAnyOrder("bars", "ticks");
    }

    @Test
    @DisplayName("동시에 생성해도 이름당 인스턴스는 하나다")
    void getOrCreate_동시_생성() throws InterruptedException {
        // given
        InMemoryCircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        Set<CircuitBreaker> seen = ConcurrentHashMap.newKeySet();

        // when
        for (int i = 0; i < 32; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                    seen.add(registry.getOrCreate("bars", CircuitBreakerConfig.defaults()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(seen).hasSize(1);
    }

    @Test
    @DisplayName("resetAll() 은 모든 Circuit Breaker 를 CLOSED 로 되돌린다")
    void resetAll_CLOSED() {
        InMemoryCircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry();
        CircuitBreaker bars = registry.getOrCreate("bars", new CircuitBreakerConfig(1, Duration.ofSeconds(30)));
        bars.tryAcquire();
        bars.recordFailure(new DataConnectionException("refused"));

        registry.resetAll();

        assertThat(bars.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    @DisplayName("빈 이름과 null config 는 거부한다")
    void getOrCreate_인자_검증() {
        InMemoryCircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry();

        assertThatThrownBy(() -> registry.getOrCreate("", CircuitBreakerConfig.defaults()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.getOrCreate("bars", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
