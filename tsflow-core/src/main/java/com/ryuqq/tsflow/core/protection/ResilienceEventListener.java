package com.ryuqq.tsflow.core.protection;

import com.ryuqq.tsflow.core.exception.ErrorKind;

import java.time.Duration;

/**
 * 보호 메커니즘 관측 이벤트 수신자.
 *
 * <p>모니터링 용도의 부가 정보이며, 구현체의 예외는 실행 흐름에 영향을 주어서는 안 됩니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public interface ResilienceEventListener {

    /**
     * 재시도 예약.
     *
     * @param name 엔드포인트 이름
     * @param attempt 실패한 시도 번호
     * @param kind 실패 종류
     * @param delay 다음 시도까지 대기 시간
     */
    void onRetry(String name, int attempt, ErrorKind kind, Duration delay);

    /**
     * Circuit Breaker 상태 전이.
     *
     * @param name Circuit Breaker 이름
     * @param from 이전 상태
     * @param to 새 상태
     */
    void onStateTransition(String name, CircuitBreakerState from, CircuitBreakerState to);

    /**
     * Circuit Breaker 가 호출을 거부함.
     *
     * @param name Circuit Breaker 이름
     */
    void onCallRejected(String name);
}
