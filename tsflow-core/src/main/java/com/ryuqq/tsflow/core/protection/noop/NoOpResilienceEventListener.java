package com.ryuqq.tsflow.core.protection.noop;

import com.ryuqq.tsflow.core.exception.ErrorKind;
import com.ryuqq.tsflow.core.protection.CircuitBreakerState;
import com.ryuqq.tsflow.core.protection.ResilienceEventListener;

import java.time.Duration;

/**
 * 이벤트를 버리는 기본 수신자.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class NoOpResilienceEventListener implements ResilienceEventListener {

    public static final NoOpResilienceEventListener INSTANCE = new NoOpResilienceEventListener();

    @Override
    public void onRetry(String name, int attempt, ErrorKind kind, Duration delay) {
        // NoOp
    }

    @Override
    public void onStateTransition(String name, CircuitBreakerState from, CircuitBreakerState to) {
        // NoOp
    }

    @Override
    public void onCallRejected(String name) {
        // NoOp
    }
}
