package com.ryuqq.tsflow.testkit.fixture;

import com.ryuqq.tsflow.core.exception.ErrorKind;
import com.ryuqq.tsflow.core.protection.CircuitBreakerState;
import com.ryuqq.tsflow.core.protection.ResilienceEventListener;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 수신한 이벤트를 문자열로 기록하는 리스너.
 *
 * <p>기록 형식:</p>
 * <ul>
 *   <li>retry:{name}:{attempt}:{kind}:{delayMs}</li>
 *   <li>transition:{name}:{from}-&gt;{to}</li>
 *   <li>rejected:{name}</li>
 * </ul>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class RecordingEventListener implements ResilienceEventListener {

    private final List<String> events = new CopyOnWriteArrayList<>();

    @Override
    public void onRetry(String name, int attempt, ErrorKind kind, Duration delay) {
        events.add("retry:" + name + ":" + attempt + ":" + kind + ":" + delay.toMillis());
    }

    @Override
    public void onStateTransition(String name, CircuitBreakerState from, CircuitBreakerState to) {
        events.add("transition:" + name + ":" + from + "->" + to);
    }

    @Override
    public void onCallRejected(String name) {
        events.add("rejected:" + name);
    }

    public List<String> events() {
        return List.copyOf(events);
    }

    public List<String> transitions() {
        return events.stream().filter(event -> event.startsWith("transition:")).toList();
    }

    public void clear() {
        events.clear();
    }
}
