package com.ryuqq.tsflow.core.protection;

import java.time.Duration;

/**
 * 재시도 사이 대기 전략.
 *
 * <p>테스트에서는 실제로 대기하지 않는 구현으로 교체합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /** {@link Thread#sleep(long)} 기반 구현. */
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    /**
     * 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트 발생 (쿼리 취소)
     */
    void sleep(Duration duration) throws InterruptedException;
}
