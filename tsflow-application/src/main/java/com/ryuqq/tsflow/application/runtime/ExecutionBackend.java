package com.ryuqq.tsflow.application.runtime;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * 파티션 작업 실행 백엔드.
 *
 * <p>DistributedDispatcher 는 파티션마다 하나의 작업을 제출하고,
 * 반환된 Future 를 파티션 순서대로 기다려 결과를 재조립합니다.</p>
 *
 * <p><strong>구현체 계약:</strong></p>
 * <ul>
 *   <li>작업 실패는 반환 Future 를 예외로 완료시키며, submit() 자체는 던지지 않음</li>
 *   <li>동시에 실행되는 작업 수는 {@link #maxConcurrency()} 를 넘지 않음</li>
 *   <li>반환 Future 의 cancel(true) 는 실행 중 작업을 인터럽트함 (가능한 경우)</li>
 *   <li>{@link #shutdown()} 이후 submit() 은 IllegalStateException</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈에서 제공됩니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public interface ExecutionBackend {

    /**
     * 작업 제출.
     *
     * @param task 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과 Future
     * @throws IllegalStateException shutdown 이후 호출된 경우
     */
    <T> CompletableFuture<T> submit(Callable<T> task);

    /**
     * 최대 동시 실행 수.
     *
     * @return 1 이상
     */
    int maxConcurrency();

    /**
     * 백엔드 종류.
     *
     * @return BackendType
     */
    BackendType type();

    /**
     * 자원 해제.
     *
     * <p>이미 제출된 작업의 완료를 기다린 뒤 자원을 정리합니다. 여러 번 호출해도 안전합니다.</p>
     */
    void shutdown();
}
