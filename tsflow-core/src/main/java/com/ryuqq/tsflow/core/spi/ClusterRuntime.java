package com.ryuqq.tsflow.core.spi;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * 원격 클러스터 실행 런타임 SPI.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public interface ClusterRuntime {

    /**
     * 클러스터 접속 가능 여부.
     *
     * @return 작업 제출이 가능하면 true
     */
    boolean isAvailable();

    /**
     * 사용 가능한 노드(워커) 수.
     *
     * @return 노드 수 (1 이상)
     */
    int nodeCount();

    /**
     * 작업을 원격으로 제출.
     *
     * @param task 실행할 작업
     * @param <T> 결과 타입
     * @return 결과 Future (작업 실패 시 예외로 완료)
     */
    <T> CompletableFuture<T> submit(Callable<T> task);
}
