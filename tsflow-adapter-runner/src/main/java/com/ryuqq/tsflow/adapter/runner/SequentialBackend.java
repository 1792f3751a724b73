package com.ryuqq.tsflow.adapter.runner;

import com.ryuqq.tsflow.application.runtime.BackendType;
import com.ryuqq.tsflow.application.runtime.ExecutionBackend;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * 호출 스레드에서 작업을 바로 실행하는 Backend.
 *
 * <p>submit() 이 반환될 때 Future 는 이미 완료되어 있습니다.
 * 작업 실패는 예외로 던지지 않고 실패한 Future 로 전달합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class SequentialBackend implements ExecutionBackend {

    private volatile boolean shutdown;

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (shutdown) {
            throw new IllegalStateException("SequentialBackend has been shut down");
        }
        try {
            return CompletableFuture.completedFuture(task.call());
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public int maxConcurrency() {
        return 1;
    }

    @Override
    public BackendType type() {
        return BackendType.SEQUENTIAL;
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }
}
