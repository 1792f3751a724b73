package com.ryuqq.tsflow.adapter.runner;

import com.ryuqq.tsflow.application.runtime.BackendType;
import com.ryuqq.tsflow.application.runtime.ExecutionBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 로컬 고정 크기 스레드 풀 Backend.
 *
 * <p>maxWorkers 개의 스레드가 작업을 실행하고, 초과분은 풀의 큐에서 대기합니다.</p>
 *
 * <p>반환된 Future 를 {@code cancel(true)} 하면 실행 중인 워커 스레드를 인터럽트합니다.
 * CompletableFuture 자체의 cancel 은 인터럽트를 전파하지 않으므로 풀의 Future 와 연결해 둡니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class LocalAsyncPoolBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalAsyncPoolBackend.class);
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(60);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final int maxWorkers;
    private final Duration shutdownTimeout;
    private final ExecutorService workerExecutor;

    public LocalAsyncPoolBackend(int maxWorkers) {
        this(maxWorkers, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * 생성자.
     *
     * @param maxWorkers 워커 스레드 수 (1 이상)
     * @param shutdownTimeout shutdown() 에서 진행 중인 작업을 기다릴 최대 시간
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LocalAsyncPoolBackend(int maxWorkers, Duration shutdownTimeout) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive (current: " + maxWorkers + ")");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative (current: " + shutdownTimeout + ")");
        }
        this.maxWorkers = maxWorkers;
        this.shutdownTimeout = shutdownTimeout;
        this.workerExecutor = Executors.newFixedThreadPool(maxWorkers, workerThreadFactory());
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> running;
        try {
            running = workerExecutor.submit(() -> {
                try {
                    result.complete(task.call());
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("LocalAsyncPoolBackend has been shut down", e);
        }

        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                running.cancel(true);
            }
        });
        return result;
    }

    @Override
    public int maxConcurrency() {
        return maxWorkers;
    }

    @Override
    public BackendType type() {
        return BackendType.LOCAL_ASYNC_POOL;
    }

    /**
     * 새 작업 접수를 멈추고 진행 중인 작업이 끝나기를 기다립니다.
     *
     * <p>shutdownTimeout 안에 끝나지 않으면 워커를 인터럽트합니다.</p>
     */
    @Override
    public void shutdown() {
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not terminate within {}ms, interrupting workers", shutdownTimeout.toMillis());
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger worker = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "tsflow-pool-" + pool + "-worker-" + worker.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
