package com.ryuqq.tsflow.adapter.runner;

import com.ryuqq.tsflow.application.runtime.BackendType;
import com.ryuqq.tsflow.application.runtime.ExecutionBackend;
import com.ryuqq.tsflow.core.spi.ClusterRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 클러스터 런타임에 작업을 위임하는 Backend.
 *
 * <p>Semaphore 로 원격 호출의 동시 실행 수를 maxWorkers 로 제한합니다.
 * 허가가 없으면 submit() 은 허가가 반납될 때까지 호출 스레드를 대기시킵니다.</p>
 *
 * <p>클러스터 런타임의 생명주기는 호출자가 관리합니다. shutdown() 은 런타임을 닫지 않고,
 * 이 Backend 로 제출된 원격 호출이 끝나기를 기다립니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class ClusterPoolBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(ClusterPoolBackend.class);
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(60);

    private final ClusterRuntime runtime;
    private final int maxWorkers;
    private final Duration shutdownTimeout;
    private final Semaphore permits;
    private volatile boolean shutdown;

    public ClusterPoolBackend(ClusterRuntime runtime, int maxWorkers) {
        this(runtime, maxWorkers, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * 생성자.
     *
     * @param runtime 클러스터 런타임
     * @param maxWorkers 동시 원격 호출 상한 (1 이상)
     * @param shutdownTimeout shutdown() 에서 진행 중인 호출을 기다릴 최대 시간
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ClusterPoolBackend(ClusterRuntime runtime, int maxWorkers, Duration shutdownTimeout) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive (current: " + maxWorkers + ")");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative (current: " + shutdownTimeout + ")");
        }
        this.runtime = runtime;
        this.maxWorkers = maxWorkers;
        this.shutdownTimeout = shutdownTimeout;
        this.permits = new Semaphore(maxWorkers, true);
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (shutdown) {
            throw new IllegalStateException("ClusterPoolBackend has been shut down");
        }

        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting for a cluster slot");
            cancelled.initCause(e);
            return CompletableFuture.failedFuture(cancelled);
        }

        CompletableFuture<T> remote;
        try {
            remote = runtime.submit(task);
        } catch (RuntimeException e) {
            permits.release();
            return CompletableFuture.failedFuture(e);
        }
        remote.whenComplete((value, error) -> permits.release());
        return remote;
    }

    @Override
    public int maxConcurrency() {
        return maxWorkers;
    }

    @Override
    public BackendType type() {
        return BackendType.CLUSTER_POOL;
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        try {
            if (permits.tryAcquire(maxWorkers, shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                permits.release(maxWorkers);
            } else {
                log.warn("Cluster calls still in flight after {}ms, giving up the wait", shutdownTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
