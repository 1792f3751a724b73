package com.ryuqq.tsflow.testkit.fixture;

import com.ryuqq.tsflow.core.spi.ClusterRuntime;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스레드 풀로 원격 노드를 흉내 내는 ClusterRuntime.
 *
 * <p>노드 하나당 스레드 하나를 사용합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class InMemoryClusterRuntime implements ClusterRuntime, AutoCloseable {

    private final int nodeCount;
    private final ExecutorService nodes;
    private final AtomicInteger submissions = new AtomicInteger();
    private volatile boolean available;

    public InMemoryClusterRuntime(int nodeCount) {
        if (nodeCount <= 0) {
            throw new IllegalArgumentException("nodeCount must be positive (current: " + nodeCount + ")");
        }
        this.nodeCount = nodeCount;
        this.nodes = Executors.newFixedThreadPool(nodeCount);
        this.available = true;
    }

    /**
     * 접속 불가 상태의 런타임.
     *
     * @return isAvailable() == false 인 런타임
     */
    public static InMemoryClusterRuntime unavailable() {
        InMemoryClusterRuntime runtime = new InMemoryClusterRuntime(1);
        runtime.available = false;
        return runtime;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public int nodeCount() {
        return nodeCount;
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        if (!available) {
            return CompletableFuture.failedFuture(new IllegalStateException("Cluster is not available"));
        }
        submissions.incrementAndGet();
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, nodes);
    }

    public int submissionCount() {
        return submissions.get();
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public void close() throws InterruptedException {
        nodes.shutdown();
        if (!nodes.awaitTermination(10, TimeUnit.SECONDS)) {
            nodes.shutdownNow();
        }
    }
}
