package com.ryuqq.tsflow.adapter.runner;

import com.ryuqq.tsflow.application.runtime.BackendInfo;
import com.ryuqq.tsflow.application.runtime.BackendType;
import com.ryuqq.tsflow.application.runtime.ExecutionBackend;
import com.ryuqq.tsflow.core.spi.ClusterRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntSupplier;

/**
 * Dispatcher 당 한 번 ExecutionBackend 를 선택하고 캐시합니다.
 *
 * <p><strong>선택 규칙:</strong></p>
 * <pre>
 * enableDistributed == false       → Sequential
 * clusterRuntime.isAvailable()     → ClusterPool
 * 그 외                            → LocalAsyncPool
 * </pre>
 *
 * <p>maxWorkers 가 0 이면 ClusterPool 은 노드 수, LocalAsyncPool 은 CPU 수를 사용합니다.</p>
 *
 * <p>선택은 첫 {@link #get()} 호출 시점에 이루어지며 (lazy), 여러 스레드가 동시에 호출해도
 * Backend 는 하나만 생성됩니다. 이후 클러스터 가용성이 바뀌어도 선택은 바뀌지 않습니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class BackendSelector {

    private static final Logger log = LoggerFactory.getLogger(BackendSelector.class);

    private final DispatcherConfig config;
    private final ClusterRuntime clusterRuntime;
    private final IntSupplier availableProcessors;
    private final Object lock = new Object();
    private volatile ExecutionBackend selected;
    private volatile boolean shutdown;

    /**
     * 로컬 전용 생성자 (클러스터 런타임 없음).
     *
     * @param config Dispatcher 설정
     */
    public BackendSelector(DispatcherConfig config) {
        this(config, null);
    }

    /**
     * 생성자.
     *
     * @param config Dispatcher 설정
     * @param clusterRuntime 클러스터 런타임 (null 이면 클러스터 미사용)
     */
    public BackendSelector(DispatcherConfig config, ClusterRuntime clusterRuntime) {
        this(config, clusterRuntime, () -> Runtime.getRuntime().availableProcessors());
    }

    BackendSelector(DispatcherConfig config, ClusterRuntime clusterRuntime, IntSupplier availableProcessors) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (availableProcessors == null) {
            throw new IllegalArgumentException("availableProcessors cannot be null");
        }
        this.config = config;
        this.clusterRuntime = clusterRuntime;
        this.availableProcessors = availableProcessors;
    }

    /**
     * 선택된 Backend 반환 (최초 호출 시 생성).
     *
     * @return 캐시된 ExecutionBackend
     * @throws IllegalStateException shutdown() 이후 호출한 경우
     */
    public ExecutionBackend get() {
        ExecutionBackend current = selected;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("BackendSelector has been shut down");
            }
            if (selected == null) {
                selected = create();
                log.info("Selected {} backend (maxConcurrency={})", selected.type(), selected.maxConcurrency());
            }
            return selected;
        }
    }

    /**
     * 현재 설정과 환경을 보고합니다.
     *
     * <p>Backend 가 아직 선택되지 않았다면 선택될 Backend 를 예측해 보고하며, 생성하지는 않습니다.</p>
     *
     * @return BackendInfo
     */
    public BackendInfo info() {
        ExecutionBackend current = selected;
        boolean clusterAvailable = isClusterAvailable();
        if (current != null) {
            return new BackendInfo(current.type(), config.enableDistributed(), current.maxConcurrency(), clusterAvailable);
        }
        BackendType type = decideType(clusterAvailable);
        return new BackendInfo(type, config.enableDistributed(), resolveWorkers(type), clusterAvailable);
    }

    public boolean isSelected() {
        return selected != null;
    }

    /**
     * 선택된 Backend 를 종료합니다. 여러 번 호출해도 안전합니다.
     */
    public void shutdown() {
        ExecutionBackend toShutdown;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            toShutdown = selected;
        }
        if (toShutdown != null) {
            log.info("Shutting down {} backend", toShutdown.type());
            toShutdown.shutdown();
        }
    }

    private ExecutionBackend create() {
        BackendType type = decideType(isClusterAvailable());
        int workers = resolveWorkers(type);
        return switch (type) {
            case SEQUENTIAL -> new SequentialBackend();
            case CLUSTER_POOL -> new ClusterPoolBackend(clusterRuntime, workers);
            case LOCAL_ASYNC_POOL -> new LocalAsyncPoolBackend(workers);
        };
    }

    private BackendType decideType(boolean clusterAvailable) {
        if (!config.enableDistributed()) {
            return BackendType.SEQUENTIAL;
        }
        return clusterAvailable ? BackendType.CLUSTER_POOL : BackendType.LOCAL_ASYNC_POOL;
    }

    private int resolveWorkers(BackendType type) {
        if (type == BackendType.SEQUENTIAL) {
            return 1;
        }
        if (!config.isAutoMaxWorkers()) {
            return config.maxWorkers();
        }
        int auto = type == BackendType.CLUSTER_POOL ? clusterRuntime.nodeCount() : availableProcessors.getAsInt();
        return Math.max(1, auto);
    }

    private boolean isClusterAvailable() {
        return clusterRuntime != null && clusterRuntime.isAvailable();
    }
}
