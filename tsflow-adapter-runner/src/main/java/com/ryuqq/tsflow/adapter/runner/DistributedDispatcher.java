package com.ryuqq.tsflow.adapter.runner;

import com.ryuqq.tsflow.adapter.inmemory.protection.InMemoryCircuitBreakerRegistry;
import com.ryuqq.tsflow.application.config.FlowSettings;
import com.ryuqq.tsflow.application.dispatcher.BatchStream;
import com.ryuqq.tsflow.application.dispatcher.QueryDispatcher;
import com.ryuqq.tsflow.application.registry.DataFetcherRegistry;
import com.ryuqq.tsflow.application.resilience.ResilientExecutor;
import com.ryuqq.tsflow.application.runtime.BackendInfo;
import com.ryuqq.tsflow.application.runtime.ExecutionBackend;
import com.ryuqq.tsflow.core.model.OptimizationHint;
import com.ryuqq.tsflow.core.model.RecordBatch;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;
import com.ryuqq.tsflow.core.partition.Partition;
import com.ryuqq.tsflow.core.partition.Partitioner;
import com.ryuqq.tsflow.core.partition.QueryPlanner;
import com.ryuqq.tsflow.core.protection.Sleeper;
import com.ryuqq.tsflow.core.protection.noop.NoOpResilienceEventListener;
import com.ryuqq.tsflow.core.spi.ClusterRuntime;
import com.ryuqq.tsflow.core.spi.DataFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 쿼리를 파티션으로 나눠 ExecutionBackend 에서 병렬로 가져오는 Dispatcher.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * stream(query, hint)
 *   ↓
 * registry.lookup(query)           → DataFetcher
 * planner.plan(query, hint)        → [Partition 1..N]
 * selector.get()                   → ExecutionBackend (Dispatcher 당 한 번 선택, 캐시)
 *   ↓
 * 각 Partition:
 *   backend.submit(resilientExecutor.execute(endpoint, fetch(partition)))
 *   ↓
 * BatchStream
 *   ├─ preserveOrder=true  → 파티션 순서대로 (maxConcurrency 만큼 미리 제출)
 *   └─ preserveOrder=false → 완료 순서대로 (preferRecentData 면 최근 파티션부터 제출)
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>실패한 파티션은 경고 로그를 남기고 건너뜀 ({@link BatchStream#summary()} 에 기록)</li>
 *   <li>모든 파티션이 실패하면 PartitionDispatchException</li>
 *   <li>파티션이 1개인 쿼리가 실패하면 원본 예외를 그대로 던짐</li>
 * </ul>
 *
 * <p>재시도와 Circuit Breaker 는 각 파티션 작업 안에서 적용되므로,
 * 재시도 대기는 워커 스레드를 점유합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class DistributedDispatcher implements QueryDispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DistributedDispatcher.class);

    private final DataFetcherRegistry registry;
    private final ResilientExecutor resilientExecutor;
    private final QueryPlanner planner;
    private final DispatcherConfig config;
    private final BackendSelector selector;

    /**
     * 로컬 전용 생성자 (기본 QueryPlanner, 클러스터 없음).
     *
     * @param registry DataFetcher 레지스트리
     * @param resilientExecutor 재시도/Circuit Breaker 실행기
     * @param config Dispatcher 설정
     */
    public DistributedDispatcher(DataFetcherRegistry registry, ResilientExecutor resilientExecutor, DispatcherConfig config) {
        this(registry, resilientExecutor, new QueryPlanner(), config, (ClusterRuntime) null);
    }

    /**
     * 생성자.
     *
     * @param registry DataFetcher 레지스트리
     * @param resilientExecutor 재시도/Circuit Breaker 실행기
     * @param planner 파티션 계획기
     * @param config Dispatcher 설정
     * @param clusterRuntime 클러스터 런타임 (null 이면 클러스터 미사용)
     * @throws IllegalArgumentException 필수 의존성이 null 인 경우
     */
    public DistributedDispatcher(
        DataFetcherRegistry registry,
        ResilientExecutor resilientExecutor,
        QueryPlanner planner,
        DispatcherConfig config,
        ClusterRuntime clusterRuntime
    ) {
        this(registry, resilientExecutor, planner, config,
            config == null ? null : new BackendSelector(config, clusterRuntime));
    }

    DistributedDispatcher(
        DataFetcherRegistry registry,
        ResilientExecutor resilientExecutor,
        QueryPlanner planner,
        DispatcherConfig config,
        BackendSelector selector
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (resilientExecutor == null) {
            throw new IllegalArgumentException("resilientExecutor cannot be null");
        }
        if (planner == null) {
            throw new IllegalArgumentException("planner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (selector == null) {
            throw new IllegalArgumentException("selector cannot be null");
        }
        this.registry = registry;
        this.resilientExecutor = resilientExecutor;
        this.planner = planner;
        this.config = config;
        this.selector = selector;
    }

    /**
     * 쿼리를 파티션 단위로 가져오는 스트림을 엽니다.
     *
     * <p>첫 파티션들은 이 메서드가 반환되기 전에 제출됩니다.
     * 스트림을 다 읽지 않을 경우 {@link BatchStream#close()} 로 남은 작업을 취소해야 합니다.</p>
     *
     * @param query 쿼리
     * @param hint 최적화 힌트
     * @param <Q> 쿼리 타입
     * @return 배치 스트림
     * @throws IllegalArgumentException 쿼리 타입에 등록된 DataFetcher 가 없는 경우
     * @throws IllegalStateException Dispatcher 가 닫힌 경우
     */
    @Override
    public <Q extends TimeSeriesQuery<Q>> BatchStream stream(Q query, OptimizationHint hint) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (hint == null) {
            throw new IllegalArgumentException("hint cannot be null");
        }

        DataFetcher<Q> fetcher = registry.lookup(query);
        List<Partition<Q>> partitions = planner.plan(query, hint);
        ExecutionBackend backend = selector.get();
        int lookAhead = Math.max(1, backend.maxConcurrency());

        log.info("Dispatching {} over {} partitions on {} (pattern={}, preserveOrder={})",
            query.timeRange(), partitions.size(), backend.type(), hint.pattern(), config.preserveOrder());

        Function<Partition<Q>, List<RecordBatch>> partitionFetch = partition -> fetchPartition(fetcher, partition);
        PartitionBatchStream<Q> stream;
        if (config.preserveOrder()) {
            stream = new OrderedBatchStream<>(backend, partitionFetch, partitions, lookAhead);
        } else {
            stream = new UnorderedBatchStream<>(backend, partitionFetch, partitions, lookAhead, hint.preferRecentData());
        }
        stream.start();
        return stream;
    }

    /**
     * 프로세스 설정으로 Dispatcher 를 조립합니다.
     *
     * <p>Circuit Breaker 는 Dispatcher 전용 InMemoryCircuitBreakerRegistry 에 엔드포인트별로 생성됩니다.</p>
     *
     * @param settings 프로세스 설정
     * @param registry DataFetcher 레지스트리
     * @param clusterRuntime 클러스터 런타임 (null 이면 클러스터 미사용)
     * @return DistributedDispatcher
     */
    public static DistributedDispatcher create(FlowSettings settings, DataFetcherRegistry registry, ClusterRuntime clusterRuntime) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        ResilientExecutor resilientExecutor = new ResilientExecutor(
            new InMemoryCircuitBreakerRegistry(),
            settings.resilience(),
            Sleeper.THREAD,
            NoOpResilienceEventListener.INSTANCE
        );
        QueryPlanner planner = new QueryPlanner(new Partitioner(settings.partitioning()));
        return new DistributedDispatcher(registry, resilientExecutor, planner, DispatcherConfig.from(settings), clusterRuntime);
    }

    @Override
    public BackendInfo backendInfo() {
        return selector.info();
    }

    public DispatcherConfig getConfig() {
        return config;
    }

    /**
     * 캐시된 Backend 를 종료합니다.
     *
     * <p>진행 중인 파티션이 끝나기를 기다립니다. 이후 stream() 호출은 IllegalStateException 입니다.</p>
     */
    @Override
    public void close() {
        selector.shutdown();
    }

    private <Q extends TimeSeriesQuery<Q>> List<RecordBatch> fetchPartition(DataFetcher<Q> fetcher, Partition<Q> partition) {
        return resilientExecutor.execute(fetcher.endpoint(), () -> {
            try (Stream<RecordBatch> batches = fetcher.fetch(partition.query())) {
                return batches.collect(Collectors.toList());
            }
        });
    }
}
