/**
 * Runner Adapter Layer - 파티션 병렬 실행 구현체.
 *
 * <p>이 패키지는 application 의 QueryDispatcher 와 ExecutionBackend 포트를 구현합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tsflow.adapter.runner.DistributedDispatcher} - 파티션 분할, 병렬 실행, 결과 재조립</li>
 *   <li>{@link com.ryuqq.tsflow.adapter.runner.BackendSelector} - Backend 선택 및 캐시</li>
 *   <li>{@link com.ryuqq.tsflow.adapter.runner.SequentialBackend} - 호출 스레드 실행</li>
 *   <li>{@link com.ryuqq.tsflow.adapter.runner.LocalAsyncPoolBackend} - 로컬 스레드 풀</li>
 *   <li>{@link com.ryuqq.tsflow.adapter.runner.ClusterPoolBackend} - 클러스터 런타임 위임</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DistributedDispatcher, *Backend)
 *   ↓ implements
 * application (QueryDispatcher, ExecutionBackend, ResilientExecutor)
 *   ↓ depends on
 * core (Partitioner, QueryPlanner, DataFetcher, ClusterRuntime)
 * </pre>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
package com.ryuqq.tsflow.adapter.runner;
