package com.ryuqq.tsflow.application.runtime;

/**
 * 파티션 실행 백엔드 종류.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public enum BackendType {

    /** 호출자 스레드에서 한 번에 하나씩 실행. */
    SEQUENTIAL,

    /** 프로세스 내 고정 크기 스레드 풀. */
    LOCAL_ASYNC_POOL,

    /** 원격 클러스터 런타임. */
    CLUSTER_POOL
}
