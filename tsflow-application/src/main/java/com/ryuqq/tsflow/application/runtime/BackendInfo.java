package com.ryuqq.tsflow.application.runtime;

/**
 * 선택된 실행 백엔드 정보 (진단용).
 *
 * @param type 백엔드 종류
 * @param distributedEnabled 분산 실행 허용 여부
 * @param maxWorkers 실제 적용된 최대 동시 실행 수
 * @param clusterAvailable 클러스터 런타임 접속 가능 여부
 * @author TsFlow Team
 * @since 1.0.0
 */
public record BackendInfo(
    BackendType type,
    boolean distributedEnabled,
    int maxWorkers,
    boolean clusterAvailable
) {

    public BackendInfo {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive (current: " + maxWorkers + ")");
        }
    }
}
