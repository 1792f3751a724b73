package com.ryuqq.tsflow.adapter.runner;

import com.ryuqq.tsflow.application.config.FlowSettings;

/**
 * DistributedDispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enableDistributed: false 면 항상 Sequential Backend (기본 true)</li>
 *   <li>maxWorkers: 동시 실행 상한, 0 이면 자동 (클러스터 노드 수 또는 CPU 수)</li>
 *   <li>preserveOrder: true 면 파티션 순서대로, false 면 완료 순서대로 배치를 내보냄 (기본 true)</li>
 * </ul>
 *
 * @author TsFlow Team
 * @since 1.0.0
 * @param enableDistributed 분산 실행 활성화 여부
 * @param maxWorkers 동시 실행 상한 (0 = 자동)
 * @param preserveOrder 파티션 순서 보존 여부
 */
public record DispatcherConfig(
    boolean enableDistributed,
    int maxWorkers,
    boolean preserveOrder
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: enableDistributed=true, maxWorkers=0 (자동), preserveOrder=true</p>
     */
    public DispatcherConfig() {
        this(true, 0, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException maxWorkers 가 음수인 경우
     */
    public DispatcherConfig {
        if (maxWorkers < 0) {
            throw new IllegalArgumentException(
                "maxWorkers must be non-negative (current: " + maxWorkers + ")"
            );
        }
    }

    /**
     * 프로세스 설정에서 Dispatcher 관련 항목만 추출.
     *
     * @param settings 프로세스 설정
     * @return DispatcherConfig
     */
    public static DispatcherConfig from(FlowSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        return new DispatcherConfig(settings.enableDistributed(), settings.maxWorkers(), settings.preserveOrder());
    }

    public boolean isAutoMaxWorkers() {
        return maxWorkers == 0;
    }

    public DispatcherConfig withEnableDistributed(boolean enableDistributed) {
        return new DispatcherConfig(enableDistributed, maxWorkers, preserveOrder);
    }

    public DispatcherConfig withMaxWorkers(int maxWorkers) {
        return new DispatcherConfig(enableDistributed, maxWorkers, preserveOrder);
    }

    public DispatcherConfig withPreserveOrder(boolean preserveOrder) {
        return new DispatcherConfig(enableDistributed, maxWorkers, preserveOrder);
    }
}
