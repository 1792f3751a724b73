package com.ryuqq.tsflow.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker 는 엔드포인트별 연속 실패 수를 추적하고,
 * 임계값 도달 시 호출을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 수 == failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과 후 첫 호출 시점)
 * HALF_OPEN (단일 probe 허용)
 *   │
 *   ├─► probe 성공 → CLOSED (실패 카운터 0)
 *   └─► probe 실패 → OPEN (recoveryTimeout 재시작)
 * </pre>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 통과하며 연속 실패 수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>recoveryTimeout 이 지나기 전까지 모든 요청을 거부합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태.
     *
     * <p>동시에 하나의 probe 요청만 통과시켜 엔드포인트 복구 여부를 확인합니다.</p>
     */
    HALF_OPEN
}
