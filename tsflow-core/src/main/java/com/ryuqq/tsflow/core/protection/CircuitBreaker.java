package com.ryuqq.tsflow.core.protection;

/**
 * Circuit Breaker SPI.
 *
 * <p>논리적 엔드포인트(대상 주소 또는 서비스 이름) 하나를 보호합니다.
 * 연속 실패가 임계값에 도달하면 빠르게 실패(Fail-Fast)하여
 * 장애가 호출자 전체로 전파되는 것을 막습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.getOrCreate("bars-endpoint", CircuitBreakerConfig.defaults());
 *
 * if (!cb.tryAcquire()) {
 *     throw new CircuitOpenException(cb.name(), cb.getConfig().recoveryTimeout());
 * }
 *
 * try {
 *     List<RecordBatch> batches = fetcher.fetch(query).toList();
 *     cb.recordSuccess();
 *     return batches;
 * } catch (RuntimeException e) {
 *     cb.recordFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * <p>구현체는 thread-safe 해야 하며, 상태 전이는 원자적으로 수행되어야 합니다.
 * 호출자는 상태를 직접 변경하지 않고 record 계열 메서드로만 보고합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름 (보호 대상 엔드포인트 식별자).
     *
     * @return 이름
     */
    String name();

    /**
     * 호출 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: recoveryTimeout 미경과 시 false, 경과 시 HALF_OPEN 전이 후 probe 로 true</li>
     *   <li>HALF_OPEN: 진행 중인 probe 가 없을 때만 true</li>
     * </ul>
     *
     * <p>true 를 받은 호출자는 반드시 {@link #recordSuccess()}, {@link #recordFailure(Throwable)},
     * {@link #releasePermit()} 중 하나를 호출해야 합니다.</p>
     *
     * @return true: 통과, false: 차단
     */
    boolean tryAcquire();

    /**
     * 호출 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 리셋</li>
     *   <li>HALF_OPEN: CLOSED 로 전이</li>
     * </ul>
     */
    void recordSuccess();

    /**
     * 호출 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 수 증가, 임계값 도달 시 OPEN 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN 전이</li>
     * </ul>
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 결과를 집계하지 않고 허용만 반납.
     *
     * <p>호출자가 작업을 취소한 경우처럼 엔드포인트 상태와 무관하게 끝난 호출에 사용합니다.
     * 연속 실패 카운터는 바뀌지 않습니다.</p>
     *
     * <ul>
     *   <li>CLOSED, OPEN: 변화 없음</li>
     *   <li>HALF_OPEN: probe 슬롯 반납 (다음 호출이 probe 가 됨)</li>
     * </ul>
     */
    void releasePermit();

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 설정 조회.
     *
     * @return Circuit Breaker 설정
     */
    CircuitBreakerConfig getConfig();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용합니다.</p>
     */
    void reset();
}
