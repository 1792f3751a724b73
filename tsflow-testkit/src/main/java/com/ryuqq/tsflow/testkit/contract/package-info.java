/**
 * SPI 구현체용 Contract Test.
 *
 * <p>adapter 모듈의 테스트 클래스가 상속하여 공통 시나리오를 검증합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.tsflow.testkit.contract.AbstractCircuitBreakerContractTest} - Circuit Breaker 상태 머신</li>
 *   <li>{@link com.ryuqq.tsflow.testkit.contract.AbstractExecutionBackendContractTest} - 실행 백엔드</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.tsflow.testkit.contract;
