/**
 * In-memory Circuit Breaker 구현체.
 *
 * <p>이 패키지는 core 모듈의 {@code CircuitBreaker}, {@code CircuitBreakerRegistry} SPI 를
 * 프로세스 메모리 기반으로 구현합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.tsflow.adapter.inmemory.protection.InMemoryCircuitBreaker} - 엔드포인트 하나의 상태 머신</li>
 *   <li>{@link com.ryuqq.tsflow.adapter.inmemory.protection.InMemoryCircuitBreakerRegistry} - 이름별 단일 인스턴스 보관</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.tsflow.adapter.inmemory.protection;
