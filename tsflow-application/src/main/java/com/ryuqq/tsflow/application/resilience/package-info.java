/**
 * 재시도 및 Circuit Breaker 실행기.
 *
 * <p>{@link com.ryuqq.tsflow.application.resilience.ResilientExecutor} 는 core 의
 * {@code RetryPolicy} 와 {@code CircuitBreaker} SPI 를 조합합니다.
 * 상태를 가진 Circuit Breaker 구현체는 adapter-inmemory 모듈에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.tsflow.application.resilience;
