package com.ryuqq.tsflow.core.protection;

import java.util.Optional;

/**
 * 엔드포인트별 Circuit Breaker 저장소 SPI.
 *
 * <p>같은 이름에 대해서는 항상 같은 인스턴스를 돌려주어,
 * 동일 엔드포인트를 향한 모든 동시 호출이 하나의 상태를 공유하도록 합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public interface CircuitBreakerRegistry {

    /**
     * 이름으로 Circuit Breaker 를 조회하고, 없으면 주어진 설정으로 생성.
     *
     * <p>이미 존재하면 config 는 무시됩니다.</p>
     *
     * @param name 엔드포인트 이름
     * @param config 신규 생성 시 사용할 설정
     * @return Circuit Breaker
     */
    CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config);

    /**
     * 이름으로 Circuit Breaker 조회.
     *
     * @param name 엔드포인트 이름
     * @return 등록된 Circuit Breaker
     */
    Optional<CircuitBreaker> find(String name);
}
