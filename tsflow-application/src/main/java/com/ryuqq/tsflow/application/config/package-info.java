/**
 * 프로세스 설정.
 *
 * <p>{@link com.ryuqq.tsflow.application.config.FlowSettings} 는 Properties 에서
 * 재시도, Circuit Breaker, 분할, 백엔드 설정을 한 번에 읽어 불변 record 로 제공합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.tsflow.application.config;
