/**
 * 쿼리 분할 실행 진입점.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.tsflow.application.dispatcher.QueryDispatcher} - 분할 실행 인터페이스</li>
 *   <li>{@link com.ryuqq.tsflow.application.dispatcher.BatchStream} - 결과 배치 스트림</li>
 *   <li>{@link com.ryuqq.tsflow.application.dispatcher.DispatchSummary} - 파티션 성공/실패 요약</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈의 {@code DistributedDispatcher} 에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.tsflow.application.dispatcher;
