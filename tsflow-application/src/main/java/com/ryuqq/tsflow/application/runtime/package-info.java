/**
 * 파티션 실행 백엔드 포트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.tsflow.application.runtime.ExecutionBackend} - 작업 제출 인터페이스</li>
 *   <li>{@link com.ryuqq.tsflow.application.runtime.BackendType} - 백엔드 종류</li>
 *   <li>{@link com.ryuqq.tsflow.application.runtime.BackendInfo} - 선택 결과 진단 정보</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code SequentialBackend}, {@code LocalAsyncPoolBackend},
 * {@code ClusterPoolBackend} 에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.tsflow.application.runtime;
