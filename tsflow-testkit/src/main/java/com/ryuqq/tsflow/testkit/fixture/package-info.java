/**
 * 테스트 픽스처.
 *
 * <p>BarQuery 쿼리, 동작을 스크립트로 지정하는 DataFetcher, 시간을 직접 움직이는 Clock,
 * 스레드 풀 기반 ClusterRuntime, 이벤트 기록 리스너를 제공합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.tsflow.testkit.fixture;
