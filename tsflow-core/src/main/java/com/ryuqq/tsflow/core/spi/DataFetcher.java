package com.ryuqq.tsflow.core.spi;

import com.ryuqq.tsflow.core.model.RecordBatch;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;

import java.util.stream.Stream;

/**
 * 데이터 소스 조회 SPI.
 *
 * <p>하나의 쿼리 타입에 대한 배치 스트림을 제공합니다.
 * 분할된 파티션마다 한 번씩 호출되므로 구현체는 thread-safe 해야 합니다.</p>
 *
 * <p>실패는 {@link com.ryuqq.tsflow.core.exception.DataTransferException} 하위 타입으로
 * 던지는 것을 권장합니다. 그 외 예외는 ErrorClassifier 규칙으로 분류됩니다.</p>
 *
 * @param <Q> 쿼리 타입
 * @author TsFlow Team
 * @since 1.0.0
 */
public interface DataFetcher<Q extends TimeSeriesQuery<Q>> {

    /**
     * 쿼리 구간의 배치 스트림 조회.
     *
     * @param query 쿼리
     * @return 시간순 배치 스트림
     */
    Stream<RecordBatch> fetch(Q query);

    /**
     * 논리적 엔드포인트 이름.
     *
     * <p>Circuit Breaker 는 이 이름 단위로 공유됩니다.</p>
     *
     * @return 엔드포인트 이름 (기본값: 구현 클래스 이름)
     */
    default String endpoint() {
        return getClass().getName();
    }
}
