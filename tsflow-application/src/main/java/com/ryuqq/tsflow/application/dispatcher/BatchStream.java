package com.ryuqq.tsflow.application.dispatcher;

import com.ryuqq.tsflow.core.model.RecordBatch;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 분할 실행 결과 배치 스트림.
 *
 * <p>파티션 결과를 소비자가 당겨가는 만큼 생산하는 Iterator 입니다.
 * 소비를 중단하려면 {@link #close()} 를 호출하며, 진행 중인 파티션 작업은 취소되고
 * 이미 받은 배치는 그대로 유효합니다.</p>
 *
 * <pre>{@code
 * try (BatchStream batches = dispatcher.stream(query, OptimizationHint.forAnalytics())) {
 *     while (batches.hasNext()) {
 *         sink.write(batches.next());
 *     }
 *     log.info("skipped partitions: {}", batches.summary().skipped());
 * }
 * }</pre>
 *
 * <p>thread-safe 하지 않습니다. 하나의 소비자 스레드에서 사용하십시오.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public interface BatchStream extends Iterator<RecordBatch>, AutoCloseable {

    /**
     * 현재까지의 실행 요약.
     *
     * @return DispatchSummary
     */
    DispatchSummary summary();

    /**
     * 남은 파티션 작업 취소 및 자원 해제.
     *
     * <p>여러 번 호출해도 안전합니다.</p>
     */
    @Override
    void close();

    /**
     * java.util.stream.Stream 으로 변환.
     *
     * <p>반환된 Stream 을 close 하면 이 BatchStream 도 close 됩니다.</p>
     *
     * @return 순차 Stream
     */
    default Stream<RecordBatch> toStream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(this::close);
    }
}
