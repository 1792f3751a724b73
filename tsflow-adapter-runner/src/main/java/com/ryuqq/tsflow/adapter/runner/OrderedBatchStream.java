package com.ryuqq.tsflow.adapter.runner;

import com.ryuqq.tsflow.application.runtime.ExecutionBackend;
import com.ryuqq.tsflow.core.model.RecordBatch;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;
import com.ryuqq.tsflow.core.partition.Partition;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Function;

/**
 * 파티션 순서대로 배치를 내보내는 스트림.
 *
 * <p>최대 lookAhead 개의 파티션만 동시에 제출해 두고, 가장 앞선 파티션이 끝나기를 기다립니다.
 * 뒤 파티션이 먼저 끝나도 앞 파티션이 소비될 때까지 결과를 보관하므로
 * 메모리에 남는 결과는 lookAhead 개를 넘지 않습니다.</p>
 *
 * @param <Q> 쿼리 타입
 * @author TsFlow Team
 * @since 1.0.0
 */
final class OrderedBatchStream<Q extends TimeSeriesQuery<Q>> extends PartitionBatchStream<Q> {

    private final List<Partition<Q>> partitions;
    private final int lookAhead;
    private final Deque<Pending<Q>> window = new ConcurrentLinkedDeque<>();
    private int nextToSubmit;

    OrderedBatchStream(
        ExecutionBackend backend,
        Function<Partition<Q>, List<RecordBatch>> partitionFetch,
        List<Partition<Q>> partitions,
        int lookAhead
    ) {
        super(backend, partitionFetch, partitions.size());
        if (lookAhead <= 0) {
            throw new IllegalArgumentException("lookAhead must be positive (current: " + lookAhead + ")");
        }
        this.partitions = List.copyOf(partitions);
        this.lookAhead = lookAhead;
    }

    @Override
    protected void submitMore() {
        while (!isClosed() && window.size() < lookAhead && nextToSubmit < partitions.size()) {
            window.addLast(submit(partitions.get(nextToSubmit++)));
        }
    }

    @Override
    protected boolean hasPending() {
        return !window.isEmpty();
    }

    @Override
    protected Pending<Q> nextPending() {
        return window.pollFirst();
    }

    @Override
    protected void cancelInFlight() {
        window.forEach(pending -> pending.future().cancel(true));
    }
}
