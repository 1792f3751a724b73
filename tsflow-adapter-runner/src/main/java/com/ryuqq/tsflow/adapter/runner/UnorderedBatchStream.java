package com.ryuqq.tsflow.adapter.runner;

import com.ryuqq.tsflow.application.runtime.ExecutionBackend;
import com.ryuqq.tsflow.core.model.RecordBatch;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;
import com.ryuqq.tsflow.core.partition.Partition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Function;

/**
 * 완료된 순서대로 배치를 내보내는 스트림.
 *
 * <p>newestFirst 가 true 면 가장 최근 구간의 파티션부터 제출합니다.
 * 동시에 제출해 두는 파티션 수는 lookAhead 로 제한됩니다.</p>
 *
 * @param <Q> 쿼리 타입
 * @author TsFlow Team
 * @since 1.0.0
 */
final class UnorderedBatchStream<Q extends TimeSeriesQuery<Q>> extends PartitionBatchStream<Q> {

    private final List<Partition<Q>> submissionOrder;
    private final int lookAhead;
    private final Set<Pending<Q>> running = ConcurrentHashMap.newKeySet();
    private final BlockingQueue<Pending<Q>> completed = new LinkedBlockingQueue<>();
    private int nextToSubmit;

    UnorderedBatchStream(
        ExecutionBackend backend,
        Function<Partition<Q>, List<RecordBatch>> partitionFetch,
        List<Partition<Q>> partitions,
        int lookAhead,
        boolean newestFirst
    ) {
        super(backend, partitionFetch, partitions.size());
        if (lookAhead <= 0) {
            throw new IllegalArgumentException("lookAhead must be positive (current: " + lookAhead + ")");
        }
        List<Partition<Q>> order = new ArrayList<>(partitions);
        if (newestFirst) {
            Collections.reverse(order);
        }
        this.submissionOrder = order;
        this.lookAhead = lookAhead;
    }

    @Override
    protected void submitMore() {
        while (!isClosed() && running.size() < lookAhead && nextToSubmit < submissionOrder.size()) {
            Pending<Q> pending = submit(submissionOrder.get(nextToSubmit++));
            running.add(pending);
            pending.future().whenComplete((batches, error) -> completed.add(pending));
        }
    }

    @Override
    protected boolean hasPending() {
        return !running.isEmpty();
    }

    @Override
    protected Pending<Q> nextPending() throws InterruptedException {
        Pending<Q> pending = completed.take();
        running.remove(pending);
        return pending;
    }

    @Override
    protected void cancelInFlight() {
        running.forEach(pending -> pending.future().cancel(true));
    }
}
