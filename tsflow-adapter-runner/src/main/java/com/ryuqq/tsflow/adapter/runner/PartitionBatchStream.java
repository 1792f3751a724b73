package com.ryuqq.tsflow.adapter.runner;

import com.ryuqq.tsflow.application.dispatcher.BatchStream;
import com.ryuqq.tsflow.application.dispatcher.DispatchSummary;
import com.ryuqq.tsflow.application.runtime.ExecutionBackend;
import com.ryuqq.tsflow.core.exception.ErrorClassifier;
import com.ryuqq.tsflow.core.exception.PartitionDispatchException;
import com.ryuqq.tsflow.core.exception.PartitionFailure;
import com.ryuqq.tsflow.core.model.RecordBatch;
import com.ryuqq.tsflow.core.model.TimeSeriesQuery;
import com.ryuqq.tsflow.core.partition.Partition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * 파티션 결과를 RecordBatch 로 풀어내는 BatchStream 의 공통 골격.
 *
 * <p>제출 순서와 대기 방식은 하위 클래스가 정하고, 이 클래스는 결과 처리를 담당합니다.</p>
 * <ul>
 *   <li>성공한 파티션의 배치를 차례로 내보냄</li>
 *   <li>실패한 파티션은 로그를 남기고 건너뜀</li>
 *   <li>모든 파티션이 실패하면 마지막에 예외 (파티션 1개면 원본 예외, 아니면 PartitionDispatchException)</li>
 * </ul>
 *
 * <p>소비는 한 스레드에서 한다고 가정합니다. close() 와 summary() 는 다른 스레드에서 호출해도 됩니다.</p>
 *
 * @param <Q> 쿼리 타입
 * @author TsFlow Team
 * @since 1.0.0
 */
abstract class PartitionBatchStream<Q extends TimeSeriesQuery<Q>> implements BatchStream {

    private static final Logger log = LoggerFactory.getLogger(PartitionBatchStream.class);

    private final ExecutionBackend backend;
    private final Function<Partition<Q>, List<RecordBatch>> partitionFetch;
    private final int totalPartitions;
    private final List<PartitionFailure> failures = new CopyOnWriteArrayList<>();
    private volatile int succeeded;
    private volatile boolean closed;
    private boolean finished;
    private Iterator<RecordBatch> current = Collections.emptyIterator();

    protected PartitionBatchStream(
        ExecutionBackend backend,
        Function<Partition<Q>, List<RecordBatch>> partitionFetch,
        int totalPartitions
    ) {
        this.backend = backend;
        this.partitionFetch = partitionFetch;
        this.totalPartitions = totalPartitions;
    }

    /**
     * 처음 제출 가능한 만큼 파티션을 제출합니다.
     */
    void start() {
        submitMore();
    }

    /**
     * 동시 실행 한도 안에서 남은 파티션을 제출합니다.
     */
    protected abstract void submitMore();

    /**
     * 아직 소비하지 않은 제출 건이 있는지.
     */
    protected abstract boolean hasPending();

    /**
     * 다음에 소비할 제출 건. 반환된 Future 는 아직 완료되지 않았을 수 있습니다.
     */
    protected abstract Pending<Q> nextPending() throws InterruptedException;

    /**
     * 진행 중인 모든 제출 건을 취소합니다.
     */
    protected abstract void cancelInFlight();

    protected final boolean isClosed() {
        return closed;
    }

    protected final Pending<Q> submit(Partition<Q> partition) {
        CompletableFuture<List<RecordBatch>> future = backend.submit(() -> partitionFetch.apply(partition));
        return new Pending<>(partition, future);
    }

    @Override
    public boolean hasNext() {
        while (!closed && !current.hasNext()) {
            if (!hasPending()) {
                finish();
                return false;
            }
            try {
                consume(nextPending());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                CancellationException cancelled = new CancellationException("Interrupted while waiting for partition results");
                cancelled.initCause(e);
                throw cancelled;
            }
            submitMore();
        }
        return !closed;
    }

    @Override
    public RecordBatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }

    @Override
    public DispatchSummary summary() {
        return new DispatchSummary(totalPartitions, succeeded, List.copyOf(failures));
    }

    /**
     * 진행 중인 파티션을 취소하고 이후 제출을 멈춥니다.
     *
     * <p>이미 내보낸 배치는 영향을 받지 않습니다.</p>
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        cancelInFlight();
        log.debug("Batch stream closed: {}", summary());
    }

    private void consume(Pending<Q> pending) throws InterruptedException {
        Partition<Q> partition = pending.partition();
        try {
            List<RecordBatch> batches = pending.future().get();
            succeeded++;
            current = batches.iterator();
            log.debug("Partition {} yielded {} batches", partition.describe(), batches.size());
        } catch (ExecutionException e) {
            recordFailure(partition, ErrorClassifier.unwrap(e));
        } catch (CancellationException e) {
            if (!closed) {
                recordFailure(partition, e);
            }
        }
    }

    private void recordFailure(Partition<Q> partition, Throwable cause) {
        PartitionFailure failure = new PartitionFailure(partition.index(), partition.timeRange(), cause);
        failures.add(failure);
        log.warn("Partition {} failed with {}, skipping: {}",
            partition.describe(), failure.kind(), cause.toString());
    }

    private void finish() {
        if (finished) {
            return;
        }
        finished = true;

        if (totalPartitions > 0 && failures.size() == totalPartitions) {
            if (totalPartitions == 1) {
                throw rethrowable(failures.get(0).cause());
            }
            throw new PartitionDispatchException(failures);
        }
        if (!failures.isEmpty()) {
            log.warn("Dispatch finished with {} of {} partitions skipped", failures.size(), totalPartitions);
        } else {
            log.debug("Dispatch finished: {} partitions", totalPartitions);
        }
    }

    private static RuntimeException rethrowable(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CompletionException(cause);
    }

    /**
     * 제출된 파티션과 그 결과 Future.
     *
     * @param partition 파티션
     * @param future 결과 Future
     * @param <Q> 쿼리 타입
     */
    protected record Pending<Q extends TimeSeriesQuery<Q>>(
        Partition<Q> partition,
        CompletableFuture<List<RecordBatch>> future
    ) {
    }
}
