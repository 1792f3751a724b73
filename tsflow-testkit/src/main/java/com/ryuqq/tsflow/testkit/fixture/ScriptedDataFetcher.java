package com.ryuqq.tsflow.testkit.fixture;

import com.ryuqq.tsflow.core.model.RecordBatch;
import com.ryuqq.tsflow.core.model.TimeRange;
import com.ryuqq.tsflow.core.spi.DataFetcher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * 동작을 스크립트로 지정하는 BarQuery 용 DataFetcher.
 *
 * <p>기본 동작은 파티션 하나당 배치 하나를 돌려주며, 배치에는 봉 시작 시각 행이
 * 최대 {@code rowsPerBatch} 개 들어갑니다.</p>
 *
 * <pre>{@code
 * ScriptedDataFetcher fetcher = new ScriptedDataFetcher("bars")
 *     .failWhen(q -> q.timeRange().start().equals(secondStart), () -> new DataServiceException("boom"))
 *     .withLatency(Duration.ofMillis(20));
 * }</pre>
 *
 * <p>thread-safe 합니다. 호출 이력과 최대 동시 호출 수를 기록합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class ScriptedDataFetcher implements DataFetcher<BarQuery> {

    private static final int DEFAULT_ROWS_PER_BATCH = 10;

    private final String endpoint;
    private final List<Rule> rules = new CopyOnWriteArrayList<>();
    private final List<BarQuery> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();
    private volatile Duration latency = Duration.ZERO;
    private volatile int rowsPerBatch = DEFAULT_ROWS_PER_BATCH;

    public ScriptedDataFetcher(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be null or blank");
        }
        this.endpoint = endpoint;
    }

    /**
     * 조건에 맞는 쿼리는 항상 실패.
     *
     * @param condition 실패 조건
     * @param error 던질 예외 공급자
     * @return this
     */
    public ScriptedDataFetcher failWhen(Predicate<BarQuery> condition, Supplier<? extends RuntimeException> error) {
        rules.add(new Rule(condition, error, new AtomicInteger(Integer.MAX_VALUE)));
        return this;
    }

    /**
     * 조건에 맞는 쿼리는 처음 times 번만 실패.
     *
     * @param condition 실패 조건
     * @param times 실패 횟수
     * @param error 던질 예외 공급자
     * @return this
     */
    public ScriptedDataFetcher failTimes(Predicate<BarQuery> condition, int times,
                                         Supplier<? extends RuntimeException> error) {
        rules.add(new Rule(condition, error, new AtomicInteger(times)));
        return this;
    }

    /**
     * 모든 쿼리를 처음 times 번 실패.
     *
     * @param times 실패 횟수
     * @param error 던질 예외 공급자
     * @return this
     */
    public ScriptedDataFetcher failFirst(int times, Supplier<? extends RuntimeException> error) {
        return failTimes(query -> true, times, error);
    }

    /**
     * 호출마다 지연 추가.
     *
     * @param latency 지연 시간
     * @return this
     */
    public ScriptedDataFetcher withLatency(Duration latency) {
        this.latency = latency;
        return this;
    }

    public ScriptedDataFetcher withRowsPerBatch(int rowsPerBatch) {
        this.rowsPerBatch = rowsPerBatch;
        return this;
    }

    @Override
    public Stream<RecordBatch> fetch(BarQuery query) {
        calls.add(query);
        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
        try {
            pause();
            for (Rule rule : rules) {
                if (rule.condition().test(query) && rule.remaining().getAndDecrement() > 0) {
                    throw rule.error().get();
                }
            }
            return Stream.of(batchFor(query));
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    public List<BarQuery> calls() {
        return Collections.unmodifiableList(new ArrayList<>(calls));
    }

    public int callCount() {
        return calls.size();
    }

    public int peakInFlight() {
        return peakInFlight.get();
    }

    private RecordBatch batchFor(BarQuery query) {
        TimeRange range = query.timeRange();
        List<Map<String, Object>> rows = new ArrayList<>();
        Instant cursor = range.start();
        while (cursor.isBefore(range.end()) && rows.size() < rowsPerBatch) {
            rows.add(Map.of("symbol", query.symbol(), "timestamp", cursor));
            cursor = cursor.plus(query.interval());
        }
        return new RecordBatch(range, rows);
    }

    private void pause() {
        Duration wait = latency;
        if (wait.isZero()) {
            return;
        }
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Fetch interrupted", e);
        }
    }

    private record Rule(Predicate<BarQuery> condition, Supplier<? extends RuntimeException> error,
                        AtomicInteger remaining) {
    }
}
