package com.ryuqq.tsflow.application.registry;

import com.ryuqq.tsflow.core.model.TimeSeriesQuery;
import com.ryuqq.tsflow.core.spi.DataFetcher;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 쿼리 타입별 DataFetcher 등록 테이블.
 *
 * <p>쿼리 클래스 하나에 DataFetcher 하나를 명시적으로 등록하며, 조회는 쿼리 인스턴스의
 * 실제 클래스로 수행합니다. 같은 타입의 중복 등록은 거부합니다.</p>
 *
 * <pre>{@code
 * DataFetcherRegistry registry = new DataFetcherRegistry()
 *     .register(BarQuery.class, new BarFetcher(client))
 *     .register(TickQuery.class, new TickFetcher(client));
 * }</pre>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class DataFetcherRegistry {

    private final Map<Class<?>, DataFetcher<?>> fetchers = new ConcurrentHashMap<>();

    /**
     * DataFetcher 등록.
     *
     * @param queryType 쿼리 클래스
     * @param fetcher DataFetcher
     * @param <Q> 쿼리 타입
     * @return this (체이닝)
     * @throws IllegalArgumentException 인자가 null 인 경우
     * @throws IllegalStateException 이미 등록된 쿼리 타입인 경우
     */
    public <Q extends TimeSeriesQuery<Q>> DataFetcherRegistry register(Class<Q> queryType, DataFetcher<Q> fetcher) {
        if (queryType == null) {
            throw new IllegalArgumentException("queryType cannot be null");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        DataFetcher<?> existing = fetchers.putIfAbsent(queryType, fetcher);
        if (existing != null) {
            throw new IllegalStateException(
                "DataFetcher already registered for " + queryType.getName() + " (" + existing.endpoint() + ")");
        }
        return this;
    }

    /**
     * 쿼리 인스턴스의 클래스로 DataFetcher 조회.
     *
     * @param query 쿼리
     * @param <Q> 쿼리 타입
     * @return DataFetcher
     * @throws IllegalArgumentException 등록된 DataFetcher 가 없는 경우
     */
    public <Q extends TimeSeriesQuery<Q>> DataFetcher<Q> lookup(Q query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        DataFetcher<?> fetcher = fetchers.get(query.getClass());
        if (fetcher == null) {
            throw new IllegalArgumentException("No DataFetcher registered for " + query.getClass().getName());
        }
        return typed(fetcher);
    }

    /**
     * 쿼리 클래스로 DataFetcher 조회.
     *
     * @param queryType 쿼리 클래스
     * @param <Q> 쿼리 타입
     * @return 등록된 DataFetcher
     */
    public <Q extends TimeSeriesQuery<Q>> Optional<DataFetcher<Q>> find(Class<Q> queryType) {
        if (queryType == null) {
            return Optional.empty();
        }
        DataFetcher<?> fetcher = fetchers.get(queryType);
        if (fetcher == null) {
            return Optional.empty();
        }
        DataFetcher<Q> found = typed(fetcher);
        return Optional.of(found);
    }

    public Set<Class<?>> registeredTypes() {
        return Set.copyOf(fetchers.keySet());
    }

    // register 는 Class<Q> 키에 DataFetcher<Q> 만 넣는다
    @SuppressWarnings("unchecked")
    private static <Q extends TimeSeriesQuery<Q>> DataFetcher<Q> typed(DataFetcher<?> fetcher) {
        return (DataFetcher<Q>) fetcher;
    }
}
