package com.ryuqq.tsflow.core.exception;

import com.ryuqq.tsflow.core.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 예외 분류 테스트.
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
@DisplayName("ErrorClassifier 및 예외 계층 테스트")
class ErrorClassifierTest {

    @Test
    @DisplayName("DataTransferException 은 자신의 kind 로 분류된다")
    void classify_도메인_예외() {
        assertEquals(ErrorKind.CONNECTION, ErrorClassifier.classify(new DataConnectionException("x")));
        assertEquals(ErrorKind.DATA_SERVICE, ErrorClassifier.classify(new DataServiceException("x")));
        assertEquals(ErrorKind.SERVER, ErrorClassifier.classify(new ServerException("x")));
        assertEquals(ErrorKind.AUTHENTICATION, ErrorClassifier.classify(new AuthenticationException("x")));
    }

    @Test
    @DisplayName("외부 예외: 타임아웃 계열은 TIMEOUT, 나머지 IOException 은 CONNECTION")
    void classify_외부_예외() {
        assertEquals(ErrorKind.TIMEOUT, ErrorClassifier.classify(new SocketTimeoutException("read")));
        assertEquals(ErrorKind.TIMEOUT, ErrorClassifier.classify(new TimeoutException("future")));
        assertEquals(ErrorKind.CONNECTION, ErrorClassifier.classify(new ConnectException("refused")));
        assertEquals(ErrorKind.CONNECTION, ErrorClassifier.classify(new IOException("reset")));
        assertEquals(ErrorKind.UNKNOWN, ErrorClassifier.classify(new IllegalStateException("bug")));
        assertEquals(ErrorKind.UNKNOWN, ErrorClassifier.classify(null));
    }

    @Test
    @DisplayName("CompletionException / ExecutionException 은 벗겨서 분류한다")
    void classify_래퍼_해제() {
        Throwable wrapped = new CompletionException(new ExecutionException(new DataTimeoutException("slow")));

        assertEquals(ErrorKind.TIMEOUT, ErrorClassifier.classify(wrapped));
        assertInstanceOf(DataTimeoutException.class, ErrorClassifier.unwrap(wrapped));
    }

    @Test
    @DisplayName("원인 체인의 인터럽트와 취소는 취소로, 소켓 타임아웃은 취소가 아닌 것으로 판별한다")
    void isCancellation_판별() {
        assertTrue(ErrorClassifier.isCancellation(new CancellationException("closed")));
        assertTrue(ErrorClassifier.isCancellation(new IllegalStateException("fetch", new InterruptedException())));
        assertTrue(ErrorClassifier.isCancellation(new UncheckedIOException(new InterruptedIOException("read"))));
        assertTrue(ErrorClassifier.isCancellation(new CompletionException(new ClosedByInterruptException())));

        assertFalse(ErrorClassifier.isCancellation(new SocketTimeoutException("read")));
        assertFalse(ErrorClassifier.isCancellation(new DataTimeoutException("slow")));
        assertFalse(ErrorClassifier.isCancellation(null));
    }

    @Test
    @DisplayName("details 는 복사되어 불변이다")
    void details_불변() {
        Map<String, Object> details = new HashMap<>();
        details.put("endpoint", "bars");

        DataTransferException exception = new DataServiceException("boom", null, details);
        details.put("later", 1);

        assertEquals(Map.of("endpoint", "bars"), exception.getDetails());
        assertThrows(UnsupportedOperationException.class, () -> exception.getDetails().put("x", 1));
    }

    @Test
    @DisplayName("RetryExhaustedException 은 시도 횟수와 마지막 오류를 담는다")
    void retryExhausted_정보() {
        DataTimeoutException last = new DataTimeoutException("slow");

        RetryExhaustedException exception = new RetryExhaustedException("gave up", 3, last);

        assertEquals(3, exception.getAttemptCount());
        assertSame(last, exception.getLastError());
        assertFalse(exception.isRetryable());
    }

    @Test
    @DisplayName("PartitionDispatchException 은 첫 실패를 cause, 나머지를 suppressed 로 둔다")
    void partitionDispatch_집계() {
        TimeRange range = TimeRange.of(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T01:00:00Z"));
        DataTimeoutException first = new DataTimeoutException("p0");
        DataConnectionException second = new DataConnectionException("p1");

        PartitionDispatchException exception = new PartitionDispatchException(List.of(
            new PartitionFailure(0, range, first),
            new PartitionFailure(1, range, second)
        ));

        assertSame(first, exception.getCause());
        assertArrayEquals(new Throwable[]{second}, exception.getSuppressed());
        assertEquals(2, exception.getFailures().size());
        assertEquals(ErrorKind.TIMEOUT, exception.getFailures().get(0).kind());
        assertTrue(exception.getMessage().contains("All 2 partitions failed"));
    }

    @Test
    @DisplayName("CircuitOpenException 은 재시도 불가이며 대기 시간을 담는다")
    void circuitOpen_정보() {
        CircuitOpenException exception = new CircuitOpenException("bars", Duration.ofSeconds(30));

        assertEquals("bars", exception.getCircuitName());
        assertEquals(Duration.ofSeconds(30), exception.getRetryAfter());
        assertFalse(exception.isRetryable());
    }
}
