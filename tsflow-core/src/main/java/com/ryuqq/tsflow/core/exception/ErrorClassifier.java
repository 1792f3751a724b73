package com.ryuqq.tsflow.core.exception;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 임의의 Throwable 을 {@link ErrorKind} 로 분류.
 *
 * <p>데이터 조회 구현체가 TsFlow 예외 계층이 아닌 JDK 예외를 던지는 경우에도
 * 재시도/Circuit Breaker 정책을 일관되게 적용하기 위해 사용합니다.</p>
 *
 * <ul>
 *   <li>{@link DataTransferException}: 자신의 kind()</li>
 *   <li>SocketTimeoutException, InterruptedIOException, TimeoutException: TIMEOUT</li>
 *   <li>그 외 IOException: CONNECTION</li>
 *   <li>CompletionException, ExecutionException, UncheckedIOException: 원인으로 재분류</li>
 *   <li>그 외: UNKNOWN (재시도 불가)</li>
 * </ul>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private ErrorClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 오류 종류 분류.
     *
     * @param error 분류할 예외 (null 이면 UNKNOWN)
     * @return ErrorKind
     */
    public static ErrorKind classify(Throwable error) {
        Throwable target = unwrap(error);
        if (target instanceof DataTransferException dte) {
            return dte.kind();
        }
        if (target instanceof SocketTimeoutException
            || target instanceof InterruptedIOException
            || target instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (target instanceof IOException) {
            return ErrorKind.CONNECTION;
        }
        return ErrorKind.UNKNOWN;
    }

    /**
     * 호출자 취소로 인한 실패인지 확인.
     *
     * <p>원인 체인에 CancellationException, InterruptedException, ClosedByInterruptException 또는
     * SocketTimeoutException 이 아닌 InterruptedIOException 이 있으면 취소로 봅니다.
     * 취소는 엔드포인트 장애가 아니므로 Circuit Breaker 실패로 집계하지 않습니다.</p>
     *
     * @param error 예외 (null 이면 false)
     * @return true: 취소
     */
    public static boolean isCancellation(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof CancellationException
                || current instanceof InterruptedException
                || current instanceof ClosedByInterruptException
                || (current instanceof InterruptedIOException && !(current instanceof SocketTimeoutException))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * CompletionException / ExecutionException / UncheckedIOException 래핑 해제.
     *
     * @param error 예외
     * @return 가장 안쪽의 실제 원인 (래퍼가 아니면 그대로)
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
            || current instanceof ExecutionException
            || current instanceof UncheckedIOException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
