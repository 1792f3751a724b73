package com.ryuqq.tsflow.application.config;

import com.ryuqq.tsflow.core.partition.PartitioningConfig;
import com.ryuqq.tsflow.core.protection.CircuitBreakerConfig;
import com.ryuqq.tsflow.core.protection.ResilienceConfig;
import com.ryuqq.tsflow.core.protection.RetryConfig;
import com.ryuqq.tsflow.core.protection.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Properties;

/**
 * 프로세스 전체 설정.
 *
 * <p>프로세스 시작 시 한 번 만들어 각 컴포넌트 생성자에 전달합니다. 전역 가변 기본값은 없습니다.</p>
 *
 * <p><strong>인식하는 키 (모두 선택):</strong></p>
 * <pre>
 * enable_distributed              true | false                 (기본 true)
 * max_workers                     0 이상 정수, 0 = 자동         (기본 0)
 * preserve_order                  true | false                 (기본 true)
 * retry.max_attempts              1 이상 정수                   (기본 3)
 * retry.strategy                  fixed | linear_backoff | exponential_backoff | exponential_backoff_jitter
 * retry.base_delay                Duration                     (기본 1s)
 * retry.max_delay                 Duration                     (기본 16s)
 * circuit.failure_threshold       1 이상 정수                   (기본 5)
 * circuit.recovery_timeout        Duration                     (기본 30s)
 * partition.threshold             Duration                     (기본 1h)
 * partition.realtime_window       Duration                     (기본 15m)
 * partition.default_target_points 1 이상 정수                   (기본 10000)
 * </pre>
 *
 * <p>Duration 은 ISO-8601 (PT15M) 또는 초 단위 숫자 (30, 0.5) 로 지정합니다.</p>
 *
 * @param enableDistributed 분산(병렬) 실행 허용 여부
 * @param maxWorkers 최대 동시 실행 수 (0 = 자동)
 * @param preserveOrder 결과를 파티션 순서대로 내보낼지 여부
 * @param resilience 재시도/Circuit Breaker 설정
 * @param partitioning 분할 기준값
 * @author TsFlow Team
 * @since 1.0.0
 */
public record FlowSettings(
    boolean enableDistributed,
    int maxWorkers,
    boolean preserveOrder,
    ResilienceConfig resilience,
    PartitioningConfig partitioning
) {

    public static final String ENABLE_DISTRIBUTED = "enable_distributed";
    public static final String MAX_WORKERS = "max_workers";
    public static final String PRESERVE_ORDER = "preserve_order";
    public static final String RETRY_MAX_ATTEMPTS = "retry.max_attempts";
    public static final String RETRY_STRATEGY = "retry.strategy";
    public static final String RETRY_BASE_DELAY = "retry.base_delay";
    public static final String RETRY_MAX_DELAY = "retry.max_delay";
    public static final String CIRCUIT_FAILURE_THRESHOLD = "circuit.failure_threshold";
    public static final String CIRCUIT_RECOVERY_TIMEOUT = "circuit.recovery_timeout";
    public static final String PARTITION_THRESHOLD = "partition.threshold";
    public static final String PARTITION_REALTIME_WINDOW = "partition.realtime_window";
    public static final String PARTITION_DEFAULT_TARGET_POINTS = "partition.default_target_points";

    private static final Logger log = LoggerFactory.getLogger(FlowSettings.class);

    public FlowSettings {
        if (maxWorkers < 0) {
            throw new IllegalArgumentException("maxWorkers must be non-negative (current: " + maxWorkers + ")");
        }
        if (resilience == null) {
            throw new IllegalArgumentException("resilience cannot be null");
        }
        if (partitioning == null) {
            throw new IllegalArgumentException("partitioning cannot be null");
        }
    }

    public static FlowSettings defaults() {
        return new FlowSettings(true, 0, true, ResilienceConfig.defaults(), PartitioningConfig.defaults());
    }

    /**
     * Properties 로부터 설정 생성.
     *
     * <p>지정되지 않은 키는 기본값을 사용합니다.</p>
     *
     * @param properties 설정 값
     * @return FlowSettings
     * @throws IllegalArgumentException 값의 형식이 잘못되었거나 범위를 벗어난 경우
     */
    public static FlowSettings fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }

        RetryConfig retryDefaults = RetryConfig.defaults();
        RetryConfig retry = new RetryConfig(
            intValue(properties, RETRY_MAX_ATTEMPTS, retryDefaults.maxAttempts()),
            strategyValue(properties, RETRY_STRATEGY, retryDefaults.strategy()),
            durationValue(properties, RETRY_BASE_DELAY, retryDefaults.baseDelay()),
            durationValue(properties, RETRY_MAX_DELAY, retryDefaults.maxDelay())
        );

        CircuitBreakerConfig circuitDefaults = CircuitBreakerConfig.defaults();
        CircuitBreakerConfig circuit = new CircuitBreakerConfig(
            intValue(properties, CIRCUIT_FAILURE_THRESHOLD, circuitDefaults.failureThreshold()),
            durationValue(properties, CIRCUIT_RECOVERY_TIMEOUT, circuitDefaults.recoveryTimeout())
        );

        PartitioningConfig partitionDefaults = PartitioningConfig.defaults();
        PartitioningConfig partitioning = new PartitioningConfig(
            durationValue(properties, PARTITION_THRESHOLD, partitionDefaults.threshold()),
            durationValue(properties, PARTITION_REALTIME_WINDOW, partitionDefaults.realTimeWindow()),
            longValue(properties, PARTITION_DEFAULT_TARGET_POINTS, partitionDefaults.defaultTargetPoints())
        );

        FlowSettings settings = new FlowSettings(
            booleanValue(properties, ENABLE_DISTRIBUTED, true),
            intValue(properties, MAX_WORKERS, 0),
            booleanValue(properties, PRESERVE_ORDER, true),
            new ResilienceConfig(retry, circuit, true),
            partitioning
        );
        log.debug("FlowSettings loaded: {}", settings);
        return settings;
    }

    public FlowSettings withEnableDistributed(boolean enableDistributed) {
        return new FlowSettings(enableDistributed, maxWorkers, preserveOrder, resilience, partitioning);
    }

    public FlowSettings withMaxWorkers(int maxWorkers) {
        return new FlowSettings(enableDistributed, maxWorkers, preserveOrder, resilience, partitioning);
    }

    public FlowSettings withPreserveOrder(boolean preserveOrder) {
        return new FlowSettings(enableDistributed, maxWorkers, preserveOrder, resilience, partitioning);
    }

    public FlowSettings withResilience(ResilienceConfig resilience) {
        return new FlowSettings(enableDistributed, maxWorkers, preserveOrder, resilience, partitioning);
    }

    public FlowSettings withPartitioning(PartitioningConfig partitioning) {
        return new FlowSettings(enableDistributed, maxWorkers, preserveOrder, resilience, partitioning);
    }

    private static String raw(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean booleanValue(Properties properties, String key, boolean defaultValue) {
        String value = raw(properties, key);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false (current: " + value + ")");
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String value = raw(properties, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String value = raw(properties, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static RetryStrategy strategyValue(Properties properties, String key, RetryStrategy defaultValue) {
        String value = raw(properties, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return RetryStrategy.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                key + " must be one of " + Arrays.toString(RetryStrategy.values()) + " (current: " + value + ")", e);
        }
    }

    static Duration durationValue(Properties properties, String key, Duration defaultValue) {
        String value = raw(properties, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (Character.isDigit(value.charAt(0)) || value.charAt(0) == '.') {
                BigDecimal seconds = new BigDecimal(value);
                return Duration.ofNanos(seconds.movePointRight(9).longValueExact());
            }
            return Duration.parse(value);
        } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
            throw new IllegalArgumentException(
                key + " must be an ISO-8601 duration or seconds (current: " + value + ")", e);
        }
    }
}
