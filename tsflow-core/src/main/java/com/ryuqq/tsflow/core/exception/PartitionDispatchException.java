package com.ryuqq.tsflow.core.exception;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 모든 파티션이 실패하여 쿼리가 데이터를 하나도 만들지 못한 경우.
 *
 * <p>파티션별 실패 원인을 집계하며, 첫 번째 실패를 cause 로 연결하고
 * 나머지는 suppressed 로 추가합니다.</p>
 *
 * @author TsFlow Team
 * @since 1.0.0
 */
public class PartitionDispatchException extends DataTransferException {

    private final List<PartitionFailure> failures;

    public PartitionDispatchException(List<PartitionFailure> failures) {
        super(buildMessage(failures), firstCause(failures), Map.of("failedPartitions", failures.size()));
        this.failures = List.copyOf(failures);
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i).cause());
        }
    }

    public List<PartitionFailure> getFailures() {
        return failures;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PARTITION_DISPATCH;
    }

    private static String buildMessage(List<PartitionFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        String summary = failures.stream()
            .map(f -> "#" + f.partitionIndex() + " " + f.timeRange() + " " + f.kind())
            .collect(Collectors.joining(", "));
        return "All " + failures.size() + " partitions failed: " + summary;
    }

    private static Throwable firstCause(List<PartitionFailure> failures) {
        return failures == null || failures.isEmpty() ? null : failures.get(0).cause();
    }
}
