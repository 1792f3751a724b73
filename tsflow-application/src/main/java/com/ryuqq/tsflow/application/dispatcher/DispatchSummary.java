package com.ryuqq.tsflow.application.dispatcher;

import com.ryuqq.tsflow.core.exception.PartitionFailure;

import java.util.List;

/**
 * 분할 실행 결과 요약.
 *
 * <p>스트림을 끝까지 소비하기 전에 조회하면 그 시점까지의 진행 상황입니다.</p>
 *
 * @param totalPartitions 전체 파티션 수
 * @param succeeded 결과를 내보낸 파티션 수
 * @param failures 실패하여 건너뛴 파티션 목록
 * @author TsFlow Team
 * @since 1.0.0
 */
public record DispatchSummary(int totalPartitions, int succeeded, List<PartitionFailure> failures) {

    public DispatchSummary {
        if (totalPartitions < 0) {
            throw new IllegalArgumentException("totalPartitions must be non-negative (current: " + totalPartitions + ")");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
        if (succeeded < 0 || succeeded + failures.size() > totalPartitions) {
            throw new IllegalArgumentException(
                "succeeded + skipped must not exceed totalPartitions (succeeded: " + succeeded
                    + ", skipped: " + failures.size() + ", total: " + totalPartitions + ")");
        }
    }

    /**
     * 실패하여 건너뛴 파티션 수.
     *
     * @return skipped
     */
    public int skipped() {
        return failures.size();
    }

    /**
     * 아직 결과가 확정되지 않은 파티션 수.
     *
     * @return pending
     */
    public int pending() {
        return totalPartitions - succeeded - skipped();
    }

    public boolean isComplete() {
        return pending() == 0;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
