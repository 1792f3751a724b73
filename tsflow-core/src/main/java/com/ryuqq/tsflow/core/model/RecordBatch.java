package com.ryuqq.tsflow.core.model;

import java.util.List;
import java.util.Map;

/**
 * 데이터 조회 결과 배치.
 *
 * <p>전송 포맷(컬럼형 배치 등)은 외부 전송 계층의 관심사이므로,
 * 여기서는 행 목록과 해당 배치가 속한 구간만 보관합니다.</p>
 *
 * @param timeRange 배치가 조회된 구간
 * @param rows 행 목록 (불변 복사본)
 * @author TsFlow Team
 * @since 1.0.0
 */
public record RecordBatch(TimeRange timeRange, List<Map<String, Object>> rows) {

    public RecordBatch {
        if (timeRange == null) {
            throw new IllegalArgumentException("timeRange cannot be null");
        }
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /**
     * 행 수.
     *
     * @return rows.size()
     */
    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
