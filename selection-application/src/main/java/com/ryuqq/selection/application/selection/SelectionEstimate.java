package com.ryuqq.selection.application.selection;

import java.time.Instant;

/**
 * 선택 건수 추정 결과 ({@code POST /selections/{token}/estimate}).
 *
 * <p>참고용 값입니다. 계산 이후 데이터가 바뀌면 실제 실행 건수와 달라질 수 있으며,
 * 실행 결과의 attempted가 최종 값입니다. UI는 "약 N건"처럼 근사치로 표시하고
 * 주기적으로 다시 조회해야 합니다.</p>
 *
 * @param estimatedCount 추정 선택 건수
 * @param computedAt 계산 시각
 * @author Selection Team
 * @since 1.0.0
 */
public record SelectionEstimate(long estimatedCount, Instant computedAt) {

    public SelectionEstimate {
        if (estimatedCount < 0) {
            throw new IllegalArgumentException("estimatedCount cannot be negative");
        }
        if (computedAt == null) {
            throw new IllegalArgumentException("computedAt cannot be null");
        }
    }
}
