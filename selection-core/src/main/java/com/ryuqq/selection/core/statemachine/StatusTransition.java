package com.ryuqq.selection.core.statemachine;

/**
 * Bulk Operation 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>RUNNING → RUNNING (진행 상황 갱신)</li>
 *   <li>RUNNING → COMPLETED</li>
 *   <li>RUNNING → COMPLETED_WITH_ERRORS</li>
 *   <li>RUNNING → ABORTED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태의 결과는 다시 쓰지 않습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 종료 상태에서 전이를 시도한 경우
     */
    public static void validate(BulkOperationStatus from, BulkOperationStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return next
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static BulkOperationStatus transition(BulkOperationStatus current, BulkOperationStatus next) {
        validate(current, next);
        return next;
    }
}
