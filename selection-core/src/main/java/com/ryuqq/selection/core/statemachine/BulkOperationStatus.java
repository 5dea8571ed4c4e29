package com.ryuqq.selection.core.statemachine;

/**
 * Bulk Operation의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * RUNNING
 *    │
 *    ├─► COMPLETED              (모든 레코드 성공)
 *    │
 *    ├─► COMPLETED_WITH_ERRORS  (일부 레코드 실패)
 *    │
 *    └─► ABORTED                (취소, 소프트 타임아웃, resolve 중단)
 *
 * 금지된 전이:
 * - 종료 상태 → 어떤 상태로도 ❌
 * </pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public enum BulkOperationStatus {

    /**
     * 실행 중 (부분 결과 조회 가능).
     */
    RUNNING,

    /**
     * 완료, 실패 레코드 없음.
     */
    COMPLETED,

    /**
     * 완료, 일부 레코드 실패.
     */
    COMPLETED_WITH_ERRORS,

    /**
     * 중단. 이미 적용된 Action은 롤백하지 않습니다.
     */
    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return RUNNING이 아니면 true
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
