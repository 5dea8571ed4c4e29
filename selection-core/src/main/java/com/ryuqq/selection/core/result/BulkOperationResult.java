package com.ryuqq.selection.core.result;

import com.ryuqq.selection.core.model.ResultId;
import com.ryuqq.selection.core.statemachine.BulkOperationStatus;

import java.time.Instant;
import java.util.List;

/**
 * Bulk Operation 결과 (불변 스냅샷).
 *
 * <p>실행 중에는 RUNNING 스냅샷이 주기적으로 발행되고, 종료 시 최종 스냅샷이 확정됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>succeeded + failed == attempted</li>
 *   <li>failures.size() ≤ failed (목록은 상한이 있지만 건수는 정확함)</li>
 *   <li>abortReason은 status가 ABORTED일 때만 non-null</li>
 *   <li>finishedAt은 종료 상태일 때만 non-null</li>
 * </ul>
 *
 * <p>attempted는 resolve된 집합보다 작을 수 있습니다. 동시에 삭제된 레코드는
 * resolve 결과에서 빠지며 이는 오류가 아닙니다.</p>
 *
 * @param resultId 결과 ID
 * @param actionKind Action 종류 (예: "reply")
 * @param status 상태
 * @param abortReason 중단 사유 (ABORTED가 아니면 null)
 * @param attempted 시도한 레코드 수
 * @param succeeded 성공 수
 * @param failed 실패 수
 * @param failures 실패 레코드 목록 (상한 적용)
 * @param startedAt 시작 시각
 * @param finishedAt 종료 시각 (실행 중이면 null)
 * @author Selection Team
 * @since 1.0.0
 */
public record BulkOperationResult(
    ResultId resultId,
    String actionKind,
    BulkOperationStatus status,
    AbortReason abortReason,
    long attempted,
    long succeeded,
    long failed,
    List<FailedRecord> failures,
    Instant startedAt,
    Instant finishedAt
) {

    public BulkOperationResult {
        if (resultId == null) {
            throw new IllegalArgumentException("resultId cannot be null");
        }
        if (actionKind == null || actionKind.isBlank()) {
            throw new IllegalArgumentException("actionKind cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        if (failures == null) {
            throw new IllegalArgumentException("failures cannot be null");
        }
        if (attempted < 0 || succeeded < 0 || failed < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
        if (succeeded + failed != attempted) {
            throw new IllegalArgumentException(String.format(
                "succeeded (%d) + failed (%d) must equal attempted (%d)", succeeded, failed, attempted));
        }
        if (failures.size() > failed) {
            throw new IllegalArgumentException("failures list cannot exceed failed count");
        }
        if ((status == BulkOperationStatus.ABORTED) != (abortReason != null)) {
            throw new IllegalArgumentException("abortReason must be set if and only if status is ABORTED");
        }
        if (status.isTerminal() != (finishedAt != null)) {
            throw new IllegalArgumentException("finishedAt must be set if and only if status is terminal");
        }
        failures = List.copyOf(failures);
    }

    /**
     * 실행 시작 시점의 빈 결과.
     *
     * @param resultId 결과 ID
     * @param actionKind Action 종류
     * @param startedAt 시작 시각
     * @return RUNNING, 모든 건수 0
     */
    public static BulkOperationResult started(ResultId resultId, String actionKind, Instant startedAt) {
        return new BulkOperationResult(resultId, actionKind, BulkOperationStatus.RUNNING, null,
            0, 0, 0, List.of(), startedAt, null);
    }

    /**
     * 실패 목록이 상한 때문에 잘렸는지 여부.
     *
     * @return 목록에 없는 실패가 있으면 true
     */
    public boolean isFailureListTruncated() {
        return failures.size() < failed;
    }
}
