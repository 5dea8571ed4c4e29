package com.ryuqq.selection.application.bulk;

import com.ryuqq.selection.core.model.ResultId;
import com.ryuqq.selection.core.result.BulkOperationResult;

/**
 * Bulk Action 제출 핸들.
 *
 * <p>time budget 대기 결과를 표현하며, 동기/비동기 응답 전략을 결정합니다.</p>
 *
 * <p><strong>두 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li><strong>budget 내 완료 (completedInline = true):</strong>
 *       HTTP 200 OK, resultOrNull에 최종 결과</li>
 *   <li><strong>비동기 전환 (completedInline = false):</strong>
 *       HTTP 202 Accepted, statusUrlOrNull에 조회 URL ({@code /bulk-actions/{id}})</li>
 * </ul>
 *
 * <pre>
 * BulkActionHandle handle = orchestrator.submit(request, 200);
 * if (handle.isCompletedInline()) {
 *     BulkOperationResult result = handle.getResultOrNull();
 * } else {
 *     String url = handle.getStatusUrlOrNull();
 * }
 * </pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class BulkActionHandle {

    private static final String STATUS_URL_PREFIX = "/bulk-actions/";

    private final ResultId resultId;
    private final boolean completedInline;
    private final BulkOperationResult resultOrNull;
    private final String statusUrlOrNull;

    private BulkActionHandle(ResultId resultId, boolean completedInline,
                             BulkOperationResult resultOrNull, String statusUrlOrNull) {
        if (resultId == null) {
            throw new IllegalArgumentException("resultId cannot be null");
        }
        this.resultId = resultId;
        this.completedInline = completedInline;
        this.resultOrNull = resultOrNull;
        this.statusUrlOrNull = statusUrlOrNull;
    }

    /**
     * budget 내 완료 핸들.
     *
     * @param result 종료 상태의 결과
     * @return BulkActionHandle (completedInline=true)
     * @throws IllegalArgumentException result가 null이거나 아직 실행 중인 경우
     */
    public static BulkActionHandle completed(BulkOperationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null for completed handle");
        }
        if (!result.status().isTerminal()) {
            throw new IllegalArgumentException("result must be terminal for completed handle");
        }
        return new BulkActionHandle(result.resultId(), true, result, null);
    }

    /**
     * 비동기 전환 핸들.
     *
     * @param resultId 결과 ID
     * @return BulkActionHandle (completedInline=false, statusUrl=/bulk-actions/{id})
     */
    public static BulkActionHandle async(ResultId resultId) {
        if (resultId == null) {
            throw new IllegalArgumentException("resultId cannot be null");
        }
        return new BulkActionHandle(resultId, false, null, statusUrlOf(resultId));
    }

    public static String statusUrlOf(ResultId resultId) {
        return STATUS_URL_PREFIX + resultId.getValue();
    }

    public ResultId getResultId() {
        return resultId;
    }

    public boolean isCompletedInline() {
        return completedInline;
    }

    /**
     * @return 최종 결과 또는 null (비동기 전환 시)
     */
    public BulkOperationResult getResultOrNull() {
        return resultOrNull;
    }

    /**
     * @return 상태 조회 URL 또는 null (budget 내 완료 시)
     */
    public String getStatusUrlOrNull() {
        return statusUrlOrNull;
    }

    @Override
    public String toString() {
        if (completedInline) {
            return "BulkActionHandle{resultId=" + resultId + ", completed=true, status=" + resultOrNull.status() + "}";
        }
        return "BulkActionHandle{resultId=" + resultId + ", completed=false, statusUrl=" + statusUrlOrNull + "}";
    }
}
