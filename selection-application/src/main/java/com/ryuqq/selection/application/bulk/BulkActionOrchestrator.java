package com.ryuqq.selection.application.bulk;

import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.error.TokenExpiredException;
import com.ryuqq.selection.core.error.TokenNotFoundException;
import com.ryuqq.selection.core.model.ResultId;
import com.ryuqq.selection.core.result.BulkOperationResult;

import java.util.Optional;

/**
 * Bulk Action 실행 진입점.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>토큰 resolve (실패 시 즉시 예외, 실행은 시작되지 않음)</li>
 *   <li>actionKind로 {@link BulkActionRegistry}에서 Action 생성</li>
 *   <li>백그라운드 실행 시작, 진행 스냅샷은 BulkResultStore에 기록</li>
 *   <li>timeBudgetMs까지 대기 후 완료/비동기 핸들 반환</li>
 * </ol>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public interface BulkActionOrchestrator {

    /**
     * Bulk Action 제출 ({@code POST /bulk-actions}).
     *
     * @param request 실행 요청
     * @param timeBudgetMs 동기 대기 시간 (50 ~ 5000ms)
     * @return 완료 또는 비동기 핸들
     * @throws IllegalArgumentException request가 null, 알 수 없는 actionKind, budget 범위 밖
     * @throws TokenNotFoundException 알 수 없는 토큰
     * @throws TokenExpiredException 만료된 토큰
     * @throws StoreUnavailableException 토큰 저장소 장애
     */
    BulkActionHandle submit(BulkActionRequest request, long timeBudgetMs);

    /**
     * 결과 조회 ({@code GET /bulk-actions/{resultId}}).
     *
     * @param resultId 결과 ID
     * @return 현재 결과 (실행 중이면 RUNNING 스냅샷)
     */
    Optional<BulkOperationResult> find(ResultId resultId);

    /**
     * 협조적 취소 요청. 다음 배치 경계에서 중단됩니다.
     *
     * @param resultId 결과 ID
     * @return 실행 중인 작업에 취소를 요청했으면 true, 이미 종료되었거나 모르는 ID면 false
     */
    boolean cancel(ResultId resultId);
}
