package com.ryuqq.selection.core.spi;

import com.ryuqq.selection.core.model.ResultId;
import com.ryuqq.selection.core.result.BulkOperationResult;

import java.util.Optional;

/**
 * Bulk Operation 결과 저장소 SPI.
 *
 * <p>비동기 실행의 진행 상황과 최종 결과를 폴링할 수 있도록 보관합니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public interface BulkResultStore {

    /**
     * 결과 저장 (같은 resultId면 덮어씀).
     *
     * <p>이미 종료 상태인 결과는 덮어쓰지 않아야 합니다.</p>
     *
     * @param result 결과 스냅샷
     * @throws IllegalArgumentException result가 null인 경우
     * @throws IllegalStateException 저장된 결과가 이미 종료 상태인 경우
     */
    void save(BulkOperationResult result);

    /**
     * 결과 조회.
     *
     * @param resultId 결과 ID
     * @return 결과 (없으면 empty)
     * @throws IllegalArgumentException resultId가 null인 경우
     */
    Optional<BulkOperationResult> find(ResultId resultId);
}
