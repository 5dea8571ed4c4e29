package com.ryuqq.selection.core.protection;

import com.ryuqq.selection.core.model.ResultId;

/**
 * Bulkhead SPI.
 *
 * <p>Bulk Operation 하나가 하위 시스템에 동시에 걸 수 있는 Action 수를 제한합니다.
 * 여러 실행이 같은 워커 풀을 공유하더라도, 한 실행이 풀 전체를 점유하지 못하게 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!bulkhead.tryAcquire(resultId, 1000)) {
 *     // 대기 시간 초과
 * }
 * try {
 *     action.apply(recordId);
 * } finally {
 *     bulkhead.release(resultId);
 * }
 * }</pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * 진입 시도 (비블로킹).
     *
     * @param resultId 실행 ID (로깅용)
     * @return true: 진입 허용, false: 동시 실행 제한 초과
     */
    boolean tryAcquire(ResultId resultId);

    /**
     * 진입 시도 (타임아웃 대기).
     *
     * @param resultId 실행 ID
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return true: 진입 허용, false: 타임아웃
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean tryAcquire(ResultId resultId, long timeoutMs) throws InterruptedException;

    /**
     * 진입 해제. 반드시 finally 블록에서 호출해야 합니다.
     *
     * @param resultId 실행 ID
     */
    void release(ResultId resultId);

    /**
     * 현재 진입 중인 작업 수.
     *
     * @return 동시 실행 수
     */
    int getCurrentConcurrency();

    BulkheadConfig getConfig();
}
