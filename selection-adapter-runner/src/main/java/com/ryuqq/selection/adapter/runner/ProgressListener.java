package com.ryuqq.selection.adapter.runner;

import com.ryuqq.selection.core.result.BulkOperationResult;

/**
 * 배치가 끝날 때마다 RUNNING 스냅샷을 받는 리스너.
 *
 * <p>리스너 예외는 실행을 중단시키지 않습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = snapshot -> { };

    void onProgress(BulkOperationResult snapshot);
}
