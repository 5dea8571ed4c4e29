package com.ryuqq.selection.core.executor;

import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.outcome.ActionOutcome;

/**
 * 레코드 하나에 적용되는 호출자 제공 Action ("reply", "export" 등).
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: Executor가 여러 워커 스레드에서 동시에 호출합니다.</li>
 *   <li>레코드 단위 멱등성 권장: 토큰이 다시 resolve되어 같은 ID가 다시 들어올 수 있습니다.</li>
 *   <li>순서에 민감한 Action은 동시성 1로 실행해야 합니다.</li>
 * </ul>
 *
 * <p>예외를 던지면 Executor가 {@code Fail(ACTION_EXCEPTION)}으로 기록합니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BulkAction {

    /**
     * 레코드에 Action 적용.
     *
     * @param id 레코드 ID
     * @return Ok, Retry 또는 Fail (null 불가)
     */
    ActionOutcome apply(RecordId id);
}
