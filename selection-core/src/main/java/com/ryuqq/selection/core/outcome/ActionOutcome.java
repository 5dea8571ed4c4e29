package com.ryuqq.selection.core.outcome;

/**
 * 레코드 하나에 대한 Bulk Action 실행 결과.
 *
 * <ul>
 *   <li>{@link Ok}: 성공</li>
 *   <li>{@link Retry}: 일시적 실패, Executor가 backoff 후 같은 레코드를 재시도</li>
 *   <li>{@link Fail}: 영구 실패, 결과의 실패 목록에 기록</li>
 * </ul>
 *
 * <p>어떤 결과도 다른 레코드 처리를 중단시키지 않습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public sealed interface ActionOutcome permits Ok, Retry, Fail {

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
