package com.ryuqq.selection.application.bulk;

import com.ryuqq.selection.core.executor.BulkAction;

import java.util.Map;

/**
 * 요청 파라미터로부터 {@link BulkAction}을 생성하는 팩토리.
 *
 * @author Selection Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BulkActionFactory {

    /**
     * @param params 요청 파라미터 (non-null, 불변)
     * @return 실행할 Action
     * @throws IllegalArgumentException 필수 파라미터가 없는 경우
     */
    BulkAction create(Map<String, String> params);
}
