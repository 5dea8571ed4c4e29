package com.ryuqq.selection.application.bulk;

import com.ryuqq.selection.core.executor.BulkAction;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * actionKind → {@link BulkActionFactory} 레지스트리.
 *
 * <p>알 수 없는 actionKind는 실행 전에 거부됩니다 (fail fast).</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class BulkActionRegistry {

    private final Map<String, BulkActionFactory> factories = new ConcurrentHashMap<>();

    /**
     * Action 종류 등록.
     *
     * @param actionKind Action 종류
     * @param factory 팩토리
     * @return this
     * @throws IllegalArgumentException 인자가 null이거나 이미 등록된 종류인 경우
     */
    public BulkActionRegistry register(String actionKind, BulkActionFactory factory) {
        if (actionKind == null || actionKind.isBlank()) {
            throw new IllegalArgumentException("actionKind cannot be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (factories.putIfAbsent(actionKind, factory) != null) {
            throw new IllegalArgumentException("actionKind already registered: " + actionKind);
        }
        return this;
    }

    /**
     * Action 생성.
     *
     * @param actionKind Action 종류
     * @param params 파라미터
     * @return Action
     * @throws IllegalArgumentException 등록되지 않은 종류이거나 팩토리가 null을 반환한 경우
     */
    public BulkAction create(String actionKind, Map<String, String> params) {
        BulkActionFactory factory = actionKind == null ? null : factories.get(actionKind);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown actionKind: " + actionKind);
        }
        BulkAction action = factory.create(params == null ? Map.of() : params);
        if (action == null) {
            throw new IllegalArgumentException("factory returned null action for " + actionKind);
        }
        return action;
    }

    public boolean supports(String actionKind) {
        return actionKind != null && factories.containsKey(actionKind);
    }

    public Set<String> getActionKinds() {
        return Set.copyOf(factories.keySet());
    }
}
