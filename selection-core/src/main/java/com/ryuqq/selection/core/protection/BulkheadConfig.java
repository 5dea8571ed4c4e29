package com.ryuqq.selection.core.protection;

/**
 * Bulkhead 설정.
 *
 * @param maxConcurrentCalls 최대 동시 실행 수 (1이면 순차 실행)
 * @param maxWaitDurationMs 진입 대기 시간 (밀리초)
 * @author Selection Team
 * @since 1.0.0
 */
public record BulkheadConfig(int maxConcurrentCalls, long maxWaitDurationMs) {

    public BulkheadConfig {
        if (maxConcurrentCalls <= 0) {
            throw new IllegalArgumentException("maxConcurrentCalls must be positive");
        }
        if (maxWaitDurationMs < 0) {
            throw new IllegalArgumentException("maxWaitDurationMs cannot be negative");
        }
    }
}
