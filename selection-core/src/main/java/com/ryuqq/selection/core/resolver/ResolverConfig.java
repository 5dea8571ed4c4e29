package com.ryuqq.selection.core.resolver;

/**
 * SelectionResolver 설정.
 *
 * @param batchSize 한 번에 방출하는 최대 ID 수 (1~10000, 기본 1000)
 * @author Selection Team
 * @since 1.0.0
 */
public record ResolverConfig(int batchSize) {

    public static final int MAX_BATCH_SIZE = 10_000;

    /**
     * 기본 설정 (batchSize=1000).
     */
    public ResolverConfig() {
        this(1000);
    }

    public ResolverConfig {
        if (batchSize <= 0 || batchSize > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(
                "batchSize must be between 1 and " + MAX_BATCH_SIZE + " (current: " + batchSize + ")"
            );
        }
    }

    public ResolverConfig withBatchSize(int batchSize) {
        return new ResolverConfig(batchSize);
    }
}
