package com.ryuqq.selection.core.protection;

import com.ryuqq.selection.core.model.ResultId;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * {@link Semaphore} 기반 Bulkhead.
 *
 * <p>공정(fair) 세마포어를 사용하므로 먼저 대기한 작업이 먼저 진입합니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class SemaphoreBulkhead implements Bulkhead {

    private final BulkheadConfig config;
    private final Semaphore permits;

    public SemaphoreBulkhead(BulkheadConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.permits = new Semaphore(config.maxConcurrentCalls(), true);
    }

    @Override
    public boolean tryAcquire(ResultId resultId) {
        return permits.tryAcquire();
    }

    @Override
    public boolean tryAcquire(ResultId resultId, long timeoutMs) throws InterruptedException {
        return permits.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void release(ResultId resultId) {
        if (permits.availablePermits() >= config.maxConcurrentCalls()) {
            throw new IllegalStateException("release without matching acquire for " + resultId);
        }
        permits.release();
    }

    @Override
    public int getCurrentConcurrency() {
        return config.maxConcurrentCalls() - permits.availablePermits();
    }

    @Override
    public BulkheadConfig getConfig() {
        return config;
    }
}
