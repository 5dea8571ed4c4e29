package com.ryuqq.selection.adapter.runner;

/**
 * Bulk Operation Executor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerThreads: 모든 실행이 공유하는 워커 풀 크기 (기본 8)</li>
 *   <li>concurrency: 실행 하나가 동시에 수행하는 Action 수 (기본 4, 1이면 순서대로 실행)</li>
 *   <li>maxRetries: 레코드별 Retry 허용 횟수 (기본 3)</li>
 *   <li>softTimeoutMs: 실행 전체 soft timeout (기본 600000ms = 10분)</li>
 *   <li>maxReportedFailures: 결과에 담는 실패 레코드 상한 (기본 100)</li>
 *   <li>dedupeEnabled: 실행 내 중복 ID 처리 방지 (기본 true)</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 * @param workerThreads 워커 스레드 수 (1 이상)
 * @param concurrency 실행당 동시 Action 수 (1 이상)
 * @param maxRetries Retry 허용 횟수 (0 이상)
 * @param softTimeoutMs soft timeout (밀리초, 양수)
 * @param maxReportedFailures 실패 목록 상한 (0 이상)
 * @param dedupeEnabled 중복 방지 여부
 */
public record BulkExecutorConfig(
    int workerThreads,
    int concurrency,
    int maxRetries,
    long softTimeoutMs,
    int maxReportedFailures,
    boolean dedupeEnabled
) {

    /**
     * 기본 설정 생성자.
     */
    public BulkExecutorConfig() {
        this(8, 4, 3, 600000, 100, true);
    }

    public BulkExecutorConfig {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException(
                "workerThreads must be positive (current: " + workerThreads + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries cannot be negative (current: " + maxRetries + ")"
            );
        }
        if (softTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "softTimeoutMs must be positive (current: " + softTimeoutMs + ")"
            );
        }
        if (maxReportedFailures < 0) {
            throw new IllegalArgumentException(
                "maxReportedFailures cannot be negative (current: " + maxReportedFailures + ")"
            );
        }
    }

    public BulkExecutorConfig withWorkerThreads(int workerThreads) {
        return new BulkExecutorConfig(workerThreads, concurrency, maxRetries, softTimeoutMs, maxReportedFailures, dedupeEnabled);
    }

    public BulkExecutorConfig withConcurrency(int concurrency) {
        return new BulkExecutorConfig(workerThreads, concurrency, maxRetries, softTimeoutMs, maxReportedFailures, dedupeEnabled);
    }

    public BulkExecutorConfig withMaxRetries(int maxRetries) {
        return new BulkExecutorConfig(workerThreads, concurrency, maxRetries, softTimeoutMs, maxReportedFailures, dedupeEnabled);
    }

    public BulkExecutorConfig withSoftTimeoutMs(long softTimeoutMs) {
        return new BulkExecutorConfig(workerThreads, concurrency, maxRetries, softTimeoutMs, maxReportedFailures, dedupeEnabled);
    }

    public BulkExecutorConfig withMaxReportedFailures(int maxReportedFailures) {
        return new BulkExecutorConfig(workerThreads, concurrency, maxRetries, softTimeoutMs, maxReportedFailures, dedupeEnabled);
    }

    public BulkExecutorConfig withDedupeEnabled(boolean dedupeEnabled) {
        return new BulkExecutorConfig(workerThreads, concurrency, maxRetries, softTimeoutMs, maxReportedFailures, dedupeEnabled);
    }
}
