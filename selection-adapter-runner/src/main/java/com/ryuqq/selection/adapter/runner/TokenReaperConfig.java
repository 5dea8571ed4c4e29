package com.ryuqq.selection.adapter.runner;

/**
 * Token Reaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분, 스케줄러가 참고)</li>
 *   <li>batchSize: purgeExpired 1회 호출당 최대 삭제 수 (기본 500)</li>
 *   <li>maxBatchesPerScan: 스캔 1회당 최대 호출 수 (기본 20)</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @param maxBatchesPerScan 스캔당 배치 수 (1 이상)
 */
public record TokenReaperConfig(
    long scanIntervalMs,
    int batchSize,
    int maxBatchesPerScan
) {

    public TokenReaperConfig() {
        this(60000, 500, 20);
    }

    public TokenReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (maxBatchesPerScan <= 0) {
            throw new IllegalArgumentException(
                "maxBatchesPerScan must be positive (current: " + maxBatchesPerScan + ")"
            );
        }
    }

    public TokenReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new TokenReaperConfig(scanIntervalMs, batchSize, maxBatchesPerScan);
    }

    public TokenReaperConfig withBatchSize(int batchSize) {
        return new TokenReaperConfig(scanIntervalMs, batchSize, maxBatchesPerScan);
    }

    public TokenReaperConfig withMaxBatchesPerScan(int maxBatchesPerScan) {
        return new TokenReaperConfig(scanIntervalMs, batchSize, maxBatchesPerScan);
    }
}
